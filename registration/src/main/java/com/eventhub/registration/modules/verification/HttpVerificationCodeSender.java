package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.verification.exception.CodeDeliveryException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Posts codes to the transactional mail endpoint.
 * <ul>
 * <li>Bearer API key, JSON body with recipient, template and merge data</li>
 * <li>Circuit breaker: opens after repeated failures; while open every send
 * fails fast with {@link CodeDeliveryException}</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "registration.delivery.mode", havingValue = "http")
public class HttpVerificationCodeSender implements VerificationCodeSender {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;
    private final RegistrationProperties properties;

    public HttpVerificationCodeSender(WebClient.Builder webClientBuilder, RegistrationProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "codeDelivery", fallbackMethod = "sendFallback")
    public void send(String email, String code, Event event, Duration validFor) {
        RegistrationProperties.Delivery delivery = properties.getDelivery();

        Map<String, Object> data = new HashMap<>();
        data.put("code", code);
        data.put("eventName", event.getName());
        data.put("expiresInMinutes", validFor.toMinutes());
        data.put("language", event.getDefaultLanguage());

        Map<String, Object> body = new HashMap<>();
        body.put("to", email);
        body.put("templateId", delivery.getTemplateId());
        body.put("data", data);

        webClient.post()
                .uri(delivery.getEndpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBearerAuth(delivery.getApiKey()))
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .block(TIMEOUT);

        log.info("Verification code sent to {} for event {}", EmailMasker.mask(email), event.getId());
    }

    @SuppressWarnings("unused")
    private void sendFallback(String email, String code, Event event, Duration validFor, Throwable t) {
        log.error("Code delivery failed for {}: {}", EmailMasker.mask(email), t.getMessage());
        throw new CodeDeliveryException("Could not send the verification code. Please try again.", t);
    }
}
