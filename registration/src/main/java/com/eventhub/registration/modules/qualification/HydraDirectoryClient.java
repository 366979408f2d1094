package com.eventhub.registration.modules.qualification;

import com.eventhub.registration.config.RegistrationProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks customers up in the Hydra identity directory.
 * <ul>
 * <li>Only consulted when {@code registration.directory.enabled=true}</li>
 * <li>A miss, a 404 or an open circuit all mean "not found": the local qualified
 * list then decides on its own</li>
 * <li>Only affects profile enrichment and the verifiedByHydra flag</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HydraDirectoryClient {

    private final RestTemplate restTemplate;
    private final RegistrationProperties properties;

    @SuppressWarnings({ "unchecked", "rawtypes" })
    @CircuitBreaker(name = "identityDirectory", fallbackMethod = "lookupFallback")
    public Optional<DirectoryProfile> lookupByEmail(String email) {
        RegistrationProperties.Directory directory = properties.getDirectory();
        if (!directory.isEnabled() || email == null) {
            return Optional.empty();
        }

        String url = UriComponentsBuilder.fromHttpUrl(directory.getBaseUrl())
                .path("/customers")
                .queryParam("email", email)
                .build()
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (directory.getApiKey() != null && !directory.getApiKey().isBlank()) {
            headers.setBearerAuth(directory.getApiKey());
        }

        ResponseEntity<Map> resp;
        try {
            resp = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), Map.class);
        } catch (HttpClientErrorException.NotFound notFound) {
            log.debug("Directory has no customer for {}", EmailMasker.mask(email));
            return Optional.empty();
        }

        Optional<DirectoryProfile> profile = parseCustomer(resp.getBody());
        log.debug("Directory lookup for {}: {}", EmailMasker.mask(email), profile.isPresent() ? "found" : "miss");
        return profile;
    }

    @SuppressWarnings("unused")
    private Optional<DirectoryProfile> lookupFallback(String email, Throwable t) {
        log.warn("Directory unavailable, falling back to local qualified list: {}", t.getMessage());
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    static Optional<DirectoryProfile> parseCustomer(Map<String, Object> body) {
        if (body == null || !(body.get("items") instanceof List<?> items) || items.isEmpty()) {
            return Optional.empty();
        }
        if (!(items.get(0) instanceof Map<?, ?> first)) {
            return Optional.empty();
        }
        Map<String, Object> customer = (Map<String, Object>) first;

        String unicityId = null;
        if (customer.get("id") instanceof Map<?, ?> id && id.get("unicity") != null) {
            unicityId = String.valueOf(id.get("unicity"));
        }

        String firstName = null;
        String lastName = null;
        if (customer.get("humanName") instanceof Map<?, ?> name) {
            firstName = (String) name.get("firstName");
            lastName = (String) name.get("lastName");
        }

        String phone = (String) customer.get("mobilePhone");
        if (phone == null) {
            phone = (String) customer.get("homePhone");
        }

        return Optional.of(new DirectoryProfile(unicityId, firstName, lastName, phone));
    }
}
