package com.eventhub.registration.exception;

import com.eventhub.registration.modules.lifecycle.exception.TransferConflictException;
import com.eventhub.registration.modules.verification.exception.CodeAttemptsExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("protocol failure carries code, retryability and correlation id")
    void registrationException() {
        MDC.put("correlationId", "abc-123");

        ResponseEntity<Map<String, Object>> response = handler.handleRegistrationException(
                new CodeAttemptsExhaustedException());

        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals(response.getStatusCode().value(), body.get("status"));
        assertEquals("CODE_EXHAUSTED", body.get("error"));
        assertEquals("abc-123", body.get("correlationId"));
        assertNotNull(body.get("retryable"));
        assertFalse(body.containsKey("missingFields"));
    }

    @Test
    @DisplayName("validation failure lists the missing fields")
    void validationException() {
        ResponseEntity<Map<String, Object>> response = handler.handleRegistrationException(
                new ValidationException("Missing required fields: lastName", List.of("lastName")));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(List.of("lastName"), response.getBody().get("missingFields"));
        assertEquals(false, response.getBody().get("retryable"));
    }

    @Test
    @DisplayName("conflict maps to 409")
    void conflict() {
        ResponseEntity<Map<String, Object>> response = handler.handleRegistrationException(
                new TransferConflictException("Registration already belongs to the target event"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("TRANSFER_CONFLICT", response.getBody().get("error"));
    }

    @Test
    @DisplayName("bean validation errors become field errors")
    void beanValidation() throws NoSuchMethodException {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(new Object(), "request");
        binding.addError(new FieldError("request", "form", "form is required"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("beanValidation"), -1);

        ResponseEntity<Map<String, Object>> response = handler.handleValidationException(
                new MethodArgumentNotValidException(parameter, binding));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(List.of("form"), response.getBody().get("missingFields"));
    }

    @Test
    @DisplayName("unexpected failure hides its message")
    void genericException() {
        MDC.put("correlationId", "xyz");

        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
                new IllegalStateException("jdbc://secret-host"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().get("message").toString().contains("secret-host"));
        assertEquals("xyz", response.getBody().get("correlationId"));
    }
}
