package com.eventhub.registration.modules.submission;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.EventStatus;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.model.entity.RegistrationStatus;
import com.eventhub.registration.modules.submission.dto.ExistingRegistrationRequest;
import com.eventhub.registration.modules.submission.dto.RegistrationView;
import com.eventhub.registration.modules.submission.dto.SubmissionResponse;
import com.eventhub.registration.modules.submission.dto.SubmitRegistrationRequest;
import com.eventhub.registration.service.EventService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RegistrationControllerTest {

    private static final String MARIA = "maria.lopez@example.com";
    private static final String GRANT = "grant-token-1";

    @Mock
    private EventService eventService;

    @Mock
    private RegistrationSubmissionService submissionService;

    private ObjectMapper objectMapper;
    private RegistrationController controller;
    private Event event;
    private MockHttpServletRequest httpRequest;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        controller = new RegistrationController(eventService, submissionService, new FormDataMapper(objectMapper));
        event = Event.builder()
                .id(UUID.randomUUID())
                .slug("summit")
                .status(EventStatus.PUBLISHED)
                .registrationMode(RegistrationMode.QUALIFIED_VERIFIED)
                .build();
        httpRequest = new MockHttpServletRequest();
        httpRequest.setRemoteAddr("203.0.113.7");
        when(eventService.requireEvent("summit")).thenReturn(event);
    }

    private Registration row(String email, int index, UUID orderId) {
        return Registration.builder()
                .id(UUID.randomUUID())
                .eventId(event.getId())
                .email(email)
                .firstName("Maria")
                .lastName("Lopez")
                .status(RegistrationStatus.REGISTERED)
                .formData("{\"chapter\":\"Lima\"}")
                .orderId(orderId)
                .attendeeIndex(orderId != null ? index : null)
                .build();
    }

    @Test
    @DisplayName("new registration answers 201 with the created count and no order id")
    void createdIs201() throws Exception {
        Registration created = row(MARIA, 0, null);
        when(submissionService.submit(eq(event), any(SubmitRegistrationRequest.class), eq("203.0.113.7")))
                .thenReturn(new SubmissionResult(List.of(created), false, null));

        ResponseEntity<SubmissionResponse> response = controller.submit("summit", new SubmitRegistrationRequest(),
                httpRequest);

        assertEquals(201, response.getStatusCode().value());
        JsonNode body = objectMapper.readTree(objectMapper.writeValueAsString(response.getBody()));
        assertFalse(body.get("wasUpdated").asBoolean());
        assertEquals(1, body.get("createdCount").asInt());
        assertFalse(body.has("orderId"));
        assertEquals(1, body.get("registrations").size());
        JsonNode first = body.get("registrations").get(0);
        assertEquals(created.getId().toString(), first.get("id").asText());
        assertEquals(MARIA, first.get("email").asText());
        assertEquals("Lima", first.get("customFields").get("chapter").asText());
    }

    @Test
    @DisplayName("update of an existing registration answers 200 with nothing created")
    void updatedIs200() {
        when(submissionService.submit(eq(event), any(SubmitRegistrationRequest.class), anyString()))
                .thenReturn(new SubmissionResult(List.of(row(MARIA, 0, null)), true, null));

        ResponseEntity<SubmissionResponse> response = controller.submit("summit", new SubmitRegistrationRequest(),
                httpRequest);

        assertEquals(200, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().isWasUpdated());
        assertEquals(0, response.getBody().getCreatedCount());
    }

    @Test
    @DisplayName("anonymous order returns every attendee under one order id")
    void orderCarriesOrderId() throws Exception {
        UUID orderId = UUID.randomUUID();
        List<Registration> rows = List.of(row("ana@example.com", 0, orderId), row("luis@example.com", 1, orderId),
                row("ana@example.com", 2, orderId));
        when(submissionService.submit(eq(event), any(SubmitRegistrationRequest.class), anyString()))
                .thenReturn(new SubmissionResult(rows, false, orderId));

        ResponseEntity<SubmissionResponse> response = controller.submit("summit", new SubmitRegistrationRequest(),
                httpRequest);

        assertEquals(201, response.getStatusCode().value());
        JsonNode body = objectMapper.readTree(objectMapper.writeValueAsString(response.getBody()));
        assertEquals(orderId.toString(), body.get("orderId").asText());
        assertEquals(3, body.get("createdCount").asInt());
        assertEquals(2, body.get("registrations").get(2).get("attendeeIndex").asInt());
    }

    @Test
    @DisplayName("existing registration is returned with 200")
    void existingFound() {
        Registration stored = row(MARIA, 0, null);
        when(submissionService.fetchExisting(event, MARIA, GRANT)).thenReturn(Optional.of(stored));

        ResponseEntity<RegistrationView> response = controller.existing("summit",
                new ExistingRegistrationRequest(MARIA, GRANT));

        assertEquals(200, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals(stored.getId(), response.getBody().getId());
    }

    @Test
    @DisplayName("no existing registration answers 204 without a body")
    void existingMissingIs204() {
        when(submissionService.fetchExisting(event, MARIA, GRANT)).thenReturn(Optional.empty());

        ResponseEntity<RegistrationView> response = controller.existing("summit",
                new ExistingRegistrationRequest(MARIA, GRANT));

        assertEquals(204, response.getStatusCode().value());
        assertNull(response.getBody());
    }
}
