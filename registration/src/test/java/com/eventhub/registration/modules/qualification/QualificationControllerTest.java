package com.eventhub.registration.modules.qualification;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.EventStatus;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.modules.qualification.dto.QualificationRequest;
import com.eventhub.registration.modules.qualification.dto.QualifiedProfile;
import com.eventhub.registration.service.EventService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QualificationControllerTest {

    private static final String MARIA = "maria.lopez@example.com";

    @Mock
    private EventService eventService;

    @Mock
    private QualificationResolver qualificationResolver;

    @InjectMocks
    private QualificationController controller;

    private Event event;

    @BeforeEach
    void setUp() {
        event = Event.builder()
                .id(UUID.randomUUID())
                .slug("summit")
                .status(EventStatus.PUBLISHED)
                .registrationMode(RegistrationMode.QUALIFIED_VERIFIED)
                .build();
        when(eventService.requireOpen("summit")).thenReturn(event);
    }

    @Test
    @DisplayName("distributor id claim gets a masked address and no phone")
    void distributorIdClaimIsMasked() throws Exception {
        when(qualificationResolver.resolve(event, null, "UX100920")).thenReturn(new QualificationResult(
                event.getId(), MARIA, "UX100920", "Maria", "Lopez", "+51 1 555 0101", true, false,
                QualificationSource.QUALIFIED_LIST, "listed"));

        ResponseEntity<QualifiedProfile> response = controller.resolve("summit",
                new QualificationRequest(null, "UX100920"));

        assertEquals(200, response.getStatusCode().value());
        QualifiedProfile profile = response.getBody();
        assertNotNull(profile);
        assertTrue(profile.isQualified());
        assertTrue(profile.isEmailMasked());
        assertEquals("m*********z@e*****e.com", profile.getEmail());
        assertNull(profile.getPhone());
        assertEquals("UX100920", profile.getUnicityId());

        String json = new ObjectMapper().writeValueAsString(profile);
        assertFalse(json.contains(MARIA));
        assertFalse(json.contains("555 0101"));
    }

    @Test
    @DisplayName("email claim gets the address back unmasked with its phone")
    void emailClaimIsPlain() {
        when(qualificationResolver.resolve(event, MARIA, null)).thenReturn(new QualificationResult(
                event.getId(), MARIA, "UX100920", "Maria", "Lopez", "+51 1 555 0101", false, true,
                QualificationSource.EXISTING_REGISTRATION, "registered"));

        ResponseEntity<QualifiedProfile> response = controller.resolve("summit", new QualificationRequest(MARIA, null));

        QualifiedProfile profile = response.getBody();
        assertNotNull(profile);
        assertFalse(profile.isEmailMasked());
        assertEquals(MARIA, profile.getEmail());
        assertEquals("+51 1 555 0101", profile.getPhone());
        assertEquals(QualificationSource.EXISTING_REGISTRATION, profile.getSource());
    }
}
