package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.EventStatus;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.modules.qualification.QualificationResolver;
import com.eventhub.registration.modules.qualification.QualificationResult;
import com.eventhub.registration.modules.qualification.QualificationSource;
import com.eventhub.registration.modules.qualification.exception.NotQualifiedException;
import com.eventhub.registration.modules.verification.dto.SignedIdentity;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.InvalidSignedLinkException;
import com.eventhub.registration.modules.verification.store.InMemoryVerificationStore;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignedLinkServiceTest {

    @Mock
    private EventService eventService;

    @Mock
    private QualificationResolver qualificationResolver;

    @Mock
    private AuditService auditService;

    private RegistrationProperties properties;
    private VerificationGrantService grantService;
    private SignedLinkService service;
    private Event event;

    @BeforeEach
    void setUp() {
        properties = new RegistrationProperties();
        properties.getSignedLink().setSecret("unit-test-secret");
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        grantService = new VerificationGrantService(new InMemoryVerificationStore(), properties);
        service = new SignedLinkService(properties, eventService, qualificationResolver, grantService,
                auditService, objectMapper);
        event = Event.builder()
                .id(UUID.randomUUID())
                .name("E1")
                .status(EventStatus.PUBLISHED)
                .registrationMode(RegistrationMode.QUALIFIED_VERIFIED)
                .build();
    }

    @Test
    @DisplayName("issued link verifies back to the signed identity")
    void issueThenVerify() {
        String token = service.issue(event, "Maria.Lopez@example.com", "UX100920", Duration.ofHours(1));

        SignedIdentity identity = service.verify(token);

        assertEquals(event.getId(), identity.eventId());
        assertEquals("maria.lopez@example.com", identity.email());
        assertEquals("UX100920", identity.distributorId());
    }

    @Test
    @DisplayName("tampered payload or signature is rejected")
    void tamperedLinkRejected() {
        String token = service.issue(event, "maria.lopez@example.com", null, Duration.ofHours(1));
        String other = service.issue(event, "someone.else@example.com", null, Duration.ofHours(1));
        String forged = other.substring(0, other.indexOf('.')) + token.substring(token.indexOf('.'));

        assertThrows(InvalidSignedLinkException.class, () -> service.verify(forged));
        assertThrows(InvalidSignedLinkException.class, () -> service.verify(token + "x"));
        assertThrows(InvalidSignedLinkException.class, () -> service.verify("no-dot"));
    }

    @Test
    @DisplayName("link signed with another secret is rejected")
    void otherSecretRejected() {
        String token = service.issue(event, "maria.lopez@example.com", null, Duration.ofHours(1));
        properties.getSignedLink().setSecret("rotated-secret");

        assertThrows(InvalidSignedLinkException.class, () -> service.verify(token));
    }

    @Test
    @DisplayName("accept still runs qualification before recording a grant")
    void acceptRunsQualification() {
        String token = service.issue(event, "maria.lopez@example.com", "UX100920", Duration.ofHours(1));
        when(qualificationResolver.resolve(event, "maria.lopez@example.com", "UX100920"))
                .thenReturn(new QualificationResult(event.getId(), "maria.lopez@example.com", "UX100920", "Maria",
                        "Lopez", null, false, true, QualificationSource.QUALIFIED_LIST, "listed"));

        VerifiedProfile profile = service.accept(event, token, "10.0.0.1");

        verify(eventService).assertOpen(event);
        assertTrue(profile.isVerifiedByHydra());
        assertTrue(grantService.find(event.getId(), "maria.lopez@example.com").isPresent());
    }

    @Test
    @DisplayName("accept of an unqualified identity records no grant")
    void acceptNotQualified() {
        String token = service.issue(event, "stranger@example.com", null, Duration.ofHours(1));
        when(qualificationResolver.resolve(event, "stranger@example.com", null))
                .thenThrow(new NotQualifiedException("not listed"));

        assertThrows(NotQualifiedException.class, () -> service.accept(event, token, "10.0.0.1"));
        assertTrue(grantService.find(event.getId(), "stranger@example.com").isEmpty());
    }

    @Test
    @DisplayName("link for another event is rejected")
    void otherEventRejected() {
        Event other = Event.builder().id(UUID.randomUUID()).status(EventStatus.PUBLISHED)
                .registrationMode(RegistrationMode.OPEN_VERIFIED).build();
        String token = service.issue(other, "maria.lopez@example.com", null, Duration.ofHours(1));

        assertThrows(InvalidSignedLinkException.class, () -> service.accept(event, token, "10.0.0.1"));
        verifyNoInteractions(qualificationResolver);
    }
}
