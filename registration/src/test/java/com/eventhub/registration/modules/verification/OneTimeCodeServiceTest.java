package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.exception.RegistrationClosedException;
import com.eventhub.registration.exception.ValidationException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.EventStatus;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.modules.qualification.QualificationResolver;
import com.eventhub.registration.modules.qualification.QualificationResult;
import com.eventhub.registration.modules.qualification.QualificationSource;
import com.eventhub.registration.modules.qualification.exception.NotQualifiedException;
import com.eventhub.registration.modules.redirect.RedirectTokenService;
import com.eventhub.registration.modules.redirect.dto.IssuedRedirectToken;
import com.eventhub.registration.modules.verification.dto.IssueCodeResponse;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.CodeAttemptsExhaustedException;
import com.eventhub.registration.modules.verification.exception.CodeDeliveryException;
import com.eventhub.registration.modules.verification.exception.CodeExpiredException;
import com.eventhub.registration.modules.verification.exception.InvalidCodeException;
import com.eventhub.registration.modules.verification.store.InMemoryVerificationStore;
import com.eventhub.registration.modules.verification.store.VerificationSession;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OneTimeCodeServiceTest {

    private static final String MARIA = "maria.lopez@example.com";

    @Mock
    private EventService eventService;

    @Mock
    private QualificationResolver qualificationResolver;

    @Mock
    private VerificationCodeSender codeSender;

    @Mock
    private RedirectTokenService redirectTokenService;

    @Mock
    private AuditService auditService;

    private InMemoryVerificationStore store;
    private VerificationGrantService grantService;
    private RegistrationProperties properties;
    private OneTimeCodeService service;
    private Event event;

    @BeforeEach
    void setUp() {
        properties = new RegistrationProperties();
        store = new InMemoryVerificationStore();
        grantService = new VerificationGrantService(store, properties);
        service = new OneTimeCodeService(eventService, qualificationResolver, store, codeSender, grantService,
                redirectTokenService, properties, auditService);
        event = Event.builder()
                .id(UUID.randomUUID())
                .name("E1")
                .status(EventStatus.PUBLISHED)
                .registrationMode(RegistrationMode.QUALIFIED_VERIFIED)
                .build();
    }

    private void qualifiesMariaByDistributorId() {
        when(qualificationResolver.resolve(event, null, "UX100920")).thenReturn(new QualificationResult(
                event.getId(), MARIA, "UX100920", "Maria", "Lopez", null, true, false,
                QualificationSource.QUALIFIED_LIST, "listed"));
    }

    private String sentCode() {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(codeSender, atLeastOnce()).send(eq(MARIA), code.capture(), eq(event), any(Duration.class));
        return code.getValue();
    }

    @Test
    @DisplayName("distributor id claim sends the code to the real address and returns only a masked one")
    void issueForMaskedIdentity() {
        qualifiesMariaByDistributorId();

        IssueCodeResponse response = service.issueCode(event, null, "UX100920", "10.0.0.1");

        assertNotNull(response.getSessionToken());
        assertTrue(response.isEmailMasked());
        assertNotEquals(MARIA, response.getMaskedEmail());
        assertEquals(600, response.getExpiresInSeconds());
        assertTrue(sentCode().matches("\\d{6}"));
    }

    @Test
    @DisplayName("correct code returns the verified profile, a redirect token and a grant")
    void validateCorrectCode() {
        qualifiesMariaByDistributorId();
        when(redirectTokenService.issue(eq(event.getId()), eq(MARIA), anyString(), isNull()))
                .thenReturn(new IssuedRedirectToken("redirect-token", Instant.now().plusSeconds(600)));

        IssueCodeResponse issued = service.issueCode(event, null, "UX100920", "10.0.0.1");
        VerifiedProfile profile = service.validateCode(event, null, issued.getSessionToken(), sentCode(), "10.0.0.1");

        assertEquals("UX100920", profile.getUnicityId());
        assertEquals(MARIA, profile.getEmail());
        assertEquals("redirect-token", profile.getRedirectToken());
        assertNotNull(profile.getGrantToken());
        assertEquals(profile.getGrantToken(), grantService.find(event.getId(), MARIA).orElseThrow().getGrantToken());
        verify(redirectTokenService).issue(event.getId(), MARIA, profile.getGrantToken(), null);
    }

    @Test
    @DisplayName("a code that validated once fails the second time")
    void codeIsSingleUse() {
        qualifiesMariaByDistributorId();
        when(redirectTokenService.issue(any(), anyString(), anyString(), isNull()))
                .thenReturn(new IssuedRedirectToken("redirect-token", Instant.now().plusSeconds(600)));

        IssueCodeResponse issued = service.issueCode(event, null, "UX100920", "10.0.0.1");
        String code = sentCode();
        service.validateCode(event, null, issued.getSessionToken(), code, "10.0.0.1");

        InvalidCodeException ex = assertThrows(InvalidCodeException.class,
                () -> service.validateCode(event, MARIA, null, code, "10.0.0.1"));
        assertEquals(-1, ex.getAttemptsRemaining());
    }

    @Test
    @DisplayName("wrong code reports the attempts left, the fifth exhausts the session")
    void wrongCodesExhaust() {
        qualifiesMariaByDistributorId();
        IssueCodeResponse issued = service.issueCode(event, null, "UX100920", "10.0.0.1");
        String wrong = sentCode().equals("000000") ? "111111" : "000000";

        for (int remaining = 4; remaining >= 1; remaining--) {
            InvalidCodeException ex = assertThrows(InvalidCodeException.class,
                    () -> service.validateCode(event, null, issued.getSessionToken(), wrong, "10.0.0.1"));
            assertEquals(remaining, ex.getAttemptsRemaining());
            assertFalse(ex.isTerminal());
        }
        assertThrows(CodeAttemptsExhaustedException.class,
                () -> service.validateCode(event, null, issued.getSessionToken(), wrong, "10.0.0.1"));
        assertThrows(InvalidCodeException.class,
                () -> service.validateCode(event, MARIA, null, wrong, "10.0.0.1"));
    }

    @Test
    @DisplayName("resend invalidates the previous code")
    void resendInvalidatesPrevious() {
        qualifiesMariaByDistributorId();
        IssueCodeResponse first = service.issueCode(event, null, "UX100920", "10.0.0.1");
        String firstCode = sentCode();
        service.issueCode(event, null, "UX100920", "10.0.0.1");

        InvalidCodeException ex = assertThrows(InvalidCodeException.class,
                () -> service.validateCode(event, null, first.getSessionToken(), firstCode, "10.0.0.1"));
        assertEquals(-1, ex.getAttemptsRemaining());
    }

    @Test
    @DisplayName("expired code fails with CodeExpired")
    void expiredCode() {
        qualifiesMariaByDistributorId();
        IssueCodeResponse issued = service.issueCode(event, null, "UX100920", "10.0.0.1");
        String code = sentCode();
        String sessionKey = VerificationSession.keyOf(event.getId(), MARIA);
        store.saveSession(store.findSession(sessionKey).orElseThrow().toBuilder()
                .expiresAt(Instant.now().minusSeconds(1))
                .build());

        assertThrows(CodeExpiredException.class,
                () -> service.validateCode(event, null, issued.getSessionToken(), code, "10.0.0.1"));
    }

    @Test
    @DisplayName("unqualified identity never receives a code")
    void notQualifiedBeforeAnyCode() {
        when(qualificationResolver.resolve(event, "stranger@example.com", null))
                .thenThrow(new NotQualifiedException("not listed"));

        assertThrows(NotQualifiedException.class,
                () -> service.issueCode(event, "stranger@example.com", null, "10.0.0.1"));

        verifyNoInteractions(codeSender);
        assertTrue(store.findSession(VerificationSession.keyOf(event.getId(), "stranger@example.com")).isEmpty());
    }

    @Test
    @DisplayName("closed event fails before qualification")
    void closedEventShortCircuits() {
        doThrow(new RegistrationClosedException("closed")).when(eventService).assertOpen(event);

        assertThrows(RegistrationClosedException.class,
                () -> service.issueCode(event, MARIA, null, "10.0.0.1"));

        verifyNoInteractions(qualificationResolver, codeSender);
    }

    @Test
    @DisplayName("delivery failure discards the session")
    void deliveryFailureDiscardsSession() {
        qualifiesMariaByDistributorId();
        doThrow(new CodeDeliveryException("down", null)).when(codeSender)
                .send(anyString(), anyString(), any(), any());

        assertThrows(CodeDeliveryException.class, () -> service.issueCode(event, null, "UX100920", "10.0.0.1"));

        assertTrue(store.findSession(VerificationSession.keyOf(event.getId(), MARIA)).isEmpty());
    }

    @Test
    @DisplayName("anonymous events do not issue codes")
    void anonymousModeRejected() {
        event.setRegistrationMode(RegistrationMode.OPEN_ANONYMOUS);

        assertThrows(ValidationException.class, () -> service.issueCode(event, MARIA, null, "10.0.0.1"));
        verifyNoInteractions(codeSender);
    }
}
