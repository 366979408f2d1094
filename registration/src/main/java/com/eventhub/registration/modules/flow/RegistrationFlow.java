package com.eventhub.registration.modules.flow;

import com.eventhub.registration.exception.RegistrationClosedException;
import com.eventhub.registration.exception.RegistrationException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.qualification.exception.NotQualifiedException;
import com.eventhub.registration.modules.redirect.RedirectTokenService;
import com.eventhub.registration.modules.submission.RegistrationSubmissionService;
import com.eventhub.registration.modules.submission.SubmissionResult;
import com.eventhub.registration.modules.submission.dto.SubmitRegistrationRequest;
import com.eventhub.registration.modules.verification.OneTimeCodeService;
import com.eventhub.registration.modules.verification.SignedLinkService;
import com.eventhub.registration.modules.verification.dto.IssueCodeResponse;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.VerificationRequiredException;
import com.eventhub.registration.service.EventService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-registrant controller that sequences qualification, code verification
 * and submission for one event.
 * <p>
 * Transitions by mode:
 * </p>
 * <ul>
 * <li>{@code qualified_verified}: EMAIL, OTP, FORM, SUCCESS. The qualification
 * check runs inside code issuance, so NOT_QUALIFIED is reached before any code
 * exists.</li>
 * <li>{@code open_verified}: starts in FORM. A submit without verification
 * parks the form, sends a code to the form's address and moves to OTP; the
 * correct code resubmits the parked form.</li>
 * <li>{@code open_anonymous}: FORM, SUCCESS. No code is ever sent.</li>
 * </ul>
 * <p>
 * The event is re-read on every operation; once it is closed the flow moves to
 * REGISTRATION_CLOSED from whatever state it was in. Recoverable failures are
 * kept in {@link #getLastError()} and leave the state (and any parked form)
 * unchanged. Calling an operation the current state does not accept throws
 * {@link IllegalStateException}.
 * </p>
 * Not thread-safe: one instance per registrant session.
 */
@Slf4j
public class RegistrationFlow {

    private final UUID eventId;
    private final String clientIp;
    private final EventService eventService;
    private final OneTimeCodeService oneTimeCodeService;
    private final RedirectTokenService redirectTokenService;
    private final SignedLinkService signedLinkService;
    private final RegistrationSubmissionService submissionService;

    @Getter
    private final RegistrationMode mode;
    @Getter
    private FlowState state;
    @Getter
    private RegistrationException lastError;

    /** Address shown to the registrant; masked until ownership is proven. */
    @Getter
    private String displayEmail;
    @Getter
    private boolean emailMasked;
    @Getter
    private VerifiedProfile profile;
    @Getter
    private SubmissionResult result;

    private String emailClaim;
    private String distributorIdClaim;
    private String sessionToken;
    private SubmitRegistrationRequest pendingSubmission;

    RegistrationFlow(Event event, String clientIp, EventService eventService,
            OneTimeCodeService oneTimeCodeService, RedirectTokenService redirectTokenService,
            SignedLinkService signedLinkService, RegistrationSubmissionService submissionService) {
        this.eventId = event.getId();
        this.mode = event.getRegistrationMode();
        this.clientIp = clientIp;
        this.eventService = eventService;
        this.oneTimeCodeService = oneTimeCodeService;
        this.redirectTokenService = redirectTokenService;
        this.signedLinkService = signedLinkService;
        this.submissionService = submissionService;
        this.state = initialState();
    }

    public UUID getEventId() {
        return eventId;
    }

    public boolean hasPendingSubmission() {
        return pendingSubmission != null;
    }

    // =========================================================================
    // Entry
    // =========================================================================

    /**
     * Observes the event once: a closed event ends the flow immediately.
     */
    public FlowState start() {
        requireState("start", EnumSet.of(FlowState.EMAIL, FlowState.FORM));
        openEventOrClose();
        return state;
    }

    /**
     * Silent resume with a redirect token handed over by another page. On
     * failure the flow stays where it is and the error is kept.
     */
    public FlowState resume(String redirectToken, String email) {
        requireState("resume", verifiableEntryStates());
        return attempt(() -> {
            openEvent();
            VerifiedProfile resumed = redirectTokenService.consume(redirectToken, email, eventId);
            verified(resumed);
            return state;
        });
    }

    /**
     * Pre-supplied identity from a signed link. Skips the code, never the
     * qualification or closed checks.
     */
    public FlowState applySignedLink(String token) {
        requireState("applySignedLink", verifiableEntryStates());
        return attempt(() -> {
            Event event = openEvent();
            verified(signedLinkService.accept(event, token, clientIp));
            return state;
        });
    }

    // =========================================================================
    // Verification
    // =========================================================================

    public FlowState submitIdentity(String email, String distributorId) {
        requireState("submitIdentity", EnumSet.of(FlowState.EMAIL));
        return attempt(() -> {
            Event event = openEvent();
            emailClaim = EmailMasker.normalize(email);
            distributorIdClaim = blankToNull(distributorId);
            sendCode(event);
            return state;
        });
    }

    /**
     * Issues a new code for the current claim; the previous one stops working.
     */
    public FlowState resend() {
        requireState("resend", EnumSet.of(FlowState.OTP));
        return attempt(() -> {
            sendCode(openEvent());
            return state;
        });
    }

    public FlowState submitCode(String code) {
        requireState("submitCode", EnumSet.of(FlowState.OTP));
        return attempt(() -> {
            Event event = openEvent();
            VerifiedProfile validated = oneTimeCodeService.validateCode(event,
                    sessionToken == null ? emailClaim : null, sessionToken, code, clientIp);
            sessionToken = null;
            verified(validated);

            if (pendingSubmission != null) {
                log.debug("Resubmitting parked form on event {}", eventId);
                doSubmit(event, pendingSubmission);
            }
            return state;
        });
    }

    // =========================================================================
    // Submission
    // =========================================================================

    public FlowState submit(SubmitRegistrationRequest request) {
        requireState("submit", EnumSet.of(FlowState.FORM));
        return attempt(() -> {
            Event event = openEvent();
            try {
                doSubmit(event, request);
            } catch (VerificationRequiredException e) {
                // open_verified: park the form and verify its address
                pendingSubmission = request;
                emailClaim = EmailMasker.normalize(request.getForm().getEmail());
                distributorIdClaim = null;
                lastError = e;
                sendCode(event);
            }
            return state;
        });
    }

    /**
     * "Use a different email": discards the live code and any identity, keeps
     * nothing from the previous attempt.
     */
    public FlowState reset() {
        if (state == FlowState.REGISTRATION_CLOSED) {
            throw new IllegalStateException("reset is not allowed once registration is closed");
        }
        if (sessionToken != null || emailClaim != null) {
            Event event = eventService.requireEvent(eventId);
            oneTimeCodeService.discardSession(event, emailClaim, sessionToken);
        }
        emailClaim = null;
        distributorIdClaim = null;
        sessionToken = null;
        displayEmail = null;
        emailMasked = false;
        profile = null;
        pendingSubmission = null;
        result = null;
        lastError = null;
        state = mode == RegistrationMode.OPEN_ANONYMOUS ? FlowState.FORM : FlowState.EMAIL;
        return state;
    }

    // -------------------------------------------------------------------------

    private void sendCode(Event event) {
        IssueCodeResponse issued = oneTimeCodeService.issueCode(event, emailClaim, distributorIdClaim, clientIp);
        sessionToken = issued.getSessionToken();
        emailMasked = issued.isEmailMasked();
        displayEmail = issued.isEmailMasked() ? issued.getMaskedEmail() : emailClaim;
        state = FlowState.OTP;
    }

    private void verified(VerifiedProfile verifiedProfile) {
        profile = verifiedProfile;
        displayEmail = verifiedProfile.getEmail();
        emailMasked = false;
        lastError = null;
        state = FlowState.FORM;
    }

    private void doSubmit(Event event, SubmitRegistrationRequest request) {
        if (profile != null && request.getForm() != null) {
            request.getForm().setEmail(profile.getEmail());
            request.setGrantToken(profile.getGrantToken());
        }
        result = submissionService.submit(event, request, clientIp);
        pendingSubmission = null;
        lastError = null;
        state = FlowState.SUCCESS;
        log.info("Registration flow finished on event {} ({} row(s), updated={})", eventId,
                result.registrations().size(), result.wasUpdated());
    }

    private Event openEvent() {
        Event event = eventService.requireEvent(eventId);
        eventService.assertOpen(event);
        return event;
    }

    private FlowState attempt(Supplier<FlowState> step) {
        try {
            return step.get();
        } catch (RegistrationClosedException e) {
            lastError = e;
            state = FlowState.REGISTRATION_CLOSED;
        } catch (NotQualifiedException e) {
            lastError = e;
            state = FlowState.NOT_QUALIFIED;
        } catch (RegistrationException e) {
            log.debug("Registration flow step failed on event {}: {}", eventId, e.getErrorCode());
            lastError = e;
        }
        return state;
    }

    private void openEventOrClose() {
        attempt(() -> {
            openEvent();
            return state;
        });
    }

    private FlowState initialState() {
        return mode == RegistrationMode.QUALIFIED_VERIFIED ? FlowState.EMAIL : FlowState.FORM;
    }

    private Set<FlowState> verifiableEntryStates() {
        if (mode == RegistrationMode.OPEN_ANONYMOUS) {
            return EnumSet.noneOf(FlowState.class);
        }
        return profile == null ? EnumSet.of(FlowState.EMAIL, FlowState.FORM) : EnumSet.noneOf(FlowState.class);
    }

    private void requireState(String operation, Set<FlowState> allowed) {
        if (!allowed.contains(state)) {
            throw new IllegalStateException(operation + " is not allowed in state " + state);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
