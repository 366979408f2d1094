package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.ClientIpResolver;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.verification.dto.IssueCodeRequest;
import com.eventhub.registration.modules.verification.dto.IssueCodeResponse;
import com.eventhub.registration.modules.verification.dto.ValidateCodeRequest;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.service.EventService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * One-time code endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /public/events/{event}/codes: qualify, then send a code (also used
 * for resend)</li>
 * <li>POST /public/events/{event}/codes/verify: validate a code, returning the
 * verified profile and a redirect token</li>
 * <li>DELETE /public/events/{event}/codes/{sessionToken}: discard the session
 * ("use a different email")</li>
 * </ul>
 */
@RestController
@RequestMapping("/public/events/{event}/codes")
@RequiredArgsConstructor
public class VerificationController {

    private final EventService eventService;
    private final OneTimeCodeService oneTimeCodeService;

    @PostMapping
    public ResponseEntity<IssueCodeResponse> issue(@PathVariable("event") String eventRef,
            @Valid @RequestBody IssueCodeRequest request,
            HttpServletRequest httpRequest) {
        Event event = eventService.requireEvent(eventRef);
        IssueCodeResponse response = oneTimeCodeService.issueCode(event, request.getEmail(),
                request.getDistributorId(), ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/verify")
    public ResponseEntity<VerifiedProfile> verify(@PathVariable("event") String eventRef,
            @Valid @RequestBody ValidateCodeRequest request,
            HttpServletRequest httpRequest) {
        Event event = eventService.requireEvent(eventRef);
        VerifiedProfile profile = oneTimeCodeService.validateCode(event, request.getEmail(),
                request.getSessionToken(), request.getCode(), ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(profile);
    }

    @DeleteMapping("/{sessionToken}")
    public ResponseEntity<Void> discard(@PathVariable("event") String eventRef,
            @PathVariable("sessionToken") String sessionToken) {
        Event event = eventService.requireEvent(eventRef);
        oneTimeCodeService.discardSession(event, null, sessionToken);
        return ResponseEntity.noContent().build();
    }
}
