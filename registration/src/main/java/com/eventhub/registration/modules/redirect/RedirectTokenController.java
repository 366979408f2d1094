package com.eventhub.registration.modules.redirect;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.redirect.dto.ConsumeRedirectTokenRequest;
import com.eventhub.registration.modules.redirect.dto.IssueRedirectTokenRequest;
import com.eventhub.registration.modules.redirect.dto.IssuedRedirectToken;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.service.EventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Redirect token endpoints.
 * <ul>
 * <li>POST /public/events/{event}/redirect-tokens: issue (needs a live
 * verification for the e-mail)</li>
 * <li>POST /public/redirect-tokens/consume: single-use consumption</li>
 * </ul>
 */
@RestController
@RequestMapping("/public")
@RequiredArgsConstructor
public class RedirectTokenController {

    private final EventService eventService;
    private final RedirectTokenService redirectTokenService;

    // ================================================================
    // POST /public/events/{event}/redirect-tokens
    // ================================================================

    @PostMapping("/events/{event}/redirect-tokens")
    public ResponseEntity<IssuedRedirectToken> issue(@PathVariable("event") String eventRef,
            @Valid @RequestBody IssueRedirectTokenRequest request) {
        Event event = eventService.requireOpen(eventRef);
        IssuedRedirectToken token = redirectTokenService.issue(event.getId(), request.getEmail(),
                request.getGrantToken(), request.getProfile());
        return ResponseEntity.status(HttpStatus.CREATED).body(token);
    }

    // ================================================================
    // POST /public/redirect-tokens/consume
    // ================================================================

    @PostMapping("/redirect-tokens/consume")
    public ResponseEntity<VerifiedProfile> consume(@Valid @RequestBody ConsumeRedirectTokenRequest request) {
        Event event = eventService.requireOpen(request.getEvent());
        VerifiedProfile profile = redirectTokenService.consume(request.getToken(), request.getEmail(),
                event.getId());
        return ResponseEntity.ok(profile);
    }
}
