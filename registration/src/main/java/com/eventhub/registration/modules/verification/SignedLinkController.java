package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.ClientIpResolver;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.verification.dto.AcceptSignedLinkRequest;
import com.eventhub.registration.modules.verification.dto.SignedLinkRequest;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.service.EventService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

/**
 * Signed identity links: operators mint them, registrants redeem them.
 */
@RestController
@RequiredArgsConstructor
public class SignedLinkController {

    private final EventService eventService;
    private final SignedLinkService signedLinkService;

    // ================================================================
    // POST /admin/events/{event}/signed-links
    // ================================================================

    @PostMapping("/admin/events/{event}/signed-links")
    public ResponseEntity<Map<String, String>> issue(@PathVariable("event") String eventRef,
            @Valid @RequestBody SignedLinkRequest request) {
        Event event = eventService.requireEvent(eventRef);
        Duration validFor = request.getValidForSeconds() != null
                ? Duration.ofSeconds(request.getValidForSeconds())
                : null;
        String token = signedLinkService.issue(event, request.getEmail(), request.getDistributorId(), validFor);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("token", token));
    }

    // ================================================================
    // POST /public/events/{event}/signed-links/accept
    // ================================================================

    @PostMapping("/public/events/{event}/signed-links/accept")
    public ResponseEntity<VerifiedProfile> accept(@PathVariable("event") String eventRef,
            @Valid @RequestBody AcceptSignedLinkRequest request,
            HttpServletRequest httpRequest) {
        Event event = eventService.requireEvent(eventRef);
        VerifiedProfile profile = signedLinkService.accept(event, request.getToken(),
                ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(profile);
    }
}
