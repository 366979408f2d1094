package com.eventhub.registration.modules.qualification;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.qualification.dto.QualificationRequest;
import com.eventhub.registration.modules.qualification.dto.QualifiedProfile;
import com.eventhub.registration.service.EventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /public/events/{event}/qualification: check a claimed identity
 * against the event's qualified list. Never issues a code.
 */
@RestController
@RequestMapping("/public/events/{event}")
@RequiredArgsConstructor
public class QualificationController {

    private final EventService eventService;
    private final QualificationResolver qualificationResolver;

    @PostMapping("/qualification")
    public ResponseEntity<QualifiedProfile> resolve(@PathVariable("event") String eventRef,
            @Valid @RequestBody QualificationRequest request) {
        Event event = eventService.requireOpen(eventRef);
        QualificationResult result = qualificationResolver.resolve(event, request.getEmail(),
                request.getDistributorId());
        return ResponseEntity.ok(result.toPublicProfile());
    }
}
