package com.eventhub.registration.modules.submission;

import com.eventhub.registration.config.ClientIpResolver;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.modules.submission.dto.ExistingRegistrationRequest;
import com.eventhub.registration.modules.submission.dto.RegistrationView;
import com.eventhub.registration.modules.submission.dto.SubmissionResponse;
import com.eventhub.registration.modules.submission.dto.SubmitRegistrationRequest;
import com.eventhub.registration.service.EventService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Public registration endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /public/events/{event}/registrations: submit (201 created, 200
 * updated)</li>
 * <li>POST /public/events/{event}/registrations/existing: the caller's own
 * registration, 204 when there is none</li>
 * </ul>
 */
@RestController
@RequestMapping("/public/events/{event}/registrations")
@RequiredArgsConstructor
public class RegistrationController {

    private final EventService eventService;
    private final RegistrationSubmissionService submissionService;
    private final FormDataMapper formDataMapper;

    // =========================================================================
    // Submit
    // =========================================================================

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(@PathVariable("event") String eventRef,
            @Valid @RequestBody SubmitRegistrationRequest request,
            HttpServletRequest httpRequest) {
        Event event = eventService.requireEvent(eventRef);
        SubmissionResult result = submissionService.submit(event, request, ClientIpResolver.resolve(httpRequest));

        List<RegistrationView> views = result.registrations().stream()
                .map(this::toView)
                .toList();
        SubmissionResponse body = SubmissionResponse.builder()
                .registrations(views)
                .wasUpdated(result.wasUpdated())
                .createdCount(result.createdCount())
                .orderId(result.orderId())
                .build();

        HttpStatus status = result.wasUpdated() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(body);
    }

    // =========================================================================
    // Existing registration
    // =========================================================================

    @PostMapping("/existing")
    public ResponseEntity<RegistrationView> existing(@PathVariable("event") String eventRef,
            @Valid @RequestBody ExistingRegistrationRequest request) {
        Event event = eventService.requireEvent(eventRef);
        return submissionService.fetchExisting(event, request.getEmail(), request.getGrantToken())
                .map(r -> ResponseEntity.ok(toView(r)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private RegistrationView toView(Registration registration) {
        return RegistrationView.from(registration, formDataMapper.read(registration.getFormData()));
    }
}
