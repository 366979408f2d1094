package com.eventhub.registration.modules.lifecycle;

import com.eventhub.registration.config.ClientIpResolver;
import com.eventhub.registration.config.OperatorAuthFilter;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.modules.lifecycle.dto.TransferRequest;
import com.eventhub.registration.modules.submission.FormDataMapper;
import com.eventhub.registration.modules.submission.dto.RegistrationView;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints on a stored registration. Guarded by
 * {@link OperatorAuthFilter}.
 */
@RestController
@RequestMapping("/admin/registrations/{id}")
@RequiredArgsConstructor
public class AttendeeLifecycleController {

    private final AttendeeLifecycleService lifecycleService;
    private final FormDataMapper formDataMapper;

    // ================================================================
    // POST /admin/registrations/{id}/transfer
    // ================================================================

    @PostMapping("/transfer")
    public ResponseEntity<RegistrationView> transfer(@PathVariable("id") UUID id,
            @Valid @RequestBody TransferRequest request,
            HttpServletRequest httpRequest) {
        Registration moved = lifecycleService.transfer(id, request.getTargetEvent(), operator(httpRequest),
                ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(toView(moved));
    }

    // ================================================================
    // POST /admin/registrations/{id}/check-in
    // ================================================================

    @PostMapping("/check-in")
    public ResponseEntity<RegistrationView> checkIn(@PathVariable("id") UUID id, HttpServletRequest httpRequest) {
        Registration checkedIn = lifecycleService.checkIn(id, operator(httpRequest),
                ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(toView(checkedIn));
    }

    // ================================================================
    // DELETE /admin/registrations/{id}
    // ================================================================

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("id") UUID id, HttpServletRequest httpRequest) {
        Map<String, Object> report = lifecycleService.cancel(id, operator(httpRequest),
                ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(Map.of(
                "status", "CANCELLED",
                "deletionReport", report,
                "timestamp", OffsetDateTime.now().toString()));
    }

    private RegistrationView toView(Registration registration) {
        return RegistrationView.from(registration, formDataMapper.read(registration.getFormData()));
    }

    private static String operator(HttpServletRequest request) {
        Object operator = request.getAttribute(OperatorAuthFilter.OPERATOR_ATTRIBUTE);
        return operator != null ? operator.toString() : "operator";
    }
}
