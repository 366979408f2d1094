package com.eventhub.registration.modules.submission;

import com.eventhub.registration.model.entity.Registration;

import java.util.List;
import java.util.UUID;

/**
 * Authoritative outcome of a submission.
 *
 * @param registrations the written rows, primary attendee first
 * @param wasUpdated    true when an existing registration was updated
 * @param orderId       set for anonymous orders
 */
public record SubmissionResult(List<Registration> registrations, boolean wasUpdated, UUID orderId) {

    public Registration primary() {
        return registrations.get(0);
    }

    public int createdCount() {
        return wasUpdated ? 0 : registrations.size();
    }
}
