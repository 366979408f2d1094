package com.eventhub.registration.modules.redirect.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Storage for single-use redirect tokens. {@link #consume} must be atomic:
 * among concurrent callers for the same token at most one sees
 * {@link ConsumeOutcome#CONSUMED}.
 */
public interface RedirectTokenStore {

    void save(RedirectTokenRecord record);

    ConsumeResult consume(String token, UUID eventId, String normalizedEmail, Instant now);
}
