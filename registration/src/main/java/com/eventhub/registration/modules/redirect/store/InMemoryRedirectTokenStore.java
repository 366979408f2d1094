package com.eventhub.registration.modules.redirect.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node redirect token store. Consumption goes through
 * {@link ConcurrentHashMap#computeIfPresent}, so only one caller can remove a
 * given token.
 */
@Component
@ConditionalOnProperty(name = "registration.ephemeral-store", havingValue = "memory")
public class InMemoryRedirectTokenStore implements RedirectTokenStore {

    private final Map<String, RedirectTokenRecord> tokens = new ConcurrentHashMap<>();

    @Override
    public void save(RedirectTokenRecord record) {
        tokens.put(record.token(), record);
    }

    @Override
    public ConsumeResult consume(String token, UUID eventId, String normalizedEmail, Instant now) {
        ConsumeResult[] result = { ConsumeResult.of(ConsumeOutcome.ABSENT) };

        tokens.computeIfPresent(token, (key, record) -> {
            if (!record.eventId().equals(eventId) || !record.email().equals(normalizedEmail)) {
                result[0] = ConsumeResult.of(ConsumeOutcome.MISMATCH);
                return record;
            }
            result[0] = record.isExpired(now)
                    ? ConsumeResult.of(ConsumeOutcome.EXPIRED)
                    : new ConsumeResult(ConsumeOutcome.CONSUMED, record.profile());
            return null;
        });

        return result[0];
    }

    public int purgeExpired(Instant now) {
        int before = tokens.size();
        tokens.values().removeIf(r -> r.isExpired(now));
        return before - tokens.size();
    }
}
