package com.eventhub.registration.service;

import com.eventhub.registration.modules.redirect.store.InMemoryRedirectTokenStore;
import com.eventhub.registration.modules.verification.store.InMemoryVerificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Drops expired entries from the in-memory stores. Expiry is already checked
 * on every read; this only bounds memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "registration.ephemeral-store", havingValue = "memory")
public class EphemeralStoreSweeper {

    private final InMemoryVerificationStore verificationStore;
    private final InMemoryRedirectTokenStore redirectTokenStore;

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void sweep() {
        Instant now = Instant.now();
        int sessions = verificationStore.purgeExpired(now);
        int tokens = redirectTokenStore.purgeExpired(now);
        if (sessions + tokens > 0) {
            log.info("Swept {} expired verification entr(ies) and {} redirect token(s)", sessions, tokens);
        }
    }
}
