package com.eventhub.registration.modules.verification.store;

public enum AttemptOutcome {
    /** No session, or the session was re-issued meanwhile. */
    ABSENT,
    EXPIRED,
    /** Wrong code, attempts left. */
    INVALID,
    /** Wrong code and no attempts left; the session was destroyed. */
    EXHAUSTED,
    /** Correct code; the session was destroyed. */
    VALIDATED
}
