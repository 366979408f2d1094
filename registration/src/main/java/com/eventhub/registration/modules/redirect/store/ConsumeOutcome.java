package com.eventhub.registration.modules.redirect.store;

public enum ConsumeOutcome {
    CONSUMED,
    /** Unknown token, or already consumed. */
    ABSENT,
    /** Token exists but is bound to another event or e-mail; left untouched. */
    MISMATCH,
    /** Past its expiry; removed. */
    EXPIRED
}
