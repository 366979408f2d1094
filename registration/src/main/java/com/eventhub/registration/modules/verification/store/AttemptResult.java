package com.eventhub.registration.modules.verification.store;

public record AttemptResult(AttemptOutcome outcome, int attempts) {

    public static AttemptResult of(AttemptOutcome outcome, int attempts) {
        return new AttemptResult(outcome, attempts);
    }
}
