package com.eventhub.registration.modules.flow;

/**
 * The one discriminated state of a {@link RegistrationFlow}.
 */
public enum FlowState {
    /** Waiting for the registrant's e-mail or distributor id. */
    EMAIL,
    /** A code was sent; waiting for it. */
    OTP,
    /** Identity settled (or not needed); waiting for the form. */
    FORM,
    SUCCESS,
    /** Terminal for the identity tried; {@code reset()} allows another one. */
    NOT_QUALIFIED,
    /** Terminal for the event. */
    REGISTRATION_CLOSED;

    public boolean isTerminal() {
        return this == NOT_QUALIFIED || this == REGISTRATION_CLOSED;
    }
}
