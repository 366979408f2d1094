package com.eventhub.registration.modules.qualification;

/**
 * Where a positive qualification came from.
 */
public enum QualificationSource {
    /** Listed in the event's qualified registrants. */
    QUALIFIED_LIST,
    /** Already holds a registration for the event (admin entry or import). */
    EXISTING_REGISTRATION,
    /** The event does not require qualification. */
    OPEN_REGISTRATION
}
