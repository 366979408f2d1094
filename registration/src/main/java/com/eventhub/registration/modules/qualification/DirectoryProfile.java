package com.eventhub.registration.modules.qualification;

/**
 * Customer record returned by the external identity directory.
 */
public record DirectoryProfile(String unicityId, String firstName, String lastName, String phone) {
}
