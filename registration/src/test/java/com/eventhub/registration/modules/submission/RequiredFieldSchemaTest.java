package com.eventhub.registration.modules.submission;

import com.eventhub.registration.modules.submission.dto.RegistrationForm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RequiredFieldSchemaTest {

    private final RequiredFieldSchema schema = new RequiredFieldSchema();

    private static RegistrationForm complete() {
        RegistrationForm form = new RegistrationForm();
        form.setFirstName("Maria");
        form.setLastName("Lopez");
        form.setEmail("maria.lopez@example.com");
        return form;
    }

    @Test
    @DisplayName("base fields come first, event fields follow alphabetically")
    void orderOfMissingFields() {
        RegistrationForm form = new RegistrationForm();
        form.setLastName("Lopez");

        List<String> missing = schema.missingFields(form, Set.of("shirtSize", "phone", "email"));

        assertEquals(List.of("firstName", "email", "phone", "shirtSize"), missing);
    }

    @Test
    @DisplayName("blank strings and malformed e-mail count as missing")
    void blankAndMalformed() {
        RegistrationForm form = complete();
        form.setFirstName("   ");
        form.setEmail("not-an-address");

        assertEquals(List.of("firstName", "email"), schema.missingFields(form, List.of()));
    }

    @Test
    @DisplayName("required terms must be accepted, not just present")
    void termsMustBeTrue() {
        RegistrationForm form = complete();
        form.setTermsAccepted(false);

        assertEquals(List.of("termsAccepted"), schema.missingFields(form, List.of("termsAccepted")));

        form.setTermsAccepted(true);
        assertTrue(schema.missingFields(form, List.of("termsAccepted")).isEmpty());
    }

    @Test
    @DisplayName("unknown ids are looked up in custom fields")
    void customFields() {
        RegistrationForm form = complete();
        form.getCustomFields().put("hotelNights", List.of());
        form.getCustomFields().put("chapter", "Lima");

        assertEquals(List.of("hotelNights", "tshirtColor"),
                schema.missingFields(form, List.of("chapter", "hotelNights", "tshirtColor")));
    }

    @Test
    @DisplayName("additional attendees only need name and e-mail")
    void reducedSchema() {
        RegistrationForm attendee = complete();

        assertTrue(schema.missingAttendeeFields(attendee).isEmpty());

        attendee.setEmail(null);
        assertEquals(List.of("email"), schema.missingAttendeeFields(attendee));
    }

    @Test
    @DisplayName("no event fields configured")
    void nullEventFields() {
        assertTrue(schema.missingFields(complete(), null).isEmpty());
    }
}
