package com.eventhub.registration.modules.submission;

import com.eventhub.registration.modules.submission.dto.RegistrationForm;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Required-field rules for registration forms.
 * <p>
 * Full schema: first name, last name and e-mail plus the event's configured
 * field ids. Reduced schema (extra attendees of an order): name and e-mail
 * only. Known ids map onto typed form properties; any other id is looked up in
 * {@code customFields}. A blank string counts as missing, and a required
 * {@code termsAccepted} must be {@code true}.
 * </p>
 */
@Component
public class RequiredFieldSchema {

    static final List<String> BASE_FIELDS = List.of("firstName", "lastName", "email");

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private static final Map<String, Function<RegistrationForm, Object>> KNOWN_FIELDS = new LinkedHashMap<>();

    static {
        KNOWN_FIELDS.put("firstName", RegistrationForm::getFirstName);
        KNOWN_FIELDS.put("lastName", RegistrationForm::getLastName);
        KNOWN_FIELDS.put("email", RegistrationForm::getEmail);
        KNOWN_FIELDS.put("phone", RegistrationForm::getPhone);
        KNOWN_FIELDS.put("distributorId", RegistrationForm::getDistributorId);
        KNOWN_FIELDS.put("unicityId", RegistrationForm::getDistributorId);
        KNOWN_FIELDS.put("language", RegistrationForm::getLanguage);
        KNOWN_FIELDS.put("gender", RegistrationForm::getGender);
        KNOWN_FIELDS.put("dateOfBirth", RegistrationForm::getDateOfBirth);
        KNOWN_FIELDS.put("passportNumber", RegistrationForm::getPassportNumber);
        KNOWN_FIELDS.put("passportCountry", RegistrationForm::getPassportCountry);
        KNOWN_FIELDS.put("passportExpiration", RegistrationForm::getPassportExpiration);
        KNOWN_FIELDS.put("emergencyContact", RegistrationForm::getEmergencyContact);
        KNOWN_FIELDS.put("emergencyContactPhone", RegistrationForm::getEmergencyContactPhone);
        KNOWN_FIELDS.put("shirtSize", RegistrationForm::getShirtSize);
        KNOWN_FIELDS.put("pantSize", RegistrationForm::getPantSize);
        KNOWN_FIELDS.put("dietaryRestrictions", RegistrationForm::getDietaryRestrictions);
        KNOWN_FIELDS.put("adaAccommodations", RegistrationForm::getAdaAccommodations);
        KNOWN_FIELDS.put("roomType", RegistrationForm::getRoomType);
        KNOWN_FIELDS.put("termsAccepted", RegistrationForm::getTermsAccepted);
    }

    /**
     * Field ids that are missing or malformed under the full schema, base fields
     * first, then the event's fields in alphabetical order.
     */
    public List<String> missingFields(RegistrationForm form, Collection<String> eventRequiredFields) {
        List<String> missing = new ArrayList<>();
        for (String field : BASE_FIELDS) {
            if (!isSatisfied(form, field)) {
                missing.add(field);
            }
        }
        if (eventRequiredFields != null) {
            for (String field : new TreeSet<>(eventRequiredFields)) {
                if (!BASE_FIELDS.contains(field) && !isSatisfied(form, field)) {
                    missing.add(field);
                }
            }
        }
        return missing;
    }

    /** Reduced schema used for additional attendees. */
    public List<String> missingAttendeeFields(RegistrationForm form) {
        return missingFields(form, List.of());
    }

    private boolean isSatisfied(RegistrationForm form, String field) {
        Object value = valueOf(form, field);
        if (value == null) {
            return false;
        }
        if ("termsAccepted".equals(field)) {
            return Boolean.TRUE.equals(value);
        }
        if (value instanceof String s) {
            if (s.isBlank()) {
                return false;
            }
            return !"email".equals(field) || EMAIL.matcher(s.trim()).matches();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    private Object valueOf(RegistrationForm form, String field) {
        Function<RegistrationForm, Object> getter = KNOWN_FIELDS.get(field);
        if (getter != null) {
            return getter.apply(form);
        }
        return form.getCustomFields() != null ? form.getCustomFields().get(field) : null;
    }
}
