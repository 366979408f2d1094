package com.eventhub.registration.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>E-mail addresses: first character of the local part, then "***@domain"</li>
 * <li>Verification codes after {@code code=}: "[REDACTED]"</li>
 * <li>Redirect / session tokens after {@code token=}: first 8 chars + "..."</li>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Phone numbers: last 4 digits only (***1234)</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.eventhub.registration.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches token=<value>, sessionToken=<value> or "token":"<value>"
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("((?i:token)[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-.]{8})[A-Za-z0-9_\\-.]+");

    // Matches code=123456 or "code":"123456"
    private static final Pattern CODE_PATTERN = Pattern.compile("(code[\"=:]+\\s*[\"']?)\\d{4,8}");

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("([A-Za-z0-9])[A-Za-z0-9._%+\\-]*@([A-Za-z0-9.\\-]+\\.[A-Za-z]{2,})");

    // Matches phone numbers starting with + followed by digits
    private static final Pattern PHONE_PATTERN = Pattern.compile("(\\+\\d{1,4})(\\d+)(\\d{4})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = CODE_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = maskEmails(masked);
        masked = PHONE_PATTERN.matcher(masked).replaceAll("***$3");

        return masked;
    }

    private String maskEmails(String input) {
        Matcher m = EMAIL_PATTERN.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1) + "***@" + m.group(2)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
