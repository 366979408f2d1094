package com.eventhub.registration.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code registration.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "registration")
public class RegistrationProperties {

    /** "redis" (default) or "memory" for single-node development. */
    private String ephemeralStore = "redis";

    /** Header carrying the operator token for /admin/** routes. */
    private String operatorHeader = "X-Operator-Token";
    private String operatorToken = "";

    private Code code = new Code();
    private Grant grant = new Grant();
    private RedirectToken redirectToken = new RedirectToken();
    private SignedLink signedLink = new SignedLink();
    private Directory directory = new Directory();
    private Delivery delivery = new Delivery();

    @Getter
    @Setter
    public static class Code {
        private int length = 6;
        private Duration ttl = Duration.ofMinutes(10);
        private int maxAttempts = 5;
    }

    @Getter
    @Setter
    public static class Grant {
        private Duration ttl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class RedirectToken {
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class SignedLink {
        private String secret = "";
        private Duration maxAge = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Directory {
        private boolean enabled = false;
        private String baseUrl = "https://hydra.unicity.net/v6";
        private String apiKey = "";
    }

    @Getter
    @Setter
    public static class Delivery {
        /** "log" writes codes to the application log (development only), "http" posts them. */
        private String mode = "log";
        private String endpoint = "";
        private String apiKey = "";
        private String templateId = "registration-code";
    }

    public boolean usesRedis() {
        return !"memory".equalsIgnoreCase(ephemeralStore);
    }
}
