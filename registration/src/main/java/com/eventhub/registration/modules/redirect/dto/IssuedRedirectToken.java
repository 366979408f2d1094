package com.eventhub.registration.modules.redirect.dto;

import java.time.Instant;

public record IssuedRedirectToken(String token, Instant expiresAt) {
}
