package com.eventhub.registration.modules.redirect.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * Redirect tokens in Redis.
 * <ul>
 * <li>Stored as hash {@code redirect_token:{token}} with eventId, email,
 * expiresAt and the JSON profile</li>
 * <li>TTL is one minute longer than the logical expiry, so a late consumer
 * still gets "expired" instead of "invalid"</li>
 * <li>Consumption is atomic via Lua script (check binding + DEL in one
 * round-trip)</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "registration.ephemeral-store", havingValue = "redis", matchIfMissing = true)
public class RedisRedirectTokenStore implements RedirectTokenStore {

    static final String KEY_PREFIX = "redirect_token:";
    private static final long TTL_SLACK_MILLIS = 60_000;

    /**
     * KEYS[1]=token key. ARGV: eventId, email, nowMillis.
     * Returns ABSENT, MISMATCH, EXPIRED or "CONSUMED:" followed by the profile.
     * A mismatch leaves the token in place for its rightful owner.
     */
    private static final String CONSUME_LUA_SCRIPT = "local v = redis.call('HMGET', KEYS[1], " +
            "'eventId', 'email', 'expiresAt', 'profile') " +
            "if not v[1] then return 'ABSENT' end " +
            "if v[1] ~= ARGV[1] or v[2] ~= ARGV[2] then return 'MISMATCH' end " +
            "redis.call('DEL', KEYS[1]) " +
            "if tonumber(ARGV[3]) >= tonumber(v[3]) then return 'EXPIRED' end " +
            "return 'CONSUMED:' .. v[4]";

    private static final DefaultRedisScript<String> CONSUME_SCRIPT = new DefaultRedisScript<>(CONSUME_LUA_SCRIPT,
            String.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void save(RedirectTokenRecord record) {
        String key = KEY_PREFIX + record.token();
        String profileJson;
        try {
            profileJson = objectMapper.writeValueAsString(record.profile());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize redirect token profile", e);
        }

        redisTemplate.opsForHash().putAll(key, Map.of(
                "eventId", record.eventId().toString(),
                "email", record.email(),
                "expiresAt", String.valueOf(record.expiresAt().toEpochMilli()),
                "profile", profileJson));
        long ttlMillis = Math.max(Duration.between(Instant.now(), record.expiresAt()).toMillis(), 0)
                + TTL_SLACK_MILLIS;
        redisTemplate.expire(key, Duration.ofMillis(ttlMillis));
    }

    @Override
    public ConsumeResult consume(String token, UUID eventId, String normalizedEmail, Instant now) {
        String raw = castToString(redisTemplate.execute(CONSUME_SCRIPT,
                Collections.singletonList(KEY_PREFIX + token),
                eventId.toString(), normalizedEmail, String.valueOf(now.toEpochMilli())));

        if (raw == null) {
            return ConsumeResult.of(ConsumeOutcome.ABSENT);
        }
        if (!raw.startsWith("CONSUMED:")) {
            return ConsumeResult.of(ConsumeOutcome.valueOf(raw));
        }

        try {
            VerifiedProfile profile = objectMapper.readValue(raw.substring("CONSUMED:".length()),
                    VerifiedProfile.class);
            return new ConsumeResult(ConsumeOutcome.CONSUMED, profile);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize redirect token profile", e);
        }
    }

    private String castToString(Object obj) {
        return obj != null ? obj.toString() : null;
    }
}
