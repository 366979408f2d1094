package com.eventhub.registration.modules.verification.store;

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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed verification store.
 * <ul>
 * <li>Session: hash {@code verify:session:{event}:{email}} holding issueId,
 * codeHash, expiresAt, attempts, sessionToken and the JSON session</li>
 * <li>Token index: {@code verify:token:{token}} pointing at the session key</li>
 * <li>Grant: {@code verify:grant:{event}:{email}} holding the JSON profile</li>
 * <li>Issue and attempt are Lua scripts, so a re-issue and a guess never
 * interleave</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "registration.ephemeral-store", havingValue = "redis", matchIfMissing = true)
public class RedisVerificationStore implements VerificationStore {

    static final String SESSION_PREFIX = "verify:session:";
    static final String TOKEN_PREFIX = "verify:token:";
    static final String GRANT_PREFIX = "verify:grant:";

    /** Keeps the Redis entry a little longer than the logical expiry. */
    private static final long TTL_SLACK_MILLIS = 60_000;

    /**
     * Replaces the session and its token index entry in one step.
     * KEYS[1]=session, KEYS[2]=new token index.
     * ARGV: issueId, codeHash, expiresAt, sessionToken, data, ttlMillis,
     * tokenPrefix.
     */
    private static final String SAVE_LUA_SCRIPT = "local old = redis.call('HGET', KEYS[1], 'sessionToken') " +
            "if old then redis.call('DEL', ARGV[7] .. old) end " +
            "redis.call('DEL', KEYS[1]) " +
            "redis.call('HSET', KEYS[1], 'issueId', ARGV[1], 'codeHash', ARGV[2], 'expiresAt', ARGV[3], " +
            "'attempts', '0', 'sessionToken', ARGV[4], 'data', ARGV[5]) " +
            "redis.call('PEXPIRE', KEYS[1], ARGV[6]) " +
            "redis.call('SET', KEYS[2], KEYS[1], 'PX', ARGV[6]) " +
            "return 1";

    /**
     * One guess. Returns "OUTCOME:attempts".
     * KEYS[1]=session. ARGV: issueId, codeHash, nowMillis, maxAttempts,
     * tokenPrefix.
     */
    private static final String ATTEMPT_LUA_SCRIPT = "local h = redis.call('HMGET', KEYS[1], " +
            "'issueId', 'codeHash', 'expiresAt', 'attempts', 'sessionToken') " +
            "if not h[1] or h[1] ~= ARGV[1] then return 'ABSENT:0' end " +
            "local attempts = tonumber(h[4]) " +
            "local function destroy() " +
            "  if h[5] then redis.call('DEL', ARGV[5] .. h[5]) end " +
            "  redis.call('DEL', KEYS[1]) " +
            "end " +
            "if tonumber(ARGV[3]) >= tonumber(h[3]) then destroy() return 'EXPIRED:' .. attempts end " +
            "if attempts >= tonumber(ARGV[4]) then destroy() return 'EXHAUSTED:' .. attempts end " +
            "if h[2] == ARGV[2] then destroy() return 'VALIDATED:' .. attempts end " +
            "attempts = redis.call('HINCRBY', KEYS[1], 'attempts', 1) " +
            "if attempts >= tonumber(ARGV[4]) then destroy() return 'EXHAUSTED:' .. attempts end " +
            "return 'INVALID:' .. attempts";

    private static final String DELETE_LUA_SCRIPT = "local t = redis.call('HGET', KEYS[1], 'sessionToken') " +
            "if t then redis.call('DEL', ARGV[1] .. t) end " +
            "return redis.call('DEL', KEYS[1])";

    private static final DefaultRedisScript<Long> SAVE_SCRIPT = new DefaultRedisScript<>(SAVE_LUA_SCRIPT, Long.class);
    private static final DefaultRedisScript<String> ATTEMPT_SCRIPT = new DefaultRedisScript<>(ATTEMPT_LUA_SCRIPT,
            String.class);
    private static final DefaultRedisScript<Long> DELETE_SCRIPT = new DefaultRedisScript<>(DELETE_LUA_SCRIPT,
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void saveSession(VerificationSession session) {
        long ttlMillis = Math.max(Duration.between(Instant.now(), session.getExpiresAt()).toMillis(), 0)
                + TTL_SLACK_MILLIS;

        redisTemplate.execute(SAVE_SCRIPT,
                List.of(SESSION_PREFIX + session.getSessionKey(), TOKEN_PREFIX + session.getSessionToken()),
                session.getIssueId(),
                session.getCodeHash(),
                String.valueOf(session.getExpiresAt().toEpochMilli()),
                session.getSessionToken(),
                toJson(session),
                String.valueOf(ttlMillis),
                TOKEN_PREFIX);
    }

    @Override
    public Optional<VerificationSession> findSession(String sessionKey) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(SESSION_PREFIX + sessionKey);
        if (fields == null || fields.get("data") == null) {
            return Optional.empty();
        }
        VerificationSession stored = fromJson(fields.get("data").toString(), VerificationSession.class);
        int attempts = fields.get("attempts") != null ? Integer.parseInt(fields.get("attempts").toString()) : 0;
        return Optional.of(stored.toBuilder().attempts(attempts).build());
    }

    @Override
    public Optional<String> findSessionKeyByToken(String sessionToken) {
        String key = redisTemplate.opsForValue().get(TOKEN_PREFIX + sessionToken);
        if (key == null || !key.startsWith(SESSION_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(key.substring(SESSION_PREFIX.length()));
    }

    @Override
    public AttemptResult attempt(String sessionKey, String issueId, String codeHash, Instant now, int maxAttempts) {
        String raw = castToString(redisTemplate.execute(ATTEMPT_SCRIPT,
                Collections.singletonList(SESSION_PREFIX + sessionKey),
                issueId, codeHash, String.valueOf(now.toEpochMilli()), String.valueOf(maxAttempts), TOKEN_PREFIX));
        return parseAttempt(raw);
    }

    @Override
    public void deleteSession(String sessionKey) {
        redisTemplate.execute(DELETE_SCRIPT, Collections.singletonList(SESSION_PREFIX + sessionKey), TOKEN_PREFIX);
    }

    @Override
    public void saveGrant(VerifiedProfile profile) {
        long ttlMillis = Math.max(Duration.between(Instant.now(), profile.getVerifiedUntil()).toMillis(), 1);
        redisTemplate.opsForValue().set(grantKey(profile.getEventId(), profile.getEmail()), toJson(profile),
                ttlMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public Optional<VerifiedProfile> findGrant(UUID eventId, String normalizedEmail, Instant now) {
        String json = redisTemplate.opsForValue().get(grantKey(eventId, normalizedEmail));
        if (json == null) {
            return Optional.empty();
        }
        VerifiedProfile profile = fromJson(json, VerifiedProfile.class);
        if (profile.getVerifiedUntil() == null || !now.isBefore(profile.getVerifiedUntil())) {
            return Optional.empty();
        }
        return Optional.of(profile);
    }

    @Override
    public void deleteGrant(UUID eventId, String normalizedEmail) {
        redisTemplate.delete(grantKey(eventId, normalizedEmail));
    }

    static AttemptResult parseAttempt(String raw) {
        if (raw == null) {
            return AttemptResult.of(AttemptOutcome.ABSENT, 0);
        }
        int sep = raw.indexOf(':');
        AttemptOutcome outcome = AttemptOutcome.valueOf(sep > 0 ? raw.substring(0, sep) : raw);
        int attempts = sep > 0 ? Integer.parseInt(raw.substring(sep + 1)) : 0;
        return AttemptResult.of(outcome, attempts);
    }

    private static String grantKey(UUID eventId, String normalizedEmail) {
        return GRANT_PREFIX + eventId + ":" + normalizedEmail;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private String castToString(Object obj) {
        return obj != null ? obj.toString() : null;
    }
}
