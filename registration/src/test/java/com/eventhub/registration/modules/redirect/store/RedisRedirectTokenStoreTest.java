package com.eventhub.registration.modules.redirect.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisRedirectTokenStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    private RedisRedirectTokenStore store;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        objectMapper.findAndRegisterModules();
        store = new RedisRedirectTokenStore(redisTemplate, objectMapper);
    }

    @Test
    @DisplayName("save writes the binding and sets a TTL past the logical expiry")
    void saveWritesHashWithTtl() {
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        UUID eventId = UUID.randomUUID();
        Instant expiresAt = Instant.now().plus(Duration.ofMinutes(10));

        store.save(new RedirectTokenRecord("tok", eventId, "maria.lopez@example.com", expiresAt,
                VerifiedProfile.builder().eventId(eventId).email("maria.lopez@example.com").build()));

        verify(hashOperations).putAll(eq("redirect_token:tok"), argThat((Map<?, ?> m) ->
                eventId.toString().equals(m.get("eventId")) && "maria.lopez@example.com".equals(m.get("email"))));
        verify(redisTemplate).expire(eq("redirect_token:tok"),
                argThat((Duration d) -> d.compareTo(Duration.ofMinutes(10)) > 0));
    }

    @Test
    @DisplayName("consume parses the profile of a CONSUMED reply")
    void consumeParsesProfile() throws Exception {
        UUID eventId = UUID.randomUUID();
        String json = objectMapper.writeValueAsString(
                VerifiedProfile.builder().eventId(eventId).email("maria.lopez@example.com").unicityId("UX100920").build());
        when(redisTemplate.execute(any(DefaultRedisScript.class), eq(Collections.singletonList("redirect_token:tok")),
                any(Object[].class))).thenReturn("CONSUMED:" + json);

        ConsumeResult result = store.consume("tok", eventId, "maria.lopez@example.com", Instant.now());

        assertEquals(ConsumeOutcome.CONSUMED, result.outcome());
        assertEquals("UX100920", result.profile().getUnicityId());
    }

    @Test
    @DisplayName("consume maps MISMATCH, EXPIRED and a missing reply")
    void consumeOutcomes() {
        UUID eventId = UUID.randomUUID();
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), any(Object[].class)))
                .thenReturn("MISMATCH", "EXPIRED", null);

        assertEquals(ConsumeOutcome.MISMATCH, store.consume("t", eventId, "a@b.co", Instant.now()).outcome());
        assertEquals(ConsumeOutcome.EXPIRED, store.consume("t", eventId, "a@b.co", Instant.now()).outcome());
        assertEquals(ConsumeOutcome.ABSENT, store.consume("t", eventId, "a@b.co", Instant.now()).outcome());
    }
}
