package com.work.token.core;

import com.work.token.core.cache.TokenCacheSlot;
import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenFormat;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.crypto.MetadataEncoder;
import com.work.token.core.crypto.MetadataTokenVerifier;
import com.work.token.core.crypto.VerificationResult;
import com.work.token.core.encode.TokenStringGenerator;
import com.work.token.core.exception.CsprngUnavailableException;
import com.work.token.core.exception.SigningException;
import com.work.token.core.model.TokenFailureReason;
import com.work.token.core.model.TokenResult;
import com.work.token.core.random.SecureByteSource;
import com.work.token.core.random.SecureRandomByteSource;
import com.work.token.core.resolve.TokenSpecResolver;
import com.work.token.core.support.metrics.TokenMetrics;
import com.work.token.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

public class TokenGeneratorTest {

    private static final long T0 = 1_700_000_000L;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(T0));
    private final TokenMetrics metrics = mock(TokenMetrics.class);

    private TokenGenerator generator(SecureByteSource source) {
        return new TokenGenerator(new TokenSpecResolver(), new TokenStringGenerator(source),
                new MetadataEncoder(clock), clock, metrics, Duration.ofMillis(50));
    }

    @Test
    public void plain_token_with_prefix_and_suffix() {
        TokenSpec spec = TokenSpec.builder("SID").header("X-Sid").format(TokenFormat.HEX).length(8)
                .prefix("sess_").suffix("_v1").build();

        TokenResult r = generator(new SecureRandomByteSource()).generate(spec, TokenContext.empty());

        assertTrue(r.isSuccess());
        assertFalse(r.isCached());
        assertEquals("SID", r.getName());
        assertEquals("X-Sid", r.getHeader().get());
        assertTrue(r.getValue().get().matches("sess_[0-9a-f]{16}_v1"));
        verify(metrics).generation("ok");
    }

    @Test
    public void timestamp_prefix_uses_clock_epoch() {
        TokenSpec spec = TokenSpec.builder("RID").format(TokenFormat.HEX).length(4).timestamp(true).build();

        String value = generator(new SecureRandomByteSource()).generate(spec, TokenContext.empty()).getValue().get();

        assertTrue(value.matches(T0 + "-[0-9a-f]{8}"), value);
    }

    @Test
    public void signed_metadata_wraps_payload_inside_prefix() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(3600).signingKey("secret").build();
        TokenSpec spec = TokenSpec.builder("SIG").format(TokenFormat.HEX).length(8).prefix("t_").build();

        String value = generator(new SecureRandomByteSource()).generate(spec, ctx).getValue().get();

        assertTrue(value.startsWith("t_" + (T0 + 3600) + ":"), value);
        String inner = value.substring(2);
        assertEquals(VerificationResult.VALID, new MetadataTokenVerifier().verify(inner, "secret", T0).getResult());
        verify(metrics).signing("signed");
    }

    @Test
    public void missing_signing_key_emits_unsigned_metadata() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(60).build();
        TokenSpec spec = TokenSpec.builder("U").format(TokenFormat.HEX).length(4).build();

        String value = generator(new SecureRandomByteSource()).generate(spec, ctx).getValue().get();

        assertTrue(value.matches((T0 + 60) + ":[0-9a-f]{8}"), value);
        verify(metrics).signing("unsigned");
        verify(metrics).resolutionWarning("signing_key_missing");
    }

    @Test
    public void blank_signing_key_emits_unsigned_metadata() {
        TokenContext ctx = TokenContext.builder()
                .encodeMetadata(true).expirySeconds(60).signingKey("   ")
                .addToken(TokenSpec.builder("T").format(TokenFormat.HEX).length(4).build())
                .build();
        TokenFacade facade = new TokenFacade(generator(new SecureRandomByteSource()), metrics);

        TokenResult r = facade.resolveAndGenerate(ctx, "/").get(0);

        assertTrue(r.isSuccess());
        assertTrue(r.getValue().get().matches((T0 + 60) + ":[0-9a-f]{8}"), r.getValue().get());
        verify(metrics).resolutionWarning("signing_key_missing");
        verify(metrics, never()).generation("error");
    }

    @Test
    public void signing_failure_falls_back_to_unsigned_metadata() {
        MetadataEncoder encoder = spy(new MetadataEncoder(clock));
        doThrow(new SigningException("HMAC unavailable", new IllegalStateException()))
                .when(encoder).encode(anyString(), anyLong(), anyString(), anyLong());
        TokenGenerator g = new TokenGenerator(new TokenSpecResolver(),
                new TokenStringGenerator(new SecureRandomByteSource()),
                encoder, clock, metrics, Duration.ofMillis(50));
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(60).signingKey("secret").build();
        TokenSpec spec = TokenSpec.builder("S").format(TokenFormat.HEX).length(4).build();

        TokenResult r = g.generate(spec, ctx);

        assertTrue(r.isSuccess());
        assertTrue(r.getValue().get().matches((T0 + 60) + ":[0-9a-f]{8}"), r.getValue().get());
        verify(metrics).signing("failed");
        verify(metrics, never()).signing("signed");
    }

    @Test
    public void cached_value_is_reused_within_ttl() {
        TokenSpec spec = TokenSpec.builder("C").ttlSeconds(60).build();
        TokenGenerator g = generator(new SecureRandomByteSource());

        TokenResult first = g.generate(spec, TokenContext.empty());
        clock.advance(Duration.ofSeconds(30));
        TokenResult second = g.generate(spec, TokenContext.empty());
        clock.advance(Duration.ofSeconds(31));
        TokenResult third = g.generate(spec, TokenContext.empty());

        assertFalse(first.isCached());
        assertTrue(second.isCached());
        assertEquals(first.getValue(), second.getValue());
        assertFalse(third.isCached());
        assertNotEquals(first.getValue(), third.getValue());
        verify(metrics).cacheLookup("hit");
        verify(metrics).cacheLookup("expired");
    }

    @Test
    public void zero_ttl_always_regenerates() {
        TokenSpec spec = TokenSpec.builder("N").ttlSeconds(0).build();
        TokenGenerator g = generator(new SecureRandomByteSource());

        TokenResult a = g.generate(spec, TokenContext.empty());
        TokenResult b = g.generate(spec, TokenContext.empty());

        assertNotEquals(a.getValue(), b.getValue());
        verify(metrics, never()).cacheLookup(anyString());
    }

    @Test
    public void clock_skew_discards_cache() {
        TokenSpec spec = TokenSpec.builder("C").ttlSeconds(60).build();
        TokenGenerator g = generator(new SecureRandomByteSource());

        TokenResult first = g.generate(spec, TokenContext.empty());
        clock.set(Instant.ofEpochSecond(T0 - 10));
        TokenResult second = g.generate(spec, TokenContext.empty());

        assertFalse(second.isCached());
        assertNotEquals(first.getValue(), second.getValue());
        verify(metrics).cacheLookup("clock_skew");
    }

    @Test
    public void csprng_failure_yields_failed_result_and_no_cache_write() {
        SecureByteSource broken = mock(SecureByteSource.class);
        when(broken.nextBytes(anyInt())).thenThrow(new CsprngUnavailableException("no entropy"));
        TokenSpec spec = TokenSpec.builder("F").header("X-F").ttlSeconds(60).build();

        TokenResult r = generator(broken).generate(spec, TokenContext.empty());

        assertFalse(r.isSuccess());
        assertFalse(r.getValue().isPresent());
        assertEquals(TokenFailureReason.CSPRNG_UNAVAILABLE, r.getFailure().get());
        assertEquals("X-F", r.getHeader().get());
        assertEquals(TokenCacheSlot.Outcome.MISS,
                spec.getCacheSlot().read(clock.instant(), 60, Duration.ofMillis(50)).getOutcome());
        verify(metrics).generation("csprng_unavailable");
    }

    @Test
    public void custom_format_with_grouping() {
        TokenContext ctx = TokenContext.builder().format(TokenFormat.CUSTOM).alphabet("ABCD").grouping(4).build();
        SecureByteSource fixed = n -> new byte[]{0x00, 0x01, 0x02, 0x03};
        TokenSpec spec = TokenSpec.builder("G").length(4).build();

        assertEquals("AAAA-AAAB-AAAC-AAAD", generator(fixed).generate(spec, ctx).getValue().get());
    }
}
