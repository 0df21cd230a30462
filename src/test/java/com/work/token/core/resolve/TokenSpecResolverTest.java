package com.work.token.core.resolve;

import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenFormat;
import com.work.token.core.config.TokenLimits;
import com.work.token.core.config.TokenSpec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenSpecResolverTest {

    private final TokenSpecResolver resolver = new TokenSpecResolver();

    @Test
    public void system_defaults_when_nothing_configured() {
        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), TokenContext.empty());

        assertEquals(TokenLimits.LENGTH_DEFAULT, t.getLength());
        assertEquals(TokenFormat.BASE64, t.getFormat());
        assertFalse(t.isTimestamp());
        assertEquals("", t.getPrefix());
        assertEquals("", t.getSuffix());
        assertEquals(0, t.getTtlSeconds());
        assertFalse(t.isCacheEnabled());
        assertFalse(t.isEncodeMetadata());
        assertTrue(t.getWarnings().isEmpty());
    }

    @Test
    public void spec_value_beats_context_value() {
        TokenContext ctx = TokenContext.builder().length(64).format(TokenFormat.HEX).prefix("ctx_").build();
        TokenSpec spec = TokenSpec.builder("T").length(8).prefix("spec_").build();

        ResolvedToken t = resolver.resolve(spec, ctx);

        assertSame(spec, t.getSpec());
        assertEquals(8, t.getLength());
        assertEquals(TokenFormat.HEX, t.getFormat());
        assertEquals("spec_", t.getPrefix());
    }

    @Test
    public void explicit_zero_ttl_does_not_inherit_parent_ttl() {
        TokenContext ctx = TokenContext.builder().ttlSeconds(300).build();

        ResolvedToken disabled = resolver.resolve(TokenSpec.builder("T").ttlSeconds(0).build(), ctx);
        ResolvedToken inherited = resolver.resolve(TokenSpec.builder("U").build(), ctx);

        assertEquals(0, disabled.getTtlSeconds());
        assertFalse(disabled.isCacheEnabled());
        assertEquals(300, inherited.getTtlSeconds());
        assertTrue(inherited.isCacheEnabled());
    }

    @Test
    public void three_level_inheritance() {
        TokenContext root = TokenContext.builder().length(20).format(TokenFormat.HEX).suffix("_r").build();
        TokenContext mid = TokenContext.builder().format(TokenFormat.BASE64URL).build();
        TokenContext leaf = TokenContext.builder().timestamp(true).build();
        TokenContext effective = TokenContext.merge(TokenContext.merge(root, mid), leaf);

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), effective);

        assertEquals(20, t.getLength());
        assertEquals(TokenFormat.BASE64URL, t.getFormat());
        assertTrue(t.isTimestamp());
        assertEquals("_r", t.getSuffix());
    }

    @Test
    public void out_of_range_length_falls_back_to_default() {
        ResolvedToken zero = resolver.resolve(TokenSpec.builder("T").length(0).build(), TokenContext.empty());
        ResolvedToken huge = resolver.resolve(TokenSpec.builder("T").length(5000).build(), TokenContext.empty());

        assertEquals(TokenLimits.LENGTH_DEFAULT, zero.getLength());
        assertEquals(TokenLimits.LENGTH_DEFAULT, huge.getLength());
        assertTrue(zero.getWarnings().contains(ResolutionWarning.LENGTH_OUT_OF_RANGE));
    }

    @Test
    public void ttl_is_clamped() {
        ResolvedToken negative = resolver.resolve(TokenSpec.builder("T").ttlSeconds(-10).build(), TokenContext.empty());
        ResolvedToken large = resolver.resolve(TokenSpec.builder("T").ttlSeconds(100_000).build(), TokenContext.empty());

        assertEquals(0, negative.getTtlSeconds());
        assertTrue(negative.getWarnings().contains(ResolutionWarning.TTL_NEGATIVE));
        assertEquals(TokenLimits.TTL_MAX_SECONDS, large.getTtlSeconds());
        assertTrue(large.getWarnings().contains(ResolutionWarning.TTL_CLAMPED));
    }

    @Test
    public void custom_without_alphabet_demotes_to_base64() {
        TokenContext ctx = TokenContext.builder().format(TokenFormat.CUSTOM).build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertEquals(TokenFormat.BASE64, t.getFormat());
        assertNull(t.getAlphabet());
        assertTrue(t.getWarnings().contains(ResolutionWarning.ALPHABET_MISSING));
    }

    @Test
    public void custom_with_invalid_alphabet_demotes_to_base64() {
        TokenContext ctx = TokenContext.builder().format(TokenFormat.CUSTOM).alphabet("AAB").build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertEquals(TokenFormat.BASE64, t.getFormat());
        assertTrue(t.getWarnings().contains(ResolutionWarning.ALPHABET_INVALID));
    }

    @Test
    public void custom_alphabet_and_grouping_are_kept() {
        TokenContext ctx = TokenContext.builder().format(TokenFormat.CUSTOM).alphabet("ABCD").grouping(4).build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertEquals(TokenFormat.CUSTOM, t.getFormat());
        assertEquals("ABCD", t.getAlphabet());
        assertEquals(4, t.getGrouping());
        assertTrue(t.getWarnings().isEmpty());
    }

    @Test
    public void grouping_is_clamped() {
        TokenContext ctx = TokenContext.builder().format(TokenFormat.CUSTOM).alphabet("ABCD").grouping(500).build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertEquals(TokenLimits.GROUPING_MAX, t.getGrouping());
        assertTrue(t.getWarnings().contains(ResolutionWarning.GROUPING_CLAMPED));
    }

    @Test
    public void metadata_requires_expiry() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).signingKey("k").build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertFalse(t.isEncodeMetadata());
        assertTrue(t.getWarnings().contains(ResolutionWarning.METADATA_WITHOUT_EXPIRY));
    }

    @Test
    public void metadata_without_key_is_unsigned_with_warning() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(60).build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertTrue(t.isEncodeMetadata());
        assertEquals(60, t.getExpirySeconds());
        assertFalse(t.getSigningKey().isPresent());
        assertTrue(t.getWarnings().contains(ResolutionWarning.SIGNING_KEY_MISSING));
    }

    @Test
    public void blank_signing_key_counts_as_missing() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(60).signingKey("  \t").build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertTrue(t.isEncodeMetadata());
        assertFalse(t.getSigningKey().isPresent());
        assertTrue(t.getWarnings().contains(ResolutionWarning.SIGNING_KEY_MISSING));
    }

    @Test
    public void ttl_longer_than_metadata_expiry_is_reported() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(60).signingKey("k").build();

        ResolvedToken longTtl = resolver.resolve(TokenSpec.builder("T").ttlSeconds(300).build(), ctx);
        ResolvedToken shortTtl = resolver.resolve(TokenSpec.builder("U").ttlSeconds(30).build(), ctx);

        assertTrue(longTtl.getWarnings().contains(ResolutionWarning.TTL_EXCEEDS_EXPIRY));
        assertFalse(shortTtl.getWarnings().contains(ResolutionWarning.TTL_EXCEEDS_EXPIRY));
    }

    @Test
    public void expiry_is_clamped() {
        TokenContext ctx = TokenContext.builder().encodeMetadata(true).expirySeconds(Integer.MAX_VALUE).signingKey("k").build();

        ResolvedToken t = resolver.resolve(TokenSpec.builder("T").build(), ctx);

        assertEquals(TokenLimits.EXPIRY_MAX_SECONDS, t.getExpirySeconds());
        assertTrue(t.getWarnings().contains(ResolutionWarning.EXPIRY_CLAMPED));
        assertTrue(t.isEncodeMetadata());
        assertEquals("k", t.getSigningKey().get());
    }
}
