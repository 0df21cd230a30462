package com.work.token.core;

import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.model.TokenFailureReason;
import com.work.token.core.model.TokenResult;
import com.work.token.core.support.metrics.TokenMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

public class TokenFacadeTest {

    private TokenGenerator generator;
    private TokenMetrics metrics;
    private TokenFacade facade;

    @BeforeEach
    public void setUp() {
        generator = mock(TokenGenerator.class);
        metrics = mock(TokenMetrics.class);
        facade = new TokenFacade(generator, metrics);
    }

    @Test
    public void generates_in_configuration_order() {
        TokenSpec a = TokenSpec.builder("A").build();
        TokenSpec b = TokenSpec.builder("B").build();
        TokenContext ctx = TokenContext.builder().addToken(a).addToken(b).build();
        when(generator.generate(same(a), any())).thenReturn(TokenResult.generated("A", null, "va"));
        when(generator.generate(same(b), any())).thenReturn(TokenResult.generated("B", null, "vb"));

        List<TokenResult> results = facade.resolveAndGenerate(ctx, "/x");

        assertEquals(2, results.size());
        assertEquals("A", results.get(0).getName());
        assertEquals("B", results.get(1).getName());
    }

    @Test
    public void url_filter_skips_non_matching_subject() {
        TokenContext ctx = TokenContext.builder()
                .urlPattern(Pattern.compile("^/admin/secure"))
                .addToken(TokenSpec.builder("A").build())
                .build();

        assertTrue(facade.resolveAndGenerate(ctx, "/admin/public").isEmpty());
        assertTrue(facade.resolveAndGenerate(ctx, null).isEmpty());
        verifyNoInteractions(generator);
    }

    @Test
    public void url_filter_matches_anywhere_in_subject() {
        TokenSpec a = TokenSpec.builder("A").build();
        TokenContext ctx = TokenContext.builder().urlPattern(Pattern.compile("secure")).addToken(a).build();
        when(generator.generate(same(a), any())).thenReturn(TokenResult.generated("A", null, "va"));

        assertEquals(1, facade.resolveAndGenerate(ctx, "/admin/secure/page").size());
    }

    @Test
    public void one_failing_token_does_not_stop_the_others() {
        TokenSpec a = TokenSpec.builder("A").header("X-A").build();
        TokenSpec b = TokenSpec.builder("B").build();
        TokenSpec c = TokenSpec.builder("C").build();
        TokenContext ctx = TokenContext.builder().addToken(a).addToken(b).addToken(c).build();
        when(generator.generate(same(a), any())).thenThrow(new IllegalStateException("boom"));
        when(generator.generate(same(b), any()))
                .thenReturn(TokenResult.failed("B", null, TokenFailureReason.CSPRNG_UNAVAILABLE));
        when(generator.generate(same(c), any())).thenReturn(TokenResult.generated("C", null, "vc"));

        List<TokenResult> results = facade.resolveAndGenerate(ctx, "/");

        assertEquals(3, results.size());
        assertEquals(TokenFailureReason.INTERNAL_ERROR, results.get(0).getFailure().get());
        assertEquals("X-A", results.get(0).getHeader().get());
        assertEquals(TokenFailureReason.CSPRNG_UNAVAILABLE, results.get(1).getFailure().get());
        assertEquals("vc", results.get(2).getValue().get());
        verify(metrics).generation("error");
    }

    @Test
    public void empty_context_yields_no_results() {
        assertTrue(facade.resolveAndGenerate(TokenContext.empty(), "/").isEmpty());
    }
}
