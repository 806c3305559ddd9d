package com.aegis.rulegov.generation;

import com.aegis.rulegov.api.GeneratedRule;
import com.aegis.rulegov.api.GenerationRequest;
import com.aegis.rulegov.api.RuleGenerator;
import com.aegis.rulegov.api.exceptions.GenerationFailureException;
import com.aegis.rulegov.api.exceptions.GenerationFailureException.Reason;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.api.model.Rule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GuardedRuleGeneratorTest {

    private static final String INSTRUCTION = "Review mobile purchases above 5000";

    @Mock
    RuleGenerator upstream;

    private ExecutorService executor;
    private GenerationSettings settings;
    private GuardedRuleGenerator generator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        settings = new GenerationSettings("test-model", Duration.ofMillis(300), 2, Duration.ofMinutes(1),
                Duration.ofMinutes(30), 100, 10);
        generator = new GuardedRuleGenerator(upstream, settings, executor,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static GeneratedRule generated() {
        Rule rule = Rule.of("mobile-review", "Review large mobile purchases", Decision.REVIEW, null,
                Condition.leaf("amount", ">", 5000), Condition.leaf("device", "==", "mobile"));
        return new GeneratedRule(rule, new GenerationMetadata("test-model", null, false, 120, 300));
    }

    @Test
    @DisplayName("Should serve a repeated instruction from cache")
    void shouldCacheByContentHash() {
        when(upstream.generate(any())).thenReturn(generated());

        GeneratedRule first = generator.generate(new GenerationRequest(INSTRUCTION, "alice"));
        GeneratedRule second = generator.generate(new GenerationRequest("  " + INSTRUCTION + " ", "bob"));

        verify(upstream, times(1)).generate(any());
        assertThat(second.rule()).isEqualTo(first.rule());
        assertThat(first.metadata().cached()).isFalse();
        assertThat(second.metadata().cached()).isTrue();
        assertThat(first.metadata().promptHash()).isEqualTo(generator.promptHash(INSTRUCTION)).hasSize(64);
    }

    @Test
    @DisplayName("Should rate limit per caller")
    void shouldRateLimit() {
        when(upstream.generate(any())).thenReturn(generated());

        generator.generate(new GenerationRequest(INSTRUCTION + " one", "alice"));
        generator.generate(new GenerationRequest(INSTRUCTION + " two", "alice"));

        assertThatThrownBy(() -> generator.generate(new GenerationRequest(INSTRUCTION + " three", "alice")))
                .isInstanceOf(GenerationFailureException.class)
                .satisfies(e -> assertThat(((GenerationFailureException) e).reason()).isEqualTo(Reason.RATE_LIMITED));
        assertThat(generator.generate(new GenerationRequest(INSTRUCTION + " three", "bob"))).isNotNull();
    }

    @Test
    @DisplayName("Should fail with TIMEOUT when the upstream call hangs")
    void shouldTimeOut() {
        when(upstream.generate(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return generated();
        });

        assertThatThrownBy(() -> generator.generate(new GenerationRequest(INSTRUCTION, "alice")))
                .isInstanceOf(GenerationFailureException.class)
                .satisfies(e -> {
                    GenerationFailureException failure = (GenerationFailureException) e;
                    assertThat(failure.reason()).isEqualTo(Reason.TIMEOUT);
                    assertThat(failure.promptHash()).isEqualTo(generator.promptHash(INSTRUCTION));
                });
    }

    @Test
    @DisplayName("Should wrap unexpected upstream errors and keep typed failures")
    void shouldClassifyUpstreamErrors() {
        when(upstream.generate(any()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenThrow(new GenerationFailureException(Reason.MALFORMED_OUTPUT, null, "no tool call"));

        assertThatThrownBy(() -> generator.generate(new GenerationRequest(INSTRUCTION, "alice")))
                .isInstanceOf(GenerationFailureException.class)
                .satisfies(e -> assertThat(((GenerationFailureException) e).reason()).isEqualTo(Reason.UPSTREAM_ERROR));
        assertThatThrownBy(() -> generator.generate(new GenerationRequest(INSTRUCTION, "alice")))
                .isInstanceOf(GenerationFailureException.class)
                .satisfies(e -> {
                    GenerationFailureException failure = (GenerationFailureException) e;
                    assertThat(failure.reason()).isEqualTo(Reason.MALFORMED_OUTPUT);
                    assertThat(failure.promptHash()).isNotNull();
                });
    }

    @Test
    @DisplayName("Should refuse short instructions without calling upstream")
    void shouldRejectShortInstruction() {
        assertThatThrownBy(() -> generator.generate(new GenerationRequest("block", "alice")))
                .isInstanceOf(InvalidRequestException.class);
        verify(upstream, times(0)).generate(any());
    }
}
