package com.aegis.rulegov.sampling;

import com.aegis.rulegov.api.StratumQuery;
import com.aegis.rulegov.api.TransactionRecordStore;
import com.aegis.rulegov.api.exceptions.SampleUnavailableException;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.Sample;
import com.aegis.rulegov.api.model.SampleFilter;
import com.aegis.rulegov.api.model.Stratum;
import com.aegis.rulegov.api.model.TransactionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StratifiedSamplerTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2025-03-12T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ExecutorService executor = Executors.newFixedThreadPool(5);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static TransactionRecord txn(String id, Duration age, double amount, int hour, boolean flagged,
                                         String device) {
        return new TransactionRecord(id, NOW.minus(age), Decision.ALLOW,
                Map.of("amount", amount, "hour", hour, "flagged", flagged, "disputed", false, "device", device));
    }

    /** Store that answers with the reference predicate over a fixed list. */
    private static TransactionRecordStore storeOf(List<TransactionRecord> records, List<StratumQuery> seen) {
        return query -> {
            seen.add(query);
            return records.stream().filter(query::matches).limit(query.limit()).toList();
        };
    }

    @Test
    @DisplayName("Should split the requested size 30/15/20/15/20")
    void shouldAllocateShares() {
        assertThat(SamplerSettings.defaults().allocate(100)).containsExactlyInAnyOrderEntriesOf(Map.of(
                Stratum.RECENT, 30, Stratum.WEEKEND_OFF_HOURS, 15, Stratum.FLAGGED_DISPUTED, 20,
                Stratum.HIGH_VALUE, 15, Stratum.RANDOM, 20));
        assertThat(SamplerSettings.defaults().allocate(7).values().stream().mapToInt(Integer::intValue).sum())
                .isEqualTo(7);
    }

    @Test
    @DisplayName("Should deduplicate records found by several strata and keep the first tag")
    void shouldDeduplicateAcrossStrata() {
        // Given
        List<StratumQuery> seen = new CopyOnWriteArrayList<>();
        List<TransactionRecord> records = List.of(
                txn("a", Duration.ofDays(1), 100, 12, false, "web"),
                txn("b", Duration.ofDays(2), 8000, 10, true, "mobile"),
                txn("c", Duration.ofDays(45), 50, 14, true, "web"),
                txn("d", Duration.ofDays(100), 9000, 2, true, "web"));
        StratifiedSampler sampler = new StratifiedSampler(storeOf(records, seen), SamplerSettings.defaults(),
                executor, CLOCK);

        // When
        Sample sample = sampler.sample(100);

        // Then
        assertThat(sample.entries()).extracting(e -> e.record().id()).containsExactly("a", "b", "c");
        assertThat(sample.entries()).extracting(Sample.Entry::stratum)
                .containsExactly(Stratum.RECENT, Stratum.RECENT, Stratum.FLAGGED_DISPUTED);
        assertThat(sample.requestedSize()).isEqualTo(100);
        assertThat(sample.stratumCounts()).containsEntry(Stratum.HIGH_VALUE, 0).containsEntry(Stratum.RANDOM, 0);
        assertThat(seen).hasSize(5);
        assertThat(seen).filteredOn(q -> q.stratum() == Stratum.FLAGGED_DISPUTED).singleElement()
                .satisfies(q -> {
                    assertThat(q.limit()).isEqualTo(20);
                    assertThat(q.since()).isEqualTo(NOW.minus(Duration.ofDays(60)));
                });
    }

    @Test
    @DisplayName("Should pass the filter to every stratum")
    void shouldApplyFilter() {
        List<StratumQuery> seen = new CopyOnWriteArrayList<>();
        List<TransactionRecord> records = List.of(
                txn("a", Duration.ofDays(1), 100, 12, false, "web"),
                txn("b", Duration.ofDays(2), 8000, 22, true, "mobile"));
        StratifiedSampler sampler = new StratifiedSampler(storeOf(records, seen), SamplerSettings.defaults(),
                Runnable::run, CLOCK);

        Sample sample = sampler.sample(50, new SampleFilter("mobile", null, null, null, null));

        assertThat(sample.records()).extracting(TransactionRecord::id).containsExactly("b");
        assertThat(seen).allSatisfy(q -> assertThat(q.filter().device()).isEqualTo("mobile"));
    }

    @Test
    @DisplayName("Should report the sample as unavailable when a stratum query fails")
    void shouldFailWhenStoreFails() {
        TransactionRecordStore broken = query -> {
            if (query.stratum() == Stratum.HIGH_VALUE) {
                throw new IllegalStateException("connection refused");
            }
            return List.of();
        };
        StratifiedSampler sampler = new StratifiedSampler(broken, SamplerSettings.defaults(), executor, CLOCK);

        assertThatThrownBy(() -> sampler.sample(100))
                .isInstanceOf(SampleUnavailableException.class)
                .hasRootCauseMessage("connection refused");
    }

    @Test
    @DisplayName("Should report the sample as unavailable when no records exist")
    void shouldFailOnEmptyUnion() {
        StratifiedSampler sampler = new StratifiedSampler(query -> List.of(), SamplerSettings.defaults(),
                executor, CLOCK);

        assertThatThrownBy(() -> sampler.sample(100)).isInstanceOf(SampleUnavailableException.class);
    }

    @Test
    @DisplayName("Should reject shares that do not sum to one")
    void shouldValidateShares() {
        assertThatThrownBy(() -> SamplerSettings.withShares(0.5, 0.5, 0.5, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
