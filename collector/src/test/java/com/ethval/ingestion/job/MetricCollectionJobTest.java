package com.ethval.ingestion.job;

import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.common.RunDeadline;
import com.ethval.domain.CollectionStatus.CollectionStatusValue;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.config.CollectorProperties;
import com.ethval.ingestion.resolver.AllTiersExhaustedException;
import com.ethval.ingestion.resolver.QualityTag;
import com.ethval.ingestion.resolver.ResolvedSeries;
import com.ethval.ingestion.resolver.TierOutcome;
import com.ethval.ingestion.resolver.TieredResolver;
import com.ethval.ingestion.status.CollectionLogWriter;
import com.ethval.ingestion.status.CollectionStatusTracker;
import com.ethval.ingestion.status.StatusFields;
import com.ethval.ingestion.store.IdempotentBatchWriter;
import com.ethval.ingestion.store.WriteFailureException;
import com.ethval.ingestion.store.WriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricCollectionJobTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 9);
    private static final MetricDefinition METRIC = MetricDefinition.builder("ethereum_tvl")
            .schema(RecordSchema.of(FieldSpec.decimal("tvl_usd", 2)))
            .build();

    @Mock
    private TieredResolver resolver;
    @Mock
    private IdempotentBatchWriter writer;
    @Mock
    private CollectionStatusTracker statusTracker;
    @Mock
    private CollectionLogWriter logWriter;

    private MetricCollectionJob job;
    private RunDeadline deadline;

    @BeforeEach
    void setUp() {
        CollectorProperties properties = new CollectorProperties();
        properties.setDaysToFetch(3);
        Clock clock = Clock.fixed(Instant.parse("2024-03-09T05:00:00Z"), ZoneOffset.UTC);
        job = new MetricCollectionJob(resolver, writer, statusTracker, logWriter, properties, clock);
        deadline = RunDeadline.unbounded(clock);
    }

    private static List<MetricRecord> records() {
        return List.of(
                new MetricRecord(TODAY.minusDays(2), null, null, Map.of("tvl_usd", new BigDecimal("1.5")), "defillama"),
                new MetricRecord(TODAY.minusDays(1), null, null, Map.of("tvl_usd", new BigDecimal("1.6")), "defillama"),
                new MetricRecord(TODAY, null, null, Map.of("tvl_usd", new BigDecimal("1.7")), "estimated"));
    }

    private StatusFields savedStatus(CollectionStatusValue expected) {
        ArgumentCaptor<StatusFields> captor = ArgumentCaptor.forClass(StatusFields.class);
        verify(statusTracker).update(eq("ethereum_tvl"), eq(expected), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("a clean series is written and recorded as SUCCESS with count and range")
    void successfulRun() {
        ResolvedSeries series = new ResolvedSeries(records(), QualityTag.SUCCESS, List.of(),
                List.of(new TierOutcome(null, "defillama", 3, 3, 0, 3, null)));
        when(resolver.resolve(eq(METRIC), any(FetchContext.class))).thenReturn(series);
        when(writer.write(METRIC, series.records(), deadline))
                .thenReturn(new WriteResult(3, 1, TODAY.minusDays(2), TODAY));

        MetricRunOutcome outcome = job.run(METRIC, deadline);

        assertThat(outcome.status()).isEqualTo(CollectionStatusValue.SUCCESS);
        assertThat(outcome.recordCount()).isEqualTo(3);
        StatusFields fields = savedStatus(CollectionStatusValue.SUCCESS);
        assertThat(fields.recordCount()).isEqualTo(3);
        assertThat(fields.dateFrom()).isEqualTo(TODAY.minusDays(2));
        assertThat(fields.dateTo()).isEqualTo(TODAY);
        assertThat(fields.lastWarning()).isNull();
        verify(logWriter).info(eq("ethereum_tvl"), eq("Collected 3 records"), anyMap());
        verify(logWriter, never()).warning(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("the collection window ends today and spans days-to-fetch")
    void windowEndsToday() {
        ResolvedSeries series = new ResolvedSeries(records(), QualityTag.SUCCESS, List.of(), List.of());
        when(resolver.resolve(eq(METRIC), any(FetchContext.class))).thenReturn(series);
        when(writer.write(any(), any(), any())).thenReturn(new WriteResult(3, 1, TODAY.minusDays(2), TODAY));

        job.run(METRIC, deadline);

        ArgumentCaptor<FetchContext> captor = ArgumentCaptor.forClass(FetchContext.class);
        verify(resolver).resolve(eq(METRIC), captor.capture());
        assertThat(captor.getValue().window().from()).isEqualTo(TODAY.minusDays(2));
        assertThat(captor.getValue().window().to()).isEqualTo(TODAY);
        assertThat(captor.getValue().dimension()).isNull();
    }

    @Test
    @DisplayName("an estimated series is stored as PARTIAL with the estimate warning")
    void estimatedMapsToPartial() {
        ResolvedSeries series = new ResolvedSeries(records(), QualityTag.ESTIMATED,
                List.of("1 of 3 records are estimated"), List.of());
        when(resolver.resolve(eq(METRIC), any(FetchContext.class))).thenReturn(series);
        when(writer.write(any(), any(), any())).thenReturn(new WriteResult(3, 1, TODAY.minusDays(2), TODAY));

        MetricRunOutcome outcome = job.run(METRIC, deadline);

        assertThat(outcome.status()).isEqualTo(CollectionStatusValue.PARTIAL);
        assertThat(outcome.message()).isEqualTo("1 of 3 records are estimated");
        assertThat(savedStatus(CollectionStatusValue.PARTIAL).lastWarning()).isEqualTo("1 of 3 records are estimated");
        verify(logWriter).warning(eq("ethereum_tvl"), eq("1 of 3 records are estimated"), anyMap());
    }

    @Test
    @DisplayName("exhausted tiers become FAILED without writing")
    void exhaustedTiersFail() {
        when(resolver.resolve(eq(METRIC), any(FetchContext.class)))
                .thenThrow(new AllTiersExhaustedException("ethereum_tvl: all tiers failed"));

        MetricRunOutcome outcome = job.run(METRIC, deadline);

        assertThat(outcome.status()).isEqualTo(CollectionStatusValue.FAILED);
        assertThat(outcome.recordCount()).isZero();
        verify(writer, never()).write(any(), any(), any());
        verify(statusTracker).markFailed(eq("ethereum_tvl"), contains("all tiers failed"));
        verify(logWriter).error(eq("ethereum_tvl"), contains("all tiers failed"), anyMap());
    }

    @Test
    @DisplayName("a write failure is FAILED and a broken status store does not escape")
    void writeFailureWithBrokenStatusStore() {
        when(resolver.resolve(eq(METRIC), any(FetchContext.class)))
                .thenReturn(new ResolvedSeries(records(), QualityTag.SUCCESS, List.of(), List.of()));
        when(writer.write(any(), any(), any()))
                .thenThrow(new WriteFailureException("Batch 1 failed", 0, new IllegalStateException("timeout")));
        doThrow(new IllegalStateException("status store down")).when(statusTracker)
                .markFailed(anyString(), anyString());

        MetricRunOutcome outcome = job.run(METRIC, deadline);

        assertThat(outcome.status()).isEqualTo(CollectionStatusValue.FAILED);
        assertThat(outcome.message()).contains("WriteFailureException").contains("Batch 1 failed");
    }

    @Test
    @DisplayName("a cancelled run fails the metric before resolving")
    void cancelledBeforeStart() {
        deadline.cancel();

        MetricRunOutcome outcome = job.run(METRIC, deadline);

        assertThat(outcome.status()).isEqualTo(CollectionStatusValue.FAILED);
        assertThat(outcome.message()).contains("cancelled");
        verify(resolver, never()).resolve(any(), any());
    }

    @Test
    @DisplayName("skip records a FAILED status with the reason")
    void skipMarksFailed() {
        MetricRunOutcome outcome = job.skip(METRIC, "run cancelled");

        assertThat(outcome).isEqualTo(MetricRunOutcome.failed("ethereum_tvl", "run cancelled"));
        verify(statusTracker).markFailed("ethereum_tvl", "run cancelled");
    }
}
