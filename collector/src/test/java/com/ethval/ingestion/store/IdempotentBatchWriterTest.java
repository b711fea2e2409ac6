package com.ethval.ingestion.store;

import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.KeyDefinition;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.common.RunCancelledException;
import com.ethval.common.RunDeadline;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.config.CollectorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IdempotentBatchWriterTest {

    private static final MetricDefinition METRIC = MetricDefinition.builder("eth_price")
            .schema(RecordSchema.of(FieldSpec.decimal("price", 2)))
            .build();

    @Mock
    private MetricStore store;

    private IdempotentBatchWriter writer;

    @BeforeEach
    void setUp() {
        CollectorProperties properties = new CollectorProperties();
        properties.setBatchSize(500);
        writer = new IdempotentBatchWriter(store, properties);
    }

    private static List<MetricRecord> records(int n) {
        LocalDate start = LocalDate.of(2021, 1, 1);
        List<MetricRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new MetricRecord(start.plusDays(i), null, null, Map.of("price", BigDecimal.valueOf(1000 + i)),
                    "cryptocompare"));
        }
        return out;
    }

    private static RunDeadline open() {
        return RunDeadline.unbounded(Clock.systemUTC());
    }

    @Test
    @DisplayName("1200 records are written as batches of 500, 500 and 200")
    @SuppressWarnings("unchecked")
    void writesInBatches() {
        List<MetricRecord> records = records(1200);

        WriteResult result = writer.write(METRIC, records, open());

        ArgumentCaptor<List<MetricRecord>> batches = ArgumentCaptor.forClass(List.class);
        verify(store).ensureIndexes("historical_eth_price", KeyDefinition.dateOnly());
        verify(store, times(3)).upsert(eq("historical_eth_price"), batches.capture(), eq(KeyDefinition.dateOnly()));
        assertThat(batches.getAllValues()).extracting(List::size).containsExactly(500, 500, 200);
        assertThat(batches.getAllValues().get(1).get(0).getDate()).isEqualTo(LocalDate.of(2021, 1, 1).plusDays(500));
        assertThat(result.count()).isEqualTo(1200);
        assertThat(result.batches()).isEqualTo(3);
        assertThat(result.dateFrom()).isEqualTo(LocalDate.of(2021, 1, 1));
        assertThat(result.dateTo()).isEqualTo(LocalDate.of(2021, 1, 1).plusDays(1199));
    }

    @Test
    @DisplayName("a failing batch aborts the remaining ones and reports what was written before it")
    void failureAbortsRemainingBatches() {
        doNothing().doThrow(new IllegalStateException("write timeout")).when(store)
                .upsert(eq("historical_eth_price"), anyList(), any(KeyDefinition.class));

        assertThatThrownBy(() -> writer.write(METRIC, records(1200), open()))
                .isInstanceOfSatisfying(WriteFailureException.class, e -> {
                    assertThat(e.getWrittenBeforeFailure()).isEqualTo(500);
                    assertThat(e.getMessage()).contains("Batch 2").contains("write timeout");
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
        verify(store, times(2)).upsert(eq("historical_eth_price"), anyList(), any(KeyDefinition.class));
    }

    @Test
    @DisplayName("a cancelled run writes nothing")
    void cancelledRunStopsBeforeFirstBatch() {
        RunDeadline deadline = open();
        deadline.cancel();

        assertThatThrownBy(() -> writer.write(METRIC, records(10), deadline))
                .isInstanceOf(RunCancelledException.class);
        verify(store, never()).upsert(any(), anyList(), any());
    }

    @Test
    @DisplayName("an empty series touches nothing")
    void emptySeries() {
        WriteResult result = writer.write(METRIC, List.of(), open());

        assertThat(result.count()).isZero();
        verify(store, never()).ensureIndexes(any(), any());
    }

    @Test
    @DisplayName("the store error is wrapped even on the first batch")
    void firstBatchFailure() {
        doThrow(new IllegalStateException("down")).when(store)
                .upsert(eq("historical_eth_price"), anyList(), any(KeyDefinition.class));

        assertThatThrownBy(() -> writer.write(METRIC, records(3), open()))
                .isInstanceOfSatisfying(WriteFailureException.class,
                        e -> assertThat(e.getWrittenBeforeFailure()).isZero());
    }
}
