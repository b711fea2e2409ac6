package com.ethval.ingestion.status;

import com.ethval.domain.CollectionStatus;
import com.ethval.domain.CollectionStatus.CollectionStatusValue;
import com.ethval.domain.CollectionStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollectionStatusTrackerTest {

    private static final Instant NOW = Instant.parse("2024-03-09T06:00:00Z");

    @Mock
    private CollectionStatusRepository statusRepository;

    private CollectionStatusTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new CollectionStatusTracker(statusRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CollectionStatus existing() {
        CollectionStatus row = new CollectionStatus();
        row.setId("s1");
        row.setDatasetName("eth_price");
        row.setStatus(CollectionStatusValue.SUCCESS);
        row.setRecordCount(1500);
        row.setDateFrom(LocalDate.of(2020, 1, 1));
        row.setDateTo(LocalDate.of(2024, 3, 8));
        row.setLastWarning("older warning");
        row.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        return row;
    }

    private CollectionStatus saved() {
        ArgumentCaptor<CollectionStatus> captor = ArgumentCaptor.forClass(CollectionStatus.class);
        verify(statusRepository).save(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("markFailed keeps the previous counts and range and records the error")
    void markFailedKeepsStoredFields() {
        when(statusRepository.findByDatasetName("eth_price")).thenReturn(Optional.of(existing()));

        tracker.markFailed("eth_price", "eth_price: all tiers failed");

        CollectionStatus row = saved();
        assertThat(row.getStatus()).isEqualTo(CollectionStatusValue.FAILED);
        assertThat(row.getLastError()).isEqualTo("eth_price: all tiers failed");
        assertThat(row.getRecordCount()).isEqualTo(1500);
        assertThat(row.getDateFrom()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(row.getLastWarning()).isEqualTo("older warning");
        assertThat(row.getLastRunAt()).isEqualTo(NOW);
        assertThat(row.getUpdatedAt()).isEqualTo(NOW);
        assertThat(row.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("update overwrites only the fields it is given")
    void updateOverwritesGivenFields() {
        when(statusRepository.findByDatasetName("eth_price")).thenReturn(Optional.of(existing()));

        tracker.update("eth_price", CollectionStatusValue.PARTIAL,
                new StatusFields(1600, LocalDate.of(2020, 1, 1), LocalDate.of(2024, 3, 9), null,
                        "12 of 1600 records are estimated"));

        CollectionStatus row = saved();
        assertThat(row.getStatus()).isEqualTo(CollectionStatusValue.PARTIAL);
        assertThat(row.getRecordCount()).isEqualTo(1600);
        assertThat(row.getDateTo()).isEqualTo(LocalDate.of(2024, 3, 9));
        assertThat(row.getLastWarning()).isEqualTo("12 of 1600 records are estimated");
        assertThat(row.getLastError()).isNull();
    }

    @Test
    @DisplayName("first update of an unknown dataset creates its row")
    void updateCreatesMissingRow() {
        when(statusRepository.findByDatasetName("fear_greed")).thenReturn(Optional.empty());

        tracker.update("fear_greed", CollectionStatusValue.SUCCESS, StatusFields.none());

        CollectionStatus row = saved();
        assertThat(row.getDatasetName()).isEqualTo("fear_greed");
        assertThat(row.getCreatedAt()).isEqualTo(NOW);
        assertThat(row.getStatus()).isEqualTo(CollectionStatusValue.SUCCESS);
    }

    @Test
    @DisplayName("seedIfMissing creates a PENDING row only when none exists")
    void seedIfMissing() {
        when(statusRepository.existsByDatasetName("eth_price")).thenReturn(true);
        when(statusRepository.existsByDatasetName("l2_tvl")).thenReturn(false);

        assertThat(tracker.seedIfMissing("eth_price")).isFalse();
        assertThat(tracker.seedIfMissing("l2_tvl")).isTrue();

        CollectionStatus row = saved();
        assertThat(row.getDatasetName()).isEqualTo("l2_tvl");
        assertThat(row.getStatus()).isEqualTo(CollectionStatusValue.PENDING);
        assertThat(row.getLastRunAt()).isNull();
    }

    @Test
    @DisplayName("seedIfMissing never overwrites an existing row")
    void seedLeavesExistingRow() {
        when(statusRepository.existsByDatasetName("eth_price")).thenReturn(true);

        tracker.seedIfMissing("eth_price");

        verify(statusRepository, never()).save(any());
    }
}
