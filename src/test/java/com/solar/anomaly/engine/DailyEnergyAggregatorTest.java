package com.solar.anomaly.engine;

import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.EnergyReading;
import com.solar.anomaly.repository.EnergyReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailyEnergyAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-10-15T09:30:00Z");

    @Mock private EnergyReadingRepository readingRepository;

    private DailyEnergyAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new DailyEnergyAggregator(readingRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void aggregate_queriesTrailingWindowUpToEndOfToday() {
        long from = Instant.parse("2026-10-01T00:00:00Z").toEpochMilli();
        long to = Instant.parse("2026-10-16T00:00:00Z").toEpochMilli();
        when(readingRepository.findByUnitBetween("SU-1", from, to)).thenReturn(List.of());

        assertThat(aggregator.aggregate("SU-1", 14)).isEmpty();
        verify(readingRepository).findByUnitBetween("SU-1", from, to);
    }

    @Test
    void aggregate_rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> aggregator.aggregate("SU-1", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sumByDay_groupsByUtcDateInAscendingOrder() {
        List<DailyAggregate> series = DailyEnergyAggregator.sumByDay(List.of(
                reading("2026-10-03T10:00:00Z", 5.0),
                reading("2026-10-02T23:59:59Z", 1.5),
                reading("2026-10-02T00:00:00Z", 2.5),
                reading("2026-10-03T12:00:00Z", 4.0)));

        assertThat(series).containsExactly(
                new DailyAggregate(LocalDate.of(2026, 10, 2), 4.0),
                new DailyAggregate(LocalDate.of(2026, 10, 3), 9.0));
    }

    @Test
    void sumByDay_keepsReportedZeroDaysAndOmitsMissingDays() {
        List<DailyAggregate> series = DailyEnergyAggregator.sumByDay(List.of(
                reading("2026-10-01T10:00:00Z", 0.0),
                reading("2026-10-04T10:00:00Z", 3.0)));

        assertThat(series).extracting(DailyAggregate::date)
                .containsExactly(LocalDate.of(2026, 10, 1), LocalDate.of(2026, 10, 4));
        assertThat(series.get(0).totalEnergy()).isZero();
    }

    @Test
    void sumByDay_clampsNegativeReadingsToZero() {
        List<DailyAggregate> series = DailyEnergyAggregator.sumByDay(List.of(
                reading("2026-10-01T10:00:00Z", -7.0),
                reading("2026-10-01T12:00:00Z", 2.0)));

        assertThat(series).containsExactly(new DailyAggregate(LocalDate.of(2026, 10, 1), 2.0));
    }

    private static EnergyReading reading(String instant, double energy) {
        return EnergyReading.builder()
                .readingId(instant)
                .unitId("SU-1")
                .timestamp(Instant.parse(instant).toEpochMilli())
                .energyGenerated(energy)
                .build();
    }
}
