package com.solar.anomaly.engine;

import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.EnergyReading;
import com.solar.anomaly.repository.EnergyReadingRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collapses raw readings of a unit into one total per UTC calendar day over
 * the trailing window {@code [today - windowDays, today]}.
 */
@Component
public class DailyEnergyAggregator {

    private final EnergyReadingRepository readingRepository;
    private final Clock clock;

    public DailyEnergyAggregator(EnergyReadingRepository readingRepository, Clock clock) {
        this.readingRepository = readingRepository;
        this.clock = clock;
    }

    public List<DailyAggregate> aggregate(String unitId, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1, got " + windowDays);
        }
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate firstDay = today.minusDays(windowDays);

        long fromInclusive = firstDay.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        long toExclusive = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

        return sumByDay(readingRepository.findByUnitBetween(unitId, fromInclusive, toExclusive));
    }

    static List<DailyAggregate> sumByDay(List<EnergyReading> readings) {
        Map<LocalDate, Double> totals = new TreeMap<>();
        for (EnergyReading reading : readings) {
            LocalDate day = Instant.ofEpochMilli(reading.getTimestamp()).atZone(ZoneOffset.UTC).toLocalDate();
            // Negative values are meter glitches; the day still counts as reported.
            double energy = Math.max(0.0, reading.getEnergyGenerated());
            totals.merge(day, energy, Double::sum);
        }

        List<DailyAggregate> series = new ArrayList<>(totals.size());
        totals.forEach((day, total) -> series.add(new DailyAggregate(day, total)));
        return series;
    }
}
