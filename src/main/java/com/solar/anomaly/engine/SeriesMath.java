package com.solar.anomaly.engine;

import com.solar.anomaly.model.DailyAggregate;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Small numeric helpers shared by detectors.
 */
public final class SeriesMath {

    private SeriesMath() {}

    public static double mean(List<DailyAggregate> series) {
        if (series.isEmpty()) return 0.0;
        double sum = 0.0;
        for (DailyAggregate day : series) {
            sum += day.totalEnergy();
        }
        return sum / series.size();
    }

    /**
     * Ordinary least squares slope of total energy against x, where x is the
     * number of calendar days since the first aggregate. Gaps in the series
     * therefore stretch the x axis instead of being collapsed.
     *
     * @return slope in energy per day, or NaN when all points share one x
     */
    public static double slope(List<DailyAggregate> series) {
        int n = series.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (DailyAggregate day : series) {
            double x = dayOffset(series, day);
            double y = day.totalEnergy();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += x * x;
        }
        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) return Double.NaN;
        return (n * sumXY - sumX * sumY) / denominator;
    }

    /**
     * Calendar days from the first to the last aggregate.
     */
    public static long spanDays(List<DailyAggregate> series) {
        if (series.isEmpty()) return 0;
        return dayOffset(series, series.get(series.size() - 1));
    }

    private static long dayOffset(List<DailyAggregate> series, DailyAggregate day) {
        return ChronoUnit.DAYS.between(series.get(0).date(), day.date());
    }
}
