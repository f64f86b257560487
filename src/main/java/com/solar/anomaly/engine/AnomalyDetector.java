package com.solar.anomaly.engine;

import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.SolarUnit;

import java.util.List;

/**
 * Interface for all anomaly detectors.
 * Each implementation handles a specific AnomalyType and must be free of side effects.
 */
public interface AnomalyDetector {

    /**
     * The anomaly type this detector produces.
     */
    AnomalyType getSupportedType();

    /**
     * Analyse a unit's daily series.
     *
     * @param series daily totals, ascending by date; days without readings are absent
     * @param unit   the unit being analysed (identity and rated capacity)
     * @return zero or more findings; an empty list when the series is too short
     */
    List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit);
}
