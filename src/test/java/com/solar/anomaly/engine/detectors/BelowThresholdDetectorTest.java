package com.solar.anomaly.engine.detectors;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.solar.anomaly.testutil.TestDataFactory.START;
import static com.solar.anomaly.testutil.TestDataFactory.createUnit;
import static com.solar.anomaly.testutil.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;

class BelowThresholdDetectorTest {

    private final BelowThresholdDetector detector = new BelowThresholdDetector(new DetectionConfig());

    @Test
    void majorityOfProducingDaysBelowTwentyPercent_isFlagged() {
        // capacity 5000 -> baseline 20000, threshold 4000
        List<AnomalyFinding> findings = detector.detect(
                series(3000, 3500, 20000, 3000), createUnit("SU-1", 5000));

        assertThat(findings).hasSize(1);
        AnomalyFinding finding = findings.get(0);
        assertThat(finding.getAnomalyType()).isEqualTo(AnomalyType.BELOW_THRESHOLD);
        assertThat(finding.getAffectedPeriod().startDate()).isEqualTo(START);
        assertThat(finding.getAffectedPeriod().endDate()).isEqualTo(START.plusDays(3));
        assertThat(finding.getDetectionDetails().getExpectedValue()).isEqualTo(20000.0);
        assertThat(finding.getDetectionDetails().getActualValue()).isEqualTo(7375.0);
        assertThat(finding.getDetectionDetails().getContext())
                .containsEntry("belowThresholdDays", 3)
                .containsEntry("nonZeroDays", 4);
        assertThat(finding.getEstimatedEnergyLoss()).isNull();
    }

    @Test
    void zeroDays_doNotCountAsBelowThreshold() {
        assertThat(detector.detect(series(0, 0, 0, 20000, 3000), createUnit("SU-1", 5000)))
                .hasSize(1);
        assertThat(detector.detect(series(0, 0, 0, 20000, 20000, 3000), createUnit("SU-1", 5000)))
                .isEmpty();
    }

    @Test
    void dayExactlyAtThreshold_isNotBelow() {
        assertThat(detector.detect(series(4000, 4000, 20000, 3000), createUnit("SU-1", 5000))).isEmpty();

        List<AnomalyFinding> findings = detector.detect(series(4000, 3999, 20000, 3000), createUnit("SU-1", 5000));
        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getDetectionDetails().getContext()).containsEntry("belowThresholdDays", 2);
    }

    @Test
    void allZeroSeries_producesNothing() {
        assertThat(detector.detect(series(0, 0, 0, 0), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void minorityBelowThreshold_isNotFlagged() {
        assertThat(detector.detect(series(3000, 20000, 21000, 19000), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void fewerThanThreeDays_producesNothing() {
        assertThat(detector.detect(series(3000, 3000), createUnit("SU-1", 5000))).isEmpty();
    }
}
