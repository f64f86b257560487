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
import static org.assertj.core.api.Assertions.within;

class SignificantDropDetectorTest {

    private final SignificantDropDetector detector = new SignificantDropDetector(new DetectionConfig());

    @Test
    void dayAtFortyPercentOfAverage_flaggedWithSixtyPercentDeviation() {
        List<AnomalyFinding> findings = detector.detect(
                series(115, 115, 115, 115, 40), createUnit("SU-1", 5000));

        assertThat(findings).hasSize(1);
        AnomalyFinding finding = findings.get(0);
        assertThat(finding.getAnomalyType()).isEqualTo(AnomalyType.SIGNIFICANT_DROP);
        assertThat(finding.getAffectedPeriod().startDate()).isEqualTo(START.plusDays(4));
        assertThat(finding.getDetectionDetails().getDeviationPercent()).isCloseTo(60.0, within(1e-9));
        assertThat(finding.getDetectionDetails().getExpectedValue()).isCloseTo(100.0, within(1e-9));
        assertThat(finding.getDetectionDetails().getContext()).containsEntry("windowSize", 5);
        assertThat(finding.getEstimatedEnergyLoss()).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void dropOfExactlyFiftyPercent_isNotFlagged() {
        // mean 100, day at 50
        assertThat(detector.detect(series(125, 125, 50), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void zeroDays_areLeftToZeroProduction() {
        assertThat(detector.detect(series(100, 100, 100, 0), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void fewerThanThreeDays_producesNothing() {
        assertThat(detector.detect(series(100, 10), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void allZeroSeries_producesNothing() {
        assertThat(detector.detect(series(0, 0, 0), createUnit("SU-1", 5000))).isEmpty();
    }
}
