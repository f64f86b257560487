package com.solar.anomaly.engine.detectors;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DailyAggregate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.solar.anomaly.testutil.TestDataFactory.START;
import static com.solar.anomaly.testutil.TestDataFactory.createUnit;
import static com.solar.anomaly.testutil.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GradualDegradationDetectorTest {

    private final GradualDegradationDetector detector = new GradualDegradationDetector(new DetectionConfig());

    @Test
    void steadyDeclineOverFourteenDays_isFlaggedOverTheWholeWindow() {
        double[] totals = new double[14];
        for (int i = 0; i < totals.length; i++) {
            totals[i] = 500 - 10 * i;
        }

        List<AnomalyFinding> findings = detector.detect(series(totals), createUnit("SU-1", 5000));

        assertThat(findings).hasSize(1);
        AnomalyFinding finding = findings.get(0);
        assertThat(finding.getAnomalyType()).isEqualTo(AnomalyType.GRADUAL_DEGRADATION);
        assertThat(finding.getAffectedPeriod().startDate()).isEqualTo(START);
        assertThat(finding.getAffectedPeriod().endDate()).isEqualTo(START.plusDays(13));
        assertThat(finding.getDetectionDetails().getExpectedValue()).isEqualTo(500.0);
        assertThat(finding.getDetectionDetails().getActualValue()).isEqualTo(370.0);
        assertThat((double) finding.getDetectionDetails().getContext().get("slope")).isCloseTo(-10.0, within(1e-9));
        // 130 over a mean of 435
        assertThat(finding.getDetectionDetails().getDeviationPercent()).isCloseTo(29.885, within(0.001));
        assertThat(finding.getEstimatedEnergyLoss()).isNull();
    }

    @Test
    void flatSeries_isNotFlagged() {
        assertThat(detector.detect(series(400, 400, 400, 400, 400, 400, 400), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void risingSeries_isNotFlagged() {
        assertThat(detector.detect(series(300, 310, 320, 330, 340, 350, 360), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void smallDecline_isNotFlagged() {
        // slope -1 over 6 days on a mean of 397
        assertThat(detector.detect(series(400, 399, 398, 397, 396, 395, 394), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void declineOfExactlyFifteenPercent_isNotFlagged() {
        // slope -10 over 6 days on a mean of 400
        assertThat(detector.detect(series(430, 420, 410, 400, 390, 380, 370), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void fewerThanSevenDays_producesNothing() {
        assertThat(detector.detect(series(500, 400, 300, 200, 100, 50), createUnit("SU-1", 5000))).isEmpty();
    }

    @Test
    void calendarGaps_stretchTheRegressionAxis() {
        List<DailyAggregate> gapped = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            gapped.add(new DailyAggregate(START.plusDays(i * 2L), 500 - 20 * i));
        }

        List<AnomalyFinding> findings = detector.detect(gapped, createUnit("SU-1", 5000));

        assertThat(findings).hasSize(1);
        assertThat((double) findings.get(0).getDetectionDetails().getContext().get("slope"))
                .isCloseTo(-10.0, within(1e-9));
        assertThat(findings.get(0).getAffectedPeriod().endDate()).isEqualTo(START.plusDays(12));
    }
}
