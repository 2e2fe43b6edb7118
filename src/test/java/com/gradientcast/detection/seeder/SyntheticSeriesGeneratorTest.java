package com.gradientcast.detection.seeder;

import com.gradientcast.detection.engine.TimestampFormat;
import com.gradientcast.detection.engine.WindowManager;
import com.gradientcast.detection.model.Frequency;
import com.gradientcast.detection.model.RawDataPoint;
import com.gradientcast.detection.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticSeriesGeneratorTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Test
    void sameSeed_sameSeries() {
        List<Double> a = new SyntheticSeriesGenerator(7).trendSeries(50, SyntheticSeriesGenerator.Trend.LINEAR, 100, 1, 0.1);
        List<Double> b = new SyntheticSeriesGenerator(7).trendSeries(50, SyntheticSeriesGenerator.Trend.LINEAR, 100, 1, 0.1);

        assertThat(a).isEqualTo(b);
    }

    @Test
    void trendSeries_flatWithoutNoise_isConstant() {
        List<Double> values = new SyntheticSeriesGenerator(1)
                .trendSeries(5, SyntheticSeriesGenerator.Trend.FLAT, 42, 1, 0.0);

        assertThat(values).containsOnly(42.0);
    }

    @Test
    void timestamps_wireFormatOneStepApart() {
        List<String> timestamps = SyntheticSeriesGenerator.timestamps(3, START, Frequency.HOURLY);

        assertThat(timestamps).containsExactly("01/01/2024, 12:00 AM", "01/01/2024, 01:00 AM", "01/01/2024, 02:00 AM");
        assertThat(TimestampFormat.parse(timestamps.get(2))).isEqualTo(START.plusHours(2));
    }

    @Test
    void anomalySeries_flagsRequestedIndices() {
        SyntheticSeriesGenerator.AnomalySeries series = new SyntheticSeriesGenerator(3).anomalySeries(
                20, 1_000, List.of(4, 15, 99), 0.5, SyntheticSeriesGenerator.Direction.UP, 0.0);

        assertThat(series.getValues()).hasSize(20);
        assertThat(series.getAnomalyFlags().get(4)).isTrue();
        assertThat(series.getAnomalyFlags().get(15)).isTrue();
        assertThat(series.getAnomalyFlags().stream().filter(Boolean::booleanValue).count()).isEqualTo(2);
        // no noise: trend 1000 + t, plus 500 at the injected points
        assertThat(series.getValues().get(4)).isEqualTo(1_504.0);
        assertThat(series.getValues().get(5)).isEqualTo(1_005.0);
    }

    @Test
    void payload_parsesAsValidSeries() {
        List<RawDataPoint> payload = new SyntheticSeriesGenerator(42).payload(48, START, 1_500_000, true, 0.05);

        TimeSeries series = new WindowManager().parse("revenue", payload);

        assertThat(series.size()).isEqualTo(48);
        assertThat(payload.get(0).getValue()).isInstanceOf(Long.class);
    }
}
