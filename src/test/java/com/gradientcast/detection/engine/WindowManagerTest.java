package com.gradientcast.detection.engine;

import com.gradientcast.detection.exception.DetectionErrorType;
import com.gradientcast.detection.exception.InsufficientHistoryException;
import com.gradientcast.detection.exception.InvalidInputException;
import com.gradientcast.detection.model.EvaluationSpec;
import com.gradientcast.detection.model.RawDataPoint;
import com.gradientcast.detection.model.TimeSeries;
import com.gradientcast.detection.model.Window;
import com.gradientcast.detection.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WindowManagerTest {

    private final WindowManager windowManager = new WindowManager();

    @Test
    void parse_integerValues_coercedToDouble() {
        List<RawDataPoint> raw = List.of(
                RawDataPoint.of("03/01/2024, 12:00 AM", 5),
                RawDataPoint.of("03/01/2024, 01:00 AM", 7L),
                RawDataPoint.of("03/01/2024, 02:00 AM", 2.5));

        TimeSeries series = windowManager.parse("revenue", raw);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.getPoints().get(0).getValue()).isEqualTo(5.0);
        assertThat(series.getPoints().get(1).getValue()).isEqualTo(7.0);
        assertThat(series.last().getTimestamp()).isEqualTo(TestDataFactory.START.plusHours(2));
    }

    @Test
    void parse_emptySeries_throwsInvalidInput() {
        InvalidInputException e = catchThrowableOfType(
                () -> windowManager.parse("revenue", Collections.emptyList()), InvalidInputException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrorType()).isEqualTo(DetectionErrorType.INVALID_INPUT);
    }

    @Test
    void parse_unparsableTimestamp_throwsInvalidInput() {
        List<RawDataPoint> raw = new ArrayList<>(TestDataFactory.hourlySeries(1, 2));
        raw.add(RawDataPoint.of("2024-03-01 03:00", 3));

        assertThatThrownBy(() -> windowManager.parse("revenue", raw))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("position 2");
    }

    @Test
    void parse_duplicateTimestamp_throwsInvalidInput() {
        List<RawDataPoint> raw = List.of(
                RawDataPoint.of("03/01/2024, 12:00 AM", 1),
                RawDataPoint.of("03/01/2024, 12:00 AM", 2));

        assertThatThrownBy(() -> windowManager.parse("revenue", raw))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    void parse_decreasingTimestamp_throwsInvalidInput() {
        List<RawDataPoint> raw = List.of(
                RawDataPoint.of("03/01/2024, 02:00 AM", 1),
                RawDataPoint.of("03/01/2024, 01:00 AM", 2));

        assertThatThrownBy(() -> windowManager.parse("revenue", raw))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void parse_nonNumericValues_throwInvalidInput() {
        for (Object bad : new Object[] {"abc", "100", true, null, Double.NaN, Double.POSITIVE_INFINITY}) {
            List<RawDataPoint> raw = List.of(
                    RawDataPoint.of("03/01/2024, 12:00 AM", 1),
                    RawDataPoint.of("03/01/2024, 01:00 AM", bad));

            assertThatThrownBy(() -> windowManager.parse("revenue", raw))
                    .as("value %s", bad)
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    @Test
    void slice_latest_evaluatesLastPointOnly() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(30, 100, 1)));

        Window window = windowManager.slice(series, EvaluationSpec.latest(), 24);

        assertThat(window.contextSize()).isEqualTo(29);
        assertThat(window.evaluationSize()).isEqualTo(1);
        assertThat(window.evaluationRange().get(0).getValue()).isEqualTo(129.0);
    }

    @Test
    void slice_lastPoints_evaluatesTrailingPoints() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(30, 100, 1)));

        Window window = windowManager.slice(series, EvaluationSpec.lastPoints(5), 24);

        assertThat(window.getEvaluationStart()).isEqualTo(25);
        assertThat(window.evaluationSize()).isEqualTo(5);
        assertThat(window.context()).hasSize(25);
    }

    @Test
    void slice_returnWindow_includesPointsWithinHoursOfLast() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(30, 100, 1)));

        Window window = windowManager.slice(series, EvaluationSpec.returnWindow(2.0), 24);

        assertThat(window.evaluationSize()).isEqualTo(3);
        assertThat(window.evaluationRange().get(0).getValue()).isEqualTo(127.0);
    }

    @Test
    void slice_belowMinimumHistory_throwsInsufficientHistory() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(23, 100, 1)));

        assertThatThrownBy(() -> windowManager.slice(series, EvaluationSpec.latest(), 24))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessageContaining("need at least 24, but got 23");
    }

    @Test
    void slice_exactlyMinimumHistory_accepted() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(24, 100, 1)));

        Window window = windowManager.slice(series, EvaluationSpec.latest(), 24);

        assertThat(window.contextSize()).isEqualTo(23);
    }

    @Test
    void slice_rangeCoveringWholeSeries_throwsInsufficientHistory() {
        TimeSeries series = windowManager.parse("revenue", TestDataFactory.hourlySeries(TestDataFactory.linear(24, 100, 1)));

        assertThatThrownBy(() -> windowManager.slice(series, EvaluationSpec.lastPoints(24), 24))
                .isInstanceOf(InsufficientHistoryException.class);
    }
}
