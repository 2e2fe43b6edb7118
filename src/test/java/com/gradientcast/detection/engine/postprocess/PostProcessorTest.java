package com.gradientcast.detection.engine.postprocess;

import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Severity;
import com.gradientcast.detection.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.gradientcast.detection.testutil.TestDataFactory.candidate;
import static org.assertj.core.api.Assertions.assertThat;

class PostProcessorTest {

    private final PostProcessor postProcessor = new PostProcessor();

    @Test
    void contiguityFilter_dropsShortRuns() {
        List<AnomalyCandidate> sequence = flags(true, true, false, true, false, true, true, true);

        assertThat(indices(postProcessor.contiguityFilter(sequence, 2))).containsExactly(0, 1, 5, 6, 7);
        assertThat(indices(postProcessor.contiguityFilter(sequence, 3))).containsExactly(5, 6, 7);
        assertThat(indices(postProcessor.contiguityFilter(sequence, 4))).isEmpty();
    }

    @Test
    void contiguityFilter_minOne_keepsEveryCandidate() {
        List<AnomalyCandidate> sequence = flags(true, false, true, false, false, true);

        List<AnomalyCandidate> confirmed = postProcessor.contiguityFilter(sequence, 1);

        assertThat(confirmed).isEqualTo(sequence.stream().filter(AnomalyCandidate::isCandidate)
                .collect(Collectors.toList()));
    }

    @Test
    void valleyFilter_lowValueLosesCandidacyButKeepsPosition() {
        List<AnomalyCandidate> sequence = List.of(
                candidate(0, 100, 90, true),
                candidate(1, 5, 90, true),
                candidate(2, 100, 90, true));

        List<AnomalyCandidate> filtered = postProcessor.valleyFilter(sequence, 10);

        assertThat(filtered).hasSize(3);
        assertThat(filtered).extracting(AnomalyCandidate::isCandidate).containsExactly(true, false, true);
    }

    @Test
    void process_valleyPointBreaksRun() {
        List<AnomalyCandidate> sequence = List.of(
                candidate(0, 100, 90, true),
                candidate(1, 5, 90, true),
                candidate(2, 100, 90, true));

        assertThat(postProcessor.process(sequence, config(10, 2))).isEmpty();
        assertThat(postProcessor.process(sequence, config(0, 2))).hasSize(3);
    }

    @Test
    void process_raisingValleyThreshold_neverAddsAnomalies() {
        List<AnomalyCandidate> sequence = new ArrayList<>();
        double[] values = {120, 40, 80, 200, 10, 150, 160, 30, 90, 95};
        for (int i = 0; i < values.length; i++) {
            sequence.add(candidate(i, values[i], 60 + i, i != 4));
        }

        int previous = Integer.MAX_VALUE;
        for (double valley = 0; valley <= 250; valley += 10) {
            int count = postProcessor.process(sequence, config(valley, 2)).size();
            assertThat(count).as("valley %s", valley).isLessThanOrEqualTo(previous);
            previous = count;
        }
    }

    @Test
    void classify_mapsBandsAndDropsNone() {
        List<AnomalyCandidate> confirmed = List.of(
                candidate(0, 100, 29.9, true),
                candidate(1, 100, 30, true),
                candidate(2, 100, 50, true),
                candidate(3, 100, 70, true),
                candidate(4, 100, 85, true));

        List<AnomalyCandidate> classified = postProcessor.classify(confirmed);

        assertThat(classified).extracting(AnomalyCandidate::getSeverity)
                .containsExactly(Severity.LOW, Severity.MEDIUM, Severity.HIGH, Severity.CRITICAL);
    }

    @Test
    void process_keepsChronologicalOrder() {
        List<AnomalyCandidate> sequence = flags(true, true, true, false, true, true);

        assertThat(indices(postProcessor.process(sequence, config(0, 2)))).containsExactly(0, 1, 2, 4, 5);
    }

    private static ResolvedConfig config(double valleyThreshold, int minContiguous) {
        return TestDataFactory.resolvedConfigBuilder(DetectorType.DENSE_AD)
                .valleyThreshold(valleyThreshold)
                .minContiguousAnomalies(minContiguous)
                .build();
    }

    private static List<AnomalyCandidate> flags(boolean... flags) {
        List<AnomalyCandidate> sequence = new ArrayList<>(flags.length);
        for (int i = 0; i < flags.length; i++) {
            sequence.add(candidate(i, 1_000, flags[i] ? 75 : 20, flags[i]));
        }
        return sequence;
    }

    private static List<Integer> indices(List<AnomalyCandidate> candidates) {
        return candidates.stream().map(AnomalyCandidate::getSeriesIndex).collect(Collectors.toList());
    }
}
