package com.gradientcast.detection.engine.postprocess;

import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-processing for the density path, applied in order to the chronological
 * candidates of the evaluation range:
 *
 * 1. Valley filter: a point with actual value below valley_threshold stops
 *    being a candidate, whatever its score. It stays in the sequence, so it
 *    breaks any run it sits in.
 * 2. Contiguity filter: runs of consecutive candidates shorter than
 *    min_contiguous_anomalies are dropped. A value of 1 keeps every candidate.
 * 3. Severity: normalized score mapped through {@link Severity#fromScore};
 *    points that classify as NONE are not emitted.
 */
@Component
public class PostProcessor {

    public List<AnomalyCandidate> process(List<AnomalyCandidate> evaluated, ResolvedConfig config) {
        List<AnomalyCandidate> afterValley = valleyFilter(evaluated, config.getValleyThreshold());
        List<AnomalyCandidate> confirmed = contiguityFilter(afterValley, config.getMinContiguousAnomalies());
        return classify(confirmed);
    }

    List<AnomalyCandidate> valleyFilter(List<AnomalyCandidate> evaluated, double valleyThreshold) {
        List<AnomalyCandidate> result = new ArrayList<>(evaluated.size());
        for (AnomalyCandidate c : evaluated) {
            if (c.isCandidate() && c.getActualValue() < valleyThreshold) {
                result.add(c.toBuilder().candidate(false).build());
            } else {
                result.add(c);
            }
        }
        return result;
    }

    /**
     * @return the candidates belonging to a run of at least {@code minRun}, chronological
     */
    List<AnomalyCandidate> contiguityFilter(List<AnomalyCandidate> sequence, int minRun) {
        List<AnomalyCandidate> confirmed = new ArrayList<>();
        List<AnomalyCandidate> run = new ArrayList<>();
        for (AnomalyCandidate c : sequence) {
            if (c.isCandidate()) {
                run.add(c);
                continue;
            }
            if (run.size() >= minRun) {
                confirmed.addAll(run);
            }
            run.clear();
        }
        if (run.size() >= minRun) {
            confirmed.addAll(run);
        }
        return confirmed;
    }

    List<AnomalyCandidate> classify(List<AnomalyCandidate> confirmed) {
        List<AnomalyCandidate> classified = new ArrayList<>(confirmed.size());
        for (AnomalyCandidate c : confirmed) {
            Severity severity = Severity.fromScore(c.getNormalizedScore());
            if (severity != Severity.NONE) {
                classified.add(c.toBuilder().severity(severity).build());
            }
        }
        return classified;
    }
}
