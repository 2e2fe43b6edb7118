package com.gradientcast.detection.engine;

import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.EvaluationSpec;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Window;

import java.util.List;

/**
 * Interface for the anomaly detectors.
 * Each implementation handles one {@link DetectorType}.
 */
public interface Detector {

    /**
     * The detector type this implementation handles.
     */
    DetectorType getSupportedType();

    /**
     * Shortest series this detector accepts under the given config.
     */
    int minimumHistory(ResolvedConfig config);

    /**
     * Which trailing points are evaluated under the given config.
     */
    EvaluationSpec evaluationSpec(ResolvedConfig config);

    /**
     * Score every point of the window's evaluation range.
     *
     * @param window  validated context + evaluation range
     * @param config  the dimension's resolved parameters
     * @param context per-dimension extras supplied with the request (e.g. an external baseline)
     * @return one candidate per evaluated point, chronological
     */
    List<AnomalyCandidate> evaluate(Window window, ResolvedConfig config, EvaluationContext context);
}
