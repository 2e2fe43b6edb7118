package com.gradientcast.detection.engine.detectors;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.model.FeatureVector;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Neighbour-density scoring of feature vectors against a reference set.
 *
 * <p>Each feature dimension is scaled by its standard deviation over the
 * reference vectors (floored at epsilon). The distance between two vectors is
 * the Euclidean distance over the dimensions both of them carry, divided by the
 * square root of that dimension count so vectors with and without lag features
 * stay comparable.
 *
 * <p>Scoring:
 * <pre>
 *   k               = min(nNeighbors, references - 1), at least 1
 *   knn(x)          = mean distance from x to its k nearest references
 *   scale           = median of knn(r) over references r (each excluding itself)
 *   anomalyScore(x) = knn(x) / scale
 *   pivot           = (1 - contamination) quantile of anomalyScore(r) over references
 *   normalized(x)   = clamp(50 * anomalyScore(x) / pivot, 0, 100)
 * </pre>
 * A typical reference scores about 1.0; the pivot maps to 50, twice the pivot to 100.
 */
@Component
public class DensityScorer {

    public static final double DECISION_BOUNDARY = 50.0;

    private final double epsilon;

    public DensityScorer(DetectionProperties properties) {
        this.epsilon = properties.getFeatures().getEpsilon();
    }

    public DensityScores score(List<FeatureVector> references, List<FeatureVector> evaluated,
                               int nNeighbors, double contamination) {
        double[][] refs = coordinates(references);
        double[][] queries = coordinates(evaluated);
        double[] scales = dimensionScales(refs);
        // each reference excludes itself, so at most references - 1 neighbours exist
        int k = Math.max(1, Math.min(nNeighbors, refs.length - 1));

        double[] referenceKnn = new double[refs.length];
        for (int i = 0; i < refs.length; i++) {
            referenceKnn[i] = meanNearest(refs[i], refs, i, k, scales);
        }

        double medianDistance = Math.max(quantile(referenceKnn, 0.5), epsilon);

        double[] referenceScores = new double[refs.length];
        for (int i = 0; i < refs.length; i++) {
            referenceScores[i] = referenceKnn[i] / medianDistance;
        }
        double pivot = Math.max(quantile(referenceScores, 1.0 - contamination), epsilon);

        List<Double> anomalyScores = new ArrayList<>(queries.length);
        List<Double> normalizedScores = new ArrayList<>(queries.length);
        for (double[] query : queries) {
            double anomalyScore = meanNearest(query, refs, -1, k, scales) / medianDistance;
            anomalyScores.add(anomalyScore);
            normalizedScores.add(normalize(anomalyScore, pivot));
        }

        return new DensityScores(anomalyScores, normalizedScores, k, medianDistance, pivot);
    }

    static double normalize(double anomalyScore, double pivot) {
        double normalized = DECISION_BOUNDARY * anomalyScore / pivot;
        return Math.max(0.0, Math.min(100.0, normalized));
    }

    /**
     * Linear-interpolated quantile (q in [0, 1]) of the given values.
     */
    static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    double distance(double[] a, double[] b, double[] scales) {
        double sum = 0.0;
        int shared = 0;
        for (int d = 0; d < a.length; d++) {
            if (Double.isNaN(scales[d]) || Double.isNaN(a[d]) || Double.isNaN(b[d])) {
                continue;
            }
            double diff = (a[d] - b[d]) / scales[d];
            sum += diff * diff;
            shared++;
        }
        return shared == 0 ? Double.POSITIVE_INFINITY : Math.sqrt(sum / shared);
    }

    private double meanNearest(double[] query, double[][] refs, int skipIndex, int k, double[] scales) {
        double[] distances = new double[skipIndex >= 0 ? refs.length - 1 : refs.length];
        int n = 0;
        for (int j = 0; j < refs.length; j++) {
            if (j == skipIndex) continue;
            distances[n++] = distance(query, refs[j], scales);
        }
        Arrays.sort(distances);
        int take = Math.min(k, distances.length);
        double sum = 0.0;
        for (int j = 0; j < take; j++) {
            sum += distances[j];
        }
        return take > 0 ? sum / take : 0.0;
    }

    // Per-dimension std over references; NaN marks a dimension no reference carries.
    private double[] dimensionScales(double[][] refs) {
        double[] scales = new double[FeatureVector.DIMENSION_COUNT];
        for (int d = 0; d < scales.length; d++) {
            double sum = 0.0;
            int count = 0;
            for (double[] ref : refs) {
                if (!Double.isNaN(ref[d])) {
                    sum += ref[d];
                    count++;
                }
            }
            if (count == 0) {
                scales[d] = Double.NaN;
                continue;
            }
            double mean = sum / count;
            double m2 = 0.0;
            for (double[] ref : refs) {
                if (!Double.isNaN(ref[d])) {
                    double diff = ref[d] - mean;
                    m2 += diff * diff;
                }
            }
            scales[d] = Math.max(Math.sqrt(m2 / count), epsilon);
        }
        return scales;
    }

    private static double[][] coordinates(List<FeatureVector> vectors) {
        double[][] coordinates = new double[vectors.size()][];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = vectors.get(i).coordinates();
        }
        return coordinates;
    }

    @Value
    public static class DensityScores {
        List<Double> anomalyScores;
        List<Double> normalizedScores;
        int neighbours;
        double medianDistance;
        double pivot;
    }
}
