package de.leipzig.htwk.patentrisk.service.similarity;

import de.leipzig.htwk.patentrisk.exception.DimensionMismatchException;

/**
 * Cosine similarity mapped onto [0,1]. A zero vector carries no signal and scores 0.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double similarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException("embedding", a.length, b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        // Single sqrt keeps sim(v, v) at exactly 1
        double cosine = dotProduct / Math.sqrt(normA * normB);
        return fromCosine(cosine);
    }

    /**
     * Map a raw cosine from [-1,1] (as reported by the vector index) onto [0,1]
     */
    public static double fromCosine(double cosine) {
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return clamp((cosine + 1.0) / 2.0);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
