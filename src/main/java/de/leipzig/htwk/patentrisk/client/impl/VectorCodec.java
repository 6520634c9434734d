package de.leipzig.htwk.patentrisk.client.impl;

/**
 * Conversion between double arrays and the pgvector text format {@code [1.0,2.0,3.0]}
 */
final class VectorCodec {

    private VectorCodec() {
    }

    static String toVectorString(double[] vector) {
        StringBuilder sb = new StringBuilder();
        sb.append("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(vector[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * @return null for a missing or empty vector
     */
    static double[] fromVectorString(String vectorString) {
        if (vectorString == null) {
            return null;
        }
        String trimmed = vectorString.trim();
        if (trimmed.length() < 2) {
            return null;
        }
        // Remove brackets and split by comma
        String content = trimmed.substring(1, trimmed.length() - 1).trim();
        if (content.isEmpty()) {
            return null;
        }
        String[] parts = content.split(",");
        double[] result = new double[parts.length];

        for (int i = 0; i < parts.length; i++) {
            result[i] = Double.parseDouble(parts[i].trim());
        }

        return result;
    }
}
