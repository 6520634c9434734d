package de.leipzig.htwk.patentrisk.service.cache;

import java.util.Locale;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Stable cache keys: SHA-256 over the normalized request parameters
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String search(String query, double vectorWeight, int limit) {
        return hash("search", normalize(query), format(vectorWeight), Integer.toString(limit));
    }

    public static String compare(String sourcePatentId, String targetPatentId) {
        return hash("compare", sourcePatentId, targetPatentId);
    }

    public static String compareClaims(String sourcePatentId, String targetPatentId, boolean includeExplanation, double vectorWeight) {
        return hash("claims", sourcePatentId, targetPatentId, Boolean.toString(includeExplanation), format(vectorWeight));
    }

    public static String priorArt(String inventionDescription, int limit, boolean includeAnalysis) {
        return hash("priorart", normalize(inventionDescription), Integer.toString(limit), Boolean.toString(includeAnalysis));
    }

    /**
     * Trim and collapse whitespace. Case is kept: it can matter to the embedding model.
     */
    static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String hash(String... parts) {
        return parts[0] + ":" + DigestUtils.sha256Hex(String.join("|", parts));
    }
}
