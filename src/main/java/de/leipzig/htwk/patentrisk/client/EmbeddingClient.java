package de.leipzig.htwk.patentrisk.client;

import de.leipzig.htwk.patentrisk.exception.DimensionMismatchException;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;

/**
 * Turns text into a fixed-length vector
 */
public interface EmbeddingClient {

    /**
     * @return a vector of exactly {@link #dimensions()} components
     * @throws EmbeddingUnavailableException if the service cannot be reached or answers garbage
     * @throws DimensionMismatchException if the service answers with a vector of the wrong length
     */
    double[] embed(String text);

    int dimensions();
}
