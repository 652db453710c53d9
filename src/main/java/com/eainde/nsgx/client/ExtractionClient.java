package com.eainde.nsgx.client;

import com.eainde.nsgx.model.ExtractionOutcome;

/**
 * Adapter over the external text-understanding service.
 *
 * <p>Implementations are stateless and thread-safe: many workers call them
 * concurrently. Transport, rate-limit and parsing problems are reported as
 * {@link ExtractionOutcome.Failure}, never thrown.</p>
 */
public interface ExtractionClient {

    /**
     * Extracts rules and vocabulary candidates from one text unit.
     *
     * @param unitText     unit text
     * @param instructions system instructions
     * @param model        model to ask
     * @return validated result, or a typed failure
     */
    ExtractionOutcome extract(String unitText, String instructions, ModelProfile model);

    /**
     * Sends a minimal structured-output request.
     *
     * @return true if the service answered with parseable JSON
     */
    boolean checkConnectivity(ModelProfile model);
}
