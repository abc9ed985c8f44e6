package com.tradecodes.classifier.service;

import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CompletionVerdict;

import java.util.List;

/**
 * Language-model disambiguator used as a last resort.
 */
public interface CompletionService {

    /**
     * @throws VerificationFailureException when no usable suggestion comes back
     */
    CompletionVerdict verify(String query, List<Candidate> candidates);
}
