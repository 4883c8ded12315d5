package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;

/**
 * One way of answering an extraction request: a hosted model or the local regex extractor.
 * Implementations are stateless with respect to health; the chain tracks that.
 */
public interface AiProvider {

    String getName();

    String getModelId();

    /**
     * @param request wire request; spans in the response refer to {@code request.getSectionText()}
     * @throws ProviderException on any failure
     */
    ExtractResponse extract(ExtractRequest request);
}
