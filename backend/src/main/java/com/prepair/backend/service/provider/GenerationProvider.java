package com.prepair.backend.service.provider;

import com.prepair.backend.exception.ProviderUnavailableException;

/**
 * Text generation against a large language model.
 */
public interface GenerationProvider {

    /**
     * @throws ProviderUnavailableException when the model cannot be reached or returns nothing
     */
    String generate(String model, String prompt, GenerationOptions options);
}
