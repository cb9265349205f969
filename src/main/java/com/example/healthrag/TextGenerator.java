package com.example.healthrag;

/**
 * Opaque text-generation backend fed with rendered contexts.
 */
public interface TextGenerator {

    /**
     * @throws GenerationUnavailableException when the backend cannot produce an answer
     */
    String generate(String prompt, GenerationOptions options);

    /** Name reported in response metadata. */
    String modelName();
}
