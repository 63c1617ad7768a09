package com.github.salilvnair.convroute.generation.core;

public interface GenerationClient {
    /**
     * Returns generated text for the prompt or throws {@link GenerationException}.
     */
    String generate(String prompt);

    default boolean isAvailable() {
        return true;
    }
}
