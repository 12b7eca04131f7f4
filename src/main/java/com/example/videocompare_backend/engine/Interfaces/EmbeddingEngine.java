package com.example.videocompare_backend.engine.Interfaces;

import java.util.List;

public interface EmbeddingEngine {

    /**
     * Embeds a batch of texts in one call.
     *
     * @return one vector per input, in input order, all of the same dimensionality
     */
    List<float[]> embed(List<String> texts);
}
