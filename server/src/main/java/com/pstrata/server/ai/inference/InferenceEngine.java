package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.synthesis.SynthesizedModel;

public interface InferenceEngine {
    /**
     * Run the sampler on a synthesized program and its data. Blocks until the draws are
     * complete; failures surface as {@link com.pstrata.server.ai.InferenceEngineException}.
     */
    PosteriorDraws sample(SynthesizedModel model);
}
