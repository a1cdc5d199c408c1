package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.PStrataConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static InferenceEngine create(PStrataConfig.EngineConfig config) {
        PStrataConfig.EngineConfig cfg = config != null ? config : new PStrataConfig.EngineConfig();
        String type = cfg.type;

        if (type == null || type.trim().isEmpty()) {
            logger.warn("Engine type not specified, defaulting to 'cmdstan'");
            type = "cmdstan";
        }

        switch (type.toLowerCase()) {
            case "cmdstan":
                return new CmdStanInferenceEngine(cfg);
            default:
                logger.warn("Unknown engine type '{}', defaulting to 'cmdstan'", type);
                return new CmdStanInferenceEngine(cfg);
        }
    }

    public static InferenceEngine create(String type) {
        PStrataConfig.EngineConfig cfg = new PStrataConfig.EngineConfig();
        cfg.type = type;
        return create(cfg);
    }
}
