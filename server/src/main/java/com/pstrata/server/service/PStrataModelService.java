package com.pstrata.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pstrata.db.PosteriorDrawDao;
import com.pstrata.db.PosteriorFitRecord;
import com.pstrata.db.SqliteInitializer;
import com.pstrata.server.ai.ConfigurationException;
import com.pstrata.server.ai.PStrataConfig;
import com.pstrata.server.ai.PStrataException;
import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.family.FamilyLinkRegistry;
import com.pstrata.server.ai.inference.InferenceEngine;
import com.pstrata.server.ai.inference.InferenceEngineFactory;
import com.pstrata.server.ai.inference.PosteriorDraws;
import com.pstrata.server.ai.posterior.OutcomeSummarizer;
import com.pstrata.server.ai.posterior.OutcomeType;
import com.pstrata.server.ai.posterior.PosteriorOutcomeArray;
import com.pstrata.server.ai.posterior.PosteriorReshaper;
import com.pstrata.server.ai.posterior.SummaryRow;
import com.pstrata.server.ai.prior.ModelPriors;
import com.pstrata.server.ai.prior.PriorSpec;
import com.pstrata.server.ai.prior.Priors;
import com.pstrata.server.ai.strata.StrataInfo;
import com.pstrata.server.ai.strata.TreatmentCoding;
import com.pstrata.server.ai.synthesis.ModelProgramSynthesizer;
import com.pstrata.server.ai.synthesis.ModelSpecification;
import com.pstrata.server.ai.synthesis.StructuralDesign;
import com.pstrata.server.ai.synthesis.SurvivalTimePoints;
import com.pstrata.server.ai.synthesis.SynthesizedModel;
import com.pstrata.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Compiles model requests, runs them through the inference engine and serves reshaped
 * outcomes from the draw cache.
 */
@Service
public class PStrataModelService {

    private static final Logger logger = LoggerFactory.getLogger(PStrataModelService.class);

    private final PStrataConfig.ConfigRoot config;
    private final InferenceEngine engine;
    private final PosteriorDrawDao drawDao;
    private final ModelProgramSynthesizer synthesizer = new ModelProgramSynthesizer();
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public PStrataModelService() {
        this(PStrataConfig.loadDefault(), null);
    }

    public PStrataModelService(PStrataConfig.ConfigRoot config, InferenceEngine engine) {
        this(config, engine, DataPathResolver.drawCachePath(config).toString());
    }

    /**
     * @param engine null to build one from the configuration
     */
    public PStrataModelService(PStrataConfig.ConfigRoot config, InferenceEngine engine, String dbPath) {
        this.config = config;
        this.engine = engine != null ? engine : InferenceEngineFactory.create(config.engine);
        try {
            SqliteInitializer.initialize(dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialise draw cache at " + dbPath, e);
        }
        this.drawDao = new PosteriorDrawDao(dbPath);
        logger.info("Model service ready, draw cache at {}", dbPath);
    }

    public SynthesizedModel compile(ModelRequest request) {
        if (request == null || request.strata == null) {
            throw new ConfigurationException("Request must declare strata");
        }
        StrataInfo strata = request.er == null ? StrataInfo.parse(request.strata)
                : StrataInfo.parse(request.strata, request.er);
        TreatmentCoding coding = TreatmentCoding.fromObserved(request.treatment, strata.getTreatmentCount());
        FamilyLinkEntry entry = FamilyLinkRegistry.getDefault().resolve(request.family, request.link);
        ModelSpecification spec = ModelSpecification.create(strata, coding, entry, priorsOf(request),
                timePointsOf(request));

        StructuralDesign design = StructuralDesign.builder()
                .response(request.response)
                .treatment(coding.getCodes())
                .intermediate(request.intermediate)
                .stratumCovariates(request.stratumCovariates,
                        namesOf(request.stratumCovariates, request.stratumCovariateNames, "XS"))
                .outcomeCovariates(request.outcomeCovariates,
                        namesOf(request.outcomeCovariates, request.outcomeCovariateNames, "XG"))
                .eventIndicator(request.event)
                .build();
        return synthesizer.synthesize(spec, design);
    }

    /**
     * Compiles, samples and caches the draws. Returns the new fit id.
     */
    public String fit(ModelRequest request) {
        SynthesizedModel model = compile(request);
        PosteriorDraws draws;
        try {
            draws = engine.sample(model);
        } catch (PStrataException e) {
            logger.error("Sampling failed for {}/{}: {}", request.family, request.link, e.getMessage());
            throw e;
        }

        String fitId = UUID.randomUUID().toString();
        String json;
        try {
            json = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialise model request", e);
        }
        int iterations = draws.getParameterNames().isEmpty() ? 0
                : draws.get(draws.getParameterNames().iterator().next()).getIterationCount();
        PosteriorFitRecord record = new PosteriorFitRecord(fitId, model.getFamily().getFamily().getFamilyName(),
                model.getFamily().getLink().getLinkName(), model.getGroupTable().getGroupCount(), iterations, json,
                System.currentTimeMillis());
        try {
            drawDao.saveFit(record, draws);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cache draws for fit " + fitId, e);
        }
        logger.info("Fit {} completed: {} groups, {} iterations", fitId, record.getGroupCount(), iterations);
        return fitId;
    }

    /**
     * Reshapes the cached draws of a fit. A null {@code type} falls back to the configured
     * default outcome type.
     */
    public PosteriorOutcomeArray outcome(String fitId, OutcomeType type) {
        PosteriorFitRecord record;
        PosteriorDraws draws;
        try {
            record = drawDao.loadFit(fitId).orElseThrow(() -> new NoSuchElementException("Unknown fit " + fitId));
            draws = drawDao.loadDraws(fitId).orElseThrow(() -> new NoSuchElementException("No draws cached for fit " + fitId));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read draw cache for fit " + fitId, e);
        }
        ModelRequest request;
        try {
            request = mapper.readValue(record.getRequestJson(), ModelRequest.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Stored request of fit " + fitId + " is unreadable", e);
        }
        SynthesizedModel model = compile(request);
        OutcomeType resolved = type != null ? type
                : OutcomeType.fromName(config.defaults == null ? null : config.defaults.outcomeType);
        return PosteriorReshaper.reshape(draws, model, resolved);
    }

    public List<SummaryRow> summarize(String fitId, OutcomeType type) {
        return OutcomeSummarizer.summarize(outcome(fitId, type));
    }

    private SurvivalTimePoints timePointsOf(ModelRequest request) {
        if (request.timePoints != null) {
            return SurvivalTimePoints.explicit(request.timePoints);
        }
        if (request.survivalTimePoints != null) {
            return SurvivalTimePoints.count(request.survivalTimePoints);
        }
        Integer configured = config.defaults == null ? null : config.defaults.survivalTimePoints;
        return configured != null ? SurvivalTimePoints.count(configured) : SurvivalTimePoints.defaults();
    }

    static ModelPriors priorsOf(ModelRequest request) {
        ModelPriors.Builder b = ModelPriors.builder();
        if (request.priors == null) {
            return b.build();
        }
        for (Map.Entry<String, ModelRequest.PriorConfig> e : request.priors.entrySet()) {
            ModelRequest.PriorConfig pc = e.getValue();
            PriorSpec prior = Priors.fromConfig(pc == null ? null : pc.name, pc == null ? null : pc.args);
            switch (e.getKey()) {
                case "intercept":
                    b.intercept(prior);
                    break;
                case "coefficient":
                    b.coefficient(prior);
                    break;
                case "sigma":
                    b.sigma(prior);
                    break;
                case "alpha":
                    b.alpha(prior);
                    break;
                case "lambda":
                    b.lambda(prior);
                    break;
                case "theta":
                    b.theta(prior);
                    break;
                default:
                    throw new ConfigurationException("Unknown prior target: " + e.getKey());
            }
        }
        return b.build();
    }

    private static List<String> namesOf(double[][] matrix, List<String> names, String prefix) {
        if (names != null || matrix == null || matrix.length == 0 || matrix[0] == null) {
            return names;
        }
        List<String> generated = new ArrayList<>();
        for (int j = 1; j <= matrix[0].length; j++) {
            generated.add(prefix + j);
        }
        return generated;
    }
}
