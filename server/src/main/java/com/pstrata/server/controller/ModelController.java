package com.pstrata.server.controller;

import com.pstrata.server.ai.ConfigurationException;
import com.pstrata.server.ai.DimensionMismatchException;
import com.pstrata.server.ai.InferenceEngineException;
import com.pstrata.server.ai.SynthesisException;
import com.pstrata.server.ai.UnsupportedCombinationException;
import com.pstrata.server.ai.family.FamilyLinkRegistry;
import com.pstrata.server.ai.posterior.OutcomeType;
import com.pstrata.server.ai.posterior.SummaryRow;
import com.pstrata.server.ai.synthesis.SynthesizedModel;
import com.pstrata.server.service.ModelRequest;
import com.pstrata.server.service.PStrataModelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

@RestController
public class ModelController {

    private static final Logger logger = LoggerFactory.getLogger(ModelController.class);
    private final PStrataModelService modelService;

    public ModelController(PStrataModelService modelService) {
        this.modelService = modelService;
    }

    @GetMapping("/families")
    public Set<String> families() {
        return FamilyLinkRegistry.getDefault().supportedFamilies();
    }

    @GetMapping("/families/{family}/links")
    public ResponseEntity<?> links(@PathVariable("family") String family) {
        Set<String> links = FamilyLinkRegistry.getDefault().supportedLinks(family);
        if (links.isEmpty()) {
            return ResponseEntity.status(404).body("Unknown family: " + family);
        }
        return ResponseEntity.ok(links);
    }

    @PostMapping("/models/compile")
    public ResponseEntity<?> compile(@RequestBody ModelRequest request) {
        logger.info("Compile request for {}/{}", request.family, request.link);
        SynthesizedModel model = modelService.compile(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("program", model.getProgramText());
        body.put("data", model.getData());
        body.put("groupCount", model.getGroupTable().getGroupCount());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/models/fit")
    public ResponseEntity<?> fit(@RequestBody ModelRequest request) {
        logger.info("Fit request for {}/{}", request.family, request.link);
        String fitId = modelService.fit(request);
        return ResponseEntity.ok(Map.of("fitId", fitId));
    }

    @GetMapping("/fits/{fitId}/summary")
    public ResponseEntity<?> summary(@PathVariable("fitId") String fitId,
            @RequestParam(value = "type", required = false) String type) {
        OutcomeType outcomeType;
        try {
            outcomeType = type == null ? null : OutcomeType.fromName(type);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
        List<SummaryRow> rows = modelService.summarize(fitId, outcomeType);
        return ResponseEntity.ok(rows);
    }

    @ExceptionHandler({ConfigurationException.class, UnsupportedCombinationException.class,
            DimensionMismatchException.class})
    public ResponseEntity<String> badRequest(RuntimeException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<String> notFound(NoSuchElementException e) {
        return ResponseEntity.status(404).body(e.getMessage());
    }

    @ExceptionHandler(SynthesisException.class)
    public ResponseEntity<String> synthesisFailure(SynthesisException e) {
        logger.error("Synthesis defect: {}", e.getMessage());
        return ResponseEntity.status(500).body(e.getMessage());
    }

    @ExceptionHandler(InferenceEngineException.class)
    public ResponseEntity<String> engineFailure(InferenceEngineException e) {
        logger.error("Inference engine failed: {}", e.getMessage());
        return ResponseEntity.status(502).body(e.getMessage() + "\n" + e.getDiagnostics());
    }
}
