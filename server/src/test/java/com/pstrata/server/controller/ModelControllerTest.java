package com.pstrata.server.controller;

import com.pstrata.server.ai.InferenceEngineException;
import com.pstrata.server.ai.PStrataConfig;
import com.pstrata.server.service.PStrataModelService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ModelControllerTest {

    @TempDir
    Path tempDir;

    private MockMvc mvc;

    @BeforeEach
    public void setup() {
        PStrataModelService service = new PStrataModelService(PStrataConfig.loadDefault(),
                model -> {
                    throw new InferenceEngineException("sampler crashed", "segfault");
                },
                tempDir.resolve("controller.db").toString());
        mvc = MockMvcBuilders.standaloneSetup(new ModelController(service)).build();
    }

    private static final String REQUEST = "{"
            + "\"strata\": {\"n\": \"00*\", \"c\": \"01\", \"a\": \"11*\"},"
            + "\"family\": \"%s\", \"link\": \"%s\","
            + "\"response\": [0.1, 0.9, 1.4, 2.2],"
            + "\"treatment\": [\"0\", \"0\", \"1\", \"1\"],"
            + "\"intermediate\": [0, 1, 0, 1]"
            + "}";

    @Test
    public void testSupportedLinks() throws Exception {
        mvc.perform(get("/families/binomial/links"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasItems("logit", "probit", "cauchit", "cloglog")));
        mvc.perform(get("/families/negbin/links"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testCompile() throws Exception {
        mvc.perform(post("/models/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(REQUEST, "gaussian", "identity")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupCount").value(4))
                .andExpect(jsonPath("$.data.G").value(4))
                .andExpect(jsonPath("$.program", containsString("log_sum_exp")));
    }

    @Test
    public void testErrorMapping() throws Exception {
        mvc.perform(post("/models/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(REQUEST, "poisson", "logit")))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/models/fit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(REQUEST, "gaussian", "identity")))
                .andExpect(status().is(502))
                .andExpect(content().string(containsString("segfault")));

        mvc.perform(get("/fits/unknown/summary"))
                .andExpect(status().isNotFound());
        mvc.perform(get("/fits/unknown/summary").param("type", "median"))
                .andExpect(status().isBadRequest());
    }
}
