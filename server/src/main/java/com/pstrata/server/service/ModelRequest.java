package com.pstrata.server.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON body of a compile or fit request. Also persisted with each fit so that cached draws
 * can be reshaped against the same group table.
 */
public class ModelRequest {

    public static class PriorConfig {
        public String name;
        public Map<String, Double> args;
    }

    // stratum name -> compact notation, e.g. "n" -> "00*"
    public LinkedHashMap<String, String> strata;
    public Map<String, Boolean> er;

    public String family;
    public String link;

    // keyed by intercept, coefficient, sigma, alpha, lambda, theta
    public Map<String, PriorConfig> priors;

    public double[] response;
    public List<String> treatment;
    public int[] intermediate;
    public double[][] stratumCovariates;
    public List<String> stratumCovariateNames;
    public double[][] outcomeCovariates;
    public List<String> outcomeCovariateNames;
    public int[] event;

    // survival grid: either a point count or explicit times
    public Integer survivalTimePoints;
    public double[] timePoints;
}
