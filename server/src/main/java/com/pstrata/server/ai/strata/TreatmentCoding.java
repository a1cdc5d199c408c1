package com.pstrata.server.ai.strata;

import com.pstrata.server.ai.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps an observed treatment variable onto 0-based integer codes.
 */
public class TreatmentCoding {

    private static final Logger logger = LoggerFactory.getLogger(TreatmentCoding.class);

    private final List<String> levelNames;
    private final int[] codes;

    public TreatmentCoding(List<String> levelNames, int[] codes) {
        if (levelNames == null || levelNames.isEmpty()) {
            throw new ConfigurationException("Treatment coding needs at least one level");
        }
        if (codes == null) {
            throw new ConfigurationException("Treatment codes must not be null");
        }
        for (int c : codes) {
            if (c < 0 || c >= levelNames.size()) {
                throw new ConfigurationException("Treatment code " + c + " outside 0.." + (levelNames.size() - 1));
            }
        }
        this.levelNames = Collections.unmodifiableList(new ArrayList<>(levelNames));
        this.codes = codes.clone();
    }

    /**
     * Codes raw treatment values. Values that are all integers within
     * {@code 0..declaredLevels-1} are used directly, with level names "0".."T-1" where T is
     * the largest observed code plus one. Anything else is treated as a categorical
     * variable whose levels are the distinct values in sorted order, numeric order when
     * every value is a number.
     */
    public static TreatmentCoding fromObserved(List<String> rawValues, int declaredLevels) {
        if (rawValues == null || rawValues.isEmpty()) {
            throw new ConfigurationException("Treatment variable has no observations");
        }
        int[] numeric = new int[rawValues.size()];
        boolean zeroBased = true;
        int max = -1;
        for (int i = 0; i < rawValues.size() && zeroBased; i++) {
            String raw = rawValues.get(i);
            try {
                int v = Integer.parseInt(raw.trim());
                if (v < 0 || v >= declaredLevels) {
                    zeroBased = false;
                } else {
                    numeric[i] = v;
                    max = Math.max(max, v);
                }
            } catch (NumberFormatException | NullPointerException e) {
                zeroBased = false;
            }
        }

        if (zeroBased) {
            List<String> names = new ArrayList<>();
            for (int z = 0; z <= max; z++) {
                names.add(String.valueOf(z));
            }
            return new TreatmentCoding(names, numeric);
        }

        logger.warn("Treatment variable is not coded 0..{}; levels are derived from its sorted distinct values",
                declaredLevels - 1);
        TreeSet<String> distinct = new TreeSet<>();
        boolean allNumeric = true;
        for (String raw : rawValues) {
            if (raw == null) {
                throw new ConfigurationException("Treatment variable contains a missing value");
            }
            String value = raw.trim();
            distinct.add(value);
            allNumeric = allNumeric && isNumber(value);
        }
        List<String> names = new ArrayList<>(distinct);
        if (allNumeric) {
            names.sort(Comparator.comparingDouble(Double::parseDouble));
        }
        Map<String, Integer> index = new HashMap<>();
        for (int z = 0; z < names.size(); z++) {
            index.put(names.get(z), z);
        }
        int[] codes = new int[rawValues.size()];
        for (int i = 0; i < rawValues.size(); i++) {
            codes[i] = index.get(rawValues.get(i).trim());
        }
        return new TreatmentCoding(names, codes);
    }

    private static boolean isNumber(String value) {
        try {
            return !Double.isNaN(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Coding whose level names are "0".."levels-1", for callers that already hold integer codes.
     */
    public static TreatmentCoding ofCodes(int[] codes, int levels) {
        List<String> names = new ArrayList<>();
        for (int z = 0; z < levels; z++) {
            names.add(String.valueOf(z));
        }
        return new TreatmentCoding(names, codes);
    }

    public int getLevelCount() {
        return levelNames.size();
    }

    public List<String> getLevelNames() {
        return levelNames;
    }

    public int[] getCodes() {
        return codes.clone();
    }
}
