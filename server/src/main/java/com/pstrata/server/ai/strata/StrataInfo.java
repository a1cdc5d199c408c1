package com.pstrata.server.ai.strata;

import com.pstrata.server.ai.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared principal strata: for every stratum the intermediate value it takes under each
 * treatment level, and whether the exclusion restriction holds within it.
 *
 * <p>The compact notation accepted by {@link #parse(Map)} writes one character per
 * treatment level: a digit for a concrete intermediate value, {@code ?} for a cell that is
 * unconstrained, and an optional trailing {@code *} for exclusion restriction. For the
 * usual noncompliance setting that is {@code n -> "00*", c -> "01", a -> "11*"}.
 */
public class StrataInfo {

    public static final int WILDCARD = -1;

    private static final char WILDCARD_CHAR = '?';
    private static final char ER_CHAR = '*';

    private final List<String> strataNames;
    private final int[][] intermediateValues;
    private final boolean[] exclusionRestricted;

    public StrataInfo(List<String> strataNames, int[][] intermediateValues, boolean[] exclusionRestricted) {
        if (strataNames == null || strataNames.isEmpty()) {
            throw new ConfigurationException("At least one stratum must be declared");
        }
        if (intermediateValues == null || intermediateValues.length != strataNames.size()) {
            throw new ConfigurationException("Expected intermediate values for " + strataNames.size() + " strata");
        }
        if (exclusionRestricted == null || exclusionRestricted.length != strataNames.size()) {
            throw new ConfigurationException("Expected an exclusion restriction flag for " + strataNames.size() + " strata");
        }
        Set<String> seen = new HashSet<>();
        for (String name : strataNames) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Stratum names must not be blank");
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate stratum name: " + name);
            }
        }
        int width = intermediateValues[0] == null ? 0 : intermediateValues[0].length;
        if (width == 0) {
            throw new ConfigurationException("Strata must declare at least one treatment level");
        }
        int[][] copy = new int[intermediateValues.length][];
        for (int s = 0; s < intermediateValues.length; s++) {
            int[] row = intermediateValues[s];
            if (row == null || row.length != width) {
                throw new ConfigurationException("Stratum '" + strataNames.get(s) + "' declares "
                        + (row == null ? 0 : row.length) + " treatment levels, expected " + width);
            }
            for (int v : row) {
                if (v < WILDCARD) {
                    throw new ConfigurationException("Invalid intermediate value " + v + " in stratum '"
                            + strataNames.get(s) + "'");
                }
            }
            copy[s] = row.clone();
        }
        this.strataNames = Collections.unmodifiableList(new ArrayList<>(strataNames));
        this.intermediateValues = copy;
        this.exclusionRestricted = exclusionRestricted.clone();
    }

    public static StrataInfo parse(Map<String, String> declarations) {
        return parse(declarations, null);
    }

    /**
     * Parses compact stratum declarations. An entry in {@code exclusionRestriction} overrides
     * the trailing {@code *} of the matching declaration; the map may be null.
     * Iteration order of {@code declarations} fixes the stratum order.
     */
    public static StrataInfo parse(Map<String, String> declarations, Map<String, Boolean> exclusionRestriction) {
        if (declarations == null || declarations.isEmpty()) {
            throw new ConfigurationException("At least one stratum must be declared");
        }
        List<String> names = new ArrayList<>();
        int[][] values = new int[declarations.size()][];
        boolean[] er = new boolean[declarations.size()];

        int s = 0;
        for (Map.Entry<String, String> e : declarations.entrySet()) {
            String code = e.getValue() == null ? "" : e.getValue().trim();
            boolean marked = code.endsWith(String.valueOf(ER_CHAR));
            if (marked) {
                code = code.substring(0, code.length() - 1);
            }
            if (code.isEmpty()) {
                throw new ConfigurationException("Stratum '" + e.getKey() + "' has an empty declaration");
            }
            int[] row = new int[code.length()];
            for (int z = 0; z < code.length(); z++) {
                char c = code.charAt(z);
                if (c == WILDCARD_CHAR) {
                    row[z] = WILDCARD;
                } else if (Character.isDigit(c)) {
                    row[z] = c - '0';
                } else {
                    throw new ConfigurationException("Illegal character '" + c + "' in declaration of stratum '"
                            + e.getKey() + "'");
                }
            }
            names.add(e.getKey());
            values[s] = row;
            if (exclusionRestriction != null && exclusionRestriction.containsKey(e.getKey())) {
                er[s] = Boolean.TRUE.equals(exclusionRestriction.get(e.getKey()));
            } else {
                er[s] = marked;
            }
            s++;
        }
        if (exclusionRestriction != null) {
            for (String key : exclusionRestriction.keySet()) {
                if (!declarations.containsKey(key)) {
                    throw new ConfigurationException("Exclusion restriction given for undeclared stratum '" + key + "'");
                }
            }
        }
        return new StrataInfo(names, values, er);
    }

    public List<String> getStrataNames() {
        return strataNames;
    }

    public int getStratumCount() {
        return strataNames.size();
    }

    public int getTreatmentCount() {
        return intermediateValues[0].length;
    }

    public int getIntermediateValue(int stratumId, int treatmentId) {
        return intermediateValues[stratumId][treatmentId];
    }

    public boolean isWildcard(int stratumId, int treatmentId) {
        return intermediateValues[stratumId][treatmentId] == WILDCARD;
    }

    public boolean isExclusionRestricted(int stratumId) {
        return exclusionRestricted[stratumId];
    }

    /**
     * Renders a stratum back into compact notation.
     */
    public String describe(int stratumId) {
        StringBuilder sb = new StringBuilder();
        for (int v : intermediateValues[stratumId]) {
            sb.append(v == WILDCARD ? WILDCARD_CHAR : Character.forDigit(v, 10));
        }
        if (exclusionRestricted[stratumId]) {
            sb.append(ER_CHAR);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StrataInfo{");
        for (int s = 0; s < strataNames.size(); s++) {
            if (s > 0) {
                sb.append(", ");
            }
            sb.append(strataNames.get(s)).append('=').append(describe(s));
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StrataInfo)) {
            return false;
        }
        StrataInfo other = (StrataInfo) o;
        return strataNames.equals(other.strataNames)
                && Arrays.deepEquals(intermediateValues, other.intermediateValues)
                && Arrays.equals(exclusionRestricted, other.exclusionRestricted);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * strataNames.hashCode() + Arrays.deepHashCode(intermediateValues))
                + Arrays.hashCode(exclusionRestricted);
    }
}
