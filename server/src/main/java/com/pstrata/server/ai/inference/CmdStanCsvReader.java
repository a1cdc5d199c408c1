package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.InferenceEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses CmdStan sampler output. Comment lines start with '#'; the first other line is
 * the header; columns named {@code name.i.j} (1-based) are regrouped per parameter and
 * sampler diagnostics ending in "__" are skipped. Several chains are concatenated in the
 * order given.
 */
public class CmdStanCsvReader {

    private static final class Column {
        final String base;
        final int[] index;

        Column(String base, int[] index) {
            this.base = base;
            this.index = index;
        }
    }

    public PosteriorDraws read(List<? extends Reader> chains, String diagnostics) {
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();
        for (Reader chain : chains) {
            header = checkHeader(header, readChain(chain, rows, diagnostics), diagnostics);
        }
        if (header == null) {
            throw new InferenceEngineException("Sampler produced no output", diagnostics);
        }
        return assemble(header, rows, diagnostics);
    }

    /**
     * Reads one output file per chain. Each file is opened only when its turn comes and is
     * closed before the next one is opened.
     */
    public PosteriorDraws readFiles(List<Path> chainFiles, String diagnostics) {
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();
        for (Path file : chainFiles) {
            Reader reader;
            try {
                reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new InferenceEngineException("Cannot open sampler output " + file, diagnostics, e);
            }
            header = checkHeader(header, readChain(reader, rows, diagnostics), diagnostics);
        }
        if (header == null) {
            throw new InferenceEngineException("Sampler produced no output", diagnostics);
        }
        return assemble(header, rows, diagnostics);
    }

    private static List<String> checkHeader(List<String> header, List<String> chainHeader, String diagnostics) {
        if (header != null && !header.equals(chainHeader)) {
            throw new InferenceEngineException("Chains disagree on output columns", diagnostics);
        }
        return chainHeader;
    }

    private static List<String> readChain(Reader reader, List<double[]> rows, String diagnostics) {
        List<String> header = null;
        try (BufferedReader br = new BufferedReader(reader)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] cells = trimmed.split(",");
                if (header == null) {
                    header = new ArrayList<>();
                    for (String c : cells) {
                        header.add(c.trim());
                    }
                    continue;
                }
                if (cells.length != header.size()) {
                    throw new InferenceEngineException("Row has " + cells.length + " columns, header has "
                            + header.size(), diagnostics);
                }
                double[] row = new double[cells.length];
                for (int i = 0; i < cells.length; i++) {
                    row[i] = Double.parseDouble(cells[i].trim());
                }
                rows.add(row);
            }
        } catch (IOException e) {
            throw new InferenceEngineException("Failed to read sampler output", diagnostics, e);
        } catch (NumberFormatException e) {
            throw new InferenceEngineException("Unparseable value in sampler output", diagnostics, e);
        }
        if (header == null) {
            throw new InferenceEngineException("Sampler output has no header", diagnostics);
        }
        return header;
    }

    private static PosteriorDraws assemble(List<String> header, List<double[]> rows, String diagnostics) {
        Map<String, List<Integer>> columnsByName = new LinkedHashMap<>();
        List<Column> columns = new ArrayList<>();
        for (int c = 0; c < header.size(); c++) {
            String name = header.get(c);
            String[] parts = name.split("\\.");
            int[] index = new int[parts.length - 1];
            try {
                for (int k = 1; k < parts.length; k++) {
                    index[k - 1] = Integer.parseInt(parts[k]) - 1;
                }
            } catch (NumberFormatException e) {
                throw new InferenceEngineException("Unexpected column name '" + name + "'", diagnostics, e);
            }
            columns.add(new Column(parts[0], index));
            if (!parts[0].endsWith("__")) {
                columnsByName.computeIfAbsent(parts[0], k -> new ArrayList<>()).add(c);
            }
        }

        Map<String, ParameterDraws> params = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> e : columnsByName.entrySet()) {
            List<Integer> cols = e.getValue();
            int rank = columns.get(cols.get(0)).index.length;
            int[] dims = new int[rank];
            for (int c : cols) {
                int[] idx = columns.get(c).index;
                if (idx.length != rank) {
                    throw new InferenceEngineException("Inconsistent indexing for " + e.getKey(), diagnostics);
                }
                for (int k = 0; k < rank; k++) {
                    dims[k] = Math.max(dims[k], idx[k] + 1);
                }
            }
            int width = 1;
            for (int d : dims) {
                width *= d;
            }
            if (width != cols.size()) {
                throw new InferenceEngineException("Parameter " + e.getKey() + " is missing elements", diagnostics);
            }
            double[][] values = new double[rows.size()][width];
            for (int c : cols) {
                int[] idx = columns.get(c).index;
                int off = 0;
                for (int k = 0; k < rank; k++) {
                    off = off * dims[k] + idx[k];
                }
                for (int i = 0; i < rows.size(); i++) {
                    values[i][off] = rows.get(i)[c];
                }
            }
            params.put(e.getKey(), new ParameterDraws(e.getKey(), dims, values));
        }
        return new PosteriorDraws(params, diagnostics);
    }
}
