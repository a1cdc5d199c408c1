package com.pstrata.db;

import com.pstrata.server.ai.inference.ParameterDraws;
import com.pstrata.server.ai.inference.PosteriorDraws;
import com.pstrata.util.DrawMatrixCodec;

import java.sql.*;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class PosteriorDrawDao {

    private final String dbPath;

    public PosteriorDrawDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA foreign_keys = ON;");
        }
        return conn;
    }

    /**
     * Stores the fit record and all parameter draws in one transaction, replacing any
     * earlier fit with the same id.
     */
    public void saveFit(PosteriorFitRecord fit, PosteriorDraws draws) throws SQLException {
        String fitSql = "INSERT INTO posterior_fit (fit_id, family, link, group_count, iteration_count, request_json, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(fit_id) DO UPDATE SET " +
                "family = excluded.family, link = excluded.link, group_count = excluded.group_count, " +
                "iteration_count = excluded.iteration_count, request_json = excluded.request_json, " +
                "created_ts = excluded.created_ts";
        String drawSql = "INSERT INTO posterior_draws (fit_id, parameter_name, dims, draws_blob) " +
                "VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(fit_id, parameter_name) DO UPDATE SET " +
                "dims = excluded.dims, draws_blob = excluded.draws_blob";

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(fitSql)) {
                    ps.setString(1, fit.getFitId());
                    ps.setString(2, fit.getFamily());
                    ps.setString(3, fit.getLink());
                    ps.setInt(4, fit.getGroupCount());
                    ps.setInt(5, fit.getIterationCount());
                    ps.setString(6, fit.getRequestJson());
                    ps.setLong(7, fit.getCreatedTs());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(drawSql)) {
                    for (String name : draws.getParameterNames()) {
                        ParameterDraws p = draws.get(name);
                        ps.setString(1, fit.getFitId());
                        ps.setString(2, name);
                        ps.setString(3, encodeDims(p.getDims()));
                        ps.setBytes(4, DrawMatrixCodec.toBytes(p.toMatrix()));
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    public Optional<PosteriorFitRecord> loadFit(String fitId) throws SQLException {
        String sql = "SELECT fit_id, family, link, group_count, iteration_count, request_json, created_ts " +
                "FROM posterior_fit WHERE fit_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, fitId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new PosteriorFitRecord(
                            rs.getString("fit_id"),
                            rs.getString("family"),
                            rs.getString("link"),
                            rs.getInt("group_count"),
                            rs.getInt("iteration_count"),
                            rs.getString("request_json"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All cached parameters of a fit, in insertion order. Empty when the fit has none.
     */
    public Optional<PosteriorDraws> loadDraws(String fitId) throws SQLException {
        String sql = "SELECT parameter_name, dims, draws_blob FROM posterior_draws WHERE fit_id = ? ORDER BY id";
        Map<String, ParameterDraws> params = new LinkedHashMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, fitId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("parameter_name");
                    int[] dims = decodeDims(rs.getString("dims"));
                    double[][] values = DrawMatrixCodec.fromBytes(rs.getBytes("draws_blob"));
                    params.put(name, new ParameterDraws(name, dims, values));
                }
            }
        }
        if (params.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PosteriorDraws(params, "loaded from cache"));
    }

    public void deleteFit(String fitId) throws SQLException {
        try (Connection conn = connect()) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM posterior_draws WHERE fit_id = ?")) {
                ps.setString(1, fitId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM posterior_fit WHERE fit_id = ?")) {
                ps.setString(1, fitId);
                ps.executeUpdate();
            }
        }
    }

    static String encodeDims(int[] dims) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < dims.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(dims[i]);
        }
        return sb.toString();
    }

    static int[] decodeDims(String text) {
        if (text == null || text.isEmpty()) {
            return new int[0];
        }
        String[] parts = text.split(",");
        int[] dims = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            dims[i] = Integer.parseInt(parts[i].trim());
        }
        return dims;
    }
}
