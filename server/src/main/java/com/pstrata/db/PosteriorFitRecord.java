package com.pstrata.db;

public class PosteriorFitRecord {

    private final String fitId;
    private final String family;
    private final String link;
    private final int groupCount;
    private final int iterationCount;
    private final String requestJson;
    private final long createdTs;

    public PosteriorFitRecord(String fitId, String family, String link, int groupCount, int iterationCount,
            String requestJson, long createdTs) {
        this.fitId = fitId;
        this.family = family;
        this.link = link;
        this.groupCount = groupCount;
        this.iterationCount = iterationCount;
        this.requestJson = requestJson;
        this.createdTs = createdTs;
    }

    public String getFitId() {
        return fitId;
    }

    public String getFamily() {
        return family;
    }

    public String getLink() {
        return link;
    }

    public int getGroupCount() {
        return groupCount;
    }

    public int getIterationCount() {
        return iterationCount;
    }

    /**
     * The model request the fit was compiled from, so the group table can be rebuilt.
     */
    public String getRequestJson() {
        return requestJson;
    }

    public long getCreatedTs() {
        return createdTs;
    }
}
