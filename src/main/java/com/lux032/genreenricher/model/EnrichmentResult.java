package com.lux032.genreenricher.model;

import lombok.Data;

import java.io.File;

/**
 * 单个文件的富化结果
 */
@Data
public class EnrichmentResult {

    private final File file;
    private final EnrichmentOutcome outcome;
    private TrackTags originalTags;
    private AggregatedResult aggregated;
    private LookupResult lookup;
    private String writtenYear;
    private String writtenAlbum;
    private String message;

    public EnrichmentResult(File file, EnrichmentOutcome outcome) {
        this.file = file;
        this.outcome = outcome;
    }

    @Override
    public String toString() {
        return String.format("EnrichmentResult{file='%s', outcome=%s, genres=%s, threshold=%.2f}",
            file.getName(), outcome,
            aggregated != null ? aggregated.getGenres() : "[]",
            aggregated != null ? aggregated.getThresholdUsed() : 0.0);
    }
}
