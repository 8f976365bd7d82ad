package com.lux032.genreenricher.model;

import lombok.Data;

/**
 * 某个来源给出的一条原始流派标签及其置信度
 */
@Data
public class GenreSignal {

    private final String rawTag;
    private final String source;
    private final double confidence; // [0, 1]

    public GenreSignal(String rawTag, String source, double confidence) {
        this.rawTag = rawTag;
        this.source = source;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
