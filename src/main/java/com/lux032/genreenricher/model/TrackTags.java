package com.lux032.genreenricher.model;

import lombok.Data;

/**
 * 从音频文件读取的现有标签
 */
@Data
public class TrackTags {

    private String artist;
    private String title;
    private String album;
    private String year;
    private String genre;

    public boolean hasArtistAndTitle() {
        return isPresent(artist) && isPresent(title);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty() && !"None".equals(value);
    }
}
