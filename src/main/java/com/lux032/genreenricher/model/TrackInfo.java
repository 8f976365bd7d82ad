package com.lux032.genreenricher.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个来源返回的曲目信息
 * 缺失的数据为空列表或 null, 不代表错误
 */
@Data
@NoArgsConstructor
public class TrackInfo {

    private List<String> genres = new ArrayList<>();
    private String year;
    private String album;
    private String sourceApi;

    // 本次查询是否等待过令牌, 不写入缓存
    private transient boolean rateLimited;

    public TrackInfo(String sourceApi) {
        this.sourceApi = sourceApi;
    }

    public static TrackInfo empty(String sourceApi) {
        return new TrackInfo(sourceApi);
    }

    /**
     * 添加流派, 忽略空值和大小写重复
     */
    public void addGenre(String genre) {
        if (genre == null || genre.trim().isEmpty()) {
            return;
        }
        String trimmed = genre.trim();
        for (String existing : genres) {
            if (existing.equalsIgnoreCase(trimmed)) {
                return;
            }
        }
        genres.add(trimmed);
    }

    public boolean isEmpty() {
        return (genres == null || genres.isEmpty()) && year == null && album == null;
    }
}
