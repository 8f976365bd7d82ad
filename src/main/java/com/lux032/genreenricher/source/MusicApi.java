package com.lux032.genreenricher.source;

import com.lux032.genreenricher.model.TrackInfo;

import java.io.IOException;

/**
 * 外部音乐信息服务
 */
public interface MusicApi {

    /**
     * 配置和限流 key 使用的标识, 例如 musicbrainz
     */
    String getId();

    /**
     * 显示名称, 例如 MusicBrainz
     */
    String getName();

    /**
     * 缺少 API Key 等必要配置时返回 false, 查询时直接跳过
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * 查询曲目信息
     * 没有找到数据时返回空的 TrackInfo, 不做内部重试
     * @throws IOException 网络、认证或服务端错误
     */
    TrackInfo getTrackInfo(String artist, String title) throws IOException;
}
