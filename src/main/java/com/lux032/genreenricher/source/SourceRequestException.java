package com.lux032.genreenricher.source;

import java.io.IOException;

/**
 * 来源请求失败, 并且这次查询曾等待过限流令牌
 */
public class SourceRequestException extends IOException {

    private final boolean rateLimited;

    public SourceRequestException(String message, Throwable cause, boolean rateLimited) {
        super(message, cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
