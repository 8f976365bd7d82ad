package com.lux032.genreenricher.service;

/**
 * 一个文件的所有来源查询都失败时抛出
 */
public class SourceUnavailableException extends Exception {

    public SourceUnavailableException(String message) {
        super(message);
    }
}
