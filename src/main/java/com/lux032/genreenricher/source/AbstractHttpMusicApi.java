package com.lux032.genreenricher.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.RateLimiter;
import com.lux032.genreenricher.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * 基于 HttpClient 的音乐服务客户端基类
 * 每个 HTTP 请求前按 来源_操作 获取令牌, 例如 musicbrainz_search
 */
@Slf4j
public abstract class AbstractHttpMusicApi implements MusicApi, Closeable {

    protected final EnricherConfig config;
    protected final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final CloseableHttpClient httpClient;

    protected AbstractHttpMusicApi(EnricherConfig config, RateLimiter rateLimiter) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.objectMapper = new ObjectMapper();
        this.httpClient = createHttpClient(config);
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    private CloseableHttpClient createHttpClient(EnricherConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        // 设置超时
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(config.getConnectTimeoutSeconds()))
            .setResponseTimeout(Timeout.ofSeconds(config.getResponseTimeoutSeconds()))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        // 配置代理
        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.info(I18nUtil.getMessage("proxy.enabled", getName(), config.getProxyHost(), config.getProxyPort()));
        } else if (config.isProxyEnabled()) {
            log.warn(I18nUtil.getMessage("proxy.enabled.no.host"));
        }

        return builder.build();
    }

    /**
     * 获取令牌后执行 GET 请求并解析 JSON
     * @param info 当前查询结果, 请求被限流时会打上标记
     * @param operation 操作名, 与来源标识组成限流 key
     * @return 响应 JSON, 404 时返回 null
     * @throws SourceRequestException 本次查询等待过令牌后请求失败
     */
    protected JsonNode getJson(TrackInfo info, String operation, String url) throws IOException {
        throttle(info, operation);
        try {
            String body = fetch(url, requestHeaders());
            if (body == null) {
                return null;
            }
            return objectMapper.readTree(body);
        } catch (IOException e) {
            if (info.isRateLimited()) {
                throw new SourceRequestException(e.getMessage(), e, true);
            }
            throw e;
        }
    }

    private void throttle(TrackInfo info, String operation) throws IOException {
        if (rateLimiter == null) {
            return;
        }
        String key = getId() + "_" + operation;
        if (rateLimiter.acquire(key, 1.0, false)) {
            return;
        }
        info.setRateLimited(true);
        log.debug("Rate limit {} exhausted, waiting for a token", key);
        if (!rateLimiter.acquire(key)) {
            throw new InterruptedIOException("Gave up waiting for rate limit " + key);
        }
    }

    /**
     * 请求头, 子类可以追加认证信息
     */
    protected Map<String, String> requestHeaders() {
        return Collections.emptyMap();
    }

    /**
     * 执行 HTTP GET
     * @return 响应正文, 404 时返回 null
     * @throws IOException 其他非 2xx 状态或网络错误
     */
    protected String fetch(String url, Map<String, String> headers) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("User-Agent", config.getUserAgent());
        httpGet.setHeader("Accept", "application/json");
        headers.forEach(httpGet::setHeader);

        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            int statusCode = response.getCode();
            String responseBody = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";

            if (statusCode == 404) {
                log.debug("{} returned 404 for {}", getName(), url);
                return null;
            }
            if (statusCode < 200 || statusCode >= 300) {
                log.error("{} API request failed: {} - {}", getName(), statusCode, responseBody);
                throw new IOException(getName() + " API request failed: " + statusCode);
            }
            log.trace("{} API response: {}", getName(), responseBody);
            return responseBody;
        } catch (ParseException e) {
            throw new IOException("Failed to read " + getName() + " response", e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
