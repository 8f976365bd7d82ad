package com.lux032.genreenricher.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 流派补全工具配置类
 */
@Slf4j
@Data
public class EnricherConfig {

    public static final String DEFAULT_CONFIG_FILE = "config.properties";

    /**
     * 单个令牌桶的配置
     */
    @Data
    public static class RateLimitSetting {
        private final double capacity;
        private final double fillRate; // 每秒
    }

    // 数据源配置
    private List<String> enabledSources;
    private String musicBrainzApiUrl;
    private String lastFmApiUrl;
    private String lastFmApiKey;
    private String discogsApiUrl;
    private String discogsToken;
    private String userAgent;

    // 限流配置, key 为 来源_操作
    private Map<String, RateLimitSetting> rateLimits;

    // 熔断配置
    private int breakerFailureThreshold;
    private int breakerResetTimeoutSeconds;

    // 批处理配置
    private int workerThreads;
    private int maxBreakerRetries;
    private String[] supportedFormats;

    // 流派筛选配置
    private double confidence;
    private double minConfidence;
    private int maxGenres;
    private int maxTags;
    private boolean dynamicThresholdEnabled;
    private double dynamicThresholdMin;
    private double dynamicThresholdMax;

    // 指标与缓存
    private String metricsFile;
    private String cacheDirectory;
    private long cacheTtlSeconds;

    // HTTP 配置
    private int connectTimeoutSeconds;
    private int responseTimeoutSeconds;
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // 文件处理配置
    private boolean dryRun;
    private boolean createBackup;
    private String backupDirectory;
    private boolean writeYearAndAlbum;

    // 国际化配置
    private String language;

    private static EnricherConfig instance;

    private EnricherConfig() {
        String home = System.getProperty("user.home") + "/.genreenricher";

        this.enabledSources = new ArrayList<>(Arrays.asList("musicbrainz", "lastfm", "discogs"));
        this.musicBrainzApiUrl = "https://musicbrainz.org/ws/2";
        this.lastFmApiUrl = "https://ws.audioscrobbler.com/2.0/";
        this.discogsApiUrl = "https://api.discogs.com";
        this.userAgent = "GenreEnricher/1.0 ( contact@example.com )";

        this.rateLimits = new LinkedHashMap<>();
        this.rateLimits.put("musicbrainz_search", new RateLimitSetting(2, 1.0));
        this.rateLimits.put("musicbrainz_lookup", new RateLimitSetting(2, 1.0));
        this.rateLimits.put("lastfm_default", new RateLimitSetting(10, 5.0));
        this.rateLimits.put("discogs_search", new RateLimitSetting(5, 1.0));
        this.rateLimits.put("discogs_lookup", new RateLimitSetting(5, 1.0));

        this.breakerFailureThreshold = 5;
        this.breakerResetTimeoutSeconds = 60;

        this.workerThreads = 3;
        this.maxBreakerRetries = 3;
        this.supportedFormats = new String[]{"mp3"};

        this.confidence = 0.3;
        this.minConfidence = 0.2;
        this.maxGenres = 3;
        this.maxTags = 100;
        this.dynamicThresholdEnabled = false;
        this.dynamicThresholdMin = 0.1;
        this.dynamicThresholdMax = 0.8;

        this.metricsFile = home + "/api_metrics.json";
        this.cacheDirectory = home + "/cache";
        this.cacheTtlSeconds = 3600;

        this.connectTimeoutSeconds = 10;
        this.responseTimeoutSeconds = 30;

        this.dryRun = false;
        this.createBackup = false;
        this.backupDirectory = null; // 为空时备份到源文件同目录
        this.writeYearAndAlbum = true;

        this.language = "en_US";
    }

    /**
     * 获取配置单例, 首次调用时从工作目录的 config.properties 加载
     */
    public static synchronized EnricherConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(DEFAULT_CONFIG_FILE));
        }
        return instance;
    }

    /**
     * 只包含内置默认值的配置
     */
    public static EnricherConfig defaults() {
        return new EnricherConfig();
    }

    /**
     * 从指定文件加载配置, 文件不存在时写出一份默认配置
     */
    public static EnricherConfig load(Path configPath) {
        EnricherConfig config = new EnricherConfig();
        if (!Files.exists(configPath)) {
            log.info("Configuration file {} not found, generating default configuration", configPath);
            try {
                config.saveToFile(configPath);
            } catch (IOException e) {
                log.error("Failed to create default configuration: {}", e.getMessage());
            }
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath)) {
            props.load(in);
            config.apply(props);
            log.info("Configuration file loaded successfully: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to read configuration {}, using defaults: {}", configPath, e.getMessage());
        }
        return config;
    }

    /**
     * 以默认值为基础应用属性
     */
    public static EnricherConfig fromProperties(Properties props) {
        EnricherConfig config = new EnricherConfig();
        config.apply(props);
        return config;
    }

    private void apply(Properties props) {
        if (props.containsKey("sources.enabled")) {
            this.enabledSources = splitList(props.getProperty("sources.enabled"));
        }
        this.musicBrainzApiUrl = props.getProperty("musicbrainz.apiUrl", musicBrainzApiUrl);
        this.lastFmApiUrl = props.getProperty("lastfm.apiUrl", lastFmApiUrl);
        this.lastFmApiKey = props.getProperty("lastfm.apiKey", lastFmApiKey);
        this.discogsApiUrl = props.getProperty("discogs.apiUrl", discogsApiUrl);
        this.discogsToken = props.getProperty("discogs.token", discogsToken);
        this.userAgent = props.getProperty("http.userAgent", userAgent);

        // ratelimit.<key>.capacity / ratelimit.<key>.fillRate
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith("ratelimit.") && name.endsWith(".capacity")) {
                String key = name.substring("ratelimit.".length(), name.length() - ".capacity".length());
                RateLimitSetting current = rateLimits.get(key);
                double capacity = parseDouble(props, name, current != null ? current.getCapacity() : 1.0);
                double fillRate = parseDouble(props, "ratelimit." + key + ".fillRate",
                    current != null ? current.getFillRate() : 1.0);
                rateLimits.put(key, new RateLimitSetting(capacity, fillRate));
            } else if (name.startsWith("ratelimit.") && name.endsWith(".fillRate")) {
                String key = name.substring("ratelimit.".length(), name.length() - ".fillRate".length());
                if (!props.containsKey("ratelimit." + key + ".capacity")) {
                    RateLimitSetting current = rateLimits.get(key);
                    double capacity = current != null ? current.getCapacity() : 1.0;
                    rateLimits.put(key, new RateLimitSetting(capacity,
                        parseDouble(props, name, current != null ? current.getFillRate() : 1.0)));
                }
            }
        }

        this.breakerFailureThreshold = parseInt(props, "breaker.failureThreshold", breakerFailureThreshold);
        this.breakerResetTimeoutSeconds = parseInt(props, "breaker.resetTimeoutSeconds", breakerResetTimeoutSeconds);

        this.workerThreads = parseInt(props, "batch.workerThreads", workerThreads);
        this.maxBreakerRetries = parseInt(props, "batch.maxBreakerRetries", maxBreakerRetries);
        if (props.containsKey("file.supportedFormats")) {
            List<String> formats = splitList(props.getProperty("file.supportedFormats"));
            if (!formats.isEmpty()) {
                this.supportedFormats = formats.toArray(new String[0]);
            }
        }

        this.confidence = parseDouble(props, "genre.confidence", confidence);
        this.minConfidence = parseDouble(props, "genre.minConfidence", minConfidence);
        this.maxGenres = parseInt(props, "genre.maxGenres", maxGenres);
        this.maxTags = parseInt(props, "genre.maxTags", maxTags);
        if (props.containsKey("genre.dynamicThreshold.enabled")) {
            this.dynamicThresholdEnabled = Boolean.parseBoolean(props.getProperty("genre.dynamicThreshold.enabled"));
        }
        this.dynamicThresholdMin = parseDouble(props, "genre.dynamicThreshold.min", dynamicThresholdMin);
        this.dynamicThresholdMax = parseDouble(props, "genre.dynamicThreshold.max", dynamicThresholdMax);

        this.metricsFile = props.getProperty("metrics.file", metricsFile);
        this.cacheDirectory = props.getProperty("cache.directory", cacheDirectory);
        this.cacheTtlSeconds = parseLong(props, "cache.ttlSeconds", cacheTtlSeconds);

        this.connectTimeoutSeconds = parseInt(props, "http.connectTimeoutSeconds", connectTimeoutSeconds);
        this.responseTimeoutSeconds = parseInt(props, "http.responseTimeoutSeconds", responseTimeoutSeconds);
        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled"));
        }
        this.proxyHost = props.getProperty("proxy.host", proxyHost);
        this.proxyPort = parseInt(props, "proxy.port", proxyPort);

        if (props.containsKey("file.dryRun")) {
            this.dryRun = Boolean.parseBoolean(props.getProperty("file.dryRun"));
        }
        if (props.containsKey("file.createBackup")) {
            this.createBackup = Boolean.parseBoolean(props.getProperty("file.createBackup"));
        }
        this.backupDirectory = props.getProperty("file.backupDirectory", backupDirectory);
        if (props.containsKey("file.writeYearAndAlbum")) {
            this.writeYearAndAlbum = Boolean.parseBoolean(props.getProperty("file.writeYearAndAlbum"));
        }

        this.language = props.getProperty("i18n.language", language);

        if (proxyEnabled) {
            log.info("HTTP proxy enabled: {}:{}", proxyHost, proxyPort);
        }
    }

    void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("sources.enabled", String.join(",", enabledSources));
        props.setProperty("musicbrainz.apiUrl", musicBrainzApiUrl);
        props.setProperty("lastfm.apiUrl", lastFmApiUrl);
        if (lastFmApiKey != null) {
            props.setProperty("lastfm.apiKey", lastFmApiKey);
        }
        props.setProperty("discogs.apiUrl", discogsApiUrl);
        if (discogsToken != null) {
            props.setProperty("discogs.token", discogsToken);
        }
        props.setProperty("http.userAgent", userAgent);
        rateLimits.forEach((key, setting) -> {
            props.setProperty("ratelimit." + key + ".capacity", String.valueOf(setting.getCapacity()));
            props.setProperty("ratelimit." + key + ".fillRate", String.valueOf(setting.getFillRate()));
        });
        props.setProperty("breaker.failureThreshold", String.valueOf(breakerFailureThreshold));
        props.setProperty("breaker.resetTimeoutSeconds", String.valueOf(breakerResetTimeoutSeconds));
        props.setProperty("batch.workerThreads", String.valueOf(workerThreads));
        props.setProperty("batch.maxBreakerRetries", String.valueOf(maxBreakerRetries));
        props.setProperty("file.supportedFormats", String.join(",", supportedFormats));
        props.setProperty("genre.confidence", String.valueOf(confidence));
        props.setProperty("genre.minConfidence", String.valueOf(minConfidence));
        props.setProperty("genre.maxGenres", String.valueOf(maxGenres));
        props.setProperty("genre.maxTags", String.valueOf(maxTags));
        props.setProperty("genre.dynamicThreshold.enabled", String.valueOf(dynamicThresholdEnabled));
        props.setProperty("genre.dynamicThreshold.min", String.valueOf(dynamicThresholdMin));
        props.setProperty("genre.dynamicThreshold.max", String.valueOf(dynamicThresholdMax));
        props.setProperty("metrics.file", metricsFile);
        props.setProperty("cache.directory", cacheDirectory);
        props.setProperty("cache.ttlSeconds", String.valueOf(cacheTtlSeconds));
        props.setProperty("http.connectTimeoutSeconds", String.valueOf(connectTimeoutSeconds));
        props.setProperty("http.responseTimeoutSeconds", String.valueOf(responseTimeoutSeconds));
        props.setProperty("proxy.enabled", String.valueOf(proxyEnabled));
        if (proxyHost != null) {
            props.setProperty("proxy.host", proxyHost);
        }
        props.setProperty("proxy.port", String.valueOf(proxyPort));
        props.setProperty("file.dryRun", String.valueOf(dryRun));
        props.setProperty("file.createBackup", String.valueOf(createBackup));
        if (backupDirectory != null) {
            props.setProperty("file.backupDirectory", backupDirectory);
        }
        props.setProperty("file.writeYearAndAlbum", String.valueOf(writeYearAndAlbum));
        props.setProperty("i18n.language", language);

        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(configPath)) {
            props.store(out, "Auto-generated by GenreEnricher");
        }
        log.info("Default configuration saved to {}", configPath);
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (enabledSources == null || enabledSources.isEmpty()) {
            log.error("No music source enabled");
            return false;
        }
        if (workerThreads < 1) {
            log.error("batch.workerThreads must be at least 1: {}", workerThreads);
            return false;
        }
        if (breakerFailureThreshold < 1) {
            log.error("breaker.failureThreshold must be at least 1: {}", breakerFailureThreshold);
            return false;
        }
        if (confidence < 0 || confidence > 1 || minConfidence < 0 || minConfidence > 1) {
            log.error("Genre confidence values must be within [0, 1]");
            return false;
        }
        if (dynamicThresholdMin > dynamicThresholdMax) {
            log.error("genre.dynamicThreshold.min is greater than genre.dynamicThreshold.max");
            return false;
        }
        if (enabledSources.contains("lastfm") && (lastFmApiKey == null || lastFmApiKey.isEmpty())) {
            log.warn("Last.fm API key not configured, Last.fm lookups will be skipped");
        }
        if (enabledSources.contains("discogs") && (discogsToken == null || discogsToken.isEmpty())) {
            log.warn("Discogs token not configured, Discogs lookups will be skipped");
        }
        return true;
    }

    private static List<String> splitList(String value) {
        if (value == null) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return defaultValue;
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return defaultValue;
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return defaultValue;
        }
    }
}
