package com.lux032.genreenricher.util;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 日志和控制台输出的多语言消息
 * 资源文件为 classpath 下的 messages_{language}.properties, 占位符统一使用 SLF4J 的 {}
 */
@Slf4j
public final class I18nUtil {

    public static final String DEFAULT_LANGUAGE = "en_US";

    private static volatile Properties messages;
    private static volatile String currentLanguage = DEFAULT_LANGUAGE;

    private I18nUtil() {
    }

    /**
     * 加载指定语言的资源, 找不到时回退到英文
     * @param language 语言代码, 如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        String requested = language == null || language.trim().isEmpty() ? DEFAULT_LANGUAGE : language.trim();

        Properties loaded = load(requested);
        if (loaded == null && !DEFAULT_LANGUAGE.equals(requested)) {
            log.warn("No i18n resource for language {}, falling back to {}", requested, DEFAULT_LANGUAGE);
            requested = DEFAULT_LANGUAGE;
            loaded = load(requested);
        }

        currentLanguage = requested;
        messages = loaded != null ? loaded : new Properties();
    }

    private static Properties load(String language) {
        String resourceFile = "/messages_" + language + ".properties";
        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            return null;
        }
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            properties.load(reader);
            log.debug("Loaded i18n resource file: {}", resourceFile);
            return properties;
        } catch (IOException e) {
            log.error("Failed to read i18n resource file: {}", resourceFile, e);
            return null;
        }
    }

    private static Properties messages() {
        Properties current = messages;
        if (current == null) {
            init(currentLanguage);
            current = messages;
        }
        return current;
    }

    /**
     * 获取消息, 找不到时返回键本身
     */
    public static String getMessage(String key) {
        return messages().getProperty(key, key);
    }

    /**
     * 获取消息并按顺序替换 {} 占位符
     */
    public static String getMessage(String key, Object... args) {
        String pattern = getMessage(key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return MessageFormatter.arrayFormat(pattern, args).getMessage();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }
}
