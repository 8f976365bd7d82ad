package com.lux032.genreenricher.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 元数据工具类
 */
public class MetadataUtils {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2030;

    private static final Pattern FOUR_DIGITS = Pattern.compile("(\\d{4})");

    private MetadataUtils() {
    }

    /**
     * 从日期字符串中提取年份, 例如 "1982-11-30" → "1982"
     * @return 年份不在 1900-2030 范围内或无法解析时返回 null
     */
    public static String extractYear(String date) {
        if (date == null || date.isEmpty()) {
            return null;
        }
        Matcher matcher = FOUR_DIGITS.matcher(date);
        if (!matcher.find()) {
            return null;
        }
        int year = Integer.parseInt(matcher.group(1));
        if (year < MIN_YEAR || year > MAX_YEAR) {
            return null;
        }
        return String.valueOf(year);
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * 计算字符串的 MD5 十六进制摘要
     */
    public static String md5Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5算法不可用", e);
        }
    }
}
