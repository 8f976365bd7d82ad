package com.lux032.genreenricher.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 流派名称清洗工具
 * 负责拆分原始标签、过滤噪声词和年份、统一大小写
 */
public class GenreNameUtils {

    /**
     * 非流派噪声词, 大小写不敏感的子串匹配
     */
    public static final Set<String> BLACKLIST_TERMS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        "victim", "fire", "universal", "compilation", "unknown", "soundtrack",
        "http", "fix", "tag", "mess", "error", "todo", "check",
        "wrong", "unclassifiable", "other", "others",
        "delete", "seen live", "favorites", "favourite", "test",
        "misc", "checked", "need", "spotify", "lastfm", "indy",
        "artist", "artists", "video", "title",
        "dj", "remix", "mix", "bootleg", "edit", "promo", "radio", "club", "live",
        "album", "single", "track", "version", "original", "extended", "instrumental"
    )));

    public static final int MAX_GENRE_LENGTH = 50;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPARATORS = Pattern.compile("[;,/]");
    private static final Pattern YEAR = Pattern.compile("\\s*\\b(19|20)\\d{2}\\b");

    private GenreNameUtils() {
    }

    /**
     * 清洗并拆分原始流派字符串
     * 例如 "Rock; Pop, Soundtrack 2020" → [Rock, Pop]
     * @param rawGenre 原始标签, 可以包含 ; , / 分隔的多个流派
     * @return 清洗后的流派列表(标题大小写, 去重, 保持原顺序)
     */
    public static List<String> cleanAndSplitGenrePayload(String rawGenre) {
        if (rawGenre == null || rawGenre.isEmpty()) {
            return Collections.emptyList();
        }

        String cleaned = CONTROL_CHARS.matcher(rawGenre).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");

        List<String> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String item : SEPARATORS.split(cleaned)) {
            String part = item.trim();
            if (part.isEmpty() || containsBlacklistedTerm(part)) {
                continue;
            }

            // 去掉嵌入的年份, 只有年份的标签会变成空串
            part = YEAR.matcher(part).replaceAll("");
            String titled = toTitleCase(part).trim();

            if (isValidGenreName(titled) && seen.add(titled.toLowerCase(Locale.ROOT))) {
                result.add(titled);
            }
        }
        return result;
    }

    public static boolean containsBlacklistedTerm(String genre) {
        String lower = genre.toLowerCase(Locale.ROOT);
        for (String term : BLACKLIST_TERMS) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 至少两个字符, 含有字母, 且不超过长度上限
     */
    public static boolean isValidGenreName(String genre) {
        if (genre == null) {
            return false;
        }
        String trimmed = genre.trim();
        if (trimmed.length() < 2 || trimmed.length() >= MAX_GENRE_LENGTH) {
            return false;
        }
        return trimmed.chars().anyMatch(Character::isLetter);
    }

    /**
     * 标题大小写: 字母前一个字符不是字母时大写, 否则小写
     * "hip-hop" → "Hip-Hop", "drum and bass" → "Drum And Bass"
     */
    public static String toTitleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }
}
