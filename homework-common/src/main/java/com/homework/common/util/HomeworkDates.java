package com.homework.common.util;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 作业日期解析器，带有容量上限的解析缓存。
 * <p>
 * 支持的输入格式：
 * <ul>
 *   <li>{@code D/M/YYYY}、{@code DD/MM/YYYY}</li>
 *   <li>{@code /} 分隔的两位年份一律按 2000 年之后计算，如 {@code 1/2/25}</li>
 *   <li>以 {@code -} 分隔的 {@code D-M-YYYY}、{@code D-M-YY}；
 *       其中两位年份 69-99 为 19xx，00-68 为 20xx</li>
 * </ul>
 * 标准格式为 {@code DD/MM/YYYY}。解析失败返回空，不抛异常。
 */
public class HomeworkDates {

    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    /** 两位年份的起点：69 -> 1969，68 -> 2068 */
    private static final int TWO_DIGIT_YEAR_BASE = 1969;

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            new DateTimeFormatterBuilder()
                    .appendPattern("d-M-")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE)
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT));

    private static final Pattern SLASH_DATE = Pattern.compile("(\\d{1,2})\\s*/\\s*(\\d{1,2})\\s*/\\s*(\\d{1,4})");

    private final Cache<String, Optional<LocalDate>> cache;

    public HomeworkDates(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * 解析日期字符串，结果会被缓存。
     */
    public Optional<LocalDate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return cache.get(trimmed, HomeworkDates::parseUncached);
    }

    /**
     * 格式化为标准格式 DD/MM/YYYY。
     */
    public String format(LocalDate date) {
        return date.format(CANONICAL);
    }

    /**
     * 规范化日期字符串；无法解析时原样返回。
     */
    public String normalize(String text) {
        return parse(text).map(this::format).orElse(text);
    }

    /**
     * 清空解析缓存（清空全部作业时调用）。
     */
    public void clearCache() {
        cache.invalidateAll();
    }

    public long cachedCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static Optional<LocalDate> parseUncached(String text) {
        // 快速路径：D/M/Y
        Matcher matcher = SLASH_DATE.matcher(text);
        if (matcher.matches()) {
            int day = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int year = Integer.parseInt(matcher.group(3));
            if (year < 100) {
                year += 2000;
            }
            Optional<LocalDate> date = toDate(year, month, day);
            if (date.isPresent()) {
                return date;
            }
        }

        for (DateTimeFormatter formatter : FALLBACK_FORMATS) {
            Optional<LocalDate> date = tryParse(text, formatter);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(text, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
