package com.homework.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 不可变的配置快照，每次派发任务时交给处理器。
 * <p>
 * 文档中核心不关心的配置项（主题、窗口尺寸、字号等）原样保存在 {@code extras} 中，
 * 保存时写回，不丢失。
 */
@Value
@Builder(toBuilder = true)
public class HomeworkSettings {

    public static final String REMIND_DAYS_KEY = "remind_days";
    public static final String CHART_DAYS_KEY = "chart_days";

    private static final String REMIND_DAYS_ALIAS = "remindDays";
    private static final String CHART_DAYS_ALIAS = "chartDays";

    /** 距截止日期多少天以内视为"即将截止" */
    int remindDays;

    /** 趋势统计覆盖的天数 */
    int chartDays;

    @Singular
    Map<String, Object> extras;

    /**
     * 用文档中的配置覆盖默认值，无法识别为整数的取值保留默认。
     */
    public HomeworkSettings merge(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return this;
        }
        HomeworkSettingsBuilder builder = toBuilder();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (REMIND_DAYS_KEY.equals(key) || REMIND_DAYS_ALIAS.equals(key)) {
                builder.remindDays(toInt(value, remindDays));
            } else if (CHART_DAYS_KEY.equals(key) || CHART_DAYS_ALIAS.equals(key)) {
                builder.chartDays(toInt(value, chartDays));
            } else {
                builder.extra(key, value);
            }
        }
        return builder.build();
    }

    /**
     * 转换为文档中 settings 节点的内容。
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>(extras);
        document.put(REMIND_DAYS_KEY, remindDays);
        document.put(CHART_DAYS_KEY, chartDays);
        return document;
    }

    private static int toInt(Object value, int fallback) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
