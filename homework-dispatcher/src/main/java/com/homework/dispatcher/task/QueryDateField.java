package com.homework.dispatcher.task;

/**
 * 查询时匹配的日期字段。
 */
public enum QueryDateField {

    DUE("due", "截止"),
    CREATE("create", "创建");

    private final String value;
    private final String label;

    QueryDateField(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 只有 "create" 表示按创建日期查询，其余按截止日期。
     */
    public static QueryDateField fromValue(String value) {
        if (value != null && CREATE.value.equalsIgnoreCase(value.trim())) {
            return CREATE;
        }
        return DUE;
    }
}
