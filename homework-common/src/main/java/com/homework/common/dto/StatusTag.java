package com.homework.common.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 派生状态标签：由截止日期、完成状态、当前日期和提醒天数计算得出，不持久化。
 * <p>
 * {@link #getWeight()} 是列表排序的主键，数值越小越靠前。
 */
public enum StatusTag {

    DUE_TODAY("due_today", "今天截止", 0),
    OVERDUE("overdue", "逾期", 1),
    DUE_SOON("due_soon", "即将截止", 2),
    PENDING("pending", "进行中", 3),
    COMPLETED("completed", "已完成", 4);

    private final String value;
    private final String label;
    private final int weight;

    StatusTag(String value, String label, int weight) {
        this.value = value;
        this.label = label;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public int getWeight() {
        return weight;
    }
}
