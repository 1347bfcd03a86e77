package com.homework.common.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 作业的持久化完成状态，只有"标记完成"任务会修改它。
 */
public enum HomeworkStatus {

    PENDING("pending"),
    COMPLETED("completed");

    private final String value;

    HomeworkStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 除 "completed" 以外的任何取值都视为未完成。
     */
    @JsonCreator
    public static HomeworkStatus fromValue(String value) {
        if (value != null && COMPLETED.value.equalsIgnoreCase(value.trim())) {
            return COMPLETED;
        }
        return PENDING;
    }
}
