package com.homework.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * 一条作业记录。
 * <p>
 * {@code code} 是主键，创建后不可修改；日期以 DD/MM/YYYY 文本保存，
 * 解析失败时按"进行中"处理。
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class HomeworkItem {

    private final String code;
    private final String subject;
    private final String content;

    @JsonProperty("create_date")
    private final String createDate;

    @JsonProperty("due_date")
    private final String dueDate;

    @Setter
    @Builder.Default
    private HomeworkStatus status = HomeworkStatus.PENDING;

    @JsonIgnore
    public boolean isCompleted() {
        return status == HomeworkStatus.COMPLETED;
    }

    /**
     * 复制一份独立的记录，供工作线程读取。
     */
    public HomeworkItem copy() {
        return toBuilder().build();
    }
}
