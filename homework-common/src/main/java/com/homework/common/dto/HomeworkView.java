package com.homework.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 展示层使用的一行作业数据：记录本身加上当前的派生状态标签。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HomeworkView {

    private String code;
    private String subject;
    private String content;
    private String createDate;
    private String dueDate;
    private StatusTag tag;

    public static HomeworkView of(HomeworkItem item, StatusTag tag) {
        return HomeworkView.builder()
                .code(item.getCode())
                .subject(item.getSubject())
                .content(item.getContent())
                .createDate(item.getCreateDate())
                .dueDate(item.getDueDate())
                .tag(tag)
                .build();
    }
}
