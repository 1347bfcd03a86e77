package com.homework.dispatcher.task;

import lombok.Builder;
import lombok.Value;

/**
 * 添加作业的参数，字段在处理器中校验。
 */
@Value
@Builder
public class AddHomeworkParams implements TaskParams {

    String code;
    String subject;
    String content;
    String createDate;
    String dueDate;
}
