package com.homework.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * 添加作业的请求体，字段校验由添加任务负责。
 */
@Data
public class AddHomeworkRequest {

    private String code;
    private String subject;
    private String content;

    @JsonAlias("create_date")
    private String createDate;

    @JsonAlias("due_date")
    private String dueDate;
}
