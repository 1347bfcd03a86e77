package com.homework.dispatcher.task;

import lombok.Value;

/**
 * 标记完成的参数。
 */
@Value
public class MarkCompletedParams implements TaskParams {

    String code;
}
