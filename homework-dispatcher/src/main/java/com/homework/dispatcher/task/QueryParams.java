package com.homework.dispatcher.task;

import lombok.Builder;
import lombok.Value;

/**
 * 按日期查询的参数。
 */
@Value
@Builder
public class QueryParams implements TaskParams {

    String queryDate;

    @Builder.Default
    QueryDateField field = QueryDateField.DUE;
}
