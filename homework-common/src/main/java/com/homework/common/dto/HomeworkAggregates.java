package com.homework.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 统计汇总：状态分布、概要统计与最近若干天的作业量趋势。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HomeworkAggregates {

    /** 展示中的作业按状态标签计数（五个标签都有键） */
    private Map<StatusTag, Integer> statusCounts;

    /** 展示中的作业总数 */
    private int total;

    private int completed;
    private int overdue;
    private int dueToday;

    /** 趋势日期（DD/MM/YYYY，由远到近） */
    private List<String> trendDates;

    /** 每天创建的作业数，与 trendDates 一一对应 */
    private List<Integer> createdCounts;

    /** 每天截止的作业数，与 trendDates 一一对应 */
    private List<Integer> dueCounts;
}
