package com.homework.status.service;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.dto.StatusTag;
import com.homework.common.util.HomeworkDates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 作业状态分类器：纯函数，相同输入总是得到相同标签。
 * <p>
 * 规则：
 * <ol>
 *   <li>已完成的作业始终为 {@link StatusTag#COMPLETED}</li>
 *   <li>截止日期无法解析时为 {@link StatusTag#PENDING}</li>
 *   <li>截止日期早于今天为逾期，等于今天为今天截止</li>
 *   <li>距截止日期不超过 remindDays 天为即将截止，否则为进行中</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class StatusClassifier {

    private final HomeworkDates dates;

    public StatusTag classify(String dueDate, HomeworkStatus explicitStatus, LocalDate today, int remindDays) {
        if (explicitStatus == HomeworkStatus.COMPLETED) {
            return StatusTag.COMPLETED;
        }
        return dates.parse(dueDate)
                .map(due -> classifyDate(due, today, remindDays))
                .orElse(StatusTag.PENDING);
    }

    public StatusTag classify(HomeworkItem item, LocalDate today, int remindDays) {
        return classify(item.getDueDate(), item.getStatus(), today, remindDays);
    }

    private StatusTag classifyDate(LocalDate due, LocalDate today, int remindDays) {
        if (due.isBefore(today)) {
            return StatusTag.OVERDUE;
        }
        if (due.isEqual(today)) {
            return StatusTag.DUE_TODAY;
        }
        long days = ChronoUnit.DAYS.between(today, due);
        return days <= remindDays ? StatusTag.DUE_SOON : StatusTag.PENDING;
    }
}
