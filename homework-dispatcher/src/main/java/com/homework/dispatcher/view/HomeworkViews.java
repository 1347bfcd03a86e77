package com.homework.dispatcher.view;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkView;
import com.homework.common.dto.StatusTag;
import com.homework.common.util.HomeworkDates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 列表视图与统计汇总的计算：过滤、排序、计数。
 * <p>
 * 只读取传入的数据，可以在工作线程上对副本调用。
 */
@Component
@RequiredArgsConstructor
public class HomeworkViews {

    private final HomeworkDates dates;

    /**
     * 已完成且截止日期早于今天的作业不再展示；截止日期无法解析的照常展示。
     */
    public boolean isDisplayed(HomeworkItem item, LocalDate today) {
        if (!item.isCompleted()) {
            return true;
        }
        return dates.parse(item.getDueDate())
                .map(due -> !due.isBefore(today))
                .orElse(true);
    }

    /**
     * 排序后的列表：先按状态权重（今天截止、逾期、即将截止、进行中、已完成），
     * 再按截止日期升序，无法解析的日期排在最前。
     */
    public List<HomeworkView> sort(Collection<HomeworkItem> items, Function<String, StatusTag> tagOf) {
        List<HomeworkView> views = new ArrayList<>(items.size());
        for (HomeworkItem item : items) {
            views.add(HomeworkView.of(item, effectiveTag(item, tagOf)));
        }
        Comparator<HomeworkView> order = Comparator
                .comparingInt((HomeworkView view) -> view.getTag().getWeight())
                .thenComparing(view -> dates.parse(view.getDueDate()).orElse(LocalDate.MIN));
        views.sort(order);
        return views;
    }

    /**
     * 刷新列表使用的视图：先过滤再排序。
     */
    public List<HomeworkView> displayList(Collection<HomeworkItem> items, Function<String, StatusTag> tagOf,
                                          LocalDate today) {
        List<HomeworkItem> displayed = items.stream()
                .filter(item -> isDisplayed(item, today))
                .collect(Collectors.toList());
        return sort(displayed, tagOf);
    }

    /**
     * 统计汇总。状态分布和概要统计只算展示中的作业，趋势统计覆盖全部作业。
     */
    public HomeworkAggregates aggregate(Collection<HomeworkItem> items, Function<String, StatusTag> tagOf,
                                        LocalDate today, int chartDays) {
        Map<StatusTag, Integer> counts = new EnumMap<>(StatusTag.class);
        for (StatusTag tag : StatusTag.values()) {
            counts.put(tag, 0);
        }
        for (HomeworkItem item : items) {
            if (isDisplayed(item, today)) {
                counts.merge(effectiveTag(item, tagOf), 1, Integer::sum);
            }
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();

        int days = Math.max(chartDays, 0);
        List<String> trendDates = new ArrayList<>(days);
        for (int i = days - 1; i >= 0; i--) {
            trendDates.add(dates.format(today.minusDays(i)));
        }
        List<Integer> created = new ArrayList<>(days);
        List<Integer> due = new ArrayList<>(days);
        for (String date : trendDates) {
            int createdOn = 0;
            int dueOn = 0;
            for (HomeworkItem item : items) {
                if (date.equals(dates.normalize(item.getCreateDate()))) {
                    createdOn++;
                }
                if (date.equals(dates.normalize(item.getDueDate()))) {
                    dueOn++;
                }
            }
            created.add(createdOn);
            due.add(dueOn);
        }

        return HomeworkAggregates.builder()
                .statusCounts(counts)
                .total(total)
                .completed(counts.get(StatusTag.COMPLETED))
                .overdue(counts.get(StatusTag.OVERDUE))
                .dueToday(counts.get(StatusTag.DUE_TODAY))
                .trendDates(trendDates)
                .createdCounts(created)
                .dueCounts(due)
                .build();
    }

    // 已完成的作业不看缓存，始终是"已完成"
    private StatusTag effectiveTag(HomeworkItem item, Function<String, StatusTag> tagOf) {
        if (item.isCompleted()) {
            return StatusTag.COMPLETED;
        }
        StatusTag tag = tagOf.apply(item.getCode());
        return tag == null ? StatusTag.PENDING : tag;
    }
}
