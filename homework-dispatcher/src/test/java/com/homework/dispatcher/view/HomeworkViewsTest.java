package com.homework.dispatcher.view;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.dto.HomeworkView;
import com.homework.common.dto.StatusTag;
import com.homework.common.util.HomeworkDates;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HomeworkViewsTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final HomeworkViews views = new HomeworkViews(new HomeworkDates(50));

    @Test
    void completedItemsDisappearOnceTheirDueDatePasses() {
        assertFalse(views.isDisplayed(item("A", "09/03/2025", HomeworkStatus.COMPLETED), TODAY));
        assertTrue(views.isDisplayed(item("B", "10/03/2025", HomeworkStatus.COMPLETED), TODAY));
        assertTrue(views.isDisplayed(item("C", "01/01/2020", HomeworkStatus.PENDING), TODAY));
        assertTrue(views.isDisplayed(item("D", "不详", HomeworkStatus.COMPLETED), TODAY));
    }

    @Test
    void sortsByWeightThenDueDate() {
        List<HomeworkItem> items = List.of(
                item("P2", "30/04/2025", HomeworkStatus.PENDING),
                item("DONE", "11/03/2025", HomeworkStatus.COMPLETED),
                item("SOON", "12/03/2025", HomeworkStatus.PENDING),
                item("P1", "1/4/2025", HomeworkStatus.PENDING),
                item("LATE2", "08/03/2025", HomeworkStatus.PENDING),
                item("TODAY", "10/03/2025", HomeworkStatus.PENDING),
                item("LATE1", "01/03/2025", HomeworkStatus.PENDING),
                item("ODD", "?", HomeworkStatus.PENDING));
        Map<String, StatusTag> tags = Map.of(
                "P2", StatusTag.PENDING,
                // 缓存里的旧标签不影响已完成作业
                "DONE", StatusTag.DUE_SOON,
                "SOON", StatusTag.DUE_SOON,
                "P1", StatusTag.PENDING,
                "LATE2", StatusTag.OVERDUE,
                "TODAY", StatusTag.DUE_TODAY,
                "LATE1", StatusTag.OVERDUE);

        List<HomeworkView> sorted = views.sort(items, tags::get);

        assertEquals(List.of("TODAY", "LATE1", "LATE2", "SOON", "ODD", "P1", "P2", "DONE"),
                sorted.stream().map(HomeworkView::getCode).collect(Collectors.toList()));
        assertEquals(StatusTag.COMPLETED, sorted.get(7).getTag());
    }

    @Test
    void trendLengthFollowsChartDays() {
        HomeworkAggregates aggregates = views.aggregate(List.of(), code -> null, TODAY, 3);

        assertEquals(List.of("08/03/2025", "09/03/2025", "10/03/2025"), aggregates.getTrendDates());
        assertEquals(List.of(0, 0, 0), aggregates.getCreatedCounts());
        assertEquals(5, aggregates.getStatusCounts().size());
        assertEquals(0, aggregates.getTotal());
    }

    private static HomeworkItem item(String code, String dueDate, HomeworkStatus status) {
        return HomeworkItem.builder()
                .code(code)
                .subject("英语")
                .content("听写")
                .createDate("01/03/2025")
                .dueDate(dueDate)
                .status(status)
                .build();
    }
}
