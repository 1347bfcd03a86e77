package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.dto.HomeworkView;
import com.homework.common.dto.StatusTag;
import com.homework.dispatcher.DispatcherHarness;
import com.homework.dispatcher.RecordingCollaborators.PresentedList;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.task.DeleteParams;
import com.homework.dispatcher.task.MarkCompletedParams;
import com.homework.dispatcher.task.QueryDateField;
import com.homework.dispatcher.task.QueryParams;
import com.homework.dispatcher.task.TaskKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.homework.dispatcher.DispatcherHarness.homework;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 通过调度器端到端地驱动各个处理器。当前日期固定为 10/03/2025。
 */
class HomeworkTaskFlowTest {

    @TempDir
    Path tempDir;

    private Path dataFile;
    private DispatcherHarness harness;

    @BeforeEach
    void setUp() {
        dataFile = tempDir.resolve("homework_data.json");
        harness = new DispatcherHarness(dataFile);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void addCanonicalizesDatesAndCascades() {
        harness.coordinator.submit(TaskKind.ADD, homework("A1", "1/3/2025", "12-3-25"));
        harness.drain();

        HomeworkItem item = harness.state.find("A1").orElseThrow();
        assertEquals("01/03/2025", item.getCreateDate());
        assertEquals("12/03/2025", item.getDueDate());
        assertEquals(HomeworkStatus.PENDING, item.getStatus());
        assertEquals(StatusTag.DUE_SOON, harness.state.getStatusCache().peek("A1").orElseThrow());
        assertTrue(harness.ui.messages(NoticeLevel.INFO).contains("作业添加成功！"));
        assertTrue(Files.exists(dataFile));
        assertEquals(1, harness.ui.lastList().items.size());
        assertEquals(1, harness.ui.lastAggregates().getTotal());
    }

    @Test
    void farFutureItemSortsAfterOverdueOne() {
        harness.coordinator.submit(TaskKind.ADD, homework("OLD", "01/03/2025", "05/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("M1", "10/03/2025", "01/01/2099"));
        harness.coordinator.submit(TaskKind.REFRESH);
        harness.drain();

        List<HomeworkView> sorted = harness.ui.lastList().items;
        assertEquals(List.of("OLD", "M1"), codes(sorted));
        assertEquals(StatusTag.OVERDUE, sorted.get(0).getTag());
        assertEquals(StatusTag.PENDING, sorted.get(1).getTag());
        assertEquals(3, sorted.get(1).getTag().getWeight());
    }

    @Test
    void duplicateCodeIsRejectedWithoutSideEffects() {
        harness.coordinator.submit(TaskKind.ADD, homework("D1", "01/03/2025", "20/03/2025"));
        harness.drain();
        List<HomeworkItem> before = harness.state.getItems();
        Map<String, StatusTag> cacheBefore = harness.state.getStatusCache().snapshot();
        long completedBefore = harness.coordinator.getCompletedCount();

        harness.coordinator.submit(TaskKind.ADD, homework("D1", "02/03/2025", "11/03/2025"));
        harness.drain();

        assertEquals(before, harness.state.getItems());
        assertEquals(cacheBefore, harness.state.getStatusCache().snapshot());
        assertEquals(List.of("作业代号 'D1' 已存在！"), harness.ui.messages(NoticeLevel.WARNING));
        // 没有级联保存、刷新、统计
        assertEquals(completedBefore, harness.coordinator.getCompletedCount());
    }

    @Test
    void addRejectsBlankFieldsAndBadDates() {
        harness.coordinator.submit(TaskKind.ADD, homework(" ", "01/03/2025", "20/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("B1", "01/03/2025", "31/02/2025"));
        harness.drain();

        assertTrue(harness.state.isEmpty());
        assertEquals(List.of("请填写所有字段！", "日期格式不正确！请使用 DD/MM/YYYY 或 D/M/YYYY 格式"),
                harness.ui.messages(NoticeLevel.WARNING));
        assertFalse(Files.exists(dataFile));
    }

    @Test
    void markCompletedUpdatesCacheImmediately() {
        harness.coordinator.submit(TaskKind.ADD, homework("C1", "01/03/2025", "10/03/2025"));
        harness.drain();
        assertEquals(StatusTag.DUE_TODAY, harness.state.statusOf("C1"));

        harness.coordinator.submit(TaskKind.MARK_COMPLETED, new MarkCompletedParams("C1"));
        harness.drain();

        assertEquals(StatusTag.COMPLETED, harness.state.getStatusCache().get("C1"));
        assertTrue(harness.state.find("C1").orElseThrow().isCompleted());
        assertTrue(harness.ui.messages(NoticeLevel.INFO).contains("作业已标记为已完成！"));
        assertEquals(1, harness.ui.lastAggregates().getCompleted());
    }

    @Test
    void markCompletedOnUnknownCodeIsAValidationError() {
        harness.coordinator.submit(TaskKind.MARK_COMPLETED, new MarkCompletedParams("NOPE"));
        harness.drain();

        assertEquals(List.of("作业 'NOPE' 不存在"), harness.ui.messages(NoticeLevel.WARNING));
        assertEquals(0, harness.state.getStatusCache().size());
    }

    @Test
    void deleteRemovesItemsAndTheirCacheEntries() {
        harness.coordinator.submit(TaskKind.ADD, homework("E1", "01/03/2025", "20/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("E2", "01/03/2025", "21/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("E3", "01/03/2025", "22/03/2025"));
        harness.drain();

        harness.coordinator.submit(TaskKind.DELETE, new DeleteParams(List.of("E1", "E3", "GHOST")));
        harness.drain();

        assertEquals(List.of("E2"), harness.state.getItems().stream().map(HomeworkItem::getCode).collect(Collectors.toList()));
        assertTrue(harness.state.getStatusCache().peek("E1").isEmpty());
        assertTrue(harness.state.getStatusCache().peek("E3").isEmpty());
        assertTrue(harness.ui.messages(NoticeLevel.INFO).contains("2 个作业删除成功！"));
    }

    @Test
    void deleteWithNothingSelectedIsRejected() {
        harness.coordinator.submit(TaskKind.DELETE, new DeleteParams(Set.of()));
        harness.drain();

        assertEquals(List.of("请先选择要删除的作业！"), harness.ui.messages(NoticeLevel.WARNING));
    }

    @Test
    void clearAllEmptiesCollectionAndCache() {
        harness.coordinator.submit(TaskKind.ADD, homework("F1", "01/03/2025", "20/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("F2", "01/03/2025", "05/03/2025"));
        harness.drain();

        harness.coordinator.submit(TaskKind.CLEAR_ALL);
        harness.drain();

        assertTrue(harness.state.isEmpty());
        assertEquals(0, harness.state.getStatusCache().size());
        assertEquals(0, harness.dates.cachedCount());
        assertEquals(StatusTag.PENDING, harness.state.getStatusCache().get("F1"));
        assertEquals(0, harness.state.getStatusCache().size());
        assertTrue(harness.ui.messages(NoticeLevel.INFO).contains("所有作业已清空！"));
    }

    @Test
    void clearAllOnEmptyCollectionOnlyNotifies() {
        harness.coordinator.submit(TaskKind.CLEAR_ALL);
        harness.drain();

        assertEquals(List.of("已经没有作业了！"), harness.ui.messages(NoticeLevel.INFO));
        assertFalse(Files.exists(dataFile));
    }

    @Test
    void queryTreatsEquivalentDateSpellingsAsEqual() {
        harness.coordinator.submit(TaskKind.ADD, homework("Q1", "1/3/2025", "1/2/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("Q2", "1/3/2025", "02/02/2025"));
        harness.drain();
        harness.ui.reset();

        harness.coordinator.submit(TaskKind.QUERY, QueryParams.builder().queryDate("01/02/2025").build());
        harness.drain();
        PresentedList byCanonical = harness.ui.lastList();

        harness.coordinator.submit(TaskKind.QUERY, QueryParams.builder().queryDate("1/2/2025").build());
        harness.drain();
        PresentedList byShort = harness.ui.lastList();

        assertEquals(List.of("Q1"), codes(byCanonical.items));
        assertEquals(codes(byCanonical.items), codes(byShort.items));
        assertEquals("在 01/02/2025 截止的作业 (共1项)", harness.ui.messages(NoticeLevel.INFO).get(1));
    }

    @Test
    void queryByCreateDate() {
        harness.coordinator.submit(TaskKind.ADD, homework("R1", "01/03/2025", "20/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("R2", "02/03/2025", "20/03/2025"));
        harness.drain();

        harness.coordinator.submit(TaskKind.QUERY,
                QueryParams.builder().queryDate("2/3/25").field(QueryDateField.CREATE).build());
        harness.drain();

        assertEquals(List.of("R2"), codes(harness.ui.lastList().items));
    }

    @Test
    void queryWithUnparseableDateIsRejected() {
        harness.coordinator.submit(TaskKind.QUERY, QueryParams.builder().queryDate("下周一").build());
        harness.drain();

        assertEquals(List.of("查询日期格式不正确！"), harness.ui.messages(NoticeLevel.WARNING));
    }

    @Test
    void savedDocumentLoadsBackIntoAnEqualCollection() {
        harness.coordinator.submit(TaskKind.ADD, homework("S1", "01/03/2025", "20/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("S2", "02/03/2025", "05/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("S3", "03/03/2025", "11/03/2025"));
        harness.coordinator.submit(TaskKind.MARK_COMPLETED, new MarkCompletedParams("S2"));
        harness.drain();
        List<HomeworkItem> saved = harness.state.getItems();

        try (DispatcherHarness reloaded = new DispatcherHarness(dataFile)) {
            reloaded.coordinator.submit(TaskKind.LOAD);
            reloaded.drain();

            assertTrue(reloaded.state.isLoaded());
            assertEquals(Set.copyOf(saved), Set.copyOf(reloaded.state.getItems()));
            assertEquals(StatusTag.COMPLETED, reloaded.state.getStatusCache().peek("S2").orElseThrow());
            assertEquals(StatusTag.DUE_SOON, reloaded.state.getStatusCache().peek("S3").orElseThrow());
            assertTrue(reloaded.ui.messages(NoticeLevel.INFO).contains("成功加载 3 条作业记录"));
            // S2 已完成且已过截止日期，不计入展示
            assertEquals(2, reloaded.ui.lastAggregates().getTotal());
        }
    }

    @Test
    void loadInstallsDocumentSettingsAndShowsEarlyBatches() throws Exception {
        StringBuilder items = new StringBuilder();
        for (int i = 0; i < 35; i++) {
            if (i > 0) {
                items.append(',');
            }
            items.append("{\"code\":\"L").append(i)
                    .append("\",\"subject\":\"语文\",\"content\":\"背诵\",\"create_date\":\"01/03/2025\",")
                    .append("\"due_date\":\"15/03/2025\"}");
        }
        Files.writeString(dataFile, "{\"homeworks\":[" + items + "],\"settings\":{\"remind_days\":7,\"theme\":\"dark\"}}",
                StandardCharsets.UTF_8);

        harness.coordinator.submit(TaskKind.LOAD);
        harness.drain();

        assertEquals(35, harness.state.size());
        assertEquals(7, harness.state.getSettings().getRemindDays());
        assertEquals("dark", harness.state.getSettings().getExtras().get("theme"));
        // 提醒天数 7 时 15/03 属于即将截止
        assertEquals(StatusTag.DUE_SOON, harness.state.statusOf("L0"));

        List<Double> progress = harness.ui.lists.stream()
                .map(list -> list.progress)
                .filter(p -> p != null)
                .collect(Collectors.toList());
        assertEquals(2, progress.size());
        assertEquals(10.0 / 35, progress.get(0), 1e-9);
        assertEquals(20.0 / 35, progress.get(1), 1e-9);
        assertNull(harness.ui.lastList().progress);
        assertEquals(35, harness.ui.lastList().items.size());
    }

    @Test
    void missingFileLeavesAnEmptyLoadedCollection() {
        harness.coordinator.submit(TaskKind.LOAD);
        harness.coordinator.submit(TaskKind.REFRESH);
        harness.drain();

        assertTrue(harness.state.isLoaded());
        assertTrue(harness.state.isEmpty());
        assertEquals(List.of("加载数据时出错：文件不存在"), harness.ui.messages(NoticeLevel.ERROR));
        assertTrue(harness.ui.lastList().items.isEmpty());
    }

    @Test
    void saveFailureIsSurfacedAsAnError() throws Exception {
        // 目标位置是非空目录，替换必然失败
        Files.createDirectories(dataFile);
        Files.writeString(dataFile.resolve("occupied.txt"), "x", StandardCharsets.UTF_8);
        harness.coordinator.submit(TaskKind.ADD, homework("W1", "01/03/2025", "20/03/2025"));
        harness.drain();

        assertEquals(1, harness.ui.messages(NoticeLevel.ERROR).size());
        assertTrue(harness.ui.messages(NoticeLevel.ERROR).get(0).startsWith("保存数据时出错："));
        assertTrue(harness.state.contains("W1"));
    }

    @Test
    void aggregatesCountDisplayedItemsAndTrendCoversAllItems() {
        harness.coordinator.submit(TaskKind.ADD, homework("T1", "08/03/2025", "10/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("T2", "09/03/2025", "09/03/2025"));
        harness.coordinator.submit(TaskKind.ADD, homework("T3", "10/03/2025", "30/03/2025"));
        harness.coordinator.submit(TaskKind.MARK_COMPLETED, new MarkCompletedParams("T2"));
        harness.drain();

        HomeworkAggregates aggregates = harness.ui.lastAggregates();
        // T2 已完成且已过截止日期，不再展示
        assertEquals(2, aggregates.getTotal());
        assertEquals(0, aggregates.getCompleted());
        assertEquals(1, aggregates.getDueToday());
        assertEquals(0, aggregates.getOverdue());
        assertEquals(1, aggregates.getStatusCounts().get(StatusTag.PENDING));
        assertEquals(List.of("06/03/2025", "07/03/2025", "08/03/2025", "09/03/2025", "10/03/2025"),
                aggregates.getTrendDates());
        assertEquals(List.of(0, 0, 1, 1, 1), aggregates.getCreatedCounts());
        assertEquals(List.of(0, 0, 0, 1, 1), aggregates.getDueCounts());
    }

    private static List<String> codes(List<HomeworkView> views) {
        return views.stream().map(HomeworkView::getCode).collect(Collectors.toList());
    }
}
