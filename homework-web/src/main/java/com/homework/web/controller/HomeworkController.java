package com.homework.web.controller;

import com.homework.common.dto.ApiResponse;
import com.homework.common.dto.HomeworkAggregates;
import com.homework.dispatcher.service.TaskCoordinator;
import com.homework.dispatcher.task.AddHomeworkParams;
import com.homework.dispatcher.task.DeleteParams;
import com.homework.dispatcher.task.MarkCompletedParams;
import com.homework.dispatcher.task.QueryDateField;
import com.homework.dispatcher.task.QueryParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.web.dto.AddHomeworkRequest;
import com.homework.web.dto.DeleteRequest;
import com.homework.web.dto.ListSnapshot;
import com.homework.web.dto.Notification;
import com.homework.web.dto.QueueStatus;
import com.homework.web.dto.TaskReceipt;
import com.homework.web.service.PresentationSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 作业登记 REST API 控制器。
 * <p>
 * 所有写操作都只是提交任务（立即返回回执），由调度器按顺序执行；
 * 执行结果通过 {@code /notifications}、{@code /list}、{@code /aggregates} 查看。
 */
@Slf4j
@RestController
@RequestMapping("/api/homework")
@RequiredArgsConstructor
public class HomeworkController {

    private final TaskCoordinator coordinator;
    private final PresentationSnapshot snapshot;

    // ======================== 提交任务 ========================

    @PostMapping("/load")
    public ApiResponse<TaskReceipt> load() {
        return accepted(coordinator.submit(TaskKind.LOAD));
    }

    @PostMapping("/save")
    public ApiResponse<TaskReceipt> save() {
        return accepted(coordinator.submit(TaskKind.SAVE));
    }

    @PostMapping("/refresh")
    public ApiResponse<TaskReceipt> refresh() {
        return accepted(coordinator.submit(TaskKind.REFRESH));
    }

    @PostMapping("/aggregates/refresh")
    public ApiResponse<TaskReceipt> refreshAggregates() {
        return accepted(coordinator.submit(TaskKind.UPDATE_DERIVED_VIEWS));
    }

    /**
     * 添加作业。
     */
    @PostMapping("/items")
    public ApiResponse<TaskReceipt> add(@RequestBody AddHomeworkRequest request) {
        AddHomeworkParams params = AddHomeworkParams.builder()
                .code(request.getCode())
                .subject(request.getSubject())
                .content(request.getContent())
                .createDate(request.getCreateDate())
                .dueDate(request.getDueDate())
                .build();
        return accepted(coordinator.submit(TaskKind.ADD, params));
    }

    /**
     * 按截止日期（field=due）或创建日期（field=create）查询。
     */
    @PostMapping("/query")
    public ApiResponse<TaskReceipt> query(@RequestParam("date") String date,
                                          @RequestParam(value = "field", defaultValue = "due") String field) {
        QueryParams params = QueryParams.builder()
                .queryDate(date)
                .field(QueryDateField.fromValue(field))
                .build();
        return accepted(coordinator.submit(TaskKind.QUERY, params));
    }

    @PostMapping("/items/{code}/complete")
    public ApiResponse<TaskReceipt> markCompleted(@PathVariable String code) {
        return accepted(coordinator.submit(TaskKind.MARK_COMPLETED, new MarkCompletedParams(code)));
    }

    @PostMapping("/items/delete")
    public ApiResponse<TaskReceipt> delete(@RequestBody DeleteRequest request) {
        return accepted(coordinator.submit(TaskKind.DELETE, new DeleteParams(request.getCodes())));
    }

    @DeleteMapping("/items")
    public ApiResponse<TaskReceipt> clearAll() {
        return accepted(coordinator.submit(TaskKind.CLEAR_ALL));
    }

    // ======================== 查询接口 ========================

    /**
     * 调度器状态。
     */
    @GetMapping("/queue")
    public ApiResponse<QueueStatus> queue() {
        QueueStatus status = QueueStatus.builder()
                .state(coordinator.getState().name())
                .queueDepth(coordinator.queueDepth())
                .currentTask(coordinator.currentTaskKind().map(TaskKind::getValue).orElse(null))
                .completedCount(coordinator.getCompletedCount())
                .failedCount(coordinator.getFailedCount())
                .build();
        return ApiResponse.ok(status);
    }

    @GetMapping("/list")
    public ApiResponse<ListSnapshot> list() {
        return ApiResponse.ok(snapshot.getList());
    }

    @GetMapping("/aggregates")
    public ApiResponse<HomeworkAggregates> aggregates() {
        return snapshot.getAggregates()
                .map(ApiResponse::ok)
                .orElse(ApiResponse.error("NOT_READY", "统计数据尚未生成"));
    }

    /**
     * 增量拉取通知：只返回序号大于 after 的部分。
     */
    @GetMapping("/notifications")
    public ApiResponse<List<Notification>> notifications(@RequestParam(value = "after", defaultValue = "0") long after) {
        return ApiResponse.ok(snapshot.notificationsAfter(after));
    }

    private ApiResponse<TaskReceipt> accepted(Task task) {
        log.debug("接口提交任务: {} ({})", task.getKind().getValue(), task.getId());
        return ApiResponse.ok(new TaskReceipt(task.getId(), task.getKind().getValue(), coordinator.queueDepth()),
                "任务已提交");
    }
}
