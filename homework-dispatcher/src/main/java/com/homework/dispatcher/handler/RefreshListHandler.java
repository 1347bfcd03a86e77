package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.StatusTag;
import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.view.HomeworkViews;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 刷新作业列表：过滤和排序在工作线程上对副本进行。
 */
@Component
@RequiredArgsConstructor
public class RefreshListHandler implements TaskHandler {

    private final HomeworkViews views;
    private final HomeworkPresenter presenter;

    @Override
    public TaskKind kind() {
        return TaskKind.REFRESH;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        HomeworkState state = context.state();
        // 缺失的标签先在调度线程上补齐，工作线程只读快照
        for (HomeworkItem item : state.getItems()) {
            state.statusOf(item.getCode());
        }
        List<HomeworkItem> items = state.copyItems();
        Map<String, StatusTag> tags = state.getStatusCache().snapshot();
        LocalDate today = state.today();

        context.offload(() -> views.displayList(items, tags::get, today), sorted -> {
            presenter.presentList(sorted, null);
            context.complete();
        });
    }
}
