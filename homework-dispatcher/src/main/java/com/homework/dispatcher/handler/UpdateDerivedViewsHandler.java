package com.homework.dispatcher.handler;

import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.view.HomeworkViews;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 更新统计汇总（状态分布、概要统计、趋势）。
 */
@Component
@RequiredArgsConstructor
public class UpdateDerivedViewsHandler implements TaskHandler {

    private final HomeworkViews views;
    private final HomeworkPresenter presenter;

    @Override
    public TaskKind kind() {
        return TaskKind.UPDATE_DERIVED_VIEWS;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        HomeworkState state = context.state();
        presenter.presentAggregates(views.aggregate(state.getItems(), state::statusOf, state.today(),
                context.settings().getChartDays()));
        context.complete();
    }
}
