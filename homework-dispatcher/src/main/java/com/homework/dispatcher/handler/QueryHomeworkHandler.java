package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkView;
import com.homework.common.exception.HomeworkValidationException;
import com.homework.common.util.HomeworkDates;
import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.QueryDateField;
import com.homework.dispatcher.task.QueryParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.view.HomeworkViews;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 按日期查询：截止日期或创建日期规范化后与查询日期完全相同即命中。不修改共享状态。
 */
@Component
@RequiredArgsConstructor
public class QueryHomeworkHandler implements TaskHandler {

    private final HomeworkDates dates;
    private final HomeworkViews views;
    private final HomeworkPresenter presenter;
    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.QUERY;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        QueryParams params = task.paramsAs(QueryParams.class);
        String queryDate = dates.parse(params.getQueryDate())
                .map(dates::format)
                .orElseThrow(() -> new HomeworkValidationException("查询日期格式不正确！"));
        QueryDateField field = params.getField() == null ? QueryDateField.DUE : params.getField();

        HomeworkState state = context.state();
        List<HomeworkItem> matched = new ArrayList<>();
        for (HomeworkItem item : state.getItems()) {
            String value = field == QueryDateField.CREATE ? item.getCreateDate() : item.getDueDate();
            if (queryDate.equals(dates.normalize(value))) {
                matched.add(item);
            }
        }

        List<HomeworkView> result = views.sort(matched, state::statusOf);
        presenter.presentList(result, null);
        notifier.notifyUser("在 " + queryDate + " " + field.getLabel() + "的作业 (共" + result.size() + "项)",
                NoticeLevel.INFO);
        context.complete();
    }
}
