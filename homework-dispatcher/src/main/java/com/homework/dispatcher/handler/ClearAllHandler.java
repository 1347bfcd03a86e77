package com.homework.dispatcher.handler;

import com.homework.common.util.HomeworkDates;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 清空全部作业、状态缓存和日期解析缓存。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClearAllHandler implements TaskHandler {

    private final HomeworkDates dates;
    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.CLEAR_ALL;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        HomeworkState state = context.state();
        if (state.isEmpty()) {
            notifier.notifyUser("已经没有作业了！", NoticeLevel.INFO);
            context.complete();
            return;
        }

        int count = state.size();
        state.clear();
        state.getStatusCache().clear();
        dates.clearCache();
        log.info("已清空全部作业: {} 条", count);

        notifier.notifyUser("所有作业已清空！", NoticeLevel.INFO);
        context.cascadeAfterMutation();
        context.complete();
    }
}
