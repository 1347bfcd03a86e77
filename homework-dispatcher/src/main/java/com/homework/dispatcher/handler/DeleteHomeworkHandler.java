package com.homework.dispatcher.handler;

import com.homework.common.exception.HomeworkValidationException;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.DeleteParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 批量删除作业，同时清掉这些代号的状态缓存。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteHomeworkHandler implements TaskHandler {

    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.DELETE;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        Set<String> codes = task.paramsAs(DeleteParams.class).getCodes();
        if (codes.isEmpty()) {
            throw new HomeworkValidationException("请先选择要删除的作业！");
        }

        HomeworkState state = context.state();
        int removed = state.removeAll(codes);
        codes.forEach(state.getStatusCache()::invalidate);
        log.info("删除作业: 请求 {} 个, 实际删除 {} 个", codes.size(), removed);

        notifier.notifyUser(removed + " 个作业删除成功！", NoticeLevel.INFO);
        context.cascadeAfterMutation();
        context.complete();
    }
}
