package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.dto.StatusTag;
import com.homework.common.exception.HomeworkValidationException;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.MarkCompletedParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 标记作业为已完成，并直接写入状态缓存。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkCompletedHandler implements TaskHandler {

    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.MARK_COMPLETED;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        String code = task.paramsAs(MarkCompletedParams.class).getCode();
        if (code == null || code.isBlank()) {
            throw new HomeworkValidationException("请先选择要标记为已完成的作业！");
        }

        HomeworkState state = context.state();
        HomeworkItem item = state.find(code)
                .orElseThrow(() -> HomeworkValidationException.notFound(code));
        item.setStatus(HomeworkStatus.COMPLETED);
        state.getStatusCache().set(code, StatusTag.COMPLETED);
        log.info("作业已完成: {}", code);

        notifier.notifyUser("作业已标记为已完成！", NoticeLevel.INFO);
        context.cascadeAfterMutation();
        context.complete();
    }
}
