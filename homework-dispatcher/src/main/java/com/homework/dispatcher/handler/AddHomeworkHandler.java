package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.exception.HomeworkValidationException;
import com.homework.common.util.HomeworkDates;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.AddHomeworkParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 添加作业。
 * <p>
 * 所有校验都在修改之前完成：字段缺失、日期无法解析、代号重复时直接失败，
 * 集合和状态缓存保持不变，也不触发级联任务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AddHomeworkHandler implements TaskHandler {

    private final HomeworkDates dates;
    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.ADD;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        AddHomeworkParams params = task.paramsAs(AddHomeworkParams.class);
        String code = trim(params.getCode());
        String subject = trim(params.getSubject());
        String content = trim(params.getContent());
        String createDate = trim(params.getCreateDate());
        String dueDate = trim(params.getDueDate());

        if (code.isEmpty() || subject.isEmpty() || content.isEmpty() || createDate.isEmpty() || dueDate.isEmpty()) {
            throw new HomeworkValidationException("请填写所有字段！");
        }
        Optional<LocalDate> created = dates.parse(createDate);
        Optional<LocalDate> due = dates.parse(dueDate);
        if (created.isEmpty() || due.isEmpty()) {
            throw new HomeworkValidationException("日期格式不正确！请使用 DD/MM/YYYY 或 D/M/YYYY 格式");
        }

        HomeworkState state = context.state();
        if (state.contains(code)) {
            throw HomeworkValidationException.duplicateCode(code);
        }

        HomeworkItem item = HomeworkItem.builder()
                .code(code)
                .subject(subject)
                .content(content)
                .createDate(dates.format(created.get()))
                .dueDate(dates.format(due.get()))
                .status(HomeworkStatus.PENDING)
                .build();
        state.add(item);
        state.refreshStatus(item);
        log.info("添加作业: {} ({}), 截止 {}", code, subject, item.getDueDate());

        notifier.notifyUser("作业添加成功！", NoticeLevel.INFO);
        context.cascadeAfterMutation();
        context.complete();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
