package com.homework.dispatcher.handler;

import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.loader.store.HomeworkDocument;
import com.homework.loader.store.HomeworkDocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 保存任务：在调度线程上生成快照，由工作线程写入文件。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SaveTaskHandler implements TaskHandler {

    private final HomeworkDocumentStore store;

    @Override
    public TaskKind kind() {
        return TaskKind.SAVE;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        HomeworkDocument snapshot = context.state().toDocument();
        context.offload(() -> {
            store.write(snapshot);
            return snapshot.getHomeworks().size();
        }, count -> {
            log.info("数据已保存: {} 条 -> {}", count, store.getDataFile());
            context.complete();
        });
    }
}
