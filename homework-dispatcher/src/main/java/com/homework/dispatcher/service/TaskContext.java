package com.homework.dispatcher.service;

import com.homework.common.dto.HomeworkSettings;
import com.homework.common.exception.HomeworkException;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.NoParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.task.TaskParams;

import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * 正在执行的任务的上下文，由调度器在派发时创建。
 * <p>
 * 任务在 {@link #complete()} 或 {@link #fail} 之前一直占用调度器，期间不会派发其他任务。
 */
public interface TaskContext {

    Task getTask();

    /** 共享状态，只能在任务协调线程上访问 */
    HomeworkState state();

    /** 派发时的配置快照 */
    HomeworkSettings settings();

    /** 任务成功结束，调度器回到空闲 */
    void complete();

    /** 任务失败结束：通知用户，调度器回到空闲，不重试 */
    void fail(HomeworkException error);

    /**
     * 在工作线程上执行阻塞工作，结果回到任务协调线程后交给 {@code onSuccess}。
     * 工作抛出的异常转换为任务失败。
     */
    <T> void offload(Callable<T> work, Consumer<T> onSuccess);

    /**
     * 把回调投递回任务协调线程执行；任务已结束时回调被丢弃。
     */
    void post(Runnable callback);

    /** 级联提交后续任务，排在队列末尾 */
    void submit(TaskKind kind, TaskParams params);

    default void submit(TaskKind kind) {
        submit(kind, NoParams.INSTANCE);
    }

    /**
     * 修改作业集合后的标准级联：保存、刷新列表、更新统计。
     */
    default void cascadeAfterMutation() {
        submit(TaskKind.SAVE);
        submit(TaskKind.REFRESH);
        submit(TaskKind.UPDATE_DERIVED_VIEWS);
    }
}
