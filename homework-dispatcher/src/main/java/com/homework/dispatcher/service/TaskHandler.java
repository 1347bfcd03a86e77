package com.homework.dispatcher.service;

import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;

/**
 * 任务处理器，每种 {@link TaskKind} 一个。
 * <p>
 * {@link #handle} 在任务协调线程上调用。处理器完成工作后必须调用
 * {@link TaskContext#complete()}；需要阻塞 I/O 时通过 {@link TaskContext#offload} 交给工作线程，
 * 在回调中再完成任务。同步抛出的异常视为任务失败。
 */
public interface TaskHandler {

    TaskKind kind();

    void handle(Task task, TaskContext context);
}
