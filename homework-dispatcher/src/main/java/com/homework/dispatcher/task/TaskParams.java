package com.homework.dispatcher.task;

/**
 * 任务参数的标记接口，每种 {@link TaskKind} 对应一种参数类型。
 */
public interface TaskParams {
}
