package com.homework.dispatcher.task;

import com.homework.common.util.IdGenerator;
import lombok.Value;

import java.time.Instant;

/**
 * 一次任务请求。提交时间只用于排查问题，调度顺序完全由队列决定。
 */
@Value
public class Task {

    String id;
    TaskKind kind;
    TaskParams params;
    Instant submittedAt;

    public static Task of(TaskKind kind, TaskParams params, Instant submittedAt) {
        if (kind == null) {
            throw new IllegalArgumentException("任务类型不能为空");
        }
        if (!kind.accepts(params)) {
            throw new IllegalArgumentException("任务 " + kind.getValue() + " 需要参数类型 "
                    + kind.getParamsType().getSimpleName() + ", 实际为 "
                    + (params == null ? "null" : params.getClass().getSimpleName()));
        }
        return new Task(IdGenerator.withPrefix("task"), kind, params, submittedAt);
    }

    public <P extends TaskParams> P paramsAs(Class<P> type) {
        return type.cast(params);
    }
}
