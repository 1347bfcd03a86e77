package com.homework.common.exception;

/**
 * 加载流水线内部异常，由出错的阶段抛出并以错误消息的形式向下游传递。
 */
public class PipelineException extends HomeworkException {

    public PipelineException(String message) {
        super("PIPELINE_ERROR", message);
    }

    public PipelineException(String message, Throwable cause) {
        super("PIPELINE_ERROR", message, cause);
    }
}
