package com.homework.common.exception;

/**
 * 数据文件读写异常（文件不存在、无法读取、无法写入等）。
 */
public class DocumentIOException extends HomeworkException {

    public DocumentIOException(String message) {
        super("IO_ERROR", message);
    }

    public DocumentIOException(String message, Throwable cause) {
        super("IO_ERROR", message, cause);
    }
}
