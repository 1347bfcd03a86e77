package com.homework.common.exception;

/**
 * 输入校验异常（字段缺失、日期格式错误、作业代号重复等）。
 * <p>
 * 在处理器内同步抛出，不会修改任何共享状态，也不会触发后续级联任务。
 */
public class HomeworkValidationException extends HomeworkException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String DUPLICATE_CODE = "DUPLICATE_CODE";
    public static final String NOT_FOUND = "NOT_FOUND";

    public HomeworkValidationException(String message) {
        super(VALIDATION_ERROR, message);
    }

    public HomeworkValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static HomeworkValidationException duplicateCode(String code) {
        return new HomeworkValidationException(DUPLICATE_CODE, "作业代号 '" + code + "' 已存在！");
    }

    public static HomeworkValidationException notFound(String code) {
        return new HomeworkValidationException(NOT_FOUND, "作业 '" + code + "' 不存在");
    }
}
