package com.homework.dispatcher.notify;

/**
 * 用户通知的级别。
 */
public enum NoticeLevel {
    INFO,
    WARNING,
    ERROR
}
