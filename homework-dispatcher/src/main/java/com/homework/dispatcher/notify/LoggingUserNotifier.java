package com.homework.dispatcher.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * 没有展示层时的默认通知实现：只写日志。
 */
@Slf4j
public class LoggingUserNotifier implements UserNotifier {

    @Override
    public void notifyUser(String message, NoticeLevel level) {
        switch (level) {
            case ERROR:
                log.error("[通知] {}", message);
                break;
            case WARNING:
                log.warn("[通知] {}", message);
                break;
            default:
                log.info("[通知] {}", message);
        }
    }
}
