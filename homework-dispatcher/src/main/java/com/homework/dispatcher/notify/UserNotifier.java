package com.homework.dispatcher.notify;

/**
 * 向用户展示消息（成功提示、校验失败、读写错误）。
 * <p>
 * 只在任务协调线程上调用。
 */
public interface UserNotifier {

    void notifyUser(String message, NoticeLevel level);
}
