package com.homework.web.service;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkView;
import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.web.config.WebProperties;
import com.homework.web.dto.ListSnapshot;
import com.homework.web.dto.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Web 展示层：保存调度器最近一次展示的列表、统计汇总和通知，供 HTTP 接口读取。
 * <p>
 * 写入来自任务协调线程，读取来自请求线程。
 */
@Slf4j
@Primary
@Component
public class PresentationSnapshot implements UserNotifier, HomeworkPresenter {

    private final Clock clock;
    private final int historySize;
    private final AtomicLong sequence = new AtomicLong();

    private final Deque<Notification> notifications = new ArrayDeque<>();

    private volatile ListSnapshot list;
    private volatile HomeworkAggregates aggregates;

    public PresentationSnapshot(WebProperties properties, Clock clock) {
        this.clock = clock;
        this.historySize = Math.max(properties.getNotificationHistory(), 1);
        this.list = new ListSnapshot(List.of(), null, null);
    }

    @Override
    public void notifyUser(String message, NoticeLevel level) {
        Notification notification = new Notification(sequence.incrementAndGet(), level, message,
                LocalDateTime.now(clock));
        synchronized (notifications) {
            notifications.addLast(notification);
            while (notifications.size() > historySize) {
                notifications.removeFirst();
            }
        }
        log.debug("[通知 {}] {}", level, message);
    }

    @Override
    public void presentList(List<HomeworkView> items, Double progress) {
        list = new ListSnapshot(List.copyOf(items), progress, LocalDateTime.now(clock));
    }

    @Override
    public void presentAggregates(HomeworkAggregates aggregates) {
        this.aggregates = aggregates;
    }

    public ListSnapshot getList() {
        return list;
    }

    public Optional<HomeworkAggregates> getAggregates() {
        return Optional.ofNullable(aggregates);
    }

    /**
     * 序号大于 {@code after} 的通知，按时间顺序。
     */
    public List<Notification> notificationsAfter(long after) {
        synchronized (notifications) {
            return notifications.stream()
                    .filter(n -> n.getSequence() > after)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
    }
}
