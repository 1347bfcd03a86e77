package com.homework.web.service;

import com.homework.common.dto.HomeworkView;
import com.homework.common.dto.StatusTag;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.web.config.WebProperties;
import com.homework.web.dto.Notification;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PresentationSnapshotTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-10T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void keepsOnlyTheMostRecentNotifications() {
        WebProperties properties = new WebProperties();
        properties.setNotificationHistory(3);
        PresentationSnapshot snapshot = new PresentationSnapshot(properties, clock);

        for (int i = 1; i <= 5; i++) {
            snapshot.notifyUser("消息 " + i, NoticeLevel.INFO);
        }

        List<Notification> all = snapshot.notificationsAfter(0);
        assertEquals(List.of("消息 3", "消息 4", "消息 5"),
                all.stream().map(Notification::getMessage).collect(Collectors.toList()));
        assertEquals(List.of(5L), snapshot.notificationsAfter(4).stream()
                .map(Notification::getSequence).collect(Collectors.toList()));
    }

    @Test
    void listSnapshotIsDetachedFromTheCallersList() {
        PresentationSnapshot snapshot = new PresentationSnapshot(new WebProperties(), clock);
        List<HomeworkView> items = new ArrayList<>();
        items.add(HomeworkView.builder().code("A").tag(StatusTag.OVERDUE).build());

        snapshot.presentList(items, 0.5);
        items.clear();

        assertEquals(1, snapshot.getList().getItems().size());
        assertEquals(Double.valueOf(0.5), snapshot.getList().getProgress());
        assertTrue(snapshot.getAggregates().isEmpty());
    }
}
