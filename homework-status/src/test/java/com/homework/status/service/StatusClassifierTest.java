package com.homework.status.service;

import com.homework.common.dto.HomeworkStatus;
import com.homework.common.dto.StatusTag;
import com.homework.common.util.HomeworkDates;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class StatusClassifierTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final StatusClassifier classifier = new StatusClassifier(new HomeworkDates(100));

    @Test
    void completedWinsOverEveryDate() {
        for (String due : new String[]{"01/01/2000", "10/03/2025", "11/03/2025", "01/01/2099", "garbage", null}) {
            for (int remind = 0; remind <= 5; remind++) {
                assertEquals(StatusTag.COMPLETED, classifier.classify(due, HomeworkStatus.COMPLETED, TODAY, remind));
            }
        }
    }

    @Test
    void pastDueDateIsOverdue() {
        assertEquals(StatusTag.OVERDUE, classifier.classify("09/03/2025", HomeworkStatus.PENDING, TODAY, 3));
    }

    @Test
    void sameDayIsDueToday() {
        assertEquals(StatusTag.DUE_TODAY, classifier.classify("10/3/2025", HomeworkStatus.PENDING, TODAY, 3));
    }

    @Test
    void withinRemindWindowIsDueSoon() {
        assertEquals(StatusTag.DUE_SOON, classifier.classify("11/03/2025", HomeworkStatus.PENDING, TODAY, 3));
        assertEquals(StatusTag.DUE_SOON, classifier.classify("13/03/2025", HomeworkStatus.PENDING, TODAY, 3));
    }

    @Test
    void beyondRemindWindowIsPending() {
        assertEquals(StatusTag.PENDING, classifier.classify("14/03/2025", HomeworkStatus.PENDING, TODAY, 3));
        assertEquals(StatusTag.PENDING, classifier.classify("11/03/2025", HomeworkStatus.PENDING, TODAY, 0));
    }

    @Test
    void unparseableDueDateFallsBackToPending() {
        assertEquals(StatusTag.PENDING, classifier.classify("someday", HomeworkStatus.PENDING, TODAY, 3));
        assertEquals(StatusTag.PENDING, classifier.classify(null, HomeworkStatus.PENDING, TODAY, 3));
    }

    @Test
    void sameInputsGiveSameTag() {
        StatusTag first = classifier.classify("12/03/2025", HomeworkStatus.PENDING, TODAY, 3);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, classifier.classify("12/03/2025", HomeworkStatus.PENDING, TODAY, 3));
        }
    }
}
