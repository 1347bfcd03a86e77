package com.homework.web.dto;

import com.homework.dispatcher.notify.NoticeLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private long sequence;
    private NoticeLevel level;
    private String message;
    private LocalDateTime time;
}
