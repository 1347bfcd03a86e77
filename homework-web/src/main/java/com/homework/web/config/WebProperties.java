package com.homework.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Web 展示层配置项。
 */
@Data
@ConfigurationProperties(prefix = "homework.web")
public class WebProperties {

    /** 保留最近多少条用户通知 */
    private int notificationHistory = 50;
}
