package com.homework.status.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 状态分类与状态缓存配置项。
 */
@Data
@ConfigurationProperties(prefix = "homework.status")
public class StatusProperties {

    /** 日期解析缓存的最大条目数 */
    private long dateCacheSize = 1000;

    /** 全量重算状态缓存的周期 */
    private Duration refreshInterval = Duration.ofHours(1);

    /** 检查是否需要重算的间隔（毫秒），跨天时也会触发重算 */
    private long checkIntervalMs = 60_000;
}
