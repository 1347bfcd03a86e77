package com.homework.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 任务调度配置项。
 */
@Data
@ConfigurationProperties(prefix = "homework.dispatcher")
public class DispatcherProperties {

    /** 调度器轮询间隔（毫秒） */
    private long tickIntervalMs = 50;

    /** 默认提醒天数，数据文件中有 settings 时以文件为准 */
    private int defaultRemindDays = 3;

    /** 默认趋势统计天数 */
    private int defaultChartDays = 5;

    /** 单个任务忙碌超过该秒数时打印警告（不会取消任务） */
    private long busyWarnSeconds = 30;
}
