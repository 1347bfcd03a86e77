package com.homework.loader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 数据加载流水线配置项。
 */
@Data
@ConfigurationProperties(prefix = "homework.loader")
public class LoaderProperties {

    /** 数据文件路径 */
    private String dataFile = "homework_data.json";

    /** 每批记录数 */
    private int batchSize = 100;

    /** 阶段之间通道的容量（消息数），满了以后上游阻塞等待 */
    private int channelCapacity = 50;

    /** 前几批数据在加载过程中就提前展示 */
    private int eagerBatches = 3;
}
