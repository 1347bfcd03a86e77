package com.homework.status.config;

import com.homework.common.util.HomeworkDates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 状态模块配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.homework.status")
@EnableConfigurationProperties(StatusProperties.class)
public class StatusModuleConfig {

    @Bean
    public HomeworkDates homeworkDates(StatusProperties properties) {
        log.info("日期解析缓存上限: {}", properties.getDateCacheSize());
        return new HomeworkDates(properties.getDateCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
