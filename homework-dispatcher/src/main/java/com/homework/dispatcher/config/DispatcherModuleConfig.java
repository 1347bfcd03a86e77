package com.homework.dispatcher.config;

import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.notify.LoggingHomeworkPresenter;
import com.homework.dispatcher.notify.LoggingUserNotifier;
import com.homework.dispatcher.notify.UserNotifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 调度模块配置。
 * <p>
 * 默认注册只写日志的通知与展示实现；展示层模块以 {@code @Primary} 提供自己的实现后，
 * 调度器注入的是展示层版本。
 */
@Configuration
@ComponentScan(basePackages = "com.homework.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    public UserNotifier loggingUserNotifier() {
        return new LoggingUserNotifier();
    }

    @Bean
    public HomeworkPresenter loggingHomeworkPresenter() {
        return new LoggingHomeworkPresenter();
    }
}
