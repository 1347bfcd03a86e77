package com.homework.web.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.homework.web")
@EnableConfigurationProperties(WebProperties.class)
public class WebModuleConfig {
}
