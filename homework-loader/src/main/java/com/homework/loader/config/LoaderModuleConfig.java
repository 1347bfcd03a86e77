package com.homework.loader.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 加载模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.homework.loader")
@EnableConfigurationProperties(LoaderProperties.class)
public class LoaderModuleConfig {
}
