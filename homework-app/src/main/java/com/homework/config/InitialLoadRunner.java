package com.homework.config;

import com.homework.dispatcher.service.TaskCoordinator;
import com.homework.dispatcher.task.TaskKind;
import com.homework.loader.config.LoaderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 应用启动时提交一次加载任务。
 * <p>
 * 可以通过 homework.load-on-startup=false 关闭（例如只想先看空列表）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InitialLoadRunner implements CommandLineRunner {

    private final TaskCoordinator coordinator;
    private final LoaderProperties loaderProperties;

    @Value("${homework.load-on-startup:true}")
    private boolean loadOnStartup;

    @Override
    public void run(String... args) {
        if (!loadOnStartup) {
            log.warn("已关闭启动加载，数据文件 {} 不会被读取，需要手动提交 load 任务", loaderProperties.getDataFile());
            return;
        }
        coordinator.submit(TaskKind.LOAD);
        log.info("已提交启动加载任务: {}", loaderProperties.getDataFile());
    }
}
