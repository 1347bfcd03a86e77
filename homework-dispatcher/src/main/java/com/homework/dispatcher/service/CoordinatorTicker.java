package com.homework.dispatcher.service;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 调度器的固定间隔驱动。
 */
@Component
@RequiredArgsConstructor
public class CoordinatorTicker {

    private final TaskCoordinator coordinator;

    @Scheduled(fixedDelayString = "${homework.dispatcher.tick-interval-ms:50}")
    public void tick() {
        coordinator.tick();
    }
}
