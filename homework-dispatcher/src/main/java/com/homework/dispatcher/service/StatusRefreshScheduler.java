package com.homework.dispatcher.service;

import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.TaskKind;
import com.homework.status.config.StatusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 状态定时重算。
 * <p>
 * 超过重算周期或者跨天后，状态标签会过期（例如"即将截止"变成"今天截止"）。
 * 检查本身投递到调度线程执行，不与任务并发访问共享状态。
 */
@Slf4j
@Component
public class StatusRefreshScheduler {

    private final TaskCoordinator coordinator;
    private final HomeworkState state;
    private final StatusProperties properties;

    public StatusRefreshScheduler(TaskCoordinator coordinator, HomeworkState state, StatusProperties properties) {
        this.coordinator = coordinator;
        this.state = state;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${homework.status.check-interval-ms:60000}",
            initialDelayString = "${homework.status.check-interval-ms:60000}")
    public void scheduledCheck() {
        coordinator.post(this::refreshIfStale);
    }

    /**
     * 必须在调度线程上调用。
     *
     * @return 是否触发了重算
     */
    boolean refreshIfStale() {
        if (!state.isLoaded() || state.isEmpty()) {
            return false;
        }
        if (!state.getStatusCache().isStale(state.now(), properties.getRefreshInterval())) {
            return false;
        }
        state.recomputeStatuses();
        log.info("定时重算作业状态完成, 作业数: {}", state.size());
        coordinator.submit(TaskKind.REFRESH);
        coordinator.submit(TaskKind.UPDATE_DERIVED_VIEWS);
        return true;
    }
}
