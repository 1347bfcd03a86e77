package com.homework.dispatcher.service;

import com.homework.common.dto.HomeworkSettings;
import com.homework.common.exception.DocumentIOException;
import com.homework.common.exception.HomeworkException;
import com.homework.common.exception.HomeworkValidationException;
import com.homework.dispatcher.config.DispatcherProperties;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.NoParams;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.task.TaskParams;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 任务队列调度器：同一时刻最多只有一个任务在执行。
 * <p>
 * 核心机制：
 * - 所有用户操作都以任务形式进入 FIFO 队列，由 {@link #tick()} 逐个取出派发
 * - 任务派发后调度器进入忙碌状态，直到处理器显式完成或失败才回到空闲
 * - 工作线程的结果通过收件箱投递回调度线程，由下一次 tick 执行，
 *   因此对作业集合和状态缓存的修改全部发生在调度线程上
 * - 失败的任务不重试，通知用户后继续处理后续任务
 */
@Slf4j
@Service
public class TaskCoordinator {

    private final Map<TaskKind, TaskHandler> handlers = new EnumMap<>(TaskKind.class);
    private final HomeworkState state;
    private final UserNotifier notifier;
    private final DispatcherProperties properties;
    private final Clock clock;

    private final BlockingQueue<Task> queue = new LinkedBlockingQueue<>();

    /** 工作线程 -> 调度线程的回调通道 */
    private final Queue<Runnable> inbox = new ConcurrentLinkedQueue<>();

    private final ExecutorService workerPool =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("homework-worker-"));

    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private volatile CoordinatorState coordinatorState = CoordinatorState.IDLE;
    private volatile ActiveTask active;
    private volatile Thread tickThread;

    public TaskCoordinator(List<TaskHandler> handlerList, HomeworkState state, UserNotifier notifier,
                           DispatcherProperties properties, Clock clock) {
        this.state = state;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
        for (TaskHandler handler : handlerList) {
            TaskHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("任务类型 " + handler.kind() + " 注册了多个处理器: "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        for (TaskKind kind : TaskKind.values()) {
            if (!handlers.containsKey(kind)) {
                log.warn("任务类型 {} 没有处理器，提交后将直接失败", kind.getValue());
            }
        }
    }

    // ==================== 对外接口 ====================

    /**
     * 提交任务（立即返回，不等待执行）。
     */
    public Task submit(TaskKind kind, TaskParams params) {
        Task task = Task.of(kind, params, clock.instant());
        queue.add(task);
        log.debug("任务已提交: {} ({}), 队列: {}", kind.getValue(), task.getId(), queue.size());
        return task;
    }

    public Task submit(TaskKind kind) {
        return submit(kind, NoParams.INSTANCE);
    }

    public int queueDepth() {
        return queue.size();
    }

    public Optional<TaskKind> currentTaskKind() {
        ActiveTask current = active;
        return current == null ? Optional.empty() : Optional.of(current.task.getKind());
    }

    public CoordinatorState getState() {
        return coordinatorState;
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    /**
     * 把回调投递到调度线程，在下一次 tick 执行。可以从任意线程调用。
     */
    public void post(Runnable callback) {
        inbox.add(callback);
    }

    // ==================== 调度循环 ====================

    /**
     * 调度一步：先执行收件箱中的回调，空闲且队列非空时派发一个任务。
     * 由定时器以固定间隔调用，不会阻塞。
     */
    public synchronized void tick() {
        tickThread = Thread.currentThread();
        drainInbox();

        if (coordinatorState == CoordinatorState.BUSY) {
            warnIfSlow();
            return;
        }
        Task next = queue.poll();
        if (next != null) {
            dispatch(next);
        }
    }

    private void drainInbox() {
        Runnable callback;
        while ((callback = inbox.poll()) != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("调度线程回调执行出错", e);
            }
        }
    }

    private void dispatch(Task task) {
        ActiveTask context = new ActiveTask(task, state.getSettings(), clock.instant());
        active = context;
        coordinatorState = CoordinatorState.BUSY;
        log.info("开始执行任务: {} ({}) | 队列: {}", task.getKind().getValue(), task.getId(), queue.size());

        TaskHandler handler = handlers.get(task.getKind());
        if (handler == null) {
            context.fail(new HomeworkException("NO_HANDLER", "不支持的任务类型: " + task.getKind().getValue()));
            return;
        }
        context.guard(() -> handler.handle(task, context));
    }

    private void finish(ActiveTask context, HomeworkException error) {
        if (active != context) {
            return;
        }
        active = null;
        coordinatorState = CoordinatorState.IDLE;

        long elapsedMs = Duration.between(context.startedAt, clock.instant()).toMillis();
        String kind = context.task.getKind().getValue();
        if (error == null) {
            completedCount.incrementAndGet();
            log.info("任务完成: {} ({}), 耗时 {} ms | 队列: {}", kind, context.task.getId(), elapsedMs, queue.size());
            return;
        }

        failedCount.incrementAndGet();
        if (error instanceof HomeworkValidationException) {
            log.warn("任务被拒绝: {} ({}): [{}] {}", kind, context.task.getId(), error.getErrorCode(), error.getMessage());
            notifier.notifyUser(error.getMessage(), NoticeLevel.WARNING);
        } else {
            log.error("任务失败: {} ({}), 耗时 {} ms: [{}] {}", kind, context.task.getId(), elapsedMs,
                    error.getErrorCode(), error.getMessage(), error);
            notifier.notifyUser(error.getMessage(), NoticeLevel.ERROR);
        }
    }

    private void warnIfSlow() {
        ActiveTask current = active;
        if (current == null || current.slowWarned) {
            return;
        }
        Duration busy = Duration.between(current.startedAt, clock.instant());
        if (busy.getSeconds() >= properties.getBusyWarnSeconds()) {
            current.slowWarned = true;
            log.warn("任务 {} ({}) 已执行 {} 秒仍未完成 | 队列: {}", current.task.getKind().getValue(),
                    current.task.getId(), busy.getSeconds(), queue.size());
        }
    }

    private boolean onTickThread() {
        return Thread.currentThread() == tickThread;
    }

    static HomeworkException toHomeworkException(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof HomeworkException) {
            return (HomeworkException) cause;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return new DocumentIOException("读写数据时出错：" + cause.getMessage(), cause);
        }
        return new HomeworkException("TASK_FAILED", "任务执行出错：" + cause.getMessage(), cause);
    }

    @PreDestroy
    public void shutdown() {
        int discarded = queue.size();
        queue.clear();
        if (discarded > 0 || active != null) {
            log.warn("调度器关闭, 丢弃排队任务 {} 个, 当前任务: {}", discarded,
                    currentTaskKind().map(TaskKind::getValue).orElse("无"));
        }
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("工作线程未能在 5 秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== 任务上下文 ====================

    private final class ActiveTask implements TaskContext {

        private final Task task;
        private final HomeworkSettings settings;
        private final Instant startedAt;
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile boolean slowWarned;

        private ActiveTask(Task task, HomeworkSettings settings, Instant startedAt) {
            this.task = task;
            this.settings = settings;
            this.startedAt = startedAt;
        }

        @Override
        public Task getTask() {
            return task;
        }

        @Override
        public HomeworkState state() {
            return state;
        }

        @Override
        public HomeworkSettings settings() {
            return settings;
        }

        @Override
        public void complete() {
            end(null);
        }

        @Override
        public void fail(HomeworkException error) {
            end(error);
        }

        private void end(HomeworkException error) {
            if (!onTickThread()) {
                post(() -> end(error));
                return;
            }
            if (!finished.compareAndSet(false, true)) {
                log.warn("任务 {} ({}) 重复结束，已忽略", task.getKind().getValue(), task.getId());
                return;
            }
            finish(this, error);
        }

        @Override
        public <T> void offload(Callable<T> work, Consumer<T> onSuccess) {
            workerPool.execute(() -> {
                T result;
                try {
                    result = work.call();
                } catch (Exception e) {
                    HomeworkException error = toHomeworkException(e);
                    TaskCoordinator.this.post(() -> fail(error));
                    return;
                }
                post(() -> onSuccess.accept(result));
            });
        }

        @Override
        public void post(Runnable callback) {
            TaskCoordinator.this.post(() -> {
                if (finished.get()) {
                    log.debug("任务 {} ({}) 已结束，丢弃迟到的回调", task.getKind().getValue(), task.getId());
                    return;
                }
                guard(callback);
            });
        }

        @Override
        public void submit(TaskKind kind, TaskParams params) {
            TaskCoordinator.this.submit(kind, params);
        }

        /**
         * 在调度线程上执行处理器代码，异常一律转为任务失败。
         */
        private void guard(Runnable action) {
            try {
                action.run();
            } catch (HomeworkException e) {
                fail(e);
            } catch (RuntimeException e) {
                log.error("任务 {} ({}) 执行异常", task.getKind().getValue(), task.getId(), e);
                fail(toHomeworkException(e));
            }
        }
    }
}
