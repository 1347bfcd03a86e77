package com.homework.dispatcher.handler;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.StatusTag;
import com.homework.common.exception.DocumentIOException;
import com.homework.common.exception.PipelineException;
import com.homework.dispatcher.notify.HomeworkPresenter;
import com.homework.dispatcher.notify.NoticeLevel;
import com.homework.dispatcher.notify.UserNotifier;
import com.homework.dispatcher.service.TaskContext;
import com.homework.dispatcher.service.TaskHandler;
import com.homework.dispatcher.state.HomeworkState;
import com.homework.dispatcher.task.Task;
import com.homework.dispatcher.task.TaskKind;
import com.homework.dispatcher.view.HomeworkViews;
import com.homework.loader.pipeline.LoadListener;
import com.homework.loader.pipeline.LoadPipeline;
import com.homework.loader.pipeline.LoadResult;
import com.homework.status.service.StatusClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 加载任务：启动加载流水线，任务在流水线结束后才完成。
 * <p>
 * 流水线回调发生在汇聚线程上，这里只把结果投递回调度线程，
 * 替换作业集合、重算状态都在调度线程上进行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoadTaskHandler implements TaskHandler {

    private final LoadPipeline pipeline;
    private final StatusClassifier classifier;
    private final HomeworkViews views;
    private final HomeworkPresenter presenter;
    private final UserNotifier notifier;

    @Override
    public TaskKind kind() {
        return TaskKind.LOAD;
    }

    @Override
    public void handle(Task task, TaskContext context) {
        notifier.notifyUser("正在加载数据...", NoticeLevel.INFO);
        pipeline.start(new LoadListener() {
            @Override
            public void onPartialResult(List<HomeworkItem> loadedSoFar, int totalCount) {
                context.post(() -> presentPartial(context, loadedSoFar, totalCount));
            }

            @Override
            public void onComplete(LoadResult result) {
                context.post(() -> install(context, result));
            }

            @Override
            public void onError(PipelineException error) {
                context.post(() -> abandon(context, error));
            }
        });
    }

    private void presentPartial(TaskContext context, List<HomeworkItem> loadedSoFar, int totalCount) {
        LocalDate today = context.state().today();
        int remindDays = context.settings().getRemindDays();
        Map<String, StatusTag> tags = new HashMap<>();
        for (HomeworkItem item : loadedSoFar) {
            tags.putIfAbsent(item.getCode(), classifier.classify(item, today, remindDays));
        }
        double progress = totalCount == 0 ? 1.0 : (double) loadedSoFar.size() / totalCount;
        presenter.presentList(views.displayList(loadedSoFar, tags::get, today), progress);
    }

    private void install(TaskContext context, LoadResult result) {
        HomeworkState state = context.state();
        int dropped = state.replaceAll(result.getItems());
        if (result.getSettings() != null) {
            state.applyDocumentSettings(result.getSettings());
        }
        state.setLoaded(true);
        state.recomputeStatuses();
        log.info("数据加载完成: {} 条, {} 批, 重复代号丢弃 {} 条", state.size(), result.getBatchCount(), dropped);

        if (!state.isEmpty()) {
            notifier.notifyUser("成功加载 " + state.size() + " 条作业记录", NoticeLevel.INFO);
        }
        context.submit(TaskKind.REFRESH);
        context.submit(TaskKind.UPDATE_DERIVED_VIEWS);
        context.complete();
    }

    private void abandon(TaskContext context, PipelineException error) {
        HomeworkState state = context.state();
        state.clear();
        state.getStatusCache().clear();
        state.setLoaded(true);
        context.fail(new DocumentIOException("加载数据时出错：" + error.getMessage(), error));
    }
}
