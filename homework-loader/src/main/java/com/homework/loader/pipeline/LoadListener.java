package com.homework.loader.pipeline;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.exception.PipelineException;

import java.util.List;

/**
 * 加载流水线的输出端回调，全部在汇聚阶段的线程上调用。
 * <p>
 * 实现方不得在回调里直接修改共享状态，应当把结果转交给任务协调线程。
 */
public interface LoadListener {

    /** 每收到一批数据调用一次 */
    default void onBatch(PipelineBatch<HomeworkItem> batch, int loadedCount) {
    }

    /**
     * 前几批数据的提前展示，参数是到目前为止已加载的全部记录（副本）。
     */
    default void onPartialResult(List<HomeworkItem> loadedSoFar, int totalCount) {
    }

    void onComplete(LoadResult result);

    void onError(PipelineException error);
}
