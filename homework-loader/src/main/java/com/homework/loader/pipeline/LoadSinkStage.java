package com.homework.loader.pipeline;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 阶段 3：汇聚规范化后的批次。
 * <p>
 * 前 {@code eagerBatches} 批到达时立即回调部分结果；收到 COMPLETE 时校验批次与总数，
 * 回调完成；收到 ERROR 时回调失败。回调方出错同样按失败处理，并继续排空上游直到终止标记。
 */
@Slf4j
class LoadSinkStage implements Runnable {

    private final PipelineChannel<HomeworkItem> input;
    private final LoadListener listener;
    private final int eagerBatches;

    private final List<HomeworkItem> loaded = new ArrayList<>();
    private int receivedBatches;
    private boolean finished;

    LoadSinkStage(PipelineChannel<HomeworkItem> input, LoadListener listener, int eagerBatches) {
        this.input = input;
        this.listener = listener;
        this.eagerBatches = eagerBatches;
    }

    @Override
    public void run() {
        while (true) {
            PipelineMessage<HomeworkItem> message = input.receive();
            if (message.isTerminal()) {
                if (!finished) {
                    // 上游异常退出时没有 COMPLETE/ERROR，不能让加载任务永远等下去
                    finish(new PipelineException("加载流水线意外结束"));
                }
                return;
            }
            if (finished) {
                continue;
            }
            try {
                handle(message);
            } catch (RuntimeException e) {
                if (finished) {
                    log.error("加载结果回调失败", e);
                } else if (e instanceof PipelineException) {
                    finish((PipelineException) e);
                } else {
                    log.error("界面准备错误", e);
                    finish(new PipelineException("界面准备错误: " + e.getMessage(), e));
                }
            }
        }
    }

    private void handle(PipelineMessage<HomeworkItem> message) {
        switch (message.getType()) {
            case BATCH:
                acceptBatch(message.getBatch());
                break;
            case COMPLETE:
                if (loaded.size() != message.getTotalCount()) {
                    throw new PipelineException("批次数据不完整: 期望 " + message.getTotalCount()
                            + " 条, 实际 " + loaded.size() + " 条");
                }
                finished = true;
                log.info("数据加载完成, 作业数: {}, 批次数: {}", loaded.size(), receivedBatches);
                listener.onComplete(new LoadResult(List.copyOf(loaded), message.getTotalCount(),
                        receivedBatches, message.getSettings()));
                break;
            case ERROR:
                finish(new PipelineException(message.getErrorMessage()));
                break;
            default:
                throw new IllegalStateException("未知消息类型: " + message.getType());
        }
    }

    private void acceptBatch(PipelineBatch<HomeworkItem> batch) {
        int expected = receivedBatches + 1;
        if (batch.getSequence() != expected) {
            throw new PipelineException("批次顺序错误: 期望第 " + expected + " 批, 收到第 " + batch.getSequence() + " 批");
        }
        loaded.addAll(batch.getRecords());
        receivedBatches = expected;
        log.debug("正在加载... ({}/{})", loaded.size(), batch.getTotalCount());

        listener.onBatch(batch, loaded.size());
        if (receivedBatches <= eagerBatches) {
            listener.onPartialResult(List.copyOf(loaded), batch.getTotalCount());
        }
    }

    private void finish(PipelineException error) {
        finished = true;
        log.warn("数据加载失败: {}", error.getMessage());
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.error("加载失败回调出错", e);
        }
    }
}
