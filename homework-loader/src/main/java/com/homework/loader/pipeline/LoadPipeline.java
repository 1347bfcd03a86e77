package com.homework.loader.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.common.dto.HomeworkItem;
import com.homework.loader.config.LoaderProperties;
import com.homework.loader.store.HomeworkDocumentStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 三级加载流水线：读取 -> 规范化 -> 汇聚。
 * <p>
 * 三个阶段各占一个线程，通过有界通道相连。每次加载新建一组通道和阶段，互不共享状态。
 */
@Slf4j
@Service
public class LoadPipeline {

    private final HomeworkDocumentStore store;
    private final ObjectMapper objectMapper;
    private final LoaderProperties properties;

    private final ExecutorService stageExecutor =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("homework-loader-"));

    public LoadPipeline(HomeworkDocumentStore store, ObjectMapper objectMapper, LoaderProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * 启动一次加载，立即返回。结果通过 listener 回调。
     *
     * @return 三个阶段全部退出时完成
     */
    public CompletableFuture<Void> start(LoadListener listener) {
        int capacity = properties.getChannelCapacity();
        PipelineChannel<JsonNode> rawChannel = new PipelineChannel<>("raw", capacity);
        PipelineChannel<HomeworkItem> normalizedChannel = new PipelineChannel<>("normalized", capacity);

        log.info("启动加载流水线: {}, 批大小: {}, 通道容量: {}",
                store.getDataFile(), properties.getBatchSize(), capacity);

        CompletableFuture<Void> reader = CompletableFuture.runAsync(
                new DocumentReaderStage(store, objectMapper, rawChannel, properties.getBatchSize()), stageExecutor);
        CompletableFuture<Void> normalizer = CompletableFuture.runAsync(
                new NormalizerStage(objectMapper, rawChannel, normalizedChannel), stageExecutor);
        CompletableFuture<Void> sink = CompletableFuture.runAsync(
                new LoadSinkStage(normalizedChannel, listener, properties.getEagerBatches()), stageExecutor);

        return CompletableFuture.allOf(reader, normalizer, sink)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("加载流水线异常退出", error);
                    }
                });
    }

    @PreDestroy
    public void shutdown() {
        stageExecutor.shutdownNow();
        try {
            if (!stageExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("加载流水线线程未能在 5 秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
