package com.homework.loader.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.loader.store.HomeworkDocument;
import com.homework.loader.store.HomeworkDocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 阶段 1：读取数据文件，判断格式，把作业数组切成固定大小的批次发往下游。
 * <p>
 * 支持两种格式：当前格式 {@code {"homeworks": [...], "settings": {...}}}，
 * 以及旧版的纯作业数组。
 */
@Slf4j
class DocumentReaderStage implements Runnable {

    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final HomeworkDocumentStore store;
    private final ObjectMapper objectMapper;
    private final PipelineChannel<JsonNode> output;
    private final int batchSize;

    DocumentReaderStage(HomeworkDocumentStore store, ObjectMapper objectMapper,
                        PipelineChannel<JsonNode> output, int batchSize) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.output = output;
        this.batchSize = batchSize;
    }

    @Override
    public void run() {
        try {
            if (!store.exists()) {
                log.warn("数据文件不存在: {}", store.getDataFile());
                fail("文件不存在");
                return;
            }

            JsonNode root = store.readTree();
            JsonNode homeworks;
            Map<String, Object> settings = null;

            if (root != null && root.isObject() && root.has(HomeworkDocument.HOMEWORKS_FIELD)) {
                homeworks = root.get(HomeworkDocument.HOMEWORKS_FIELD);
                JsonNode settingsNode = root.get(HomeworkDocument.SETTINGS_FIELD);
                if (settingsNode != null && settingsNode.isObject()) {
                    settings = objectMapper.convertValue(settingsNode, SETTINGS_TYPE);
                }
            } else {
                // 旧版格式：整个文件就是作业数组
                homeworks = root;
            }

            if (homeworks == null || !homeworks.isArray()) {
                fail("无法识别的数据格式");
                return;
            }

            int total = homeworks.size();
            int totalBatches = total == 0 ? 0 : (total - 1) / batchSize + 1;
            log.debug("开始读取数据, 作业数: {}, 批次数: {}, 格式: {}", total, totalBatches,
                    settings != null ? "当前" : "旧版");

            for (int start = 0, sequence = 1; start < total; start += batchSize, sequence++) {
                int end = Math.min(start + batchSize, total);
                List<JsonNode> records = new ArrayList<>(end - start);
                for (int i = start; i < end; i++) {
                    records.add(homeworks.get(i));
                }
                output.send(PipelineMessage.batch(new PipelineBatch<>(sequence, totalBatches, total, records)));
            }

            output.send(PipelineMessage.complete(total, settings));
            output.send(PipelineMessage.end());
        } catch (RuntimeException e) {
            log.error("读取数据文件失败", e);
            fail(e.getMessage());
        }
    }

    private void fail(String message) {
        output.send(PipelineMessage.error(message));
        output.send(PipelineMessage.end());
    }
}
