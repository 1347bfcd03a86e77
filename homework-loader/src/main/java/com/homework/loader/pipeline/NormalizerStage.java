package com.homework.loader.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkStatus;
import com.homework.common.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 阶段 2：逐批规范化记录。
 * <p>
 * 缺少 status 字段的记录补为 pending（兼容旧数据），然后转换成 {@link HomeworkItem}。
 * 控制消息原样透传。本阶段出错后向下游发出错误和终止标记，
 * 之后继续消费并丢弃上游剩余消息，直到收到终止标记，保证上游不会卡在满通道上。
 */
@Slf4j
class NormalizerStage implements Runnable {

    private static final String STATUS_FIELD = "status";
    private static final String CODE_FIELD = "code";

    private final ObjectMapper objectMapper;
    private final PipelineChannel<JsonNode> input;
    private final PipelineChannel<HomeworkItem> output;

    NormalizerStage(ObjectMapper objectMapper, PipelineChannel<JsonNode> input,
                    PipelineChannel<HomeworkItem> output) {
        this.objectMapper = objectMapper;
        this.input = input;
        this.output = output;
    }

    @Override
    public void run() {
        boolean failed = false;
        while (true) {
            PipelineMessage<JsonNode> message = input.receive();
            if (message.isTerminal()) {
                if (!failed) {
                    output.send(PipelineMessage.end());
                }
                return;
            }
            if (failed) {
                continue;
            }

            switch (message.getType()) {
                case ERROR:
                    output.send(message.passThrough());
                    output.send(PipelineMessage.end());
                    failed = true;
                    break;
                case COMPLETE:
                    output.send(message.passThrough());
                    break;
                case BATCH:
                    try {
                        output.send(PipelineMessage.batch(normalize(message.getBatch())));
                    } catch (PipelineException | IllegalArgumentException e) {
                        log.error("数据处理错误, 批次 {}/{}", message.getBatch().getSequence(),
                                message.getBatch().getTotalBatches(), e);
                        output.send(PipelineMessage.error("数据处理错误: " + e.getMessage()));
                        output.send(PipelineMessage.end());
                        failed = true;
                    }
                    break;
                default:
                    throw new IllegalStateException("未知消息类型: " + message.getType());
            }
        }
    }

    private PipelineBatch<HomeworkItem> normalize(PipelineBatch<JsonNode> batch) {
        List<HomeworkItem> items = new ArrayList<>(batch.size());
        for (JsonNode record : batch.getRecords()) {
            if (!record.isObject()) {
                throw new PipelineException("作业记录不是对象: " + record);
            }
            ObjectNode node = (ObjectNode) record;
            if (!node.hasNonNull(CODE_FIELD)) {
                throw new PipelineException("作业记录缺少 code 字段: " + node);
            }
            if (!node.hasNonNull(STATUS_FIELD)) {
                node.put(STATUS_FIELD, HomeworkStatus.PENDING.getValue());
            }
            items.add(objectMapper.convertValue(node, HomeworkItem.class));
        }
        log.debug("批次 {}/{} 规范化完成, 记录数: {}", batch.getSequence(), batch.getTotalBatches(), items.size());
        return batch.withRecords(items);
    }
}
