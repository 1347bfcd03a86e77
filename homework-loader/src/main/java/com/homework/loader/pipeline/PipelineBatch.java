package com.homework.loader.pipeline;

import lombok.Value;

import java.util.List;

/**
 * 流水线中的一批记录，带有批次序号（从 1 开始）和总量信息。
 */
@Value
public class PipelineBatch<T> {

    int sequence;
    int totalBatches;
    int totalCount;
    List<T> records;

    public boolean isLast() {
        return sequence == totalBatches;
    }

    public int size() {
        return records.size();
    }

    public <R> PipelineBatch<R> withRecords(List<R> newRecords) {
        return new PipelineBatch<>(sequence, totalBatches, totalCount, newRecords);
    }
}
