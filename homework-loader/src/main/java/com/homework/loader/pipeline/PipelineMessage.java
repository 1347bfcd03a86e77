package com.homework.loader.pipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 流水线阶段之间传递的消息。
 * <p>
 * 消息流总是以 {@link Type#END} 结束，且 END 之前一定是 {@link Type#COMPLETE} 或 {@link Type#ERROR}。
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PipelineMessage<T> {

    public enum Type {
        /** 一批数据 */
        BATCH,
        /** 全部批次已发出，携带总数和配置 */
        COMPLETE,
        /** 某一阶段出错，后续阶段不再处理数据 */
        ERROR,
        /** 终止标记 */
        END
    }

    private final Type type;
    private final PipelineBatch<T> batch;
    private final int totalCount;
    /** 当前格式文件中的 settings；旧版格式为 null */
    private final Map<String, Object> settings;
    private final String errorMessage;

    public static <T> PipelineMessage<T> batch(PipelineBatch<T> batch) {
        return new PipelineMessage<>(Type.BATCH, batch, batch.getTotalCount(), null, null);
    }

    public static <T> PipelineMessage<T> complete(int totalCount, Map<String, Object> settings) {
        return new PipelineMessage<>(Type.COMPLETE, null, totalCount, settings, null);
    }

    public static <T> PipelineMessage<T> error(String errorMessage) {
        return new PipelineMessage<>(Type.ERROR, null, 0, null, errorMessage);
    }

    public static <T> PipelineMessage<T> end() {
        return new PipelineMessage<>(Type.END, null, 0, null, null);
    }

    /**
     * 控制消息（非数据批次）换一个泛型参数原样向下游传递。
     */
    public <R> PipelineMessage<R> passThrough() {
        if (type == Type.BATCH) {
            throw new IllegalStateException("数据批次不能直接透传");
        }
        return new PipelineMessage<>(type, null, totalCount, settings, errorMessage);
    }

    public boolean isTerminal() {
        return type == Type.END;
    }
}
