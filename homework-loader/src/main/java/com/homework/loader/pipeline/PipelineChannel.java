package com.homework.loader.pipeline;

import com.homework.common.exception.PipelineException;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 阶段之间的有界通道。
 * <p>
 * 通道满时发送方阻塞，下游慢时上游随之放慢，不丢弃任何消息；先进先出，保持批次顺序。
 */
public class PipelineChannel<T> {

    private final String name;
    private final BlockingQueue<PipelineMessage<T>> queue;

    public PipelineChannel(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void send(PipelineMessage<T> message) {
        try {
            queue.put(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("向通道 " + name + " 发送消息时被中断", e);
        }
    }

    public PipelineMessage<T> receive() {
        try {
            return queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("从通道 " + name + " 接收消息时被中断", e);
        }
    }

    /** 剩余容量，为 0 时发送方会阻塞 */
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }
}
