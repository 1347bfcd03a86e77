package com.homework.status.service;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.StatusTag;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 作业状态缓存：code -> 派生状态标签。
 * <p>
 * 缓存未命中不是错误：按 code 找到作业后现场计算并写回；
 * 作业不存在时返回 {@link StatusTag#PENDING}，不写入缓存。
 * <p>
 * 非线程安全，只能在任务协调线程上访问。
 */
@Slf4j
public class StatusCache {

    /** 未命中时的现场计算：code -> 标签，作业不存在时返回空 */
    private final Function<String, Optional<StatusTag>> fallback;

    private final Map<String, StatusTag> tags = new HashMap<>();

    private LocalDateTime lastRecomputedAt;
    private LocalDate lastRecomputedFor;

    public StatusCache(Function<String, Optional<StatusTag>> fallback) {
        this.fallback = fallback;
    }

    /**
     * 用当前时间重算全部作业状态，替换整个映射。
     */
    public void recomputeAll(Collection<HomeworkItem> items, StatusClassifier classifier,
                             LocalDateTime now, int remindDays) {
        LocalDate today = now.toLocalDate();
        tags.clear();
        for (HomeworkItem item : items) {
            tags.put(item.getCode(), classifier.classify(item, today, remindDays));
        }
        lastRecomputedAt = now;
        lastRecomputedFor = today;
        log.debug("状态缓存已全量重算, 作业数: {}", tags.size());
    }

    public StatusTag get(String code) {
        StatusTag cached = tags.get(code);
        if (cached != null) {
            return cached;
        }
        Optional<StatusTag> computed = fallback.apply(code);
        computed.ifPresent(tag -> tags.put(code, tag));
        return computed.orElse(StatusTag.PENDING);
    }

    /**
     * 只查缓存，不触发现场计算。
     */
    public Optional<StatusTag> peek(String code) {
        return Optional.ofNullable(tags.get(code));
    }

    public void set(String code, StatusTag tag) {
        tags.put(code, tag);
    }

    public void invalidate(String code) {
        tags.remove(code);
    }

    public void clear() {
        tags.clear();
    }

    public int size() {
        return tags.size();
    }

    /**
     * 复制当前映射，交给工作线程只读使用。
     */
    public Map<String, StatusTag> snapshot() {
        return new HashMap<>(tags);
    }

    /**
     * 距上次全量重算是否已超过给定周期，或者已经跨天。
     */
    public boolean isStale(LocalDateTime now, Duration interval) {
        if (lastRecomputedAt == null) {
            return true;
        }
        if (!now.toLocalDate().equals(lastRecomputedFor)) {
            return true;
        }
        return !lastRecomputedAt.plus(interval).isAfter(now);
    }
}
