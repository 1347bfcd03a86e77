package com.homework.dispatcher.state;

import com.homework.common.dto.HomeworkItem;
import com.homework.common.dto.HomeworkSettings;
import com.homework.common.dto.StatusTag;
import com.homework.dispatcher.config.DispatcherProperties;
import com.homework.loader.store.HomeworkDocument;
import com.homework.status.service.StatusCache;
import com.homework.status.service.StatusClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 任务协调线程独占的共享状态：作业集合、状态缓存和当前配置。
 * <p>
 * 作业代号在集合内唯一；工作线程只能拿到 {@link #copyItems()} 之类的副本。
 * 非线程安全，只能在任务协调线程上访问。
 */
@Slf4j
@Component
public class HomeworkState {

    private final StatusClassifier classifier;
    private final Clock clock;

    /** code -> 作业，保持插入顺序（即文件中的顺序） */
    private final Map<String, HomeworkItem> items = new LinkedHashMap<>();
    private final StatusCache statusCache;

    private HomeworkSettings settings;
    private boolean loaded;

    public HomeworkState(StatusClassifier classifier, Clock clock, DispatcherProperties properties) {
        this.classifier = classifier;
        this.clock = clock;
        this.settings = HomeworkSettings.builder()
                .remindDays(properties.getDefaultRemindDays())
                .chartDays(properties.getDefaultChartDays())
                .build();
        this.statusCache = new StatusCache(this::classifyFresh);
    }

    // ==================== 作业集合 ====================

    public List<HomeworkItem> getItems() {
        return List.copyOf(items.values());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean contains(String code) {
        return items.containsKey(code);
    }

    public Optional<HomeworkItem> find(String code) {
        return Optional.ofNullable(items.get(code));
    }

    /**
     * 追加一条作业；代号重复属于调用方的错误。
     */
    public void add(HomeworkItem item) {
        if (items.containsKey(item.getCode())) {
            throw new IllegalStateException("作业代号已存在: " + item.getCode());
        }
        items.put(item.getCode(), item);
    }

    /**
     * 删除给定代号的作业，返回实际删除的数量。
     */
    public int removeAll(Collection<String> codes) {
        int removed = 0;
        for (String code : codes) {
            if (items.remove(code) != null) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        items.clear();
    }

    /**
     * 用加载结果替换整个集合。重复代号只保留第一条，返回被丢弃的数量。
     */
    public int replaceAll(Collection<HomeworkItem> loadedItems) {
        items.clear();
        int dropped = 0;
        for (HomeworkItem item : loadedItems) {
            if (items.putIfAbsent(item.getCode(), item) != null) {
                dropped++;
                log.warn("数据文件中作业代号重复，已忽略: {}", item.getCode());
            }
        }
        return dropped;
    }

    /**
     * 复制一份作业集合，供工作线程使用。
     */
    public List<HomeworkItem> copyItems() {
        List<HomeworkItem> copy = new ArrayList<>(items.size());
        for (HomeworkItem item : items.values()) {
            copy.add(item.copy());
        }
        return copy;
    }

    /**
     * 生成待保存的文档快照（作业和配置都是副本）。
     */
    public HomeworkDocument toDocument() {
        return new HomeworkDocument(copyItems(), settings.toDocument());
    }

    // ==================== 状态缓存 ====================

    public StatusCache getStatusCache() {
        return statusCache;
    }

    public StatusTag statusOf(String code) {
        return statusCache.get(code);
    }

    /**
     * 按当前时间和配置重算全部作业状态。
     */
    public void recomputeStatuses() {
        statusCache.recomputeAll(items.values(), classifier, now(), settings.getRemindDays());
    }

    /**
     * 按当前时间和配置计算单条作业的状态，并写入缓存。
     */
    public StatusTag refreshStatus(HomeworkItem item) {
        StatusTag tag = classifier.classify(item, today(), settings.getRemindDays());
        statusCache.set(item.getCode(), tag);
        return tag;
    }

    private Optional<StatusTag> classifyFresh(String code) {
        return find(code).map(item -> classifier.classify(item, today(), settings.getRemindDays()));
    }

    // ==================== 配置与时间 ====================

    public HomeworkSettings getSettings() {
        return settings;
    }

    /**
     * 合并数据文件中的配置。提醒天数可能变化，调用方随后应全量重算状态。
     */
    public void applyDocumentSettings(Map<String, Object> documentSettings) {
        HomeworkSettings merged = settings.merge(documentSettings);
        if (merged.getRemindDays() != settings.getRemindDays()) {
            log.info("提醒天数由 {} 调整为 {}", settings.getRemindDays(), merged.getRemindDays());
        }
        settings = merged;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public void setLoaded(boolean loaded) {
        this.loaded = loaded;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
