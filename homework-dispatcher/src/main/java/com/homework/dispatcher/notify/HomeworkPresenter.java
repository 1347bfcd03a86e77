package com.homework.dispatcher.notify;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkView;

import java.util.List;

/**
 * 展示层接口：接收排好序的作业列表和统计汇总。
 * <p>
 * 只在任务协调线程上调用。
 */
public interface HomeworkPresenter {

    /**
     * @param items    已排序的作业列表
     * @param progress 加载进度 (0, 1]；完整结果时为 null
     */
    void presentList(List<HomeworkView> items, Double progress);

    void presentAggregates(HomeworkAggregates aggregates);
}
