package com.homework.dispatcher.notify;

import com.homework.common.dto.HomeworkAggregates;
import com.homework.common.dto.HomeworkView;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 没有展示层时的默认展示实现：只写日志。
 */
@Slf4j
public class LoggingHomeworkPresenter implements HomeworkPresenter {

    @Override
    public void presentList(List<HomeworkView> items, Double progress) {
        if (progress != null) {
            log.info("作业列表（加载中 {}%）: {} 项", Math.round(progress * 100), items.size());
        } else {
            log.info("作业列表: {} 项", items.size());
        }
    }

    @Override
    public void presentAggregates(HomeworkAggregates aggregates) {
        log.info("总计: {} | 已完成: {} | 逾期: {} | 今天截止: {}",
                aggregates.getTotal(), aggregates.getCompleted(), aggregates.getOverdue(), aggregates.getDueToday());
    }
}
