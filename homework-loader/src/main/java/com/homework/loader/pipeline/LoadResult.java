package com.homework.loader.pipeline;

import com.homework.common.dto.HomeworkItem;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次完整加载的结果。
 */
@Value
public class LoadResult {

    List<HomeworkItem> items;
    int totalCount;
    int batchCount;
    /** 旧版格式文件没有 settings */
    Map<String, Object> settings;
}
