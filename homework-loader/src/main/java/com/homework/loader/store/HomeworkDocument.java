package com.homework.loader.store;

import com.homework.common.dto.HomeworkItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 数据文件的当前格式：{@code {"homeworks": [...], "settings": {...}}}。
 * <p>
 * 旧版文件只有一个作业数组，由加载流水线兼容处理。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HomeworkDocument {

    public static final String HOMEWORKS_FIELD = "homeworks";
    public static final String SETTINGS_FIELD = "settings";

    private List<HomeworkItem> homeworks;
    private Map<String, Object> settings;
}
