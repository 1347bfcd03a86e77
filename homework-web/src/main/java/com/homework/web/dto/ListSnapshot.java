package com.homework.web.dto;

import com.homework.common.dto.HomeworkView;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 最近一次展示的作业列表。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListSnapshot {

    private List<HomeworkView> items;
    /** 加载中的进度 (0, 1]，完整结果为 null */
    private Double progress;
    private LocalDateTime updatedAt;
}
