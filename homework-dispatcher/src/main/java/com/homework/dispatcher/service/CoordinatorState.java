package com.homework.dispatcher.service;

/**
 * 调度器状态：空闲时可以取下一个任务，忙碌时等待当前任务完成。
 */
public enum CoordinatorState {
    IDLE,
    BUSY
}
