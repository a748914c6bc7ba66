package com.perizia.service;

import java.time.Duration;

/**
 * 僵尸案件清理
 *
 * @author perizia
 * @since 2025-03-05
 */
public interface ZombieRecoveryService {

    /**
     * 一条语句把创建时间早于 now - timeout 且处于 PROCESSING / GENERATING 的案件重置为 OPEN
     *
     * @param timeout 超时
     * @return 重置的案件数
     */
    int rescue(Duration timeout);
}
