package com.perizia.service;

/**
 * 发件箱处理器，可多个实例并发调用
 *
 * @author perizia
 * @since 2025-03-04
 */
public interface OutboxProcessorService {

    /**
     * 领取一批待处理消息并分发，被其他事务锁住的消息跳过。
     * 单条失败只记录错误并递增重试次数，不影响其余消息。
     *
     * @param limit 最多处理的消息数
     * @return 本批处理成功的消息数
     */
    int processBatch(int limit);

    /**
     * 处理指定消息，已被其他事务领取或已处理时跳过
     *
     * @param messageId 消息ID
     * @return 是否处理成功
     */
    boolean processMessage(Long messageId);
}
