package com.perizia.model.enums;

/**
 * 发件箱消息状态
 *
 * @author perizia
 * @since 2025-03-04
 */
public enum OutboxStatus {

    PENDING,

    PROCESSED,

    FAILED
}
