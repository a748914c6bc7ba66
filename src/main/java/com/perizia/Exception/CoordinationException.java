package com.perizia.Exception;

/**
 * 协调类错误（锁超时、版本号唯一约束冲突等）
 * 事务回滚后继续向上抛给任务队列，由队列决定是否整体重试
 *
 * @author perizia
 * @since 2025-03-05
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
