package com.perizia.Exception;

/**
 * 报告生成失败（模型调用的所有路径均已用尽）
 * 捕获方将案件置为 ERROR，不再向任务队列抛出
 *
 * @author perizia
 * @since 2025-03-06
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
