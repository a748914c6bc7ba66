package com.perizia.service.llm;

/**
 * 模型提供方错误码
 * 由提供方适配层从 HTTP 状态码或异常类型映射得到，编排层只依据错误码决策，不解析错误文本。
 * 映射规则变化时递增 {@link #CONTRACT_VERSION}。
 *
 * @author perizia
 * @since 2025-03-06
 */
public enum ProviderErrorCode {

    /**
     * 400，请求参数非法；附带缓存时视为缓存失效
     */
    INVALID_ARGUMENT,

    /**
     * 401/403
     */
    PERMISSION_DENIED,

    /**
     * 404，模型或缓存不存在
     */
    NOT_FOUND,

    /**
     * 429，限流
     */
    RESOURCE_EXHAUSTED,

    /**
     * 500
     */
    INTERNAL,

    /**
     * 503，服务不可用
     */
    UNAVAILABLE,

    /**
     * 529 或提供方明确返回的过载
     */
    OVERLOADED,

    /**
     * 504 或客户端读取超时
     */
    DEADLINE_EXCEEDED,

    UNKNOWN;

    public static final int CONTRACT_VERSION = 1;

    /**
     * 同一模型上退避重试可能恢复的错误
     */
    public boolean isTransient() {
        return switch (this) {
            case UNAVAILABLE, DEADLINE_EXCEEDED, RESOURCE_EXHAUSTED, INTERNAL, OVERLOADED -> true;
            default -> false;
        };
    }

    /**
     * 过载类错误，可以切换到备用模型
     */
    public boolean isOverload() {
        return this == OVERLOADED || this == UNAVAILABLE;
    }

    public static ProviderErrorCode fromHttpStatus(int status) {
        return switch (status) {
            case 400 -> INVALID_ARGUMENT;
            case 401, 403 -> PERMISSION_DENIED;
            case 404 -> NOT_FOUND;
            case 408, 504 -> DEADLINE_EXCEEDED;
            case 429 -> RESOURCE_EXHAUSTED;
            case 500 -> INTERNAL;
            case 502, 503 -> UNAVAILABLE;
            case 529 -> OVERLOADED;
            default -> status >= 500 ? INTERNAL : UNKNOWN;
        };
    }
}
