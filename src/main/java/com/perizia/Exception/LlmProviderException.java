package com.perizia.Exception;

import com.perizia.service.llm.ProviderErrorCode;
import lombok.Getter;

/**
 * 模型提供方调用失败
 * 错误码由提供方适配层根据 HTTP 状态或异常类型给出，上层只看错误码
 *
 * @author perizia
 * @since 2025-03-06
 */
@Getter
public class LlmProviderException extends RuntimeException {

    private final ProviderErrorCode code;

    /**
     * 失败时是否附带了提示词缓存
     */
    private final boolean cacheAttached;

    public LlmProviderException(ProviderErrorCode code, String message, Throwable cause) {
        this(code, false, message, cause);
    }

    public LlmProviderException(ProviderErrorCode code, boolean cacheAttached, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.cacheAttached = cacheAttached;
    }

    /**
     * 复制一份并标记是否附带缓存
     */
    public LlmProviderException withCacheAttached(boolean attached) {
        return new LlmProviderException(code, attached, getMessage(), getCause());
    }

    public boolean isCacheInvalidation() {
        return cacheAttached && code == ProviderErrorCode.INVALID_ARGUMENT;
    }
}
