package com.perizia.service;

import com.perizia.Exception.TaskAuthException;

/**
 * 任务回调的服务身份令牌
 *
 * @author perizia
 * @since 2025-03-03
 */
public interface TaskAuthService {

    /**
     * 为本服务投递的任务签发身份令牌
     */
    String issueToken();

    /**
     * 校验 Authorization 头
     *
     * @param authorization "Bearer xxx" 形式的请求头
     * @return 调用方身份
     * @throws TaskAuthException 缺失或格式错误为 401，签名、身份、受众或有效期不符为 403
     */
    String verifyBearer(String authorization);
}
