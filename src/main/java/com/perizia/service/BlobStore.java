package com.perizia.service;

import java.time.Duration;

/**
 * 对象存储
 * 引用即存储内的相对路径，如 cases/1/2/a1b2c3.pdf
 *
 * @author perizia
 * @since 2025-03-02
 */
public interface BlobStore {

    /**
     * 写入对象，已存在时覆盖
     *
     * @param data 内容
     * @param path 相对路径
     * @return 对象引用
     */
    String put(byte[] data, String path);

    byte[] get(String ref);

    boolean exists(String ref);

    /**
     * 生成带过期时间的签名下载链接
     */
    String signedUrl(String ref, Duration ttl);

    /**
     * 校验签名下载链接的参数
     *
     * @param ref       对象引用
     * @param expiresAt 过期时间(epoch 秒)
     * @param signature 签名
     * @return 签名正确且未过期
     */
    boolean verifySignature(String ref, long expiresAt, String signature);

    /**
     * 删除对象，不存在时忽略
     */
    void delete(String ref);
}
