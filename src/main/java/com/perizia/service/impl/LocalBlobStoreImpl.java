package com.perizia.service.impl;

import cn.hutool.core.net.URLEncodeUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.SecureUtil;
import com.perizia.config.FileStorageProperties;
import com.perizia.service.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;

/**
 * 对象存储 - 本地文件系统实现
 * 签名链接使用 HMAC-SHA256(ref:expiresAt)
 *
 * @author perizia
 * @since 2025-03-02
 */
@Slf4j
@Service
public class LocalBlobStoreImpl implements BlobStore {

    static final String DOWNLOAD_PATH = "/files/download";

    private final FileStorageProperties properties;

    private final Clock clock;

    public LocalBlobStoreImpl(FileStorageProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String put(byte[] data, String path) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
            log.info("对象写入成功: ref={}, size={}", path, data.length);
            return path;
        } catch (IOException e) {
            log.error("对象写入失败: ref={}", path, e);
            throw new BusinessException("文件保存失败: " + e.getMessage());
        }
    }

    @Override
    public byte[] get(String ref) {
        Path filePath = resolve(ref);
        if (!Files.isRegularFile(filePath)) {
            throw new BusinessException("文件不存在: " + ref);
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            log.error("对象读取失败: ref={}", ref, e);
            throw new BusinessException("文件读取失败: " + e.getMessage());
        }
    }

    @Override
    public boolean exists(String ref) {
        return Files.isRegularFile(resolve(ref));
    }

    @Override
    public String signedUrl(String ref, Duration ttl) {
        resolve(ref);
        long expiresAt = clock.instant().plus(ttl).getEpochSecond();
        return StrUtil.removeSuffix(properties.getPublicBaseUrl(), "/") + DOWNLOAD_PATH
            + "?ref=" + URLEncodeUtil.encodeQuery(ref)
            + "&expires=" + expiresAt
            + "&signature=" + sign(ref, expiresAt);
    }

    @Override
    public boolean verifySignature(String ref, long expiresAt, String signature) {
        if (StrUtil.hasBlank(ref, signature) || clock.instant().getEpochSecond() > expiresAt) {
            return false;
        }
        return MessageDigest.isEqual(
            sign(ref, expiresAt).getBytes(StandardCharsets.UTF_8),
            signature.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void delete(String ref) {
        Path filePath = resolve(ref);
        try {
            if (Files.deleteIfExists(filePath)) {
                log.info("对象删除成功: ref={}", ref);
            } else {
                log.warn("对象不存在,无需删除: ref={}", ref);
            }
        } catch (IOException e) {
            log.error("对象删除失败: ref={}", ref, e);
            throw new BusinessException("文件删除失败: " + e.getMessage());
        }
    }

    private String sign(String ref, long expiresAt) {
        if (StrUtil.isBlank(properties.getSigningSecret())) {
            throw new IllegalStateException("file.storage.signing-secret 未配置");
        }
        return SecureUtil.hmacSha256(properties.getSigningSecret()).digestHex(ref + ":" + expiresAt);
    }

    /**
     * 解析为基础目录内的绝对路径，拒绝路径遍历
     */
    private Path resolve(String ref) {
        if (StrUtil.isBlank(ref)) {
            throw new BusinessException("文件路径不能为空");
        }
        if (ref.contains("..") || ref.contains("\\") || ref.startsWith("/")) {
            throw new BusinessException("无效的文件路径");
        }
        Path base = Paths.get(properties.getBasePath()).toAbsolutePath().normalize();
        Path filePath = base.resolve(ref).normalize();
        if (!filePath.startsWith(base)) {
            throw new BusinessException("文件路径超出允许范围");
        }
        return filePath;
    }
}
