package com.perizia.service.impl;

import cn.hutool.core.exceptions.ValidateException;
import cn.hutool.core.util.StrUtil;
import cn.hutool.jwt.JWT;
import cn.hutool.jwt.JWTUtil;
import cn.hutool.jwt.JWTValidator;
import cn.hutool.jwt.RegisteredPayload;
import cn.hutool.jwt.signers.JWTSigner;
import cn.hutool.jwt.signers.JWTSignerUtil;
import com.perizia.Exception.TaskAuthException;
import com.perizia.config.TaskAuthProperties;
import com.perizia.service.TaskAuthService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;

/**
 * 任务回调身份令牌 - HS256 JWT 实现
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Service
public class TaskAuthServiceImpl implements TaskAuthService {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * 时钟偏差容忍(秒)
     */
    private static final long LEEWAY_SECONDS = 30;

    private final TaskAuthProperties properties;

    private final Clock clock;

    public TaskAuthServiceImpl(TaskAuthProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String issueToken() {
        Instant now = clock.instant();
        return JWT.create()
            .setSubject(properties.getIssuerIdentity())
            .setAudience(properties.getAudience())
            .setIssuedAt(Date.from(now))
            .setExpiresAt(Date.from(now.plus(properties.getTokenTtl())))
            .setSigner(signer())
            .sign();
    }

    @Override
    public String verifyBearer(String authorization) {
        if (StrUtil.isBlank(authorization) || !authorization.startsWith(BEARER_PREFIX)) {
            throw TaskAuthException.unauthorized("缺少身份令牌");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();

        JWT jwt;
        try {
            jwt = JWTUtil.parseToken(token);
        } catch (RuntimeException e) {
            throw TaskAuthException.unauthorized("身份令牌格式错误");
        }
        if (!jwt.setSigner(signer()).verify()) {
            throw TaskAuthException.forbidden("身份令牌签名无效");
        }
        try {
            JWTValidator.of(jwt).validateDate(Date.from(clock.instant()), LEEWAY_SECONDS);
        } catch (ValidateException e) {
            throw TaskAuthException.forbidden("身份令牌已过期或尚未生效");
        }
        if (jwt.getPayload(RegisteredPayload.EXPIRES_AT) == null) {
            throw TaskAuthException.forbidden("身份令牌缺少过期时间");
        }
        if (!audienceMatches(jwt.getPayload(RegisteredPayload.AUDIENCE))) {
            throw TaskAuthException.forbidden("身份令牌受众不符");
        }
        Object subject = jwt.getPayload(RegisteredPayload.SUBJECT);
        String identity = subject == null ? null : subject.toString();
        if (identity == null || !properties.getAllowedIdentities().contains(identity)) {
            log.warn("拒绝未授权的服务身份: identity={}", identity);
            throw TaskAuthException.forbidden("服务身份不在允许列表中");
        }
        return identity;
    }

    private boolean audienceMatches(Object audience) {
        if (audience instanceof Collection<?> values) {
            return values.stream().anyMatch(v -> properties.getAudience().equals(String.valueOf(v)));
        }
        return audience != null && properties.getAudience().equals(audience.toString());
    }

    private JWTSigner signer() {
        if (StrUtil.isBlank(properties.getSecret())) {
            throw new IllegalStateException("task.auth.secret 未配置");
        }
        return JWTSignerUtil.hs256(properties.getSecret().getBytes(StandardCharsets.UTF_8));
    }
}
