package com.perizia.utils;

import cn.dev33.satoken.stp.StpUtil;
import top.continew.starter.core.exception.BusinessException;

/**
 * 当前登录用户的租户
 * 登录时写入 Sa-Token 会话的 tenantId 属性
 *
 * @author perizia
 * @since 2025-03-02
 */
public final class TenantContext {

    public static final String SESSION_TENANT_KEY = "tenantId";

    public static final String SESSION_ROLES_KEY = "roles";

    private TenantContext() {
    }

    public static Long currentTenantId() {
        Object tenantId = StpUtil.getSession().get(SESSION_TENANT_KEY);
        if (tenantId == null) {
            throw new BusinessException("当前会话未绑定租户");
        }
        return tenantId instanceof Number number ? number.longValue() : Long.valueOf(tenantId.toString());
    }
}
