package com.perizia.config;

import cn.dev33.satoken.stp.StpInterface;
import cn.dev33.satoken.stp.StpUtil;
import com.perizia.utils.TenantContext;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Sa-Token 角色来源：登录时写入会话的 roles 属性
 *
 * @author perizia
 * @since 2025-03-05
 */
@Component
public class StpInterfaceImpl implements StpInterface {

    @Override
    public List<String> getPermissionList(Object loginId, String loginType) {
        return Collections.emptyList();
    }

    @Override
    public List<String> getRoleList(Object loginId, String loginType) {
        return toRoles(StpUtil.getSessionByLoginId(loginId).get(TenantContext.SESSION_ROLES_KEY));
    }

    /**
     * 会话属性经过序列化后元素类型不一定是 String，逐个转换
     */
    static List<String> toRoles(Object roles) {
        if (!(roles instanceof List<?> list)) {
            return Collections.emptyList();
        }
        return list.stream().map(String::valueOf).toList();
    }
}
