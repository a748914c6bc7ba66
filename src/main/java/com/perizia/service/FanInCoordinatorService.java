package com.perizia.service;

/**
 * 文档汇聚判定
 *
 * @author perizia
 * @since 2025-03-04
 */
public interface FanInCoordinatorService {

    /**
     * 在案件行锁内检查是否所有文档都已到达终态。
     * 全部结束且至少一个成功时，将案件置为 GENERATING 并在同一事务内写入生成消息，提交后尽力立即分发；
     * 没有任何成功文档时案件置为 ERROR，不触发生成。
     *
     * @param caseId   案件ID
     * @param tenantId 租户ID
     */
    void checkCompletion(Long caseId, Long tenantId);
}
