package com.perizia.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.enums.ExtractionStatus;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * 案件文档 Mapper
 *
 * @author perizia
 * @since 2025-03-02
 */
@Mapper
public interface DocumentMapper extends BaseMapper<DocumentDO> {

    /**
     * 统计尚未到达终态的文档数
     */
    default long countNonTerminal(Long caseId, Long tenantId) {
        return selectCount(new LambdaQueryWrapper<DocumentDO>()
            .eq(DocumentDO::getCaseId, caseId)
            .eq(DocumentDO::getTenantId, tenantId)
            .notIn(DocumentDO::getAiStatus, ExtractionStatus.terminalStatuses()));
    }

    default long countByStatus(Long caseId, Long tenantId, ExtractionStatus status) {
        return selectCount(new LambdaQueryWrapper<DocumentDO>()
            .eq(DocumentDO::getCaseId, caseId)
            .eq(DocumentDO::getTenantId, tenantId)
            .eq(DocumentDO::getAiStatus, status));
    }

    default List<DocumentDO> selectByCase(Long caseId, Long tenantId) {
        return selectList(new LambdaQueryWrapper<DocumentDO>()
            .eq(DocumentDO::getCaseId, caseId)
            .eq(DocumentDO::getTenantId, tenantId)
            .orderByAsc(DocumentDO::getCreateTime));
    }

    default List<DocumentDO> selectByCaseAndStatus(Long caseId, Long tenantId, ExtractionStatus status) {
        return selectList(new LambdaQueryWrapper<DocumentDO>()
            .eq(DocumentDO::getCaseId, caseId)
            .eq(DocumentDO::getTenantId, tenantId)
            .eq(DocumentDO::getAiStatus, status)
            .orderByAsc(DocumentDO::getCreateTime));
    }
}
