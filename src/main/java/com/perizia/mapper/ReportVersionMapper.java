package com.perizia.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.perizia.model.entity.ReportVersionDO;
import com.perizia.model.enums.VersionSource;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 报告版本 Mapper
 *
 * @author perizia
 * @since 2025-03-05
 */
@Mapper
public interface ReportVersionMapper extends BaseMapper<ReportVersionDO> {

    /**
     * 当前最大版本号，没有版本时为 0
     */
    @Select("SELECT COALESCE(MAX(version_number), 0) FROM report_versions WHERE case_id = #{caseId} AND tenant_id = #{tenantId}")
    int selectMaxVersionNumber(@Param("caseId") Long caseId, @Param("tenantId") Long tenantId);

    /**
     * 最近一个带有 AI 原文的 AI 初稿，用于生成训练样本对
     */
    default ReportVersionDO selectLatestDraft(Long caseId, Long tenantId) {
        return selectOne(new LambdaQueryWrapper<ReportVersionDO>()
            .eq(ReportVersionDO::getCaseId, caseId)
            .eq(ReportVersionDO::getTenantId, tenantId)
            .eq(ReportVersionDO::getSource, VersionSource.AI_DRAFT)
            .eq(ReportVersionDO::getIsFinal, false)
            .isNotNull(ReportVersionDO::getAiRawOutput)
            .orderByDesc(ReportVersionDO::getVersionNumber)
            .last("LIMIT 1"));
    }

    default ReportVersionDO selectLatestBySource(Long caseId, Long tenantId, VersionSource source) {
        return selectOne(new LambdaQueryWrapper<ReportVersionDO>()
            .eq(ReportVersionDO::getCaseId, caseId)
            .eq(ReportVersionDO::getTenantId, tenantId)
            .eq(ReportVersionDO::getSource, source)
            .orderByDesc(ReportVersionDO::getVersionNumber)
            .last("LIMIT 1"));
    }

    default boolean existsBySource(Long caseId, Long tenantId, VersionSource source) {
        return exists(new LambdaQueryWrapper<ReportVersionDO>()
            .eq(ReportVersionDO::getCaseId, caseId)
            .eq(ReportVersionDO::getTenantId, tenantId)
            .eq(ReportVersionDO::getSource, source));
    }

    default List<ReportVersionDO> selectByCase(Long caseId, Long tenantId) {
        return selectList(new LambdaQueryWrapper<ReportVersionDO>()
            .eq(ReportVersionDO::getCaseId, caseId)
            .eq(ReportVersionDO::getTenantId, tenantId)
            .orderByAsc(ReportVersionDO::getVersionNumber));
    }
}
