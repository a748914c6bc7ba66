package com.perizia.mapper;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.enums.CaseStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * 案件 Mapper
 *
 * @author perizia
 * @since 2025-03-02
 */
@Mapper
public interface CaseMapper extends BaseMapper<CaseDO> {

    /**
     * 加排他行锁读取案件，须在事务内调用，锁持有到事务结束
     *
     * @param id       案件ID
     * @param tenantId 租户ID
     * @return 案件，不存在或已删除时为 null
     */
    @Select("SELECT * FROM cases WHERE id = #{id} AND tenant_id = #{tenantId} AND is_deleted = 0 FOR UPDATE")
    CaseDO selectByIdForUpdate(@Param("id") Long id, @Param("tenantId") Long tenantId);

    /**
     * 一条语句批量重置卡住的案件
     *
     * @param cutoff 创建时间早于该时刻才会被重置
     * @param stuck  视为卡住的状态
     * @param target 重置后的状态
     * @return 受影响行数
     */
    @Update("""
        <script>
        UPDATE cases SET status = #{target}, update_time = NOW()
        WHERE is_deleted = 0
          AND create_time &lt; #{cutoff}
          AND status IN
          <foreach collection="stuck" item="s" open="(" separator="," close=")">#{s}</foreach>
        </script>
        """)
    int resetStuckCases(@Param("cutoff") LocalDateTime cutoff,
                        @Param("stuck") Collection<CaseStatus> stuck,
                        @Param("target") CaseStatus target);

    /**
     * 更新案件状态
     *
     * @return 受影响行数
     */
    default int updateStatus(Long id, Long tenantId, CaseStatus status) {
        return update(null, new LambdaUpdateWrapper<CaseDO>()
            .eq(CaseDO::getId, id)
            .eq(CaseDO::getTenantId, tenantId)
            .set(CaseDO::getStatus, status)
            .set(CaseDO::getUpdateTime, LocalDateTime.now()));
    }

    /**
     * 仅当案件仍处于 expected 状态时更新
     *
     * @return 受影响行数，0 表示状态已被其他流程改变
     */
    default int compareAndSetStatus(Long id, Long tenantId, CaseStatus expected, CaseStatus target) {
        return update(null, new LambdaUpdateWrapper<CaseDO>()
            .eq(CaseDO::getId, id)
            .eq(CaseDO::getTenantId, tenantId)
            .eq(CaseDO::getStatus, expected)
            .set(CaseDO::getStatus, target)
            .set(CaseDO::getUpdateTime, LocalDateTime.now()));
    }
}
