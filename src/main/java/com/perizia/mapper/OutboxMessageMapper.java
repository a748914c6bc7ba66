package com.perizia.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.perizia.model.entity.OutboxMessageDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 发件箱 Mapper
 * 领取消息用 SKIP LOCKED，并发的处理器各自拿到不相交的一批
 *
 * @author perizia
 * @since 2025-03-04
 */
@Mapper
public interface OutboxMessageMapper extends BaseMapper<OutboxMessageDO> {

    @Select("""
        SELECT * FROM outbox_messages
        WHERE status = 'PENDING'
        ORDER BY create_time ASC
        LIMIT #{limit}
        FOR UPDATE SKIP LOCKED
        """)
    List<OutboxMessageDO> selectPendingForUpdateSkipLocked(@Param("limit") int limit);

    /**
     * 领取指定的待处理消息，已被其他事务锁住或已处理时返回 null
     */
    @Select("SELECT * FROM outbox_messages WHERE id = #{id} AND status = 'PENDING' FOR UPDATE SKIP LOCKED")
    OutboxMessageDO selectPendingByIdForUpdateSkipLocked(@Param("id") Long id);
}
