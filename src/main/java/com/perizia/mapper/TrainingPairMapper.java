package com.perizia.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.perizia.model.entity.TrainingPairDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 训练样本对 Mapper
 *
 * @author perizia
 * @since 2025-03-05
 */
@Mapper
public interface TrainingPairMapper extends BaseMapper<TrainingPairDO> {
}
