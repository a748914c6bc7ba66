package com.perizia.support;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.conditions.AbstractWrapper;
import com.baomidou.mybatisplus.core.metadata.TableInfoHelper;
import org.apache.ibatis.builder.MapperBuilderAssistant;

import java.util.Collection;

/**
 * 单元测试中直接构造 Lambda 条件构造器前，需要先注册实体的列缓存
 */
public final class MybatisPlusTestSupport {

    private MybatisPlusTestSupport() {
    }

    public static void initTableInfo(Class<?>... entityClasses) {
        MapperBuilderAssistant assistant = new MapperBuilderAssistant(new MybatisConfiguration(), "");
        for (Class<?> entityClass : entityClasses) {
            if (TableInfoHelper.getTableInfo(entityClass) == null) {
                TableInfoHelper.initTableInfo(assistant, entityClass);
            }
        }
    }

    /**
     * 条件构造器中 set / eq 的参数值
     */
    public static Collection<Object> paramValues(AbstractWrapper<?, ?, ?> wrapper) {
        return wrapper.getParamNameValuePairs().values();
    }
}
