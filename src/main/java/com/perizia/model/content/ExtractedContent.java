package com.perizia.model.content;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 文档抽取结果，按 type 区分文本、视觉素材与错误
 *
 * @author perizia
 * @since 2025-03-03
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextContent.class, name = "text"),
    @JsonSubTypes.Type(value = VisionContent.class, name = "vision"),
    @JsonSubTypes.Type(value = ErrorContent.class, name = "error")
})
public sealed interface ExtractedContent permits TextContent, VisionContent, ErrorContent {

    /**
     * 文档上存储的是列表，序列化时须指定元素类型才会写出 type 字段
     */
    TypeReference<List<ExtractedContent>> LIST_TYPE = new TypeReference<>() {
    };

    /**
     * 来源文件名
     */
    String filename();
}
