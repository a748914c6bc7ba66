package com.perizia.service.llm;

/**
 * 提示词片段
 *
 * @author perizia
 * @since 2025-03-06
 */
public sealed interface PromptPart permits PromptPart.Text, PromptPart.File {

    /**
     * 文本片段
     */
    record Text(String text) implements PromptPart {
    }

    /**
     * 已上传到提供方侧通道的文件，调用结束后需要删除
     *
     * @param fileRef  提供方文件引用
     * @param mimeType MIME 类型
     * @param label    文件名，用于在提示词中标注来源
     */
    record File(String fileRef, String mimeType, String label) implements PromptPart {
    }

    static PromptPart text(String text) {
        return new Text(text);
    }
}
