package com.perizia.service.llm;

import com.perizia.model.content.ErrorContent;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.content.VisionContent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装报告生成的提示词
 * 使用缓存时系统指令已在缓存中，只发送材料；否则把系统指令内联在最前面
 *
 * @author perizia
 * @since 2025-03-06
 */
@Component
public class PromptBuilder {

    private static final String CLOSING_WITH_CACHE =
        "请分析以上全部文档、图片与文本，按照已缓存的系统指令生成报告。";

    private static final String CLOSING_INLINE =
        "请分析以上全部文档、图片与文本，按照本提示词开头的系统指令生成报告。";

    private final String systemPrompt;

    public PromptBuilder(@Qualifier("reportSystemPrompt") String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    /**
     * @param materials     抽取成功的文档内容
     * @param uploadedFiles 已上传到提供方的视觉文件
     * @param uploadErrors  上传失败的说明
     * @param useCache      是否使用提示词缓存
     */
    public List<PromptPart> build(List<ExtractedContent> materials, List<PromptPart.File> uploadedFiles,
                                  List<String> uploadErrors, boolean useCache) {
        List<PromptPart> parts = new ArrayList<>();
        if (!useCache) {
            parts.add(PromptPart.text(systemPrompt + "\n\n"));
        }
        for (ExtractedContent content : materials) {
            if (content instanceof TextContent text) {
                if (text.text() == null || text.text().isBlank()) {
                    continue;
                }
                parts.add(PromptPart.text("--- 文件开始: " + text.filename() + " ---\n"
                    + text.text()
                    + "\n--- 文件结束: " + text.filename() + " ---\n\n"));
            } else if (content instanceof ErrorContent error) {
                parts.add(PromptPart.text("[提示: 文件 " + error.filename() + " 处理失败: " + error.message() + "]\n\n"));
            }
            // VisionContent 通过 uploadedFiles 以文件引用的形式加入
        }
        for (String uploadError : uploadErrors) {
            parts.add(PromptPart.text("[提示: " + uploadError + "]\n\n"));
        }
        parts.addAll(uploadedFiles);
        parts.add(PromptPart.text(useCache ? CLOSING_WITH_CACHE : CLOSING_INLINE));
        return parts;
    }

    /**
     * 需要上传到提供方的视觉素材
     */
    public static List<VisionContent> visionMaterials(List<ExtractedContent> materials) {
        List<VisionContent> result = new ArrayList<>();
        for (ExtractedContent content : materials) {
            if (content instanceof VisionContent vision) {
                result.add(vision);
            }
        }
        return result;
    }
}
