package com.perizia.service.impl;

import cn.hutool.core.util.StrUtil;
import com.perizia.Exception.ExtractionException;
import com.perizia.config.PipelineProperties;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.content.VisionContent;
import com.perizia.model.enums.ExtractionErrorType;
import com.perizia.service.BlobStore;
import com.perizia.service.DocumentExtractionService;
import com.perizia.service.ExtractionErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * 文档内容抽取实现
 * PDF 与图片交给模型直接识别，其余格式使用 Apache Tika 抽取文本
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Service
public class DocumentExtractionServiceImpl implements DocumentExtractionService {

    static final Set<String> VISION_TYPES = Set.of(
        "application/pdf",
        "image/jpeg",
        "image/png",
        "image/webp",
        "image/gif"
    );

    static final Set<String> TEXT_TYPES = Set.of(
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
        "application/msword",
        "application/vnd.ms-excel",
        "application/vnd.ms-outlook",
        "message/rfc822",
        "application/rtf",
        "application/xml"
    );

    private final Tika tika = new Tika();

    private final BlobStore blobStore;

    private final PipelineProperties pipelineProperties;

    public DocumentExtractionServiceImpl(BlobStore blobStore, PipelineProperties pipelineProperties) {
        this.blobStore = blobStore;
        this.pipelineProperties = pipelineProperties;
    }

    @Override
    public List<ExtractedContent> extract(String storageRef, String mimeType, String filename) {
        byte[] data = blobStore.get(storageRef);
        if (data.length == 0) {
            return List.of();
        }
        long maxBytes = pipelineProperties.getExtraction().getMaxFileSizeMb() * 1024L * 1024L;
        if (data.length > maxBytes) {
            throw new ExtractionException(ExtractionErrorType.OVERSIZED,
                "文件大小 " + data.length + " 字节超过上限 " + maxBytes);
        }

        String detected = tika.detect(data, filename);
        log.info("开始抽取文档: file={}, declared={}, detected={}, size={}", filename, mimeType, detected, data.length);

        // 声明为图片/PDF 但内容不是，说明文件已损坏或被改了扩展名
        if (isVisionType(mimeType) && !isVisionType(detected)) {
            throw new ExtractionException(ExtractionErrorType.CORRUPT_FILE,
                "文件内容与声明的类型不符: declared=" + mimeType + ", detected=" + detected);
        }
        if (isVisionType(detected)) {
            return List.of(new VisionContent(filename, detected, storageRef));
        }
        if (!TEXT_TYPES.contains(detected) && !detected.startsWith("text/")) {
            throw new ExtractionException(ExtractionErrorType.UNSUPPORTED_TYPE, "不支持的文件类型: " + detected);
        }

        String text = parseText(data, filename);
        if (StrUtil.isBlank(text)) {
            log.info("文档没有可抽取的文本: file={}", filename);
            return List.of();
        }
        log.info("文档抽取完成: file={}, 字符数={}", filename, text.length());
        return List.of(new TextContent(filename, text));
    }

    private String parseText(byte[] data, String filename) {
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        try (InputStream inputStream = new ByteArrayInputStream(data)) {
            String text = tika.parseToString(inputStream, metadata, pipelineProperties.getExtraction().getMaxTextLength());
            return cleanText(text);
        } catch (IOException | TikaException e) {
            throw new ExtractionException(ExtractionErrorClassifier.classify(e), "文档解析失败: " + e.getMessage(), e);
        }
    }

    private static boolean isVisionType(String mimeType) {
        return mimeType != null && VISION_TYPES.contains(mimeType.toLowerCase());
    }

    /**
     * 清理文本
     * - 移除控制字符（数据库 text 列不接受 \u0000）
     * - 压缩多余空行和空白
     */
    static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "")
            .replaceAll("\\r\\n?", "\n")
            .replaceAll("[ \\t]{2,}", " ")
            .replaceAll("(?m)^[ \\t]+|[ \\t]+$", "")
            .replaceAll("\\n{3,}", "\n\n")
            .trim();
    }
}
