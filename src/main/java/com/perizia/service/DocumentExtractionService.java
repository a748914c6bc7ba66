package com.perizia.service;

import com.perizia.Exception.ExtractionException;
import com.perizia.model.content.ExtractedContent;

import java.util.List;

/**
 * 文档内容抽取
 *
 * @author perizia
 * @since 2025-03-03
 */
public interface DocumentExtractionService {

    /**
     * 从对象存储读取文件并抽取内容
     *
     * @param storageRef 对象存储引用
     * @param mimeType   上传时声明的 MIME 类型
     * @param filename   原始文件名
     * @return 抽取结果，内容为空时返回空列表
     * @throws ExtractionException 文件无法处理
     */
    List<ExtractedContent> extract(String storageRef, String mimeType, String filename);
}
