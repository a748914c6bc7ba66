package com.perizia.model.content;

/**
 * 直接交给模型识别的视觉素材（PDF、图片）
 *
 * @param filename   来源文件名
 * @param mimeType   经魔数校验的 MIME 类型
 * @param storageRef 对象存储路径
 */
public record VisionContent(String filename, String mimeType, String storageRef) implements ExtractedContent {
}
