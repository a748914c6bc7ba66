package com.perizia.model.content;

/**
 * 抽取出的纯文本
 *
 * @param filename 来源文件名
 * @param text     清洗后的文本
 */
public record TextContent(String filename, String text) implements ExtractedContent {
}
