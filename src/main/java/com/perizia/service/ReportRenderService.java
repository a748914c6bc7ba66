package com.perizia.service;

/**
 * 报告渲染
 *
 * @author perizia
 * @since 2025-03-07
 */
public interface ReportRenderService {

    /**
     * 将报告文本渲染为 DOCX
     *
     * @param title      文档标题
     * @param reportText 报告文本（Markdown 标题与列表）
     * @return DOCX 字节
     */
    byte[] render(String title, String reportText);
}
