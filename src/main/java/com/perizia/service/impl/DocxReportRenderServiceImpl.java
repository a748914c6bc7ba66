package com.perizia.service.impl;

import cn.hutool.core.util.StrUtil;
import com.perizia.service.ReportRenderService;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 报告渲染 - Apache POI DOCX 实现
 * 支持的标记：# / ## / ### 标题、- 或 * 列表、**加粗**
 *
 * @author perizia
 * @since 2025-03-07
 */
@Slf4j
@Service
public class DocxReportRenderServiceImpl implements ReportRenderService {

    private static final String FONT = "宋体";

    private static final int BODY_FONT_SIZE = 11;

    @Override
    public byte[] render(String title, String reportText) {
        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (StrUtil.isNotBlank(title)) {
                XWPFParagraph titleParagraph = document.createParagraph();
                titleParagraph.setAlignment(ParagraphAlignment.CENTER);
                addRun(titleParagraph, "公估报告 " + title, true, 18);
            }

            for (String rawLine : StrUtil.nullToEmpty(reportText).split("\\r?\\n")) {
                String line = rawLine.strip();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.startsWith("### ")) {
                    addRun(document.createParagraph(), line.substring(4), true, 12);
                } else if (line.startsWith("## ")) {
                    addRun(document.createParagraph(), line.substring(3), true, 14);
                } else if (line.startsWith("# ")) {
                    addRun(document.createParagraph(), line.substring(2), true, 16);
                } else if (line.startsWith("- ") || line.startsWith("* ")) {
                    XWPFParagraph paragraph = document.createParagraph();
                    paragraph.setIndentationLeft(360);
                    addInline(paragraph, "• " + line.substring(2));
                } else {
                    addInline(document.createParagraph(), line);
                }
            }

            document.write(out);
            byte[] bytes = out.toByteArray();
            log.debug("报告渲染完成: title={}, size={}", title, bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("报告渲染失败", e);
        }
    }

    /**
     * 按 ** 切分，奇数段加粗
     */
    private void addInline(XWPFParagraph paragraph, String text) {
        String[] segments = text.split("\\*\\*", -1);
        for (int i = 0; i < segments.length; i++) {
            if (!segments[i].isEmpty()) {
                addRun(paragraph, segments[i], i % 2 == 1, BODY_FONT_SIZE);
            }
        }
    }

    private void addRun(XWPFParagraph paragraph, String text, boolean bold, int fontSize) {
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        run.setBold(bold);
        run.setFontSize(fontSize);
        run.setFontFamily(FONT);
    }
}
