package com.perizia.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 报告版本来源
 *
 * @author perizia
 * @since 2025-03-06
 */
@Getter
@AllArgsConstructor
public enum VersionSource {

    AI_DRAFT("ai-draft"),

    PRELIMINARY("preliminary"),

    HUMAN_FINAL("final");

    /**
     * 对外展示的来源标签
     */
    private final String tag;
}
