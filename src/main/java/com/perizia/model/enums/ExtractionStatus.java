package com.perizia.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * 文档 AI 抽取状态
 *
 * @author perizia
 * @since 2025-03-02
 */
public enum ExtractionStatus {

    PENDING,

    PROCESSING,

    SUCCESS,

    ERROR,

    SKIPPED;

    private static final Set<ExtractionStatus> TERMINAL = EnumSet.of(SUCCESS, ERROR, SKIPPED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * 终态集合：SUCCESS / ERROR / SKIPPED
     */
    public static Set<ExtractionStatus> terminalStatuses() {
        return EnumSet.copyOf(TERMINAL);
    }
}
