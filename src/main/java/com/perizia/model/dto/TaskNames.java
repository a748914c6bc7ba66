package com.perizia.model.dto;

/**
 * 任务名称常量
 *
 * @author perizia
 * @since 2025-03-03
 */
public final class TaskNames {

    public static final String PROCESS_DOCUMENT = "process-document";

    public static final String GENERATE_REPORT = "generate-report";

    private TaskNames() {
    }
}
