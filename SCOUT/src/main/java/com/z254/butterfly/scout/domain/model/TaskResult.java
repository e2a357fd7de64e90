package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value returned by an agent task. The orchestrator only inspects {@code success}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResult {

    private boolean success;
    private Object data;
    private String error;

    public static TaskResult success(Object data) {
        return TaskResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    public static TaskResult failure(String error) {
        return TaskResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
