package com.marketdesk.jobs.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for enqueueing a task by function name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnqueueTaskRequest {

    @NotBlank(message = "Function is required")
    private String function;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();
}
