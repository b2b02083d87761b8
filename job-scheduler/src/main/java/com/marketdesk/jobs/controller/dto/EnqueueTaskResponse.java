package com.marketdesk.jobs.controller.dto;

import com.marketdesk.jobs.domain.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnqueueTaskResponse {

    private String taskId;
    private String function;
    private TaskStatus status;
}
