package com.marketdesk.jobs.controller.dto;

import com.marketdesk.jobs.domain.QueueEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueStatusResponse {

    private long depth;
    private List<QueueEnvelope> pending;
}
