package com.marketdesk.jobs.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Wire record pushed onto the work queue. Consumed destructively by one worker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueEnvelope {

    private String id;
    private String func;
    private Map<String, Object> args;
}
