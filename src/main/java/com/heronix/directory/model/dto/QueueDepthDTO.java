package com.heronix.directory.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a device's queue depth at first resolution.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueDepthDTO {

    /**
     * Quantum tasks waiting in the normal queue
     */
    private int normal;

    /**
     * Quantum tasks waiting in the priority queue
     */
    private int priority;

    /**
     * Hybrid jobs waiting
     */
    private int jobs;

    public QueueDepthDTO copy() {
        return new QueueDepthDTO(normal, priority, jobs);
    }
}
