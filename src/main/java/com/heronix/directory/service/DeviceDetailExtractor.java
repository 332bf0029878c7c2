package com.heronix.directory.service;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.directory.model.domain.StepResult;
import com.heronix.directory.model.dto.QueueDepthDTO;
import com.heronix.directory.provider.ProviderClient.QueueInfo;
import com.heronix.directory.provider.ProviderClient.RawDeviceDetail;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts the optional parts of a device description.
 *
 * Each step is independent: a broken queue report does not cost the caller the
 * capabilities, and neither ever fails the describe call. Absent data is a
 * success with no value, malformed data is a degradation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceDetailExtractor {

    static final String TASK_QUEUE = "QUANTUM_TASKS_QUEUE";
    static final String JOB_QUEUE = "JOBS_QUEUE";
    static final String PRIORITY = "PRIORITY";

    private final ObjectMapper objectMapper;

    /**
     * Sum the reported queues into normal, priority and job counts.
     */
    public StepResult<QueueDepthDTO> queueDepth(RawDeviceDetail detail) {
        List<QueueInfo> queues = detail.queueInfo();
        if (queues == null) {
            return StepResult.success(null);
        }

        try {
            QueueDepthDTO depth = new QueueDepthDTO();
            for (QueueInfo queue : queues) {
                int size = parseSize(queue);
                String queueClass = queue.queueClass() != null ? queue.queueClass() : "";
                switch (queueClass) {
                    case TASK_QUEUE -> {
                        if (isPriority(queue)) {
                            depth.setPriority(depth.getPriority() + size);
                        } else {
                            depth.setNormal(depth.getNormal() + size);
                        }
                    }
                    case JOB_QUEUE -> depth.setJobs(depth.getJobs() + size);
                    default -> throw new IllegalArgumentException("unrecognised queue class '" + queueClass + "'");
                }
            }
            return StepResult.success(depth);

        } catch (RuntimeException e) {
            log.warn("RESOLVER: Queue depth unavailable for {}: {}", detail.id(), e.getMessage());
            return StepResult.degraded("Queue depth unavailable for " + detail.id() + ": " + e.getMessage());
        }
    }

    /**
     * Pass the capabilities blob through after checking it is well-formed JSON.
     */
    public StepResult<String> capabilities(RawDeviceDetail detail) {
        String blob = detail.capabilitiesBlob();
        if (blob == null || blob.isBlank()) {
            return StepResult.success(null);
        }

        try {
            objectMapper.readTree(blob);
            return StepResult.success(blob);
        } catch (JsonProcessingException e) {
            log.warn("RESOLVER: Capabilities of {} are not valid JSON: {}", detail.id(), e.getOriginalMessage());
            return StepResult.degraded("Capabilities unavailable for " + detail.id()
                    + ": malformed document (" + e.getOriginalMessage() + ")");
        }
    }

    /**
     * Read {@code paradigm.qubitCount} from an already extracted capabilities blob.
     */
    public StepResult<Integer> qubitCount(String deviceId, String capabilities) {
        if (capabilities == null) {
            return StepResult.success(null);
        }

        try {
            JsonNode count = objectMapper.readTree(capabilities).path("paradigm").path("qubitCount");
            if (count.isMissingNode() || count.isNull()) {
                return StepResult.success(null);
            }
            if (!count.canConvertToInt() || !count.isIntegralNumber()) {
                return StepResult.degraded("Qubit count unavailable for " + deviceId
                        + ": unexpected value " + count);
            }
            return StepResult.success(count.intValue());

        } catch (JsonProcessingException e) {
            return StepResult.degraded("Qubit count unavailable for " + deviceId + ": " + e.getOriginalMessage());
        }
    }

    private int parseSize(QueueInfo queue) {
        if (queue.size() == null) {
            throw new IllegalArgumentException("queue " + queue.queueClass() + " reported no size");
        }
        try {
            int size = Integer.parseInt(queue.size().trim());
            if (size < 0) {
                throw new IllegalArgumentException("negative size " + size + " for queue " + queue.queueClass());
            }
            return size;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("non-numeric size '" + queue.size() + "' for queue " + queue.queueClass());
        }
    }

    private boolean isPriority(QueueInfo queue) {
        return queue.priority() != null && PRIORITY.equals(queue.priority().trim().toUpperCase(Locale.ROOT));
    }
}
