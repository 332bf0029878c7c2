package com.heronix.directory.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.directory.model.domain.StepResult;
import com.heronix.directory.model.dto.QueueDepthDTO;
import com.heronix.directory.provider.ProviderClient.QueueInfo;
import com.heronix.directory.provider.ProviderClient.RawDeviceDetail;

class DeviceDetailExtractorTest {

    private static final String ID = "arn:aws:braket:us-west-1::device/qpu/acme/Ankaa";

    private final DeviceDetailExtractor extractor = new DeviceDetailExtractor(new ObjectMapper());

    private static RawDeviceDetail withQueues(List<QueueInfo> queues) {
        return new RawDeviceDetail(ID, "Ankaa", "QPU", "ONLINE", "Acme", queues, null);
    }

    private static RawDeviceDetail withCapabilities(String blob) {
        return new RawDeviceDetail(ID, "Ankaa", "QPU", "ONLINE", "Acme", null, blob);
    }

    @Test
    void splitsTaskQueuesByPriorityAndCountsJobs() {
        StepResult<QueueDepthDTO> result = extractor.queueDepth(withQueues(List.of(
                new QueueInfo("QUANTUM_TASKS_QUEUE", "12", "Normal"),
                new QueueInfo("QUANTUM_TASKS_QUEUE", " 3 ", "Priority"),
                new QueueInfo("JOBS_QUEUE", "7", null))));

        assertThat(result).isEqualTo(StepResult.success(new QueueDepthDTO(12, 3, 7)));
    }

    @Test
    void taskQueueWithoutPriorityCountsAsNormal() {
        StepResult<QueueDepthDTO> result = extractor.queueDepth(withQueues(List.of(
                new QueueInfo("QUANTUM_TASKS_QUEUE", "5", null))));

        assertThat(result).isEqualTo(StepResult.success(new QueueDepthDTO(5, 0, 0)));
    }

    @Test
    void missingQueueReportIsAbsentNotDegraded() {
        List<String> warnings = new ArrayList<>();

        assertThat(extractor.queueDepth(withQueues(null)).unwrap(warnings)).isEmpty();
        assertThat(warnings).isEmpty();
    }

    @Test
    void malformedQueuesDegrade() {
        assertThat(extractor.queueDepth(withQueues(List.of(new QueueInfo("QUANTUM_TASKS_QUEUE", "many", "Normal")))))
                .isInstanceOf(StepResult.Degraded.class);
        assertThat(extractor.queueDepth(withQueues(List.of(new QueueInfo("MYSTERY_QUEUE", "1", null)))))
                .isInstanceOf(StepResult.Degraded.class);
        assertThat(extractor.queueDepth(withQueues(List.of(new QueueInfo("JOBS_QUEUE", null, null)))))
                .isInstanceOf(StepResult.Degraded.class);
    }

    @Test
    void capabilitiesPassThroughUnchanged() {
        String blob = "{\"braketSchemaHeader\":{\"name\":\"braket.device_schema.rigetti\"},\"paradigm\":{\"qubitCount\":84}}";

        assertThat(extractor.capabilities(withCapabilities(blob))).isEqualTo(StepResult.success(blob));
        assertThat(extractor.qubitCount(ID, blob)).isEqualTo(StepResult.success(84));
    }

    @Test
    void malformedCapabilitiesDegradeWithWarning() {
        List<String> warnings = new ArrayList<>();

        assertThat(extractor.capabilities(withCapabilities("{not json")).unwrap(warnings)).isEmpty();
        assertThat(warnings).singleElement().satisfies(w -> assertThat(w).contains("Capabilities unavailable"));
    }

    @Test
    void qubitCountIsOptional() {
        assertThat(extractor.qubitCount(ID, null)).isEqualTo(StepResult.success(null));
        assertThat(extractor.qubitCount(ID, "{\"action\":{}}")).isEqualTo(StepResult.success(null));
        assertThat(extractor.qubitCount(ID, "{\"paradigm\":{\"qubitCount\":\"many\"}}"))
                .isInstanceOf(StepResult.Degraded.class);
    }
}
