package com.heronix.directory.provider.braket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.heronix.directory.exception.ProviderException;
import com.heronix.directory.model.domain.Region;
import com.heronix.directory.provider.ProviderClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Provider client for Amazon Braket.
 *
 * Braket serves devices from regional endpoints. QPUs live in one region and carry
 * it in their ARN; managed simulators are region-less and answer in every region.
 *
 * @see <a href="https://docs.aws.amazon.com/braket/latest/APIReference/">Braket API Reference</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraketProviderClient implements ProviderClient {

    private final BraketApiClient apiClient;

    @Override
    public ListPage listDevices(Region region, String cursor) {
        Map<String, Object> response = apiClient.searchDevices(region, cursor);

        Object devices = response.getOrDefault("devices", List.of());
        if (!(devices instanceof List<?> entries)) {
            throw new ProviderException(region.code(), "MalformedResponse", 200,
                    "SearchDevices in " + region + " returned no device list");
        }

        List<RawDevice> page = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> device) {
                page.add(new RawDevice(
                        asString(device.get("deviceArn")),
                        asString(device.get("deviceName")),
                        asString(device.get("deviceType")),
                        asString(device.get("deviceStatus")),
                        asString(device.get("providerName"))
                ));
            } else {
                // Keep a blank record so the lister reports it as malformed
                page.add(new RawDevice(null, null, null, null, null));
            }
        }

        String nextToken = asString(response.get("nextToken"));
        log.debug("BRAKET: Search page in {} returned {} devices, more={}",
                region, page.size(), nextToken != null);
        return new ListPage(page, nextToken);
    }

    @Override
    public RawDeviceDetail describeDevice(Region region, String deviceId) {
        Map<String, Object> response = apiClient.getDevice(region, deviceId);

        return new RawDeviceDetail(
                asString(response.get("deviceArn")),
                asString(response.get("deviceName")),
                asString(response.get("deviceType")),
                asString(response.get("deviceStatus")),
                asString(response.get("providerName")),
                queueInfo(response.get("deviceQueueInfo")),
                asString(response.get("deviceCapabilities"))
        );
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    /**
     * Returns null when the response carries no queue list, so that extraction can
     * tell "not reported" apart from "reported empty".
     */
    private List<QueueInfo> queueInfo(Object value) {
        if (!(value instanceof List<?> entries)) {
            return null;
        }
        List<QueueInfo> queues = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> queue) {
                queues.add(new QueueInfo(
                        asString(queue.get("queue")),
                        asString(queue.get("queueSize")),
                        asString(queue.get("queuePriority"))
                ));
            }
        }
        return queues;
    }

    private String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
