package com.heronix.directory.model.domain;

import com.heronix.directory.model.dto.DeviceDetailDTO;
import com.heronix.directory.model.dto.QueueDepthDTO;
import com.heronix.directory.model.enums.DeviceStatus;

import lombok.Builder;
import lombok.Value;

/**
 * Static projection of a device detail: every field except status.
 *
 * Immutable. Written once per device id and merged with a fresh status on each read.
 */
@Value
@Builder
public class CacheEntry {

    String deviceArn;
    String deviceName;
    String deviceType;
    String providerName;
    String originRegion;
    QueueDepthDTO queueDepth;
    String capabilities;
    Integer qubitCount;

    /**
     * Project a freshly built detail onto its static fields.
     */
    public static CacheEntry fromDetail(DeviceDetailDTO detail) {
        return CacheEntry.builder()
                .deviceArn(detail.getDeviceArn())
                .deviceName(detail.getDeviceName())
                .deviceType(detail.getDeviceType())
                .providerName(detail.getProviderName())
                .originRegion(detail.getOriginRegion())
                .queueDepth(detail.getQueueDepth() != null ? detail.getQueueDepth().copy() : null)
                .capabilities(detail.getCapabilities())
                .qubitCount(detail.getQubitCount())
                .build();
    }

    /**
     * Build a new detail from the cached static fields and the given status.
     */
    public DeviceDetailDTO withStatus(DeviceStatus status) {
        return DeviceDetailDTO.builder()
                .deviceArn(deviceArn)
                .deviceName(deviceName)
                .deviceType(deviceType)
                .deviceStatus(status)
                .providerName(providerName)
                .originRegion(originRegion)
                .queueDepth(queueDepth != null ? queueDepth.copy() : null)
                .capabilities(capabilities)
                .qubitCount(qubitCount)
                .build();
    }
}
