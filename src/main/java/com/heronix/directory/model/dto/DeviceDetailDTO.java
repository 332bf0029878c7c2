package com.heronix.directory.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.heronix.directory.model.enums.DeviceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full device description. Everything except {@code deviceStatus} is static.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceDetailDTO {

    private String deviceArn;

    private String deviceName;

    private String deviceType;

    /**
     * Always read from the latest provider response
     */
    private DeviceStatus deviceStatus;

    private String providerName;

    /**
     * Region that answered the describe call
     */
    private String originRegion;

    /**
     * Absent when the provider reported no usable queue information
     */
    private QueueDepthDTO queueDepth;

    /**
     * Serialized device capabilities, passed through unchanged
     */
    @JsonProperty("properties")
    private String capabilities;

    /**
     * Qubit count taken from the capabilities paradigm, when present
     */
    private Integer qubitCount;
}
