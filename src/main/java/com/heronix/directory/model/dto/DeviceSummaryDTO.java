package com.heronix.directory.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.directory.model.enums.DeviceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device as returned by a listing. Never cached.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceSummaryDTO {

    private String deviceArn;

    private String deviceName;

    /**
     * Device kind as reported by the provider, e.g. QPU or SIMULATOR
     */
    private String deviceType;

    private DeviceStatus deviceStatus;

    private String providerName;

    /**
     * Region whose search returned this record
     */
    private String originRegion;
}
