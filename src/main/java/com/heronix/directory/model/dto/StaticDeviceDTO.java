package com.heronix.directory.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static device data for export. Carries no status.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StaticDeviceDTO {

    private String deviceArn;

    private String deviceName;

    private String deviceType;

    private String providerName;

    private Integer qubitCount;

    public static StaticDeviceDTO fromDetail(DeviceDetailDTO detail) {
        return StaticDeviceDTO.builder()
                .deviceArn(detail.getDeviceArn())
                .deviceName(detail.getDeviceName())
                .deviceType(detail.getDeviceType())
                .providerName(detail.getProviderName())
                .qubitCount(detail.getQubitCount())
                .build();
    }
}
