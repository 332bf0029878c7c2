package com.heronix.directory.model.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.directory.model.enums.ErrorKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response envelope for the device directory API.
 *
 * Success responses carry {@code devices} or {@code device}, plus {@code warnings}
 * only when something degraded. Error responses carry {@code type} and {@code message}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DirectoryResponseDTO {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;

    private List<?> devices;

    private DeviceDetailDTO device;

    private List<String> warnings;

    private String type;

    private String message;

    public static DirectoryResponseDTO devices(List<?> devices, List<String> warnings) {
        return DirectoryResponseDTO.builder()
                .status(SUCCESS)
                .devices(devices)
                .warnings(warningsOrNull(warnings))
                .build();
    }

    public static DirectoryResponseDTO device(DeviceDetailDTO device, List<String> warnings) {
        return DirectoryResponseDTO.builder()
                .status(SUCCESS)
                .device(device)
                .warnings(warningsOrNull(warnings))
                .build();
    }

    public static DirectoryResponseDTO error(ErrorKind kind, String message) {
        return DirectoryResponseDTO.builder()
                .status(ERROR)
                .type(kind.getCode())
                .message(message)
                .build();
    }

    public static DirectoryResponseDTO unexpected(String message) {
        return DirectoryResponseDTO.builder()
                .status(ERROR)
                .type("internal")
                .message(message)
                .build();
    }

    private static List<String> warningsOrNull(List<String> warnings) {
        return warnings == null || warnings.isEmpty() ? null : List.copyOf(warnings);
    }
}
