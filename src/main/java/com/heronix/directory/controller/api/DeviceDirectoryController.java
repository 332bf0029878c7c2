package com.heronix.directory.controller.api;

import java.util.List;
import java.util.function.Supplier;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.model.domain.DirectoryResult;
import com.heronix.directory.model.dto.DeviceDetailDTO;
import com.heronix.directory.model.dto.DeviceSummaryDTO;
import com.heronix.directory.model.dto.DirectoryResponseDTO;
import com.heronix.directory.model.dto.StaticDeviceDTO;
import com.heronix.directory.service.DeviceDetailResolver;
import com.heronix.directory.service.DeviceExportService;
import com.heronix.directory.service.RegionFanoutLister;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for the device directory.
 *
 * GET without query params lists all devices; GET with ?deviceArn=<arn> describes
 * one device.
 */
@RestController
@RequestMapping("/api/v1/directory/devices")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Device Directory", description = "APIs for listing and describing provider devices")
public class DeviceDirectoryController {

    private final RegionFanoutLister lister;
    private final DeviceDetailResolver resolver;
    private final DeviceExportService exportService;

    @GetMapping
    @Operation(summary = "List or describe devices",
            description = "Without deviceArn, list ONLINE and OFFLINE devices of all regions. "
                    + "With deviceArn, describe that device with a fresh status.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Devices returned, possibly with warnings"),
        @ApiResponse(responseCode = "400", description = "Malformed device ARN"),
        @ApiResponse(responseCode = "401", description = "Provider credentials missing or expired"),
        @ApiResponse(responseCode = "403", description = "Provider denied access"),
        @ApiResponse(responseCode = "404", description = "Device not found"),
        @ApiResponse(responseCode = "503", description = "Provider error")
    })
    public ResponseEntity<DirectoryResponseDTO> getDevices(
            @Parameter(description = "Device ARN (e.g., arn:aws:braket:::device/quantum-simulator/amazon/sv1)")
            @RequestParam(name = "deviceArn", required = false) String deviceArn) {

        if (deviceArn != null) {
            return respond("describe " + deviceArn, () -> {
                DirectoryResult<DeviceDetailDTO> result = resolver.describe(deviceArn);
                return DirectoryResponseDTO.device(result.value(), result.warnings());
            });
        }

        return respond("list devices", () -> {
            DirectoryResult<List<DeviceSummaryDTO>> result = lister.listDevices();
            return DirectoryResponseDTO.devices(result.value(), result.warnings());
        });
    }

    @GetMapping("/static-export")
    @Operation(summary = "Export static device data",
            description = "Describe every listed device and return its static fields without status")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Static device data returned"),
        @ApiResponse(responseCode = "401", description = "Provider credentials missing or expired")
    })
    public ResponseEntity<DirectoryResponseDTO> exportStaticData() {
        return respond("export static device data", () -> {
            DirectoryResult<List<StaticDeviceDTO>> result = exportService.exportStaticData();
            return DirectoryResponseDTO.devices(result.value(), result.warnings());
        });
    }

    private ResponseEntity<DirectoryResponseDTO> respond(String action, Supplier<DirectoryResponseDTO> call) {
        try {
            return ResponseEntity.ok(call.get());

        } catch (DirectoryException e) {
            log.warn("Failed to {}: {} ({})", action, e.getMessage(), e.getKind().getCode());
            return ResponseEntity.status(e.getKind().getHttpStatus())
                    .body(DirectoryResponseDTO.error(e.getKind(), e.getMessage()));

        } catch (RuntimeException e) {
            log.error("Unexpected failure to {}", action, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(DirectoryResponseDTO.unexpected(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
}
