package com.heronix.directory.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.model.domain.DirectoryResult;
import com.heronix.directory.model.dto.DeviceDetailDTO;
import com.heronix.directory.model.dto.DeviceSummaryDTO;
import com.heronix.directory.model.dto.StaticDeviceDTO;
import com.heronix.directory.model.enums.ErrorKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports the static data of every listed device, for clients that ship a
 * bundled device table and only poll status at runtime.
 *
 * Describes go through {@link DeviceDetailResolver}, so repeated exports are
 * served from the static cache apart from the status fetch.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceExportService {

    private final RegionFanoutLister lister;
    private final DeviceDetailResolver resolver;

    public DirectoryResult<List<StaticDeviceDTO>> exportStaticData() {
        DirectoryResult<List<DeviceSummaryDTO>> listing = lister.listDevices();

        List<StaticDeviceDTO> exported = new ArrayList<>();
        List<String> warnings = new ArrayList<>(listing.warnings());
        Set<String> seen = new HashSet<>();

        for (DeviceSummaryDTO summary : listing.value()) {
            // Region-less devices may be listed once per region
            if (!seen.add(summary.getDeviceArn())) {
                continue;
            }
            try {
                DirectoryResult<DeviceDetailDTO> described = resolver.describe(summary.getDeviceArn());
                exported.add(StaticDeviceDTO.fromDetail(described.value()));
                warnings.addAll(described.warnings());
            } catch (DirectoryException e) {
                if (e.getKind() == ErrorKind.AUTH) {
                    throw e;
                }
                log.warn("EXPORT: Skipping {}: {}", summary.getDeviceArn(), e.getMessage());
                warnings.add("Skipped " + summary.getDeviceArn() + ": " + e.getMessage());
            }
        }

        log.info("EXPORT: Exported {} of {} devices", exported.size(), seen.size());
        return new DirectoryResult<>(exported, warnings);
    }
}
