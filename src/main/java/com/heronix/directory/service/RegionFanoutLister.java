package com.heronix.directory.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.directory.config.DirectoryProperties;
import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.exception.ProviderException;
import com.heronix.directory.model.domain.DirectoryResult;
import com.heronix.directory.model.domain.Region;
import com.heronix.directory.model.domain.RegionCatalog;
import com.heronix.directory.model.domain.StepResult;
import com.heronix.directory.model.dto.DeviceSummaryDTO;
import com.heronix.directory.model.enums.DeduplicationPolicy;
import com.heronix.directory.model.enums.DeviceStatus;
import com.heronix.directory.model.enums.ErrorKind;
import com.heronix.directory.provider.ProviderClient;
import com.heronix.directory.provider.ProviderClient.ListPage;
import com.heronix.directory.provider.ProviderClient.RawDevice;
import com.heronix.directory.service.RegionFanout.RegionOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lists devices across every catalog region.
 *
 * A failing region costs the caller a warning, not the listing. Credential
 * failures are the exception: they abort the whole listing, since every region
 * shares the same credentials.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegionFanoutLister {

    private final ProviderClient providerClient;
    private final RegionCatalog catalog;
    private final RegionFanout fanout;
    private final ErrorClassifier errorClassifier;
    private final DirectoryProperties properties;

    /**
     * Devices of one region plus the warnings raised while paging through it.
     */
    record RegionListing(List<DeviceSummaryDTO> devices, List<String> warnings) {}

    /**
     * List ONLINE and OFFLINE devices of all regions, in catalog order and then
     * discovery order within a region. Regions are gathered as they finish, so a
     * credential failure from any region ends the listing at once.
     *
     * @throws DirectoryException with kind AUTH when credentials are rejected
     */
    public DirectoryResult<List<DeviceSummaryDTO>> listDevices() {
        log.info("FANOUT: Listing devices across {} regions", catalog.size());

        Map<Region, StepResult<RegionListing>> results = new HashMap<>();

        try (RegionFanout.Dispatch<RegionListing> dispatch =
                     fanout.dispatch(catalog.regions(), this::listRegion)) {

            RegionOutcome<RegionListing> outcome;
            while ((outcome = dispatch.next()) != null) {
                StepResult<RegionListing> result = gather(outcome);
                if (result instanceof StepResult.Failed<RegionListing> failed) {
                    throw failed.error();
                }
                results.put(outcome.region(), result);
            }
        }

        List<DeviceSummaryDTO> devices = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Region region : catalog.regions()) {
            results.get(region).unwrap(warnings).ifPresent(listing -> {
                devices.addAll(listing.devices());
                warnings.addAll(listing.warnings());
            });
        }

        List<DeviceSummaryDTO> merged = deduplicate(devices);
        log.info("FANOUT: Listed {} devices with {} warnings", merged.size(), warnings.size());
        return new DirectoryResult<>(merged, warnings);
    }

    // ========================================================================
    // REGION WORK
    // ========================================================================

    /**
     * Page through one region. A failing page ends the region but keeps the pages
     * already read; only credential failures escape.
     */
    RegionListing listRegion(Region region) {
        List<DeviceSummaryDTO> devices = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String cursor = null;
        int pages = 0;

        do {
            ListPage page;
            try {
                page = providerClient.listDevices(region, cursor);
            } catch (ProviderException e) {
                if (errorClassifier.classify(e).isGlobal()) {
                    throw e;
                }
                log.warn("FANOUT: Paging stopped in {} after {} pages: {}", region, pages, e.getMessage());
                warnings.add("Region " + region + ": failed to list devices: " + errorClassifier.describe(e));
                break;
            }
            pages++;

            for (RawDevice raw : page.devices()) {
                if (raw.id() == null || raw.id().isBlank()) {
                    log.warn("FANOUT: Skipping device without id in {}", region);
                    warnings.add("Region " + region + ": skipped malformed device record (name="
                            + raw.name() + ")");
                    continue;
                }
                DeviceStatus status = DeviceStatus.fromProvider(raw.status());
                if (!status.isListable()) {
                    continue;
                }
                devices.add(DeviceSummaryDTO.builder()
                        .deviceArn(raw.id())
                        .deviceName(raw.name())
                        .deviceType(raw.kind())
                        .deviceStatus(status)
                        .providerName(raw.providerName())
                        .originRegion(region.code())
                        .build());
            }

            cursor = page.hasNext() ? page.nextCursor() : null;
        } while (cursor != null && !Thread.currentThread().isInterrupted());

        log.debug("FANOUT: Region {} returned {} listable devices over {} pages", region, devices.size(), pages);
        return new RegionListing(devices, warnings);
    }

    private StepResult<RegionListing> gather(RegionOutcome<RegionListing> outcome) {
        if (outcome.isSuccess()) {
            return StepResult.success(outcome.value());
        }

        Throwable failure = outcome.failure();
        ErrorKind kind = errorClassifier.classify(failure);
        if (kind.isGlobal()) {
            log.error("FANOUT: Credentials rejected in {}, aborting listing", outcome.region());
            return StepResult.failed(errorClassifier.toDirectoryException(failure,
                    "Provider credentials are missing or expired"));
        }

        log.warn("FANOUT: Region {} degraded to warning: {}", outcome.region(), errorClassifier.describe(failure));
        return StepResult.degraded("Region " + outcome.region() + ": failed to list devices: "
                + errorClassifier.describe(failure));
    }

    private List<DeviceSummaryDTO> deduplicate(List<DeviceSummaryDTO> devices) {
        DeduplicationPolicy policy = properties.getListing().getDeduplication();
        if (policy == DeduplicationPolicy.NONE) {
            return devices;
        }

        Map<String, DeviceSummaryDTO> firstSeen = new LinkedHashMap<>();
        for (DeviceSummaryDTO device : devices) {
            firstSeen.putIfAbsent(device.getDeviceArn(), device);
        }
        return new ArrayList<>(firstSeen.values());
    }
}
