package com.heronix.directory.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.heronix.directory.exception.DeviceNotFoundException;
import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.model.domain.CacheEntry;
import com.heronix.directory.model.domain.DeviceArn;
import com.heronix.directory.model.domain.DirectoryResult;
import com.heronix.directory.model.domain.Region;
import com.heronix.directory.model.domain.RegionCatalog;
import com.heronix.directory.model.dto.DeviceDetailDTO;
import com.heronix.directory.model.enums.DeviceStatus;
import com.heronix.directory.model.enums.ErrorKind;
import com.heronix.directory.provider.ProviderClient;
import com.heronix.directory.provider.ProviderClient.RawDeviceDetail;
import com.heronix.directory.service.RegionFanout.RegionOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves one device id to its full description.
 *
 * Every call fetches the device once to read a fresh status. Static fields come
 * from {@link StaticInfoCache} when present and are built and cached otherwise.
 * Ids without a region segment are probed across the catalog, first success in
 * catalog order wins.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceDetailResolver {

    private final ProviderClient providerClient;
    private final RegionCatalog catalog;
    private final RegionFanout fanout;
    private final ErrorClassifier errorClassifier;
    private final StaticInfoCache cache;
    private final DeviceDetailExtractor extractor;

    /**
     * Provider response together with the region that gave it.
     */
    record Resolved(Region region, RawDeviceDetail detail) {}

    /**
     * Describe a device.
     *
     * @throws DirectoryException VALIDATION for a malformed id, NOT_FOUND when no
     *         region knows the device, AUTH, PERMISSION or SERVER_ERROR otherwise
     */
    public DirectoryResult<DeviceDetailDTO> describe(String deviceId) {
        DeviceArn arn = DeviceArn.parse(deviceId);
        log.info("RESOLVER: Describing {}", arn);

        Resolved resolved = arn.isRegionless() ? probe(arn) : describeInRegion(arn);
        DeviceStatus status = DeviceStatus.fromProvider(resolved.detail().status());

        Optional<CacheEntry> cached = cache.get(arn.value());
        if (cached.isPresent()) {
            log.debug("RESOLVER: Cache hit for {}, status {}", arn, status);
            return DirectoryResult.of(cached.get().withStatus(status));
        }

        List<String> warnings = new ArrayList<>();
        DeviceDetailDTO built = build(arn, resolved, status, warnings);
        CacheEntry entry = CacheEntry.fromDetail(built);
        CacheEntry winner = cache.putIfAbsent(arn.value(), entry);

        if (winner != entry) {
            // Another caller cached first; our warnings describe a discarded build
            return DirectoryResult.of(winner.withStatus(status));
        }
        return new DirectoryResult<>(winner.withStatus(status), warnings);
    }

    // ========================================================================
    // REGION RESOLUTION
    // ========================================================================

    private Resolved describeInRegion(DeviceArn arn) {
        Region region = catalog.find(arn.regionCode())
                .orElseThrow(() -> DirectoryException.validation(
                        "Region " + arn.regionCode() + " of device " + arn + " is not served by this directory"));

        try (RegionFanout.Dispatch<RawDeviceDetail> dispatch =
                     fanout.dispatch(List.of(region), r -> providerClient.describeDevice(r, arn.value()))) {

            RegionOutcome<RawDeviceDetail> outcome = dispatch.next();
            if (outcome.isSuccess()) {
                return new Resolved(region, outcome.value());
            }

            Throwable failure = outcome.failure();
            if (errorClassifier.isTimeout(failure)) {
                throw new DirectoryException(ErrorKind.SERVER_ERROR,
                        "Region " + region + " did not answer in time describing " + arn, failure);
            }
            ErrorKind kind = errorClassifier.classify(failure);
            if (kind == ErrorKind.NOT_FOUND) {
                throw new DeviceNotFoundException(
                        "Device not found: " + arn + ". The device may have been retired.", failure);
            }
            throw new DirectoryException(kind,
                    "Failed to describe " + arn + " in " + region + ": " + errorClassifier.describe(failure), failure);
        }
    }

    /**
     * Ask every region at once and buffer the answers as they arrive. The first
     * success in catalog order wins, so a region is only judged once every region
     * before it has answered. Not-found and timeouts move on to the next region;
     * other failures are remembered and also move on. A credential failure from
     * any region aborts as soon as it arrives.
     */
    private Resolved probe(DeviceArn arn) {
        log.debug("RESOLVER: {} carries no region, probing {}", arn, catalog);
        List<Region> order = catalog.regions();
        Map<Region, RegionOutcome<RawDeviceDetail>> answers = new HashMap<>();
        int cursor = 0;
        String lastFailure = null;

        try (RegionFanout.Dispatch<RawDeviceDetail> dispatch =
                     fanout.dispatch(order, r -> providerClient.describeDevice(r, arn.value()))) {

            RegionOutcome<RawDeviceDetail> outcome;
            while (cursor < order.size() && (outcome = dispatch.next()) != null) {
                if (!outcome.isSuccess() && errorClassifier.classify(outcome.failure()).isGlobal()) {
                    throw errorClassifier.toDirectoryException(outcome.failure(),
                            "Provider credentials are missing or expired");
                }
                answers.put(outcome.region(), outcome);

                while (cursor < order.size() && answers.containsKey(order.get(cursor))) {
                    Region region = order.get(cursor++);
                    RegionOutcome<RawDeviceDetail> answer = answers.get(region);
                    if (answer.isSuccess()) {
                        log.debug("RESOLVER: {} answered by {}", arn, region);
                        return new Resolved(region, answer.value());
                    }

                    Throwable failure = answer.failure();
                    if (errorClassifier.isTimeout(failure)) {
                        log.debug("RESOLVER: {} timed out for {}, trying next region", region, arn);
                    } else if (errorClassifier.classify(failure) != ErrorKind.NOT_FOUND) {
                        lastFailure = region + ": " + errorClassifier.describe(failure);
                        log.warn("RESOLVER: Probe of {} failed in {}: {}", arn, region, lastFailure);
                    }
                }
            }
        }

        throw new DeviceNotFoundException("Device not found in any region: " + arn
                + (lastFailure != null ? ". Last failure: " + lastFailure : ""));
    }

    // ========================================================================
    // DETAIL CONSTRUCTION
    // ========================================================================

    private DeviceDetailDTO build(DeviceArn arn, Resolved resolved, DeviceStatus status, List<String> warnings) {
        RawDeviceDetail raw = resolved.detail();
        String deviceId = raw.id() != null ? raw.id() : arn.value();

        DeviceDetailDTO detail = DeviceDetailDTO.builder()
                .deviceArn(deviceId)
                .deviceName(raw.name())
                .deviceType(raw.kind())
                .deviceStatus(status)
                .providerName(raw.providerName())
                .originRegion(resolved.region().code())
                .build();

        extractor.queueDepth(raw).unwrap(warnings).ifPresent(detail::setQueueDepth);
        extractor.capabilities(raw).unwrap(warnings).ifPresent(detail::setCapabilities);
        extractor.qubitCount(deviceId, detail.getCapabilities()).unwrap(warnings).ifPresent(detail::setQubitCount);

        return detail;
    }
}
