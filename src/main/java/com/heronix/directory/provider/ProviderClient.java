package com.heronix.directory.provider;

import java.util.List;

import com.heronix.directory.exception.ProviderException;
import com.heronix.directory.model.domain.Region;

/**
 * Per-region access to the device provider.
 *
 * Implementations perform transport and request signing. Failures are reported as
 * {@link ProviderException} carrying the provider's error code.
 */
public interface ProviderClient {

    /**
     * Fetch one page of device summaries from a region.
     *
     * @param region region to search
     * @param cursor continuation token from the previous page, null for the first page
     * @return the page, with a null {@code nextCursor} on the last page
     */
    ListPage listDevices(Region region, String cursor);

    /**
     * Fetch the full description of one device from a region.
     *
     * @param region region to ask
     * @param deviceId device identifier
     * @return raw device description
     */
    RawDeviceDetail describeDevice(Region region, String deviceId);

    // ========================================================================
    // RESULT TYPES
    // ========================================================================

    /**
     * One page of a device search.
     */
    record ListPage(List<RawDevice> devices, String nextCursor) {

        public ListPage {
            devices = devices == null ? List.of() : List.copyOf(devices);
        }

        public boolean hasNext() {
            return nextCursor != null && !nextCursor.isBlank();
        }
    }

    /**
     * Device summary as reported by a search.
     */
    record RawDevice(
            String id,
            String name,
            String kind,
            String status,
            String providerName
    ) {}

    /**
     * Device description as reported by a describe call.
     */
    record RawDeviceDetail(
            String id,
            String name,
            String kind,
            String status,
            String providerName,
            List<QueueInfo> queueInfo,
            String capabilitiesBlob
    ) {}

    /**
     * One queue entry. {@code queueClass} is QUANTUM_TASKS_QUEUE or JOBS_QUEUE;
     * task queues are further split by {@code priority} (Normal or Priority).
     */
    record QueueInfo(
            String queueClass,
            String size,
            String priority
    ) {}
}
