package com.libragraph.triage.core.artifact;

import java.time.Instant;
import java.util.Optional;

/**
 * A removable device seen by the plug-and-play manager.
 *
 * @param deviceClass {@code USBSTOR} for mass storage, {@code USB} otherwise
 */
public record UsbDevice(String serial, String deviceClass, String vendor, String product, String revision,
                        String friendlyName, Instant firstSeen, Instant lastSeen) implements ArtifactPayload {

    @Override
    public String identity() {
        return serial;
    }

    /** Widens the seen range; descriptive fields missing here are taken from the newer record. */
    @Override
    public Optional<ArtifactPayload> mergeWith(ArtifactPayload newer) {
        if (!(newer instanceof UsbDevice other)) {
            return Optional.empty();
        }
        UsbDevice merged = new UsbDevice(
                serial,
                deviceClass != null ? deviceClass : other.deviceClass,
                vendor != null ? vendor : other.vendor,
                product != null ? product : other.product,
                revision != null ? revision : other.revision,
                friendlyName != null ? friendlyName : other.friendlyName,
                earliest(firstSeen, other.firstSeen),
                latest(lastSeen, other.lastSeen));
        return merged.equals(this) ? Optional.empty() : Optional.of(merged);
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null || b == null) return a != null ? a : b;
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null || b == null) return a != null ? a : b;
        return a.isAfter(b) ? a : b;
    }
}
