package com.lucidityplatform.common.flux;

import com.lucidityplatform.common.model.RoomProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Externally configured drain rates keyed by {@code plane|zone|subZone}.
 *
 * <p>A missing level is stored as {@code *}. Lookup tries the exact sub-zone key, then
 * the zone key, then the plane key; the first hit wins over the whole environment
 * profile hierarchy. An empty table is the normal "no override" state.
 */
public final class WorldOverrideTable {

    private static final Logger log = LoggerFactory.getLogger(WorldOverrideTable.class);

    private static final String WILDCARD = "*";

    /** Rates above this are almost certainly typos (100 instead of 0.1). */
    public static final double MAX_DRAIN_RATE = 10.0;

    private final Map<String, Double> fluxByKey;

    private WorldOverrideTable(Map<String, Double> fluxByKey) {
        this.fluxByKey = Map.copyOf(fluxByKey);
    }

    public static WorldOverrideTable empty() {
        return new WorldOverrideTable(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return fluxByKey.size();
    }

    public Optional<Match> lookup(RoomProfile room) {
        if (fluxByKey.isEmpty() || room == null) {
            return Optional.empty();
        }
        String[][] candidates = {
            {room.plane(), room.zone(), room.subZone()},
            {room.plane(), room.zone(), null},
            {room.plane(), null, null}
        };
        for (String[] candidate : candidates) {
            Double flux = fluxByKey.get(key(candidate[0], candidate[1], candidate[2]));
            if (flux != null) {
                return Optional.of(new Match(flux, "lucidity_rule:" + label(candidate)));
            }
        }
        return Optional.empty();
    }

    public static String key(String plane, String zone, String subZone) {
        return part(plane) + "|" + part(zone) + "|" + part(subZone);
    }

    /** Drain rates are positive per-minute losses; flux is the signed value. */
    public static double rateToFlux(double rate) {
        if (rate > MAX_DRAIN_RATE) {
            log.error("Lucidity drain rate exceeds maximum, clamping. rate={} max={}", rate, MAX_DRAIN_RATE);
            rate = MAX_DRAIN_RATE;
        }
        return -rate;
    }

    private static String part(String value) {
        return value == null || value.isBlank() ? WILDCARD : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String label(String[] parts) {
        StringBuilder label = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                break;
            }
            if (label.length() > 0) {
                label.append('/');
            }
            label.append(part);
        }
        return label.toString();
    }

    public record Match(double flux, String source) {}

    public static final class Builder {
        private final Map<String, Double> fluxByKey = new HashMap<>();

        private Builder() {}

        public Builder drainRate(String plane, String zone, String subZone, double rate) {
            fluxByKey.put(key(plane, zone, subZone), rateToFlux(rate));
            return this;
        }

        /** Accepts a stable id of the form {@code plane/zone}. */
        public Builder drainRate(String zoneStableId, String subZone, double rate) {
            String[] parts = zoneStableId == null ? new String[0] : zoneStableId.split("/");
            String plane = parts.length > 0 ? parts[0] : null;
            String zone  = parts.length > 1 ? parts[1] : null;
            return drainRate(plane, zone, subZone, rate);
        }

        public WorldOverrideTable build() {
            return new WorldOverrideTable(fluxByKey);
        }
    }
}
