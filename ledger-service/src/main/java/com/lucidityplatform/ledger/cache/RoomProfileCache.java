package com.lucidityplatform.ledger.cache;

import com.lucidityplatform.common.model.RoomProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache of room geography so each flux cadence does not hit the world directory
 * once per occupied room. Expired entries are evicted on read.
 */
@Component
public class RoomProfileCache {

    private static final Logger log = LoggerFactory.getLogger(RoomProfileCache.class);

    private final ConcurrentHashMap<String, CachedRoom> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public RoomProfileCache(Clock clock, @Value("${lucidity.flux.room-cache-ttl:60s}") Duration ttl) {
        this.clock = clock;
        this.ttl   = ttl;
    }

    /** The cached profile, or {@code null} when absent or expired. */
    public RoomProfile get(String roomId) {
        CachedRoom entry = store.get(roomId);
        if (entry == null) {
            return null;
        }
        if (clock.instant().isAfter(entry.fetchedAt().plus(ttl))) {
            store.remove(roomId);
            log.debug("ROOM_CACHE_EXPIRED roomId={}", roomId);
            return null;
        }
        return entry.profile();
    }

    public void put(String roomId, RoomProfile profile) {
        store.put(roomId, new CachedRoom(profile, clock.instant()));
    }

    public int size() {
        return store.size();
    }

    private record CachedRoom(RoomProfile profile, Instant fetchedAt) {}
}
