package com.lucidityplatform.ledger.adapter;

import com.lucidityplatform.ledger.client.WorldClient;
import com.lucidityplatform.ledger.support.InMemoryLedgerStore;
import com.lucidityplatform.ledger.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SanitariumFailoverHandlerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final InMemoryLedgerStore store = new InMemoryLedgerStore(clock);
    private final WorldClient worldClient = mock(WorldClient.class);
    private final SanitariumFailoverHandler handler =
        new SanitariumFailoverHandler(store, worldClient, "sanitarium_foyer");

    @Test
    @DisplayName("clears hallucination timers, keeps other cooldowns and relocates")
    void clearsAndRelocates() {
        UUID actor = store.registerActor();
        Instant later = clock.instant().plusSeconds(600);
        store.setCooldown(actor, "hallucination_timer", later).block();
        store.setCooldown(actor, "hallucination_echo", later).block();
        store.setCooldown(actor, "pray", later).block();
        when(worldClient.relocate(any(), anyString(), anyString())).thenReturn(Mono.empty());

        StepVerifier.create(handler.failover(actor, -100)).verifyComplete();

        StepVerifier.create(store.getCooldown(actor, "hallucination_timer")).verifyComplete();
        StepVerifier.create(store.getCooldown(actor, "hallucination_echo")).verifyComplete();
        StepVerifier.create(store.getCooldown(actor, "pray")).expectNextCount(1).verifyComplete();
        verify(worldClient).relocate(eq(actor), eq("sanitarium_foyer"), eq("catatonia_failover"));
    }

    @Test
    @DisplayName("relocation errors surface to the caller")
    void relocationError() {
        UUID actor = store.registerActor();
        when(worldClient.relocate(any(), anyString(), anyString()))
            .thenReturn(Mono.error(new IllegalStateException("world down")));

        StepVerifier.create(handler.failover(actor, -100))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
