package com.lucidityplatform.ledger.publisher;

import com.lucidityplatform.common.event.LucidityChangeEvent;
import com.lucidityplatform.common.event.LucidityEventPublisher;
import com.lucidityplatform.common.event.LucidityStatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST implementation of {@link LucidityEventPublisher}.
 *
 * <p>Posts events to the notification service fire-and-forget. With
 * {@code notification.enabled=false} events are only logged, which is the local
 * development setup.
 */
@Component
public class RestLucidityEventPublisher implements LucidityEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestLucidityEventPublisher.class);

    private final WebClient notificationClient;
    private final boolean enabled;

    public RestLucidityEventPublisher(WebClient notificationClient,
                                      @Value("${notification.enabled:true}") boolean enabled) {
        this.notificationClient = notificationClient;
        this.enabled            = enabled;
    }

    @Override
    public void publishChange(LucidityChangeEvent event) {
        if (!enabled) {
            log.info("Lucidity change (notification disabled). actorId={} score={} delta={} tier={} reason={}",
                     event.actorId(), event.score(), event.delta(), event.tier().label(), event.reason());
            return;
        }
        notificationClient.post()
            .uri("/api/v1/notify/lucidity")
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.debug("Lucidity change published. actorId={} status={}",
                                 event.actorId(), r.getStatusCode()),
                err -> log.warn("Lucidity change publish failed (non-critical). actorId={}",
                                event.actorId(), err)
            );
    }

    @Override
    public void publishStatus(LucidityStatusEvent event) {
        if (!enabled) {
            log.info("Lucidity status (notification disabled). actorId={} status={} score={}",
                     event.actorId(), event.status().code(), event.score());
            return;
        }
        notificationClient.post()
            .uri("/api/v1/notify/lucidity-status")
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Lucidity status published. actorId={} status={} httpStatus={}",
                                event.actorId(), event.status().code(), r.getStatusCode()),
                err -> log.warn("Lucidity status publish failed (non-critical). actorId={} status={}",
                                event.actorId(), event.status().code(), err)
            );
    }
}
