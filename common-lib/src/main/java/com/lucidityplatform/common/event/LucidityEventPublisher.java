package com.lucidityplatform.common.event;

/**
 * Outbound notification transport for lucidity events.
 *
 * <p>Implementations MUST be non-blocking and fire-and-forget: a failed delivery is
 * logged by the implementation and never reported back to the ledger write that
 * produced the event.
 */
public interface LucidityEventPublisher {

    void publishChange(LucidityChangeEvent event);

    void publishStatus(LucidityStatusEvent event);
}
