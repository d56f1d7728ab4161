package com.quotefeed.marketdata.broadcast;

import com.quotefeed.common.event.QuoteBroadcastMessage;

/**
 * Outbound channel for quote updates. Implementations are best effort; failures surface as
 * {@link com.quotefeed.common.exception.BroadcastException} and are handled per message by the
 * caller.
 */
public interface QuoteBroadcastSink {

    void publish(QuoteBroadcastMessage message);
}
