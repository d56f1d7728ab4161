package com.quotefeed.marketdata.broadcast;

import com.quotefeed.common.event.QuoteBroadcastMessage;
import com.quotefeed.common.exception.BroadcastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process fan-out of quote updates to every live subscriber (the SSE stream endpoint).
 *
 * <p>Multicast without replay: a subscriber only sees messages published after it joined, and
 * a publish with nobody listening is dropped silently.
 */
public class ReactiveQuoteBroadcastSink implements QuoteBroadcastSink {

    private static final Logger log = LoggerFactory.getLogger(ReactiveQuoteBroadcastSink.class);

    private final Sinks.Many<QuoteBroadcastMessage> sink =
        Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(QuoteBroadcastMessage message) {
        Sinks.EmitResult result = sink.tryEmitNext(message);
        if (result == Sinks.EmitResult.OK || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("QUOTE_BROADCAST asset={} price={} subscribers={}",
                      message.asset(), message.price(), sink.currentSubscriberCount());
            return;
        }
        throw new BroadcastException("Broadcast rejected. asset=" + message.asset() + " result=" + result);
    }

    public Flux<QuoteBroadcastMessage> stream() {
        return sink.asFlux();
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
