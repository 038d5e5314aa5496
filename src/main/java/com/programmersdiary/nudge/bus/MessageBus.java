package com.programmersdiary.nudge.bus;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;

/**
 * In-process outbound transport. Publishing is a best-effort enqueue: it never blocks, and a
 * message that does not fit in the buffer is dropped.
 */
@Component
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final Sinks.Many<OutboundMessage> outbound;

    public MessageBus(@Value("${nudge.bus.buffer-size:256}") int bufferSize) {
        this.outbound = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
    }

    public synchronized void publishOutbound(OutboundMessage message) {
        var result = outbound.tryEmitNext(message);
        if (result.isFailure()) {
            log.warn("Dropped outbound message for {}:{} ({})", message.channel(), message.chatId(), result);
        }
    }

    public Flux<OutboundMessage> outbound() {
        return outbound.asFlux();
    }

    /**
     * Delivers every outbound message for {@code channel} to {@code callback} on a worker thread.
     * A failing callback is logged and does not stop delivery.
     */
    public Disposable subscribeOutbound(String channel, Consumer<OutboundMessage> callback) {
        return outbound.asFlux()
                .filter(message -> channel.equals(message.channel()))
                .publishOn(Schedulers.boundedElastic())
                .subscribe(message -> {
                    try {
                        callback.accept(message);
                    } catch (RuntimeException e) {
                        log.error("Subscriber for channel '{}' failed: {}", channel, e.getMessage(), e);
                    }
                });
    }

    @PreDestroy
    public synchronized void close() {
        outbound.tryEmitComplete();
    }
}
