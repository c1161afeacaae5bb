package com.txwatch.connection.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Best-effort WebSocket channel to the node. Reconnects after a fixed delay whenever the session ends, without
 * an attempt cap, until {@link #close()} is called.
 */
@Slf4j
public class StreamChannel {

    private final WebSocketClient client;
    private final URI uri;
    private final ObjectMapper objectMapper;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration reconnectDelay;
    private final List<Consumer<JsonNode>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean open = new AtomicBoolean(false);

    private volatile Sinks.Many<String> outbound;
    private volatile Disposable session;
    private volatile boolean closed = true;

    public StreamChannel(WebSocketClient client, URI uri, ObjectMapper objectMapper,
                         TaskScheduler scheduler, Clock clock, Duration reconnectDelay) {
        this.client = client;
        this.uri = uri;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.clock = clock;
        this.reconnectDelay = reconnectDelay;
    }

    /**
     * Starts the session unless one is already active.
     */
    public synchronized void open() {
        closed = false;
        Disposable current = session;
        if (current != null && !current.isDisposed()) {
            return;
        }
        connect();
    }

    public synchronized void close() {
        closed = true;
        Disposable current = session;
        if (current != null) {
            current.dispose();
        }
        open.set(false);
        outbound = null;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Serializes the message as JSON and queues it on the session.
     *
     * @return false when the channel is not connected; the message is dropped
     */
    public boolean send(Object message) {
        Sinks.Many<String> sink = outbound;
        if (!open.get() || sink == null) {
            log.warn("Stream is not connected; dropping message");
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stream message is not serializable: " + e.getMessage(), e);
        }
        return sink.tryEmitNext(json).isSuccess();
    }

    public void addListener(Consumer<JsonNode> listener) {
        listeners.add(listener);
    }

    void dispatch(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stream message: {}", e.getOriginalMessage());
            return;
        }
        for (Consumer<JsonNode> listener : listeners) {
            try {
                listener.accept(node);
            } catch (RuntimeException e) {
                log.warn("Stream listener failed: {}", e.getMessage());
            }
        }
    }

    private void connect() {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        outbound = sink;
        session = client.execute(uri, ws -> {
                    open.set(true);
                    log.info("Stream connected to {}", uri);
                    Mono<Void> out = ws.send(sink.asFlux().map(ws::textMessage));
                    Mono<Void> in = ws.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(this::dispatch)
                            .doFinally(signal -> sink.tryEmitComplete())
                            .then();
                    return Mono.when(in, out);
                })
                .onErrorResume(e -> {
                    log.warn("Stream error on {}: {}", uri, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> onSessionEnded())
                .subscribe();
    }

    private void onSessionEnded() {
        open.set(false);
        if (closed) {
            log.info("Stream closed");
            return;
        }
        log.info("Stream disconnected; reconnecting in {}ms", reconnectDelay.toMillis());
        scheduler.schedule(this::reconnect, clock.instant().plus(reconnectDelay));
    }

    private synchronized void reconnect() {
        if (closed) {
            return;
        }
        connect();
    }
}
