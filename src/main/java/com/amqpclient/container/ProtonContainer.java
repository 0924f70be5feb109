package com.amqpclient.container;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;
import com.amqpclient.connection.Connection;
import com.amqpclient.connection.ConnectionHandler;
import com.amqpclient.connection.ReconnectEngine;
import com.amqpclient.transport.ProtonTransportFactory;
import com.amqpclient.transport.TransportFactory;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Container backed by a single Vert.x event-loop context.
 *
 * Connections, their transports, retry timers and application callbacks all
 * run on that one context. Timers use {@code Vertx.setTimer}; zero delays go
 * through {@code runOnContext} so scheduled work never runs inline.
 */
public class ProtonContainer implements Container {

    private static final Logger log = LoggerFactory.getLogger(ProtonContainer.class);

    // Keeps Netty's deadline arithmetic in range for huge backoff values
    private static final long MAX_TIMER_MILLIS = Long.MAX_VALUE / 1_000_000L;

    private final String id;
    private final Vertx vertx;
    private final boolean ownsVertx;
    private final Context context;
    private final ConnectionHandler handler;
    private final TransportFactory transports;

    private final Map<String, ReconnectEngine> engines = new ConcurrentHashMap<>();
    // Only touched on the event loop
    private final Set<VertxWork> pendingWork = new LinkedHashSet<>();
    private boolean autoStop = true;

    private final AtomicInteger connectionIds = new AtomicInteger(0);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);

    public ProtonContainer(ConnectionHandler handler) {
        this(handler, "container-" + UUID.randomUUID());
    }

    public ProtonContainer(ConnectionHandler handler, String id) {
        this(Vertx.vertx(), true, handler, id, null);
    }

    /**
     * Container on a caller-owned Vert.x instance, which is left open on stop.
     */
    public ProtonContainer(Vertx vertx, ConnectionHandler handler, String id) {
        this(vertx, false, handler, id, null);
    }

    /**
     * Container with a custom transport factory, used to plug in other transports.
     */
    public ProtonContainer(Vertx vertx, ConnectionHandler handler, String id, TransportFactory transports) {
        this(vertx, false, handler, id, transports);
    }

    private ProtonContainer(Vertx vertx, boolean ownsVertx, ConnectionHandler handler, String id,
                            TransportFactory transports) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.ownsVertx = ownsVertx;
        this.handler = handler != null ? handler : new ConnectionHandler() { };
        this.id = Objects.requireNonNull(id, "id");
        this.context = vertx.getOrCreateContext();
        this.transports = transports != null ? transports : new ProtonTransportFactory(vertx, id);
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * Whether {@link #run()} returns by itself once the last connection closed
     * and no scheduled work is left. Defaults to true.
     */
    public void setAutoStop(boolean autoStop) {
        execute(() -> this.autoStop = autoStop);
    }

    @Override
    public Connection connect(String address) {
        return connect(address, ConnectionOptions.empty());
    }

    @Override
    public Connection connect(String address, ConnectionOptions options) {
        Objects.requireNonNull(options, "options");
        if (stopped.get()) {
            throw new IllegalStateException("Container " + id + " is stopped");
        }
        ConnectionTarget target = ConnectionTarget.parse(address);
        String connectionId = id + "-" + connectionIds.incrementAndGet();
        ReconnectEngine engine = new ReconnectEngine(connectionId, target, options, this, transports,
                                                     handler, this::onConnectionClosed);
        execute(() -> {
            if (stopped.get()) {
                engine.stop();
                return;
            }
            engines.put(connectionId, engine);
            engine.start();
        });
        return engine.getConnection();
    }

    @Override
    public ScheduledWork schedule(Duration delay, Runnable work) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(work, "work");
        VertxWork scheduled = new VertxWork(work);
        execute(() -> {
            if (stopped.get() || scheduled.cancelled.get()) {
                return;
            }
            pendingWork.add(scheduled);
            long millis = Math.min(Math.max(delay.toMillis(), 0L), MAX_TIMER_MILLIS);
            if (millis < 1) {
                context.runOnContext(v -> scheduled.fire());
            } else {
                scheduled.timerId = vertx.setTimer(millis, timerId -> scheduled.fire());
            }
        });
        return scheduled;
    }

    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Container " + id + " is already running");
        }
        log.info("Container {} starting", id);
        execute(() -> {
            try {
                handler.onContainerStart(this);
            } catch (RuntimeException e) {
                log.warn("Container {} start handler threw", id, e);
            }
        });
        try {
            stoppedLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        }
        log.info("Container {} stopped", id);
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        execute(() -> {
            log.info("Stopping container {} ({} connections, {} scheduled tasks)", id, engines.size(), pendingWork.size());
            for (VertxWork work : new ArrayList<>(pendingWork)) {
                work.cancelTimer();
            }
            pendingWork.clear();
            for (ReconnectEngine engine : new ArrayList<>(engines.values())) {
                engine.stop();
            }
            engines.clear();
            if (ownsVertx) {
                vertx.close().onFailure(e -> log.warn("Error closing Vert.x for container {}", id, e));
            }
            stoppedLatch.countDown();
        });
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void execute(Runnable task) {
        if (inEventLoop()) {
            runSafely(task);
        } else {
            context.runOnContext(v -> runSafely(task));
        }
    }

    @Override
    public boolean inEventLoop() {
        return Vertx.currentContext() == context;
    }

    /**
     * Number of connections that have not reached CLOSED yet.
     */
    public int getActiveConnectionCount() {
        return engines.size();
    }

    private void onConnectionClosed(Connection connection) {
        engines.remove(connection.getId());
        checkAutoStop();
    }

    private void checkAutoStop() {
        if (autoStop && running.get() && engines.isEmpty() && pendingWork.isEmpty()) {
            log.debug("Container {} has no more work", id);
            stop();
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Task on container {} threw", id, e);
        }
    }

    /**
     * Timer or deferred task on the container's context.
     */
    private final class VertxWork implements ScheduledWork {
        private final Runnable work;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile long timerId = -1;
        private volatile boolean done;

        VertxWork(Runnable work) {
            this.work = work;
        }

        void fire() {
            if (!pendingWork.remove(this) || cancelled.get() || stopped.get()) {
                return;
            }
            done = true;
            runSafely(work);
            checkAutoStop();
        }

        void cancelTimer() {
            cancelled.set(true);
            long timer = timerId;
            if (timer >= 0) {
                vertx.cancelTimer(timer);
            }
        }

        @Override
        public boolean cancel() {
            if (done || !cancelled.compareAndSet(false, true)) {
                return false;
            }
            long timer = timerId;
            if (timer >= 0) {
                vertx.cancelTimer(timer);
            }
            execute(() -> {
                if (pendingWork.remove(this)) {
                    checkAutoStop();
                }
            });
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
