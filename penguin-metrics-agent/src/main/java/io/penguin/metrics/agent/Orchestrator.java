package io.penguin.metrics.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.penguin.metrics.agent.collector.CollectionException;
import io.penguin.metrics.agent.collector.Collector;
import io.penguin.metrics.agent.collector.CollectorResult;
import io.penguin.metrics.agent.collector.CollectorState;
import io.penguin.metrics.agent.collector.Origin;
import io.penguin.metrics.agent.discovery.CollectorLifecycle;
import io.penguin.metrics.agent.discovery.Reconciler;
import io.penguin.metrics.agent.homeassistant.Device;
import io.penguin.metrics.agent.homeassistant.Sensor;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the agent: one periodic task per collector on a shared scheduler, plus the
 * auto-discovery reconciler.
 * <p>
 * Lifecycle:
 * <pre>
 * Orchestrator orchestrator = new Orchestrator(context);
 * orchestrator.start();
 * // On shutdown:
 * orchestrator.stop();
 * </pre>
 * A new collector's announcements are always enqueued before its first payload.
 */
public class Orchestrator implements CollectorLifecycle {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AgentContext context;
    private final CollectorTable table = new CollectorTable();
    private final ScheduledExecutorService collectorScheduler;
    private final ScheduledExecutorService discoveryScheduler;
    private final Reconciler reconciler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public Orchestrator(AgentContext context) {
        this.context = context;
        AtomicInteger threadIndex = new AtomicInteger();
        this.collectorScheduler = Executors.newScheduledThreadPool(context.settings().getSchedulerThreads(), r -> {
            Thread t = new Thread(r, "collector-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.discoveryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auto-discovery");
            t.setDaemon(true);
            return t;
        });
        this.reconciler = new Reconciler(context.config(), context.enumerators(), this);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Orchestrator already running");
            return;
        }
        context.discovery().loadRegistry();
        context.transport().start();

        for (SourceConfig source : context.config().allSources()) {
            register(source, Origin.MANUAL);
        }
        reconciler.reconcile();
        context.discovery().finalizeRegistration(liveUniqueIds());

        Duration refresh = context.config().autoRefreshInterval();
        if (!refresh.isZero() && !refresh.isNegative() && autoDiscoveryEnabled()) {
            discoveryScheduler.scheduleWithFixedDelay(this::reconcileSafely,
                    refresh.toMillis(), refresh.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Started {} collectors", table.size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping {} collectors", table.size());
        shutdownScheduler(discoveryScheduler, "auto-discovery", Duration.ofSeconds(5));
        for (ManagedCollector collector : table.snapshot()) {
            collector.cancel();
        }
        shutdownScheduler(collectorScheduler, "collector", context.settings().getShutdownGrace());
        for (ManagedCollector collector : table.snapshot()) {
            collector.setState(CollectorState.STOPPED);
        }
        context.transport().shutdown();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean add(SourceConfig source) {
        return register(source, Origin.AUTO_DISCOVERED);
    }

    @Override
    public void remove(SourceType type, String id) {
        Optional<ManagedCollector> removed = table.remove(type.topicSegment() + "/" + id);
        if (removed.isEmpty()) {
            return;
        }
        ManagedCollector collector = removed.get();
        collector.cancel();
        collector.setState(CollectorState.STOPPED);
        awaitCycle(collector);
        context.discovery().retract(collector.getSensors());
        context.transport().forgetSource(collector.getStateTopic());
        log.debug("Removed collector {}", collector.key());
    }

    public List<ManagedCollector> collectors() {
        return table.snapshot();
    }

    public Optional<ManagedCollector> collector(String key) {
        return table.get(key);
    }

    /**
     * Creates, initializes, announces and schedules one source.
     */
    boolean register(SourceConfig source, Origin origin) {
        Collector collector;
        try {
            collector = context.collectors().create(source);
        } catch (RuntimeException e) {
            log.warn("Cannot create collector for {} '{}': {}", source.type().blockName(), source.name(), e.getMessage());
            return false;
        }
        if (!collector.enabled()) {
            log.info("Skipping {}: no metrics enabled", collector.key());
            return false;
        }
        Device device = context.devices().resolve(source).orElse(null);
        List<Sensor> sensors = context.sensors().sensors(collector, device);
        ManagedCollector managed = new ManagedCollector(collector, origin, device, sensors,
                context.sensors().stateTopic(source));
        if (!table.putIfAbsent(managed)) {
            log.warn("Collector {} already exists, ignoring duplicate", managed.key());
            return false;
        }

        managed.setState(CollectorState.INITIALIZING);
        try {
            collector.initialize();
        } catch (CollectionException | RuntimeException e) {
            managed.setState(CollectorState.STOPPED);
            log.warn("Initialization of {} failed, collector stopped: {}", managed.key(), e.getMessage());
            if (origin == Origin.AUTO_DISCOVERED) {
                table.remove(managed.key());
                return false;
            }
            return true;
        }

        context.discovery().announce(sensors);
        managed.setState(CollectorState.RUNNING);
        managed.setSchedule(collectorScheduler.scheduleWithFixedDelay(() -> runCycle(managed),
                0, collector.updateInterval().toMillis(), TimeUnit.MILLISECONDS));
        log.debug("Started collector {} ({}) every {}ms", managed.key(), origin,
                collector.updateInterval().toMillis());
        return true;
    }

    /**
     * One collection cycle. Never throws, so the schedule is never cancelled by a failure.
     * A collector stopped while the cycle was running publishes nothing.
     */
    void runCycle(ManagedCollector managed) {
        ReentrantLock lock = managed.cycleLock();
        lock.lock();
        try {
            if (managed.getState() == CollectorState.STOPPED) {
                return;
            }
            CollectorResult result;
            CollectorState next;
            try {
                result = managed.getCollector().collect();
                next = CollectorState.RUNNING;
            } catch (CollectionException | RuntimeException e) {
                String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Collection failed for {}: {}", managed.key(), error);
                result = CollectorResult.failed(error);
                next = CollectorState.DEGRADED;
            }
            if (managed.getState() == CollectorState.STOPPED) {
                log.debug("Discarding result of stopped collector {}", managed.key());
                return;
            }
            if (managed.getState() == CollectorState.DEGRADED && next == CollectorState.RUNNING) {
                log.info("Collector {} recovered", managed.key());
            }
            managed.setState(next);
            managed.setLastResult(result);
            try {
                context.transport().publishSource(managed.getStateTopic(), MAPPER.writeValueAsString(result.toPayload()));
            } catch (JsonProcessingException e) {
                log.warn("Cannot serialize payload of {}: {}", managed.key(), e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits, bounded by the shutdown grace, for a cycle of {@code collector} that is still in flight.
     */
    private void awaitCycle(ManagedCollector collector) {
        Duration grace = context.settings().getShutdownGrace();
        ReentrantLock lock = collector.cycleLock();
        try {
            if (lock.tryLock(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                lock.unlock();
            } else {
                log.warn("Cycle of {} still running after {}ms, removing it anyway", collector.key(), grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void reconcileSafely() {
        try {
            reconciler.reconcile();
        } catch (RuntimeException e) {
            log.error("Auto-discovery pass failed", e);
        }
    }

    private boolean autoDiscoveryEnabled() {
        for (SourceType type : SourceType.values()) {
            if (type.discoverable() && context.config().autoDiscovery(type).enabled()) {
                return true;
            }
        }
        return false;
    }

    private Set<String> liveUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (ManagedCollector collector : table.snapshot()) {
            if (collector.getState() != CollectorState.STOPPED) {
                for (Sensor sensor : collector.getSensors()) {
                    ids.add(sensor.uniqueId());
                }
            }
        }
        return ids;
    }

    private void shutdownScheduler(ScheduledExecutorService scheduler, String name, Duration grace) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
                log.warn("{} scheduler did not terminate gracefully", name);
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
