package io.dispatch4j.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.CallbackSender;
import io.dispatch4j.Worker;
import io.dispatch4j.core.CronDescriptor;
import io.dispatch4j.core.CronStore;
import io.dispatch4j.core.WakeSignal;
import io.dispatch4j.utils.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a live set of recurring triggers in step with the {@link CronStore}.
 *
 * <p>The worker loop builds a {@link CronGeneration} from the store, runs it until a
 * reconfigure signal arrives, tears it down and builds the next one. {@link #reconfigure(List)}
 * is a full replace: the store is cleared, the new set written, and the worker signalled.
 */
public class CronEngine implements Worker {
    private static final Logger log = LoggerFactory.getLogger(CronEngine.class);

    private final CronStore cronStore;
    private final CallbackSender sender;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final int triggerThreads;
    private final Clock clock;

    private final WakeSignal reconfigure = new WakeSignal();
    private final Object reconfigureLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopRequested = false;

    private volatile CronEngineState state = CronEngineState.BUILDING;
    private volatile CronGeneration current;
    private long generations = 0;

    public CronEngine(CronStore cronStore, CallbackSender sender, ObjectMapper objectMapper,
                      ZoneId zone, int triggerThreads) {
        this(cronStore, sender, objectMapper, zone, triggerThreads, Clock.systemUTC());
    }

    public CronEngine(CronStore cronStore, CallbackSender sender, ObjectMapper objectMapper,
                      ZoneId zone, int triggerThreads, Clock clock) {
        this.cronStore = Objects.requireNonNull(cronStore, "cronStore must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (triggerThreads <= 0) {
            throw new IllegalArgumentException("triggerThreads must be a positive number");
        }
        this.triggerThreads = triggerThreads;
    }

    @Override
    public String name() {
        return "crons";
    }

    /**
     * Build, run and rebuild trigger generations until {@link #stop()} is called.
     *
     * @throws io.dispatch4j.core.StoreException if descriptors cannot be loaded
     */
    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Cron engine is already running");
        }
        log.info("Cron engine started with zone={}, triggerThreads={}", zone, triggerThreads);
        try {
            while (!stopRequested) {
                state = CronEngineState.BUILDING;
                List<CronDescriptor> descriptors = cronStore.findAll();
                CronGeneration generation = new CronGeneration(
                        ++generations, descriptors, zone, triggerThreads, clock, this::fire);
                current = generation;
                generation.start();
                state = CronEngineState.RUNNING;
                log.info("Started crons generation={} with {} jobs.", generation.number(), generation.size());

                try {
                    reconfigure.await();
                } finally {
                    state = CronEngineState.TEARDOWN;
                    generation.close();
                    current = null;
                }
                if (!stopRequested) {
                    log.info("Got crons recompute request, tearing down generation={}.", generation.number());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = CronEngineState.STOPPED;
            log.info("Cron engine stopped.");
        }
    }

    @Override
    public void stop() {
        stopRequested = true;
        reconfigure.raise();
    }

    /**
     * Replace the whole recurring set.
     *
     * <p>The request is validated before the store is touched. The store update itself is not
     * atomic: if an insert fails after the clear, the store keeps the partial set and the
     * {@link io.dispatch4j.core.StoreException} propagates without signalling the worker.
     *
     * @throws IllegalArgumentException if an id is blank or duplicated, or a spec is invalid
     */
    public void reconfigure(List<CronDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        validate(descriptors);

        synchronized (reconfigureLock) {
            cronStore.deleteAll();
            for (CronDescriptor d : descriptors) {
                cronStore.insert(d);
            }
            reconfigure.raise();
        }
        log.info("Stored {} cron jobs, signalled rebuild.", descriptors.size());
    }

    private void validate(List<CronDescriptor> descriptors) {
        Set<String> ids = new HashSet<>();
        for (CronDescriptor d : descriptors) {
            if (d == null) {
                throw new IllegalArgumentException("cron job must not be null");
            }
            if (d.id().isBlank()) {
                throw new IllegalArgumentException("cron job id must not be blank");
            }
            if (!ids.add(d.id())) {
                throw new IllegalArgumentException("Duplicate cron job id: " + d.id());
            }
            // throws with the parser's message
            CronExpressions.parse(d.scheduleExpression(), zone);
        }
    }

    private void fire(CronDescriptor descriptor) {
        try {
            sender.send(payload(descriptor.id()));
            log.info("Executed cron job {} ({}).", descriptor.id(), descriptor.scheduleExpression());
        } catch (Exception e) {
            log.warn("Failed to execute cron job {} ({}): {}", descriptor.id(), descriptor.scheduleExpression(), e.getMessage());
        }
    }

    private byte[] payload(String cronId) throws JsonProcessingException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("cron_id", cronId);
        return objectMapper.writeValueAsBytes(body);
    }

    public CronEngineState state() {
        return state;
    }

    /**
     * Descriptors of the running generation; empty while no generation is running.
     */
    public List<CronDescriptor> activeTriggers() {
        CronGeneration g = current;
        return g == null || !g.isActive() ? List.of() : g.descriptors();
    }

    /**
     * Number of the running generation, or 0 while none is running.
     */
    public long generation() {
        CronGeneration g = current;
        return g == null ? 0 : g.number();
    }
}
