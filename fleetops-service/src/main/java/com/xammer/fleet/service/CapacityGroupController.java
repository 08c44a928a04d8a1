package com.xammer.fleet.service;

import com.xammer.fleet.domain.BootstrapPayload;
import com.xammer.fleet.domain.CapacitySettings;
import com.xammer.fleet.domain.FleetMember;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.FleetSpec;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.MemberHealth;
import com.xammer.fleet.domain.MemberLifecycle;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.RefreshPreferences;
import com.xammer.fleet.domain.RefreshStatus;
import com.xammer.fleet.domain.TemplateGeneration;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.exception.FleetNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns one fleet: its template generations, its members and its capacity bounds.
 *
 * <p>Capacity is a versioned value that operators may change at any time through
 * {@link #updateCapacity(int, int, int)}. Refresh steps and reconciliation re-read it on every pass.
 *
 * <p>A rolling refresh replaces every member that existed when it started. Each step does at most one
 * thing: launch a fresh member, or retire a stale one. A live member is retired only when the live count
 * stays at or above {@link RefreshPreferences#liveFloor(CapacitySettings)} afterwards.
 */
public class CapacityGroupController {

    private static final Logger logger = LoggerFactory.getLogger(CapacityGroupController.class);

    private final String fleetId;
    private final FleetSpec spec;
    private final TrafficTier trafficTier;
    private final FleetNetwork network;
    private final HealthCheckMode healthCheckMode;
    private final FleetCompute compute;
    private final TaskScheduler scheduler;
    private final RefreshPreferences preferences;
    private final Clock clock;

    private final AtomicReference<CapacitySettings> capacity;

    private final Object lock = new Object();
    // guarded by lock
    private final List<TemplateGeneration> generations = new ArrayList<>();
    private final Map<String, FleetMember> members = new LinkedHashMap<>();
    private RefreshRun refresh;
    private RefreshStatus lastRefreshStatus = RefreshStatus.NONE;
    private String lastRefreshId;
    private ScheduledFuture<?> reconcileTask;
    private boolean deleted;
    private int subnetCursor;

    public CapacityGroupController(String fleetId, FleetSpec spec, TrafficTier trafficTier, FleetNetwork network,
            FleetCompute compute, TaskScheduler scheduler, RefreshPreferences preferences, Clock clock) {
        FleetDefinitionValidator.validateCapacity(spec.getMinSize(), spec.getDesiredCapacity(), spec.getMaxSize());
        this.fleetId = fleetId;
        this.spec = spec;
        this.trafficTier = trafficTier;
        this.network = network;
        this.healthCheckMode = HealthCheckMode.of(trafficTier);
        this.compute = compute;
        this.scheduler = scheduler;
        this.preferences = preferences;
        this.clock = clock;
        this.capacity = new AtomicReference<>(spec.initialCapacity());
    }

    public String getFleetId() {
        return fleetId;
    }

    public FleetNetwork getNetwork() {
        return network;
    }

    public HealthCheckMode getHealthCheckMode() {
        return healthCheckMode;
    }

    public CapacitySettings getCapacity() {
        return capacity.get();
    }

    /**
     * Registers generation 1, launches the desired capacity and starts periodic reconciliation.
     */
    public void start(BootstrapPayload payload) {
        synchronized (lock) {
            TemplateGeneration first = new TemplateGeneration(1, spec.getInstanceType(), spec.getAmiReference(),
                    payload, clock.instant(), null);
            TemplateGeneration registered = first.withTemplateRef(compute.registerTemplate(fleetId, network, first));
            generations.add(registered);
            int desired = capacity.get().getDesiredCapacity();
            for (int i = 0; i < desired; i++) {
                launch(registered);
            }
            logger.info("Fleet {}: started with {} member(s), health mode {}", fleetId, desired, healthCheckMode);
            reconcileTask = scheduler.scheduleWithFixedDelay(this::reconcile, preferences.getReconcileInterval());
        }
    }

    public CapacitySettings updateCapacity(int minSize, int desiredCapacity, int maxSize) {
        FleetDefinitionValidator.validateCapacity(minSize, desiredCapacity, maxSize);
        CapacitySettings updated = capacity.updateAndGet(current -> current.next(minSize, desiredCapacity, maxSize));
        logger.info("Fleet {}: capacity now min={} desired={} max={} (version {})",
                fleetId, minSize, desiredCapacity, maxSize, updated.getVersion());
        return updated;
    }

    /**
     * Registers a new template generation and makes it current. The previous generation stays registered
     * until no member runs on it; running members move to the new generation only through a rolling refresh.
     */
    public TemplateGeneration replaceTemplate(String instanceType, String amiReference, BootstrapPayload payload) {
        synchronized (lock) {
            ensureNotDeleted();
            TemplateGeneration previous = currentGeneration();
            TemplateGeneration next = new TemplateGeneration(previous.getNumber() + 1,
                    instanceType != null ? instanceType : previous.getInstanceType(),
                    amiReference != null ? amiReference : previous.getAmiReference(),
                    payload != null ? payload : previous.getPayload(),
                    clock.instant(),
                    null);
            TemplateGeneration registered = next.withTemplateRef(compute.registerTemplate(fleetId, network, next));
            generations.add(registered);
            logger.info("Fleet {}: template generation {} is current ({}), generation {} kept until unused",
                    fleetId, registered.getNumber(), registered.getTemplateRef(), previous.getNumber());
            retireUnusedGenerations();
            return registered;
        }
    }

    /**
     * Starts replacing every current member with one from the current generation. Returns immediately;
     * calling it while a refresh runs reports the running refresh instead of starting another.
     */
    public RefreshOutcome startRollingRefresh() {
        synchronized (lock) {
            if (deleted) {
                return RefreshOutcome.rejected("fleet " + fleetId + " is being deleted", "FleetDeleting");
            }
            if (refresh != null) {
                logger.info("Refresh: fleet {} already refreshing ({}), ignoring trigger", fleetId, refresh.id);
                return RefreshOutcome.alreadyInProgress(refresh.id);
            }
            Set<String> stale = members.values().stream()
                    .filter(FleetMember::isActive)
                    .map(FleetMember::getInstanceId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            RefreshRun run = new RefreshRun(UUID.randomUUID().toString(), currentGeneration().getNumber(), stale, clock.instant());
            refresh = run;
            lastRefreshId = run.id;
            lastRefreshStatus = RefreshStatus.IN_PROGRESS;
            logger.info("Refresh: fleet {} started {} replacing {} member(s) with generation {}",
                    fleetId, run.id, stale.size(), run.targetGeneration);
            run.task = scheduler.scheduleWithFixedDelay(this::refreshStep, preferences.getStepInterval());
            return RefreshOutcome.accepted(run.id);
        }
    }

    /**
     * One refresh step. Invoked by the scheduler while a refresh is in progress.
     */
    public void refreshStep() {
        synchronized (lock) {
            RefreshRun run = refresh;
            if (run == null || deleted) {
                return;
            }
            try {
                advance(run);
            } catch (RuntimeException e) {
                logger.error("Refresh: fleet {} step of {} failed, retrying on next step", fleetId, run.id, e);
            }
        }
    }

    private void advance(RefreshRun run) {
        checkMemberHealth();
        run.stale.removeIf(id -> !isActive(id));
        if (run.stale.isEmpty()) {
            finishRefresh(RefreshStatus.SUCCESSFUL);
            return;
        }
        if (hasPendingReplacement(run)) {
            logger.debug("Refresh: fleet {} waiting for replacement to come into service", fleetId);
            return;
        }

        CapacitySettings cap = capacity.get();
        int floor = preferences.liveFloor(cap);
        int live = liveCount();
        int active = activeCount();

        Optional<FleetMember> notLive = staleMembers(run).filter(m -> !m.isLive()).findFirst();
        if (notLive.isPresent()) {
            retire(notLive.get(), "stale and not in service");
            return;
        }
        boolean surplus = active > cap.getDesiredCapacity();
        boolean atMax = active >= cap.getMaxSize();
        if ((surplus || atMax) && live - 1 >= floor) {
            FleetMember oldest = staleMembers(run)
                    .min(Comparator.comparing(FleetMember::getLaunchedAt))
                    .orElseThrow();
            retire(oldest, "replaced by refresh " + run.id);
            return;
        }
        if (!atMax) {
            String id = launch(currentGeneration());
            run.fresh.add(id);
            return;
        }
        logger.warn("Refresh: fleet {} holding, {} live at floor {} and {} active at max {}",
                fleetId, live, floor, active, cap.getMaxSize());
    }

    /**
     * Health checks, warmup promotion and self-healing. Scaling to the desired capacity is skipped
     * while a refresh owns membership changes.
     */
    public void reconcile() {
        synchronized (lock) {
            if (deleted) {
                return;
            }
            try {
                checkMemberHealth();
                if (refresh == null) {
                    scaleToDesired();
                    retireUnusedGenerations();
                }
            } catch (RuntimeException e) {
                logger.error("Fleet {}: reconciliation failed, retrying on next pass", fleetId, e);
            }
        }
    }

    /**
     * Tears the fleet down. Every member is terminated whatever its lifecycle state; a failure on one
     * member does not stop the others.
     *
     * @return ids of the members that were terminated
     */
    public List<String> delete() {
        synchronized (lock) {
            if (deleted) {
                return List.of();
            }
            deleted = true;
            if (refresh != null) {
                finishRefresh(RefreshStatus.CANCELLED);
            }
            if (reconcileTask != null) {
                reconcileTask.cancel(false);
            }
            List<String> terminated = new ArrayList<>();
            for (FleetMember member : members.values()) {
                try {
                    compute.terminateMember(network, member.getInstanceId());
                    terminated.add(member.getInstanceId());
                } catch (RuntimeException e) {
                    logger.error("Fleet {}: could not terminate {} ({}) during delete",
                            fleetId, member.getInstanceId(), member.getLifecycle(), e);
                }
            }
            members.clear();
            try {
                compute.deleteTemplates(fleetId);
            } catch (RuntimeException e) {
                logger.error("Fleet {}: could not delete templates", fleetId, e);
            }
            generations.clear();
            logger.info("Fleet {}: deleted, {} member(s) terminated", fleetId, terminated.size());
            return terminated;
        }
    }

    public FleetState snapshot() {
        synchronized (lock) {
            FleetState.FleetStateBuilder state = FleetState.builder()
                    .fleetId(fleetId)
                    .capacity(capacity.get())
                    .healthCheckMode(healthCheckMode)
                    .templateGeneration(generations.isEmpty() ? null : currentGeneration().getNumber())
                    .liveMembers(liveCount())
                    .pendingMembers((int) members.values().stream()
                            .filter(m -> m.getLifecycle() == MemberLifecycle.PENDING).count())
                    .refreshStatus(lastRefreshStatus)
                    .refreshId(lastRefreshId)
                    .effectiveAddress(network.getEffectiveAddress())
                    .trafficTierPresent(trafficTier.isPresent());
            for (FleetMember member : members.values()) {
                state.member(new FleetState.MemberView(member.getInstanceId(), member.getGeneration(), member.getLifecycle()));
            }
            return state.build();
        }
    }

    public boolean isRefreshInProgress() {
        synchronized (lock) {
            return refresh != null;
        }
    }

    // --- internals, all called with lock held ---

    private TemplateGeneration currentGeneration() {
        return generations.get(generations.size() - 1);
    }

    private String launch(TemplateGeneration generation) {
        List<String> subnets = spec.getSubnetIds();
        String subnet = subnets.get(subnetCursor++ % subnets.size());
        String instanceId = compute.launchMember(fleetId, network, generation, subnet);
        members.put(instanceId, new FleetMember(instanceId, generation.getNumber(), subnet, clock.instant()));
        return instanceId;
    }

    private void retire(FleetMember member, String reason) {
        MemberLifecycle previous = member.getLifecycle();
        member.setLifecycle(MemberLifecycle.TERMINATING);
        try {
            compute.terminateMember(network, member.getInstanceId());
        } catch (RuntimeException e) {
            // the instance is still running, the next pass retries it
            member.setLifecycle(previous);
            throw e;
        }
        member.setLifecycle(MemberLifecycle.TERMINATED);
        members.remove(member.getInstanceId());
        logger.info("Fleet {}: retired {} (generation {}): {}", fleetId, member.getInstanceId(), member.getGeneration(), reason);
        retireUnusedGenerations();
    }

    private void checkMemberHealth() {
        Instant now = clock.instant();
        for (FleetMember member : new ArrayList<>(members.values())) {
            if (!member.isActive()) {
                continue;
            }
            MemberHealth health = compute.checkHealth(network, member.getInstanceId(), healthCheckMode);
            boolean warmedUp = !member.getLaunchedAt().plus(preferences.getInstanceWarmup()).isAfter(now);
            if (member.getLifecycle() == MemberLifecycle.PENDING) {
                if (health == MemberHealth.HEALTHY && warmedUp) {
                    member.setLifecycle(MemberLifecycle.IN_SERVICE);
                    logger.info("Fleet {}: {} in service", fleetId, member.getInstanceId());
                } else if (health == MemberHealth.UNHEALTHY && warmedUp) {
                    retire(member, "failed health checks after warmup");
                }
            } else if (health == MemberHealth.UNHEALTHY) {
                retire(member, "failed " + healthCheckMode + " health check");
            }
        }
    }

    private void scaleToDesired() {
        CapacitySettings cap = capacity.get();
        int active = activeCount();
        for (int i = active; i < cap.getDesiredCapacity(); i++) {
            launch(currentGeneration());
        }
        if (active > cap.getDesiredCapacity()) {
            List<FleetMember> surplus = members.values().stream()
                    .filter(FleetMember::isActive)
                    .sorted(Comparator.comparing((FleetMember m) -> m.isLive())
                            .thenComparing(FleetMember::getGeneration)
                            .thenComparing(FleetMember::getLaunchedAt))
                    .limit(active - cap.getDesiredCapacity())
                    .collect(Collectors.toList());
            for (FleetMember member : surplus) {
                retire(member, "above desired capacity " + cap.getDesiredCapacity());
            }
        }
    }

    private void retireUnusedGenerations() {
        if (generations.isEmpty()) {
            return;
        }
        TemplateGeneration current = currentGeneration();
        Iterator<TemplateGeneration> it = generations.iterator();
        while (it.hasNext()) {
            TemplateGeneration generation = it.next();
            if (generation == current) {
                continue;
            }
            boolean inUse = members.values().stream().anyMatch(m -> m.getGeneration() == generation.getNumber());
            if (!inUse) {
                compute.retireTemplate(fleetId, generation);
                it.remove();
                logger.info("Fleet {}: template generation {} retired", fleetId, generation.getNumber());
            }
        }
    }

    private void finishRefresh(RefreshStatus status) {
        RefreshRun run = refresh;
        if (run.task != null) {
            run.task.cancel(false);
        }
        refresh = null;
        lastRefreshStatus = status;
        logger.info("Refresh: fleet {} {} {} after {} ({} member(s) launched)",
                fleetId, run.id, status, Duration.between(run.startedAt, clock.instant()), run.fresh.size());
        retireUnusedGenerations();
    }

    private boolean hasPendingReplacement(RefreshRun run) {
        return members.values().stream()
                .anyMatch(m -> m.getLifecycle() == MemberLifecycle.PENDING && !run.stale.contains(m.getInstanceId()));
    }

    private Stream<FleetMember> staleMembers(RefreshRun run) {
        return run.stale.stream().map(members::get).filter(m -> m != null && m.isActive());
    }

    private boolean isActive(String instanceId) {
        FleetMember member = members.get(instanceId);
        return member != null && member.isActive();
    }

    private int liveCount() {
        return (int) members.values().stream().filter(FleetMember::isLive).count();
    }

    private int activeCount() {
        return (int) members.values().stream().filter(FleetMember::isActive).count();
    }

    private void ensureNotDeleted() {
        if (deleted) {
            throw new FleetNotFoundException(fleetId);
        }
    }

    private static final class RefreshRun {
        private final String id;
        private final int targetGeneration;
        private final Set<String> stale;
        private final Set<String> fresh = new LinkedHashSet<>();
        private final Instant startedAt;
        private ScheduledFuture<?> task;

        private RefreshRun(String id, int targetGeneration, Set<String> stale, Instant startedAt) {
            this.id = id;
            this.targetGeneration = targetGeneration;
            this.stale = stale;
            this.startedAt = startedAt;
        }
    }
}
