package com.platform.hacontroller.promotion;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.detection.PrimaryFailureHandler;
import com.platform.hacontroller.error.ControlPlaneException;
import com.platform.hacontroller.error.NoViablePrimaryException;
import com.platform.hacontroller.error.PromotionInProgressException;
import com.platform.hacontroller.error.PromotionTimeoutException;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.PrimaryDownEvent;
import com.platform.hacontroller.observability.LoggingConfig;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.routing.EndpointRouter;
import com.platform.hacontroller.topology.TopologyStore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Replaces a failed primary with the least-lagged replica.
 *
 * Order of a run:
 * 1. Fence the old primary (topology first, then the platform). If the platform
 *    refuses, stop and halt automation: promoting next to a live writer risks split-brain.
 * 2. Try candidates in {@link CandidateSelector} order. Each gets the promote command
 *    and must report PRIMARY within the promotion timeout, or it is fenced and the next
 *    one is tried.
 * 3. On success record the new primary and publish the next mapping generation.
 * 4. With no candidate left raise NoViablePrimary and halt automatic promotion.
 *
 * Runs are serialized on a single thread. A PrimaryDownEvent arriving while a run is
 * in flight is coalesced into it. A run id is assigned when the topology promotion flag
 * is taken, and an operator abort targets that id only.
 */
@Slf4j
@Component
public class PromotionCoordinator implements PrimaryFailureHandler {

    private final TopologyStore topologyStore;
    private final TopologyCollaborator collaborator;
    private final EndpointRouter endpointRouter;
    private final CandidateSelector candidateSelector;
    private final ControllerEventPublisher eventPublisher;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final ExecutorService promotionExecutor;
    private final Clock clock;

    private final Duration promotionTimeout;
    private final Duration pollInterval;
    private final Duration primaryAbsenceAlert;

    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicReference<String> abortTarget = new AtomicReference<>();
    private final AtomicReference<String> currentPromotionId = new AtomicReference<>();
    private final AtomicReference<PromotionResult> lastResult = new AtomicReference<>();

    private volatile Instant primaryAbsentSince;
    private volatile boolean absenceAlerted;

    public PromotionCoordinator(TopologyStore topologyStore,
                                TopologyCollaborator collaborator,
                                EndpointRouter endpointRouter,
                                CandidateSelector candidateSelector,
                                ControllerEventPublisher eventPublisher,
                                StructuredLogger structuredLogger,
                                MetricsRegistry metricsRegistry,
                                Tracer tracer,
                                @Qualifier("promotionExecutor") ExecutorService promotionExecutor,
                                HaControllerProperties properties,
                                Clock clock) {
        this.topologyStore = topologyStore;
        this.collaborator = collaborator;
        this.endpointRouter = endpointRouter;
        this.candidateSelector = candidateSelector;
        this.eventPublisher = eventPublisher;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.promotionExecutor = promotionExecutor;
        this.clock = clock;
        this.promotionTimeout = properties.getPromotion().getTimeout();
        this.pollInterval = properties.getPromotion().getPollInterval();
        this.primaryAbsenceAlert = properties.getPromotion().getPrimaryAbsenceAlert();
    }

    // ==================== Triggers ====================

    @Override
    public void onPrimaryDown(PrimaryDownEvent event) {
        if (halted.get()) {
            log.warn("Automatic promotion halted, failure of {} is handled when automation resumes", event.nodeId());
            return;
        }
        if (!topologyStore.tryBeginPromotion()) {
            log.info("Promotion {} in flight, coalescing failure of {}", currentPromotionId.get(), event.nodeId());
            metricsRegistry.incrementCounter("hacontroller.promotion.coalesced");
            return;
        }
        String promotionId = claimRun();
        submit(promotionId, () -> {
            Optional<String> primaryId = topologyStore.snapshot().primaryId();
            if (primaryId.isEmpty() || !primaryId.get().equals(event.nodeId())) {
                log.info("Discarding stale failure of {}, current primary is {}",
                    event.nodeId(), primaryId.orElse("none"));
                return record(new PromotionResult(null, PromotionResult.Outcome.DISCARDED_STALE, "detector",
                    event.nodeId(), primaryId.orElse(null), List.of(), null, clock.instant(), 0,
                    "Node is no longer the primary"));
            }
            return promote(promotionId, event.nodeId(), null, "detector");
        });
    }

    /**
     * Operator-initiated failover, bypassing quorum detection. Works while automation is halted.
     *
     * @param targetNodeId  replica to promote first, or null to use the normal candidate order
     * @param abortInFlight abort a running promotion instead of failing with PromotionInProgress
     */
    public CompletableFuture<PromotionResult> forceFailover(String targetNodeId, boolean abortInFlight) {
        if (targetNodeId != null) {
            Node target = topologyStore.node(targetNodeId)
                .orElseThrow(() -> ResourceNotFoundException.node(targetNodeId));
            if (!candidateSelector.isEligible(target)) {
                throw new ValidationException("targetNodeId", targetNodeId,
                    "must be a replica that is not judged DOWN (role " + target.role() + ", health " + target.health() + ")");
            }
        }

        if (topologyStore.tryBeginPromotion()) {
            announceManualFailover(targetNodeId);
            String promotionId = claimRun();
            return submit(promotionId, () ->
                promote(promotionId, topologyStore.snapshot().primaryId().orElse(null), targetNodeId, "manual"));
        }
        if (!abortInFlight) {
            throw new PromotionInProgressException();
        }

        String inFlight = currentPromotionId.get();
        if (inFlight != null) {
            log.warn("Aborting in-flight promotion {} for manual failover", inFlight);
            abortTarget.set(inFlight);
        } else {
            log.info("Promotion flag still held by a finishing run, queueing manual failover behind it");
        }
        announceManualFailover(targetNodeId);
        // queued behind the aborted run on the single promotion thread
        return CompletableFuture.supplyAsync(() -> {
            if (!topologyStore.tryBeginPromotion()) {
                throw new PromotionInProgressException();
            }
            String promotionId = claimRun();
            return runClaimed(promotionId, () ->
                promote(promotionId, topologyStore.snapshot().primaryId().orElse(null), targetNodeId, "manual"));
        }, promotionExecutor);
    }

    /**
     * Re-enable automatic promotion after a fail-stop. A promotion starts if there is no
     * primary, or if the primary was judged DOWN while automation was halted.
     *
     * @return false if automation was not halted
     */
    public boolean resumeAutomaticPromotion() {
        if (!halted.getAndSet(false)) {
            return false;
        }
        structuredLogger.failover().automationResumed("operator");
        eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.AUTOMATIC_PROMOTION_RESUMED, null,
            "Automatic promotion re-enabled by operator"));

        Optional<Node> primary = topologyStore.snapshot().primary();
        boolean primaryDown = primary.isPresent() && primary.get().health() == HealthStatus.DOWN;
        if ((primary.isEmpty() || primaryDown) && topologyStore.tryBeginPromotion()) {
            String oldPrimaryId = primary.map(Node::id).orElse(null);
            if (primaryDown) {
                log.info("Primary {} is DOWN after resume, starting a promotion", oldPrimaryId);
            } else {
                log.info("No primary after resume, starting a promotion");
            }
            String promotionId = claimRun();
            submit(promotionId, () -> promote(promotionId, oldPrimaryId, null, "resume"));
        }
        return true;
    }

    // ==================== Promotion run ====================

    /**
     * Assign the id of a run whose caller has just taken the topology promotion flag.
     */
    private String claimRun() {
        String promotionId = UUID.randomUUID().toString().substring(0, 8);
        currentPromotionId.set(promotionId);
        return promotionId;
    }

    private CompletableFuture<PromotionResult> submit(String promotionId, Supplier<PromotionResult> work) {
        return CompletableFuture.supplyAsync(() -> runClaimed(promotionId, work), promotionExecutor);
    }

    private PromotionResult runClaimed(String promotionId, Supplier<PromotionResult> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("Promotion run failed unexpectedly: {}", e.getMessage(), e);
            throw e;
        } finally {
            abortTarget.compareAndSet(promotionId, null);
            currentPromotionId.compareAndSet(promotionId, null);
            topologyStore.endPromotion();
        }
    }

    private boolean abortRequested(String promotionId) {
        return promotionId.equals(abortTarget.get());
    }

    /**
     * One promotion run. Caller holds the topology promotion flag under {@code promotionId}.
     */
    PromotionResult promote(String promotionId, String oldPrimaryId, String preferredTarget, String trigger) {
        RunContext run = new RunContext(promotionId, trigger, oldPrimaryId, clock.instant(), System.nanoTime());
        LoggingConfig.setPromotionContext(promotionId);

        Span span = tracer.spanBuilder("ha.promotion")
            .setAttribute("ha.promotion.id", promotionId)
            .setAttribute("ha.promotion.trigger", trigger)
            .setAttribute("ha.promotion.old_primary", String.valueOf(oldPrimaryId))
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            log.info("Promotion {} started by {} (old primary {})", promotionId, trigger, oldPrimaryId);

            if (abortRequested(promotionId)) {
                return finish(run, span, PromotionResult.Outcome.ABORTED, null, null, "Aborted before start");
            }

            if (oldPrimaryId != null && !fenceOldPrimary(oldPrimaryId)) {
                halt("Fencing of " + oldPrimaryId + " failed");
                return finish(run, span, PromotionResult.Outcome.FENCING_FAILED, null, null,
                    "Old primary " + oldPrimaryId + " could not be fenced");
            }

            for (Node candidate : rankCandidates(preferredTarget)) {
                if (abortRequested(promotionId)) {
                    return finish(run, span, PromotionResult.Outcome.ABORTED, null, null, "Aborted by operator");
                }
                run.attempted.add(candidate.id());
                try {
                    if (!attempt(promotionId, candidate, oldPrimaryId, trigger)) {
                        fenceFailedCandidate(candidate.id());
                        return finish(run, span, PromotionResult.Outcome.ABORTED, null, null,
                            "Aborted while waiting for " + candidate.id());
                    }
                    topologyStore.setRole(candidate.id(), NodeRole.PRIMARY);
                    EndpointMapping mapping = endpointRouter.publish();
                    announcePromoted(run, candidate.id(), mapping);
                    return finish(run, span, PromotionResult.Outcome.PROMOTED, candidate.id(), mapping.generation(),
                        "Promoted " + candidate.id());
                } catch (PromotionTimeoutException e) {
                    log.warn("{}", e.getMessage());
                    structuredLogger.failover().promotionFailed(candidate.id(), e.getErrorCode().getCode(), e.getMessage());
                    eventPublisher.publish(ControllerEvent.warning(ControllerEvent.EventType.PROMOTION_TIMEOUT,
                        candidate.id(), e.getMessage()));
                    fenceFailedCandidate(candidate.id());
                } catch (ControlPlaneException e) {
                    log.warn("Promotion of {} failed: {}", candidate.id(), e.getMessage());
                    structuredLogger.failover().promotionFailed(candidate.id(), e.getErrorCode().getCode(), e.getMessage());
                    fenceFailedCandidate(candidate.id());
                }
            }

            NoViablePrimaryException failure = new NoViablePrimaryException(run.attempted);
            log.error("{}", failure.getMessage());
            eventPublisher.publish(ControllerEvent.critical(ControllerEvent.EventType.NO_VIABLE_PRIMARY,
                oldPrimaryId, failure.getMessage()));
            halt(failure.getMessage());
            span.recordException(failure);
            return finish(run, span, PromotionResult.Outcome.NO_VIABLE_PRIMARY, null, null, failure.getMessage());
        } finally {
            span.end();
            LoggingConfig.clearPromotionContext();
        }
    }

    /**
     * @return true once the candidate reports PRIMARY, false if the run was aborted meanwhile
     * @throws PromotionTimeoutException if the candidate does not report PRIMARY in time
     */
    private boolean attempt(String promotionId, Node candidate, String oldPrimaryId, String trigger) {
        topologyStore.setRole(candidate.id(), NodeRole.CANDIDATE);
        structuredLogger.failover().promotionStarted(oldPrimaryId, candidate.id(), trigger);
        eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.PROMOTION_STARTED, candidate.id(),
            "Promoting " + candidate.id() + " (lag " + candidate.lag() + ")"));

        collaborator.setNodeRole(candidate.id(), NodeRole.PRIMARY);
        return awaitPrimaryRole(promotionId, candidate.id());
    }

    private boolean awaitPrimaryRole(String promotionId, String nodeId) {
        long deadline = System.nanoTime() + promotionTimeout.toNanos();
        while (true) {
            if (abortRequested(promotionId)) {
                return false;
            }
            if (reportsPrimary(nodeId)) {
                return true;
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new PromotionTimeoutException(nodeId, promotionTimeout);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to report PRIMARY", nodeId);
                return false;
            }
        }
    }

    private boolean reportsPrimary(String nodeId) {
        try {
            return collaborator.listNodes().stream()
                .anyMatch(n -> n.id().equals(nodeId) && n.role() == NodeRole.PRIMARY);
        } catch (RuntimeException e) {
            log.debug("Could not read node roles while waiting for {}: {}", nodeId, e.getMessage());
            return false;
        }
    }

    private List<Node> rankCandidates(String preferredTarget) {
        List<Node> ranked = new ArrayList<>(candidateSelector.rank(topologyStore.snapshot()));
        if (preferredTarget != null) {
            boolean moved = ranked.removeIf(n -> n.id().equals(preferredTarget));
            if (moved) {
                ranked.add(0, topologyStore.node(preferredTarget).orElseThrow());
            } else {
                log.warn("Requested target {} is no longer eligible, using normal candidate order", preferredTarget);
            }
        }
        log.info("Promotion candidates: {}", ranked.stream().map(Node::id).collect(Collectors.toList()));
        return ranked;
    }

    // ==================== Fencing ====================

    private boolean fenceOldPrimary(String nodeId) {
        Optional<Node> node = topologyStore.node(nodeId);
        if (node.isEmpty() || node.get().isFenced()) {
            return true;
        }
        topologyStore.setRole(nodeId, NodeRole.FENCED);
        try {
            collaborator.setNodeRole(nodeId, NodeRole.FENCED);
        } catch (RuntimeException e) {
            metricsRegistry.recordFencing(nodeId, false);
            structuredLogger.failover().nodeFenced(nodeId, false, e.getMessage());
            eventPublisher.publish(ControllerEvent.critical(ControllerEvent.EventType.FENCING_FAILED, nodeId,
                "Could not revoke writes on " + nodeId + ": " + e.getMessage()));
            return false;
        }
        metricsRegistry.recordFencing(nodeId, true);
        structuredLogger.failover().nodeFenced(nodeId, true, null);
        eventPublisher.publish(ControllerEvent.warning(ControllerEvent.EventType.NODE_FENCED, nodeId,
            "Writes revoked on old primary " + nodeId));
        return true;
    }

    private void fenceFailedCandidate(String nodeId) {
        try {
            topologyStore.setRole(nodeId, NodeRole.FENCED);
        } catch (ResourceNotFoundException e) {
            log.debug("Candidate {} already left the topology", nodeId);
        }
        try {
            collaborator.setNodeRole(nodeId, NodeRole.FENCED);
            metricsRegistry.recordFencing(nodeId, true);
            structuredLogger.failover().nodeFenced(nodeId, true, null);
        } catch (RuntimeException e) {
            metricsRegistry.recordFencing(nodeId, false);
            structuredLogger.failover().nodeFenced(nodeId, false, e.getMessage());
            eventPublisher.publish(ControllerEvent.critical(ControllerEvent.EventType.FENCING_FAILED, nodeId,
                "Could not fence failed candidate " + nodeId + ": " + e.getMessage()));
        }
    }

    // ==================== Outcome ====================

    private void halt(String reason) {
        halted.set(true);
        structuredLogger.failover().automationHalted(reason);
    }

    private void announceManualFailover(String targetNodeId) {
        eventPublisher.publish(ControllerEvent.warning(ControllerEvent.EventType.MANUAL_FAILOVER, targetNodeId,
            targetNodeId != null ? "Manual failover to " + targetNodeId : "Manual failover requested"));
    }

    private void announcePromoted(RunContext run, String newPrimaryId, EndpointMapping mapping) {
        long durationMs = run.elapsedMs();
        structuredLogger.failover().promotionCompleted(newPrimaryId, durationMs, mapping.generation());
        eventPublisher.publish(ControllerEvent.create(ControllerEvent.EventType.PRIMARY_PROMOTED,
            ControllerEvent.Severity.WARNING, newPrimaryId,
            "Promoted " + newPrimaryId + " in " + durationMs + "ms",
            Map.of("oldPrimary", String.valueOf(run.oldPrimaryId),
                "generation", mapping.generation(),
                "attempted", List.copyOf(run.attempted))));
    }

    private PromotionResult finish(RunContext run, Span span, PromotionResult.Outcome outcome,
                                   String newPrimaryId, Long generation, String message) {
        long durationMs = run.elapsedMs();
        metricsRegistry.recordPromotion(outcome.name(), durationMs);
        span.setAttribute("ha.promotion.outcome", outcome.name());
        span.setStatus(outcome == PromotionResult.Outcome.PROMOTED ? StatusCode.OK : StatusCode.ERROR, message);
        log.info("Promotion {} finished: {} in {}ms", run.promotionId, outcome, durationMs);
        return record(new PromotionResult(run.promotionId, outcome, run.trigger, run.oldPrimaryId, newPrimaryId,
            List.copyOf(run.attempted), generation, run.startedAt, durationMs, message));
    }

    private PromotionResult record(PromotionResult result) {
        lastResult.set(result);
        return result;
    }

    // ==================== Watchdog & status ====================

    /**
     * Raise one PRIMARY_ABSENT alert per episode in which no node has been PRIMARY
     * for longer than the configured limit.
     */
    @Scheduled(fixedDelayString = "${hacontroller.promotion.watchdog-interval-ms:5000}")
    public void checkPrimaryPresence() {
        Instant now = clock.instant();
        if (topologyStore.snapshot().primary().isPresent()) {
            primaryAbsentSince = null;
            absenceAlerted = false;
            return;
        }
        if (primaryAbsentSince == null) {
            primaryAbsentSince = now;
            return;
        }
        Duration absent = Duration.between(primaryAbsentSince, now);
        if (!absenceAlerted && absent.compareTo(primaryAbsenceAlert) >= 0) {
            absenceAlerted = true;
            eventPublisher.publish(ControllerEvent.critical(ControllerEvent.EventType.PRIMARY_ABSENT, null,
                "No primary for " + absent.toSeconds() + "s"
                    + (halted.get() ? ", automatic promotion halted" : "")));
        }
    }

    public PromotionStatus status() {
        return new PromotionStatus(topologyStore.isPromotionInProgress(), halted.get(),
            currentPromotionId.get(), lastResult.get(), primaryAbsentSince);
    }

    public boolean isHalted() {
        return halted.get();
    }

    public Optional<PromotionResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    /**
     * Wait for a running promotion to end, up to the given time. Used on shutdown.
     */
    public boolean awaitIdle(Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (topologyStore.isPromotionInProgress()) {
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private static final class RunContext {
        private final String promotionId;
        private final String trigger;
        private final String oldPrimaryId;
        private final Instant startedAt;
        private final long startNanos;
        private final List<String> attempted = new ArrayList<>();

        RunContext(String promotionId, String trigger, String oldPrimaryId, Instant startedAt, long startNanos) {
            this.promotionId = promotionId;
            this.trigger = trigger;
            this.oldPrimaryId = oldPrimaryId;
            this.startedAt = startedAt;
            this.startNanos = startNanos;
        }

        long elapsedMs() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }
    }
}
