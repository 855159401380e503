package com.purchasingpower.toolagent.agent;

import com.google.common.base.Preconditions;
import com.purchasingpower.toolagent.agent.ToolNotification.EventType;
import com.purchasingpower.toolagent.core.ActiveExecution;
import com.purchasingpower.toolagent.core.CacheKeyGenerator;
import com.purchasingpower.toolagent.core.Clock;
import com.purchasingpower.toolagent.core.CompletionHistory;
import com.purchasingpower.toolagent.core.CompletionRecord;
import com.purchasingpower.toolagent.core.CompletionRecord.Outcome;
import com.purchasingpower.toolagent.core.ExecutionSlot;
import com.purchasingpower.toolagent.core.ImmutableParams;
import com.purchasingpower.toolagent.core.MetricsSnapshot;
import com.purchasingpower.toolagent.core.RateLimitDecision;
import com.purchasingpower.toolagent.core.RequestPriority;
import com.purchasingpower.toolagent.core.RequestQueue;
import com.purchasingpower.toolagent.core.ResultCache;
import com.purchasingpower.toolagent.core.SlidingWindowRateLimiter;
import com.purchasingpower.toolagent.core.SystemClock;
import com.purchasingpower.toolagent.core.ToolAgentMetrics;
import com.purchasingpower.toolagent.core.ToolRequest;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives every tool request of one agent through its lifecycle:
 * <pre>
 *   Submitted -> RateChecked -> CacheHit                     (terminal RESULT, fromCache)
 *                            -> Queued -> Dispatched -> Completed (terminal RESULT / ERROR / CANCELLED)
 *             -> RateLimited                                (terminal)
 *   Queued    -> Cancelled                                  (terminal)
 * </pre>
 *
 * <p>At most one request executes at a time. Execution runs on the supplied
 * {@link Executor}; when it finishes, the slot is freed, the cache and metrics
 * are updated and the next queued request is dispatched immediately.
 *
 * <p>Every submitted request produces exactly one terminal notification. Failures
 * are never retried here; only a rate-limit denial carries a retry hint.
 *
 * <p>All state belongs to this instance and is guarded by its monitor. Separate
 * managers share nothing.
 *
 * @since 1.0.0
 */
@Slf4j
public class ToolRequestLifecycleManager {

    @Getter
    private final String agentName;

    @Getter
    private final String toolName;

    private final ToolInvoker invoker;
    private final ToolRequestHooks hooks;
    private final Executor executor;
    private final ToolNotificationSink notificationSink;
    private final Clock clock;
    private final CacheKeyGenerator cacheKeyGenerator;

    private final SlidingWindowRateLimiter rateLimiter;
    private final ResultCache cache;
    private final CompletionHistory history;
    private final RequestQueue queue = new RequestQueue();
    private final ExecutionSlot slot = new ExecutionSlot();
    private final ToolAgentMetrics metrics = new ToolAgentMetrics();
    private final AtomicLong requestSequence = new AtomicLong();

    @Builder
    public ToolRequestLifecycleManager(String agentName,
                                       String toolName,
                                       ToolAgentSettings settings,
                                       ToolInvoker invoker,
                                       ToolRequestHooks hooks,
                                       Executor executor,
                                       ToolNotificationSink notificationSink,
                                       Clock clock,
                                       CacheKeyGenerator cacheKeyGenerator) {
        Preconditions.checkNotNull(toolName, "Tool name cannot be null");
        Preconditions.checkNotNull(invoker, "Tool invoker cannot be null");
        Preconditions.checkNotNull(executor, "Executor cannot be null");
        Preconditions.checkNotNull(notificationSink, "Notification sink cannot be null");

        ToolAgentSettings resolved = settings != null ? settings : ToolAgentSettings.builder().build();
        this.toolName = toolName;
        this.agentName = agentName != null ? agentName : toolName + "_agent";
        this.invoker = invoker;
        this.hooks = hooks != null ? hooks : ToolRequestHooks.NONE;
        this.executor = executor;
        this.notificationSink = notificationSink;
        this.clock = clock != null ? clock : SystemClock.instance();
        this.cacheKeyGenerator = cacheKeyGenerator != null ? cacheKeyGenerator : new CacheKeyGenerator();
        this.rateLimiter = new SlidingWindowRateLimiter(this.clock, resolved.getRateLimitWindowMs(), resolved.getRateLimitMax());
        this.cache = new ResultCache(this.clock, resolved.getCacheTtlMs());
        this.history = new CompletionHistory(resolved.getMaxHistorySize());
    }

    public String submit(Map<String, Object> params) {
        return submit(params, RequestPriority.NORMAL, null);
    }

    public String submit(Map<String, Object> params, RequestPriority priority) {
        return submit(params, priority, null);
    }

    /**
     * Admit, answer from cache, or queue a request. Never blocks on tool execution.
     *
     * @param requestId caller-chosen id, or null to generate one
     * @return the request id used in every notification for this request
     */
    public synchronized String submit(Map<String, Object> params, RequestPriority priority, String requestId) {
        String id = requestId != null && !requestId.isBlank() ? requestId : nextRequestId();
        // the cache key and the queued request both derive from this snapshot
        Map<String, Object> safeParams = ImmutableParams.copyOf(params);

        RateLimitDecision decision = rateLimiter.admit();
        if (!decision.allowed()) {
            log.warn("[{}] Rate limit exceeded, rejecting request {} (retry after {}s)",
                agentName, id, decision.retryAfterSeconds());
            publish(notification(id, EventType.RATE_LIMITED)
                .error("Rate limit exceeded")
                .retryAfterSeconds(decision.retryAfterSeconds())
                .build());
            return id;
        }

        String cacheKey;
        try {
            cacheKey = cacheKeyGenerator.generate(safeParams);
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Rejecting request {}: {}", agentName, id, e.getMessage());
            metrics.recordFailure();
            history.record(new CompletionRecord(id, Outcome.FAILURE, 0L, Instant.now()));
            publish(notification(id, EventType.ERROR)
                .error("Validation failed: " + e.getMessage())
                .build());
            return id;
        }

        Optional<Object> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("[{}] Cache hit for request {}", agentName, id);
            metrics.recordCacheHit();
            publish(notification(id, EventType.RESULT)
                .result(cached.get())
                .fromCache(true)
                .build());
            return id;
        }

        ToolRequest request = ToolRequest.builder()
            .id(id)
            .params(safeParams)
            .priority(priority != null ? priority : RequestPriority.NORMAL)
            .createdAt(clock.nowMillis())
            .cacheKey(cacheKey)
            .build();
        queue.enqueue(request);
        log.debug("[{}] Queued request {} with priority {} (queue length {})",
            agentName, id, request.getPriority(), queue.size());

        tryDispatch();
        return id;
    }

    /**
     * Best-effort cancellation. A queued request is removed and reported as
     * cancelled right away. An executing request keeps running; its outcome is
     * still cached and counted, but it reports as cancelled instead of
     * result/error when it finishes.
     */
    public synchronized CancelOutcome cancel(String requestId) {
        if (requestId == null) {
            return CancelOutcome.NOT_FOUND;
        }
        if (queue.remove(requestId)) {
            log.info("[{}] Cancelled queued request {}", agentName, requestId);
            publish(notification(requestId, EventType.CANCELLED).build());
            return CancelOutcome.CANCELLED;
        }
        if (slot.markCancelled(requestId)) {
            log.info("[{}] Request {} is executing, flagged as cancelled", agentName, requestId);
            return CancelOutcome.CANCELLATION_REQUESTED;
        }
        log.debug("[{}] Cancel for unknown or finished request {}", agentName, requestId);
        return CancelOutcome.NOT_FOUND;
    }

    /**
     * Publish an intermediate progress update for the executing request.
     *
     * @return false if {@code requestId} is not the executing request
     */
    public synchronized boolean reportProgress(String requestId, Object progress) {
        if (!slot.contains(requestId)) {
            return false;
        }
        publish(notification(requestId, EventType.PROGRESS)
            .result(progress)
            .build());
        return true;
    }

    public synchronized MetricsSnapshot getMetrics() {
        return metrics.snapshot(queue.size(), slot.activeCount(), cache.size(), history.snapshot());
    }

    /**
     * Most recent completions, newest first.
     */
    public synchronized List<CompletionRecord> getHistory() {
        return history.snapshot();
    }

    public synchronized void clearCache() {
        int cleared = cache.size();
        cache.clear();
        log.info("[{}] Cleared {} cached results", agentName, cleared);
    }

    public synchronized int getQueueLength() {
        return queue.size();
    }

    public synchronized int getActiveCount() {
        return slot.activeCount();
    }

    // Caller holds the monitor.
    private void tryDispatch() {
        if (slot.isOccupied()) {
            return;
        }
        Optional<ToolRequest> next = queue.dequeue();
        if (next.isEmpty()) {
            return;
        }

        ToolRequest request = next.get();
        slot.tryOccupy(request, clock.nowMillis());
        log.debug("[{}] Dispatching request {}", agentName, request.getId());
        publish(notification(request.getId(), EventType.STARTED).build());

        try {
            executor.execute(() -> execute(request));
        } catch (RejectedExecutionException e) {
            log.error("[{}] Executor rejected request {}", agentName, request.getId(), e);
            complete(request, Completion.failure("Execution rejected: " + e.getMessage()), 0L);
        }
    }

    // Runs on the executor, outside the monitor.
    private void execute(ToolRequest request) {
        long startedAt = clock.nowMillis();
        Completion completion = null;
        try {
            completion = invoke(request);
        } catch (Exception e) {
            log.error("[{}] Tool {} failed for request {}", agentName, toolName, request.getId(), e);
            completion = Completion.failure("Tool execution failed: " + e.getMessage());
        } finally {
            if (completion == null) {
                completion = Completion.failure("Tool execution aborted");
            }
            complete(request, completion, clock.nowMillis() - startedAt);
        }
    }

    private Completion invoke(ToolRequest request) {
        ParamValidation validation = hooks.validateParams(request.getParams());
        if (validation == null || !validation.valid()) {
            String reason = validation != null ? validation.reason() : "validator returned no result";
            log.debug("[{}] Request {} failed validation: {}", agentName, request.getId(), reason);
            return Completion.failure("Validation failed: " + reason);
        }

        Map<String, Object> params = validation.params() != null ? validation.params() : request.getParams();
        ToolResult result = invoker.invoke(toolName, params);
        if (result == null) {
            return Completion.failure("Tool returned no result");
        }
        if (!result.isSuccess()) {
            String message = result.getMessage() != null ? result.getMessage() : "Tool execution failed";
            return Completion.failure(message);
        }
        return Completion.success(hooks.processResult(result.getData(), request));
    }

    private synchronized void complete(ToolRequest request, Completion completion, long executionTimeMs) {
        boolean cancelled = slot.release(request.getId())
            .map(ActiveExecution::isCancelled)
            .orElse(false);

        if (completion.success()) {
            if (completion.result() != null) {
                cache.put(request.getCacheKey(), completion.result());
            }
            metrics.recordSuccess(executionTimeMs);
        } else {
            metrics.recordFailure();
            log.error("[{}] Request {} failed: {}", agentName, request.getId(), completion.error());
        }

        Outcome outcome = cancelled ? Outcome.CANCELLED : completion.success() ? Outcome.SUCCESS : Outcome.FAILURE;
        history.record(new CompletionRecord(request.getId(), outcome, executionTimeMs, Instant.now()));

        if (cancelled) {
            publish(notification(request.getId(), EventType.CANCELLED)
                .executionTimeMs(executionTimeMs)
                .build());
        } else if (completion.success()) {
            publish(notification(request.getId(), EventType.RESULT)
                .result(completion.result())
                .fromCache(false)
                .executionTimeMs(executionTimeMs)
                .build());
        } else {
            publish(notification(request.getId(), EventType.ERROR)
                .error(completion.error())
                .executionTimeMs(executionTimeMs)
                .build());
        }

        tryDispatch();
    }

    private ToolNotification.ToolNotificationBuilder notification(String requestId, EventType type) {
        return ToolNotification.builder()
            .agentName(agentName)
            .toolName(toolName)
            .requestId(requestId)
            .type(type);
    }

    /**
     * Publish an agent-level notification (not tied to a request) through the
     * same guarded path as request notifications.
     */
    synchronized void publishAgentEvent(EventType type) {
        ToolNotification.ToolNotificationBuilder builder = ToolNotification.builder()
            .agentName(agentName)
            .toolName(toolName)
            .type(type);
        if (type == EventType.METRICS_REPORT) {
            builder.metrics(getMetrics());
        }
        publish(builder.build());
    }

    private void publish(ToolNotification notification) {
        try {
            notificationSink.publish(notification);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to publish {} notification for request {}",
                agentName, notification.getType(), notification.getRequestId(), e);
        }
    }

    private String nextRequestId() {
        return toolName + "_" + requestSequence.incrementAndGet();
    }

    private record Completion(boolean success, Object result, String error) {

        static Completion success(Object result) {
            return new Completion(true, result, null);
        }

        static Completion failure(String error) {
            return new Completion(false, null, error);
        }
    }
}
