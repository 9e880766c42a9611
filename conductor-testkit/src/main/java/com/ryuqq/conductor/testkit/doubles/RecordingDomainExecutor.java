package com.ryuqq.conductor.testkit.doubles;

import com.ryuqq.conductor.core.json.JsonSupport;
import com.ryuqq.conductor.core.model.ActionError;
import com.ryuqq.conductor.core.model.ActionMetadata;
import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.spi.DomainExecutor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Scripted {@link DomainExecutor} that records every request it receives.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingDomainExecutor database = RecordingDomainExecutor.succeeding(Domain.DATABASE);
 * RecordingDomainExecutor finance = RecordingDomainExecutor.failing(Domain.FINANCE, "INVOICE_LOCKED");
 * ...
 * assertEquals(0, finance.invocationCount());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingDomainExecutor implements DomainExecutor {

    private final Domain domain;
    private final Function<ActionRequest, ActionResult> behavior;
    private final List<ActionRequest> received = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch gate;

    public RecordingDomainExecutor(Domain domain, Function<ActionRequest, ActionResult> behavior) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (behavior == null) {
            throw new IllegalArgumentException("behavior cannot be null");
        }
        this.domain = domain;
        this.behavior = behavior;
    }

    /**
     * Executor answering every request with a success carrying {@code {"handledBy": "<domain>"}}.
     */
    public static RecordingDomainExecutor succeeding(Domain domain) {
        return new RecordingDomainExecutor(domain, request -> ActionResult.ok(
            request.domain(),
            request.action(),
            JsonSupport.newObject().put("handledBy", request.domain().getId()),
            new ActionMetadata(0, List.of(request.domain().getId() + "-agent"), List.of(), List.of())));
    }

    /**
     * Executor answering every request with a business failure.
     */
    public static RecordingDomainExecutor failing(Domain domain, String code) {
        return new RecordingDomainExecutor(domain, request -> ActionResult.failed(
            request.domain(),
            request.action(),
            ActionError.of(code, request.actionType() + " failed"),
            ActionMetadata.timed(0)));
    }

    /**
     * Executor that throws the given exception for every request.
     */
    public static RecordingDomainExecutor throwing(Domain domain, RuntimeException failure) {
        return new RecordingDomainExecutor(domain, request -> {
            throw failure;
        });
    }

    /**
     * Blocks every execution until {@link #release()} is called.
     *
     * @return this executor
     */
    public RecordingDomainExecutor holdUntilReleased() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public Domain domain() {
        return domain;
    }

    @Override
    public ActionResult execute(ActionRequest request) {
        received.add(request);
        CountDownLatch current = gate;
        if (current != null) {
            try {
                if (!current.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Executor for " + domain + " was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while held", e);
            }
        }
        return behavior.apply(request);
    }

    public int invocationCount() {
        return received.size();
    }

    public List<ActionRequest> receivedRequests() {
        return List.copyOf(received);
    }

    public ActionRequest lastRequest() {
        if (received.isEmpty()) {
            throw new IllegalStateException("Executor for " + domain + " has not been invoked");
        }
        return received.get(received.size() - 1);
    }
}
