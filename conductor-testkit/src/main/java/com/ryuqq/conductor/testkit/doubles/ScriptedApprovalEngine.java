package com.ryuqq.conductor.testkit.doubles;

import com.ryuqq.conductor.core.spi.approval.ApprovalDecision;
import com.ryuqq.conductor.core.spi.approval.ApprovalEngine;
import com.ryuqq.conductor.core.spi.approval.ApprovalException;
import com.ryuqq.conductor.core.spi.approval.ApprovalRequest;
import com.ryuqq.conductor.core.spi.approval.ApprovalVerdict;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted {@link ApprovalEngine}.
 *
 * <p>Modes:</p>
 * <ul>
 *   <li>{@link #autoApproving()}: returns {@code auto-approved-N} ids, never waits</li>
 *   <li>{@link #deciding(ApprovalVerdict, String)}: pending ids, wait returns the scripted decision</li>
 *   <li>{@link #expiring(String)}: pending ids, wait throws {@link ApprovalException}</li>
 *   <li>{@link #neverDeciding()}: pending ids, wait blocks until released or 10 seconds</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedApprovalEngine implements ApprovalEngine {

    private enum Mode { AUTO, DECIDE, EXPIRE, BLOCK }

    private final Mode mode;
    private final ApprovalVerdict verdict;
    private final String message;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<ApprovalRequest> requests = new CopyOnWriteArrayList<>();
    private final List<String> waitedOn = new CopyOnWriteArrayList<>();
    private final CountDownLatch release = new CountDownLatch(1);

    private ScriptedApprovalEngine(Mode mode, ApprovalVerdict verdict, String message) {
        this.mode = mode;
        this.verdict = verdict;
        this.message = message;
    }

    public static ScriptedApprovalEngine autoApproving() {
        return new ScriptedApprovalEngine(Mode.AUTO, ApprovalVerdict.APPROVED, null);
    }

    public static ScriptedApprovalEngine deciding(ApprovalVerdict verdict, String reason) {
        return new ScriptedApprovalEngine(Mode.DECIDE, verdict, reason);
    }

    public static ScriptedApprovalEngine expiring(String message) {
        return new ScriptedApprovalEngine(Mode.EXPIRE, ApprovalVerdict.EXPIRED, message);
    }

    public static ScriptedApprovalEngine neverDeciding() {
        return new ScriptedApprovalEngine(Mode.BLOCK, ApprovalVerdict.APPROVED, null);
    }

    @Override
    public String requestApproval(ApprovalRequest request) {
        requests.add(request);
        int id = sequence.incrementAndGet();
        return mode == Mode.AUTO ? "auto-approved-" + id : "approval-" + id;
    }

    @Override
    public ApprovalDecision waitForApproval(String requestId) {
        waitedOn.add(requestId);
        switch (mode) {
            case EXPIRE:
                throw new ApprovalException(requestId, message);
            case BLOCK:
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ApprovalException(requestId, "interrupted", e);
                }
                return new ApprovalDecision(requestId, ApprovalVerdict.APPROVED, "operator", null);
            default:
                return new ApprovalDecision(requestId, verdict, "operator", message);
        }
    }

    /**
     * Unblocks waits in {@link #neverDeciding()} mode.
     */
    public void release() {
        release.countDown();
    }

    public List<ApprovalRequest> requests() {
        return List.copyOf(requests);
    }

    public List<String> waitedOn() {
        return List.copyOf(waitedOn);
    }
}
