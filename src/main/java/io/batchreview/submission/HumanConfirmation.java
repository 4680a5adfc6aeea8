package io.batchreview.submission;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof that a human confirmed one action over one exact set of changes. Only
 * {@link ConfirmationGate} can create it, and {@link SubmissionGateway} consumes it once.
 */
public final class HumanConfirmation {
    private final SubmissionAction action;
    private final List<String> restIds;
    private final long confirmedAtMs;
    private final AtomicBoolean consumed;

    HumanConfirmation(SubmissionAction action, List<String> restIds, long confirmedAtMs) {
        this.action = action;
        this.restIds = List.copyOf(restIds);
        this.confirmedAtMs = confirmedAtMs;
        this.consumed = new AtomicBoolean(false);
    }

    public SubmissionAction action() {
        return action;
    }

    public List<String> restIds() {
        return restIds;
    }

    public long confirmedAtMs() {
        return confirmedAtMs;
    }

    public boolean consumed() {
        return consumed.get();
    }

    /**
     * Marks this confirmation used for {@code expected} over {@code ids}.
     *
     * @throws ConfirmationException if it was used before, confirms another action, or covers
     *                               other changes
     */
    void consume(SubmissionAction expected, List<String> ids) {
        if (action != expected) {
            throw new ConfirmationException("Confirmation was given for " + action + ", not " + expected);
        }
        if (!Set.copyOf(restIds).equals(Set.copyOf(ids))) {
            throw new ConfirmationException("Confirmed changes differ from the changes to act on");
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new ConfirmationException("Confirmation was already used");
        }
    }
}
