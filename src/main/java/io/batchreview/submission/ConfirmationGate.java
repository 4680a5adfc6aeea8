package io.batchreview.submission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Two-step arm/confirm guard in front of every bulk vote or submit.
 *
 * <p>Arming records the action and the Batch the human was shown and hands back a token.
 * Confirming the token within the timeout, against an unchanged Batch, mints the
 * {@link HumanConfirmation} the gateway requires. Tokens are single-use: confirming, disarming
 * or expiring removes them.
 */
public final class ConfirmationGate {
    private static final Logger LOG = LoggerFactory.getLogger(ConfirmationGate.class);

    private final long timeoutMs;
    private final LongSupplier clockMs;
    private final Map<String, ArmedConfirmation> armed;

    public ConfirmationGate(long timeoutMs) {
        this(timeoutMs, System::currentTimeMillis);
    }

    public ConfirmationGate(long timeoutMs, LongSupplier clockMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.timeoutMs = timeoutMs;
        this.clockMs = clockMs;
        this.armed = new ConcurrentHashMap<>();
    }

    public ArmedConfirmation arm(SubmissionAction action, List<String> batchIds) {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (batchIds == null || batchIds.isEmpty()) {
            throw new ConfirmationException("Nothing to confirm: the Batch is empty");
        }
        purgeExpired();
        String token = UUID.randomUUID().toString();
        ArmedConfirmation pending = new ArmedConfirmation(token, action, batchIds, clockMs.getAsLong() + timeoutMs);
        armed.put(token, pending);
        LOG.debug("Armed {} over {} change(s)", action, batchIds.size());
        return pending;
    }

    /**
     * @param currentBatchIds the Batch as it is now
     * @throws ConfirmationException when the token is unknown, used or expired, names another
     *                               action, or the Batch membership changed since arming
     */
    public HumanConfirmation confirm(String token, SubmissionAction action, List<String> currentBatchIds) {
        ArmedConfirmation pending = token == null ? null : armed.remove(token);
        if (pending == null) {
            throw new ConfirmationException("Unknown or already used confirmation");
        }
        long now = clockMs.getAsLong();
        if (now > pending.expiresAtMs()) {
            throw new ConfirmationException("Confirmation expired; arm the action again");
        }
        if (pending.action() != action) {
            throw new ConfirmationException("Armed action was " + pending.action() + ", not " + action);
        }
        if (!Set.copyOf(pending.restIds()).equals(Set.copyOf(currentBatchIds))) {
            throw new ConfirmationException("The Batch changed after the action was armed");
        }
        return new HumanConfirmation(action, pending.restIds(), now);
    }

    public boolean disarm(String token) {
        return token != null && armed.remove(token) != null;
    }

    public int pendingCount() {
        purgeExpired();
        return armed.size();
    }

    private void purgeExpired() {
        long now = clockMs.getAsLong();
        armed.values().removeIf(pending -> now > pending.expiresAtMs());
    }
}
