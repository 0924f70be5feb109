package com.amqpclient.address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, cyclic list of targets a connection may be (re)opened to.
 *
 * The cycle is always the originally requested address followed by the
 * failover addresses. A sticky override, while set, replaces the cycle for
 * reconnect attempts without moving the cursor. The very first attempt of a
 * connection always goes to the original address.
 *
 * Not thread safe: owned by a single connection engine and only touched from
 * its event loop.
 */
public final class CandidateList {

    private final ConnectionTarget original;
    private List<ConnectionTarget> failover = Collections.emptyList();
    private ConnectionTarget override;

    // Index of the next cycle entry to try. May equal the cycle length after
    // the last entry was used, it wraps when the next target is selected so a
    // failover list that grows in between is picked up where the cycle left off.
    private int cursor;

    public CandidateList(ConnectionTarget original) {
        this.original = Objects.requireNonNull(original, "original");
    }

    public CandidateList(ConnectionTarget original, List<ConnectionTarget> failover) {
        this(original);
        setFailover(failover);
    }

    /**
     * Select the target for the next connection attempt.
     *
     * @param firstAttempt true for the initial attempt made by connect()
     */
    public ConnectionTarget nextTarget(boolean firstAttempt) {
        if (firstAttempt) {
            return original;
        }
        if (override != null) {
            return override;
        }
        int size = size();
        if (cursor >= size) {
            cursor = 0;
        }
        ConnectionTarget target = cursor == 0 ? original : failover.get(cursor - 1);
        cursor++;
        return target;
    }

    /**
     * Replace the failover addresses. The cursor is kept as is.
     */
    public void setFailover(List<ConnectionTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            failover = Collections.emptyList();
        } else {
            failover = Collections.unmodifiableList(new ArrayList<>(targets));
        }
    }

    /**
     * Set or, with null, clear the sticky override.
     */
    public void setOverride(ConnectionTarget target) {
        this.override = target;
    }

    public ConnectionTarget getOriginal() {
        return original;
    }

    public ConnectionTarget getOverride() {
        return override;
    }

    public boolean hasOverride() {
        return override != null;
    }

    public List<ConnectionTarget> getFailover() {
        return failover;
    }

    /**
     * Length of the cycle: the original address plus the failover addresses.
     */
    public int size() {
        return 1 + failover.size();
    }

    public int getCursor() {
        return cursor;
    }

    @Override
    public String toString() {
        return String.format("CandidateList{original=%s, failover=%s, override=%s, cursor=%d}",
                           original, failover, override, cursor);
    }
}
