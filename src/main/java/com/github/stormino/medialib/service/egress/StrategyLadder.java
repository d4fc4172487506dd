package com.github.stormino.medialib.service.egress;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ordered, bounded list of attempts for one job. Consumed front to back; the
 * remaining rungs may be rewritten once a rung proves that the client identity,
 * not the route, is being blocked. The bound holds after every rewrite, so a
 * job always runs out of rungs in finite time.
 */
@Slf4j
public class StrategyLadder {

    private final List<AttemptDescriptor> rungs;
    private final int maxRungs;
    private int cursor = 0;

    public StrategyLadder(List<AttemptDescriptor> rungs, int maxRungs) {
        if (maxRungs < 1) {
            throw new IllegalArgumentException("maxRungs must be positive");
        }
        this.maxRungs = maxRungs;
        this.rungs = new ArrayList<>(rungs.subList(0, Math.min(rungs.size(), maxRungs)));
    }

    public boolean hasNext() {
        return cursor < rungs.size();
    }

    public AttemptDescriptor next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Strategy ladder exhausted after " + cursor + " rungs");
        }
        return rungs.get(cursor++);
    }

    /**
     * Insert {@code attempt} as the very next rung. Rungs pushed past the bound are dropped.
     *
     * @return true if the rung was inserted
     */
    public boolean insertNext(AttemptDescriptor attempt) {
        if (cursor >= maxRungs) {
            return false;
        }
        rungs.add(cursor, attempt);
        while (rungs.size() > maxRungs) {
            AttemptDescriptor dropped = rungs.remove(rungs.size() - 1);
            log.debug("Ladder bound {} reached, dropping rung [{}]", maxRungs, dropped);
        }
        return true;
    }

    /**
     * Whether {@code identity} is already used on the named route anywhere in the ladder.
     */
    public boolean containsIdentityOnRoute(String routeName, ClientIdentity identity) {
        return rungs.stream().anyMatch(rung ->
                rung.getRoute().getName().equals(routeName) && rung.getClientIdentity() == identity);
    }

    /**
     * Number of rungs already handed out.
     */
    public int position() {
        return cursor;
    }

    public int size() {
        return rungs.size();
    }

    public int getMaxRungs() {
        return maxRungs;
    }

    public List<AttemptDescriptor> getRungs() {
        return Collections.unmodifiableList(rungs);
    }
}
