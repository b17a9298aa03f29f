package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.LadderStatus;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Per-position ladder state: the configured rungs, which of them have fired, and the
 * current status.
 *
 * <p>Rungs fire strictly in order. {@link #nextLevel()} only ever returns the first unused
 * rung, so a deeper rung cannot fire before a shallower one and no rung fires twice.
 */
public class DcaLadderState {

    private final List<DcaLevel> levels;
    private final BitSet triggered;
    private LadderStatus status;
    private int lastTriggeredLevel;

    public DcaLadderState(List<DcaLevel> levels) {
        this.levels = List.copyOf(levels);
        this.triggered = new BitSet(levels.size());
        this.status = levels.isEmpty() ? LadderStatus.EXHAUSTED : LadderStatus.IDLE;
    }

    public static DcaLadderState disabled() {
        return new DcaLadderState(List.of());
    }

    public Optional<DcaLevel> nextLevel() {
        int index = triggered.nextClearBit(0);
        return index < levels.size() ? Optional.of(levels.get(index)) : Optional.empty();
    }

    /**
     * The deepest rung that has not fired yet. Rungs fire in order, so while any rung is
     * unused the last configured rung is still armed.
     */
    public Optional<DcaLevel> deepestArmedLevel() {
        return nextLevel().map(next -> levels.get(levels.size() - 1));
    }

    /**
     * Marks a rung as used.
     *
     * @throws IllegalStateException if the rung is not the next unused one
     */
    public void markTriggered(DcaLevel level) {
        DcaLevel expected = nextLevel().orElseThrow(() -> new IllegalStateException("Ladder already exhausted"));
        if (expected.level() != level.level()) {
            throw new IllegalStateException(
                    "Ladder level " + level.level() + " triggered out of order, expected " + expected.level());
        }
        triggered.set(level.level() - 1);
        lastTriggeredLevel = level.level();
        status = LadderStatus.LEVEL_TRIGGERED;
    }

    /** Leaves LEVEL_TRIGGERED once the triggered order has been sized. */
    public void settle() {
        status = triggered.cardinality() >= levels.size() ? LadderStatus.EXHAUSTED : LadderStatus.IDLE;
    }

    public boolean isTriggered(int level) {
        return level >= 1 && level <= levels.size() && triggered.get(level - 1);
    }

    public int getTriggeredCount() {
        return triggered.cardinality();
    }

    public LadderStatus getStatus() {
        return status;
    }

    public int getLastTriggeredLevel() {
        return lastTriggeredLevel;
    }

    public List<DcaLevel> getLevels() {
        return levels;
    }

    public List<Integer> getTriggeredLevels() {
        List<Integer> result = new ArrayList<>();
        triggered.stream().forEach(i -> result.add(i + 1));
        return result;
    }
}
