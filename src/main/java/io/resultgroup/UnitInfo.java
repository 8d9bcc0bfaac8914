package io.resultgroup;

import java.time.Instant;

/**
 * Immutable metadata for a launched unit.
 */
public final class UnitInfo {

    private final long groupId;
    private final long unitId;
    private final String name;
    private final Instant launchedAt;
    private final String schedulerName;

    public UnitInfo(long groupId, long unitId, String name, Instant launchedAt, String schedulerName) {
        this.groupId = groupId;
        this.unitId = unitId;
        this.name = name;
        this.launchedAt = launchedAt;
        this.schedulerName = schedulerName;
    }

    public long groupId() {
        return groupId;
    }

    public long unitId() {
        return unitId;
    }

    public String name() {
        return name;
    }

    public Instant launchedAt() {
        return launchedAt;
    }

    public String schedulerName() {
        return schedulerName;
    }

    @Override
    public String toString() {
        return "UnitInfo{group=" + groupId + ", unit=" + unitId + ", name='" + name + "', scheduler=" + schedulerName + "}";
    }
}
