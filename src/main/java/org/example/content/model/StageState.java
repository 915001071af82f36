package org.example.content.model;

import java.time.Instant;

/**
 * Mutable per-stage state owned by a {@link ProgressRecord}.
 */
public class StageState {

    private StageStatus status = StageStatus.PENDING;
    private Instant startTime;
    private Instant endTime;
    private double durationSeconds;
    private int totalItems;
    private int completedItems;
    private double avgScore;
    private int errorCount;
    private String message = "";

    public StageState() {
    }

    public static StageState fromSnapshot(StageStateSnapshot snapshot) {
        StageState state = new StageState();
        state.status = snapshot.status();
        state.startTime = snapshot.startTime();
        state.endTime = snapshot.endTime();
        state.durationSeconds = snapshot.durationSeconds();
        state.totalItems = Math.max(0, snapshot.totalItems());
        state.completedItems = Math.max(0, snapshot.completedItems());
        state.avgScore = snapshot.avgScore();
        state.errorCount = Math.max(0, snapshot.errorCount());
        state.message = snapshot.message();
        return state;
    }

    public StageStateSnapshot toSnapshot() {
        return new StageStateSnapshot(
                status,
                startTime,
                endTime,
                durationSeconds,
                totalItems,
                completedItems,
                avgScore,
                errorCount,
                message
        );
    }

    public StageStatus getStatus() {
        return status;
    }

    public void setStatus(StageStatus status) {
        this.status = status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public int getCompletedItems() {
        return completedItems;
    }

    public void setCompletedItems(int completedItems) {
        this.completedItems = completedItems;
    }

    public double getAvgScore() {
        return avgScore;
    }

    public void setAvgScore(double avgScore) {
        this.avgScore = avgScore;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public void setErrorCount(int errorCount) {
        this.errorCount = errorCount;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message == null ? "" : message;
    }
}
