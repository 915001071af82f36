package org.example.content.service.progress;

import org.example.content.model.OverallStatus;
import org.example.content.model.ProductionStage;
import org.example.content.model.ProgressSnapshot;
import org.example.content.model.ProgressSummary;
import org.example.content.model.StageHistoryEntry;
import org.example.content.model.StageStateSnapshot;
import org.example.content.model.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressTrackerTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tracker = new ProgressTracker("article-42", "article_production", StageCatalog.defaultCatalog(), clock);
    }

    @Test
    void newTracker_prePopulatesEveryStageAsPending() {
        assertEquals(OverallStatus.PENDING, tracker.getOverallStatus());
        assertEquals(ProductionStage.TOPIC_DISCOVERY, tracker.getCurrentStage());
        for (ProductionStage stage : StageCatalog.defaultCatalog().processableStages()) {
            StageStateSnapshot state = tracker.getStageState(stage).orElseThrow();
            assertEquals(StageStatus.PENDING, state.status());
            assertEquals(0, state.totalItems());
        }
        assertTrue(tracker.getStageState(ProductionStage.COMPLETED).isEmpty());
        assertEquals(0.0, tracker.progressPercentage(), 1e-9);
    }

    @Test
    void startStage_setsStageAndOverallInProgress() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 3);

        StageStateSnapshot state = tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow();
        assertEquals(StageStatus.IN_PROGRESS, state.status());
        assertEquals(START, state.startTime());
        assertEquals(3, state.totalItems());
        assertEquals(OverallStatus.IN_PROGRESS, tracker.getOverallStatus());
    }

    @Test
    void startStage_metaState_isIgnored() {
        tracker.startStage(ProductionStage.COMPLETED, 3);

        assertEquals(OverallStatus.PENDING, tracker.getOverallStatus());
        assertEquals(ProductionStage.TOPIC_DISCOVERY, tracker.getCurrentStage());
    }

    @Test
    void updateStageProgress_clampsCompletedItemsAndScore() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 3);

        tracker.updateStageProgress(ProductionStage.TOPIC_DISCOVERY, 7, 1.4, "too many", 0);
        StageStateSnapshot state = tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow();
        assertEquals(3, state.completedItems());
        assertEquals(1.0, state.avgScore(), 1e-9);
        assertEquals("too many", state.message());

        tracker.updateStageProgress(ProductionStage.TOPIC_DISCOVERY, -2, -0.5, null, 0);
        state = tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow();
        assertEquals(0, state.completedItems());
        assertEquals(0.0, state.avgScore(), 1e-9);
        assertEquals("too many", state.message());
    }

    @Test
    void updateStageProgress_errorIncrementRollsUpIntoTotal() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 3);
        tracker.updateStageProgress(ProductionStage.TOPIC_DISCOVERY, null, null, null, 2);

        assertEquals(2, tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow().errorCount());
        assertEquals(2, tracker.getErrorCount());
    }

    @Test
    void completeStage_advancesAndRecordsDuration() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 3);
        clock.advanceSeconds(90);

        tracker.completeStage(ProductionStage.TOPIC_DISCOVERY);

        StageStateSnapshot done = tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow();
        assertEquals(StageStatus.COMPLETED, done.status());
        assertEquals(90.0, done.durationSeconds(), 1e-9);
        assertEquals(START.plusSeconds(90), done.endTime());
        assertEquals(ProductionStage.TOPIC_RESEARCH, tracker.getCurrentStage());
        assertEquals(StageStatus.PENDING, tracker.getStageState(ProductionStage.TOPIC_RESEARCH).orElseThrow().status());
        assertEquals(10.0, tracker.progressPercentage(), 1e-9);
    }

    @Test
    void completeStage_lastStage_completesProcess() {
        runAllStages();

        assertEquals(OverallStatus.COMPLETED, tracker.getOverallStatus());
        assertEquals(ProductionStage.COMPLETED, tracker.getCurrentStage());
        assertNotNull(tracker.getSummary().completedAt());
        assertEquals(100.0, tracker.progressPercentage(), 1e-9);
    }

    @Test
    void completeStage_metaState_failsWithInternalError() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);

        tracker.completeStage(ProductionStage.PAUSED);

        assertEquals(OverallStatus.FAILED, tracker.getOverallStatus());
        assertEquals(ProductionStage.FAILED, tracker.getCurrentStage());
        List<StageHistoryEntry> history = tracker.getStageHistory();
        assertEquals(1, history.size());
        assertEquals("Internal error: stage transition failed for paused", history.get(0).error());
    }

    @Test
    void failProcess_marksActiveStageAndAppendsOneHistoryEntry() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);
        tracker.completeStage(ProductionStage.TOPIC_DISCOVERY);
        tracker.startStage(ProductionStage.TOPIC_RESEARCH, 1);

        tracker.failProcess("research service down");

        StageStateSnapshot research = tracker.getStageState(ProductionStage.TOPIC_RESEARCH).orElseThrow();
        assertEquals(StageStatus.FAILED, research.status());
        assertEquals("research service down", research.message());
        assertEquals(OverallStatus.FAILED, tracker.getOverallStatus());
        assertEquals(ProductionStage.FAILED, tracker.getCurrentStage());
        assertEquals(List.of(new StageHistoryEntry(START, ProductionStage.TOPIC_RESEARCH, "research service down")),
                tracker.getStageHistory());
    }

    @Test
    void failProcess_withoutMessage_usesDefaultAndLeavesHistoryAlone() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);

        tracker.failProcess(null);

        assertEquals("Process failed at this stage.",
                tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow().message());
        assertTrue(tracker.getStageHistory().isEmpty());
    }

    @Test
    void terminalStates_absorbFurtherMutations() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);
        tracker.failProcess("fatal");
        ProgressSnapshot failed = tracker.getStateForPersistence();

        tracker.startStage(ProductionStage.TOPIC_RESEARCH, 4);
        tracker.updateStageProgress(ProductionStage.TOPIC_DISCOVERY, 1, 0.9, "late", 3);
        tracker.completeStage(ProductionStage.TOPIC_DISCOVERY);
        tracker.addErrorLog(ProductionStage.TOPIC_DISCOVERY, "late error");
        tracker.completeProcess();
        tracker.failProcess("again");
        assertFalse(tracker.pauseProcess());
        assertFalse(tracker.resumeProcess());

        assertEquals(failed, tracker.getStateForPersistence());
    }

    @Test
    void completedRun_absorbsFailAndPause() {
        runAllStages();
        ProgressSnapshot completed = tracker.getStateForPersistence();

        tracker.failProcess("too late");
        assertFalse(tracker.pauseProcess());

        assertEquals(completed, tracker.getStateForPersistence());
        assertEquals(OverallStatus.COMPLETED, tracker.getOverallStatus());
    }

    @Test
    void pauseAndResume_returnToPausedStage() {
        advanceTo(ProductionStage.ARTICLE_WRITING);

        assertTrue(tracker.pauseProcess());
        assertEquals(OverallStatus.PAUSED, tracker.getOverallStatus());
        assertEquals("article_writing", tracker.getPausedFromStage());
        assertEquals(StageStatus.PAUSED, tracker.getStageState(ProductionStage.ARTICLE_WRITING).orElseThrow().status());

        assertTrue(tracker.resumeProcess());
        assertEquals(OverallStatus.IN_PROGRESS, tracker.getOverallStatus());
        assertEquals(ProductionStage.ARTICLE_WRITING, tracker.getCurrentStage());
        assertEquals(StageStatus.IN_PROGRESS,
                tracker.getStageState(ProductionStage.ARTICLE_WRITING).orElseThrow().status());
        assertNull(tracker.getPausedFromStage());
    }

    @Test
    void startStage_whilePaused_isIgnoredUntilResumed() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 3);
        assertTrue(tracker.pauseProcess());

        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 5);

        assertEquals(OverallStatus.PAUSED, tracker.getOverallStatus());
        assertEquals("topic_discovery", tracker.getPausedFromStage());
        StageStateSnapshot discovery = tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow();
        assertEquals(StageStatus.PAUSED, discovery.status());
        assertEquals(3, discovery.totalItems());
        assertEquals("paused", tracker.getStateForPersistence().overallStatus().wireValue());

        assertTrue(tracker.resumeProcess());
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 5);
        assertEquals(OverallStatus.IN_PROGRESS, tracker.getOverallStatus());
        assertNull(tracker.getPausedFromStage());
        assertEquals(5, tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow().totalItems());
    }

    @Test
    void resume_corruptedMarker_fallsBackToFirstUnfinishedStage() {
        advanceTo(ProductionStage.ARTICLE_WRITING);
        tracker.pauseProcess();
        ProgressSnapshot corrupted = tracker.getStateForPersistence().withPausedFromStage("bogus_stage");

        ProgressTracker restored = ProgressTracker.restore(
                "article-42", "article_production", corrupted, StageCatalog.defaultCatalog(), clock);

        assertTrue(restored.resumeProcess());
        assertEquals(ProductionStage.ARTICLE_WRITING, restored.getCurrentStage());
        assertEquals(OverallStatus.IN_PROGRESS, restored.getOverallStatus());
    }

    @Test
    void resume_markerNamingCompletedStage_fallsBack() {
        advanceTo(ProductionStage.ARTICLE_WRITING);
        tracker.pauseProcess();
        ProgressSnapshot stale = tracker.getStateForPersistence().withPausedFromStage("topic_discovery");

        ProgressTracker restored = ProgressTracker.restore(
                "article-42", "article_production", stale, StageCatalog.defaultCatalog(), clock);

        assertTrue(restored.resumeProcess());
        assertEquals(ProductionStage.ARTICLE_WRITING, restored.getCurrentStage());
    }

    @Test
    void resume_whenNotPaused_isRejected() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);

        assertFalse(tracker.resumeProcess());
        assertEquals(OverallStatus.IN_PROGRESS, tracker.getOverallStatus());
    }

    @Test
    void resume_withEveryStageCompleted_staysPaused() {
        Map<String, StageStateSnapshot> stages = new LinkedHashMap<>();
        for (ProductionStage stage : StageCatalog.defaultCatalog().processableStages()) {
            stages.put(stage.wireValue(), new StageStateSnapshot(
                    StageStatus.COMPLETED, START, START, 0.0, 1, 1, 1.0, 0, ""));
        }
        ProgressSnapshot snapshot = new ProgressSnapshot(1, ProductionStage.ARTICLE_REVIEW, stages, START, null,
                List.of(), 0, "nonsense", OverallStatus.PAUSED);
        ProgressTracker restored = ProgressTracker.restore(
                "article-42", "article_production", snapshot, StageCatalog.defaultCatalog(), clock);

        assertFalse(restored.resumeProcess());
        assertEquals(OverallStatus.PAUSED, restored.getOverallStatus());
    }

    @Test
    void addErrorLog_tagsStageAndCountsErrors() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 2);
        clock.advanceSeconds(5);

        tracker.addErrorLog(ProductionStage.TOPIC_DISCOVERY, "item 1 timed out");
        tracker.addErrorLog(null, "untagged problem");

        List<StageHistoryEntry> history = tracker.getStageHistory();
        assertEquals(2, history.size());
        assertEquals(ProductionStage.TOPIC_DISCOVERY, history.get(0).stage());
        assertEquals(START.plusSeconds(5), history.get(0).time());
        assertEquals(ProductionStage.TOPIC_DISCOVERY, history.get(1).stage());
        assertEquals(1, tracker.getStageState(ProductionStage.TOPIC_DISCOVERY).orElseThrow().errorCount());
        assertEquals(1, tracker.getErrorCount());
    }

    @Test
    void progressPercentage_weightsPartialStages() {
        advanceTo(ProductionStage.ARTICLE_WRITING);
        tracker.startStage(ProductionStage.ARTICLE_WRITING, 4);
        tracker.updateStageProgress(ProductionStage.ARTICLE_WRITING, 2, null, null, 0);

        // discovery 10 + research 20 + half of writing 30
        assertEquals(45.0, tracker.progressPercentage(), 1e-9);
    }

    @Test
    void totalDuration_usesCompletionTimeOnceFinished() {
        clock.advanceSeconds(30);
        assertEquals(30.0, tracker.totalDurationSeconds(), 1e-9);

        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 1);
        tracker.failProcess("stop");
        clock.advanceSeconds(100);

        assertEquals(30.0, tracker.totalDurationSeconds(), 1e-9);
    }

    @Test
    void stateForPersistence_isStableAndRestorable() {
        advanceTo(ProductionStage.ARTICLE_WRITING);
        tracker.startStage(ProductionStage.ARTICLE_WRITING, 4);
        tracker.updateStageProgress(ProductionStage.ARTICLE_WRITING, 1, 0.8, "drafting", 1);

        ProgressSnapshot first = tracker.getStateForPersistence();
        ProgressSnapshot second = tracker.getStateForPersistence();
        assertEquals(first, second);

        ProgressTracker restored = ProgressTracker.restore(
                "article-42", "article_production", first, StageCatalog.defaultCatalog(), clock);
        assertEquals(tracker.progressPercentage(), restored.progressPercentage(), 1e-9);
        assertEquals(tracker.getOverallStatus(), restored.getOverallStatus());
        assertEquals(first, restored.getStateForPersistence());
    }

    @Test
    void restore_fillsMissingStagesAndIgnoresUnknownOnes() {
        Map<String, StageStateSnapshot> stages = new LinkedHashMap<>();
        stages.put("topic_discovery", new StageStateSnapshot(
                StageStatus.COMPLETED, START, START, 0.0, 3, 3, 0.9, 1, ""));
        stages.put("legacy_stage", new StageStateSnapshot(
                StageStatus.COMPLETED, null, null, 0.0, 0, 0, 0.0, 5, ""));
        ProgressSnapshot snapshot = new ProgressSnapshot(1, ProductionStage.TOPIC_RESEARCH, stages, START, null,
                List.of(), 99, null, OverallStatus.IN_PROGRESS);

        ProgressTracker restored = ProgressTracker.restore(
                "article-42", "article_production", snapshot, StageCatalog.defaultCatalog(), clock);

        assertEquals(StageStatus.PENDING, restored.getStageState(ProductionStage.ARTICLE_REVIEW).orElseThrow().status());
        assertEquals(1, restored.getErrorCount());
        assertEquals(5, restored.getStateForPersistence().stages().size());
    }

    @Test
    void summary_addsIdentityPercentageAndDuration() {
        tracker.startStage(ProductionStage.TOPIC_DISCOVERY, 2);
        tracker.updateStageProgress(ProductionStage.TOPIC_DISCOVERY, 1, 0.8, null, 0);
        clock.advanceSeconds(12);

        ProgressSummary summary = tracker.getSummary();

        assertEquals("article-42", summary.entityId());
        assertEquals("article_production", summary.operationType());
        assertEquals(OverallStatus.IN_PROGRESS, summary.overallStatus());
        assertEquals(5.0, summary.progressPercentage(), 1e-9);
        assertEquals(12.0, summary.durationSeconds(), 1e-9);
        assertEquals(5, summary.stages().size());
    }

    private void advanceTo(ProductionStage target) {
        for (ProductionStage stage : StageCatalog.defaultCatalog().processableStages()) {
            if (stage == target) {
                return;
            }
            tracker.startStage(stage, 1);
            tracker.updateStageProgress(stage, 1, 0.9, null, 0);
            tracker.completeStage(stage);
        }
    }

    private void runAllStages() {
        for (ProductionStage stage : StageCatalog.defaultCatalog().processableStages()) {
            tracker.startStage(stage, 1);
            tracker.updateStageProgress(stage, 1, 0.9, null, 0);
            tracker.completeStage(stage);
        }
    }

    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant initial) {
            this.current = initial;
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }

        private void advanceSeconds(long seconds) {
            current = current.plusSeconds(seconds);
        }
    }
}
