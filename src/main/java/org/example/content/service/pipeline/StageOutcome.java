package org.example.content.service.pipeline;

/**
 * Result of running one item through a stage.
 *
 * @param result the item to hand to the next stage if it passes review
 * @param score  the executor's own quality estimate in {@code [0, 1]}
 * @param notes  free-form remarks for the reviewer, may be empty
 */
public record StageOutcome(
        WorkItem result,
        double score,
        String notes
) {
    public StageOutcome {
        if (notes == null) {
            notes = "";
        }
    }

    public static StageOutcome of(WorkItem result, double score) {
        return new StageOutcome(result, score, "");
    }
}
