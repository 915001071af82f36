package org.example.content.service.pipeline;

import org.example.content.model.ProductionStage;

/**
 * Does the actual work of one production stage for one item.
 * <p>
 * Expected per-item problems should come back as a low-scoring outcome. Any other
 * runtime exception drops the item; {@link StageExecutionException} fails the run.
 */
public interface StageExecutor {

    ProductionStage stage();

    StageOutcome execute(WorkItem item, StageContext context);
}
