package org.example.content.service.pipeline;

import org.example.content.model.ProductionStage;

/**
 * What an executor knows about the call it is serving.
 *
 * @param itemIndex zero-based position of the item within this stage's input
 */
public record StageContext(
        String entityId,
        ProductionStage stage,
        SeedParameters seed,
        int itemIndex,
        int totalItems
) {
}
