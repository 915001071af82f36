package org.example.content.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * External input for the first stage: which category to discover topics in and how many.
 */
public record SeedParameters(
        String category,
        int count
) {
    public SeedParameters {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1 but was " + count);
        }
    }

    /**
     * One seed item per requested topic, each tagged with the category.
     */
    public List<WorkItem> toSeedItems() {
        List<WorkItem> items = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            items.add(new WorkItem("seed-" + i, category, Map.of(WorkItem.CATEGORY, category)));
        }
        return items;
    }
}
