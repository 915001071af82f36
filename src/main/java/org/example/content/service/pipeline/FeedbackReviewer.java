package org.example.content.service.pipeline;

/**
 * Scores a stage outcome. Register a bean of this type to put a human in the loop;
 * otherwise {@link AutomaticFeedbackReviewer} trusts the executor's own score.
 */
public interface FeedbackReviewer {

    Feedback review(StageOutcome outcome, StageContext context);
}
