package org.example.content.service.pipeline;

/**
 * Review verdict on a stage outcome. Automatic and human reviews look the same.
 */
public record Feedback(
        double averageScore,
        String comment
) {
    public Feedback {
        if (Double.isNaN(averageScore)) {
            averageScore = 0.0;
        }
        averageScore = Math.min(1.0, Math.max(0.0, averageScore));
        if (comment == null) {
            comment = "";
        }
    }

    public static Feedback of(double averageScore) {
        return new Feedback(averageScore, "");
    }
}
