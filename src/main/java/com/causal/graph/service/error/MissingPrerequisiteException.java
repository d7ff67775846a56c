package com.causal.graph.service.error;

/**
 * Thrown when a stage needs an upstream artifact that has not been produced yet.
 * The message always names the stage that has to run first.
 */
public class MissingPrerequisiteException extends CausalAnalysisException {

    public static final String ERROR_CODE = "MISSING_PREREQUISITE";

    private final String producingStage;

    public MissingPrerequisiteException(String artifact, String producingStage) {
        super("Missing artifact '%s'. Run stage %s first".formatted(artifact, producingStage),
                artifact, ERROR_CODE);
        this.producingStage = producingStage;
    }

    public String getProducingStage() {
        return producingStage;
    }
}
