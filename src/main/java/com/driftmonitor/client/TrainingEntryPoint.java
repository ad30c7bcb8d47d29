package com.driftmonitor.client;

/**
 * Starts model retraining. Returns once training has finished; failures surface as
 * {@link com.driftmonitor.exception.TrainingInvocationException}.
 */
public interface TrainingEntryPoint {

    void train();
}
