package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.model.IterationDiagnostics;

/**
 * Receives the per-iteration convergence series; rendering them is up to the implementation.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    void iterationCompleted(IterationDiagnostics diagnostics);
}
