package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.model.IterationDiagnostics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingDiagnosticsSink implements DiagnosticsSink {

    @Override
    public void iterationCompleted(final IterationDiagnostics diagnostics) {
        log.info("Iteration {}: frames={}, alignment stars={}, measured stars={}",
                diagnostics.iteration(), diagnostics.framesUsed(),
                diagnostics.alignmentStars(), diagnostics.measuredStars());
        log.info("RMS(PM - PM_ref) = ({}, {}) mas/yr",
                String.format("%.4e", diagnostics.rmsRa()),
                String.format("%.4e", diagnostics.rmsDec()));
        if (diagnostics.driftRa() != null) {
            log.info("PM variation = ({}, {}) mas/yr, threshold = {} mas/yr",
                    String.format("%.4e", diagnostics.driftRa()),
                    String.format("%.4e", diagnostics.driftDec()),
                    String.format("%.4e", diagnostics.driftThreshold()));
        }
    }
}
