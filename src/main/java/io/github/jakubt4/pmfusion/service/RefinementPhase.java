package io.github.jakubt4.pmfusion.service;

/**
 * States of the refinement loop, in execution order.
 */
public enum RefinementPhase {
    INIT,
    PER_FRAME_TRANSFORM,
    AGGREGATE,
    CALIBRATE,
    MEMBERSHIP_UPDATE,
    CONVERGENCE_CHECK,
    DONE
}
