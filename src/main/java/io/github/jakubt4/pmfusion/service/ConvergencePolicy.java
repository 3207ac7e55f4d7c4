package io.github.jakubt4.pmfusion.service;

/**
 * Stop criterion of the refinement loop.
 */
public enum ConvergencePolicy {
    /** Stop once the alignment flags no longer change. */
    MEMBERSHIP,
    /** Stop once absolute proper motions move less than a fraction of their error. */
    DRIFT,
    /** Run exactly one iteration. */
    SINGLE_PASS
}
