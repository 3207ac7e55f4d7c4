package io.github.jakubt4.pmfusion.service.stats;

public enum CovarianceType {
    FULL,
    SPHERICAL
}
