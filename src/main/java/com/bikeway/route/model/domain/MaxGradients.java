package com.bikeway.route.model.domain;

/**
 * Steepest realistic climb and descent along a path, in percent, one decimal.
 */
public record MaxGradients(double maxUphill, double maxDownhill) {

    public static final MaxGradients FLAT = new MaxGradients(0, 0);
}
