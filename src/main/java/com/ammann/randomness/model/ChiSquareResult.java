/* (C)2026 */
package com.ammann.randomness.model;

/**
 * Chi-square goodness-of-fit against the uniform distribution.
 *
 * @param statistic sum of squared normalized deviations from the uniform expectation
 * @param degreesOfFreedom alphabet size minus one
 * @param pValue normal-approximation upper tail, undefined when {@code statistic < degreesOfFreedom}
 * @param exactPValue exact upper tail of the chi-square distribution
 */
public record ChiSquareResult(
        double statistic, int degreesOfFreedom, Measurement pValue, double exactPValue) {}
