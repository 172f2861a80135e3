/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.jplde;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retarded (apparent) positions: the target is observed where it was when the
 * light now reaching the center left it.
 *
 * <p>Fixed-point iteration on the light time {@code τ = k·Δ}, with Δ the
 * center-target distance at {@code jde - τ}. Iteration stops when Δ repeats
 * exactly or after {@code maxIterations} rounds; there is no tolerance.</p>
 */
public final class LightTimeSolver {
    private static final Logger log = LoggerFactory.getLogger(LightTimeSolver.class);

    /** Light travel time per astronomical unit, days. */
    public static final double DAYS_PER_AU = 0.0057755183;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final BodyResolver resolver;
    private final int maxIterations;
    private final double auPerDistanceUnit;

    /**
     * @param resolver          source of relative positions
     * @param maxIterations     iteration cap
     * @param auPerDistanceUnit factor turning the resolver's distances into AU
     *                          (1 for AU output, 1/AU for km output)
     */
    public LightTimeSolver(BodyResolver resolver, int maxIterations, double auPerDistanceUnit) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        this.resolver = resolver;
        this.maxIterations = maxIterations;
        this.auPerDistanceUnit = auPerDistanceUnit;
    }

    public LightTimeSolver(BodyResolver resolver) {
        this(resolver, DEFAULT_MAX_ITERATIONS, 1.0);
    }

    /**
     * Position of {@code target} seen from {@code center} at {@code jde},
     * corrected for light time.
     */
    public ApparentPosition apparent(Body center, Body target, double jde) {
        double tau = 0;
        double delta = 0;
        boolean converged = false;
        for (int i = 0; i < maxIterations; i++) {
            Vector6 pv = resolver.relative(center, target, jde - tau);
            double delta0 = pv.distance() * auPerDistanceUnit;
            tau = DAYS_PER_AU * delta0;
            if (delta0 == delta) {
                converged = true;
                break;
            }
            delta = delta0;
        }
        if (!converged) {
            log.warn(
                    "Light time {} -> {} at JDE {} did not settle within {} iterations; using τ={} d",
                    center, target, jde, maxIterations, tau);
        }
        Vector6 position = resolver.relative(center, target, jde - tau).positionOnly();
        return new ApparentPosition(position, tau);
    }
}
