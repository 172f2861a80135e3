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
package com.github.tinemuz.jplde.exceptions;

/**
 * Thrown when a JDE falls outside the inclusive span a dataset covers. Carries
 * the requested epoch and the span for diagnostics.
 */
public class EpochOutOfRangeException extends EphemerisException {
    private final double requested;
    private final double startEpoch;
    private final double finalEpoch;

    public EpochOutOfRangeException(
            double requested, double startEpoch, double finalEpoch, String description) {
        super("The requested JDE " + requested + " is out of range for " + description
                + " which covers JDE " + startEpoch + " to JDE " + finalEpoch + ".");
        this.requested = requested;
        this.startEpoch = startEpoch;
        this.finalEpoch = finalEpoch;
    }

    public double getRequested() {
        return requested;
    }

    public double getStartEpoch() {
        return startEpoch;
    }

    public double getFinalEpoch() {
        return finalEpoch;
    }
}
