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
package com.github.tinemuz.jplde.store;

import java.util.Arrays;

/**
 * Coefficients of one DE record, covering the half-open JDE interval
 * {@code [jd0, jd1)}. The first two coefficients are the interval bounds
 * themselves, which is why layout pointers in the header start at 3.
 */
public final class Chunk {
    private final double[] coefficients;

    /**
     * @param coefficients the record's coefficients, interval bounds first; copied
     * @throws IllegalArgumentException if fewer than two values are given
     */
    public Chunk(double[] coefficients) {
        if (coefficients.length < 2) {
            throw new IllegalArgumentException("a chunk needs at least its two interval bounds");
        }
        this.coefficients = coefficients.clone();
    }

    public double jd0() {
        return coefficients[0];
    }

    public double jd1() {
        return coefficients[1];
    }

    /** 0-based coefficient access. */
    public double get(int index) {
        return coefficients[index];
    }

    public int size() {
        return coefficients.length;
    }

    public boolean contains(double jde) {
        return jde >= jd0() && jde < jd1();
    }

    @Override
    public String toString() {
        return "Chunk[" + jd0() + ", " + jd1() + ") of " + coefficients.length + " coefficients";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Chunk other && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }
}
