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
package com.github.tinemuz.jplde.interp;

import com.github.tinemuz.jplde.exceptions.ChunkParseException;
import com.github.tinemuz.jplde.header.Header;
import com.github.tinemuz.jplde.header.LayoutEntry;
import com.github.tinemuz.jplde.store.Chunk;

/**
 * Evaluates the Chebyshev series of one element inside a loaded chunk.
 *
 * <p>A chunk spans {@code blockSize} days and each element splits it into
 * {@code subintervals} equal pieces, each with its own set of
 * {@code coeffCount} coefficients per component. The epoch is mapped to the
 * subinterval it falls in and to a scaled time in [-1, 1], then the
 * position polynomials T_k and their derivatives are built by recurrence.</p>
 *
 * <p>Two conventions are kept exactly: the position sum stops one
 * coefficient short of {@code coeffCount}, and only elements 1 to 11 are
 * divided by the AU constant.</p>
 */
public final class ChebyshevInterpolator {
    /** Highest element id holding a body position in km. */
    public static final int LAST_BODY_ELEMENT = 11;
    /** Most coefficient groups any element has. */
    public static final int MAX_COMPONENTS = 3;
    private static final int MAX_VELOCITY_COMPONENTS = 3;

    private final Header header;
    private final OutputUnit unit;

    public ChebyshevInterpolator(Header header, OutputUnit unit) {
        this.header = header;
        this.unit = unit;
    }

    public OutputUnit unit() {
        return unit;
    }

    /**
     * Interpolate an element at {@code jde}.
     *
     * @param chunk      chunk covering {@code jde}
     * @param element    1-based element number
     * @param jde        epoch, TDB
     * @param components number of coefficient groups the element has (1 to 3)
     * @param velocity   also compute the time derivative of the first three components
     * @return the positions, followed by the velocities when requested
     * @throws com.github.tinemuz.jplde.exceptions.ElementNotFoundException if the
     *         element is not in the header's layout
     * @throws ChunkParseException if the chunk is too short for the element
     * @throws IllegalArgumentException if {@code components} is not 1 to 3
     */
    public double[] interpolate(Chunk chunk, int element, double jde, int components, boolean velocity) {
        requireComponents(components);
        LayoutEntry entry = header.layoutEntry(element);
        int nCoeff = entry.coeffCount();
        int nSub = entry.subintervals();
        double blockSize = header.blockSize();

        // Interval and subinterval, then the scaled Chebyshev time
        double tint = (jde - chunk.jd0()) / blockSize;
        if (tint >= 1.0) {
            // closing bound of the last record: end of its last subinterval
            tint = nSub;
        } else {
            tint = (tint - Math.floor(tint)) * nSub;
        }
        double nseg = Math.min(Math.floor(tint), nSub - 1);
        double chebTime = 2 * (tint - nseg) - 1;

        int pointer = entry.coeffStart() - 1 + (int) nseg * nCoeff * components;
        int end = pointer + components * nCoeff;
        if (end > chunk.size()) {
            throw new ChunkParseException(
                    "element " + element + " needs coefficients up to " + end + " but the chunk holds "
                            + chunk.size());
        }

        double[] posPoly = new double[nCoeff];
        posPoly[0] = 1;
        posPoly[1] = chebTime;
        for (int k = 2; k < nCoeff; k++) {
            posPoly[k] = 2 * chebTime * posPoly[k - 1] - posPoly[k - 2];
        }

        boolean toAu = element <= LAST_BODY_ELEMENT && unit == OutputUnit.AU;
        int velComponents = velocity ? Math.min(components, MAX_VELOCITY_COMPONENTS) : 0;
        double[] result = new double[components + velComponents];

        for (int j = 0; j < components; j++) {
            int base = pointer + j * nCoeff;
            double sum = 0;
            for (int k = 0; k < nCoeff - 1; k++) {
                sum = sum + chunk.get(base + k) * posPoly[k];
            }
            result[j] = toAu ? sum / header.au() : sum;
        }

        if (velocity) {
            double[] velPoly = new double[nCoeff];
            velPoly[0] = 0;
            velPoly[1] = 1;
            if (nCoeff > 2) velPoly[2] = 4 * chebTime;
            for (int k = 3; k < nCoeff; k++) {
                velPoly[k] = 2 * chebTime * velPoly[k - 1] + 2 * posPoly[k - 1] - velPoly[k - 2];
            }
            double scale = 2.0 * nSub / blockSize;
            for (int j = 0; j < velComponents; j++) {
                int base = pointer + j * nCoeff;
                double sum = 0;
                for (int k = 0; k < nCoeff; k++) {
                    sum = sum + chunk.get(base + k) * velPoly[k];
                }
                sum = sum * scale;
                result[components + j] = toAu ? sum / header.au() : sum;
            }
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if {@code components} is not 1 to 3
     */
    public static void requireComponents(int components) {
        if (components < 1 || components > MAX_COMPONENTS) {
            throw new IllegalArgumentException(
                    "components must be 1 to " + MAX_COMPONENTS + ": " + components);
        }
    }
}
