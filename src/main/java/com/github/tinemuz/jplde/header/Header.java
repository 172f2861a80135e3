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
package com.github.tinemuz.jplde.header;

import com.github.tinemuz.jplde.exceptions.ElementNotFoundException;
import com.github.tinemuz.jplde.exceptions.EpochOutOfRangeException;
import com.github.tinemuz.jplde.exceptions.HeaderFormatException;
import java.util.List;
import java.util.Map;

/**
 * Parsed contents of a DE header file. Immutable; one instance is shared by
 * every query against the same dataset.
 *
 * @param description free text naming the dataset, e.g. "JPL Planetary Ephemeris DE421/LE421"
 * @param startEpoch  first JDE covered (inclusive)
 * @param finalEpoch  last JDE covered (inclusive)
 * @param blockSize   days covered by one coefficient chunk
 * @param kSize       record size constant from the header
 * @param nCoeff      coefficients per record
 * @param constants   named physical constants (AU, EMRAT, CLIGHT, ...)
 * @param layout      per-element coefficient layout; element N is {@code layout.get(N - 1)}
 */
public record Header(
        String description,
        double startEpoch,
        double finalEpoch,
        double blockSize,
        int kSize,
        int nCoeff,
        Map<String, Double> constants,
        List<LayoutEntry> layout) {

    /** Elements 1..11 hold body positions; every usable dataset has at least these. */
    public static final int MIN_ELEMENTS = 11;

    public Header {
        constants = Map.copyOf(constants);
        layout = List.copyOf(layout);
    }

    /**
     * Value of a named constant.
     *
     * @throws HeaderFormatException if the header does not define it
     */
    public double constant(String name) {
        Double value = constants.get(name);
        if (value == null) {
            throw new HeaderFormatException("constant '" + name + "' is not defined");
        }
        return value;
    }

    public boolean hasConstant(String name) {
        return constants.containsKey(name);
    }

    /** Kilometres per astronomical unit. */
    public double au() {
        return constant("AU");
    }

    /** Earth/Moon mass ratio. */
    public double emrat() {
        return constant("EMRAT");
    }

    public int elementCount() {
        return layout.size();
    }

    /**
     * Layout of a 1-based element.
     *
     * @throws ElementNotFoundException if the dataset has no such element
     */
    public LayoutEntry layoutEntry(int element) {
        if (element < 1 || element > layout.size()) {
            throw new ElementNotFoundException(element, layout.size());
        }
        return layout.get(element - 1);
    }

    public boolean covers(double jde) {
        return jde >= startEpoch && jde <= finalEpoch;
    }

    /**
     * @throws EpochOutOfRangeException if {@code jde} is outside [startEpoch, finalEpoch]
     */
    public void requireEpoch(double jde) {
        if (!covers(jde)) {
            throw new EpochOutOfRangeException(jde, startEpoch, finalEpoch, description);
        }
    }
}
