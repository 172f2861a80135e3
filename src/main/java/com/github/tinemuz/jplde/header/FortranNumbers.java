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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsing helpers for the Fortran-formatted numbers used throughout the DE
 * ASCII files, e.g. {@code -0.143951838384999992D-05}.
 */
public final class FortranNumbers {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FortranNumbers() {}

    /**
     * Parse a value written with a {@code D} exponent marker by rewriting the
     * marker to {@code e}. Plain decimal and {@code E} notation pass through.
     *
     * @throws NumberFormatException if the token is not a number
     */
    public static double parse(String raw) {
        String token = raw.trim();
        if (token.isEmpty()) throw new NumberFormatException("empty numeric field");
        return Double.parseDouble(token.replace('D', 'e').replace('d', 'e'));
    }

    /**
     * Parse the same notation by splitting it into mantissa and exponent and
     * combining them as {@code mantissa * 10^exponent}. Agrees with
     * {@link #parse} up to rounding of the final multiplication.
     *
     * @throws NumberFormatException if either part is not a number
     */
    public static double parseSplit(String raw) {
        String token = raw.trim().replace('d', 'D').replace('E', 'D').replace('e', 'D');
        int marker = token.indexOf('D');
        if (marker < 0) return Double.parseDouble(token);
        double mantissa = Double.parseDouble(token.substring(0, marker));
        String exp = token.substring(marker + 1);
        if (exp.startsWith("+")) exp = exp.substring(1);
        int exponent = Integer.parseInt(exp);
        return mantissa * Math.pow(10, exponent);
    }

    /** Split a line on runs of whitespace, dropping empty leading/trailing fields. */
    public static String[] fields(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return new String[0];
        return WHITESPACE.split(trimmed);
    }

    /** Parse every whitespace-separated field of a line with {@link #parse}. */
    public static List<Double> parseAll(String line) {
        String[] toks = fields(line);
        List<Double> out = new ArrayList<>(toks.length);
        for (String t : toks) out.add(parse(t));
        return out;
    }
}
