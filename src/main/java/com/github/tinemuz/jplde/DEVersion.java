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

import java.util.List;
import java.util.Locale;

/**
 * A JPL DE release, identified by the token used in its file names
 * ({@code 421}, {@code 430t}, ...).
 *
 * <p>Coverage and content vary by release: DE406 has neither nutations nor
 * librations, DE432 has librations only, and the {@code t} releases add
 * TT-TDB as element 15.</p>
 */
public final class DEVersion {
    /** Every release published in ASCII form. */
    public static final List<String> KNOWN = List.of(
            "102", "200", "202", "403", "405", "406", "410", "413", "414", "418", "421",
            "422", "423", "424", "430", "430t", "431", "432", "432t");

    /** DE421 is small and covers 1900 to 2050. */
    public static final DEVersion DEFAULT = new DEVersion("421");

    private final String token;

    private DEVersion(String token) {
        this.token = token;
    }

    /**
     * Parse {@code DE421}, {@code de430t} or {@code 421}.
     *
     * @throws IllegalArgumentException if the release is unknown
     */
    public static DEVersion parse(String version) {
        String t = version.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("de")) t = t.substring(2);
        if (!KNOWN.contains(t)) {
            throw new IllegalArgumentException("DE" + t + " is not a known DE release");
        }
        return new DEVersion(t);
    }

    /** Version as it appears in file names. */
    public String token() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DEVersion other && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "DE" + token;
    }
}
