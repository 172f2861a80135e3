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

/**
 * Solar-system bodies a DE dataset can position. The id is the element number
 * of the body in the header layout, except for {@link #EARTH} and
 * {@link #MOON} which are derived from the Earth-Moon barycenter and the
 * geocentric Moon, and {@link #SOLAR_SYSTEM_BARYCENTER} which is the origin.
 */
public enum Body {
    SOLAR_SYSTEM_BARYCENTER(0, "Solar System barycenter", "SSB"),
    MERCURY(1, "Mercury", "Me"),
    VENUS(2, "Venus", "V"),
    EARTH_MOON_BARYCENTER(3, "Earth-Moon barycenter", "EMB"),
    EARTH(301, "Earth", "E"),
    MARS(4, "Mars", "M"),
    JUPITER(5, "Jupiter", "J"),
    SATURN(6, "Saturn", "S"),
    URANUS(7, "Uranus", "U"),
    NEPTUNE(8, "Neptune", "N"),
    PLUTO(9, "Pluto", "P"),
    MOON(10, "Moon", "Lu"),
    SUN(11, "Sun", "Su");

    private final int id;
    private final String displayName;
    private final String abbreviation;

    Body(int id, String displayName, String abbreviation) {
        this.id = id;
        this.displayName = displayName;
        this.abbreviation = abbreviation;
    }

    public int id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String abbreviation() {
        return abbreviation;
    }

    /**
     * @throws IllegalArgumentException if no body has this id
     */
    public static Body fromId(int id) {
        for (Body b : values()) {
            if (b.id == id) return b;
        }
        throw new IllegalArgumentException("No body with id " + id);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
