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

import java.util.Objects;

/**
 * Turns a {@link Body} into a barycentric position/velocity and composes
 * relative vectors.
 *
 * <p>Most bodies are a single element lookup. The dataset stores the
 * Earth-Moon barycenter and the geocentric Moon rather than the Earth and the
 * Moon themselves, so:</p>
 * <ul>
 *   <li>Earth = EMB - Moon<sub>geo</sub> / (1 + EMRAT)</li>
 *   <li>Moon = Moon<sub>geo</sub> + Earth</li>
 * </ul>
 */
public final class BodyResolver {
    private static final int POSITION_COMPONENTS = 3;

    private final ElementSource source;
    private final double emrat;

    /**
     * @param source element interpolation, positions in the session's unit
     * @param emrat  Earth/Moon mass ratio from the dataset header
     */
    public BodyResolver(ElementSource source, double emrat) {
        this.source = Objects.requireNonNull(source, "source");
        this.emrat = emrat;
    }

    /** Position and velocity of {@code body} relative to the solar system barycenter. */
    public Vector6 barycentric(Body body, double jde) {
        switch (body) {
            case SOLAR_SYSTEM_BARYCENTER:
                return Vector6.ZERO;
            case EARTH:
                return earth(jde);
            case MOON:
                return geocentricMoon(jde).add(earth(jde));
            default:
                return element(body.id(), jde);
        }
    }

    /** {@code target - center}, position and velocity. */
    public Vector6 relative(Body center, Body target, double jde) {
        return barycentric(target, jde).subtract(barycentric(center, jde));
    }

    private Vector6 earth(double jde) {
        Vector6 emb = element(Body.EARTH_MOON_BARYCENTER.id(), jde);
        return emb.subtract(geocentricMoon(jde).scale(1 / (1 + emrat)));
    }

    private Vector6 geocentricMoon(double jde) {
        return element(Body.MOON.id(), jde);
    }

    private Vector6 element(int element, double jde) {
        return Vector6.of(source.interpolate(element, POSITION_COMPONENTS, true, jde));
    }
}
