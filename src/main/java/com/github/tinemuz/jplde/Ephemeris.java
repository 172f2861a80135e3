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

import com.github.tinemuz.jplde.exceptions.ElementNotFoundException;
import com.github.tinemuz.jplde.header.Header;
import com.github.tinemuz.jplde.header.HeaderParser;
import com.github.tinemuz.jplde.interp.ChebyshevInterpolator;
import com.github.tinemuz.jplde.interp.OutputUnit;
import com.github.tinemuz.jplde.store.Chunk;
import com.github.tinemuz.jplde.store.ChunkStore;
import java.nio.file.Path;

/**
 * Reader session over one JPL DE dataset.
 *
 * <p>Opening a session parses the header; coefficient chunks are then loaded
 * on demand and cached for the lifetime of the session. All queries take the
 * epoch as a Julian Ephemeris Date in TDB and are safe to call from several
 * threads.</p>
 *
 * <pre>
 * Ephemeris de421 = Ephemeris.open(Path.of("/data/de421"), DEVersion.parse("DE421"));
 * Vector6 mars = de421.position(Body.EARTH, Body.MARS, 2457309.5);
 * </pre>
 *
 * <p>Positions are in AU and AU/day (km and km/day with
 * {@link OutputUnit#KM}), measured in the dataset's reference frame (ICRF for
 * DE403 and later).</p>
 */
public final class Ephemeris implements ElementSource {
    static final int NUTATION = 12;
    static final int LIBRATION = 13;
    static final int MANTLE_VELOCITY = 14;
    static final int TT_MINUS_TDB = 15;

    private final Header header;
    private final DEVersion version;
    private final ChunkStore store;
    private final ChebyshevInterpolator interpolator;
    private final BodyResolver resolver;
    private final LightTimeSolver lightTime;

    private Ephemeris(Header header, EphemerisConfig config) {
        this.header = header;
        this.version = config.version();
        this.store = new ChunkStore(
                header, config.directory(), config.version().token(), config.maxCachedChunks());
        this.interpolator = new ChebyshevInterpolator(header, config.unit());
        this.resolver = new BodyResolver(this, header.emrat());
        double auPerUnit = config.unit() == OutputUnit.KM ? 1 / header.au() : 1.0;
        this.lightTime = new LightTimeSolver(resolver, config.lightTimeIterations(), auPerUnit);
    }

    /**
     * Open a dataset, locating its header among the accepted file names.
     *
     * @throws com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException if no header exists
     * @throws com.github.tinemuz.jplde.exceptions.HeaderFormatException if the header is malformed
     */
    public static Ephemeris open(EphemerisConfig config) {
        Path headerFile = HeaderParser.locate(config.directory(), config.version().token());
        return new Ephemeris(HeaderParser.parse(headerFile), config);
    }

    public static Ephemeris open(Path directory, DEVersion version) {
        return open(EphemerisConfig.builder(directory).version(version).build());
    }

    /** Open a session on an already parsed header. */
    public static Ephemeris withHeader(Header header, EphemerisConfig config) {
        return new Ephemeris(header, config);
    }

    /** Parse a header file without opening a session. */
    public static Header loadHeader(Path headerFile) {
        return HeaderParser.parse(headerFile);
    }

    public Header header() {
        return header;
    }

    public DEVersion version() {
        return version;
    }

    public OutputUnit unit() {
        return interpolator.unit();
    }

    /** Chunk store backing this session. */
    public ChunkStore store() {
        return store;
    }

    /**
     * Position and velocity of {@code body} relative to the solar system barycenter.
     *
     * @throws com.github.tinemuz.jplde.exceptions.EpochOutOfRangeException if
     *         {@code jde} is outside the dataset span
     */
    public Vector6 position(Body body, double jde) {
        header.requireEpoch(jde);
        return resolver.barycentric(body, jde);
    }

    /** Position and velocity of {@code target} as seen from {@code center}. */
    public Vector6 position(Body center, Body target, double jde) {
        header.requireEpoch(jde);
        return resolver.relative(center, target, jde);
    }

    /**
     * Position of {@code target} seen from {@code center}, corrected for light
     * travel time. The light time is returned with it, in days.
     */
    public ApparentPosition apparentPosition(Body center, Body target, double jde) {
        header.requireEpoch(jde);
        return lightTime.apparent(center, target, jde);
    }

    /**
     * Nutation in longitude and obliquity (IAU 1980), radians.
     *
     * @throws ElementNotFoundException if the dataset carries no nutations
     */
    public Nutation nutation(double jde) {
        double[] n = optionalElement(NUTATION, 2, jde, "the Earth's nutations");
        return new Nutation(n[0], n[1]);
    }

    /**
     * Lunar mantle libration angles, radians.
     *
     * @throws ElementNotFoundException if the dataset carries no librations
     */
    public Libration libration(double jde) {
        double[] l = optionalElement(LIBRATION, 3, jde, "lunar librations");
        return new Libration(l[0], l[1], l[2]);
    }

    /**
     * Lunar mantle angular velocity, radians/day.
     *
     * @throws ElementNotFoundException if the dataset does not carry it
     */
    public double[] lunarMantleVelocity(double jde) {
        return optionalElement(MANTLE_VELOCITY, 3, jde, "the lunar mantle velocity");
    }

    /**
     * TT - TDB at the geocenter, seconds. Only the {@code t} releases carry it.
     *
     * @throws ElementNotFoundException if the dataset does not carry it
     */
    public double ttMinusTdb(double jde) {
        return optionalElement(TT_MINUS_TDB, 1, jde, "TT-TDB")[0];
    }

    /**
     * Interpolate a raw element. Checks the epoch and the element before any
     * coefficient file is read.
     */
    @Override
    public double[] interpolate(int element, int components, boolean velocity, double jde) {
        header.requireEpoch(jde);
        header.layoutEntry(element);
        ChebyshevInterpolator.requireComponents(components);
        Chunk chunk = store.chunkFor(jde);
        return interpolator.interpolate(chunk, element, jde, components, velocity);
    }

    private double[] optionalElement(int element, int components, double jde, String what) {
        header.requireEpoch(jde);
        try {
            header.layoutEntry(element);
        } catch (ElementNotFoundException e) {
            throw new ElementNotFoundException(
                    element,
                    "Unable to calculate " + what + " because element " + element
                            + " does not exist within the " + version + " data.",
                    e);
        }
        return interpolate(element, components, false, jde);
    }

    @Override
    public String toString() {
        return "Ephemeris[" + version + ": " + header.description() + "]";
    }
}
