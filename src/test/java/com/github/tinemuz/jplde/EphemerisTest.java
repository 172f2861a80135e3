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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException;
import com.github.tinemuz.jplde.exceptions.ElementNotFoundException;
import com.github.tinemuz.jplde.exceptions.EpochOutOfRangeException;
import com.github.tinemuz.jplde.header.Header;
import com.github.tinemuz.jplde.header.HeaderParser;
import com.github.tinemuz.jplde.interp.OutputUnit;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end checks against {@link SyntheticDataset}, whose expected values
 * are computed with closed-form Chebyshev polynomials.
 */
class EphemerisTest {

    private static final double K = LightTimeSolver.DAYS_PER_AU;

    @TempDir
    Path dir;

    /** Span ends, record and file boundaries, and seeded random epochs. */
    private static double[] epochs() {
        List<Double> list = new ArrayList<>(List.of(
                SyntheticDataset.START,
                SyntheticDataset.START + 32,
                2451888.5,
                2451909.75,
                2451920.5,
                2452100.25,
                SyntheticDataset.FINAL - 1e-3,
                SyntheticDataset.FINAL));
        Random rnd = new Random(421);
        for (int i = 0; i < 40; i++) {
            list.add(SyntheticDataset.START + rnd.nextDouble() * (SyntheticDataset.FINAL - SyntheticDataset.START));
        }
        return list.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static void assertClose(double expected, double actual, String message) {
        assertEquals(expected, actual, 1e-11 * Math.max(1, Math.abs(expected)), message);
    }

    private static void assertClose(Vector6 expected, Vector6 actual, String message) {
        for (int i = 0; i < 6; i++) {
            assertClose(expected.component(i), actual.component(i), message + " [" + i + "]");
        }
    }

    @Nested
    @DisplayName("Body positions")
    class PositionTests {

        @Test
        @DisplayName("Barycentric vectors of every body match the closed form")
        void barycentric() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open();
            for (double jde : epochs()) {
                for (Body body : Body.values()) {
                    assertClose(ds.expectedBarycentric(body, jde), eph.position(body, jde), body + " at " + jde);
                }
            }
        }

        @Test
        @DisplayName("Relative vectors are target minus center")
        void relative() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open();
            double jde = 2452000.5;
            Vector6 expected = ds.expectedBarycentric(Body.MARS, jde)
                    .subtract(ds.expectedBarycentric(Body.EARTH, jde));
            assertClose(expected, eph.position(Body.EARTH, Body.MARS, jde), "Earth -> Mars");
            assertEquals(
                    eph.position(Body.EARTH, Body.MARS, jde).negate(),
                    eph.position(Body.MARS, Body.EARTH, jde));
        }

        @Test
        @DisplayName("Moon minus Earth is the stored geocentric Moon")
        void geocentricMoon() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            for (double jde : epochs()) {
                Vector6 geo = Vector6.of(eph.interpolate(10, 3, true, jde));
                assertClose(geo, eph.position(Body.EARTH, Body.MOON, jde), "Moon at " + jde);
            }
        }

        @Test
        @DisplayName("Barycenter is the origin everywhere in the span")
        void origin() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            assertEquals(Vector6.ZERO, eph.position(Body.SOLAR_SYSTEM_BARYCENTER, SyntheticDataset.START));
            assertEquals(Vector6.ZERO, eph.position(Body.SOLAR_SYSTEM_BARYCENTER, SyntheticDataset.FINAL));
        }

        @Test
        @DisplayName("Results are reproducible within and across sessions")
        void deterministic() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris a = ds.open();
            Ephemeris b = ds.open();
            for (double jde : epochs()) {
                Vector6 first = a.position(Body.VENUS, Body.PLUTO, jde);
                assertEquals(first, a.position(Body.VENUS, Body.PLUTO, jde));
                assertEquals(first, b.position(Body.VENUS, Body.PLUTO, jde));
            }
        }
    }

    @Nested
    @DisplayName("Dataset span")
    class SpanTests {

        @Test
        @DisplayName("Both span ends are inclusive")
        void inclusive() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            assertTrue(Double.isFinite(eph.position(Body.SUN, SyntheticDataset.START).x()));
            assertTrue(Double.isFinite(eph.position(Body.SUN, SyntheticDataset.FINAL).x()));
        }

        @Test
        @DisplayName("Epochs just outside the span are rejected")
        void outside() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            double after = SyntheticDataset.FINAL + 1e-6;
            EpochOutOfRangeException e =
                    assertThrows(EpochOutOfRangeException.class, () -> eph.position(Body.MARS, after));
            assertEquals(after, e.getRequested());
            assertEquals(SyntheticDataset.START, e.getStartEpoch());
            assertEquals(SyntheticDataset.FINAL, e.getFinalEpoch());
            assertTrue(e.getMessage().contains(SyntheticDataset.DESCRIPTION));

            double before = SyntheticDataset.START - 1e-6;
            assertThrows(EpochOutOfRangeException.class, () -> eph.position(Body.EARTH, Body.MOON, before));
            assertThrows(EpochOutOfRangeException.class,
                    () -> eph.position(Body.SOLAR_SYSTEM_BARYCENTER, before));
            assertThrows(EpochOutOfRangeException.class,
                    () -> eph.apparentPosition(Body.EARTH, Body.MARS, before));
            assertThrows(EpochOutOfRangeException.class, () -> eph.nutation(before));
        }
    }

    @Nested
    @DisplayName("Optional elements")
    class OptionalElementTests {

        @Test
        @DisplayName("Nutations")
        void nutation() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open();
            for (double jde : epochs()) {
                double[] expected = ds.expected(12, false, jde, OutputUnit.AU);
                Nutation n = eph.nutation(jde);
                assertClose(expected[0], n.longitude(), "longitude");
                assertClose(expected[1], n.obliquity(), "obliquity");
            }
        }

        @Test
        @DisplayName("Librations are the stored angles, unwrapped")
        void libration() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open();
            boolean negativePsiSeen = false;
            for (double jde : epochs()) {
                double[] expected = ds.expected(13, false, jde, OutputUnit.AU);
                double[] stored = eph.interpolate(13, 3, false, jde);
                Libration l = eph.libration(jde);
                assertClose(expected[0], l.phi(), "phi");
                assertClose(expected[1], l.theta(), "theta");
                assertClose(expected[2], l.psi(), "psi");
                assertEquals(stored[2], l.psi(), "psi at " + jde);
                negativePsiSeen |= l.psi() < 0;
            }
            assertTrue(negativePsiSeen, "fixture should produce a negative third angle");
        }

        @Test
        @DisplayName("Lunar mantle velocity and TT-TDB of a t release")
        void tRelease() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de430t(dir);
            Ephemeris eph = ds.open();
            for (double jde : epochs()) {
                assertClose(ds.expected(15, false, jde, OutputUnit.AU)[0], eph.ttMinusTdb(jde), "TT-TDB");
                double[] expected = ds.expected(14, false, jde, OutputUnit.AU);
                double[] actual = eph.lunarMantleVelocity(jde);
                assertEquals(3, actual.length);
                for (int i = 0; i < 3; i++) {
                    assertClose(expected[i], actual[i], "mantle " + i);
                }
            }
        }

        @Test
        @DisplayName("Missing elements name the element and the release")
        void missing() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de406(dir);
            Files.delete(ds.segmentA());
            Files.delete(ds.segmentB());
            Ephemeris eph = ds.open();

            ElementNotFoundException e =
                    assertThrows(ElementNotFoundException.class, () -> eph.nutation(2451600.5));
            assertEquals(12, e.getElement());
            assertTrue(e.getMessage().contains("DE406"), e.getMessage());
            assertEquals(13, assertThrows(ElementNotFoundException.class,
                    () -> eph.libration(2451600.5)).getElement());
            assertEquals(14, assertThrows(ElementNotFoundException.class,
                    () -> eph.lunarMantleVelocity(2451600.5)).getElement());
            assertEquals(15, assertThrows(ElementNotFoundException.class,
                    () -> eph.ttMinusTdb(2451600.5)).getElement());
        }

        @Test
        @DisplayName("Raw lookups take one to three components")
        void rawComponentCount() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open();
            assertEquals(3, eph.interpolate(4, 3, false, 2452000.5).length);
            assertThrows(IllegalArgumentException.class, () -> eph.interpolate(4, 6, false, 2452000.5));

            Files.delete(ds.segmentA());
            Files.delete(ds.segmentB());
            Ephemeris fresh = ds.open();
            assertThrows(IllegalArgumentException.class, () -> fresh.interpolate(4, 4, true, 2451600.5));
        }

        @Test
        @DisplayName("Release without TT-TDB")
        void noTtMinusTdb() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            assertEquals(15, assertThrows(ElementNotFoundException.class,
                    () -> eph.ttMinusTdb(2451600.5)).getElement());
        }
    }

    @Nested
    @DisplayName("Output units")
    class UnitTests {

        @Test
        @DisplayName("Kilometre sessions report km and km/day")
        void kilometres() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris eph = ds.open(OutputUnit.KM);
            assertEquals(OutputUnit.KM, eph.unit());
            for (double jde : epochs()) {
                assertClose(Vector6.of(ds.expected(4, true, jde, OutputUnit.KM)), eph.position(Body.MARS, jde), "Mars");
            }
        }

        @Test
        @DisplayName("Light time does not depend on the unit")
        void lightTime() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            ApparentPosition au = ds.open().apparentPosition(Body.EARTH, Body.JUPITER, 2452000.5);
            ApparentPosition km = ds.open(OutputUnit.KM).apparentPosition(Body.EARTH, Body.JUPITER, 2452000.5);
            assertEquals(au.lightTimeDays(), km.lightTimeDays(), 1e-12);
            assertEquals(au.position().x() * SyntheticDataset.AU_KM, km.position().x(),
                    1e-9 * Math.abs(km.position().x()));
        }
    }

    @Nested
    @DisplayName("Apparent positions")
    class ApparentTests {

        @Test
        @DisplayName("A body seen from itself has no light time")
        void self() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            ApparentPosition p = eph.apparentPosition(Body.SUN, Body.SUN, 2452000.5);
            assertEquals(0.0, p.lightTimeDays());
            assertEquals(0.0, p.position().distance());
        }

        @Test
        @DisplayName("Light time equals the retarded distance times k")
        void retarded() throws IOException {
            Ephemeris eph = SyntheticDataset.de421(dir).open();
            for (double jde : new double[] {2451600.5, 2452000.5, 2452200.0}) {
                ApparentPosition p = eph.apparentPosition(Body.EARTH, Body.MARS, jde);
                assertEquals(K * p.position().distance(), p.lightTimeDays(), 1e-12);
                assertEquals(0.0, p.position().vx());
                Vector6 retarded = eph.position(Body.EARTH, Body.MARS, jde - p.lightTimeDays());
                assertEquals(retarded.positionOnly(), p.position());
            }
        }
    }

    @Nested
    @DisplayName("Thread Safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Concurrent queries agree with sequential ones")
        void concurrentQueries() throws Exception {
            SyntheticDataset ds = SyntheticDataset.de421(dir);
            Ephemeris sequential = ds.open();
            Ephemeris shared = Ephemeris.open(
                    EphemerisConfig.builder(dir).version(ds.version()).maxCachedChunks(4).build());

            final int threadCount = 8;
            final int queries = 200;
            double[] epochs = new double[queries];
            Body[] bodies = new Body[queries];
            Vector6[] expected = new Vector6[queries];
            Random rnd = new Random(7);
            for (int i = 0; i < queries; i++) {
                epochs[i] = SyntheticDataset.START + rnd.nextDouble() * (SyntheticDataset.FINAL - SyntheticDataset.START);
                bodies[i] = Body.values()[rnd.nextInt(Body.values().length)];
                expected[i] = sequential.position(Body.EARTH, bodies[i], epochs[i]);
            }

            Queue<String> mismatches = new ConcurrentLinkedQueue<>();
            Queue<Throwable> errors = new ConcurrentLinkedQueue<>();
            Thread[] threads = new Thread[threadCount];
            for (int t = 0; t < threadCount; t++) {
                final int offset = t * 17;
                threads[t] = new Thread(() -> {
                    try {
                        for (int j = 0; j < queries; j++) {
                            int i = (j + offset) % queries;
                            Vector6 v = shared.position(Body.EARTH, bodies[i], epochs[i]);
                            if (!v.equals(expected[i])) mismatches.add(bodies[i] + " at " + epochs[i]);
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    }
                });
                threads[t].start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            assertTrue(errors.isEmpty(), () -> "errors: " + errors);
            assertTrue(mismatches.isEmpty(), () -> "mismatches: " + mismatches);
        }
    }

    @Nested
    @DisplayName("Opening datasets")
    class OpeningTests {

        @Test
        @DisplayName("Missing header")
        void missingHeader() {
            assertThrows(DatasetFileNotFoundException.class, () -> Ephemeris.open(dir, DEVersion.parse("DE405")));
        }

        @Test
        @DisplayName("Session on a parsed header")
        void withHeader() throws IOException {
            SyntheticDataset ds = SyntheticDataset.de430t(dir);
            Header header = Ephemeris.loadHeader(HeaderParser.locate(dir, "430t"));
            Ephemeris eph = Ephemeris.withHeader(header, EphemerisConfig.builder(dir).version(ds.version()).build());

            assertSame(header, eph.header());
            assertEquals(DEVersion.parse("430t"), eph.version());
            assertEquals(15, eph.header().elementCount());
            assertTrue(eph.toString().contains("DE430t"));
            assertClose(ds.expectedBarycentric(Body.SUN, 2451700.5), eph.position(Body.SUN, 2451700.5), "Sun");
        }
    }
}
