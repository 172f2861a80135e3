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
package com.github.tinemuz.jplde.check;

import com.github.tinemuz.jplde.Body;
import com.github.tinemuz.jplde.Ephemeris;
import com.github.tinemuz.jplde.exceptions.ChunkParseException;
import com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException;
import com.github.tinemuz.jplde.exceptions.ElementNotFoundException;
import com.github.tinemuz.jplde.header.FortranNumbers;
import com.github.tinemuz.jplde.interp.OutputUnit;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a dataset against the reference values JPL ships with it
 * ({@code testpo.NNN}).
 *
 * <p>Everything up to the {@code EOT} line is commentary. Each following line
 * reads {@code denum date jed target center coordinate value}, where target
 * and center use the JPL test codes (1-11 planets, Moon and Sun, 12 solar
 * system barycenter, 13 Earth-Moon barycenter, 14 nutations, 15 librations,
 * 16 lunar mantle angular velocity, 17 TT-TDB) and coordinate is the 1-based
 * component of the position/velocity vector.</p>
 */
public final class ReferenceCheck {
    private static final Logger log = LoggerFactory.getLogger(ReferenceCheck.class);

    /** Precision JPL quotes for its own test program. */
    public static final double DEFAULT_TOLERANCE = 1e-13;
    private static final String END_OF_TEXT = "EOT";

    private final Path source;
    private final List<Entry> entries;

    private ReferenceCheck(Path source, List<Entry> entries) {
        this.source = source;
        this.entries = List.copyOf(entries);
    }

    /** The reference file of a dataset directory, {@code testpo.<version>}. */
    public static Path locate(Path directory, String versionToken) {
        return directory.resolve("testpo." + versionToken);
    }

    /**
     * Parse a reference file.
     *
     * @throws DatasetFileNotFoundException if the file does not exist
     * @throws ChunkParseException if a data line is malformed
     */
    public static ReferenceCheck load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.ISO_8859_1);
        } catch (NoSuchFileException e) {
            throw new DatasetFileNotFoundException(file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        List<Entry> entries = new ArrayList<>();
        boolean data = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!data) {
                data = line.trim().equals(END_OF_TEXT);
                continue;
            }
            if (line.isBlank()) continue;
            entries.add(parseEntry(file, line, i + 1));
        }
        if (!data) {
            throw new ChunkParseException(file.getFileName() + " has no '" + END_OF_TEXT + "' marker");
        }
        log.debug("Read {} reference values from {}", entries.size(), file.getFileName());
        return new ReferenceCheck(file, entries);
    }

    private static Entry parseEntry(Path file, String line, int lineNumber) {
        String[] f = FortranNumbers.fields(line);
        if (f.length < 7) {
            throw new ChunkParseException(file.getFileName() + " line " + lineNumber + " has " + f.length
                    + " fields, expected 7");
        }
        try {
            int target = Integer.parseInt(f[3]);
            int center = Integer.parseInt(f[4]);
            int coordinate = Integer.parseInt(f[5]);
            if (coordinate < 1 || coordinate > 6) {
                throw new NumberFormatException("coordinate " + coordinate + " is not in 1..6");
            }
            return new Entry(f[0], f[1], FortranNumbers.parse(f[2]), target, center, coordinate,
                    FortranNumbers.parse(f[6]), lineNumber);
        } catch (NumberFormatException e) {
            throw new ChunkParseException(
                    file.getFileName() + " line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    public Path source() {
        return source;
    }

    public List<Entry> entries() {
        return entries;
    }

    /**
     * Compare every entry inside the dataset span against {@code ephemeris}.
     * Entries outside the span, or for elements the dataset lacks, are skipped.
     *
     * @throws IllegalStateException if the ephemeris does not report in AU
     */
    public Report run(Ephemeris ephemeris, double tolerance) {
        if (ephemeris.unit() != OutputUnit.AU) {
            throw new IllegalStateException("Reference values are in AU; open the ephemeris with OutputUnit.AU");
        }
        int checked = 0;
        int skipped = 0;
        List<Failure> failures = new ArrayList<>();
        for (Entry e : entries) {
            if (!ephemeris.header().covers(e.jde())) {
                skipped++;
                continue;
            }
            double[] computed;
            try {
                computed = compute(ephemeris, e);
            } catch (ElementNotFoundException missing) {
                skipped++;
                continue;
            }
            if (e.coordinate() > computed.length) {
                skipped++;
                continue;
            }
            checked++;
            double value = computed[e.coordinate() - 1];
            double diff = Math.abs(value - e.expected());
            if (!(diff <= tolerance)) {
                log.warn("{} line {}: expected {} got {} (|Δ|={})",
                        source.getFileName(), e.line(), e.expected(), value, diff);
                failures.add(new Failure(e, value, diff));
            }
        }
        log.info("Reference check of {} against {}: {} checked, {} skipped, {} failed",
                ephemeris.version(), source.getFileName(), checked, skipped, failures.size());
        return new Report(checked, skipped, failures);
    }

    public Report run(Ephemeris ephemeris) {
        return run(ephemeris, DEFAULT_TOLERANCE);
    }

    private static double[] compute(Ephemeris ephemeris, Entry e) {
        switch (e.target()) {
            case 14: return ephemeris.interpolate(12, 2, true, e.jde());
            case 15: return ephemeris.interpolate(13, 3, true, e.jde());
            case 16: return ephemeris.interpolate(14, 3, true, e.jde());
            case 17: return ephemeris.interpolate(15, 1, true, e.jde());
            default:
                return ephemeris.position(body(e.center()), body(e.target()), e.jde()).toArray();
        }
    }

    /** Body for a JPL test code; note that 3 is the Earth and 13 the Earth-Moon barycenter. */
    static Body body(int code) {
        switch (code) {
            case 3: return Body.EARTH;
            case 12: return Body.SOLAR_SYSTEM_BARYCENTER;
            case 13: return Body.EARTH_MOON_BARYCENTER;
            default:
                if (code >= 1 && code <= 11) return Body.fromId(code);
                throw new IllegalArgumentException("No body for test code " + code);
        }
    }

    /** One reference value. */
    public record Entry(
            String denum,
            String date,
            double jde,
            int target,
            int center,
            int coordinate,
            double expected,
            int line) {}

    public record Failure(Entry entry, double computed, double difference) {}

    public record Report(int checked, int skipped, List<Failure> failures) {
        public Report {
            failures = List.copyOf(failures);
        }

        public boolean passed() {
            return failures.isEmpty();
        }
    }
}
