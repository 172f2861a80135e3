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

import com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException;
import com.github.tinemuz.jplde.exceptions.HeaderFormatException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the positional DE ASCII header ({@code header.NNN}).
 *
 * <p>The header is not self-describing: every field sits on a fixed line, and
 * the lines after GROUP 1040 shift with the number of constants (ten names per
 * line, three values per line). Layout by 0-based line, with
 * {@code N = ceil(count / 10)} and {@code V = ceil(count / 3)}:</p>
 *
 * <pre>
 *  0           KSIZE= k    NCOEFF= n
 *  4           description
 *  10          start epoch, final epoch, block size
 *  14          constant count
 *  15..14+N    constant names
 *  19+N..18+N+V constant values
 *  22+N+V      coefficient start pointers
 *  23+N+V      coefficient counts
 *  24+N+V      subinterval counts
 * </pre>
 */
public final class HeaderParser {
    private static final Logger log = LoggerFactory.getLogger(HeaderParser.class);

    /** Suffixes a header may carry, in order of preference. */
    static final String[] HEADER_SUFFIXES = {"_572", "", "_229"};

    private static final int META_LINE = 0;
    private static final int DESCRIPTION_LINE = 4;
    private static final int SPAN_LINE = 10;
    private static final int CONSTANT_COUNT_LINE = 14;
    private static final int NAMES_PER_LINE = 10;
    private static final int VALUES_PER_LINE = 3;

    private HeaderParser() {}

    /**
     * Find the header of a dataset version inside {@code directory}, trying
     * {@code header.V_572}, {@code header.V} and {@code header.V_229} in turn.
     *
     * @param directory    dataset directory
     * @param versionToken version as used in file names, e.g. {@code 421} or {@code 430t}
     * @throws DatasetFileNotFoundException if none of the candidates exists
     */
    public static Path locate(Path directory, String versionToken) {
        for (String suffix : HEADER_SUFFIXES) {
            Path candidate = directory.resolve("header." + versionToken + suffix);
            if (Files.isRegularFile(candidate)) return candidate;
        }
        throw new DatasetFileNotFoundException(
                directory,
                "No header file for version " + versionToken + " was found in '" + directory
                        + "'. The dataset may be incomplete.");
    }

    /**
     * Read and parse a header file.
     *
     * @throws DatasetFileNotFoundException if the file does not exist
     * @throws HeaderFormatException if a required line is missing or a field is not numeric
     */
    public static Header parse(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.ISO_8859_1);
        } catch (NoSuchFileException e) {
            log.error("Ephemeris header {} does not exist", file);
            throw new DatasetFileNotFoundException(file, e);
        } catch (IOException e) {
            log.error("Failed to read ephemeris header {}", file, e);
            throw new UncheckedIOException("Failed to read ephemeris header " + file, e);
        }
        Header header = parse(lines);
        log.info(
                "Loaded header '{}' from {}: JDE {} to {}, {} elements, {} constants",
                header.description(),
                file.getFileName(),
                header.startEpoch(),
                header.finalEpoch(),
                header.elementCount(),
                header.constants().size());
        return header;
    }

    /** Parse header lines already in memory. */
    public static Header parse(List<String> lines) {
        String[] meta = FortranNumbers.fields(line(lines, META_LINE, "KSIZE/NCOEFF"));
        if (meta.length < 4) {
            throw new HeaderFormatException("line 1 should read 'KSIZE= k NCOEFF= n'");
        }
        int kSize = integer(meta[1], "KSIZE");
        int nCoeff = integer(meta[3], "NCOEFF");

        String description = line(lines, DESCRIPTION_LINE, "description").trim();

        String[] span = FortranNumbers.fields(line(lines, SPAN_LINE, "GROUP 1030"));
        if (span.length < 3) {
            throw new HeaderFormatException("GROUP 1030 needs start epoch, final epoch and block size");
        }
        double startEpoch = number(span[0], "start epoch");
        double finalEpoch = number(span[1], "final epoch");
        double blockSize = number(span[2], "block size");
        if (!(blockSize > 0) || finalEpoch < startEpoch) {
            throw new HeaderFormatException(
                    "invalid span " + startEpoch + ".." + finalEpoch + " / " + blockSize);
        }

        int count = integer(line(lines, CONSTANT_COUNT_LINE, "constant count").trim(), "constant count");
        int nameLines = ceilDiv(count, NAMES_PER_LINE);
        int valueLines = ceilDiv(count, VALUES_PER_LINE);

        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < nameLines; i++) {
            for (String name : FortranNumbers.fields(line(lines, CONSTANT_COUNT_LINE + 1 + i, "GROUP 1040"))) {
                names.add(name);
            }
        }
        int valuesStart = 19 + nameLines;
        List<Double> values = new ArrayList<>(count);
        for (int i = 0; i < valueLines; i++) {
            for (String raw : FortranNumbers.fields(line(lines, valuesStart + i, "GROUP 1041"))) {
                values.add(number(raw, "constant value"));
            }
        }
        if (names.size() != count || values.size() != count) {
            throw new HeaderFormatException(
                    "expected " + count + " constants but found " + names.size() + " names and "
                            + values.size() + " values");
        }
        Map<String, Double> constants = new HashMap<>();
        for (int i = 0; i < count; i++) {
            if (constants.put(names.get(i), values.get(i)) != null) {
                throw new HeaderFormatException("constant '" + names.get(i) + "' is defined twice");
            }
        }

        int layoutStart = 22 + nameLines + valueLines;
        int[] starts = integers(line(lines, layoutStart, "GROUP 1050 pointers"), "coefficient start");
        int[] counts = integers(line(lines, layoutStart + 1, "GROUP 1050 counts"), "coefficient count");
        int[] sets = integers(line(lines, layoutStart + 2, "GROUP 1050 subintervals"), "subinterval count");
        if (starts.length != counts.length || starts.length != sets.length) {
            throw new HeaderFormatException(
                    "GROUP 1050 rows differ in length: " + starts.length + ", " + counts.length
                            + ", " + sets.length);
        }
        if (starts.length < Header.MIN_ELEMENTS) {
            throw new HeaderFormatException(
                    "GROUP 1050 lists " + starts.length + " elements, at least "
                            + Header.MIN_ELEMENTS + " are required");
        }
        List<LayoutEntry> layout = new ArrayList<>(starts.length);
        for (int i = 0; i < starts.length; i++) {
            if (starts[i] < 1 || counts[i] < 2 || sets[i] < 1) {
                throw new HeaderFormatException("element " + (i + 1) + " has an invalid layout");
            }
            layout.add(new LayoutEntry(starts[i], counts[i], sets[i]));
        }

        if (!constants.containsKey("AU") || !constants.containsKey("EMRAT")) {
            throw new HeaderFormatException("constants AU and EMRAT are required");
        }
        return new Header(
                description, startEpoch, finalEpoch, blockSize, kSize, nCoeff, constants, layout);
    }

    private static String line(List<String> lines, int index, String what) {
        if (index >= lines.size()) {
            throw new HeaderFormatException(
                    "missing " + what + " at line " + (index + 1) + " (file has " + lines.size()
                            + " lines)");
        }
        return lines.get(index);
    }

    private static int integer(String raw, String what) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new HeaderFormatException(what + " is not an integer: '" + raw + "'", e);
        }
    }

    private static int[] integers(String line, String what) {
        String[] toks = FortranNumbers.fields(line);
        int[] out = new int[toks.length];
        for (int i = 0; i < toks.length; i++) out[i] = integer(toks[i], what);
        return out;
    }

    private static double number(String raw, String what) {
        try {
            return FortranNumbers.parse(raw);
        } catch (NumberFormatException e) {
            throw new HeaderFormatException(what + " is not numeric: '" + raw + "'", e);
        }
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
