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
package com.github.tinemuz.jplde.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.tinemuz.jplde.exceptions.ChunkParseException;
import com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException;
import com.github.tinemuz.jplde.exceptions.SegmentNotFoundException;
import com.github.tinemuz.jplde.header.FortranNumbers;
import com.github.tinemuz.jplde.header.Header;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates and loads the coefficient chunk covering a requested epoch.
 *
 * <p>A dataset is split into segment files by calendar year
 * ({@code ascpYYYY.V}, or {@code ascmYYYY.V} for years before 0). Every file
 * is a sequence of records of identical byte length; each record starts with a
 * {@code recordNumber nCoeff} line followed by the coefficients, three per
 * line, the first two being the record's JDE bounds. The first record is
 * measured once per file and every later record is read by seeking straight
 * to {@code index * recordBytes}.</p>
 *
 * <p>Segment choice, file geometry and chunks are cached in Caffeine caches,
 * so repeated queries inside one chunk never touch the file system. The
 * caches are safe for concurrent use; a chunk becomes visible only once it
 * is fully parsed.</p>
 */
public final class ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    /** JDE of 2000-01-01 00:00 used as the anchor of the year estimate. */
    private static final double JDE_2000 = 2451544.5;
    private static final double DAYS_PER_YEAR = 365.25;
    private static final int VALUES_PER_LINE = 3;

    private final Header header;
    private final Path directory;
    private final Pattern segmentName;
    private final Cache<Integer, Segment> segmentsByYear;
    private final Cache<Path, RecordGeometry> geometry;
    private final Cache<ChunkKey, Chunk> chunks;

    /**
     * @param header          parsed header of the dataset
     * @param directory       directory holding the segment files
     * @param versionToken    version as used in file names, e.g. {@code 421}
     * @param maxCachedChunks upper bound of cached chunks; zero or less means unbounded
     */
    public ChunkStore(Header header, Path directory, String versionToken, long maxCachedChunks) {
        this.header = header;
        this.directory = directory;
        this.segmentName = Pattern.compile("asc([pm])(\\d+)\\." + Pattern.quote(versionToken));
        this.segmentsByYear = Caffeine.newBuilder().build();
        this.geometry = Caffeine.newBuilder().build();
        Caffeine<Object, Object> chunkCache = Caffeine.newBuilder();
        if (maxCachedChunks > 0) chunkCache.maximumSize(maxCachedChunks);
        this.chunks = chunkCache.build();
    }

    /**
     * Calendar year used to pick a segment file. Coarse on purpose: it only has
     * to agree with the year tokens in the segment file names.
     */
    public static int yearOf(double jde) {
        return (int) Math.floor(2000 + Math.floor((jde - JDE_2000) / DAYS_PER_YEAR));
    }

    /** Number of physical lines one record spans. */
    public int linesPerRecord() {
        return 2 + header.nCoeff() / VALUES_PER_LINE;
    }

    /** Chunk covering {@code jde}, selecting the segment file first. */
    public Chunk chunkFor(double jde) {
        return loadChunk(selectSegment(jde), jde);
    }

    /**
     * Segment file whose year range contains the year of {@code jde}.
     *
     * @throws com.github.tinemuz.jplde.exceptions.EpochOutOfRangeException if the
     *         epoch is outside the header's span
     * @throws SegmentNotFoundException if no segment file of this version exists
     */
    public Segment selectSegment(double jde) {
        header.requireEpoch(jde);
        int year = yearOf(jde);
        return segmentsByYear.get(year, y -> findSegment(y, jde));
    }

    /**
     * Load the chunk of {@code segment} that covers {@code jde}.
     *
     * @throws SegmentNotFoundException if the segment's records do not reach the epoch
     * @throws ChunkParseException if the record is short, malformed or misaligned
     */
    public Chunk loadChunk(Segment segment, double jde) {
        RecordGeometry geo = geometry.get(segment.path(), this::measure);
        long computed = (long) Math.floor((jde - geo.jde0()) / header.blockSize());
        boolean closingBound = computed == geo.recordCount() && computed > 0;
        long index = closingBound ? computed - 1 : computed;
        if (index < 0 || index >= geo.recordCount()) {
            throw new SegmentNotFoundException(
                    jde,
                    "Segment " + segment.name() + " covers " + geo.recordCount()
                            + " records from JDE " + geo.jde0() + " and does not reach JDE " + jde);
        }
        double chunkStart = geo.jde0() + index * header.blockSize();
        Chunk chunk = chunks.get(
                new ChunkKey(segment.path(), chunkStart), key -> read(segment, geo, index));

        if (closingBound && jde > chunk.jd1()) {
            throw new SegmentNotFoundException(
                    jde, "Segment " + segment.name() + " ends at JDE " + chunk.jd1() + " before JDE " + jde);
        }
        if (jde < chunk.jd0() || jde > chunk.jd1()) {
            throw new ChunkParseException(
                    "record " + (index + 1) + " of " + segment.name() + " covers [" + chunk.jd0() + ", "
                            + chunk.jd1() + ") but was selected for JDE " + jde
                            + "; records are not of uniform length");
        }
        return chunk;
    }

    private Segment findSegment(int year, double jde) {
        List<Segment> segments = listSegments();
        if (segments.isEmpty()) {
            throw new SegmentNotFoundException(
                    jde, "No coefficient files matching '" + segmentName.pattern() + "' in " + directory);
        }
        for (Segment segment : segments) {
            if (segment.selects(year)) {
                log.debug("Year {} served by segment {}", year, segment.name());
                return segment;
            }
        }
        throw new SegmentNotFoundException(jde, "No coefficient file covers year " + year);
    }

    /** Segment files of this version in ascending year order. */
    public List<Segment> listSegments() {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> segmentName.matcher(p.getFileName().toString()).matches())
                    .toList();
        } catch (NoSuchFileException e) {
            throw new DatasetFileNotFoundException(directory, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparingInt(this::yearToken));

        List<Segment> segments = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            int year = yearToken(sorted.get(i));
            int from = i == 0 ? Integer.MIN_VALUE : year;
            int until = i == sorted.size() - 1 ? Integer.MAX_VALUE : yearToken(sorted.get(i + 1));
            segments.add(new Segment(sorted.get(i), year, from, until));
        }
        return segments;
    }

    private int yearToken(Path file) {
        Matcher m = segmentName.matcher(file.getFileName().toString());
        if (!m.matches()) throw new IllegalArgumentException("not a segment file: " + file);
        int year = Integer.parseInt(m.group(2));
        return "m".equals(m.group(1)) ? -year : year;
    }

    // Reads the first record to learn where the file starts and how long a record is.
    private RecordGeometry measure(Path file) {
        int lines = linesPerRecord();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            long size = Files.size(file);
            ByteArrayOutputStream firstDataLine = new ByteArrayOutputStream(96);
            long bytes = 0;
            int newlines = 0;
            int b;
            while (newlines < lines && (b = in.read()) != -1) {
                bytes++;
                if (b == '\n') {
                    newlines++;
                } else if (newlines == 1) {
                    firstDataLine.write(b);
                }
            }
            boolean unterminatedLastLine = newlines == lines - 1 && bytes == size;
            if (newlines < lines && !unterminatedLastLine) {
                throw new ChunkParseException(
                        file.getFileName() + " is shorter than one record of " + lines + " lines");
            }
            String[] fields = FortranNumbers.fields(firstDataLine.toString(StandardCharsets.ISO_8859_1));
            if (fields.length < 2) {
                throw new ChunkParseException(file.getFileName() + " has no interval bounds on line 2");
            }
            double jde0 = parse(fields[0], file, 2);
            long count = (size + bytes - 1) / bytes;
            log.debug("Segment {} starts at JDE {}: {} records of {} bytes", file.getFileName(), jde0, count, bytes);
            return new RecordGeometry(jde0, bytes, count, size);
        } catch (NoSuchFileException e) {
            throw new DatasetFileNotFoundException(file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private Chunk read(Segment segment, RecordGeometry geo, long index) {
        long offset = index * geo.recordBytes();
        int length = (int) Math.min(geo.recordBytes(), geo.fileBytes() - offset);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(segment.path(), StandardOpenOption.READ)) {
            while (buffer.hasRemaining()) {
                int n = channel.read(buffer, offset + buffer.position());
                if (n < 0) break;
            }
        } catch (NoSuchFileException e) {
            throw new DatasetFileNotFoundException(segment.path(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + segment.path(), e);
        }
        String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.ISO_8859_1);
        String[] lines = text.split("\r?\n");
        int expected = linesPerRecord();
        long firstLine = index * expected + 1;
        if (lines.length < expected) {
            throw new ChunkParseException(
                    segment.name() + " record " + (index + 1) + " has " + lines.length + " lines, expected "
                            + expected);
        }

        String[] recordHeader = FortranNumbers.fields(lines[0]);
        if (recordHeader.length < 2 || !recordHeader[1].equals(Integer.toString(header.nCoeff()))) {
            throw new ChunkParseException(
                    segment.name() + " line " + firstLine + " should read 'recordNumber " + header.nCoeff()
                            + "' but reads '" + lines[0].trim() + "'");
        }

        double[] values = new double[(expected - 1) * VALUES_PER_LINE];
        int n = 0;
        for (int i = 1; i < expected; i++) {
            String[] fields = FortranNumbers.fields(lines[i]);
            if (fields.length != VALUES_PER_LINE) {
                throw new ChunkParseException(
                        segment.name() + " line " + (firstLine + i) + " holds " + fields.length
                                + " values, expected " + VALUES_PER_LINE);
            }
            for (String field : fields) {
                values[n++] = parse(field, segment.path(), firstLine + i);
            }
        }
        double[] coefficients = new double[header.nCoeff()];
        System.arraycopy(values, 0, coefficients, 0, coefficients.length);
        Chunk chunk = new Chunk(coefficients);
        log.debug("Loaded {} from {} record {}", chunk, segment.name(), index + 1);
        return chunk;
    }

    private static double parse(String field, Path file, long line) {
        try {
            return FortranNumbers.parse(field);
        } catch (NumberFormatException e) {
            throw new ChunkParseException(
                    file.getFileName() + " line " + line + ": '" + field + "' is not a number", e);
        }
    }

    /** Identity of a cached chunk: its segment file and starting JDE. */
    private record ChunkKey(Path segment, double chunkStart) {}
}
