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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.jplde.SyntheticDataset;
import com.github.tinemuz.jplde.exceptions.ChunkParseException;
import com.github.tinemuz.jplde.exceptions.DatasetFileNotFoundException;
import com.github.tinemuz.jplde.exceptions.EpochOutOfRangeException;
import com.github.tinemuz.jplde.exceptions.SegmentNotFoundException;
import com.github.tinemuz.jplde.header.Header;
import com.github.tinemuz.jplde.header.HeaderParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkStoreTest {

    @TempDir
    Path dir;

    private SyntheticDataset ds;
    private Header header;

    @BeforeEach
    void setUp() throws IOException {
        ds = SyntheticDataset.de421(dir);
        header = HeaderParser.parse(HeaderParser.locate(dir, "421"));
    }

    private ChunkStore store() {
        return new ChunkStore(header, dir, "421", 16);
    }

    /** 0-based line of a record's {@code recordNumber nCoeff} line within a segment file. */
    private int recordLine(int recordInFile) {
        return recordInFile * store().linesPerRecord();
    }

    @Nested
    @DisplayName("Segment selection")
    class SelectionTests {

        @Test
        @DisplayName("Year estimate")
        void yearOf() {
            assertEquals(2000, ChunkStore.yearOf(2451544.5));
            assertEquals(1999, ChunkStore.yearOf(2451544.4));
            assertEquals(2001, ChunkStore.yearOf(2451909.75));
            assertEquals(1850, ChunkStore.yearOf(2451544.5 - 150 * 365.25));
            assertEquals(-1, ChunkStore.yearOf(2451544.5 - 2001 * 365.25));
        }

        @Test
        @DisplayName("Segments are ordered by year, negative years first")
        void ordering() throws IOException {
            Files.createFile(dir.resolve("ascm0100.421"));
            Files.createFile(dir.resolve("ascp1900.421"));
            Files.createFile(dir.resolve("ascp1950.405"));

            List<Segment> segments = store().listSegments();

            assertEquals(4, segments.size());
            assertEquals("ascm0100.421", segments.get(0).name());
            assertEquals(-100, segments.get(0).year());
            assertEquals(Integer.MIN_VALUE, segments.get(0).fromYear());
            assertEquals(1900, segments.get(0).untilYear());
            assertEquals("ascp1900.421", segments.get(1).name());
            assertEquals("ascp2000.421", segments.get(2).name());
            assertEquals(2001, segments.get(2).untilYear());
            assertEquals("ascp2001.421", segments.get(3).name());
            assertEquals(Integer.MAX_VALUE, segments.get(3).untilYear());
        }

        @Test
        @DisplayName("Epochs are routed to the file of their year")
        void routing() {
            ChunkStore store = store();
            assertEquals(ds.segmentA(), store.selectSegment(SyntheticDataset.START).path());
            assertEquals(ds.segmentA(), store.selectSegment(2451900.0).path());
            assertEquals(ds.segmentB(), store.selectSegment(2451910.5).path());
            assertEquals(ds.segmentB(), store.selectSegment(SyntheticDataset.FINAL).path());
        }

        @Test
        @DisplayName("Epochs outside the header span are rejected before any file is read")
        void outOfRange() throws IOException {
            Files.delete(ds.segmentA());
            Files.delete(ds.segmentB());
            assertThrows(EpochOutOfRangeException.class, () -> store().chunkFor(SyntheticDataset.START - 0.5));
            assertThrows(EpochOutOfRangeException.class, () -> store().chunkFor(SyntheticDataset.FINAL + 0.5));
        }

        @Test
        @DisplayName("No coefficient files at all")
        void noSegments() throws IOException {
            Files.delete(ds.segmentA());
            Files.delete(ds.segmentB());
            SegmentNotFoundException e =
                    assertThrows(SegmentNotFoundException.class, () -> store().chunkFor(2451600.5));
            assertEquals(2451600.5, e.getEpoch());
        }

        @Test
        @DisplayName("Missing dataset directory")
        void missingDirectory() {
            ChunkStore store = new ChunkStore(header, dir.resolve("absent"), "421", 16);
            assertThrows(DatasetFileNotFoundException.class, () -> store.chunkFor(2451600.5));
        }

        @Test
        @DisplayName("Last file does not reach the epoch")
        void gapAtEnd() throws IOException {
            Files.delete(ds.segmentB());
            SegmentNotFoundException e =
                    assertThrows(SegmentNotFoundException.class, () -> store().chunkFor(2452000.5));
            assertEquals(2452000.5, e.getEpoch());
        }
    }

    @Nested
    @DisplayName("Chunk loading")
    class LoadingTests {

        @Test
        @DisplayName("Chunk bounds contain the epoch and coefficients match the file")
        void contents() {
            ChunkStore store = store();
            double jde = 2451900.0;
            Chunk chunk = store.chunkFor(jde);

            assertEquals(2451888.5, chunk.jd0());
            assertEquals(2451920.5, chunk.jd1());
            assertTrue(chunk.contains(jde));
            assertEquals(ds.nCoeff(), chunk.size());
            double[] expected = ds.record(11);
            for (int i = 0; i < expected.length; i++) {
                assertEquals(expected[i], chunk.get(i), "coefficient " + i);
            }
        }

        @Test
        @DisplayName("Record boundaries belong to the later record")
        void boundaries() {
            ChunkStore store = store();
            assertEquals(SyntheticDataset.START, store.chunkFor(SyntheticDataset.START).jd0());
            assertEquals(SyntheticDataset.START + 32, store.chunkFor(SyntheticDataset.START + 32).jd0());
            assertEquals(SyntheticDataset.START, store.chunkFor(SyntheticDataset.START + 31.999).jd0());
        }

        @Test
        @DisplayName("Final epoch is served by the last record")
        void closingBound() {
            Chunk chunk = store().chunkFor(SyntheticDataset.FINAL);
            assertEquals(SyntheticDataset.FINAL, chunk.jd1());
            assertEquals(SyntheticDataset.FINAL - SyntheticDataset.BLOCK, chunk.jd0());
        }

        @Test
        @DisplayName("Repeated queries inside a record share one chunk")
        void cached() {
            ChunkStore store = store();
            Chunk first = store.chunkFor(2451540.0);
            assertSame(first, store.chunkFor(2451560.0));
            assertNotSame(first, store.chunkFor(2451570.0));
        }

        @Test
        @DisplayName("Cached chunks survive removal of their file")
        void servedFromCache() throws IOException {
            ChunkStore store = store();
            Chunk first = store.chunkFor(2451700.5);
            Files.delete(ds.segmentA());
            Files.delete(ds.segmentB());
            assertSame(first, store.chunkFor(2451700.5));
            assertSame(first, store.chunkFor(2451701.5));
        }

        @Test
        @DisplayName("Unbounded cache")
        void unbounded() {
            ChunkStore store = new ChunkStore(header, dir, "421", 0);
            for (int r = 0; r < SyntheticDataset.RECORDS; r++) {
                double jde = SyntheticDataset.START + r * SyntheticDataset.BLOCK + 1;
                assertTrue(store.chunkFor(jde).contains(jde));
            }
        }
    }

    @Nested
    @DisplayName("Malformed coefficient files")
    class MalformedTests {

        @Test
        @DisplayName("Line with a missing value")
        void shortLine() throws IOException {
            int line = recordLine(2) + 6;
            String original = SyntheticDataset.line(ds.segmentA(), line);
            SyntheticDataset.replaceLine(ds.segmentA(), line, original.substring(0, 52) + " ".repeat(26));
            assertThrows(ChunkParseException.class, () -> store().chunkFor(SyntheticDataset.START + 2 * 32 + 1));
        }

        @Test
        @DisplayName("Value that is not a number")
        void notANumber() throws IOException {
            int line = recordLine(3) + 4;
            String original = SyntheticDataset.line(ds.segmentA(), line);
            SyntheticDataset.replaceLine(ds.segmentA(), line, original.replaceFirst("D", "X"));
            assertThrows(ChunkParseException.class, () -> store().chunkFor(SyntheticDataset.START + 3 * 32 + 1));
        }

        @Test
        @DisplayName("Record header with a different coefficient count")
        void recordHeader() throws IOException {
            String replacement = String.format(Locale.ROOT, "%6d%6d", 5, ds.nCoeff() + 1);
            SyntheticDataset.replaceLine(ds.segmentA(), recordLine(4), replacement);
            assertThrows(ChunkParseException.class, () -> store().chunkFor(SyntheticDataset.START + 4 * 32 + 1));
        }

        @Test
        @DisplayName("Records of uneven length")
        void misaligned() throws IOException {
            String first = SyntheticDataset.line(ds.segmentA(), 0);
            SyntheticDataset.replaceLine(ds.segmentA(), 0, first + " ".repeat(100));
            assertThrows(ChunkParseException.class, () -> store().chunkFor(SyntheticDataset.START + 5 * 32 + 1));
        }

        @Test
        @DisplayName("File shorter than one record")
        void truncatedFile() throws IOException {
            Files.writeString(ds.segmentA(), "     1   463\n  0.24515365D+07  0.24515685D+07  0.0D+00\n");
            assertThrows(ChunkParseException.class, () -> store().chunkFor(SyntheticDataset.START + 1));
        }
    }
}
