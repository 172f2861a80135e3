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

import com.github.tinemuz.jplde.interp.OutputUnit;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of an {@link Ephemeris} session.
 *
 * <p>Build one with {@link #builder(Path)}, or load it from the classpath
 * resource <code>jplde.properties</code> with {@link #fromClasspath()}:</p>
 *
 * <pre>
 * jplde.directory=/data/de421
 * jplde.version=DE421
 * jplde.unit=AU
 * jplde.cache.max-chunks=1024
 * jplde.lighttime.max-iterations=100
 * </pre>
 */
public final class EphemerisConfig {
    private static final Logger log = LoggerFactory.getLogger(EphemerisConfig.class);
    static final String RESOURCE = "jplde.properties";

    private final Path directory;
    private final DEVersion version;
    private final OutputUnit unit;
    private final long maxCachedChunks;
    private final int lightTimeIterations;

    private EphemerisConfig(Builder b) {
        this.directory = b.directory;
        this.version = b.version;
        this.unit = b.unit;
        this.maxCachedChunks = b.maxCachedChunks;
        this.lightTimeIterations = b.lightTimeIterations;
    }

    public static Builder builder(Path directory) {
        return new Builder(directory);
    }

    /**
     * Load settings from <code>jplde.properties</code> on the classpath. Only
     * {@code jplde.directory} is required.
     *
     * @throws IllegalStateException if the resource is missing, unreadable or invalid
     */
    public static EphemerisConfig fromClasspath() {
        return fromClasspath(RESOURCE);
    }

    static EphemerisConfig fromClasspath(String resource) {
        InputStream in = EphemerisConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Ephemeris settings '{}' not found on classpath", resource);
            throw new IllegalStateException("Ephemeris settings '" + resource + "' not found on classpath");
        }
        Properties props = new Properties();
        try (in) {
            props.load(in);
        } catch (IOException e) {
            log.error("Failed to read ephemeris settings {}", resource, e);
            throw new IllegalStateException("Failed to read ephemeris settings " + resource, e);
        }
        return fromProperties(props);
    }

    /**
     * @throws IllegalStateException if {@code jplde.directory} is absent or a value is invalid
     */
    public static EphemerisConfig fromProperties(Properties props) {
        String dir = props.getProperty("jplde.directory");
        if (dir == null || dir.isBlank()) {
            throw new IllegalStateException("jplde.directory is required");
        }
        try {
            Builder b = builder(Paths.get(dir.trim()));
            String version = props.getProperty("jplde.version");
            if (version != null) b.version(DEVersion.parse(version));
            String unit = props.getProperty("jplde.unit");
            if (unit != null) b.unit(OutputUnit.valueOf(unit.trim().toUpperCase(Locale.ROOT)));
            String chunks = props.getProperty("jplde.cache.max-chunks");
            if (chunks != null) b.maxCachedChunks(Long.parseLong(chunks.trim()));
            String iterations = props.getProperty("jplde.lighttime.max-iterations");
            if (iterations != null) b.lightTimeIterations(Integer.parseInt(iterations.trim()));
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid ephemeris settings: " + e.getMessage(), e);
        }
    }

    public Path directory() {
        return directory;
    }

    public DEVersion version() {
        return version;
    }

    public OutputUnit unit() {
        return unit;
    }

    /** Upper bound of cached coefficient chunks; zero or less means unbounded. */
    public long maxCachedChunks() {
        return maxCachedChunks;
    }

    public int lightTimeIterations() {
        return lightTimeIterations;
    }

    @Override
    public String toString() {
        return "EphemerisConfig[" + version + " at " + directory + ", unit=" + unit + ", maxCachedChunks="
                + maxCachedChunks + ", lightTimeIterations=" + lightTimeIterations + "]";
    }

    public static final class Builder {
        private final Path directory;
        private DEVersion version = DEVersion.DEFAULT;
        private OutputUnit unit = OutputUnit.AU;
        private long maxCachedChunks = 1024;
        private int lightTimeIterations = LightTimeSolver.DEFAULT_MAX_ITERATIONS;

        private Builder(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
        }

        public Builder version(DEVersion version) {
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder unit(OutputUnit unit) {
            this.unit = Objects.requireNonNull(unit, "unit");
            return this;
        }

        public Builder maxCachedChunks(long maxCachedChunks) {
            this.maxCachedChunks = maxCachedChunks;
            return this;
        }

        public Builder lightTimeIterations(int iterations) {
            if (iterations < 1) throw new IllegalArgumentException("lightTimeIterations must be >= 1");
            this.lightTimeIterations = iterations;
            return this;
        }

        public EphemerisConfig build() {
            return new EphemerisConfig(this);
        }
    }
}
