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
 * Cartesian position and velocity. Units are AU and AU/day unless the
 * session was opened with {@link com.github.tinemuz.jplde.interp.OutputUnit#KM}.
 */
public record Vector6(double x, double y, double z, double vx, double vy, double vz) {
    public static final Vector6 ZERO = new Vector6(0, 0, 0, 0, 0, 0);

    /**
     * Build from an interpolation result: three positions, optionally followed
     * by three velocities.
     */
    public static Vector6 of(double[] pv) {
        if (pv.length != 3 && pv.length != 6) {
            throw new IllegalArgumentException("expected 3 or 6 components, got " + pv.length);
        }
        if (pv.length == 3) return new Vector6(pv[0], pv[1], pv[2], 0, 0, 0);
        return new Vector6(pv[0], pv[1], pv[2], pv[3], pv[4], pv[5]);
    }

    public Vector6 add(Vector6 o) {
        return new Vector6(x + o.x, y + o.y, z + o.z, vx + o.vx, vy + o.vy, vz + o.vz);
    }

    public Vector6 subtract(Vector6 o) {
        return new Vector6(x - o.x, y - o.y, z - o.z, vx - o.vx, vy - o.vy, vz - o.vz);
    }

    public Vector6 scale(double f) {
        return new Vector6(x * f, y * f, z * f, vx * f, vy * f, vz * f);
    }

    public Vector6 negate() {
        return new Vector6(-x, -y, -z, -vx, -vy, -vz);
    }

    /** Same position with the velocity set to zero. */
    public Vector6 positionOnly() {
        return new Vector6(x, y, z, 0, 0, 0);
    }

    /** Length of the position part. */
    public double distance() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /** Component by 0-based index: x, y, z, vx, vy, vz. */
    public double component(int index) {
        switch (index) {
            case 0: return x;
            case 1: return y;
            case 2: return z;
            case 3: return vx;
            case 4: return vy;
            case 5: return vz;
            default: throw new IndexOutOfBoundsException("component " + index);
        }
    }

    public double[] toArray() {
        return new double[] {x, y, z, vx, vy, vz};
    }
}
