/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Specular.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.specular.geometry;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Static vector helpers layered over {@code javax.vecmath}.
 *
 * <p>All methods allocate a fresh result and never modify their arguments, so they are safe to call on values shared
 * between render threads.
 *
 * @author hal.hildebrand
 */
public final class Vectors {

    /**
     * Squared length below which a vector is treated as having no direction.
     */
    public static final double DEGENERATE_LENGTH_SQUARED = 1e-24;

    private Vectors() {
    }

    /**
     * Component-wise (Hadamard) product {@code a ⊙ b}.
     */
    public static Vector3d hadamard(Tuple3d a, Tuple3d b) {
        return new Vector3d(a.x * b.x, a.y * b.y, a.z * b.z);
    }

    /**
     * Mirror {@code direction} about the plane whose normal is {@code normal}: {@code d - 2 (d·n) n}.
     *
     * @param direction incoming direction, any length
     * @param normal    unit surface normal
     * @return reflected direction with the same length as {@code direction}
     */
    public static Vector3d reflect(Vector3d direction, Vector3d normal) {
        var scaled = new Vector3d(normal);
        scaled.scale(2.0 * direction.dot(normal));
        var reflected = new Vector3d(direction);
        reflected.sub(scaled);
        return reflected;
    }

    /**
     * Unit vector in the direction of {@code v}. A zero (or vanishingly short) vector has no direction and yields the
     * zero vector rather than NaN components.
     */
    public static Vector3d normalize(Tuple3d v) {
        var result = new Vector3d(v);
        if (isDegenerate(result)) {
            result.set(0.0, 0.0, 0.0);
            return result;
        }
        result.normalize();
        return result;
    }

    /**
     * @return true if {@code v} is too short to carry a direction
     */
    public static boolean isDegenerate(Vector3d v) {
        return !(v.lengthSquared() > DEGENERATE_LENGTH_SQUARED);
    }

    /**
     * Vector from {@code from} to {@code to}.
     */
    public static Vector3d between(Point3d from, Point3d to) {
        var v = new Vector3d();
        v.sub(to, from);
        return v;
    }

    /**
     * Unit vector pointing from {@code from} toward {@code to}, or zero if the points coincide.
     */
    public static Vector3d direction(Point3d from, Point3d to) {
        return normalize(between(from, to));
    }

    /**
     * {@code base + s * v} as a new point.
     */
    public static Point3d pointAlong(Point3d base, Vector3d v, double s) {
        var p = new Point3d(v);
        p.scale(s);
        p.add(base);
        return p;
    }

    /**
     * {@code s * v} as a new vector.
     */
    public static Vector3d scaled(Tuple3d v, double s) {
        var result = new Vector3d(v);
        result.scale(s);
        return result;
    }

    /**
     * Cross product {@code a × b} as a new vector.
     */
    public static Vector3d cross(Vector3d a, Vector3d b) {
        var result = new Vector3d();
        result.cross(a, b);
        return result;
    }

    public static double clamp(double x, double min, double max) {
        if (x < min) {
            return min;
        }
        if (x > max) {
            return max;
        }
        return x;
    }

    /**
     * @return true if every component is neither NaN nor infinite
     */
    public static boolean isFinite(Tuple3d v) {
        return Double.isFinite(v.x) && Double.isFinite(v.y) && Double.isFinite(v.z);
    }

    /**
     * Copy of {@code v}, or the zero vector for {@code null}.
     */
    public static Vector3d copyOrZero(Tuple3d v) {
        return v == null ? new Vector3d() : new Vector3d(v);
    }
}
