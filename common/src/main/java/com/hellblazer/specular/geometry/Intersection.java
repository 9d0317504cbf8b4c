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
import javax.vecmath.Vector3d;

/**
 * A ray/surface hit: ray parameter, hit point and unit surface normal at that point. Lives only for one shading
 * computation.
 *
 * @param t        ray parameter of the hit
 * @param position {@code origin + t * direction}
 * @param normal   unit outward normal at {@code position}
 * @author hal.hildebrand
 */
public record Intersection(double t, Point3d position, Vector3d normal) implements Comparable<Intersection> {

    /**
     * Whether a root {@code t} lies beyond {@code minDistance}. Secondary rays need {@code t} strictly beyond their
     * epsilon; primary rays ({@code minDistance == 0}) also accept a hit exactly at the origin.
     */
    public static boolean accepts(double t, double minDistance) {
        return t > minDistance || (minDistance == 0.0 && t == 0.0);
    }

    /**
     * Orders intersections nearest first.
     */
    @Override
    public int compareTo(Intersection other) {
        return Double.compare(t, other.t);
    }

    @Override
    public String toString() {
        return String.format("Intersection[t=%.6f, pos=(%.4f,%.4f,%.4f), n=(%.4f,%.4f,%.4f)]", t, position.x,
                             position.y, position.z, normal.x, normal.y, normal.z);
    }
}
