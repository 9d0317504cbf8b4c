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
 * Ray with an origin and a direction. The direction is not required to be unit length; intersection math accounts for
 * its magnitude. Components are copied on construction and must be treated as read-only afterwards.
 *
 * @author hal.hildebrand
 */
public record Ray(Point3d origin, Vector3d direction) {

    public Ray {
        if (origin == null || direction == null) {
            throw new IllegalArgumentException("Ray origin and direction are required");
        }
        origin = new Point3d(origin);
        direction = new Vector3d(direction);
    }

    /**
     * Point at parameter {@code t}: {@code origin + t * direction}.
     */
    public Point3d pointAt(double t) {
        return Vectors.pointAlong(origin, direction, t);
    }

    @Override
    public String toString() {
        return String.format("Ray[o=(%.4f,%.4f,%.4f), d=(%.4f,%.4f,%.4f)]", origin.x, origin.y, origin.z, direction.x,
                             direction.y, direction.z);
    }
}
