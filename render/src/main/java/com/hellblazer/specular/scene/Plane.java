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
package com.hellblazer.specular.scene;

import com.hellblazer.specular.geometry.Intersection;
import com.hellblazer.specular.geometry.Ray;
import com.hellblazer.specular.geometry.Vectors;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Optional;

/**
 * Infinite plane through {@code point} with unit normal {@code normal}. The normal is normalized on construction and
 * is reported unchanged at every hit; back faces are not flipped toward the viewer.
 *
 * @author hal.hildebrand
 */
public record Plane(Point3d point, Vector3d normal) implements Shape {

    public static final String TYPE = "plane";

    public Plane {
        if (point == null || normal == null) {
            throw new IllegalArgumentException("Plane point and normal are required");
        }
        if (Vectors.isDegenerate(normal)) {
            throw new IllegalArgumentException("Plane normal cannot be zero");
        }
        point = new Point3d(point);
        normal = Vectors.normalize(normal);
    }

    @Override
    public Optional<Intersection> intersect(Ray ray, double minDistance) {
        var denominator = normal.dot(ray.direction());
        if (denominator == 0.0) {
            // parallel
            return Optional.empty();
        }
        var t = normal.dot(Vectors.between(ray.origin(), point)) / denominator;
        if (!Intersection.accepts(t, minDistance)) {
            return Optional.empty();
        }
        return Optional.of(new Intersection(t, ray.pointAt(t), new Vector3d(normal)));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
