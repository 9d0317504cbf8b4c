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
 * Sphere primitive.
 *
 * @author hal.hildebrand
 */
public record Sphere(Point3d centre, double radius) implements Shape {

    public static final String TYPE = "sphere";

    public Sphere {
        if (centre == null) {
            throw new IllegalArgumentException("Sphere centre is required");
        }
        if (!(radius >= 0.0)) {
            throw new IllegalArgumentException("Sphere radius must be non-negative: " + radius);
        }
        centre = new Point3d(centre);
    }

    /**
     * Solves {@code a t² + b t + c = 0} with {@code a = |d|²}, {@code b = 2 d·(o - centre)},
     * {@code c = |o - centre|² - r²} and keeps the smaller accepted root.
     */
    @Override
    public Optional<Intersection> intersect(Ray ray, double minDistance) {
        var direction = ray.direction();
        var difference = new Vector3d();
        difference.sub(ray.origin(), centre);

        var a = direction.lengthSquared();
        var b = 2.0 * direction.dot(difference);
        var c = difference.lengthSquared() - radius * radius;
        var discriminant = b * b - 4.0 * a * c;
        if (discriminant < 0.0 || a == 0.0) {
            return Optional.empty();
        }

        var root = Math.sqrt(discriminant);
        var t1 = (-b - root) / (2.0 * a);
        var t2 = (-b + root) / (2.0 * a);

        double t;
        if (Intersection.accepts(t1, minDistance)) {
            t = t1;
        } else if (Intersection.accepts(t2, minDistance)) {
            t = t2;
        } else {
            return Optional.empty();
        }

        var point = ray.pointAt(t);
        var normal = Vectors.normalize(Vectors.between(centre, point));
        return Optional.of(new Intersection(t, point, normal));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
