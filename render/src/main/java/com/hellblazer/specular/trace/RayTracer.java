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
package com.hellblazer.specular.trace;

import com.hellblazer.specular.geometry.Ray;
import com.hellblazer.specular.geometry.Vectors;
import com.hellblazer.specular.scene.Scene;

import javax.vecmath.Vector3d;

/**
 * Recursive entry point of the pipeline: nearest hit, local shading, then a mirror reflection ray attenuated by the
 * material's reflectivity. The bounce count is threaded explicitly through every call and recursion stops once it
 * reaches {@code maxBounces}, which also bounds stack depth for facing mirrors.
 *
 * @author hal.hildebrand
 */
public class RayTracer {

    private final IntersectionEngine intersections;
    private final ShadingEngine      shading;
    private final Vector3d           background;
    private final int                maxBounces;
    private final double             reflectionEpsilon;

    /**
     * @param scene             scene to trace
     * @param maxBounces        reflection ceiling per primary ray
     * @param shadowEpsilon     minimum distance along shadow rays
     * @param reflectionEpsilon minimum distance along reflection rays
     */
    public RayTracer(Scene scene, int maxBounces, double shadowEpsilon, double reflectionEpsilon) {
        if (maxBounces < 0) {
            throw new IllegalArgumentException("Max bounces must be non-negative: " + maxBounces);
        }
        this.intersections = new IntersectionEngine(scene.objects());
        this.shading = new ShadingEngine(intersections, scene.lights(), scene.ambientLight(), shadowEpsilon);
        this.background = new Vector3d(scene.background());
        this.maxBounces = maxBounces;
        this.reflectionEpsilon = reflectionEpsilon;
    }

    /**
     * Trace a primary ray.
     */
    public Vector3d trace(Ray ray) {
        return trace(ray, 0.0, 0);
    }

    /**
     * Colour seen along {@code ray}.
     *
     * @param ray         ray to follow
     * @param minDistance self-intersection guard for the ray's origin
     * @param depth       reflections already performed for this primary ray
     * @return linear RGB; the background colour if nothing is hit
     */
    public Vector3d trace(Ray ray, double minDistance, int depth) {
        var found = intersections.nearest(ray, minDistance);
        if (found.isEmpty()) {
            return new Vector3d(background);
        }
        var hit = found.get();
        var colour = shading.shade(ray, hit);

        var material = hit.material();
        if (material.isReflective() && depth < maxBounces) {
            var intersection = hit.intersection();
            var reflected = new Ray(intersection.position(), Vectors.reflect(ray.direction(), intersection.normal()));
            var contribution = trace(reflected, reflectionEpsilon, depth + 1);
            contribution.scale(material.kReflect());
            colour.add(contribution);
        }
        return colour;
    }
}
