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
import com.hellblazer.specular.scene.LightSource;
import com.hellblazer.specular.scene.Material;

import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Local illumination at a hit point: an ambient term plus, for every light the point can see, a Lambertian diffuse
 * term and a Blinn-Phong specular term. Shadowing is binary; a light blocked by anything contributes nothing.
 * <p>
 * Results are linear RGB and may exceed 1.
 *
 * @author hal.hildebrand
 */
public class ShadingEngine {

    private final IntersectionEngine intersections;
    private final List<LightSource>  lights;
    private final Vector3d           ambientLight;
    private final double             shadowEpsilon;

    public ShadingEngine(IntersectionEngine intersections, List<LightSource> lights, Vector3d ambientLight,
                         double shadowEpsilon) {
        this.intersections = intersections;
        this.lights = List.copyOf(lights);
        this.ambientLight = new Vector3d(ambientLight);
        this.shadowEpsilon = shadowEpsilon;
    }

    /**
     * Local colour of {@code hit} as seen from the origin of {@code ray}.
     *
     * @param ray the ray that produced the hit; its origin is the viewer
     * @param hit nearest hit along {@code ray}
     * @return ambient plus the diffuse and specular contribution of every unoccluded light
     */
    public Vector3d shade(Ray ray, Hit hit) {
        var material = hit.material();
        var colour = ambient(material);

        var intersection = hit.intersection();
        var view = Vectors.direction(intersection.position(), ray.origin());
        for (var light : lights) {
            var toLight = Vectors.direction(intersection.position(), light.position());
            if (intersections.occluded(new Ray(intersection.position(), toLight), shadowEpsilon)) {
                continue;
            }
            colour.add(diffuse(intersection.normal(), toLight, material, light));
            colour.add(specular(intersection.normal(), toLight, view, material, light));
        }
        return colour;
    }

    /**
     * {@code kAmbient * (ambientLight ⊙ colour)}
     */
    Vector3d ambient(Material material) {
        var term = Vectors.hadamard(ambientLight, material.colour());
        term.scale(material.kAmbient());
        return term;
    }

    /**
     * {@code kDiffuse * clamp(n·l, 0, 1) * (light ⊙ colour)}
     */
    Vector3d diffuse(Vector3d normal, Vector3d toLight, Material material, LightSource light) {
        var coefficient = Vectors.clamp(normal.dot(toLight), 0.0, 1.0);
        var term = Vectors.hadamard(light.colour(), material.colour());
        term.scale(material.kDiffuse() * coefficient);
        return term;
    }

    /**
     * {@code kSpecular * clamp(h·n, 0, 1)^shine * light} with {@code h = normalize(l + v)}. A half vector with no
     * direction (light and view exactly opposed, or the viewer sitting on the surface) reflects nothing.
     */
    Vector3d specular(Vector3d normal, Vector3d toLight, Vector3d view, Material material, LightSource light) {
        var sum = new Vector3d(toLight);
        sum.add(view);
        if (Vectors.isDegenerate(view) || Vectors.isDegenerate(sum)) {
            return new Vector3d();
        }
        var half = Vectors.normalize(sum);
        var coefficient = Math.pow(Vectors.clamp(half.dot(normal), 0.0, 1.0), material.shine());
        return Vectors.scaled(light.colour(), material.kSpecular() * coefficient);
    }
}
