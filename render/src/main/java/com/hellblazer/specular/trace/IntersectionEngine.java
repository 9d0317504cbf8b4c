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

import com.hellblazer.specular.geometry.Intersection;
import com.hellblazer.specular.geometry.Ray;
import com.hellblazer.specular.scene.SceneObject;

import java.util.List;
import java.util.Optional;

/**
 * Linear scan of every scene object for the nearest hit along a ray. Stateless apart from the immutable object list,
 * so one instance is shared by all render threads.
 *
 * @author hal.hildebrand
 */
public class IntersectionEngine {

    private final List<SceneObject> objects;

    public IntersectionEngine(List<SceneObject> objects) {
        this.objects = List.copyOf(objects);
    }

    /**
     * Nearest hit beyond {@code minDistance}. When two objects are hit at exactly the same distance the earlier one in
     * scene order wins, though callers must not rely on that.
     *
     * @param ray         the ray to cast
     * @param minDistance 0 for primary rays, a small epsilon for rays leaving a surface
     * @return the hit and its material, or empty if nothing qualifies
     */
    public Optional<Hit> nearest(Ray ray, double minDistance) {
        Intersection closest = null;
        SceneObject closestObject = null;
        for (var object : objects) {
            var candidate = object.shape().intersect(ray, minDistance);
            if (candidate.isPresent() && (closest == null || candidate.get().compareTo(closest) < 0)) {
                closest = candidate.get();
                closestObject = object;
            }
        }
        if (closest == null) {
            return Optional.empty();
        }
        return Optional.of(new Hit(closest, closestObject.material()));
    }

    /**
     * Whether any object is hit beyond {@code minDistance}. Stops at the first hit; used for binary shadow tests, so
     * occluders past the light still count.
     */
    public boolean occluded(Ray ray, double minDistance) {
        for (var object : objects) {
            if (object.shape().intersect(ray, minDistance).isPresent()) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return objects.size();
    }
}
