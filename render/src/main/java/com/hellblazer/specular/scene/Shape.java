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

import java.util.Optional;

/**
 * Geometric primitive. The set of primitives is closed; a new primitive is a new permitted record carrying its own
 * parameters and its own intersection rule.
 *
 * @author hal.hildebrand
 */
public sealed interface Shape permits Sphere, Plane {

    /**
     * Nearest intersection of {@code ray} with this shape whose parameter is accepted by
     * {@link Intersection#accepts(double, double)} for {@code minDistance}.
     *
     * @param ray         the ray, direction of any non-zero length
     * @param minDistance lower bound on the ray parameter, used to suppress self-intersection
     * @return the hit, or empty if the ray misses or every root is too close
     */
    Optional<Intersection> intersect(Ray ray, double minDistance);

    /**
     * Short type tag, matching the scene document's {@code type} field.
     */
    String type();
}
