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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Point light. Intensity is not attenuated with distance.
 *
 * @param colour   per-channel intensity
 * @param position light position
 * @author hal.hildebrand
 */
public record LightSource(Vector3d colour, Point3d position) {

    public LightSource {
        if (colour == null || position == null) {
            throw new IllegalArgumentException("Light colour and position are required");
        }
        colour = new Vector3d(colour);
        position = new Point3d(position);
    }
}
