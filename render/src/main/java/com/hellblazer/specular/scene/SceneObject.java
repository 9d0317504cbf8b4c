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

/**
 * One shape paired with its material. Order within the scene only matters as a tie-break when two objects are hit at
 * exactly the same distance.
 *
 * @author hal.hildebrand
 */
public record SceneObject(Shape shape, Material material) {

    public SceneObject {
        if (shape == null || material == null) {
            throw new IllegalArgumentException("Scene object requires a shape and a material");
        }
    }
}
