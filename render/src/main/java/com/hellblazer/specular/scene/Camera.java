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
 * Pinhole camera with a rectangular screen placed {@code screenDistance} along the view direction. The direction does
 * not need to be normalized.
 *
 * @param position       eye position
 * @param direction      view direction
 * @param screenDistance distance from the eye to the screen
 * @param screenWidth    screen extent along the horizontal basis vector
 * @param screenHeight   screen extent along the vertical basis vector
 * @param screenColumns  horizontal pixel count
 * @param screenRows     vertical pixel count
 * @author hal.hildebrand
 */
public record Camera(Point3d position, Vector3d direction, double screenDistance, double screenWidth,
                     double screenHeight, int screenColumns, int screenRows) {

    public Camera {
        if (position == null || direction == null) {
            throw new IllegalArgumentException("Camera position and direction are required");
        }
        if (screenColumns <= 0 || screenRows <= 0) {
            throw new IllegalArgumentException(
            "Camera pixel grid must be positive: " + screenColumns + "x" + screenRows);
        }
        try {
            Math.multiplyExact(screenColumns, screenRows);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
            "Camera pixel grid is too large: " + screenColumns + "x" + screenRows, e);
        }
        position = new Point3d(position);
        direction = new Vector3d(direction);
    }

    public int pixelCount() {
        return Math.multiplyExact(screenColumns, screenRows);
    }
}
