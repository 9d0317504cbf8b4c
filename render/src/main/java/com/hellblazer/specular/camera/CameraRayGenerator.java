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
package com.hellblazer.specular.camera;

import com.hellblazer.specular.geometry.Ray;
import com.hellblazer.specular.geometry.Vectors;
import com.hellblazer.specular.error.RenderException.DegenerateCameraException;
import com.hellblazer.specular.scene.Camera;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Maps pixel coordinates to primary rays.
 * <p>
 * The screen basis is {@code u = normalize(direction)}, {@code v = u × up}, {@code w = v × u}: {@code u} looks into
 * the scene, {@code v} runs along image columns and {@code w} along image rows, with row 0 at the top. The basis is
 * computed once; {@link #rayForPixel(int, int)} is a pure function of the pixel coordinate.
 *
 * @author hal.hildebrand
 */
public class CameraRayGenerator {

    private final Point3d  position;
    private final Vector3d forward;
    private final Vector3d right;
    private final Vector3d up;
    private final double   screenDistance;
    private final double   screenWidth;
    private final double   screenHeight;
    private final int      columns;
    private final int      rows;

    /**
     * @param camera  the scene camera
     * @param worldUp world up vector, any non-zero length
     * @throws DegenerateCameraException if the camera direction or {@code worldUp} is zero, or they are parallel
     */
    public CameraRayGenerator(Camera camera, Vector3d worldUp) {
        if (Vectors.isDegenerate(camera.direction())) {
            throw new DegenerateCameraException("Camera direction cannot be zero");
        }
        if (Vectors.isDegenerate(worldUp)) {
            throw new DegenerateCameraException("World up cannot be zero");
        }
        this.forward = Vectors.normalize(camera.direction());
        // only the direction of world up matters
        var side = Vectors.cross(forward, Vectors.normalize(worldUp));
        if (Vectors.isDegenerate(side)) {
            throw new DegenerateCameraException(
            String.format("Camera direction (%.3f,%.3f,%.3f) is parallel to world up (%.3f,%.3f,%.3f)",
                          camera.direction().x, camera.direction().y, camera.direction().z, worldUp.x, worldUp.y,
                          worldUp.z));
        }
        this.right = side;
        this.up = Vectors.cross(right, forward);
        this.position = new Point3d(camera.position());
        this.screenDistance = camera.screenDistance();
        this.screenWidth = camera.screenWidth();
        this.screenHeight = camera.screenHeight();
        this.columns = camera.screenColumns();
        this.rows = camera.screenRows();
    }

    /**
     * Primary ray through pixel {@code (x, y)}. The direction is
     * {@code screenDistance * u + xScreen * v + yScreen * w} and is deliberately left unnormalized.
     *
     * @param x column, 0 at the left
     * @param y row, 0 at the top
     */
    public Ray rayForPixel(int x, int y) {
        var xScreen = (double) (x - columns / 2) / columns * screenWidth * 0.5;
        var yScreen = (double) (y - rows / 2) / rows * screenHeight * -0.5;

        var direction = Vectors.scaled(forward, screenDistance);
        direction.scaleAdd(xScreen, right, direction);
        direction.scaleAdd(yScreen, up, direction);
        return new Ray(position, direction);
    }

    public Vector3d getForward() {
        return new Vector3d(forward);
    }

    public Vector3d getRight() {
        return new Vector3d(right);
    }

    public Vector3d getUp() {
        return new Vector3d(up);
    }
}
