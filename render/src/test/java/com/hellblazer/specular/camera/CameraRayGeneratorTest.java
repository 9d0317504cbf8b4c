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

import com.hellblazer.specular.error.RenderException.DegenerateCameraException;
import com.hellblazer.specular.scene.Camera;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;

import static com.hellblazer.specular.TestScenes.p;
import static com.hellblazer.specular.TestScenes.v;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class CameraRayGeneratorTest {

    private static final double   EPSILON = 1e-9;
    private static final Vector3d Z_UP    = v(0, 0, 1);

    private final Camera camera = new Camera(p(0, 5, 0), v(0, -1, 0), 2.0, 1.0, 0.5, 4, 4);

    @Test
    void testBasisIsOrthogonal() {
        var rays = new CameraRayGenerator(camera, Z_UP);

        assertEquals(v(0, -1, 0), rays.getForward());
        assertEquals(0.0, rays.getForward().dot(rays.getRight()), EPSILON);
        assertEquals(0.0, rays.getForward().dot(rays.getUp()), EPSILON);
        assertEquals(0.0, rays.getRight().dot(rays.getUp()), EPSILON);
        assertTrue(rays.getUp().dot(Z_UP) > 0.0, "Screen up should agree with world up");
    }

    @Test
    @DisplayName("The centre pixel looks straight down the view axis")
    void testCentrePixel() {
        var ray = new CameraRayGenerator(camera, Z_UP).rayForPixel(2, 2);

        assertEquals(p(0, 5, 0), ray.origin());
        assertEquals(0.0, ray.direction().x, EPSILON);
        assertEquals(-2.0, ray.direction().y, EPSILON);
        assertEquals(0.0, ray.direction().z, EPSILON);
    }

    @Test
    @DisplayName("Row 0 is the top and column 0 is the left of the image")
    void testPixelOrientation() {
        var rays = new CameraRayGenerator(camera, Z_UP);
        var right = rays.getRight();
        var up = rays.getUp();

        var topLeft = rays.rayForPixel(0, 0).direction();
        var bottomRight = rays.rayForPixel(3, 3).direction();

        assertTrue(topLeft.dot(up) > 0.0);
        assertTrue(topLeft.dot(right) < 0.0);
        assertTrue(bottomRight.dot(up) < 0.0);
        assertTrue(bottomRight.dot(right) > 0.0);
    }

    @Test
    void testScreenOffsets() {
        var rays = new CameraRayGenerator(camera, Z_UP);
        var right = rays.getRight();
        var up = rays.getUp();
        var rightLength = right.length();

        var corner = rays.rayForPixel(0, 0).direction();

        // xScreen = (0 - 2) / 4 * 1.0 * 0.5, yScreen = (0 - 2) / 4 * 0.5 * -0.5
        assertEquals(-0.25 * rightLength * rightLength, corner.dot(right), EPSILON);
        assertEquals(0.125 * up.lengthSquared(), corner.dot(up), EPSILON);
        assertEquals(-2.0, corner.y, EPSILON);
    }

    @Test
    void testDirectionNeedNotBeUnitLength() {
        var scaled = new Camera(p(0, 5, 0), v(0, -7, 0), 2.0, 1.0, 0.5, 4, 4);

        var expected = new CameraRayGenerator(camera, Z_UP).rayForPixel(1, 3);
        var actual = new CameraRayGenerator(scaled, Z_UP).rayForPixel(1, 3);

        assertTrue(expected.direction().epsilonEquals(actual.direction(), EPSILON));
    }

    @Test
    void testRaysAreRepeatable() {
        var rays = new CameraRayGenerator(camera, Z_UP);
        assertEquals(rays.rayForPixel(3, 1), rays.rayForPixel(3, 1));
    }

    @Test
    void testOddGrid() {
        var odd = new Camera(p(0, 0, 0), v(1, 0, 0), 1.0, 1.0, 1.0, 3, 3);
        var ray = new CameraRayGenerator(odd, Z_UP).rayForPixel(1, 1);

        assertTrue(ray.direction().epsilonEquals(v(1, 0, 0), EPSILON));
    }

    @Test
    void testDirectionParallelToUpRejected() {
        var straightUp = new Camera(p(0, 0, 0), v(0, 0, 3), 1.0, 1.0, 1.0, 4, 4);
        var straightDown = new Camera(p(0, 0, 0), v(0, 0, -1), 1.0, 1.0, 1.0, 4, 4);

        assertThrows(DegenerateCameraException.class, () -> new CameraRayGenerator(straightUp, Z_UP));
        assertThrows(DegenerateCameraException.class, () -> new CameraRayGenerator(straightDown, Z_UP));
    }

    @Test
    void testZeroDirectionRejected() {
        var blind = new Camera(p(0, 0, 0), v(0, 0, 0), 1.0, 1.0, 1.0, 4, 4);
        assertThrows(DegenerateCameraException.class, () -> new CameraRayGenerator(blind, Z_UP));
    }

    @Test
    @DisplayName("Only the direction of world up shapes the rays")
    void testWorldUpLengthIsIgnored() {
        var unit = new CameraRayGenerator(camera, v(0, 0, 1));
        var scaledUp = new CameraRayGenerator(camera, v(0, 0, 3));
        var shortUp = new CameraRayGenerator(camera, v(0, 0, 0.01));

        for (int y = 0; y < camera.screenRows(); y++) {
            for (int x = 0; x < camera.screenColumns(); x++) {
                var expected = unit.rayForPixel(x, y).direction();
                assertTrue(expected.epsilonEquals(scaledUp.rayForPixel(x, y).direction(), EPSILON),
                           "pixel (" + x + "," + y + ")");
                assertTrue(expected.epsilonEquals(shortUp.rayForPixel(x, y).direction(), EPSILON),
                           "pixel (" + x + "," + y + ")");
            }
        }
        assertEquals(1.0, scaledUp.getUp().length(), EPSILON);
    }

    @Test
    void testZeroWorldUpRejected() {
        assertThrows(DegenerateCameraException.class, () -> new CameraRayGenerator(camera, v(0, 0, 0)));
    }

    @Test
    void testAlternateWorldUp() {
        var overhead = new Camera(p(0, 0, 5), v(0, 0, -1), 1.0, 1.0, 1.0, 4, 4);
        var rays = new CameraRayGenerator(overhead, v(0, 1, 0));

        assertTrue(rays.getUp().dot(v(0, 1, 0)) > 0.0);
        assertTrue(rays.rayForPixel(2, 2).direction().epsilonEquals(v(0, 0, -1), EPSILON));
    }
}
