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
import com.hellblazer.specular.geometry.Vectors;
import com.hellblazer.specular.scene.LightSource;
import com.hellblazer.specular.scene.Material;
import com.hellblazer.specular.scene.Plane;
import com.hellblazer.specular.scene.SceneObject;
import com.hellblazer.specular.scene.Sphere;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.List;

import static com.hellblazer.specular.TestScenes.WHITE;
import static com.hellblazer.specular.TestScenes.p;
import static com.hellblazer.specular.TestScenes.v;
import static com.hellblazer.specular.TestScenes.whiteLight;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Local illumination tests. Hits are constructed directly on the floor {@code z = 0} at the origin so each term can be
 * checked in isolation.
 *
 * @author hal.hildebrand
 */
class ShadingEngineTest {

    private static final double   EPSILON = 1e-9;
    private static final Vector3d COLOUR  = v(1.0, 0.5, 0.25);

    private static Hit floorHit(Material material) {
        return new Hit(new Intersection(1.0, p(0, 0, 0), v(0, 0, 1)), material);
    }

    private static Ray viewFromAbove() {
        return new Ray(p(0, 0, 1), v(0, 0, -1));
    }

    private static ShadingEngine engine(List<SceneObject> objects, List<LightSource> lights, Vector3d ambient) {
        return new ShadingEngine(new IntersectionEngine(objects), lights, ambient, 0.1);
    }

    private static void assertColour(double r, double g, double b, Tuple3d actual) {
        assertEquals(r, actual.x, EPSILON, "red");
        assertEquals(g, actual.y, EPSILON, "green");
        assertEquals(b, actual.z, EPSILON, "blue");
    }

    @Test
    @DisplayName("A point enclosed by an opaque object receives ambient light only")
    void testEnclosedPointIsAmbientOnly() {
        var material = new Material(COLOUR, 0.5, 1.0, 1.0, 10.0);
        var floor = new Plane(p(0, 0, 0), v(0, 0, 1));
        var enclosure = new Sphere(p(0, 0, 0), 3.0);
        var objects = List.of(new SceneObject(floor, material), new SceneObject(enclosure, material));
        var lights = List.of(whiteLight(0, 0, 10), whiteLight(5, 5, 5), whiteLight(-8, 0, 1));
        var shading = engine(objects, lights, v(0.2, 0.2, 0.2));

        // confirm the primary hit really is the floor
        var tracerView = viewFromAbove();
        var hit = new IntersectionEngine(objects).nearest(tracerView, 0.0).orElseThrow();
        assertEquals(1.0, hit.intersection().t(), EPSILON);

        assertColour(0.1, 0.05, 0.025, shading.shade(tracerView, hit));
    }

    @Test
    void testAmbientTerm() {
        var shading = engine(List.of(), List.of(), v(0.5, 1.0, 0.0));
        var material = new Material(COLOUR, 0.4, 0.0, 0.0, 1.0);

        assertColour(0.2, 0.2, 0.0, shading.ambient(material));
    }

    @Test
    void testDiffuseHeadOn() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, 10)), new Vector3d());
        var material = new Material(COLOUR, 0.0, 1.0, 0.0, 1.0);

        assertColour(1.0, 0.5, 0.25, shading.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    void testDiffuseFollowsCosine() {
        var shading = engine(List.of(), List.of(whiteLight(10, 0, 10)), new Vector3d());
        var material = new Material(WHITE, 0.0, 0.8, 0.0, 1.0);

        var expected = 0.8 * Math.cos(Math.PI / 4);
        assertColour(expected, expected, expected, shading.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    void testDiffuseUsesLightColour() {
        var light = new LightSource(v(0.5, 0.0, 1.0), p(0, 0, 4));
        var shading = engine(List.of(), List.of(light), new Vector3d());
        var material = new Material(COLOUR, 0.0, 1.0, 0.0, 1.0);

        assertColour(0.5, 0.0, 0.25, shading.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    @DisplayName("A light below the surface adds nothing")
    void testLightBehindSurface() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, -10)), new Vector3d());
        var material = new Material(WHITE, 0.0, 1.0, 1.0, 5.0);

        var colour = shading.shade(viewFromAbove(), floorHit(material));

        assertColour(0.0, 0.0, 0.0, colour);
    }

    @Test
    @DisplayName("Viewer and light on the normal produce the specular peak")
    void testSpecularPeak() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, 10)), new Vector3d());
        var material = new Material(COLOUR, 0.0, 0.0, 0.5, 50.0);

        // specular is not tinted by the surface colour
        assertColour(0.5, 0.5, 0.5, shading.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    void testSpecularFallsOffWithShine() {
        var shading = engine(List.of(), List.of(whiteLight(10, 0, 10)), new Vector3d());
        var dull = new Material(WHITE, 0.0, 0.0, 1.0, 1.0);
        var sharp = new Material(WHITE, 0.0, 0.0, 1.0, 100.0);

        var dullColour = shading.shade(viewFromAbove(), floorHit(dull));
        var sharpColour = shading.shade(viewFromAbove(), floorHit(sharp));

        // half vector sits 22.5 degrees off the normal
        assertEquals(Math.cos(Math.PI / 8), dullColour.x, EPSILON);
        assertTrue(sharpColour.x < dullColour.x);
        assertTrue(sharpColour.x >= 0.0);
    }

    @Test
    @DisplayName("Light exactly opposite the viewer yields no specular and no NaN")
    void testDegenerateHalfVector() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, 10)), new Vector3d());
        var material = new Material(WHITE, 0.0, 0.0, 1.0, 0.0);
        var fromBelow = new Ray(p(0, 0, -10), v(0, 0, 1));

        var colour = shading.shade(fromBelow, floorHit(material));

        assertTrue(Vectors.isFinite(colour));
        assertColour(0.0, 0.0, 0.0, colour);
    }

    @Test
    void testViewerOnSurfaceYieldsNoSpecular() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, 10)), new Vector3d());
        var material = new Material(WHITE, 0.0, 0.0, 1.0, 0.0);
        var grazing = new Ray(p(0, 0, 0), v(1, 0, 0));

        assertColour(0.0, 0.0, 0.0, shading.shade(grazing, floorHit(material)));
    }

    @Test
    @DisplayName("Occluders closer than the shadow epsilon are ignored")
    void testShadowEpsilon() {
        var material = new Material(WHITE, 0.0, 1.0, 0.0, 1.0);
        var film = List.of(new SceneObject(new Plane(p(0, 0, 0.05), v(0, 0, 1)), material));
        var lights = List.of(whiteLight(0, 0, 10));

        var coarse = new ShadingEngine(new IntersectionEngine(film), lights, new Vector3d(), 0.1);
        var fine = new ShadingEngine(new IntersectionEngine(film), lights, new Vector3d(), 0.01);

        assertColour(1.0, 1.0, 1.0, coarse.shade(viewFromAbove(), floorHit(material)));
        assertColour(0.0, 0.0, 0.0, fine.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    @DisplayName("Occluders beyond the light still cast shadows")
    void testOccluderBeyondLight() {
        var material = new Material(WHITE, 0.0, 1.0, 0.0, 1.0);
        var ceiling = List.of(new SceneObject(new Plane(p(0, 0, 20), v(0, 0, -1)), material));
        var shading = engine(ceiling, List.of(whiteLight(0, 0, 10)), new Vector3d());

        assertColour(0.0, 0.0, 0.0, shading.shade(viewFromAbove(), floorHit(material)));
    }

    @Test
    void testLightsAccumulate() {
        var shading = engine(List.of(), List.of(whiteLight(0, 0, 10), whiteLight(0, 0, 3)), v(1, 1, 1));
        var material = new Material(WHITE, 0.1, 0.4, 0.0, 1.0);

        assertColour(0.9, 0.9, 0.9, shading.shade(viewFromAbove(), floorHit(material)));
    }
}
