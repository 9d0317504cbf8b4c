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
import com.hellblazer.specular.scene.Material;
import com.hellblazer.specular.scene.Plane;
import com.hellblazer.specular.scene.SceneObject;
import com.hellblazer.specular.scene.Sphere;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.hellblazer.specular.TestScenes.ambientOnly;
import static com.hellblazer.specular.TestScenes.p;
import static com.hellblazer.specular.TestScenes.v;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class IntersectionEngineTest {

    private static final double EPSILON = 1e-9;

    private final Material red   = ambientOnly(v(1, 0, 0), 1.0);
    private final Material green = ambientOnly(v(0, 1, 0), 1.0);
    private final Material blue  = ambientOnly(v(0, 0, 1), 1.0);

    private List<SceneObject> row() {
        var objects = new ArrayList<SceneObject>();
        objects.add(new SceneObject(new Sphere(p(0, 0, -10), 1.0), red));
        objects.add(new SceneObject(new Sphere(p(0, 0, -4), 1.0), green));
        objects.add(new SceneObject(new Plane(p(0, 0, -20), v(0, 0, 1)), blue));
        return objects;
    }

    @Test
    void testNearestOfSeveral() {
        var engine = new IntersectionEngine(row());

        var hit = engine.nearest(new Ray(p(0, 0, 0), v(0, 0, -1)), 0.0).orElseThrow();

        assertEquals(3.0, hit.intersection().t(), EPSILON);
        assertSame(green, hit.material());
    }

    @Test
    void testNearestIgnoresSceneOrder() {
        var objects = row();
        Collections.reverse(objects);
        var engine = new IntersectionEngine(objects);

        var hit = engine.nearest(new Ray(p(0, 0, 0), v(0, 0, -1)), 0.0).orElseThrow();

        assertEquals(3.0, hit.intersection().t(), EPSILON);
        assertSame(green, hit.material());
    }

    @Test
    void testFallsThroughToPlane() {
        var engine = new IntersectionEngine(row());

        var hit = engine.nearest(new Ray(p(5, 5, 0), v(0, 0, -1)), 0.0).orElseThrow();

        assertEquals(20.0, hit.intersection().t(), EPSILON);
        assertSame(blue, hit.material());
    }

    @Test
    void testMinDistanceSkipsNearerSurfaces() {
        var engine = new IntersectionEngine(row());

        // from the far side of the green sphere's front surface
        var hit = engine.nearest(new Ray(p(0, 0, -3), v(0, 0, -1)), 1e-4).orElseThrow();

        assertEquals(2.0, hit.intersection().t(), EPSILON);
        assertSame(green, hit.material());
    }

    @Test
    void testEmptyScene() {
        var engine = new IntersectionEngine(List.of());
        var ray = new Ray(p(0, 0, 0), v(0, 0, -1));

        assertTrue(engine.nearest(ray, 0.0).isEmpty());
        assertFalse(engine.occluded(ray, 0.0));
        assertEquals(0, engine.size());
    }

    @Test
    void testMiss() {
        var engine = new IntersectionEngine(row());
        assertTrue(engine.nearest(new Ray(p(0, 0, 0), v(0, 0, 1)), 0.0).isEmpty());
    }

    @Test
    void testOccluded() {
        var engine = new IntersectionEngine(row());

        assertTrue(engine.occluded(new Ray(p(0, 0, 0), v(0, 0, -1)), 0.1));
        assertFalse(engine.occluded(new Ray(p(0, 0, 0), v(0, 0, 1)), 0.1));
        assertFalse(engine.occluded(new Ray(p(0, 0, 0), v(1, 0, 0)), 0.1));
    }

    @Test
    void testListIsCopied() {
        var objects = row();
        var engine = new IntersectionEngine(objects);
        objects.clear();
        assertEquals(3, engine.size());
    }
}
