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

import com.hellblazer.specular.geometry.Vectors;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate root of a render: camera, global ambient light, background colour, lights and objects. Built once and
 * then shared read-only by every pixel computation.
 *
 * @param camera       the camera
 * @param ambientLight global ambient term
 * @param background   colour of primary rays that hit nothing
 * @param lights       point lights, in document order
 * @param objects      scene objects, in document order
 * @author hal.hildebrand
 */
public record Scene(Camera camera, Vector3d ambientLight, Vector3d background, List<LightSource> lights,
                    List<SceneObject> objects) {

    public Scene {
        if (camera == null) {
            throw new IllegalArgumentException("Scene camera is required");
        }
        ambientLight = Vectors.copyOrZero(ambientLight);
        background = Vectors.copyOrZero(background);
        lights = List.copyOf(lights);
        objects = List.copyOf(objects);
    }

    public static Builder builder(Camera camera) {
        return new Builder(camera);
    }

    @Override
    public String toString() {
        return String.format("Scene[%dx%d, lights=%d, objects=%d]", camera.screenColumns(), camera.screenRows(),
                             lights.size(), objects.size());
    }

    /**
     * Incremental construction; absent ambient and background terms default to black.
     */
    public static class Builder {
        private final Camera              camera;
        private final List<LightSource>   lights  = new ArrayList<>();
        private final List<SceneObject>   objects = new ArrayList<>();
        private       Vector3d            ambientLight;
        private       Vector3d            background;

        private Builder(Camera camera) {
            this.camera = camera;
        }

        public Builder ambientLight(Vector3d ambientLight) {
            this.ambientLight = ambientLight;
            return this;
        }

        public Builder background(Vector3d background) {
            this.background = background;
            return this;
        }

        public Builder light(LightSource light) {
            lights.add(light);
            return this;
        }

        public Builder object(Shape shape, Material material) {
            objects.add(new SceneObject(shape, material));
            return this;
        }

        public Builder object(SceneObject object) {
            objects.add(object);
            return this;
        }

        public Scene build() {
            return new Scene(camera, ambientLight, background, lights, objects);
        }
    }
}
