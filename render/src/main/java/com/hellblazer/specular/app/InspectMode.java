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
package com.hellblazer.specular.app;

import com.hellblazer.specular.io.SceneLoader;
import com.hellblazer.specular.scene.Plane;
import com.hellblazer.specular.scene.Scene;
import com.hellblazer.specular.scene.Sphere;

import javax.vecmath.Tuple3d;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Inspect mode: loads a scene and prints camera, lighting and per-object details.
 *
 * @author hal.hildebrand
 */
public class InspectMode {

    private final SpecularCommandLine.Config config;
    private final PrintStream                out;

    public InspectMode(SpecularCommandLine.Config config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public int execute() throws IOException {
        var scene = new SceneLoader().load(Path.of(config.inputFile));
        report(scene);
        return 0;
    }

    void report(Scene scene) {
        var camera = scene.camera();
        out.println("=== Scene: " + config.inputFile + " ===");
        out.printf("Camera:      position %s, direction %s%n", format(camera.position()),
                   format(camera.direction()));
        out.printf("Screen:      distance %.3f, size %.3f x %.3f, grid %d x %d%n", camera.screenDistance(),
                   camera.screenWidth(), camera.screenHeight(), camera.screenColumns(), camera.screenRows());
        out.printf("Ambient:     %s%n", format(scene.ambientLight()));
        out.printf("Background:  %s%n", format(scene.background()));
        out.printf("Lights:      %d%n", scene.lights().size());
        for (var light : scene.lights()) {
            out.printf("  light at %s colour %s%n", format(light.position()), format(light.colour()));
        }
        out.printf("Objects:     %d%n", scene.objects().size());
        var reflective = 0;
        for (var object : scene.objects()) {
            var material = object.material();
            if (material.isReflective()) {
                reflective++;
            }
            var shape = object.shape();
            String geometry;
            if (shape instanceof Sphere sphere) {
                geometry = String.format("centre %s radius %.3f", format(sphere.centre()), sphere.radius());
            } else if (shape instanceof Plane plane) {
                geometry = String.format("point %s normal %s", format(plane.point()), format(plane.normal()));
            } else {
                geometry = shape.toString();
            }
            out.printf("  %-6s %s colour %s ka=%.2f kd=%.2f ks=%.2f kr=%.2f shine=%.1f%n", shape.type(), geometry,
                       format(material.colour()), material.kAmbient(), material.kDiffuse(), material.kSpecular(),
                       material.kReflect(), material.shine());
        }
        out.printf("Reflective:  %d%n", reflective);
    }

    private static String format(Tuple3d t) {
        return String.format("(%.3f, %.3f, %.3f)", t.x, t.y, t.z);
    }
}
