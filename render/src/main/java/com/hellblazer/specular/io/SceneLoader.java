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
package com.hellblazer.specular.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.specular.error.RenderException.InvalidSceneException;
import com.hellblazer.specular.scene.Camera;
import com.hellblazer.specular.scene.LightSource;
import com.hellblazer.specular.scene.Material;
import com.hellblazer.specular.scene.Plane;
import com.hellblazer.specular.scene.Scene;
import com.hellblazer.specular.scene.SceneObject;
import com.hellblazer.specular.scene.Shape;
import com.hellblazer.specular.scene.Sphere;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a JSON scene document into a {@link Scene}.
 *
 * <pre>
 * {
 *   "camera": { "position": [0, -5, 0], "direction": [0, 1, 0], "screenDistance": 1,
 *               "screenWidth": 1, "screenHeight": 1, "screenColumns": 256, "screenRows": 256 },
 *   "ambientLight": [0.1, 0.1, 0.1],
 *   "background": [0, 0, 0],
 *   "lights": [ { "colour": [1, 1, 1], "pos": [0, 0, 5] } ],
 *   "objects": [ { "material": { "colour": [1, 0, 0], "kAmbient": 1, "kDiffuse": 0.7,
 *                                "kSpecular": 0.3, "kReflect": 0, "shine": 20 },
 *                  "shape": { "type": "sphere", "centre": [0, 0, 0], "radius": 1 } } ]
 * }
 * </pre>
 * {@code background} and {@code kReflect} are optional and default to zero. Every structural problem is reported as
 * an {@link InvalidSceneException} naming the JSON pointer of the offending element.
 *
 * @author hal.hildebrand
 */
public class SceneLoader {

    private static final Logger log = LoggerFactory.getLogger(SceneLoader.class);

    private final ObjectMapper objectMapper;

    public SceneLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load a scene file.
     *
     * @throws IOException           if the file cannot be read
     * @throws InvalidSceneException if the content is not a valid scene
     */
    public Scene load(Path path) throws IOException {
        try (var is = Files.newInputStream(path)) {
            var scene = load(is);
            log.info("Loaded scene {}: {} objects, {} lights, {}x{}", path, scene.objects().size(),
                     scene.lights().size(), scene.camera().screenColumns(), scene.camera().screenRows());
            return scene;
        }
    }

    /**
     * Load a scene from a classpath resource.
     */
    public Scene loadResource(String resource) throws IOException {
        try (var is = SceneLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Scene resource not found: " + resource);
            }
            return load(is);
        }
    }

    /**
     * Parse a scene document from a stream. The stream is not closed.
     */
    public Scene load(InputStream is) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(is);
        } catch (JsonProcessingException e) {
            throw new InvalidSceneException("/", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidSceneException("/", "scene must be a JSON object");
        }
        return parseScene(root);
    }

    private Scene parseScene(JsonNode root) {
        var builder = Scene.builder(parseCamera(required(root, "/", "camera")))
                           .ambientLight(vector(required(root, "/", "ambientLight"), "/ambientLight"));
        if (root.has("background")) {
            builder.background(vector(root.get("background"), "/background"));
        }

        var lights = array(required(root, "/", "lights"), "/lights");
        for (int i = 0; i < lights.size(); i++) {
            builder.light(parseLight(lights.get(i), "/lights/" + i));
        }

        var objects = array(required(root, "/", "objects"), "/objects");
        for (int i = 0; i < objects.size(); i++) {
            builder.object(parseObject(objects.get(i), "/objects/" + i));
        }

        var scene = builder.build();
        log.debug("Parsed {}", scene);
        return scene;
    }

    private Camera parseCamera(JsonNode node) {
        var at = "/camera";
        try {
            return new Camera(point(required(node, at, "position"), at + "/position"),
                              vector(required(node, at, "direction"), at + "/direction"),
                              number(node, at, "screenDistance"), number(node, at, "screenWidth"),
                              number(node, at, "screenHeight"), integer(node, at, "screenColumns"),
                              integer(node, at, "screenRows"));
        } catch (IllegalArgumentException e) {
            throw new InvalidSceneException(at, e.getMessage(), e);
        }
    }

    private LightSource parseLight(JsonNode node, String at) {
        return new LightSource(vector(required(node, at, "colour"), at + "/colour"),
                               point(required(node, at, "pos"), at + "/pos"));
    }

    private SceneObject parseObject(JsonNode node, String at) {
        return new SceneObject(parseShape(required(node, at, "shape"), at + "/shape"),
                               parseMaterial(required(node, at, "material"), at + "/material"));
    }

    private Material parseMaterial(JsonNode node, String at) {
        var kReflect = node.has("kReflect") ? number(node, at, "kReflect") : 0.0;
        return new Material(vector(required(node, at, "colour"), at + "/colour"), number(node, at, "kAmbient"),
                            number(node, at, "kDiffuse"), number(node, at, "kSpecular"), kReflect,
                            number(node, at, "shine"));
    }

    private Shape parseShape(JsonNode node, String at) {
        var typeNode = required(node, at, "type");
        if (!typeNode.isTextual()) {
            throw new InvalidSceneException(at + "/type", "shape type must be a string");
        }
        var type = typeNode.asText();
        try {
            return switch (type.toLowerCase()) {
                case Sphere.TYPE -> new Sphere(point(required(node, at, "centre"), at + "/centre"),
                                               number(node, at, "radius"));
                case Plane.TYPE -> new Plane(point(required(node, at, "point"), at + "/point"),
                                             vector(required(node, at, "normal"), at + "/normal"));
                default -> throw new InvalidSceneException(at + "/type", "unknown shape type '" + type + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new InvalidSceneException(at, e.getMessage(), e);
        }
    }

    private static JsonNode required(JsonNode parent, String at, String field) {
        var node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidSceneException(pointer(at, field), "missing required field");
        }
        return node;
    }

    private static JsonNode array(JsonNode node, String at) {
        if (!node.isArray()) {
            throw new InvalidSceneException(at, "expected an array");
        }
        return node;
    }

    private static double number(JsonNode parent, String at, String field) {
        var node = required(parent, at, field);
        if (!node.isNumber()) {
            throw new InvalidSceneException(pointer(at, field), "expected a number");
        }
        return node.asDouble();
    }

    private static int integer(JsonNode parent, String at, String field) {
        var node = required(parent, at, field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidSceneException(pointer(at, field), "expected an integer");
        }
        return node.asInt();
    }

    private static double[] triple(JsonNode node, String at) {
        if (!node.isArray() || node.size() != 3) {
            throw new InvalidSceneException(at, "expected an array of three numbers");
        }
        var values = new double[3];
        for (int i = 0; i < 3; i++) {
            if (!node.get(i).isNumber()) {
                throw new InvalidSceneException(at + "/" + i, "expected a number");
            }
            values[i] = node.get(i).asDouble();
        }
        return values;
    }

    private static Vector3d vector(JsonNode node, String at) {
        return new Vector3d(triple(node, at));
    }

    private static Point3d point(JsonNode node, String at) {
        return new Point3d(triple(node, at));
    }

    private static String pointer(String at, String field) {
        return at.endsWith("/") ? at + field : at + "/" + field;
    }
}
