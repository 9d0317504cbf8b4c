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
package com.hellblazer.specular.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.specular.geometry.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.io.IOException;
import java.io.InputStream;

/**
 * Tunable constants of the tracing pipeline.
 *
 * @param maxBounces        reflection recursion ceiling; a primary ray spawns at most this many reflection rays
 * @param shadowEpsilon     minimum ray parameter for shadow rays (trades acne against missed contact shadows)
 * @param reflectionEpsilon minimum ray parameter for reflection rays
 * @param worldUp           world up direction used to build the camera basis; stored as a unit vector
 * @param threads           worker threads used by the pixel renderer
 * @author hal.hildebrand
 */
public record RenderSettings(int maxBounces, double shadowEpsilon, double reflectionEpsilon, Vector3d worldUp,
                             int threads) {

    public static final  String       RESOURCE             = "/render-settings.json";
    public static final  int          DEFAULT_MAX_BOUNCES  = 10;
    public static final  double       DEFAULT_SHADOW_EPS   = 0.1;
    public static final  double       DEFAULT_REFLECT_EPS  = 1e-4;
    private static final Logger       log                  = LoggerFactory.getLogger(RenderSettings.class);
    private static final ObjectMapper objectMapper         = new ObjectMapper();

    public RenderSettings {
        if (maxBounces < 0) {
            throw new IllegalArgumentException("Max bounces must be non-negative: " + maxBounces);
        }
        if (!(shadowEpsilon >= 0.0) || Double.isInfinite(shadowEpsilon)) {
            throw new IllegalArgumentException("Shadow epsilon must be finite and non-negative: " + shadowEpsilon);
        }
        if (!(reflectionEpsilon >= 0.0) || Double.isInfinite(reflectionEpsilon)) {
            throw new IllegalArgumentException(
            "Reflection epsilon must be finite and non-negative: " + reflectionEpsilon);
        }
        if (worldUp == null || Vectors.isDegenerate(worldUp)) {
            throw new IllegalArgumentException("World up must be a non-zero vector");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be at least 1: " + threads);
        }
        worldUp = Vectors.normalize(worldUp);
    }

    /**
     * Built-in defaults: ten bounces, shadow epsilon 0.1, reflection epsilon 1e-4, +Z up, one thread per processor.
     */
    public static RenderSettings defaults() {
        return new RenderSettings(DEFAULT_MAX_BOUNCES, DEFAULT_SHADOW_EPS, DEFAULT_REFLECT_EPS,
                                  new Vector3d(0, 0, 1), Runtime.getRuntime().availableProcessors());
    }

    /**
     * Defaults from the classpath resource {@value #RESOURCE}, falling back to {@link #defaults()} for the resource
     * as a whole or for any field it omits.
     */
    public static RenderSettings load() {
        try (var is = RenderSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.warn("Render settings resource {} not found, using built-in defaults", RESOURCE);
                return defaults();
            }
            return parse(is);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load render settings {}: {}, using built-in defaults", RESOURCE, e.getMessage());
            return defaults();
        }
    }

    /**
     * Parse settings from a JSON document; absent fields keep their default.
     *
     * @throws IOException              if the document is malformed or a field has the wrong JSON type
     * @throws IllegalArgumentException if a field is well typed but out of range
     */
    public static RenderSettings parse(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("Render settings must be a JSON object");
        }
        var fallback = defaults();

        var maxBounces = integer(root, "maxBounces", fallback.maxBounces);
        var shadowEpsilon = number(root, "shadowEpsilon", fallback.shadowEpsilon);
        var reflectionEpsilon = number(root, "reflectionEpsilon", fallback.reflectionEpsilon);
        var worldUp = root.has("worldUp") ? parseVector(root.get("worldUp")) : fallback.worldUp;
        var threads = integer(root, "threads", fallback.threads);

        var settings = new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
        log.debug("Resolved {}", settings);
        return settings;
    }

    private static int integer(JsonNode root, String field, int fallback) throws IOException {
        var node = root.get(field);
        if (node == null) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(field + " must be an integer, got " + node);
        }
        return node.asInt();
    }

    private static double number(JsonNode root, String field, double fallback) throws IOException {
        var node = root.get(field);
        if (node == null) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new IOException(field + " must be a number, got " + node);
        }
        return node.asDouble();
    }

    private static Vector3d parseVector(JsonNode node) throws IOException {
        if (node == null || !node.isArray() || node.size() != 3) {
            throw new IOException("worldUp must be an array of three numbers");
        }
        for (var component : node) {
            if (!component.isNumber()) {
                throw new IOException("worldUp must be an array of three numbers, got " + node);
            }
        }
        return new Vector3d(node.get(0).asDouble(), node.get(1).asDouble(), node.get(2).asDouble());
    }

    public RenderSettings withMaxBounces(int maxBounces) {
        return new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
    }

    public RenderSettings withShadowEpsilon(double shadowEpsilon) {
        return new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
    }

    public RenderSettings withReflectionEpsilon(double reflectionEpsilon) {
        return new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
    }

    public RenderSettings withWorldUp(Vector3d worldUp) {
        return new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
    }

    public RenderSettings withThreads(int threads) {
        return new RenderSettings(maxBounces, shadowEpsilon, reflectionEpsilon, worldUp, threads);
    }

    @Override
    public String toString() {
        return String.format("RenderSettings[bounces=%d, shadowEps=%g, reflectEps=%g, up=(%.3f,%.3f,%.3f), threads=%d]",
                             maxBounces, shadowEpsilon, reflectionEpsilon, worldUp.x, worldUp.y, worldUp.z, threads);
    }
}
