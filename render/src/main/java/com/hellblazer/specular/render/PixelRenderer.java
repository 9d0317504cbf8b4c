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

import com.hellblazer.specular.camera.CameraRayGenerator;
import com.hellblazer.specular.geometry.Vectors;
import com.hellblazer.specular.error.RenderException.RenderFailedException;
import com.hellblazer.specular.scene.Scene;
import com.hellblazer.specular.trace.RayTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Renders every pixel of the scene camera's grid. Each pixel is an independent function of its coordinate and the
 * read-only scene, so rows are farmed out to a fixed pool and each task writes only its own slice of the output; the
 * result is identical for any thread count.
 *
 * @author hal.hildebrand
 */
public class PixelRenderer {

    private static final Logger log = LoggerFactory.getLogger(PixelRenderer.class);

    private final Scene              scene;
    private final RenderSettings     settings;
    private final CameraRayGenerator rays;
    private final RayTracer          tracer;

    /**
     * @throws com.hellblazer.specular.error.RenderException.DegenerateCameraException if the camera basis cannot be built
     */
    public PixelRenderer(Scene scene, RenderSettings settings) {
        this.scene = scene;
        this.settings = settings;
        this.rays = new CameraRayGenerator(scene.camera(), settings.worldUp());
        this.tracer = new RayTracer(scene, settings.maxBounces(), settings.shadowEpsilon(),
                                    settings.reflectionEpsilon());
    }

    /**
     * Linear colour of pixel {@code (x, y)}.
     */
    public Vector3d radiance(int x, int y) {
        return tracer.trace(rays.rayForPixel(x, y));
    }

    /**
     * Render the full grid using {@link RenderSettings#threads()} workers.
     *
     * @throws RenderFailedException if a worker fails or the calling thread is interrupted
     */
    public Frame render() {
        var width = scene.camera().screenColumns();
        var height = scene.camera().screenRows();
        var pixels = new int[scene.camera().pixelCount()];
        var start = System.nanoTime();

        int nonFinite;
        if (settings.threads() == 1) {
            nonFinite = 0;
            for (int y = 0; y < height; y++) {
                nonFinite += renderRow(y, width, pixels);
            }
        } else {
            nonFinite = renderParallel(width, height, pixels);
        }

        if (nonFinite > 0) {
            log.warn("{} pixels had non-finite colour and were clamped", nonFinite);
        }
        log.info("Rendered {}x{} in {} ms using {} thread(s)", width, height,
                 TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), settings.threads());
        return new Frame(width, height, pixels);
    }

    private int renderParallel(int width, int height, int[] pixels) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.threads(), height));
        try {
            var rows = new ArrayList<Future<Integer>>(height);
            for (int y = 0; y < height; y++) {
                final var row = y;
                rows.add(executor.submit(() -> renderRow(row, width, pixels)));
            }
            var nonFinite = 0;
            for (var row : rows) {
                nonFinite += row.get();
            }
            return nonFinite;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderFailedException("Render interrupted", e);
        } catch (ExecutionException e) {
            throw new RenderFailedException("Pixel worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Trace one row into its slice of {@code pixels}.
     *
     * @return number of pixels whose linear colour was not finite
     */
    private int renderRow(int y, int width, int[] pixels) {
        var nonFinite = 0;
        var offset = y * width;
        for (int x = 0; x < width; x++) {
            var colour = radiance(x, y);
            if (!Vectors.isFinite(colour)) {
                nonFinite++;
            }
            pixels[offset + x] = ColorEncoding.toRgb(colour);
        }
        log.trace("Row {} complete", y);
        return nonFinite;
    }
}
