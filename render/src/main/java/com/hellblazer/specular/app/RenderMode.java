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

import com.hellblazer.specular.io.ImageSink;
import com.hellblazer.specular.io.PngImageSink;
import com.hellblazer.specular.io.SceneLoader;
import com.hellblazer.specular.render.PixelRenderer;
import com.hellblazer.specular.render.RenderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Render mode: scene file in, PNG out.
 *
 * @author hal.hildebrand
 */
public class RenderMode {
    private static final Logger log = LoggerFactory.getLogger(RenderMode.class);

    private final SpecularCommandLine.Config config;
    private final PrintStream                out;

    public RenderMode(SpecularCommandLine.Config config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    /**
     * Settings resource overlaid with any command-line overrides.
     */
    static RenderSettings resolveSettings(SpecularCommandLine.Config config) {
        var settings = RenderSettings.load();
        if (config.threads != null) {
            settings = settings.withThreads(config.threads);
        }
        if (config.maxBounces != null) {
            settings = settings.withMaxBounces(config.maxBounces);
        }
        if (config.shadowEpsilon != null) {
            settings = settings.withShadowEpsilon(config.shadowEpsilon);
        }
        if (config.reflectionEpsilon != null) {
            settings = settings.withReflectionEpsilon(config.reflectionEpsilon);
        }
        return settings;
    }

    public int execute() throws IOException {
        return execute(new PngImageSink(Path.of(config.outputFile)));
    }

    /**
     * Render into an arbitrary sink.
     */
    public int execute(ImageSink sink) throws IOException {
        var scene = new SceneLoader().load(Path.of(config.inputFile));
        var settings = resolveSettings(config);
        log.debug("Using {}", settings);

        var frame = new PixelRenderer(scene, settings).render();
        sink.write(frame);

        if (!config.quiet) {
            out.printf("Rendered %s (%dx%d) -> %s%n", config.inputFile, frame.getWidth(), frame.getHeight(),
                       config.outputFile);
        }
        return 0;
    }
}
