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

import com.hellblazer.specular.render.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes frames as 8-bit RGB PNG files, row 0 at the top.
 *
 * @author hal.hildebrand
 */
public class PngImageSink implements ImageSink {

    private static final Logger log = LoggerFactory.getLogger(PngImageSink.class);

    private final Path outputPath;

    public PngImageSink(Path outputPath) {
        this.outputPath = outputPath;
    }

    @Override
    public void write(Frame frame) throws IOException {
        var parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        var image = toImage(frame);
        if (!ImageIO.write(image, "png", outputPath.toFile())) {
            throw new IOException("No PNG writer available for " + outputPath);
        }
        log.info("Image saved: {} ({}x{}, {} KB)", outputPath, frame.getWidth(), frame.getHeight(),
                 String.format("%.1f", Files.size(outputPath) / 1024.0));
    }

    /**
     * Copy a frame into a {@link BufferedImage#TYPE_INT_RGB} image.
     */
    public static BufferedImage toImage(Frame frame) {
        var image = new BufferedImage(frame.getWidth(), frame.getHeight(), BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, frame.getWidth(), frame.getHeight(), frame.toArray(), 0, frame.getWidth());
        return image;
    }

    public Path getOutputPath() {
        return outputPath;
    }
}
