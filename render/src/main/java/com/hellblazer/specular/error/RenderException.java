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
package com.hellblazer.specular.error;

/**
 * Base exception for failures that stop a render before or while it runs.
 * <p>
 * Subclasses:
 * <ul>
 * <li>{@link InvalidSceneException} - scene document is structurally invalid</li>
 * <li>{@link DegenerateCameraException} - camera basis cannot be constructed</li>
 * <li>{@link RenderFailedException} - a pixel worker failed or the render was interrupted</li>
 * </ul>
 * Geometric misses (negative discriminant, ray parallel to a plane) are ordinary results, never exceptions.
 *
 * @author hal.hildebrand
 */
public sealed class RenderException extends RuntimeException
    permits RenderException.InvalidSceneException,
            RenderException.DegenerateCameraException,
            RenderException.RenderFailedException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a scene document is missing a field, has a vector of the wrong arity, names an unknown shape type or
     * carries values the scene model rejects.
     */
    public static final class InvalidSceneException extends RenderException {
        private final String location;

        /**
         * @param location JSON pointer of the offending element
         * @param message  what is wrong with it
         */
        public InvalidSceneException(String location, String message) {
            super(String.format("Invalid scene at %s: %s", location, message));
            this.location = location;
        }

        public InvalidSceneException(String location, String message, Throwable cause) {
            super(String.format("Invalid scene at %s: %s", location, message), cause);
            this.location = location;
        }

        public String getLocation() {
            return location;
        }
    }

    /**
     * Thrown when the camera direction is zero or parallel to world-up, so the screen basis collapses.
     */
    public static final class DegenerateCameraException extends RenderException {

        public DegenerateCameraException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a pixel worker fails or the rendering thread is interrupted.
     */
    public static final class RenderFailedException extends RenderException {

        public RenderFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
