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

import javax.vecmath.Tuple3d;

/**
 * Linear colour to 8-bit display channel conversion: {@code clamp(round(value * 255), 0, 255)}. NaN maps to 0.
 *
 * @author hal.hildebrand
 */
public final class ColorEncoding {

    private ColorEncoding() {
    }

    public static int toChannel(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        var scaled = Math.round(value * 255.0);
        if (scaled < 0) {
            return 0;
        }
        return scaled > 255 ? 255 : (int) scaled;
    }

    /**
     * Packed {@code 0xRRGGBB}.
     */
    public static int toRgb(Tuple3d colour) {
        return toChannel(colour.x) << 16 | toChannel(colour.y) << 8 | toChannel(colour.z);
    }

    public static int red(int rgb) {
        return rgb >> 16 & 0xFF;
    }

    public static int green(int rgb) {
        return rgb >> 8 & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }
}
