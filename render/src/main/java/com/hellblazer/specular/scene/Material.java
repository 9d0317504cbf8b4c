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

import javax.vecmath.Vector3d;

/**
 * Surface response of a scene object. Coefficients are expected in [0,1] and the colour components likewise, but
 * neither is clamped or validated: over-bright materials are allowed and only clamped at display encoding.
 *
 * @param colour    base RGB colour
 * @param kAmbient  ambient reflectance
 * @param kDiffuse  diffuse (Lambertian) reflectance
 * @param kSpecular specular (Blinn-Phong) reflectance
 * @param kReflect  mirror reflectivity; zero disables reflection rays
 * @param shine     specular exponent
 * @author hal.hildebrand
 */
public record Material(Vector3d colour, double kAmbient, double kDiffuse, double kSpecular, double kReflect,
                       double shine) {

    public Material {
        if (colour == null) {
            throw new IllegalArgumentException("Material colour is required");
        }
        colour = new Vector3d(colour);
    }

    /**
     * Non-reflective material.
     */
    public Material(Vector3d colour, double kAmbient, double kDiffuse, double kSpecular, double shine) {
        this(colour, kAmbient, kDiffuse, kSpecular, 0.0, shine);
    }

    public boolean isReflective() {
        return kReflect != 0.0;
    }
}
