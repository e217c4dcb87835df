/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
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
package com.hellblazer.facefinder.finder;

import com.hellblazer.facefinder.geometry.Face;

import java.util.List;

/**
 * Finds the faces most similar to a given face.
 *
 * @author hal.hildebrand
 */
public interface FaceFinder {

    /**
     * Find the most similar faces. A new face (id 0) is stored first and becomes part of the searched set.
     *
     * @param face the face to find, and to store if new
     * @return the most similar faces, the resolved face first carrying its assigned id
     */
    List<Face> resolve(Face face);

    /**
     * Remove every stored face
     */
    void flush();
}
