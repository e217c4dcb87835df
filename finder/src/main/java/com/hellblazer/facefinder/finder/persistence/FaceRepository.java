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
package com.hellblazer.facefinder.finder.persistence;

import com.hellblazer.facefinder.geometry.Face;

import java.util.List;

/**
 * Durable storage of faces. Implementations report their own failures unchanged; callers do not retry.
 *
 * @author hal.hildebrand
 */
public interface FaceRepository {

    /**
     * Store a face and assign its identity.
     *
     * @return a new, strictly positive id never handed out before
     */
    long insert(int race, int emotion, int oldness);

    /**
     * @param limit maximum number of faces to return
     * @return the most recently stored faces, highest id first
     */
    List<Face> loadRecent(int limit);

    /**
     * Delete every stored face
     */
    void truncate();
}
