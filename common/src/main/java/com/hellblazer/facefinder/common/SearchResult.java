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
package com.hellblazer.facefinder.common;

import com.hellblazer.facefinder.geometry.Face;

import java.util.List;

/**
 * Outcome of a nearest neighbor search.
 *
 * @param faces         closest first. The query face is always first.
 * @param nodesVisited  tree nodes entered, 0 for a linear scan
 * @param leavesVisited leaves scanned, 0 for a linear scan
 * @param linearScan    whether the search fell back to scanning every face
 * @author hal.hildebrand
 */
public record SearchResult(List<Face> faces, int nodesVisited, int leavesVisited, boolean linearScan) {
    public SearchResult {
        faces = List.copyOf(faces);
    }

    public Face closest() {
        return faces.get(0);
    }

    public int size() {
        return faces.size();
    }
}
