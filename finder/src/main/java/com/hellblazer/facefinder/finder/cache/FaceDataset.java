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
package com.hellblazer.facefinder.finder.cache;

import com.hellblazer.facefinder.finder.persistence.FaceRepository;
import com.hellblazer.facefinder.geometry.Face;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The capacity bounded working set of faces eligible for indexing. Once full, each new face overwrites the face with
 * the smallest id, an approximation of evicting the oldest.
 * <p>
 * Not thread-safe; the owner serializes access.
 *
 * @author hal.hildebrand
 */
public class FaceDataset {

    public static final int DEFAULT_CAPACITY = 10000;

    private static final Logger log = LoggerFactory.getLogger(FaceDataset.class);

    private final int        capacity;
    private final List<Face> faces;

    public FaceDataset() {
        this(DEFAULT_CAPACITY);
    }

    public FaceDataset(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.faces = new ArrayList<>(Math.min(capacity, DEFAULT_CAPACITY));
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        faces.clear();
    }

    /**
     * @return unmodifiable view of the faces in their current order
     */
    public List<Face> faces() {
        return Collections.unmodifiableList(faces);
    }

    public boolean isEmpty() {
        return faces.isEmpty();
    }

    /**
     * Replace the contents with the most recent faces of the repository, highest id first
     *
     * @return the number of faces loaded
     */
    public int load(FaceRepository repository) {
        var recent = repository.loadRecent(capacity);
        faces.clear();
        faces.addAll(recent.subList(0, Math.min(capacity, recent.size())));
        log.info("Loaded {} faces, capacity {}", faces.size(), capacity);
        return faces.size();
    }

    /**
     * Add a face, evicting the face with the smallest id when full.
     *
     * @return the evicted face, or null if there was room
     */
    public Face push(Face face) {
        if (faces.size() < capacity) {
            faces.add(face);
            return null;
        }
        faces.sort(Comparator.comparingLong(Face::getId));
        var evicted = faces.set(0, face);
        log.debug("Dataset full at {}, evicted {} for {}", capacity, evicted, face);
        return evicted;
    }

    public int size() {
        return faces.size();
    }
}
