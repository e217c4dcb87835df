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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory repository. Ids come from a sequence starting at 1 that is not reset by
 * {@link #truncate()}, so an id is never handed out twice.
 *
 * @author hal.hildebrand
 */
public class InMemoryFaceRepository implements FaceRepository {
    private final ConcurrentSkipListMap<Long, Face> faces    = new ConcurrentSkipListMap<>();
    private final AtomicLong                        sequence = new AtomicLong(1L);

    @Override
    public long insert(int race, int emotion, int oldness) {
        var face = new Face(race, emotion, oldness).withId(sequence.getAndIncrement());
        faces.put(face.getId(), face);
        return face.getId();
    }

    @Override
    public List<Face> loadRecent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        var result = new ArrayList<Face>(Math.min(limit, faces.size()));
        for (var face : faces.descendingMap().values()) {
            if (result.size() == limit) {
                break;
            }
            result.add(face);
        }
        return result;
    }

    /**
     * Get the next id without consuming it
     */
    public long peekNextId() {
        return sequence.get();
    }

    public int size() {
        return faces.size();
    }

    @Override
    public void truncate() {
        faces.clear();
    }
}
