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

import com.hellblazer.facefinder.finder.persistence.InMemoryFaceRepository;
import com.hellblazer.facefinder.geometry.Face;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FaceDatasetTest {

    @Test
    public void testPushBelowCapacity() {
        var dataset = new FaceDataset(3);
        assertNull(dataset.push(new Face(1, 1, 1, 1)));
        assertNull(dataset.push(new Face(2, 2, 2, 2)));
        assertEquals(2, dataset.size());
        assertEquals(List.of(1L, 2L), dataset.faces().stream().map(Face::getId).toList());
    }

    @Test
    public void testEvictsSmallestId() {
        var dataset = new FaceDataset();
        var ids = new ArrayList<Long>();
        for (long id = 1; id <= FaceDataset.DEFAULT_CAPACITY; id++) {
            ids.add(id + 5);
        }
        Collections.shuffle(ids, new Random(0x11));
        for (var id : ids) {
            dataset.push(new Face((int) (id % 101), (int) (id % 1001), 7, id));
        }
        assertEquals(FaceDataset.DEFAULT_CAPACITY, dataset.size());
        var min = dataset.faces().stream().mapToLong(Face::getId).min().orElseThrow();
        assertEquals(6, min);

        var added = new Face(1, 2, 3, 20_000);
        var evicted = dataset.push(added);
        assertNotNull(evicted);
        assertEquals(min, evicted.getId());
        assertEquals(FaceDataset.DEFAULT_CAPACITY, dataset.size());
        var present = dataset.faces().stream().map(Face::getId).collect(Collectors.toSet());
        assertFalse(present.contains(min));
        assertTrue(present.contains(20_000L));
    }

    @Test
    public void testRepeatedEviction() {
        var dataset = new FaceDataset(4);
        for (long id = 1; id <= 4; id++) {
            dataset.push(new Face(0, 0, 0, id));
        }
        dataset.push(new Face(0, 0, 0, 5));
        dataset.push(new Face(0, 0, 0, 6));
        var present = dataset.faces().stream().map(Face::getId).collect(Collectors.toSet());
        assertEquals(Set.of(3L, 4L, 5L, 6L), present);
    }

    @Test
    public void testLoadAndClear() {
        var repository = new InMemoryFaceRepository();
        for (int i = 0; i < 12; i++) {
            repository.insert(i, i, i);
        }
        var dataset = new FaceDataset(5);
        assertEquals(5, dataset.load(repository));
        assertEquals(List.of(12L, 11L, 10L, 9L, 8L), dataset.faces().stream().map(Face::getId).toList());

        dataset.clear();
        assertTrue(dataset.isEmpty());
    }

    @Test
    public void testFacesIsReadOnly() {
        var dataset = new FaceDataset(2);
        dataset.push(new Face(0, 0, 0, 1));
        assertThrows(UnsupportedOperationException.class, () -> dataset.faces().add(new Face(0, 0, 0, 2)));
    }

    @Test
    public void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new FaceDataset(0));
    }
}
