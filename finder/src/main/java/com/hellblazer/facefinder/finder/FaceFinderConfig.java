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

import com.hellblazer.facefinder.common.KdTree.BuildStrategy;
import com.hellblazer.facefinder.common.NearestNeighborSearch;
import com.hellblazer.facefinder.finder.cache.FaceDataset;

/**
 * Configuration of a {@link KdTreeFaceFinder}.
 *
 * @author hal.hildebrand
 */
public class FaceFinderConfig {

    public static FaceFinderConfig defaultConfig() {
        return new FaceFinderConfig();
    }

    private BuildStrategy buildStrategy = BuildStrategy.IN_PLACE;
    private int           capacity      = FaceDataset.DEFAULT_CAPACITY;
    private int           neighbors     = NearestNeighborSearch.DEFAULT_NEIGHBORS;

    /**
     * How the partition tree is rebuilt after each insert
     */
    public BuildStrategy getBuildStrategy() {
        return buildStrategy;
    }

    /**
     * Maximum number of faces held in memory and indexed
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * Number of faces a resolve returns, the resolved face included
     */
    public int getNeighbors() {
        return neighbors;
    }

    @Override
    public String toString() {
        return "FaceFinderConfig[capacity=" + capacity + ", neighbors=" + neighbors + ", buildStrategy="
        + buildStrategy + "]";
    }

    public FaceFinderConfig withBuildStrategy(BuildStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Build strategy must not be null");
        }
        this.buildStrategy = strategy;
        return this;
    }

    public FaceFinderConfig withCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        return this;
    }

    public FaceFinderConfig withNeighbors(int neighbors) {
        if (neighbors < 2) {
            throw new IllegalArgumentException("Neighbors must be at least 2");
        }
        this.neighbors = neighbors;
        return this;
    }
}
