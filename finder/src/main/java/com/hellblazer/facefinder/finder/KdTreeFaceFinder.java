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

import com.hellblazer.facefinder.common.KdTree;
import com.hellblazer.facefinder.common.NearestNeighborSearch;
import com.hellblazer.facefinder.common.SearchResult;
import com.hellblazer.facefinder.finder.cache.FaceDataset;
import com.hellblazer.facefinder.finder.persistence.FaceRepository;
import com.hellblazer.facefinder.geometry.Face;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Face finder over an in-memory partition tree. New faces are persisted, added to the bounded dataset and the tree is
 * rebuilt from scratch; there is no incremental update.
 * <p>
 * The dataset and its tree are published together as one immutable snapshot. Mutations are serialized by a lock and
 * swap in a new snapshot; searches run against whichever snapshot was current when they started.
 *
 * @author hal.hildebrand
 */
public class KdTreeFaceFinder implements FaceFinder {

    private record Snapshot(List<Face> faces, KdTree tree) {
        static final Snapshot EMPTY = new Snapshot(List.of(), null);
    }

    private static final Logger log = LoggerFactory.getLogger(KdTreeFaceFinder.class);

    private final FaceFinderConfig      config;
    private final FaceDataset           dataset;
    private final ReentrantLock         lock     = new ReentrantLock();
    private final FaceRepository        repository;
    private final NearestNeighborSearch engine;
    private volatile Snapshot           snapshot = Snapshot.EMPTY;

    public KdTreeFaceFinder(FaceRepository repository) {
        this(repository, FaceFinderConfig.defaultConfig());
    }

    /**
     * Load the most recent faces from the repository and index them
     */
    public KdTreeFaceFinder(FaceRepository repository, FaceFinderConfig config) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.config = Objects.requireNonNull(config, "config");
        this.dataset = new FaceDataset(config.getCapacity());
        this.engine = new NearestNeighborSearch(config.getNeighbors());
        reload();
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            repository.truncate();
            dataset.clear();
            snapshot = Snapshot.EMPTY;
            log.info("Flushed all faces");
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the faces currently indexed, in dataset order
     */
    public List<Face> faces() {
        return snapshot.faces;
    }

    public FaceFinderConfig getConfig() {
        return config;
    }

    /**
     * @return whether the current faces are indexed by a tree rather than scanned
     */
    public boolean isIndexed() {
        return snapshot.tree != null;
    }

    /**
     * Discard the in-memory state and re-read the most recent faces from the repository
     */
    public void reload() {
        lock.lock();
        try {
            dataset.load(repository);
            rebuild();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Face> resolve(Face face) {
        return search(face).faces();
    }

    /**
     * Resolve a face, reporting how the search went.
     *
     * @see #resolve(Face)
     */
    public SearchResult search(Face face) {
        var query = face;
        Snapshot current;
        if (query.isNew()) {
            lock.lock();
            try {
                query = store(query);
                current = snapshot;
            } finally {
                lock.unlock();
            }
        } else {
            current = snapshot;
        }
        var result = engine.search(query, current.tree, current.faces);
        log.debug("Resolved {} against {} faces: {}", query, current.faces.size(), result.faces());
        return result;
    }

    /**
     * @return the number of faces currently indexed
     */
    public int size() {
        return snapshot.faces.size();
    }

    private void rebuild() {
        var faces = List.copyOf(dataset.faces());
        var tree = KdTree.build(faces, config.getBuildStrategy()).orElse(null);
        snapshot = new Snapshot(faces, tree);
    }

    private Face store(Face face) {
        var id = repository.insert(face.getRace(), face.getEmotion(), face.getOldness());
        var stored = face.withId(id);
        dataset.push(stored);
        rebuild();
        log.debug("Stored {}", stored);
        return stored;
    }
}
