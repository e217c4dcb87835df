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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * k nearest neighbor search over a {@link KdTree}, falling back to a linear scan when there is no tree.
 * <p>
 * The traversal keeps two bounds. The outer radius is the squared distance of the k-th best face seen so far and
 * drives pruning of far subtrees. The inner radius is the distance of the (k-1)-th best, so that when a closer face
 * evicts the outer bound the next outer bound is already known. The faces closer than the inner bound sit in a
 * backlog heap, from which the next inner bound is pulled. Each accepted face costs a constant number of heap
 * operations instead of a re-sort of the candidates.
 * <p>
 * All traversal state lives in a per-call {@link SearchContext}, so one instance may serve concurrent searches.
 *
 * @author hal.hildebrand
 */
public class NearestNeighborSearch {

    public static final int DEFAULT_NEIGHBORS = KdTree.MIN_POINTS + 1;

    private static final long   UNSET = -1L;
    private static final Logger log   = LoggerFactory.getLogger(NearestNeighborSearch.class);

    private record Candidate(Face face, long distance) {
    }

    /**
     * Worst first
     */
    private static final Comparator<Candidate> FARTHEST_FIRST = Comparator.comparingLong(Candidate::distance)
                                                                           .reversed();

    /**
     * Scratch state of one search
     */
    private static final class SearchContext {
        final PriorityQueue<Candidate> backlog  = new PriorityQueue<>(FARTHEST_FIRST);
        final PriorityQueue<Candidate> best     = new PriorityQueue<>(FARTHEST_FIRST);
        final int                      k;
        final PriorityQueue<Candidate> pending  = new PriorityQueue<>(FARTHEST_FIRST);
        final Face                     query;
        final PriorityQueue<Candidate> scratch  = new PriorityQueue<>(FARTHEST_FIRST);
        Face                           innerPoint;
        long                           innerRadius = UNSET;
        int                            leavesVisited;
        int                            nodesVisited;
        Face                           outerPoint;
        long                           outerRadius = UNSET;
        Face                           pivot;

        SearchContext(Face query, int k) {
            this.query = query;
            this.k = k;
        }

        Candidate candidate(Face face) {
            return new Candidate(face, query.distanceSquared(face));
        }

        void inner(Candidate candidate) {
            innerRadius = candidate.distance;
            innerPoint = candidate.face;
        }

        void offerBest(Candidate candidate) {
            best.offer(candidate);
            if (best.size() > k) {
                best.poll();
            }
        }

        void outer(Candidate candidate) {
            outerRadius = candidate.distance;
            outerPoint = candidate.face;
        }
    }

    private final int neighbors;

    public NearestNeighborSearch() {
        this(DEFAULT_NEIGHBORS);
    }

    /**
     * @param neighbors number of faces a search returns, the query included. At least 2.
     */
    public NearestNeighborSearch(int neighbors) {
        if (neighbors < 2) {
            throw new IllegalArgumentException("Neighbors must be at least 2: " + neighbors);
        }
        this.neighbors = neighbors;
    }

    public int getNeighbors() {
        return neighbors;
    }

    /**
     * Find the faces nearest to the query by squared Euclidean distance.
     *
     * @param query the face to search around. It is returned first whether or not it is among the indexed faces.
     * @param tree  the tree over {@code faces}, or null to scan {@code faces} linearly
     * @param faces every indexed face
     * @return up to {@link #getNeighbors()} faces, closest first
     */
    public SearchResult search(Face query, KdTree tree, Collection<Face> faces) {
        if (tree == null) {
            var queue = new PriorityQueue<>(FARTHEST_FIRST);
            for (var face : faces) {
                queue.offer(new Candidate(face, query.distanceSquared(face)));
            }
            return new SearchResult(finish(query, queue), 0, 0, true);
        }
        var context = new SearchContext(query, neighbors);
        visit(tree.root(), context);
        if (log.isTraceEnabled()) {
            log.trace("Search for {} visited {} nodes, {} leaves of {}; outer {} at {}, inner {} at {}", query,
                      context.nodesVisited, context.leavesVisited, tree, context.outerRadius, context.outerPoint,
                      context.innerRadius, context.innerPoint);
        }
        return new SearchResult(finish(query, context.best), context.nodesVisited, context.leavesVisited, false);
    }

    /**
     * Seed the bounds from the first faces seen. Until k faces have been seen the outer radius stays unset.
     */
    private void establishBounds(List<Face> faces, SearchContext context) {
        for (var face : faces) {
            var candidate = context.candidate(face);
            context.scratch.offer(candidate);
            context.offerBest(candidate);
        }
        if (context.scratch.size() < context.k) {
            return;
        }
        Candidate boundary = null;
        while (context.scratch.size() > context.k - 1) {
            boundary = context.scratch.poll();
        }
        context.outer(boundary);
        context.inner(context.scratch.poll());
        context.backlog.addAll(context.scratch);
        context.scratch.clear();
    }

    /**
     * Drain the candidates in best-last order, put the query at the end and keep the closest, closest first.
     */
    private List<Face> finish(Face query, PriorityQueue<Candidate> queue) {
        var ordered = new ArrayList<Face>(queue.size() + 1);
        while (!queue.isEmpty()) {
            ordered.add(queue.poll().face);
        }
        ordered.removeIf(face -> face.isSameFace(query));
        ordered.add(query);
        var result = new ArrayList<>(ordered.subList(Math.max(0, ordered.size() - neighbors), ordered.size()));
        Collections.reverse(result);
        if (result.isEmpty() || result.get(0) != query) {
            throw new IllegalStateException("Search must yield the query face first: " + query);
        }
        return result;
    }

    /**
     * Scan a leaf once the outer radius is known. Faces inside it are collected, then folded into the bounds worst
     * first.
     */
    private void refineBounds(List<Face> faces, SearchContext context) {
        for (var face : faces) {
            var candidate = context.candidate(face);
            if (candidate.distance < context.outerRadius) {
                context.offerBest(candidate);
                if (context.innerRadius == UNSET) {
                    context.backlog.offer(candidate);
                } else {
                    context.pending.offer(candidate);
                }
            }
        }
        while (!context.pending.isEmpty()) {
            var candidate = context.pending.poll();
            if (context.innerRadius == UNSET) {
                if (candidate.distance < context.outerRadius) {
                    context.backlog.offer(candidate);
                }
            } else {
                tighten(candidate, context);
            }
        }
        if (context.innerRadius == UNSET) {
            settleBacklog(context);
        }
    }

    /**
     * With the inner radius unset the backlog holds every face closer than the outer radius. Pull the outer radius in
     * until exactly k-1 remain, then take the worst of those as the inner radius.
     */
    private void settleBacklog(SearchContext context) {
        while (context.backlog.size() > context.k - 1) {
            context.outer(context.backlog.poll());
        }
        if (context.backlog.size() == context.k - 1) {
            context.inner(context.backlog.poll());
        }
    }

    /**
     * Fold one face closer than the outer radius into the bounds
     */
    private void tighten(Candidate candidate, SearchContext context) {
        if (candidate.distance >= context.outerRadius) {
            return;
        }
        if (candidate.distance >= context.innerRadius) {
            context.outer(candidate);
            return;
        }
        context.outerRadius = context.innerRadius;
        context.outerPoint = context.innerPoint;
        var next = context.backlog.peek();
        if (next == null) {
            // backlog exhausted, re-derive the inner radius from scratch
            context.innerRadius = UNSET;
            context.innerPoint = null;
            context.backlog.offer(candidate);
            return;
        }
        if (next.distance > candidate.distance) {
            context.inner(context.backlog.poll());
            context.backlog.offer(candidate);
        } else {
            context.inner(candidate);
        }
    }

    private void visit(KdTree.Node node, SearchContext context) {
        context.nodesVisited++;
        if (node.isLeaf()) {
            visitLeaf(node, context);
            return;
        }
        var axis = node.axis();
        var value = context.query.get(axis);
        var split = node.pivot().get(axis);
        KdTree.Node near;
        KdTree.Node far;
        if (value >= split) {
            near = node.right();
            far = node.left();
        } else {
            near = node.left();
            far = node.right();
        }
        visit(near, context);
        long toPlane = (long) (split - value) * (split - value);
        if (context.outerRadius == UNSET || toPlane < context.outerRadius) {
            // internal pivots sit in no leaf; consider this one with the first leaf on the far side
            context.pivot = node.pivot();
            visit(far, context);
        }
    }

    private void visitLeaf(KdTree.Node leaf, SearchContext context) {
        context.leavesVisited++;
        var faces = leaf.points();
        if (context.pivot != null) {
            faces = new ArrayList<>(faces);
            faces.add(context.pivot);
            context.pivot = null;
        }
        if (context.outerRadius == UNSET) {
            establishBounds(faces, context);
        } else {
            refineBounds(faces, context);
        }
    }
}
