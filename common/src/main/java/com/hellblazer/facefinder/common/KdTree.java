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

import com.hellblazer.facefinder.geometry.Axis;
import com.hellblazer.facefinder.geometry.Face;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Three dimensional partition tree over faces. Each level splits its range at the median on the axis for that level
 * (race, emotion, oldness, race, ...). Ranges too small to split leave a leaf holding every face of the range,
 * including the leaf's own pivot.
 * <p>
 * The tree is immutable once built. It is never updated in place: a changed face set means a new tree.
 *
 * @author hal.hildebrand
 */
public class KdTree {

    /**
     * Minimum number of faces on each side of a split
     */
    public static final int MIN_POINTS = 4;

    /**
     * Smallest face set worth a tree: a root and two leaves
     */
    public static final int MIN_BUILD_SIZE = MIN_POINTS * 2 + 3;

    public enum BuildStrategy {
        /**
         * Quicksort each sub-range of one shared array in place
         */
        IN_PLACE,
        /**
         * Copy and stably sort each slice, recursing on sub-lists
         */
        SLICED
    }

    public static final class Node {
        private final Axis       axis;
        private final Node       left;
        private final Face       pivot;
        private final List<Face> points;
        private final Node       right;

        private Node(Face pivot, Axis axis, Node left, Node right) {
            this.pivot = pivot;
            this.axis = axis;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.points = Collections.emptyList();
        }

        private Node(Face pivot, Axis axis, List<Face> points) {
            this.pivot = pivot;
            this.axis = axis;
            this.left = null;
            this.right = null;
            this.points = List.copyOf(points);
        }

        /**
         * The axis this node's range was ordered on. For an internal node this is the splitting axis.
         */
        public Axis axis() {
            return axis;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Node other)) return false;
            return axis == other.axis && pivot.equals(other.pivot) && points.equals(other.points)
            && Objects.equals(left, other.left) && Objects.equals(right, other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(axis, pivot, points, left, right);
        }

        public boolean isLeaf() {
            return left == null;
        }

        public Node left() {
            return left;
        }

        public Face pivot() {
            return pivot;
        }

        /**
         * @return the faces of a leaf, pivot included; empty for an internal node
         */
        public List<Face> points() {
            return points;
        }

        public Node right() {
            return right;
        }

        @Override
        public String toString() {
            return isLeaf() ? "Leaf[" + axis + ", " + pivot + ", " + points.size() + " faces]"
                            : "Node[" + axis + ", " + pivot + "]";
        }
    }

    //
    // Hoare partitioning quicksort on one axis, restricted to [left, right]. The partition value is taken from the
    // midpoint of the range before partitioning starts.
    //
    static class QuickSort {

        static void sort(Face[] data, int left, int right, Axis axis) {
            var l = left;
            var r = right;
            var center = data[midpoint(left, right)].get(axis);
            do {
                while (data[r].get(axis) > center) {
                    r--;
                }
                while (data[l].get(axis) < center) {
                    l++;
                }
                if (l <= r) {
                    swap(data, l, r);
                    l++;
                    r--;
                }
            } while (l <= r);
            if (r > left) {
                sort(data, left, r, axis);
            }
            if (l < right) {
                sort(data, l, right, axis);
            }
        }

        private static void swap(Face[] data, int i, int j) {
            var value = data[i];
            data[i] = data[j];
            data[j] = value;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(KdTree.class);

    /**
     * Build a tree using the {@link BuildStrategy#IN_PLACE} strategy.
     *
     * @param faces the faces to index, in their current order. The list is not modified.
     * @return the tree, or empty if there are fewer than {@link #MIN_BUILD_SIZE} faces
     */
    public static Optional<KdTree> build(List<Face> faces) {
        return build(faces, BuildStrategy.IN_PLACE);
    }

    /**
     * Build a tree. Building twice from the same faces in the same order yields structurally equal trees.
     *
     * @param faces    the faces to index, in their current order. The list is not modified.
     * @param strategy how ranges are ordered and split
     * @return the tree, or empty if there are fewer than {@link #MIN_BUILD_SIZE} faces
     */
    public static Optional<KdTree> build(List<Face> faces, BuildStrategy strategy) {
        if (faces.size() < MIN_BUILD_SIZE) {
            log.debug("Not building tree for {} faces, need at least {}", faces.size(), MIN_BUILD_SIZE);
            return Optional.empty();
        }
        var start = System.nanoTime();
        var root = switch (strategy) {
            case IN_PLACE -> {
                var data = faces.toArray(new Face[0]);
                yield buildRange(data, Axis.RACE, 0, data.length - 1);
            }
            case SLICED -> buildSlice(faces, Axis.RACE);
        };
        var tree = new KdTree(root, faces.size());
        if (log.isDebugEnabled()) {
            log.debug("Built {} tree over {} faces: height {}, {} leaves in {} us", strategy, tree.size,
                      tree.height(), tree.leafCount(), (System.nanoTime() - start) / 1000);
        }
        return Optional.of(tree);
    }

    /**
     * Midpoint of [left, right], halves rounded up
     */
    static int midpoint(int left, int right) {
        return (left + right + 1) / 2;
    }

    private static Node buildRange(Face[] data, Axis axis, int left, int right) {
        QuickSort.sort(data, left, right, axis);
        var mid = midpoint(left, right);
        // start of a run of equal values, so ties always split the same way
        while (mid > left && data[mid].get(axis) == data[mid - 1].get(axis)) {
            mid--;
        }
        var pivot = data[mid];
        if (mid - left > MIN_POINTS && right - mid > MIN_POINTS) {
            var next = axis.next();
            return new Node(pivot, axis, buildRange(data, next, left, mid - 1), buildRange(data, next, mid + 1, right));
        }
        return new Node(pivot, axis, Arrays.asList(data).subList(left, right + 1));
    }

    private static Node buildSlice(List<Face> slice, Axis axis) {
        var sorted = new ArrayList<>(slice);
        sorted.sort(Comparator.comparingInt(f -> f.get(axis)));
        var n = sorted.size();
        var mid = n / 2;
        while (mid > 0 && sorted.get(mid).get(axis) == sorted.get(mid - 1).get(axis)) {
            mid--;
        }
        var pivot = sorted.get(mid);
        if (mid - 1 > MIN_POINTS && n - (mid + 1) > MIN_POINTS) {
            var next = axis.next();
            return new Node(pivot, axis, buildSlice(sorted.subList(0, mid), next),
                            buildSlice(sorted.subList(mid + 1, n), next));
        }
        return new Node(pivot, axis, sorted);
    }

    private final Node root;
    private final int  size;

    private KdTree(Node root, int size) {
        this.root = root;
        this.size = size;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KdTree other)) return false;
        return size == other.size && root.equals(other.root);
    }

    /**
     * Visit every leaf, left to right
     */
    public void forEachLeaf(Consumer<Node> action) {
        forEachNode(node -> {
            if (node.isLeaf()) {
                action.accept(node);
            }
        });
    }

    /**
     * Visit every node in pre-order
     */
    public void forEachNode(Consumer<Node> action) {
        var stack = new ArrayDeque<Node>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            action.accept(node);
            if (!node.isLeaf()) {
                stack.push(node.right);
                stack.push(node.left);
            }
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, size);
    }

    public int height() {
        return height(root);
    }

    public int leafCount() {
        var count = new int[1];
        forEachLeaf(leaf -> count[0]++);
        return count[0];
    }

    public Node root() {
        return root;
    }

    /**
     * @return the number of faces the tree was built from
     */
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "KdTree[size=" + size + ", height=" + height() + "]";
    }

    private int height(Node node) {
        if (node.isLeaf()) {
            return 1;
        }
        return 1 + Math.max(height(node.left), height(node.right));
    }
}
