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

import com.hellblazer.facefinder.common.KdTree.BuildStrategy;
import com.hellblazer.facefinder.geometry.Axis;
import com.hellblazer.facefinder.geometry.Face;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class KdTreeTest {

    static List<Face> randomFaces(Random random, int count) {
        var faces = new ArrayList<Face>(count);
        for (int i = 1; i <= count; i++) {
            faces.add(new Face(random.nextInt(101), random.nextInt(1001), random.nextInt(1001), i));
        }
        return faces;
    }

    @Test
    public void testBelowThreshold() {
        var faces = randomFaces(new Random(0x1638), KdTree.MIN_BUILD_SIZE - 1);
        assertTrue(KdTree.build(faces).isEmpty());
        assertTrue(KdTree.build(faces, BuildStrategy.SLICED).isEmpty());
        assertTrue(KdTree.build(List.of()).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(BuildStrategy.class)
    public void testMinimumSize(BuildStrategy strategy) {
        var faces = randomFaces(new Random(0x666), KdTree.MIN_BUILD_SIZE);
        var tree = KdTree.build(faces, strategy).orElseThrow();
        assertEquals(KdTree.MIN_BUILD_SIZE, tree.size());
        assertContainsEachOnce(tree, faces);
    }

    @ParameterizedTest
    @EnumSource(BuildStrategy.class)
    public void testEveryFaceOnce(BuildStrategy strategy) {
        var random = new Random(0xdeadbeef);
        for (int size : new int[] { 11, 12, 25, 100, 1000, 10_000 }) {
            var faces = randomFaces(random, size);
            var tree = KdTree.build(faces, strategy).orElseThrow();
            assertEquals(size, tree.size());
            assertContainsEachOnce(tree, faces);
            assertNodeInvariants(tree);
        }
    }

    @ParameterizedTest
    @EnumSource(BuildStrategy.class)
    public void testDuplicateValues(BuildStrategy strategy) {
        var faces = new ArrayList<Face>();
        for (int i = 1; i <= 200; i++) {
            faces.add(new Face(i % 3, (i % 5) * 100, 500, i));
        }
        var tree = KdTree.build(faces, strategy).orElseThrow();
        assertContainsEachOnce(tree, faces);
        assertNodeInvariants(tree);
    }

    @Test
    public void testIdenticalFacesMakeOneLeaf() {
        var faces = new ArrayList<Face>();
        for (int i = 1; i <= 30; i++) {
            faces.add(new Face(10, 10, 10, i));
        }
        var tree = KdTree.build(faces).orElseThrow();
        // every split backs up to the start of the run, leaving nothing on the left
        assertTrue(tree.root().isLeaf());
        assertEquals(30, tree.root().points().size());
    }

    @ParameterizedTest
    @EnumSource(BuildStrategy.class)
    public void testDeterministic(BuildStrategy strategy) {
        var faces = randomFaces(new Random(0x1234), 2000);
        var first = KdTree.build(faces, strategy).orElseThrow();
        var second = KdTree.build(faces, strategy).orElseThrow();
        assertEquals(first, second);
        assertEquals(first.height(), second.height());
        assertEquals(first.leafCount(), second.leafCount());
    }

    @Test
    public void testInputUntouched() {
        var faces = randomFaces(new Random(0x4321), 500);
        var copy = new ArrayList<>(faces);
        KdTree.build(faces);
        KdTree.build(faces, BuildStrategy.SLICED);
        assertEquals(copy, faces);
    }

    @Test
    public void testAxisRotation() {
        var tree = KdTree.build(randomFaces(new Random(0x9), 5000)).orElseThrow();
        assertEquals(Axis.RACE, tree.root().axis());
        var depthAxis = new IdentityHashMap<KdTree.Node, Axis>();
        depthAxis.put(tree.root(), Axis.RACE);
        tree.forEachNode(node -> {
            var expected = depthAxis.get(node);
            assertEquals(expected, node.axis());
            if (!node.isLeaf()) {
                depthAxis.put(node.left(), expected.next());
                depthAxis.put(node.right(), expected.next());
            }
        });
    }

    @Test
    public void testSplitOrdering() {
        var tree = KdTree.build(randomFaces(new Random(0x77), 3000)).orElseThrow();
        tree.forEachNode(node -> {
            if (node.isLeaf()) {
                return;
            }
            var axis = node.axis();
            var split = node.pivot().get(axis);
            collect(node.left()).forEach(f -> assertTrue(f.get(axis) < split, "left of " + node + ": " + f));
            collect(node.right()).forEach(f -> assertTrue(f.get(axis) >= split, "right of " + node + ": " + f));
        });
    }

    @Test
    public void testLeafContainsPivot() {
        var tree = KdTree.build(randomFaces(new Random(0x55), 800)).orElseThrow();
        assertTrue(tree.leafCount() > 1);
        tree.forEachLeaf(leaf -> {
            assertTrue(leaf.points().contains(leaf.pivot()));
            assertTrue(leaf.points().size() > KdTree.MIN_POINTS);
        });
    }

    @Test
    public void testMidpoint() {
        assertEquals(0, KdTree.midpoint(0, 0));
        assertEquals(1, KdTree.midpoint(0, 1));
        assertEquals(1, KdTree.midpoint(0, 2));
        assertEquals(5, KdTree.midpoint(0, 10));
        assertEquals(6, KdTree.midpoint(1, 10));
    }

    @Test
    public void testQuickSort() {
        var random = new Random(0x31);
        var data = randomFaces(random, 1000).toArray(new Face[0]);
        KdTree.QuickSort.sort(data, 100, 899, Axis.EMOTION);
        for (int i = 101; i <= 899; i++) {
            assertTrue(data[i - 1].getEmotion() <= data[i].getEmotion());
        }
    }

    private void assertContainsEachOnce(KdTree tree, List<Face> faces) {
        var counts = new HashMap<Long, Integer>();
        tree.forEachNode(node -> {
            if (node.isLeaf()) {
                node.points().forEach(f -> counts.merge(f.getId(), 1, Integer::sum));
            } else {
                counts.merge(node.pivot().getId(), 1, Integer::sum);
            }
        });
        assertEquals(faces.size(), counts.size());
        for (var face : faces) {
            assertEquals(1, counts.getOrDefault(face.getId(), 0), "count of " + face);
        }
    }

    private void assertNodeInvariants(KdTree tree) {
        tree.forEachNode(node -> {
            assertEquals(node.left() == null, node.right() == null, "exactly one child: " + node);
            if (!node.isLeaf()) {
                assertTrue(node.points().isEmpty());
            } else {
                assertTrue(node.points().contains(node.pivot()));
            }
        });
    }

    private List<Face> collect(KdTree.Node node) {
        var result = new ArrayList<Face>();
        collect(node, result);
        return result;
    }

    private void collect(KdTree.Node node, List<Face> result) {
        if (node.isLeaf()) {
            result.addAll(node.points());
            return;
        }
        result.add(node.pivot());
        collect(node.left(), result);
        collect(node.right(), result);
    }
}
