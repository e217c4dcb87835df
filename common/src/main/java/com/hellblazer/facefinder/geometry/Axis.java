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
package com.hellblazer.facefinder.geometry;

/**
 * The three feature axes of a face, in splitting order. Each axis carries the inclusive range its values must fall
 * in.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    RACE("race", 0, 100), EMOTION("emotion", 0, 1000), OLDNESS("oldness", 0, 1000);

    public static final int DIMENSIONS = 3;

    private static final Axis[] VALUES = values();

    public static Axis of(int index) {
        if (index < 0 || index >= DIMENSIONS) {
            throw new IllegalArgumentException("Unexpected axis index: " + index);
        }
        return VALUES[index];
    }

    private final String attribute;
    private final int    max;
    private final int    min;

    Axis(String attribute, int min, int max) {
        this.attribute = attribute;
        this.min = min;
        this.max = max;
    }

    public String attribute() {
        return attribute;
    }

    /**
     * @throws FaceRangeException if the value lies outside [min, max]
     */
    public int check(int value) {
        if (value < min || value > max) {
            throw new FaceRangeException(attribute, value, min, max);
        }
        return value;
    }

    public int max() {
        return max;
    }

    public int min() {
        return min;
    }

    /**
     * The axis used one level deeper in the tree: race, emotion, oldness, race, ...
     */
    public Axis next() {
        return VALUES[(ordinal() + 1) % DIMENSIONS];
    }
}
