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

import java.util.Objects;

/**
 * Immutable face feature vector with an identity. An id of 0 marks a face that has not been persisted yet; once a
 * non-zero id is assigned the face is fixed.
 *
 * @author hal.hildebrand
 */
public final class Face {

    /** Id of a face that has not been persisted */
    public static final long NEW = 0L;

    private final int  emotion;
    private final long id;
    private final int  oldness;
    private final int  race;

    /**
     * Create a new, not yet persisted face.
     *
     * @param race    race parameter, 0 to 100
     * @param emotion emotion level, 0 to 1000
     * @param oldness oldness level, 0 to 1000
     * @throws FaceRangeException if any attribute is out of range
     */
    public Face(int race, int emotion, int oldness) {
        this(race, emotion, oldness, NEW);
    }

    /**
     * Create a face.
     *
     * @param race    race parameter, 0 to 100
     * @param emotion emotion level, 0 to 1000
     * @param oldness oldness level, 0 to 1000
     * @param id      identity, 0 for a new face
     * @throws FaceRangeException if any attribute is out of range or the id is negative
     */
    public Face(int race, int emotion, int oldness, long id) {
        if (id < 0) {
            throw new FaceRangeException("id", id, 0, Long.MAX_VALUE);
        }
        this.id = id;
        this.race = Axis.RACE.check(race);
        this.emotion = Axis.EMOTION.check(emotion);
        this.oldness = Axis.OLDNESS.check(oldness);
    }

    /**
     * Squared Euclidean distance over the three axes. No square root is taken; ranking only needs the ordering.
     *
     * @param other other face
     * @return squared distance
     */
    public long distanceSquared(Face other) {
        long dr = race - other.race;
        long de = emotion - other.emotion;
        long d0 = oldness - other.oldness;
        return dr * dr + de * de + d0 * d0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Face other)) return false;
        return id == other.id && race == other.race && emotion == other.emotion && oldness == other.oldness;
    }

    public int get(Axis axis) {
        return switch (axis) {
            case RACE -> race;
            case EMOTION -> emotion;
            case OLDNESS -> oldness;
        };
    }

    /**
     * @param axis axis index, 0 to 2
     */
    public int get(int axis) {
        return get(Axis.of(axis));
    }

    public int getEmotion() {
        return emotion;
    }

    public long getId() {
        return id;
    }

    public int getOldness() {
        return oldness;
    }

    public int getRace() {
        return race;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, race, emotion, oldness);
    }

    public boolean isNew() {
        return id == NEW;
    }

    /**
     * Whether the other face has the same identity. New faces have no identity and only match themselves.
     */
    public boolean isSameFace(Face other) {
        if (this == other) return true;
        return id != NEW && id == other.id;
    }

    @Override
    public String toString() {
        return String.format("Face[%d](%d, %d, %d)", id, race, emotion, oldness);
    }

    /**
     * The persisted copy of this new face.
     *
     * @param id the assigned identity, strictly positive
     * @return a face with the same attributes and the given id
     * @throws IllegalStateException if this face already has an identity
     * @throws FaceRangeException    if the id is not positive
     */
    public Face withId(long id) {
        if (!isNew()) {
            throw new IllegalStateException("Face already persisted as " + this.id);
        }
        if (id <= 0) {
            throw new FaceRangeException("id", id, 1, Long.MAX_VALUE);
        }
        return new Face(race, emotion, oldness, id);
    }
}
