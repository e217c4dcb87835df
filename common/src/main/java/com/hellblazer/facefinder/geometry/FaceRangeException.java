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
 * Thrown when a face attribute falls outside its documented range.
 *
 * @author hal.hildebrand
 */
public class FaceRangeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String attribute;
    private final long   max;
    private final long   min;
    private final long   value;

    public FaceRangeException(String attribute, long value, long min, long max) {
        super(max == Long.MAX_VALUE ? String.format("%s must be at least %d, was %d", attribute, min, value)
                                    : String.format("%s must be between %d and %d, was %d", attribute, min, max,
                                                    value));
        this.attribute = attribute;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public String getAttribute() {
        return attribute;
    }

    public long getMax() {
        return max;
    }

    public long getMin() {
        return min;
    }

    public long getValue() {
        return value;
    }
}
