/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mapforge.common.tile;

/**
 * An axis-aligned rectangle in EPSG:3857 (spherical Mercator) meters.
 */
public record Extent(double minx, double miny, double maxx, double maxy) {

    public Extent {
        if (!(minx < maxx)) {
            throw new IllegalArgumentException(String.format("minx must be less than maxx: %f >= %f", minx, maxx));
        }
        if (!(miny < maxy)) {
            throw new IllegalArgumentException(String.format("miny must be less than maxy: %f >= %f", miny, maxy));
        }
    }

    public double width() {
        return maxx - minx;
    }

    public double height() {
        return maxy - miny;
    }

    /**
     * Returns true if the projected point lies inside this extent, edges included.
     */
    public boolean contains(double x, double y) {
        return x >= minx && x <= maxx && y >= miny && y <= maxy;
    }
}
