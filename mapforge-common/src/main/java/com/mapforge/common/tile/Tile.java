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

import java.math.BigDecimal;

/**
 * A Web Mercator ZXY tile address.
 *
 * <p>Tile {@code y} grows downward from the northern edge of the map, so {@code (0, 0)} is the
 * north-west corner at every zoom level.</p>
 *
 * @param x    column, {@code 0 <= x < 2^zoom}
 * @param y    row, {@code 0 <= y < 2^zoom}
 * @param zoom zoom level, {@code 0 <= zoom <= MAX_ZOOM}
 */
public record Tile(int x, int y, int zoom) {
    public static final int MAX_ZOOM = 30;

    public Tile {
        if (zoom < 0 || zoom > MAX_ZOOM) {
            throw new IllegalArgumentException("zoom must be between 0 and " + MAX_ZOOM + ": " + zoom);
        }
        long dimension = 1L << zoom;
        if (x < 0 || x >= dimension) {
            throw new IllegalArgumentException(String.format("x out of range for zoom %d: %d", zoom, x));
        }
        if (y < 0 || y >= dimension) {
            throw new IllegalArgumentException(String.format("y out of range for zoom %d: %d", zoom, y));
        }
    }

    public static Tile fromZxy(int zoom, int x, int y) {
        return new Tile(x, y, zoom);
    }

    /**
     * Expands a slippy-map URL template, e.g. {@code https://tile.example.org/{z}/{x}/{y}.png}.
     *
     * @param template the template containing {@code {x}}, {@code {y}} and {@code {z}} placeholders
     * @return the expanded URL
     */
    public String toUrl(String template) {
        return template
                .replace("{x}", Integer.toString(x))
                .replace("{y}", Integer.toString(y))
                .replace("{z}", Integer.toString(zoom));
    }

    /**
     * Expands a WMS GetMap URL template. {@code {bbox}} becomes the tile's bounding box in
     * EPSG:3857 and {@code {srs}} becomes {@code EPSG:3857}.
     *
     * @param template the template containing {@code {bbox}} and {@code {srs}} placeholders
     * @return the expanded URL
     */
    public String toWmsUrl(String template) {
        Extent bbox = TileMath.boundingBox(this);
        String formatted = plain(bbox.minx()) + "," + plain(bbox.miny()) + "," + plain(bbox.maxx()) + "," + plain(bbox.maxy());
        return template
                .replace("{bbox}", formatted)
                .replace("{srs}", TileMath.SRS);
    }

    // WMS servers expect plain decimals, never the exponent form of Double.toString.
    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    @Override
    public String toString() {
        return zoom + "/" + x + "/" + y;
    }
}
