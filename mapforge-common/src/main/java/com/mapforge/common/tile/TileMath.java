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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversions between WGS84 coordinates, Web Mercator tiles and EPSG:3857 extents.
 *
 * <p>Coordinates are normalized to the unit square first: {@code (0, 0)} is the north-west corner
 * of the map and {@code (1, 1)} the south-east corner. Tile indexes and projected positions are
 * both derived from the normalized values.</p>
 */
public final class TileMath {
    public static final double EARTH_RADIUS = 6378137.0;
    public static final double EARTH_CIRCUMFERENCE = 2 * Math.PI * EARTH_RADIUS;
    public static final String SRS = "EPSG:3857";

    private TileMath() {
    }

    private static double normalizeLongitude(double lon) {
        return 0.5 + lon / 360.0;
    }

    private static double normalizeLatitude(double lat) {
        double sin = Math.sin(Math.toRadians(lat));
        return 0.5 - Math.log((1 + sin) / (1 - sin)) / (4 * Math.PI);
    }

    private static int tileIndex(double normalized, int zoom) {
        long dimension = 1L << zoom;
        if (normalized <= 0) {
            return 0;
        }
        if (normalized >= 1) {
            return (int) (dimension - 1);
        }
        return (int) Math.floor(normalized * dimension);
    }

    /**
     * Returns the tile containing the given coordinate at the given zoom level. Coordinates
     * outside the Mercator square are clamped to the first or last row and column.
     *
     * @param lon  longitude in degrees
     * @param lat  latitude in degrees
     * @param zoom zoom level
     * @return the enclosing tile
     */
    public static Tile fromCoordinates(double lon, double lat, int zoom) {
        int x = tileIndex(normalizeLongitude(lon), zoom);
        int y = tileIndex(normalizeLatitude(lat), zoom);
        return new Tile(x, y, zoom);
    }

    /**
     * Projects a WGS84 coordinate to EPSG:3857.
     *
     * @param lon longitude in degrees
     * @param lat latitude in degrees
     * @return {@code {x, y}} in meters
     */
    public static double[] project(double lon, double lat) {
        double x = (normalizeLongitude(lon) - 0.5) * EARTH_CIRCUMFERENCE;
        double y = (0.5 - normalizeLatitude(lat)) * EARTH_CIRCUMFERENCE;
        return new double[]{x, y};
    }

    /**
     * Returns the bounding box of a tile in EPSG:3857. Tile rows grow southward while projected
     * y grows northward, so row 0 touches the top edge of the map.
     */
    public static Extent boundingBox(Tile tile) {
        double tileSize = EARTH_CIRCUMFERENCE / (1L << tile.zoom());
        double half = EARTH_CIRCUMFERENCE / 2;

        double minx = tile.x() * tileSize - half;
        double maxx = minx + tileSize;
        double maxy = half - tile.y() * tileSize;
        double miny = maxy - tileSize;
        return new Extent(minx, miny, maxx, maxy);
    }

    /**
     * Returns every descendant of {@code tile} down to {@code targetZoom}, deepest zoom first.
     * <p>
     * Tiles are split breadth-first, one zoom level at a time, into the quadrants
     * {@code (2x, 2y)}, {@code (2x+1, 2y)}, {@code (2x+1, 2y+1)} and {@code (2x, 2y+1)}. The
     * accumulated list is reversed before it is returned, so the last element is {@code tile}
     * itself and the list holds {@code sum(4^i)} tiles for {@code i} in
     * {@code [0, targetZoom - tile.zoom()]}.
     *
     * @param tile       the parent tile
     * @param targetZoom the deepest zoom level, not less than {@code tile.zoom()}
     * @return the parent and all of its descendants, deepest first
     * @throws IllegalArgumentException if {@code targetZoom} is less than the tile's zoom or
     *                                  greater than {@link Tile#MAX_ZOOM}
     */
    public static List<Tile> children(Tile tile, int targetZoom) {
        if (targetZoom < tile.zoom()) {
            throw new IllegalArgumentException(
                    String.format("target zoom %d is less than tile zoom %d", targetZoom, tile.zoom())
            );
        }
        if (targetZoom > Tile.MAX_ZOOM) {
            throw new IllegalArgumentException("target zoom exceeds " + Tile.MAX_ZOOM + ": " + targetZoom);
        }

        List<Tile> tiles = new ArrayList<>();
        tiles.add(tile);
        int levelStart = 0;
        for (int zoom = tile.zoom(); zoom < targetZoom; zoom++) {
            int levelEnd = tiles.size();
            for (int i = levelStart; i < levelEnd; i++) {
                Tile parent = tiles.get(i);
                int x = parent.x() * 2;
                int y = parent.y() * 2;
                tiles.add(new Tile(x, y, zoom + 1));
                tiles.add(new Tile(x + 1, y, zoom + 1));
                tiles.add(new Tile(x + 1, y + 1, zoom + 1));
                tiles.add(new Tile(x, y + 1, zoom + 1));
            }
            levelStart = levelEnd;
        }
        Collections.reverse(tiles);
        return tiles;
    }
}
