package dev.devanks.hlsarchive.aggregator.service;

import dev.devanks.hlsarchive.aggregator.model.ItemDocument;

import java.util.Comparator;
import java.util.List;

/**
 * Orders items along a Hilbert curve over the centre of their bbox, so that spatially close items
 * end up in the same row groups.
 */
public final class HilbertOrdering {

    static final int ORDER = 14;
    static final int GRID_SIZE = 1 << ORDER;
    /**
     * One past the largest curve index; items without a usable bbox sort after every placed item.
     */
    static final long UNPLACED = 1L << (2 * ORDER);

    private HilbertOrdering() {
    }

    /**
     * Stable sort; returns a new list.
     */
    public static List<ItemDocument> sort(List<ItemDocument> items) {
        return items.stream()
                .sorted(Comparator.comparingLong(HilbertOrdering::index))
                .toList();
    }

    static long index(ItemDocument item) {
        List<Double> bbox = item.getBbox();
        double west;
        double south;
        double east;
        double north;
        if (bbox.size() == 4) {
            west = bbox.get(0);
            south = bbox.get(1);
            east = bbox.get(2);
            north = bbox.get(3);
        } else if (bbox.size() == 6) {
            west = bbox.get(0);
            south = bbox.get(1);
            east = bbox.get(3);
            north = bbox.get(4);
        } else {
            return UNPLACED;
        }
        double lon = (west + east) / 2;
        double lat = (south + north) / 2;
        if (Double.isNaN(lon) || Double.isNaN(lat)) {
            return UNPLACED;
        }
        return curveIndex(toCell(lon, -180, 180), toCell(lat, -90, 90));
    }

    private static int toCell(double value, double min, double max) {
        double clamped = Math.max(min, Math.min(max, value));
        int cell = (int) ((clamped - min) / (max - min) * GRID_SIZE);
        return Math.min(cell, GRID_SIZE - 1);
    }

    /**
     * Distance along the curve of cell (x, y) on the {@code GRID_SIZE} square grid.
     */
    static long curveIndex(int x, int y) {
        long d = 0;
        for (int s = GRID_SIZE / 2; s > 0; s /= 2) {
            int rx = (x & s) > 0 ? 1 : 0;
            int ry = (y & s) > 0 ? 1 : 0;
            d += (long) s * s * ((3 * rx) ^ ry);
            // rotate the quadrant
            if (ry == 0) {
                if (rx == 1) {
                    x = GRID_SIZE - 1 - x;
                    y = GRID_SIZE - 1 - y;
                }
                int t = x;
                x = y;
                y = t;
            }
        }
        return d;
    }
}
