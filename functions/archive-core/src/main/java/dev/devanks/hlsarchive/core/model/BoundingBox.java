package dev.devanks.hlsarchive.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.locationtech.jts.geom.Envelope;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

/**
 * Geographic bounding box in degrees, (west, south, east, north).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BoundingBox {

    double west;
    double south;
    double east;
    double north;

    public static BoundingBox of(double west, double south, double east, double north) {
        if (west < -180 || west > 180) {
            throw new IllegalArgumentException("min_lon must be between -180 and 180, got " + west);
        }
        if (east < -180 || east > 180) {
            throw new IllegalArgumentException("max_lon must be between -180 and 180, got " + east);
        }
        if (south < -90 || south > 90) {
            throw new IllegalArgumentException("min_lat must be between -90 and 90, got " + south);
        }
        if (north < -90 || north > 90) {
            throw new IllegalArgumentException("max_lat must be between -90 and 90, got " + north);
        }
        if (west >= east) {
            throw new IllegalArgumentException("min_lon (" + west + ") must be less than max_lon (" + east + ")");
        }
        if (south >= north) {
            throw new IllegalArgumentException("min_lat (" + south + ") must be less than max_lat (" + north + ")");
        }
        return new BoundingBox(west, south, east, north);
    }

    /**
     * Builds a box from a 4-element list of numbers, as found in JSON invocation payloads.
     */
    public static BoundingBox fromList(List<?> values) {
        if (values == null || values.size() != 4) {
            throw new IllegalArgumentException("Invalid bounding_box: expected 4 values, got "
                    + (values == null ? 0 : values.size()));
        }
        double[] coords = new double[4];
        for (int i = 0; i < 4; i++) {
            if (!(values.get(i) instanceof Number number)) {
                throw new IllegalArgumentException("Invalid bounding_box: value " + values.get(i) + " is not a number");
            }
            coords[i] = number.doubleValue();
        }
        return of(coords[0], coords[1], coords[2], coords[3]);
    }

    public Envelope toEnvelope() {
        return new Envelope(west, east, south, north);
    }

    /**
     * Boundary-inclusive: boxes that only touch count as intersecting.
     */
    public boolean intersects(Envelope other) {
        return other != null && toEnvelope().intersects(other);
    }

    /**
     * CMR {@code bounding_box} parameter value, in plain decimal notation.
     */
    public String toCmrParameter() {
        return DoubleStream.of(west, south, east, north)
                .mapToObj(value -> BigDecimal.valueOf(value).toPlainString())
                .collect(Collectors.joining(","));
    }
}
