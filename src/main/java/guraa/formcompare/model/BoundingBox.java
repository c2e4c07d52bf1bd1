package guraa.formcompare.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Axis-aligned box in display space: origin at the top-left corner of the page,
 * y growing downward. {@code y0} is the top edge and {@code y1} the bottom edge.
 */
@Value
@Builder
@Jacksonized
public class BoundingBox {

    double x0;
    double y0;
    double x1;
    double y1;

    public static BoundingBox of(double x0, double y0, double x1, double y1) {
        return new BoundingBox(x0, y0, x1, y1);
    }

    public double height() {
        return y1 - y0;
    }

    public double centerX() {
        return (x0 + x1) / 2.0;
    }

    public double centerY() {
        return (y0 + y1) / 2.0;
    }

    /**
     * Euclidean distance between the centers of two boxes.
     *
     * @param other The other box
     * @return The center-to-center distance
     */
    public double centerDistance(BoundingBox other) {
        double dx = centerX() - other.centerX();
        double dy = centerY() - other.centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Check whether every edge of this box lies within {@code tolerance} of the
     * matching edge of the other box.
     *
     * @param other The other box
     * @param tolerance Maximum allowed drift per edge
     * @return true if all four edges are within tolerance
     */
    public boolean isWithinTolerance(BoundingBox other, double tolerance) {
        return Math.abs(x0 - other.x0) <= tolerance
                && Math.abs(y0 - other.y0) <= tolerance
                && Math.abs(x1 - other.x1) <= tolerance
                && Math.abs(y1 - other.y1) <= tolerance;
    }
}
