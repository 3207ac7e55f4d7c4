package io.github.jakubt4.pmfusion.model;

/**
 * Six-parameter linear mapping from detector pixels to tangent-plane pixels:
 * {@code xi = a*x + b*y + c}, {@code eta = d*x + e*y + f}.
 */
public record LinearTransform(double a, double b, double c, double d, double e, double f) {

    /**
     * Pure translation placing {@code (x0, y0)} at the origin.
     */
    public static LinearTransform centeredOn(final double x0, final double y0) {
        return new LinearTransform(1.0, 0.0, -x0, 0.0, 1.0, -y0);
    }

    public double xi(final double x, final double y) {
        return a * x + b * y + c;
    }

    public double eta(final double x, final double y) {
        return d * x + e * y + f;
    }
}
