package dev.nuclr.spherify.engine;

/**
 * Center of the 2-sphere in 3D space.
 *
 * @param x first coordinate
 * @param y second coordinate
 * @param z third coordinate
 */
public record SphereCenter(double x, double y, double z) {

    public static final SphereCenter ORIGIN = new SphereCenter(0, 0, 0);

    /**
     * Parses a point written as three comma-separated numbers without spaces,
     * e.g. {@code 0.8,-1,420.69}.
     *
     * @throws IllegalArgumentException if there are not exactly three numeric coordinates
     */
    public static SphereCenter parse(String text) {
        String[] parts = text.trim().split(",", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "Expected 3 comma-separated coordinates but got " + parts.length + ": '" + text + "'");
        }
        try {
            return new SphereCenter(
                    Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a point in 3D space: '" + text + "'", e);
        }
    }

    /** Engine argument form, e.g. {@code 0.0,0.0,0.0}. */
    public String toArgument() {
        return x + "," + y + "," + z;
    }
}
