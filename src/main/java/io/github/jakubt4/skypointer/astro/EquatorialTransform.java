package io.github.jakubt4.skypointer.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Ecliptic to equatorial rotation about the vernal-equinox axis.
 */
public final class EquatorialTransform {

    private EquatorialTransform() {
    }

    /**
     * Mean obliquity of the ecliptic in radians at day count {@code d}.
     */
    public static double obliquity(final double d) {
        return FastMath.toRadians(23.4393 - 3.563E-7 * d);
    }

    public static EquatorialCoordinates toEquatorial(final Vector3D ecliptic, final double d) {
        final var ecl = obliquity(d);
        final var cosEcl = FastMath.cos(ecl);
        final var sinEcl = FastMath.sin(ecl);

        final var xe = ecliptic.getX();
        final var ye = ecliptic.getY() * cosEcl - ecliptic.getZ() * sinEcl;
        final var ze = ecliptic.getY() * sinEcl + ecliptic.getZ() * cosEcl;

        var ra = FastMath.atan2(ye, xe);
        while (ra < 0.0) {
            ra += MathUtils.TWO_PI;
        }
        final var dec = FastMath.atan2(ze, FastMath.sqrt(xe * xe + ye * ye));
        final var rg = FastMath.sqrt(xe * xe + ye * ye + ze * ze);

        return new EquatorialCoordinates(ra, dec, rg);
    }
}
