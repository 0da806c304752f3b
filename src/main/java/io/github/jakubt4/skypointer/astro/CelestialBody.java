package io.github.jakubt4.skypointer.astro;

import io.github.jakubt4.skypointer.error.UnknownBodyException;
import org.hipparchus.util.FastMath;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Every body the pointer can track.
 *
 * <p>Sun, Moon and planets are resolved through {@link OrbitalElementProvider};
 * stars and galaxies carry their J2000 right ascension and declination in degrees.
 */
public enum CelestialBody {

    SUN("Sun", BodyCategory.SUN, "Sonne"),
    MOON("Moon", BodyCategory.MOON, "Mond"),
    MERCURY("Mercury", BodyCategory.PLANET, "Merkur"),
    VENUS("Venus", BodyCategory.PLANET),
    MARS("Mars", BodyCategory.PLANET),
    JUPITER("Jupiter", BodyCategory.PLANET),
    SATURN("Saturn", BodyCategory.PLANET),
    URANUS("Uranus", BodyCategory.PLANET),
    NEPTUNE("Neptune", BodyCategory.PLANET, "Neptun"),

    SIRIUS("Sirius", BodyCategory.STAR, 101.5, -16.74497),
    ALPHA_CENTAURI_A("Alpha Centauri A", BodyCategory.STAR, 219.9, -60.83389),
    ARCTURUS("Arcturus", BodyCategory.STAR, 214.1333, 19.0835),
    VEGA("Vega", BodyCategory.STAR, 279.3958, 38.080389),
    ALDEBARAN("Aldebaran", BodyCategory.STAR, 69.2542, 16.54503),
    CAPELLA("Capella", BodyCategory.STAR, 79.525, 46.01411),
    REGULUS("Regulus", BodyCategory.STAR, 152.3458, 11.87286),
    ALTAIR("Altair", BodyCategory.STAR, 297.9292, 8.921056),
    RIGEL("Rigel", BodyCategory.STAR, 78.8625, -8.182111),

    ANDROMEDA("Andromeda", BodyCategory.GALAXY, 10.95, 41.37297),
    LARGE_MAGELLANIC_CLOUD("Large Magellanic Cloud", BodyCategory.GALAXY, 80.8542, -69.74044, "Gr. Magel. Wolke"),
    SMALL_MAGELLANIC_CLOUD("Small Magellanic Cloud", BodyCategory.GALAXY, 13.3208, -72.69078, "Kl. Magel. Wolke"),
    TRIANGULUM("Triangulum", BodyCategory.GALAXY, 23.7333, 30.75689, "Dreiecksnebel"),
    BODES_GALAXY("Bode's Galaxy", BodyCategory.GALAXY, 149.4583, 68.97347, "Bodes Galaxie"),
    CENTAURUS_A("Centaurus A", BodyCategory.GALAXY, 201.6458, -43.11758),
    CIGAR_GALAXY("Cigar Galaxy", BodyCategory.GALAXY, 149.3583, 69.58781, "Zigarrengalaxie"),
    SOMBRERO_GALAXY("Sombrero Galaxy", BodyCategory.GALAXY, 190.2458, -11.7275, "Sombrerogalaxie"),
    VIRGO_A("Virgo A", BodyCategory.GALAXY, 187.9458, 12.28597);

    private static final Map<String, CelestialBody> BY_KEY = new HashMap<>();

    static {
        for (final var body : values()) {
            BY_KEY.put(key(body.name()), body);
            BY_KEY.put(key(body.displayName), body);
            for (final var alias : body.aliases) {
                BY_KEY.put(key(alias), body);
            }
        }
    }

    private final String displayName;
    private final BodyCategory category;
    private final double rightAscensionDeg;
    private final double declinationDeg;
    private final List<String> aliases;

    CelestialBody(final String displayName, final BodyCategory category, final String... aliases) {
        this(displayName, category, Double.NaN, Double.NaN, aliases);
    }

    CelestialBody(final String displayName, final BodyCategory category,
                  final double rightAscensionDeg, final double declinationDeg, final String... aliases) {
        this.displayName = displayName;
        this.category = category;
        this.rightAscensionDeg = rightAscensionDeg;
        this.declinationDeg = declinationDeg;
        this.aliases = List.of(aliases);
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Name the pointing controller firmware knows the body by. This is the legacy
     * German menu name where one differs from the display name.
     */
    public String menuName() {
        return aliases.isEmpty() ? displayName : aliases.get(0);
    }

    public BodyCategory category() {
        return category;
    }

    public boolean isCatalog() {
        return category.isCatalog();
    }

    /**
     * @throws IllegalStateException for bodies that move along an orbit
     */
    public double rightAscensionRad() {
        requireCatalog();
        return FastMath.toRadians(rightAscensionDeg);
    }

    /**
     * @throws IllegalStateException for bodies that move along an orbit
     */
    public double declinationRad() {
        requireCatalog();
        return FastMath.toRadians(declinationDeg);
    }

    private void requireCatalog() {
        if (!isCatalog()) {
            throw new IllegalStateException(displayName + " has no fixed equatorial coordinates");
        }
    }

    /**
     * Resolves a body from its constant name, display name or legacy menu name.
     * Matching ignores case, spaces and punctuation.
     *
     * @throws UnknownBodyException if nothing matches
     */
    public static CelestialBody fromId(final String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new UnknownBodyException(String.valueOf(identifier));
        }
        final var body = BY_KEY.get(key(identifier));
        if (body == null) {
            throw new UnknownBodyException(identifier);
        }
        return body;
    }

    public static Map<BodyCategory, List<CelestialBody>> byCategory() {
        final var grouped = Stream.of(values())
                .collect(Collectors.groupingBy(CelestialBody::category,
                        () -> new EnumMap<BodyCategory, List<CelestialBody>>(BodyCategory.class), Collectors.toList()));
        return Collections.unmodifiableMap(grouped);
    }

    private static String key(final String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
