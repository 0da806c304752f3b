package io.github.jakubt4.skypointer.astro;

public enum BodyCategory {
    SUN,
    MOON,
    PLANET,
    STAR,
    GALAXY;

    /**
     * Stars and galaxies have fixed equatorial coordinates and no orbit.
     */
    public boolean isCatalog() {
        return this == STAR || this == GALAXY;
    }
}
