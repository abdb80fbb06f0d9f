package com.thermosentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Grouping key for baseline statistics: a (city, season) pair.
 *
 * <p>
 * Keys order by city, then season, so maps keyed by {@code SeasonKey} iterate
 * deterministically.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonKey implements Comparable<SeasonKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<SeasonKey> ORDER = Comparator
            .comparing(SeasonKey::getCity)
            .thenComparing(SeasonKey::getSeason);

    private final String city;
    private final String season;

    private SeasonKey(String city, String season) {
        this.city = Objects.requireNonNull(city, "city must not be null");
        this.season = Objects.requireNonNull(season, "season must not be null");
    }

    /**
     * @param city   city name
     * @param season season label
     * @return the key for the pair
     * @throws NullPointerException if either argument is {@code null}
     */
    public static SeasonKey of(String city, String season) {
        return new SeasonKey(city, season);
    }

    public String getCity() {
        return city;
    }

    public String getSeason() {
        return season;
    }

    @Override
    public int compareTo(SeasonKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonKey that))
            return false;
        return city.equals(that.city) && season.equals(that.season);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, season);
    }

    @Override
    public String toString() {
        return "(" + city + ", " + season + ")";
    }
}
