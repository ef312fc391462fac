package io.relayindex.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text form of a location constraint: {@code any}, {@code se}, {@code se/sto} or
 * {@code se/sto/se1-wg-001}.
 */
public final class LocationConstraints {
    public static final String ANY = "any";
    private static final String SEPARATOR = "/";

    private LocationConstraints() {
    }

    public static Constraint<LocationConstraint> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Constraint.any();
        }
        String value = raw.trim();
        if (ANY.equals(value.toLowerCase(Locale.ROOT))) {
            return Constraint.any();
        }
        List<String> segments = new ArrayList<>();
        for (String segment : value.split(SEPARATOR, -1)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in location constraint: " + raw);
            }
            segments.add(trimmed);
        }
        return switch (segments.size()) {
            case 1 -> Constraint.only(new LocationConstraint.Country(segments.get(0)));
            case 2 -> Constraint.only(new LocationConstraint.City(segments.get(0), segments.get(1)));
            case 3 -> Constraint.only(new LocationConstraint.Hostname(segments.get(0), segments.get(1), segments.get(2)));
            default -> throw new IllegalArgumentException("Too many segments in location constraint: " + raw);
        };
    }

    public static String format(Constraint<LocationConstraint> constraint) {
        if (constraint instanceof Constraint.Only<LocationConstraint> only) {
            return format(only.value());
        }
        return ANY;
    }

    public static String format(LocationConstraint location) {
        if (location instanceof LocationConstraint.Hostname hostname) {
            return String.join(SEPARATOR, hostname.countryCode(), hostname.cityCode(), hostname.hostname());
        }
        if (location instanceof LocationConstraint.City city) {
            return String.join(SEPARATOR, city.countryCode(), city.cityCode());
        }
        return location.countryCode();
    }
}
