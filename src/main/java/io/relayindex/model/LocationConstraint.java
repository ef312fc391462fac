package io.relayindex.model;

/**
 * Identifies a country, a city inside a country, or a single relay host inside a city.
 */
public sealed interface LocationConstraint
        permits LocationConstraint.Country, LocationConstraint.City, LocationConstraint.Hostname {

    String countryCode();

    record Country(String countryCode) implements LocationConstraint {
    }

    record City(String countryCode, String cityCode) implements LocationConstraint {
    }

    record Hostname(String countryCode, String cityCode, String hostname) implements LocationConstraint {
    }
}
