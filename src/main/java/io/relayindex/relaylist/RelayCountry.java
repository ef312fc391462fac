package io.relayindex.relaylist;

import io.relayindex.model.LocationConstraint;

import java.util.List;

public record RelayCountry(
        String name,
        String code,
        boolean expanded,
        List<RelayCity> cities
) implements RelayItem {
    public RelayCountry {
        cities = List.copyOf(cities);
    }

    @Override
    public RelayItemType type() {
        return RelayItemType.COUNTRY;
    }

    @Override
    public boolean hasChildren() {
        return !cities.isEmpty();
    }

    @Override
    public LocationConstraint location() {
        return new LocationConstraint.Country(code);
    }
}
