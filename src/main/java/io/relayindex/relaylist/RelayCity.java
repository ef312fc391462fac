package io.relayindex.relaylist;

import io.relayindex.model.LocationConstraint;

import java.util.List;

public record RelayCity(
        String name,
        String countryCode,
        String code,
        boolean expanded,
        List<Relay> relays
) implements RelayItem {
    public RelayCity {
        relays = List.copyOf(relays);
    }

    @Override
    public RelayItemType type() {
        return RelayItemType.CITY;
    }

    @Override
    public boolean hasChildren() {
        return !relays.isEmpty();
    }

    @Override
    public LocationConstraint location() {
        return new LocationConstraint.City(countryCode, code);
    }
}
