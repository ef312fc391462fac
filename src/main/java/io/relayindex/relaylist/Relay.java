package io.relayindex.relaylist;

import io.relayindex.model.LocationConstraint;

public record Relay(
        String countryCode,
        String cityCode,
        String hostname
) implements RelayItem {
    @Override
    public RelayItemType type() {
        return RelayItemType.RELAY;
    }

    @Override
    public String name() {
        return hostname;
    }

    @Override
    public boolean expanded() {
        return false;
    }

    @Override
    public boolean hasChildren() {
        return false;
    }

    @Override
    public LocationConstraint location() {
        return new LocationConstraint.Hostname(countryCode, cityCode, hostname);
    }
}
