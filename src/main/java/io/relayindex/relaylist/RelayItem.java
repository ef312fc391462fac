package io.relayindex.relaylist;

import io.relayindex.model.LocationConstraint;

/**
 * A node of the relay hierarchy: a country, a city or a single relay.
 */
public sealed interface RelayItem permits RelayCountry, RelayCity, Relay {
    RelayItemType type();

    String name();

    boolean expanded();

    boolean hasChildren();

    /**
     * The location constraint that selects exactly this node.
     */
    LocationConstraint location();
}
