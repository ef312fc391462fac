package io.relayindex.relaylist;

public enum RelayItemType {
    COUNTRY,
    CITY,
    RELAY
}
