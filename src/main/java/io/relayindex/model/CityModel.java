package io.relayindex.model;

import java.util.List;

public record CityModel(
        String name,
        String code,
        List<RelayModel> relays
) {
    public CityModel {
        relays = relays == null ? List.of() : List.copyOf(relays);
    }
}
