package io.relayindex.model;

import java.util.List;

public record CountryModel(
        String name,
        String code,
        List<CityModel> cities
) {
    public CountryModel {
        cities = cities == null ? List.of() : List.copyOf(cities);
    }
}
