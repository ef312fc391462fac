package io.relayindex.model;

import java.util.List;

public record RelayListModel(
        List<CountryModel> countries
) {
    public RelayListModel {
        countries = countries == null ? List.of() : List.copyOf(countries);
    }
}
