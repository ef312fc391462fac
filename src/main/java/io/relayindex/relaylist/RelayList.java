package io.relayindex.relaylist;

import io.relayindex.model.CityModel;
import io.relayindex.model.Constraint;
import io.relayindex.model.CountryModel;
import io.relayindex.model.LocationConstraint;
import io.relayindex.model.RelayListModel;
import io.relayindex.model.RelayModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only country, city and relay hierarchy built from a {@link RelayListModel}.
 *
 * <p>Input order is kept as given and nothing is deduplicated, so every lookup returns
 * the first node whose code matches exactly (case-sensitive).
 */
public final class RelayList {
    private final List<RelayCountry> countries;

    public RelayList(RelayListModel model) {
        Objects.requireNonNull(model, "model");
        List<RelayCountry> built = new ArrayList<>(model.countries().size());
        for (CountryModel country : model.countries()) {
            List<RelayCity> cities = new ArrayList<>(country.cities().size());
            for (CityModel city : country.cities()) {
                List<Relay> relays = new ArrayList<>(city.relays().size());
                for (RelayModel relay : city.relays()) {
                    relays.add(new Relay(country.code(), city.code(), relay.hostname()));
                }
                cities.add(new RelayCity(city.name(), country.code(), city.code(), false, relays));
            }
            built.add(new RelayCountry(country.name(), country.code(), false, cities));
        }
        this.countries = List.copyOf(built);
    }

    public List<RelayCountry> countries() {
        return countries;
    }

    public int relayCount() {
        int count = 0;
        for (RelayCountry country : countries) {
            for (RelayCity city : country.cities()) {
                count += city.relays().size();
            }
        }
        return count;
    }

    public Optional<RelayItem> findItemForLocation(Constraint<LocationConstraint> constraint) {
        Objects.requireNonNull(constraint, "constraint");
        if (!(constraint instanceof Constraint.Only<LocationConstraint> only)) {
            return Optional.empty();
        }
        LocationConstraint location = only.value();
        if (location instanceof LocationConstraint.Country country) {
            return findCountry(country.countryCode()).map(RelayItem.class::cast);
        }
        if (location instanceof LocationConstraint.City city) {
            return findCity(city.countryCode(), city.cityCode()).map(RelayItem.class::cast);
        }
        if (location instanceof LocationConstraint.Hostname hostname) {
            return findRelay(hostname.countryCode(), hostname.cityCode(), hostname.hostname())
                    .map(RelayItem.class::cast);
        }
        throw new IllegalStateException("Unsupported location constraint: " + location);
    }

    public Optional<RelayCountry> findCountry(String countryCode) {
        for (RelayCountry country : countries) {
            if (Objects.equals(country.code(), countryCode)) {
                return Optional.of(country);
            }
        }
        return Optional.empty();
    }

    public Optional<RelayCity> findCity(String countryCode, String cityCode) {
        return findCountry(countryCode).flatMap(country -> firstCity(country, cityCode));
    }

    public Optional<Relay> findRelay(String countryCode, String cityCode, String hostname) {
        return findCity(countryCode, cityCode).flatMap(city -> firstRelay(city, hostname));
    }

    private static Optional<RelayCity> firstCity(RelayCountry country, String cityCode) {
        for (RelayCity city : country.cities()) {
            if (Objects.equals(city.code(), cityCode)) {
                return Optional.of(city);
            }
        }
        return Optional.empty();
    }

    private static Optional<Relay> firstRelay(RelayCity city, String hostname) {
        for (Relay relay : city.relays()) {
            if (Objects.equals(relay.hostname(), hostname)) {
                return Optional.of(relay);
            }
        }
        return Optional.empty();
    }
}
