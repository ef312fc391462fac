package io.relayindex.cli;

import io.relayindex.model.LocationConstraints;
import io.relayindex.relaylist.Relay;
import io.relayindex.relaylist.RelayCity;
import io.relayindex.relaylist.RelayCountry;
import io.relayindex.relaylist.RelayItem;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

final class RelayItemViews {
    private RelayItemViews() {
    }

    static Map<String, Object> describe(RelayItem item) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", item.type().name().toLowerCase(Locale.ROOT));
        out.put("name", item.name());
        out.put("location", LocationConstraints.format(item.location()));
        out.put("expanded", item.expanded());
        if (item instanceof RelayCountry country) {
            out.put("code", country.code());
            out.put("cities", country.cities().size());
            out.put("relays", country.cities().stream().mapToInt(city -> city.relays().size()).sum());
        } else if (item instanceof RelayCity city) {
            out.put("countryCode", city.countryCode());
            out.put("code", city.code());
            out.put("relays", city.relays().size());
        } else if (item instanceof Relay relay) {
            out.put("countryCode", relay.countryCode());
            out.put("cityCode", relay.cityCode());
            out.put("hostname", relay.hostname());
        }
        return out;
    }
}
