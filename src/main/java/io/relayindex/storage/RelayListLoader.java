package io.relayindex.storage;

import io.relayindex.model.CityModel;
import io.relayindex.model.CountryModel;
import io.relayindex.model.RelayListModel;
import io.relayindex.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads a {@link RelayListModel} from a JSON file of the form
 * {@code {"countries":[{"name","code","cities":[{"name","code","relays":[{"hostname"}]}]}]}}.
 */
public final class RelayListLoader {
    private static final Logger log = LoggerFactory.getLogger(RelayListLoader.class);

    private RelayListLoader() {
    }

    public static RelayListModel load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Relay list file not found: {}", file);
            throw new RuntimeException("Relay list file not found: " + file, new NoSuchFileException(file.toString()));
        }
        RelayListModel model;
        try {
            model = Jsons.mapper().readValue(file.toFile(), RelayListModel.class);
        } catch (IOException e) {
            log.warn("Failed to read relay list {}: {}", file, e.getMessage());
            throw new RuntimeException("Failed to read relay list: " + file, e);
        }
        if (model == null) {
            // "null" is valid JSON but carries no countries.
            model = new RelayListModel(null);
        }
        if (log.isInfoEnabled()) {
            log.info("Loaded relay list {} (countries={}, cities={}, relays={})",
                    file, model.countries().size(), cityCount(model), relayCount(model));
        }
        return model;
    }

    private static int cityCount(RelayListModel model) {
        int count = 0;
        for (CountryModel country : model.countries()) {
            count += country.cities().size();
        }
        return count;
    }

    private static int relayCount(RelayListModel model) {
        int count = 0;
        for (CountryModel country : model.countries()) {
            for (CityModel city : country.cities()) {
                count += city.relays().size();
            }
        }
        return count;
    }
}
