package io.relayindex.storage;

import io.relayindex.model.CityModel;
import io.relayindex.model.CountryModel;
import io.relayindex.model.RelayListModel;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayListLoaderTest {
    @Test
    void loadShouldReadFixtureAndIgnoreUnknownFields() throws Exception {
        Path fixture = Path.of(RelayListLoaderTest.class.getResource("/relays-fixture.json").toURI());

        RelayListModel model = RelayListLoader.load(fixture);

        assertEquals(2, model.countries().size());
        CountryModel sweden = model.countries().get(0);
        assertEquals("Sweden", sweden.name());
        assertEquals("se", sweden.code());
        CityModel stockholm = sweden.cities().get(0);
        assertEquals("sto", stockholm.code());
        assertEquals(List.of("se1-wg-001", "se1-wg-002"),
                stockholm.relays().stream().map(r -> r.hostname()).toList());
        assertTrue(model.countries().get(1).cities().get(0).relays().isEmpty());
    }

    @Test
    void loadShouldTreatMissingListsAsEmpty() throws Exception {
        Path root = Files.createTempDirectory("relayindex-loader-");
        Path file = root.resolve("relays.json");
        Files.writeString(file, "{\"countries\":[{\"name\":\"Norway\",\"code\":\"no\"}]}");

        RelayListModel model = RelayListLoader.load(file);

        assertEquals(1, model.countries().size());
        assertTrue(model.countries().get(0).cities().isEmpty());
    }

    @Test
    void loadShouldFailWithPathForMissingFile() throws Exception {
        Path root = Files.createTempDirectory("relayindex-loader-missing-");
        Path file = root.resolve("absent.json");

        RuntimeException error = assertThrows(RuntimeException.class, () -> RelayListLoader.load(file));
        assertTrue(error.getMessage().contains(file.toString()));
    }

    @Test
    void loadShouldFailForMalformedJson() throws Exception {
        Path root = Files.createTempDirectory("relayindex-loader-bad-");
        Path file = root.resolve("relays.json");
        Files.writeString(file, "{\"countries\": [");

        RuntimeException error = assertThrows(RuntimeException.class, () -> RelayListLoader.load(file));
        assertTrue(error.getMessage().contains(file.toString()));
        assertTrue(error.getCause() instanceof java.io.IOException);
    }
}
