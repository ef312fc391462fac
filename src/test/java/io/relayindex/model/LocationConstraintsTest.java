package io.relayindex.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocationConstraintsTest {
    @Test
    void parseShouldTreatBlankAndAnyAsUnconstrained() {
        assertEquals(Constraint.any(), LocationConstraints.parse(null));
        assertEquals(Constraint.any(), LocationConstraints.parse("   "));
        assertEquals(Constraint.any(), LocationConstraints.parse("any"));
        assertEquals(Constraint.any(), LocationConstraints.parse(" ANY "));
    }

    @Test
    void parseShouldMapSegmentCountToVariant() {
        assertEquals(Constraint.only(new LocationConstraint.Country("se")), LocationConstraints.parse("se"));
        assertEquals(Constraint.only(new LocationConstraint.City("se", "sto")), LocationConstraints.parse(" se / sto "));
        assertEquals(Constraint.only(new LocationConstraint.Hostname("se", "sto", "se1-wg-001")),
                LocationConstraints.parse("se/sto/se1-wg-001"));
    }

    @Test
    void parseShouldKeepCase() {
        assertEquals(Constraint.only(new LocationConstraint.Country("SE")), LocationConstraints.parse("SE"));
    }

    @Test
    void parseShouldRejectMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> LocationConstraints.parse("se//x"));
        assertThrows(IllegalArgumentException.class, () -> LocationConstraints.parse("se/sto/"));
        assertThrows(IllegalArgumentException.class, () -> LocationConstraints.parse("/sto"));
        assertThrows(IllegalArgumentException.class, () -> LocationConstraints.parse("se/sto/host/extra"));
    }

    @Test
    void formatShouldInvertParse() {
        for (String raw : new String[]{"any", "se", "se/sto", "se/sto/se1-wg-001"}) {
            assertEquals(raw, LocationConstraints.format(LocationConstraints.parse(raw)));
        }
    }

    @Test
    void onlyShouldRejectNullValue() {
        assertThrows(NullPointerException.class, () -> Constraint.only(null));
    }
}
