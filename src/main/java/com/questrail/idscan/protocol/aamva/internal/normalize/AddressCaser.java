package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.util.Map;
import java.util.Objects;

/**
 * Renders upper-case AAMVA address elements (DAG street, DAI city) in mixed
 * case.
 *
 * <p>Street addresses lose their periods and keep the conventional form of
 * common abbreviations: {@code 123 N. MAIN ST} → {@code 123 N Main St},
 * {@code 9 OAK AVE NE} → {@code 9 Oak Ave NE}.</p>
 */
public final class AddressCaser
{
    private static final Map<String, String> STREET_ABBREVIATIONS = Map.ofEntries(
            Map.entry("st", "St"), Map.entry("ave", "Ave"), Map.entry("blvd", "Blvd"),
            Map.entry("dr", "Dr"), Map.entry("ln", "Ln"), Map.entry("rd", "Rd"),
            Map.entry("ct", "Ct"), Map.entry("pl", "Pl"), Map.entry("cir", "Cir"),
            Map.entry("pkwy", "Pkwy"), Map.entry("hwy", "Hwy"), Map.entry("apt", "Apt"),
            Map.entry("ste", "Ste"), Map.entry("fl", "Fl"),
            Map.entry("n", "N"), Map.entry("s", "S"), Map.entry("e", "E"), Map.entry("w", "W"),
            Map.entry("ne", "NE"), Map.entry("nw", "NW"), Map.entry("se", "SE"), Map.entry("sw", "SW"),
            Map.entry("po", "PO"));

    private AddressCaser() {}

    public static String normalizeStreet(String raw) {
        Objects.requireNonNull(raw, "raw");
        return NameCaser.caseTokens(raw.replace(".", ""), (token, index) -> {
            final String abbreviation = STREET_ABBREVIATIONS.get(token);
            return (abbreviation != null) ? abbreviation : NameCaser.capitalize(token);
        });
    }

    public static String normalizeCity(String raw) {
        Objects.requireNonNull(raw, "raw");
        return NameCaser.caseTokens(raw, (token, index) -> NameCaser.capitalize(token));
    }
}
