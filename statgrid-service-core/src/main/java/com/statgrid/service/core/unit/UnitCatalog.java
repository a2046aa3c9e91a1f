package com.statgrid.service.core.unit;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Well-known unit names (normalized, lower-case) with their fixed code and symbol; empty when none. */
final class UnitCatalog {

    record KnownUnit(String code, String symbol) {}

    private static final Map<String, KnownUnit> KNOWN = Map.ofEntries(
            Map.entry("numar persoane", new KnownUnit("PERSONS", "pers.")),
            Map.entry("persoane", new KnownUnit("PERSONS", "pers.")),
            Map.entry("mii", new KnownUnit("MII", "")),
            Map.entry("bucati", new KnownUnit("BUCATI", "buc.")),
            Map.entry("mii bucati", new KnownUnit("MII_BUCATI", "mii buc.")),
            Map.entry("locuri", new KnownUnit("LOCURI", "")),
            Map.entry("numar", new KnownUnit("NUMBER", "nr.")),
            Map.entry("mii persoane", new KnownUnit("THOUSAND_PERSONS", "mii pers.")),
            Map.entry("procente", new KnownUnit("PERCENT", "%")),
            Map.entry("procent", new KnownUnit("PERCENT", "%")),
            Map.entry("%", new KnownUnit("PERCENT", "%")),
            Map.entry("promile", new KnownUnit("PROMILE", "‰")),
            Map.entry("la mie", new KnownUnit("PROMILE", "‰")),
            Map.entry("‰", new KnownUnit("PROMILE", "‰")),
            Map.entry("indice", new KnownUnit("INDEX", "")),
            Map.entry("rata", new KnownUnit("RATE", "")),
            Map.entry("coeficient", new KnownUnit("COEFFICIENT", "")),
            Map.entry("ha", new KnownUnit("HECTARES", "ha")),
            Map.entry("m.p. arie desfasurata", new KnownUnit("SQM_AREA", "m²")),
            Map.entry("mii lei", new KnownUnit("THOUSAND_LEI", "mii lei")),
            Map.entry("milioane lei", new KnownUnit("MILLION_LEI", "mil. lei")),
            Map.entry("lei", new KnownUnit("LEI", "lei")),
            Map.entry("kg", new KnownUnit("KG", "kg")),
            Map.entry("tone", new KnownUnit("TONS", "t")),
            Map.entry("mii tone", new KnownUnit("THOUSAND_TONS", "mii t")),
            Map.entry("litri", new KnownUnit("LITERS", "l")),
            Map.entry("mii litri", new KnownUnit("THOUSAND_LITERS", "mii l")),
            Map.entry("mii locuri", new KnownUnit("THOUSAND_PLACES", "mii loc.")),
            Map.entry("zile-turist", new KnownUnit("TOURIST_DAYS", "zile-turist")),
            Map.entry("numar sosiri", new KnownUnit("ARRIVALS", "sosiri")),
            Map.entry("numar innoptari", new KnownUnit("OVERNIGHT_STAYS", "înnoptări")));

    private UnitCatalog() {}

    static Optional<KnownUnit> lookup(String normalizedName) {
        return Optional.ofNullable(KNOWN.get(normalizedName.toLowerCase(Locale.ROOT)));
    }
}
