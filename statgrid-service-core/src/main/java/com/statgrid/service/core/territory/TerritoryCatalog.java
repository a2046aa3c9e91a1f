package com.statgrid.service.core.territory;

import com.statgrid.core.label.LabelNormalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Static names of the development regions and counties, with their territory codes. */
final class TerritoryCatalog {

    static final String EXTRA_TERRITORIAL = "EXTRA";
    static final String CAPITAL = "B";
    static final String NATIONAL = "RO";

    static final Map<String, String> MACROREGIONS = Map.of(
            "UNU", "RO1",
            "DOI", "RO2",
            "TREI", "RO3",
            "PATRU", "RO4");

    /** Longest names first so compound names win over their suffixes (SUD VEST OLTENIA before VEST). */
    static final List<Region> REGIONS = List.of(
                    region("RO11", "Nord-Vest"),
                    region("RO12", "Centru"),
                    region("RO21", "Nord-Est"),
                    region("RO22", "Sud-Est"),
                    region("RO31", "Sud-Muntenia"),
                    region("RO32", "București-Ilfov"),
                    region("RO41", "Sud-Vest Oltenia"),
                    region("RO42", "Vest"))
            .stream()
            .sorted(Comparator.comparingInt((Region r) -> r.normalizedName().length())
                    .reversed())
            .toList();

    /** Normalized county name to county code. */
    static final Map<String, String> COUNTIES = List.of(
                    new String[] {"AB", "Alba"},
                    new String[] {"AR", "Arad"},
                    new String[] {"AG", "Argeș"},
                    new String[] {"BC", "Bacău"},
                    new String[] {"BH", "Bihor"},
                    new String[] {"BN", "Bistrița-Năsăud"},
                    new String[] {"BT", "Botoșani"},
                    new String[] {"BV", "Brașov"},
                    new String[] {"BR", "Brăila"},
                    new String[] {"B", "București"},
                    new String[] {"BZ", "Buzău"},
                    new String[] {"CS", "Caraș-Severin"},
                    new String[] {"CL", "Călărași"},
                    new String[] {"CJ", "Cluj"},
                    new String[] {"CT", "Constanța"},
                    new String[] {"CV", "Covasna"},
                    new String[] {"DB", "Dâmbovița"},
                    new String[] {"DJ", "Dolj"},
                    new String[] {"GL", "Galați"},
                    new String[] {"GR", "Giurgiu"},
                    new String[] {"GJ", "Gorj"},
                    new String[] {"HR", "Harghita"},
                    new String[] {"HD", "Hunedoara"},
                    new String[] {"IL", "Ialomița"},
                    new String[] {"IS", "Iași"},
                    new String[] {"IF", "Ilfov"},
                    new String[] {"MM", "Maramureș"},
                    new String[] {"MH", "Mehedinți"},
                    new String[] {"MS", "Mureș"},
                    new String[] {"NT", "Neamț"},
                    new String[] {"OT", "Olt"},
                    new String[] {"PH", "Prahova"},
                    new String[] {"SM", "Satu Mare"},
                    new String[] {"SJ", "Sălaj"},
                    new String[] {"SB", "Sibiu"},
                    new String[] {"SV", "Suceava"},
                    new String[] {"TR", "Teleorman"},
                    new String[] {"TM", "Timiș"},
                    new String[] {"TL", "Tulcea"},
                    new String[] {"VS", "Vaslui"},
                    new String[] {"VL", "Vâlcea"},
                    new String[] {"VN", "Vrancea"})
            .stream()
            .collect(Collectors.toUnmodifiableMap(c -> LabelNormalizer.normalizeFoldingHyphens(c[1]), c -> c[0]));

    private TerritoryCatalog() {}

    private static Region region(String code, String name) {
        String normalized = LabelNormalizer.normalizeFoldingHyphens(name);
        String words = String.join("[\\s-]+", normalized.split(" "));
        Pattern pattern = Pattern.compile("(?:^|REGIUNEA\\s+|\\s)" + words + "(?:\\s|$)", Pattern.CASE_INSENSITIVE);
        return new Region(code, normalized, pattern);
    }

    record Region(String code, String normalizedName, Pattern pattern) {
        boolean matches(String normalizedLabel) {
            return normalizedLabel.contains(normalizedName) || pattern.matcher(normalizedLabel).find();
        }
    }
}
