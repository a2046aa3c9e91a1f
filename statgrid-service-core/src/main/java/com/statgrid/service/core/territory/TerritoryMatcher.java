package com.statgrid.service.core.territory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.statgrid.core.label.LabelNormalizer;
import com.statgrid.core.model.Territory;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.EntityResolver;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.ResolutionMethod;
import com.statgrid.service.core.resolve.ResolverOutcome;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lookup-only territory resolution. Rules run in a fixed order and the first match wins; narrow
 * rules (fixed aggregates, codes, totals, exact county names) always run before the broad region
 * containment test because several county names occur inside compound region names.
 */
@Component
@Slf4j
public class TerritoryMatcher implements EntityResolver {

    private static final Pattern MULTI_ENTITY = Pattern.compile("\\p{Lu}\\p{Ll}+,\\s*\\p{Lu}\\p{Ll}+");
    private static final Pattern CAPITAL_QUALIFIER = Pattern.compile("\\b(SAI|INCL)");
    private static final Pattern CODED = Pattern.compile("^(\\d{4,6})\\s+(.+)$");
    private static final Pattern MACROREGION = Pattern.compile("MACROREGIUNEA\\s+(UNU|DOI|TREI|PATRU)\\b");
    private static final String[] COUNTY_PREFIXES = {"JUDETUL ", "MUNICIPIUL "};

    private final TerritoryRepository territories;
    private final Cache<String, Long> idsByCode =
            Caffeine.newBuilder().maximumSize(1_000).build();

    public TerritoryMatcher(TerritoryRepository territories) {
        this.territories = territories;
    }

    @Override
    public ContextType contextType() {
        return ContextType.TERRITORY;
    }

    @Override
    public ResolverOutcome resolve(LabelRequest request) {
        String trimmed = request.label().trim();
        String normalized = LabelNormalizer.normalizeFoldingHyphens(trimmed);

        if (normalized.contains("EXTRA REGIUNI")) {
            return byCode(TerritoryCatalog.EXTRA_TERRITORIAL, ResolutionMethod.PATTERN);
        }
        if (trimmed.contains(",") && MULTI_ENTITY.matcher(trimmed).find()) {
            return ResolverOutcome.unresolved("Multi-territory aggregate label");
        }

        if (normalized.contains("BUCURESTI") && CAPITAL_QUALIFIER.matcher(normalized).find()) {
            return byCode(TerritoryCatalog.CAPITAL, ResolutionMethod.PATTERN);
        }

        Matcher coded = CODED.matcher(trimmed);
        if (coded.matches()) {
            return byExternalCode(coded.group(1), coded.group(2));
        }

        if (normalized.equals("TOTAL") || normalized.contains("NIVEL NATIONAL")) {
            return byCode(TerritoryCatalog.NATIONAL, ResolutionMethod.PATTERN);
        }

        Matcher macro = MACROREGION.matcher(normalized);
        if (macro.find()) {
            return byCode(TerritoryCatalog.MACROREGIONS.get(macro.group(1)), ResolutionMethod.PATTERN);
        }

        String countyCode = TerritoryCatalog.COUNTIES.get(stripCountyPrefix(normalized));
        if (countyCode != null) {
            return byCode(countyCode, ResolutionMethod.PATTERN);
        }

        for (TerritoryCatalog.Region region : TerritoryCatalog.REGIONS) {
            if (region.matches(normalized)) {
                return byCode(region.code(), ResolutionMethod.PATTERN);
            }
        }

        return ResolverOutcome.unresolved("No territory rule matched");
    }

    private ResolverOutcome byCode(String code, ResolutionMethod method) {
        Long cached = idsByCode.getIfPresent(code);
        if (cached != null) {
            return ResolverOutcome.resolved(cached, method);
        }
        Optional<Territory> territory = territories.findByCode(code);
        if (territory.isEmpty()) {
            log.warn("Territory code {} is not seeded", code);
            return ResolverOutcome.unresolved("Territory code " + code + " not seeded");
        }
        idsByCode.put(code, territory.get().id());
        return ResolverOutcome.resolved(territory.get().id(), method);
    }

    private ResolverOutcome byExternalCode(String code, String name) {
        Optional<Territory> territory =
                territories.findByExternalCode(code).or(() -> territories.findByCode(code));
        if (territory.isPresent()) {
            return ResolverOutcome.resolved(territory.get().id(), ResolutionMethod.CODE);
        }
        log.info("Data quality gap: coded territory label '{} {}' matches no territory", code, name);
        return ResolverOutcome.unresolved("No territory with code " + code);
    }

    private static String stripCountyPrefix(String normalized) {
        for (String prefix : COUNTY_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                return normalized.substring(prefix.length());
            }
        }
        return normalized;
    }
}
