package com.statgrid.service.core.unit;

import com.statgrid.core.label.LabelNormalizer;
import com.statgrid.core.model.UnitOfMeasure;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.EntityResolver;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.ResolutionMethod;
import com.statgrid.service.core.resolve.ResolverOutcome;
import com.statgrid.service.core.support.Codes;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Resolves {@code UM: <name>} labels, creating the unit on first sight. */
@Component
@RequiredArgsConstructor
@Slf4j
public class UnitResolver implements EntityResolver {

    private static final Pattern UNIT_LABEL = Pattern.compile("^UM:\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private final UnitRepository units;

    @Override
    public ContextType contextType() {
        return ContextType.UNIT;
    }

    @Override
    public ResolverOutcome resolve(LabelRequest request) {
        String label = request.label().trim();
        Matcher matcher = UNIT_LABEL.matcher(label);
        if (!matcher.matches()) {
            return ResolverOutcome.unresolved("Not a unit of measure label");
        }
        String unitName = matcher.group(1).trim();
        Optional<UnitCatalog.KnownUnit> known = UnitCatalog.lookup(LabelNormalizer.normalize(unitName));
        String code = known.map(UnitCatalog.KnownUnit::code).orElseGet(() -> Codes.fromLabel(unitName));
        String symbol = known.map(UnitCatalog.KnownUnit::symbol).filter(s -> !s.isEmpty()).orElse(null);

        Optional<UnitOfMeasure> existing = units.findByCode(code);
        if (existing.isPresent()) {
            if (!existing.get().sourceLabels().contains(label)) {
                units.addSourceLabel(existing.get().id(), label);
            }
            return ResolverOutcome.resolved(existing.get().id(), ResolutionMethod.PATTERN);
        }

        UnitOfMeasure unit = units.insertIfAbsent(code, unitName, symbol, label)
                .map(created -> {
                    log.debug("Created unit of measure {} for label '{}'", created.code(), label);
                    return created;
                })
                .or(() -> units.findByCode(code))
                .orElseThrow(() -> new IllegalStateException("Unit vanished after insert: " + code));
        return ResolverOutcome.resolved(unit.id(), ResolutionMethod.PATTERN);
    }

    /** True when the label carries a unit of measure rather than a dimension option. */
    public static boolean isUnitLabel(String label) {
        return label != null && UNIT_LABEL.matcher(label.trim()).matches();
    }
}
