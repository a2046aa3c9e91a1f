package com.statgrid.service.core.time;

import com.statgrid.core.model.TimePeriod;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.EntityResolver;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.ResolutionMethod;
import com.statgrid.service.core.resolve.ResolverOutcome;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class TimePeriodResolver implements EntityResolver {

    private final TimePeriodRepository periods;

    @Override
    public ContextType contextType() {
        return ContextType.TIME_PERIOD;
    }

    @Override
    public ResolverOutcome resolve(LabelRequest request) {
        Optional<ParsedTimePeriod> parsed = TimePeriodParser.parse(request.label());
        if (parsed.isEmpty()) {
            return ResolverOutcome.unresolved("Unrecognized time period label");
        }
        ParsedTimePeriod period = parsed.get();
        TimePeriod row = periods.find(period).orElseGet(() -> create(period, request));
        return ResolverOutcome.resolved(row.id(), ResolutionMethod.PATTERN);
    }

    private TimePeriod create(ParsedTimePeriod period, LabelRequest request) {
        String labelEn = request.alternativeLabel() == null || request.alternativeLabel().isBlank()
                ? period.englishLabel()
                : request.alternativeLabel().trim();
        return periods.insertIfAbsent(period, request.label().trim(), labelEn)
                .map(created -> {
                    log.debug("Created time period {} for label '{}'", created.id(), request.label());
                    return created;
                })
                .or(() -> periods.find(period))
                .orElseThrow(() -> new IllegalStateException("Time period vanished after insert: " + period));
    }
}
