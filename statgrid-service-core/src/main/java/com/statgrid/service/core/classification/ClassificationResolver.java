package com.statgrid.service.core.classification;

import com.statgrid.core.label.LabelNormalizer;
import com.statgrid.core.model.ClassificationType;
import com.statgrid.core.model.ClassificationValue;
import com.statgrid.service.core.resolve.ClassificationPlacement;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.EntityResolver;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.ResolutionMethod;
import com.statgrid.service.core.resolve.ResolverOutcome;
import com.statgrid.service.core.support.Codes;
import com.statgrid.service.core.support.Sha256;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds or creates classification values under the type named by the context hint. Values are
 * deduplicated by the SHA-256 of their normalized label within a type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationResolver implements EntityResolver {

    private final ClassificationRepository classifications;

    @Override
    public ContextType contextType() {
        return ContextType.CLASSIFICATION;
    }

    @Override
    public ResolverOutcome resolve(LabelRequest request) {
        Long typeId = parseTypeId(request.contextHint());
        if (typeId == null) {
            return ResolverOutcome.unresolved("Missing classification type hint");
        }
        if (classifications.findTypeById(typeId).isEmpty()) {
            return ResolverOutcome.unresolved("Unknown classification type " + typeId);
        }
        ClassificationValue value = findOrCreateValue(typeId, request.label(), request.placement());
        return ResolverOutcome.resolved(value.id(), ResolutionMethod.EXACT);
    }

    public ClassificationType findOrCreateType(String code, String name, boolean hierarchical) {
        return classifications
                .findTypeByCode(code)
                .or(() -> classifications.insertTypeIfAbsent(code, name, hierarchical))
                .or(() -> classifications.findTypeByCode(code))
                .orElseThrow(() -> new IllegalStateException("Classification type vanished after insert: " + code));
    }

    /** Type for a dimension heading: a known type when recognised, otherwise one coded after the heading. */
    public ClassificationType findOrCreateTypeForDimension(String dimensionLabel) {
        ClassificationTypeInference.TypeDefinition definition =
                ClassificationTypeInference.inferOrGenerate(dimensionLabel);
        return findOrCreateType(definition.code(), definition.name(), definition.hierarchical());
    }

    private ClassificationValue findOrCreateValue(long typeId, String label, ClassificationPlacement placement) {
        String normalized = LabelNormalizer.normalize(label);
        String contentHash = Sha256.hex(normalized);
        return classifications
                .findValue(typeId, contentHash)
                .or(() -> classifications.insertValueIfAbsent(draft(typeId, label, normalized, contentHash, placement)))
                .or(() -> classifications.findValue(typeId, contentHash))
                .orElseThrow(() -> new IllegalStateException(
                        "Classification value vanished after insert: type=" + typeId + " label=" + label));
    }

    private ClassificationValue draft(
            long typeId, String label, String normalized, String contentHash, ClassificationPlacement placement) {
        String code = Codes.fromLabel(label);
        String path = code;
        if (placement.parentId() != null) {
            path = classifications
                    .findValueById(placement.parentId())
                    .map(parent -> parent.path() + "." + code)
                    .orElse(code);
        }
        log.debug("Creating classification value '{}' under type {}", label, typeId);
        return new ClassificationValue(
                0L,
                typeId,
                code,
                contentHash,
                label.trim(),
                normalized,
                placement.parentId(),
                path,
                placement.level(),
                placement.sortOrder());
    }

    private static Long parseTypeId(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(hint.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
