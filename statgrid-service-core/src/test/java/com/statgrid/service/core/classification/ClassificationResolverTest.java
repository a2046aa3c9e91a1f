package com.statgrid.service.core.classification;

import static org.assertj.core.api.Assertions.assertThat;

import com.statgrid.core.model.ClassificationType;
import com.statgrid.core.model.ClassificationValue;
import com.statgrid.service.core.resolve.ClassificationPlacement;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.ResolverOutcome;
import com.statgrid.service.core.testing.InMemoryClassificationRepository;
import org.junit.jupiter.api.Test;

class ClassificationResolverTest {

    private final InMemoryClassificationRepository repository = new InMemoryClassificationRepository();
    private final ClassificationResolver resolver = new ClassificationResolver(repository);

    @Test
    void createsValueUnderTypeAndDeduplicatesByNormalizedContent() {
        ClassificationType sex = resolver.findOrCreateType("SEX", "Sexe", false);

        ResolverOutcome first = resolver.resolve(request(sex.id(), "Masculin", ClassificationPlacement.ROOT));
        ResolverOutcome second = resolver.resolve(request(sex.id(), "  MASCULIN ", ClassificationPlacement.ROOT));

        assertThat(first.isResolved()).isTrue();
        assertThat(second.entityId()).isEqualTo(first.entityId());
        assertThat(repository.values()).hasSize(1);
        ClassificationValue value = repository.values().get(0);
        assertThat(value.code()).isEqualTo("MASCULIN");
        assertThat(value.nameNormalized()).isEqualTo("MASCULIN");
        assertThat(value.contentHash()).hasSize(64);
    }

    @Test
    void childPathExtendsParentPath() {
        ClassificationType age = resolver.findOrCreateType("AGE_GROUP", "Grupe de vârstă", true);
        long parentId = resolver.resolve(request(age.id(), "0-14 ani", ClassificationPlacement.ROOT))
                .entityId();

        long childId = resolver.resolve(request(age.id(), "0-4 ani", new ClassificationPlacement(parentId, 1, 3)))
                .entityId();

        ClassificationValue child = repository.findValueById(childId).orElseThrow();
        assertThat(child.path()).isEqualTo("014_ANI.04_ANI");
        assertThat(child.parentId()).isEqualTo(parentId);
        assertThat(child.level()).isEqualTo(1);
        assertThat(child.sortOrder()).isEqualTo(3);
    }

    @Test
    void sameLabelUnderDifferentTypesGivesDifferentValues() {
        long sex = resolver.findOrCreateType("SEX", "Sexe", false).id();
        long residence = resolver.findOrCreateType("RESIDENCE", "Medii", false).id();

        Long a = resolver.resolve(request(sex, "Total", ClassificationPlacement.ROOT)).entityId();
        Long b = resolver.resolve(request(residence, "Total", ClassificationPlacement.ROOT)).entityId();

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void missingOrUnknownTypeHintIsUnresolved() {
        assertThat(resolver.resolve(LabelRequest.of(ContextType.CLASSIFICATION, "Total")).reason())
                .contains("Missing");
        assertThat(resolver.resolve(request(999L, "Total", ClassificationPlacement.ROOT)).reason())
                .contains("Unknown");
        assertThat(repository.values()).isEmpty();
    }

    @Test
    void typeForDimensionUsesInferenceThenGeneratedCode() {
        ClassificationType residence = resolver.findOrCreateTypeForDimension("Medii de rezidență");
        ClassificationType again = resolver.findOrCreateTypeForDimension("Medii de rezidenta");
        ClassificationType custom = resolver.findOrCreateTypeForDimension("Tipuri de locuințe");

        assertThat(residence.code()).isEqualTo("RESIDENCE");
        assertThat(again.id()).isEqualTo(residence.id());
        assertThat(custom.code()).isEqualTo("TIPURI_DE_LOCUINTE");
        assertThat(custom.hierarchical()).isFalse();
        assertThat(repository.types()).hasSize(2);
    }

    @Test
    void inferenceRecognisesKnownHeadings() {
        assertThat(ClassificationTypeInference.infer("Sexe")).map(ClassificationTypeInference.TypeDefinition::code)
                .contains("SEX");
        assertThat(ClassificationTypeInference.infer("Activități ale economiei naționale - CAEN Rev.2"))
                .map(ClassificationTypeInference.TypeDefinition::code)
                .contains("ECONOMIC_ACTIVITY");
        assertThat(ClassificationTypeInference.infer("Grupe de vârstă"))
                .map(ClassificationTypeInference.TypeDefinition::hierarchical)
                .contains(true);
        assertThat(ClassificationTypeInference.infer("Categorii de drumuri")).isEmpty();
    }

    private static LabelRequest request(long typeId, String label, ClassificationPlacement placement) {
        return new LabelRequest(ContextType.CLASSIFICATION, label, null, Long.toString(typeId), null, placement);
    }
}
