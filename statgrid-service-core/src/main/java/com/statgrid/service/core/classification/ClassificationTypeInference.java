package com.statgrid.service.core.classification;

import com.statgrid.core.label.LabelNormalizer;
import com.statgrid.service.core.support.Codes;
import java.util.List;
import java.util.Optional;

/** Maps a dimension heading to one of the well-known classification types. */
public final class ClassificationTypeInference {

    public record TypeDefinition(String code, String name, boolean hierarchical) {}

    private record Rule(List<String> keywords, TypeDefinition type) {}

    private static final List<Rule> RULES = List.of(
            rule(new TypeDefinition("SEX", "Sexe", false), "SEX"),
            rule(new TypeDefinition("RESIDENCE", "Medii de rezidență", false), "MEDII DE REZIDENTA", "URBAN", "RURAL"),
            rule(new TypeDefinition("AGE_GROUP", "Grupe de vârstă", true), "GRUPE DE VARSTA", "VARSTE"),
            rule(new TypeDefinition("ECONOMIC_ACTIVITY", "Activități economice", true), "CAEN", "ACTIVITATI ECONOMICE"),
            rule(
                    new TypeDefinition("EDUCATION_LEVEL", "Niveluri de educație", true),
                    "NIVEL DE EDUCATIE",
                    "NIVEL DE INSTRUIRE"),
            rule(new TypeDefinition("MARITAL_STATUS", "Stare civilă", false), "STARE CIVILA", "STAREA CIVILA"),
            rule(new TypeDefinition("CITIZENSHIP", "Cetățenie", false), "CETATENIE"),
            rule(new TypeDefinition("ETHNICITY", "Etnie", false), "ETNIE", "NATIONALITATE"),
            rule(new TypeDefinition("RELIGION", "Religie", false), "RELIGIE", "CONFESIUNE"),
            rule(new TypeDefinition("OWNERSHIP", "Forme de proprietate", false), "FORME DE PROPRIETATE"),
            rule(new TypeDefinition("SIZE_CLASS", "Clase de mărime", true), "CLASE DE MARIME"));

    private ClassificationTypeInference() {}

    public static Optional<TypeDefinition> infer(String dimensionLabel) {
        String normalized = LabelNormalizer.normalize(dimensionLabel);
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(normalized::contains)) {
                return Optional.of(rule.type());
            }
        }
        return Optional.empty();
    }

    /** Known type for the heading, or a non-hierarchical type coded after the heading itself. */
    public static TypeDefinition inferOrGenerate(String dimensionLabel) {
        return infer(dimensionLabel)
                .orElseGet(() -> new TypeDefinition(Codes.fromLabel(dimensionLabel), dimensionLabel.trim(), false));
    }

    private static Rule rule(TypeDefinition type, String... keywords) {
        return new Rule(List.of(keywords), type);
    }
}
