package com.statgrid.service.core.classification;

import com.statgrid.core.model.ClassificationType;
import com.statgrid.core.model.ClassificationValue;
import java.util.Optional;

public interface ClassificationRepository {

    Optional<ClassificationType> findTypeById(long id);

    Optional<ClassificationType> findTypeByCode(String code);

    /** Returns the created type, or empty when the code already exists. */
    Optional<ClassificationType> insertTypeIfAbsent(String code, String name, boolean hierarchical);

    Optional<ClassificationValue> findValueById(long id);

    Optional<ClassificationValue> findValue(long typeId, String contentHash);

    /** Returns the created value (the draft id is ignored), or empty when the hash already exists for the type. */
    Optional<ClassificationValue> insertValueIfAbsent(ClassificationValue draft);
}
