package com.statgrid.service.core.territory;

import com.statgrid.core.model.Territory;
import java.util.Optional;

/** Read-only access to the pre-seeded territories. */
public interface TerritoryRepository {

    Optional<Territory> findByCode(String code);

    /** Lookup by the external area code (SIRUTA). */
    Optional<Territory> findByExternalCode(String externalCode);
}
