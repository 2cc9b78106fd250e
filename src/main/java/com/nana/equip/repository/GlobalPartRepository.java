package com.nana.equip.repository;

import com.nana.equip.domain.GlobalPart;

import java.util.Optional;

/**
 * Persistence contract for the project-independent parts catalog.
 */
public interface GlobalPartRepository {

    /**
     * Inserts the part or refreshes the existing entry with the same part
     * number (case-insensitive). Non-null incoming fields win; null fields
     * keep the stored value.
     *
     * @param part the catalog payload, part number required
     * @return the catalog id, identical for every call with the same part number
     * @throws RepositoryException if the upsert fails
     */
    String upsertByPartNumber(GlobalPart part);

    Optional<GlobalPart> findByPartNumber(String partNumber);
}
