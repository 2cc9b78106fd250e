package com.nana.equip.repository;

import com.nana.equip.domain.SupplierMatch;

/**
 * Resolves free-text supplier names from a spreadsheet to supplier records,
 * creating a new supplier when nothing is similar enough.
 */
public interface SupplierMatcher {

    /**
     * @param supplierName free-text name as it appears in the file, not blank
     * @param threshold    minimum similarity in [0, 1] for a fuzzy match to be accepted
     * @return the matched or newly created supplier
     * @throws RepositoryException if the lookup or the creation fails
     */
    SupplierMatch matchOrCreate(String supplierName, double threshold);
}
