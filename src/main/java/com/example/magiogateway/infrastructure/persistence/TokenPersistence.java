package com.example.magiogateway.infrastructure.persistence;

import com.example.magiogateway.domain.model.TokenSet;

/**
 * Durable copy of the last token set per language. Implementations log failures instead of
 * throwing; callers fall back to memory-only handling.
 */
public interface TokenPersistence {

    /**
     * @return stored token set, or {@code null} when nothing usable is stored
     */
    TokenSet load(String language);

    void save(TokenSet tokenSet, String language);

    /**
     * Removes the stored record. A missing record is not an error.
     *
     * @return false only when an existing record could not be removed
     */
    boolean delete(String language);
}
