package com.example.magiogateway.infrastructure.persistence;

import com.example.magiogateway.domain.model.TokenSet;

public class NoopTokenPersistence implements TokenPersistence {

    @Override
    public TokenSet load(String language) {
        return null;
    }

    @Override
    public void save(TokenSet tokenSet, String language) {
        // nothing to write
    }

    @Override
    public boolean delete(String language) {
        return true;
    }
}
