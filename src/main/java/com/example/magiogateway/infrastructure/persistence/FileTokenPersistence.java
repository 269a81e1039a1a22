package com.example.magiogateway.infrastructure.persistence;

import com.example.magiogateway.domain.model.TokenSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the token set as {@code <dataDir>/token_<lang>.json}. Whole-file reads and writes;
 * writes go through a temp file so a crash never leaves a half-written record.
 */
public class FileTokenPersistence implements TokenPersistence {

    private static final Logger log = LoggerFactory.getLogger(FileTokenPersistence.class);

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public FileTokenPersistence(String dataDir, ObjectMapper objectMapper) {
        this(Paths.get(dataDir == null || dataDir.trim().isEmpty() ? "data" : dataDir.trim()), objectMapper);
    }

    public FileTokenPersistence(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public TokenSet load(String language) {
        Path file = tokenFile(language);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            TokenSet tokenSet = objectMapper.readValue(file.toFile(), TokenSet.class);
            log.info("Token record loaded from {}", file);
            return tokenSet;
        } catch (IOException e) {
            log.warn("Token record {} is unreadable, ignoring it", file, e);
            return null;
        }
    }

    @Override
    public void save(TokenSet tokenSet, String language) {
        Path file = tokenFile(language);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), tokenSet);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Token record saved to {}", file);
        } catch (IOException e) {
            log.error("Failed to save token record {}", file, e);
        }
    }

    @Override
    public boolean delete(String language) {
        Path file = tokenFile(language);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Token record {} deleted", file);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to delete token record {}", file, e);
            return false;
        }
    }

    Path tokenFile(String language) {
        return dataDir.resolve("token_" + language + ".json");
    }
}
