package com.polycopy.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.error.LedgerStoreException;
import com.polycopy.ledger.LedgerSnapshot;
import com.polycopy.ledger.LedgerStateStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the latest ledger snapshot in a single JSON file. Writes go to a sibling temp file
 * that is then moved over the target, so a crash never leaves a half-written snapshot.
 */
@Slf4j
public class JsonFileLedgerStateStore implements LedgerStateStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileLedgerStateStore(@NonNull Path path, @NonNull ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(LedgerSnapshot snapshot) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Ledger saved: {} open positions, {} closed trades",
                    snapshot.positions().size(), snapshot.closedTrades().size());
        } catch (IOException e) {
            throw new LedgerStoreException("failed to save ledger to " + path, e);
        }
    }

    @Override
    public Optional<LedgerSnapshot> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), LedgerSnapshot.class));
        } catch (IOException e) {
            throw new LedgerStoreException("failed to load ledger from " + path, e);
        }
    }

    public Path path() {
        return path;
    }
}
