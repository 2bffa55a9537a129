package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link DraftLibraryOpener}: resolves paths to libraries registered in this process.
 */
@Repository
@Slf4j
public class InMemoryLibraryRegistry implements DraftLibraryOpener {

    private final Map<String, DraftLibrary> libraries = new ConcurrentHashMap<>();

    public void register(String path, DraftLibrary library) {
        libraries.put(path, library);
        log.info("Registered library at path: {}", path);
    }

    @Override
    public DraftLibrary open(String path) {
        if (path == null || path.isBlank()) {
            throw new LibraryUnavailableException("Library path is empty");
        }
        DraftLibrary library = libraries.get(path);
        if (library == null) {
            throw new LibraryUnavailableException("Failed to open library: " + path);
        }
        return library;
    }
}
