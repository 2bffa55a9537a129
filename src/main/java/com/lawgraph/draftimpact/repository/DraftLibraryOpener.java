package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;

/**
 * Opens a library by path.
 */
public interface DraftLibraryOpener {

    /**
     * @throws LibraryUnavailableException if nothing can be opened at the given path
     */
    DraftLibrary open(String path);
}
