package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryLibraryRegistryTest {

    private final InMemoryLibraryRegistry registry = new InMemoryLibraryRegistry();

    @Test
    void open_whenPathRegistered_returnsLibrary() {
        DraftLibrary library = new InMemoryDraftLibrary("http://example.org/usc/");
        registry.register("/data/usc", library);

        assertThat(registry.open("/data/usc")).isSameAs(library);
    }

    @Test
    void open_whenPathBlank_throws() {
        assertThatThrownBy(() -> registry.open("  "))
                .isInstanceOf(LibraryUnavailableException.class)
                .hasMessageContaining("Library path is empty");
    }

    @Test
    void open_whenPathUnknown_throws() {
        assertThatThrownBy(() -> registry.open("/data/missing"))
                .isInstanceOf(LibraryUnavailableException.class)
                .hasMessageContaining("Failed to open library: /data/missing");
    }
}
