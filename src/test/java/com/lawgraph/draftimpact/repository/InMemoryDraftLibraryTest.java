package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.InMemoryTripleStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDraftLibraryTest {

    @Test
    void register_recordsDocumentEntry() {
        InMemoryTripleStore graph = new InMemoryTripleStore();
        graph.add("http://example.org/usc/6502", "http://example.org/reg#title", "Regulation of unfair acts");
        graph.add("http://example.org/usc/6502", "http://example.org/reg#number", "6502");

        InMemoryDraftLibrary library = new InMemoryDraftLibrary("http://example.org/usc/")
                .register("us-usc-title-15", graph);

        assertThat(library.getDocument("us-usc-title-15")).hasValueSatisfying(entry -> {
            assertThat(entry.getDocumentId()).isEqualTo("us-usc-title-15");
            assertThat(entry.getTripleCount()).isEqualTo(2);
        });
        assertThat(library.loadGraph("us-usc-title-15")).isSameAs(graph);
    }

    @Test
    void loadGraph_whenDocumentUnknown_throws() {
        InMemoryDraftLibrary library = new InMemoryDraftLibrary("http://example.org/usc/");

        assertThatThrownBy(() -> library.loadGraph("us-usc-title-42"))
                .isInstanceOf(LibraryUnavailableException.class)
                .hasMessageContaining("No graph stored for document us-usc-title-42");
        assertThat(library.getDocument("us-usc-title-42")).isEmpty();
    }

    @Test
    void getBaseUri_whenNull_isEmpty() {
        assertThat(new InMemoryDraftLibrary(null).getBaseUri()).isEmpty();
    }
}
