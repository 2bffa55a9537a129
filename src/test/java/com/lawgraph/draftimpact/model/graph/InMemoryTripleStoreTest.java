package com.lawgraph.draftimpact.model.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTripleStoreTest {

    private InMemoryTripleStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTripleStore();
        store.add("A", GraphVocabulary.REFERENCES, "B");
        store.add("C", GraphVocabulary.REFERENCES, "B");
        store.add("B", GraphVocabulary.TITLE, "Definitions");
    }

    @Test
    void find_treatsNullAndEmptyAsWildcards() {
        assertThat(store.find(null, GraphVocabulary.REFERENCES, "B")).hasSize(2);
        assertThat(store.find("", "", "")).hasSize(3);
        assertThat(store.find("A", null, null))
                .containsExactly(Triple.of("A", GraphVocabulary.REFERENCES, "B"));
    }

    @Test
    void add_isIdempotent() {
        store.add("A", GraphVocabulary.REFERENCES, "B");

        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    void add_rejectsBlankComponents() {
        assertThatThrownBy(() -> store.add("A", "", "B"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.add(null, GraphVocabulary.TITLE, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delete_returnsNumberRemovedAndUpdatesIndexes() {
        int removed = store.delete(null, GraphVocabulary.REFERENCES, "B");

        assertThat(removed).isEqualTo(2);
        assertThat(store.find(null, null, "B")).isEmpty();
        assertThat(store.find("A", null, null)).isEmpty();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void getOne_returnsEmptyStringWhenAbsent() {
        assertThat(store.getOne("B", GraphVocabulary.TITLE)).isEqualTo("Definitions");
        assertThat(store.getOne("B", GraphVocabulary.RDFS_LABEL)).isEmpty();
    }

    @Test
    void copyOf_isIndependentOfSource() {
        InMemoryTripleStore copy = InMemoryTripleStore.copyOf(store);
        copy.delete("A", null, null);
        copy.add("D", GraphVocabulary.REFERENCES, "A");

        assertThat(store.count()).isEqualTo(3);
        assertThat(copy.count()).isEqualTo(3);
        assertThat(store.find("D", null, null)).isEmpty();
    }

    @Test
    void mergeFrom_addsOnlyMissingFacts() {
        InMemoryTripleStore other = new InMemoryTripleStore();
        other.bulkAdd(List.of(
                Triple.of("A", GraphVocabulary.REFERENCES, "B"),
                Triple.of("E", GraphVocabulary.REFERENCES, "F")));

        store.mergeFrom(other);

        assertThat(store.count()).isEqualTo(4);
    }
}
