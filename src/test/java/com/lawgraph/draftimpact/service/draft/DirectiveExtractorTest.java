package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.service.draft.DirectiveExtractor.Directive;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DirectiveExtractorTest {

    @Test
    void extract_whenShallNot_yieldsOnlyNegatedDirective() {
        List<Directive> directives = DirectiveExtractor.extract("The agency shall not disclose annual reports.");

        assertThat(directives).singleElement().satisfies(directive -> {
            assertThat(directive.getVerb()).isEqualTo("shall not");
            assertThat(directive.isNegated()).isTrue();
            assertThat(directive.getKeywords()).containsExactly("disclose", "annual", "reports");
        });
    }

    @Test
    void extract_whenMustNot_yieldsOnlyNegatedDirective() {
        assertThat(DirectiveExtractor.extract("An operator must not retain records."))
                .extracting(Directive::getVerb)
                .containsExactly("must not");
    }

    @Test
    void extract_whenShallNotice_keepsPlainDirective() {
        List<Directive> directives = DirectiveExtractor.extract("The operator shall notify the parent.");

        assertThat(directives).singleElement().satisfies(directive -> {
            assertThat(directive.getVerb()).isEqualTo("shall");
            assertThat(directive.isNegated()).isFalse();
            assertThat(directive.getKeywords()).containsExactly("notify", "parent");
        });
    }

    @Test
    void extract_whenPositiveAndNegatedSentences_yieldsOneDirectiveEach() {
        List<Directive> directives = DirectiveExtractor.extract(
                "The operator shall provide notice. The operator shall not sell data.");

        assertThat(directives).extracting(Directive::getVerb, Directive::isNegated)
                .containsExactly(
                        tuple("shall not", true),
                        tuple("shall", false));
    }
}
