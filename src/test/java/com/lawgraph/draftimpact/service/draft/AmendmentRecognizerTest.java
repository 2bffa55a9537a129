package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.draft.AmendmentType;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.draft.DraftSection;
import com.lawgraph.draftimpact.dto.draft.TargetReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AmendmentRecognizerTest {

    private static final String NUMBERED_BLOCK =
            "SEC. 3. DEFINITIONS.\n"
                    + "    Section 1303 of the Children's Online Privacy Protection Act of 1998 (15 U.S.C. 6502) is amended--\n"
                    + "        (1) in subsection (b)--\n"
                    + "            (A) in paragraph (1), by striking \"parent\" and inserting \"parent or guardian\"; and\n"
                    + "            (B) by adding at the end the following: \"(3) Each operator shall maintain records.\"\n"
                    + "        (2) by redesignating subsection (c) as subsection (d).\n";

    private final AmendmentRecognizer recognizer = new AmendmentRecognizer(DraftAnalysisConfig.defaults());

    @Test
    void extractAmendments_recognizesInlineStrikeAndInsert() {
        List<Amendment> amendments = recognizer.extractAmendments(
                "Section 1302 of the Act (15 U.S.C. 6501) is amended by striking \"13 years\" and inserting \"16 years\".");

        assertThat(amendments).hasSize(1);
        Amendment amendment = amendments.get(0);
        assertThat(amendment.getType()).isEqualTo(AmendmentType.STRIKE_INSERT);
        assertThat(amendment.getTargetTitle()).isEqualTo("15");
        assertThat(amendment.getTargetSection()).isEqualTo("6501");
        assertThat(amendment.getStrikeText()).isEqualTo("13 years");
        assertThat(amendment.getInsertText()).isEqualTo("16 years");
    }

    @Test
    void extractAmendments_recognizesStandaloneRepeal() {
        List<Amendment> amendments = recognizer.extractAmendments(
                "Section 1307 of title 15, United States Code, is hereby repealed.");

        assertThat(amendments).extracting(Amendment::getType, Amendment::getTargetTitle, Amendment::getTargetSection)
                .containsExactly(tuple(AmendmentType.REPEAL, "15", "1307"));
    }

    @Test
    void extractAmendments_narrowsTargetThroughNumberedAndLetteredClauses() {
        List<Amendment> amendments = recognizer.extractAmendments(NUMBERED_BLOCK);

        assertThat(amendments)
                .extracting(Amendment::getType, Amendment::getTargetSection, Amendment::getTargetSubsection)
                .containsExactly(
                        tuple(AmendmentType.STRIKE_INSERT, "6502", "(b)(1)"),
                        tuple(AmendmentType.ADD_AT_END, "6502", "(b)"),
                        tuple(AmendmentType.REDESIGNATE, "6502", ""));
        assertThat(amendments.get(1).getInsertText()).isEqualTo("(3) Each operator shall maintain records.");
        assertThat(amendments.get(2).getStrikeText()).isEqualTo("(c)");
        assertThat(amendments.get(2).getInsertText()).isEqualTo("(d)");
    }

    @Test
    void extractAmendments_isDeterministic() {
        assertThat(recognizer.extractAmendments(NUMBERED_BLOCK))
                .isEqualTo(recognizer.extractAmendments(NUMBERED_BLOCK));
    }

    @Test
    void extractAmendments_givesEachAnchorItsOwnTarget() {
        String text = "    Section 1303 of the Act (15 U.S.C. 6502) is amended by striking \"website\" and inserting \"online service\".\n"
                + "\n"
                + "    Section 1304 of the Act (15 U.S.C. 6503) is amended by striking \"may\" and inserting \"shall\".\n";

        List<Amendment> amendments = recognizer.extractAmendments(text);

        assertThat(amendments).extracting(Amendment::getTargetSection, Amendment::getInsertText)
                .containsExactly(tuple("6502", "online service"), tuple("6503", "shall"));
    }

    @Test
    void extractAmendments_whenLaterPreambleNamesNoTarget_usesEarlierCitation() {
        String text = "    Section 1303 of the Act (15 U.S.C. 6502) is amended by striking \"website\" and inserting \"online service\".\n"
                + "\n"
                + "    Such section is further amended by striking \"may\" and inserting \"shall\".\n";

        List<Amendment> amendments = recognizer.extractAmendments(text);

        assertThat(amendments).extracting(Amendment::getTargetSection, Amendment::getInsertText)
                .containsExactly(tuple("6502", "online service"), tuple("6502", "shall"));
    }

    @Test
    void extractAmendments_keepsLeadEditAndIgnoresFollowingNumberedList() {
        String text = "Section 1305 of the Act (15 U.S.C. 6504) is amended by striking \"30 days\" and inserting \"15 days\".\n"
                + "    (1) In general.--An operator shall respond within the period.\n"
                + "    (2) Extensions.--The Commission may extend the period.\n";

        List<Amendment> amendments = recognizer.extractAmendments(text);

        assertThat(amendments).hasSize(1);
        assertThat(amendments.get(0).getStrikeText()).isEqualTo("30 days");
    }

    @Test
    void extractAmendments_returnsEmptyListForTextWithoutDirectives() {
        assertThat(recognizer.extractAmendments("SEC. 1. SHORT TITLE. This Act may be cited as the Kids Privacy Act."))
                .isEmpty();
        assertThat(recognizer.extractAmendments("")).isEmpty();
        assertThat(recognizer.extractAmendments(null)).isEmpty();
    }

    @Test
    void extractAmendments_truncatesLongDescriptions() {
        DraftAnalysisConfig config = DraftAnalysisConfig.defaults();
        config.setDescriptionMaxLength(20);
        AmendmentRecognizer shortRecognizer = new AmendmentRecognizer(config);

        List<Amendment> amendments = shortRecognizer.extractAmendments(
                "Section 1307 of title 15, United States Code, is repealed.");

        assertThat(amendments.get(0).getDescription()).hasSize(23).endsWith("...");
    }

    @Test
    void classifyAmendmentType_appliesRulesInPriorityOrder() {
        assertThat(recognizer.classifyAmendmentType("by striking \"a\" and inserting \"b\""))
                .contains(AmendmentType.STRIKE_INSERT);
        assertThat(recognizer.classifyAmendmentType("by inserting after section 5 the following new section"))
                .contains(AmendmentType.ADD_NEW_SECTION);
        assertThat(recognizer.classifyAmendmentType("The table of contents for chapter 91 is amended"))
                .contains(AmendmentType.TABLE_OF_CONTENTS);
        assertThat(recognizer.classifyAmendmentType("subsection (e) is repealed")).contains(AmendmentType.REPEAL);
        assertThat(recognizer.classifyAmendmentType("This Act may be cited as")).isEmpty();
    }

    @Test
    void parseTargetReference_prefersUscCitation() {
        assertThat(recognizer.parseTargetReference("Section 1303 of the Act (15 U.S.C. 6502(b)(2))"))
                .contains(new TargetReference("15", "6502", "(b)(2)"));
        assertThat(recognizer.parseTargetReference("Section 552a(b) of title 5"))
                .contains(new TargetReference("5", "552a", "(b)"));
        assertThat(recognizer.parseTargetReference("Title 11 is amended")).contains(new TargetReference("11", "", ""));
        assertThat(recognizer.parseTargetReference("no reference here")).isEmpty();
    }

    @Test
    void annotateBill_fillsEverySection() {
        DraftBill bill = DraftBill.builder()
                .billNumber("H.R. 1234")
                .sections(List.of(
                        DraftSection.builder().number("1").rawText("This Act may be cited as the Test Act.").build(),
                        DraftSection.builder().number("2").rawText(NUMBERED_BLOCK).build()))
                .build();

        recognizer.annotateBill(bill);

        assertThat(bill.getSections().get(0).getAmendments()).isEmpty();
        assertThat(bill.getSections().get(1).getAmendments()).hasSize(3);
        assertThat(bill.getStatistics().getAmendmentCount()).isEqualTo(3);
    }

    @Test
    void amendmentTypeFromString_acceptsLabelOrName() {
        assertThat(AmendmentType.fromString("add_at_end")).isEqualTo(AmendmentType.ADD_AT_END);
        assertThat(AmendmentType.fromString("REPEAL")).isEqualTo(AmendmentType.REPEAL);
        assertThat(AmendmentType.fromString("renumber")).isNull();
        assertThat(AmendmentType.fromString(null)).isNull();
    }
}
