package com.lawgraph.draftimpact.dto.finding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FindingLabelsTest {

    @Test
    void severityLabelForRank_whenInAndOutOfRange() {
        assertThat(Severity.labelForRank(0)).isEqualTo("error");
        assertThat(Severity.labelForRank(2)).isEqualTo("info");
        assertThat(Severity.labelForRank(-1)).isEqualTo("unknown");
        assertThat(Severity.labelForRank(Severity.values().length)).isEqualTo("unknown");
    }

    @Test
    void conflictTypeLabelForRank_whenInAndOutOfRange() {
        assertThat(ConflictType.labelForRank(ConflictType.RIGHTS_NARROWING.ordinal())).isEqualTo("rights_narrowing");
        assertThat(ConflictType.labelForRank(-1)).isEqualTo("unknown");
        assertThat(ConflictType.labelForRank(ConflictType.values().length)).isEqualTo("unknown");
    }

    @Test
    void temporalIssueTypeLabelForRank_whenInAndOutOfRange() {
        assertThat(TemporalIssueType.labelForRank(TemporalIssueType.SUNSET.ordinal())).isEqualTo("temporal_sunset");
        assertThat(TemporalIssueType.labelForRank(-1)).isEqualTo("unknown");
        assertThat(TemporalIssueType.labelForRank(TemporalIssueType.values().length)).isEqualTo("unknown");
    }

    @Test
    void conflictLabels_whenTypeAndSeverityPresent() {
        Conflict conflict = Conflict.builder()
                .type(ConflictType.OBLIGATION_CONTRADICTION)
                .severity(Severity.ERROR)
                .description("contradiction")
                .build();

        assertThat(conflict.typeLabel()).isEqualTo("obligation_contradiction");
        assertThat(conflict.severityLabel()).isEqualTo("error");
    }

    @Test
    void findingLabels_whenTypeAndSeverityMissing_areUnknown() {
        Conflict conflict = Conflict.builder().description("incomplete").build();
        TemporalFinding finding = TemporalFinding.builder().description("incomplete").build();

        assertThat(conflict.typeLabel()).isEqualTo("unknown");
        assertThat(conflict.severityLabel()).isEqualTo("unknown");
        assertThat(finding.typeLabel()).isEqualTo("unknown");
        assertThat(finding.severityLabel()).isEqualTo("unknown");
    }
}
