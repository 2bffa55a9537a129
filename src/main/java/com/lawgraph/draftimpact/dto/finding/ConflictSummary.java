package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictSummary {

    @JsonProperty("total_conflicts")
    private int totalConflicts;

    private int errors;
    private int warnings;
    private int infos;

    @JsonProperty("by_type")
    @Builder.Default
    private Map<ConflictType, Integer> byType = new EnumMap<>(ConflictType.class);

    public static ConflictSummary of(List<Conflict> conflicts) {
        ConflictSummary summary = ConflictSummary.builder()
                .totalConflicts(conflicts.size())
                .build();

        for (Conflict conflict : conflicts) {
            switch (conflict.getSeverity()) {
                case ERROR -> summary.errors++;
                case WARNING -> summary.warnings++;
                case INFO -> summary.infos++;
            }
            summary.byType.merge(conflict.getType(), 1, Integer::sum);
        }
        return summary;
    }
}
