package com.lawgraph.draftimpact.dto.draft;

import lombok.Value;

/**
 * Title/section/subsection a block of amending text applies to.
 * The section is empty when only a title could be found ("... et seq.").
 */
@Value
public class TargetReference {
    String title;
    String section;
    String subsection;

    public TargetReference withSubsection(String newSubsection) {
        return new TargetReference(title, section, newSubsection);
    }
}
