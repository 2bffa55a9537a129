package com.lawgraph.draftimpact.dto.overlay;

import com.lawgraph.draftimpact.dto.draft.Amendment;
import lombok.Value;

@Value
public class SkippedAmendment {
    Amendment amendment;
    String reason;
}
