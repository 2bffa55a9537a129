package com.lawgraph.draftimpact.service.extract;

import lombok.Value;

/**
 * A cross-reference found in provision text.
 */
@Value
public class ExtractedReference {
    ReferenceKind kind;
    int articleNumber;    // 0 when not numeric
    String text;
}
