package com.lawgraph.draftimpact.service.extract;

import lombok.Builder;
import lombok.Value;

/**
 * A right, obligation or prohibition recognized in provision text.
 * Rights carry {@link #rightType}; obligations and prohibitions carry {@link #obligationType}.
 */
@Value
@Builder
public class SemanticAnnotation {
    SemanticKind kind;
    String rightType;
    String obligationType;
    String matchedText;
}
