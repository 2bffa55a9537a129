package com.lawgraph.draftimpact.service.extract;

public enum ReferenceKind {
    INTERNAL,   // section of the same document
    EXTERNAL    // another title, act or code
}
