package com.lawgraph.draftimpact.service.extract;

public enum SemanticKind {
    RIGHT,
    OBLIGATION,
    PROHIBITION
}
