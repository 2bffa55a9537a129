package com.lawgraph.draftimpact.service.extract;

import java.util.List;

public interface SemanticExtractor {

    /**
     * @return annotations in order of detection, or an empty list
     */
    List<SemanticAnnotation> extract(String provisionText);
}
