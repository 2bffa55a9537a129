package com.lawgraph.draftimpact.service.extract;

import java.util.List;

public interface ReferenceExtractor {

    /**
     * @return references in order of appearance, or an empty list
     */
    List<ExtractedReference> extract(String provisionText);
}
