package com.lawgraph.draftimpact.dto.report;

import lombok.Value;

@Value
public class RiskAssessment {
    RiskLevel level;
    String justification;
}
