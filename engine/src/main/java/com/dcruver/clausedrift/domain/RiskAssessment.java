package com.dcruver.clausedrift.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskAssessment {
    RiskLevel level;
    int score;             // 0-100
    String explanation;    // never empty
    boolean aiExplained;
}
