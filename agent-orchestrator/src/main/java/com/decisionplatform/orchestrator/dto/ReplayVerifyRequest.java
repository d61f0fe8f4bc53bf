package com.decisionplatform.orchestrator.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ReplayVerifyRequest {

    private long seed      = 42L;
    private int  batchSize = 20;
    private int  runs      = 2;
}
