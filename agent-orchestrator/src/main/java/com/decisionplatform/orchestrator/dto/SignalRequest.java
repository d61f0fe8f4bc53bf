package com.decisionplatform.orchestrator.dto;

import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.Signal;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbound signal payload. Intake stamps a missing id and timestamp; from then on the
 * {@link Signal} is immutable and its timestamp is the only clock the pipeline reads.
 */
@Data
@NoArgsConstructor
public class SignalRequest {

    private String  signalId;
    private String  symbol;
    private String  direction;
    private String  timeframe;
    private Instant timestamp;
    private String  experimentId;

    public boolean isValid() {
        return symbol != null && !symbol.isBlank() && direction != null;
    }

    public Signal toSignal() {
        return Signal.of(
            signalId != null && !signalId.isBlank() ? signalId : UUID.randomUUID().toString(),
            symbol,
            Direction.fromValue(direction),
            timeframe,
            timestamp != null ? timestamp : Instant.now(),
            experimentId);
    }
}
