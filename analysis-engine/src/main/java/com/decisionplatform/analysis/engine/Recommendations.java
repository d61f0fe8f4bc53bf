package com.decisionplatform.analysis.engine;

import com.decisionplatform.analysis.contract.ContractSpec;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.ExitProfile;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.TradeRecommendation;

final class Recommendations {

    /** Placeholder quantity; the gamma sizer sets the final size. */
    static final int UNSIZED = 1;

    private Recommendations() {}

    static TradeRecommendation build(EngineVariant engine, Signal signal, ContractSpec contract) {
        return new TradeRecommendation(
            signal.experimentKey(),
            signal.signalId(),
            engine,
            signal.symbol(),
            signal.direction(),
            contract.optionType(),
            contract.strike(),
            contract.expiration(),
            UNSIZED,
            contract.entryPrice(),
            contract.stopLoss(),
            contract.takeProfit(),
            false,
            ExitProfile.MEAN_REVERT);
    }
}
