package com.decisionplatform.analysis.contract;

import com.decisionplatform.common.model.OptionType;

import java.time.LocalDate;

public record ContractSpec(
    OptionType optionType,
    double strike,
    LocalDate expiration,
    double entryPrice,
    double stopLoss,
    double takeProfit
) {}
