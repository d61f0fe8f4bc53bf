package com.decisionplatform.analysis.contract;

import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;

/**
 * Strike/expiration selection and entry pricing for an approved signal. Shared by both
 * engines so A and B recommendations differ only in the decision, not in the contract.
 */
public interface ContractSelector {

    ContractSpec select(Signal signal, MarketContext context);
}
