package com.decisionplatform.analysis.engine;

import com.decisionplatform.analysis.contract.ContractSelector;
import com.decisionplatform.analysis.rules.Confluence;
import com.decisionplatform.analysis.rules.EntryAction;
import com.decisionplatform.analysis.rules.EntryDecision;
import com.decisionplatform.analysis.rules.EntryRule;
import com.decisionplatform.analysis.rules.RuleResult;
import com.decisionplatform.analysis.rules.Tier1HardBlockRules;
import com.decisionplatform.analysis.rules.Tier2DelayRules;
import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.TradeRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Engine A: ordered, short-circuiting rule tiers.
 *
 * <h3>Tiers</h3>
 * <ol>
 *   <li>Tier 1 (hard block) — any trigger → {@link EntryAction#BLOCK}</li>
 *   <li>Tier 2 (delay)      — any trigger → {@link EntryAction#WAIT}</li>
 *   <li>Tier 3 (approval)   — otherwise {@link EntryAction#APPROVE} with
 *       {@code confidence = mean(bias effective confidence, confluence ratio)}</li>
 * </ol>
 * All rules of a tier run in their fixed order so the rationale lists every trigger of the
 * deciding tier; lower tiers are never evaluated once a higher tier decides.
 */
public class RuleBasedDecisionEngine implements DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDecisionEngine.class);

    public static final String ENTRY_APPROVED = "ENTRY_APPROVED";

    private final List<EntryRule> tier1;
    private final List<EntryRule> tier2;
    private final ContractSelector contractSelector;
    private final AuditSink auditSink;

    public RuleBasedDecisionEngine(double minConfidence, ContractSelector contractSelector, AuditSink auditSink) {
        this.tier1 = Tier1HardBlockRules.rules(minConfidence);
        this.tier2 = Tier2DelayRules.rules();
        this.contractSelector = contractSelector;
        this.auditSink = auditSink;
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.A;
    }

    @Override
    public Mono<EngineResult> evaluate(DecisionInput input) {
        return Mono.fromCallable(() -> evaluateNow(input));
    }

    EngineResult evaluateNow(DecisionInput input) {
        EntryDecision decision = decide(input);
        auditSink.record(AuditStage.ENGINE_A, input.signal().signalId(), decision);
        log.info("[EngineA] signalId={} action={} tier={} rules={}",
            input.signal().signalId(), decision.action(), decision.tier(), decision.triggeredRules());

        if (decision.action() != EntryAction.APPROVE) {
            return new EngineResult(EngineVariant.A, false, decision.confidence(), decision.rationale(),
                decision, null, null);
        }
        TradeRecommendation rec = Recommendations.build(EngineVariant.A, input.signal(),
            contractSelector.select(input.signal(), input.context()));
        return new EngineResult(EngineVariant.A, true, decision.confidence(), decision.rationale(),
            decision, null, rec);
    }

    /** Pure tier evaluation; no audit, no contract selection. */
    public EntryDecision decide(DecisionInput input) {
        List<RuleResult> blocks = triggered(tier1, input);
        if (!blocks.isEmpty()) {
            return new EntryDecision(EntryAction.BLOCK, 1, 0.0,
                blocks.stream().map(RuleResult::rule).toList(),
                blocks.stream().map(RuleResult::message).toList());
        }
        List<RuleResult> delays = triggered(tier2, input);
        if (!delays.isEmpty()) {
            return new EntryDecision(EntryAction.WAIT, 2, 0.0,
                delays.stream().map(RuleResult::rule).toList(),
                delays.stream().map(RuleResult::message).toList());
        }
        int confluence = Confluence.count(input);
        double biasConfidence = input.bias().effectiveConfidence();
        double confidence = Math.max(0.0, Math.min(1.0,
            (biasConfidence + (double) confluence / Confluence.FACTORS) / 2.0));
        String rationale = String.format(Locale.ROOT, "bias confidence %.2f, confluence %d/%d",
            biasConfidence, confluence, Confluence.FACTORS);
        return new EntryDecision(EntryAction.APPROVE, 3, confidence, List.of(ENTRY_APPROVED), List.of(rationale));
    }

    private static List<RuleResult> triggered(List<EntryRule> rules, DecisionInput input) {
        List<RuleResult> results = new ArrayList<>();
        for (EntryRule rule : rules) {
            Optional<RuleResult> result = rule.evaluate(input);
            result.ifPresent(results::add);
        }
        return results;
    }
}
