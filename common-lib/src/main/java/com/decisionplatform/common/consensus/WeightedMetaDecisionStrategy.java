package com.decisionplatform.common.consensus;

import com.decisionplatform.common.config.ConsensusWeights;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MetaDecision;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.Verdict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Role-weighted {@link ConsensusEngine} with risk veto.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Sort outputs into the static {@link EvaluatorType} order.</li>
 *   <li>Any {@code REJECT} from an evaluator with veto authority ({@link EvaluatorType#RISK})
 *       forces {@code REJECT}, reason {@value #RISK_VETO}.</li>
 *   <li>Each output is weighted by its role: {@code w = weights.weightOf(type.role())}.</li>
 *   <li>{@code approvalScore  = Σ(w × c | APPROVE) / Σw}<br>
 *       {@code rejectionScore = Σ(w × c | REJECT)  / Σw}</li>
 *   <li>APPROVE iff {@code approvalScore ≥ threshold} and {@code approvalScore > rejectionScore};
 *       otherwise REJECT, with {@value #BELOW_THRESHOLD} when the threshold was missed.</li>
 * </ol>
 *
 * <p>{@code finalConfidence} is {@code approvalScore} on approve, otherwise
 * {@code max(rejectionScore, 1 − approvalScore)}. Reasons list {@code "TYPE: reasoning"}
 * for every non-approve output in static order, followed by the decision reason.
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedMetaDecisionStrategy implements ConsensusEngine {

    public static final String RISK_VETO       = "risk_veto";
    public static final String BELOW_THRESHOLD = "below_threshold";
    public static final String REJECTION_DOMINANT = "rejection_dominant";
    public static final String NO_EVALUATORS   = "no_evaluators";

    private final double approvalThreshold;
    private final ConsensusWeights weights;

    public WeightedMetaDecisionStrategy(double approvalThreshold, ConsensusWeights weights) {
        this.approvalThreshold = approvalThreshold;
        this.weights = weights;
    }

    @Override
    public MetaDecision compute(List<EvaluatorOutput> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return new MetaDecision(Verdict.REJECT, 0.0, List.of(NO_EVALUATORS), List.of(), 0.0, 0.0);
        }

        List<EvaluatorOutput> ordered = new ArrayList<>(outputs);
        ordered.sort(Comparator.comparing(EvaluatorOutput::agentType));

        List<EvaluatorType> contributing = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        double totalWeight = 0.0;
        double approveSum  = 0.0;
        double rejectSum   = 0.0;
        boolean vetoed     = false;

        for (EvaluatorOutput out : ordered) {
            double w = weights.weightOf(out.agentType().role());
            contributing.add(out.agentType());
            totalWeight += w;
            if (out.recommendation() == Recommendation.APPROVE) {
                approveSum += w * out.confidence();
            } else {
                if (out.recommendation() == Recommendation.REJECT) {
                    rejectSum += w * out.confidence();
                    if (out.agentType().hasVeto()) {
                        vetoed = true;
                    }
                }
                reasons.add(out.agentType().name() + ": " + out.reasoning());
            }
        }

        double approvalScore  = totalWeight > 0.0 ? approveSum / totalWeight : 0.0;
        double rejectionScore = totalWeight > 0.0 ? rejectSum / totalWeight : 0.0;

        if (vetoed) {
            reasons.add(RISK_VETO);
            return reject(reasons, contributing, approvalScore, rejectionScore);
        }
        if (approvalScore < approvalThreshold) {
            reasons.add(BELOW_THRESHOLD);
            return reject(reasons, contributing, approvalScore, rejectionScore);
        }
        if (approvalScore <= rejectionScore) {
            reasons.add(REJECTION_DOMINANT);
            return reject(reasons, contributing, approvalScore, rejectionScore);
        }
        return new MetaDecision(Verdict.APPROVE, approvalScore, reasons, contributing,
            approvalScore, rejectionScore);
    }

    private static MetaDecision reject(List<String> reasons, List<EvaluatorType> contributing,
                                       double approvalScore, double rejectionScore) {
        double confidence = Math.max(rejectionScore, 1.0 - approvalScore);
        return new MetaDecision(Verdict.REJECT, confidence, reasons, contributing,
            approvalScore, rejectionScore);
    }
}
