package com.decisionledger.merge;

import com.decisionledger.evidence.EvidenceBundle;

/**
 * Decision plus the evidence gathered while producing it.
 */
public record MergedEvaluation(PolicyDecision decision, EvidenceBundle evidence) {
}
