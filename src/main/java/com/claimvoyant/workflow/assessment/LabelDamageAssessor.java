package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.DamageAssessment;
import com.claimvoyant.model.claim.DamageSeverity;
import com.claimvoyant.model.claim.DetectedLabel;
import com.claimvoyant.model.claim.ExtractedData;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic assessment from image labels.
 *
 * Damage is assumed when any label is one of {@link #DAMAGE_LABELS}; the result
 * then carries a fixed MODERATE estimate. No computer vision model is involved.
 */
@Component
public class LabelDamageAssessor implements DamageAssessor {

    static final Set<String> DAMAGE_LABELS = Set.of("car", "vehicle", "damage", "accident", "crash");

    static final double ESTIMATED_REPAIR_COST = 2500.0;
    static final double CONFIDENCE = 0.75;

    @Override
    public DamageAssessment assess(ExtractedData extractedData) {
        List<DetectedLabel> labels = extractedData.getLabels() != null ? extractedData.getLabels() : List.of();
        boolean detected = labels.stream()
                .map(DetectedLabel::name)
                .filter(name -> name != null)
                .anyMatch(name -> DAMAGE_LABELS.contains(name.toLowerCase(Locale.ROOT)));

        if (!detected) {
            return DamageAssessment.builder()
                    .damageDetected(false)
                    .severity(DamageSeverity.NONE)
                    .estimatedRepairCost(0.0)
                    .damageLocations(List.of())
                    .confidence(CONFIDENCE)
                    .build();
        }
        return DamageAssessment.builder()
                .damageDetected(true)
                .severity(DamageSeverity.MODERATE)
                .estimatedRepairCost(ESTIMATED_REPAIR_COST)
                .damageLocations(List.of("Front bumper", "Hood"))
                .confidence(CONFIDENCE)
                .build();
    }
}
