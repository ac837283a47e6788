package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.ClaimEntities;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based entity extraction over claim text.
 *
 * <p>Recognised forms:
 * <ul>
 *   <li>policy number: {@code AUTO-123}, {@code POL-123456}, or a labelled {@code Policy: XYZ-9}
 *       (the label is dropped)</li>
 *   <li>incident date: {@code 2025-10-22} or {@code 10/22/2025}</li>
 * </ul>
 * Only the first match of each pattern is used. Missing entities stay null.
 */
@Component
public class ClaimEntityExtractor {

    private static final Pattern POLICY_NUMBER =
            Pattern.compile("(AUTO-\\d+|POL-\\d+|POLICY[:\\s]+(\\w+-?\\d+))", Pattern.CASE_INSENSITIVE);

    private static final Pattern INCIDENT_DATE =
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4})");

    public ClaimEntities extract(String text) {
        if (text == null || text.isBlank()) {
            return ClaimEntities.empty();
        }
        return ClaimEntities.builder()
                .policyNumber(findPolicyNumber(text))
                .incidentDate(findFirst(INCIDENT_DATE, text))
                .build();
    }

    private static String findPolicyNumber(String text) {
        Matcher matcher = POLICY_NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String labelled = matcher.group(2);
        return labelled != null ? labelled : matcher.group(1);
    }

    private static String findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }
}
