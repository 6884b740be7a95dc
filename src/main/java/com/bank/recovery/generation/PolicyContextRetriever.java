package com.bank.recovery.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks a fixed set of policy documents by keyword overlap with the query.
 * Documents are not filtered by account or debtor; every debtor sees the same policies.
 */
@Component
public class PolicyContextRetriever implements ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(PolicyContextRetriever.class);

    private static final List<ReferenceSnippet> DOCUMENTS = List.of(
            new ReferenceSnippet("fdcpa_guidelines", "FDCPA Basic Compliance Rules",
                    "Contact hours: 8 AM to 9 PM in the debtor's timezone. No contact on Sundays or federal holidays. "
                            + "Maximum 3 contact attempts per day. Must identify as debt collector. "
                            + "Cannot use threatening or abusive language. "
                            + "Must provide debt validation notice within 5 days.", 0),
            new ReferenceSnippet("internal_policy", "Payment Plan Guidelines",
                    "Maximum settlement percentage: 70% of outstanding balance. Maximum installment period: 12 months. "
                            + "Minimum payment amount: $25 per installment. Payment plans require written agreement. "
                            + "First payment due within 30 days of agreement. Missed payments may void the agreement.", 0),
            new ReferenceSnippet("escalation_policy", "Human Escalation Guidelines",
                    "Escalate when the debtor requests debt validation, disputes the debt, mentions bankruptcy or an "
                            + "attorney, expresses financial hardship or distress, or asks for a supervisor. "
                            + "Escalate when confidence is below 0.5 or a settlement negotiation is complex.", 0),
            new ReferenceSnippet("verification_policy", "Identity Verification Policy",
                    "Verify with the last 4 digits of the SSN and the last payment amount. "
                            + "Maximum 3 verification attempts. Lock the conversation after failed attempts "
                            + "and require human verification for locked conversations.", 0));

    // Query terms that point at a document even without literal overlap
    private static final Map<String, String> KEYWORD_HINTS = Map.of(
            "plan", "internal_policy",
            "settle", "internal_policy",
            "installment", "internal_policy",
            "dispute", "escalation_policy",
            "lawyer", "escalation_policy",
            "attorney", "escalation_policy",
            "bankruptcy", "escalation_policy",
            "harass", "fdcpa_guidelines",
            "stop", "fdcpa_guidelines",
            "verify", "verification_policy");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "to", "of", "and", "or", "is", "my", "i", "can", "you", "me", "for", "in", "on", "what");

    @Override
    public List<ReferenceSnippet> retrieve(String query, String accountId, String debtorId, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        try {
            Set<String> terms = tokenize(query);
            String lowered = query.toLowerCase(Locale.ROOT);

            return DOCUMENTS.stream()
                    .map(doc -> new ReferenceSnippet(doc.source(), doc.title(), doc.content(), score(doc, terms, lowered)))
                    .filter(doc -> doc.score() > 0)
                    .sorted(Comparator.comparingDouble(ReferenceSnippet::score).reversed())
                    .limit(limit)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Context retrieval failed, continuing without references: {}", e.getMessage());
            return List.of();
        }
    }

    private double score(ReferenceSnippet doc, Set<String> terms, String loweredQuery) {
        Set<String> docTerms = tokenize(doc.title() + " " + doc.content());
        long overlap = terms.stream().filter(docTerms::contains).count();
        double score = terms.isEmpty() ? 0 : (double) overlap / terms.size();
        for (Map.Entry<String, String> hint : KEYWORD_HINTS.entrySet()) {
            if (loweredQuery.contains(hint.getKey()) && hint.getValue().equals(doc.source())) {
                score += 1.0;
            }
        }
        return score;
    }

    private static Set<String> tokenize(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> t.length() > 1 && !STOP_WORDS.contains(t))
                .collect(Collectors.toSet());
    }
}
