package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.CandidateDecision;
import com.eainde.nsgx.model.DocumentResult;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns the candidates of all document results into catalog proposals.
 *
 * <h3>Steps:</h3>
 * <pre>
 * 1. collect      documents in id order → (category, key) groups, first-seen order;
 *                 candidates the service already decided other than ADD_NEW are left out
 * 2. decide       per group: exact / fuzzy / qualifier → MAP_TO_EXISTING,
 *                 unknown category → IGNORE, else provisional ADD_NEW
 * 3. cluster      provisional ADD_NEW groups per category (greedy, single pass)
 * 4. threshold    cluster with fewer than T distinct documents → IGNORE, else ADD_NEW
 * 5. sort         supporting documents desc, mean confidence desc
 * </pre>
 */
@Log4j2
public class ProposalEngine {

    private static final Comparator<CandidateAggregate> AGGREGATE_ORDER = Comparator
            .comparingInt(CandidateAggregate::supportingDocCount).reversed()
            .thenComparing(Comparator.comparingDouble(CandidateAggregate::meanConfidence).reversed());

    private final CandidateDecisionEngine decisionEngine;
    private final CandidateClusterer clusterer;

    public ProposalEngine(CandidateDecisionEngine decisionEngine, CandidateClusterer clusterer) {
        this.decisionEngine = decisionEngine;
        this.clusterer = clusterer;
    }

    public ProposalReport propose(List<DocumentResult> documents, int minDocCount) {
        List<DocumentResult> ordered = new ArrayList<>(documents);
        ordered.sort(Comparator.comparing(DocumentResult::documentId));

        // ── Step 1: group observations by (category, key) ───────────────
        Map<String, KeyGroup> groups = new LinkedHashMap<>();
        int observations = 0;
        int excluded = 0;
        for (DocumentResult document : ordered) {
            for (Map.Entry<String, List<Candidate>> entry : document.candidatesMerged().entrySet()) {
                String category = entry.getKey();
                for (Candidate candidate : entry.getValue()) {
                    if (!isNewTermCandidate(candidate)) {
                        excluded++;
                        continue;
                    }
                    String key = canonicalKey(candidate);
                    groups.computeIfAbsent(category + ":" + key, k -> new KeyGroup(category, key))
                            .add(candidate, document.documentId());
                    observations++;
                }
            }
        }

        if (excluded > 0) {
            log.debug("Left out {} candidates decided other than ADD_NEW by the service", excluded);
        }

        // ── Step 2: per-group decision ───────────────────────────────────
        List<CandidateAggregate> rows = new ArrayList<>();
        Map<String, List<KeyGroup>> pendingByCategory = new LinkedHashMap<>();
        for (KeyGroup group : groups.values()) {
            Verdict verdict = decisionEngine.decide(group.category(), group.key(), group.representative());
            if (verdict.isProvisionalNew()) {
                pendingByCategory.computeIfAbsent(group.category(), k -> new ArrayList<>()).add(group);
            } else {
                rows.add(aggregate(List.of(group), verdict.decision(), verdict.target(), verdict.reason()));
            }
        }

        // ── Step 3 + 4: cluster and apply the document threshold ─────────
        List<CandidateAggregate> accepted = new ArrayList<>();
        for (List<KeyGroup> pending : pendingByCategory.values()) {
            for (List<KeyGroup> cluster : clusterer.cluster(pending)) {
                int docCount = distinctDocuments(cluster).size();
                String key = cluster.get(0).key();
                if (docCount < minDocCount) {
                    rows.add(aggregate(cluster, CandidateDecision.IGNORE, key,
                            "Insufficient document frequency (" + docCount + " < " + minDocCount + ")"));
                } else {
                    CandidateAggregate added = aggregate(cluster, CandidateDecision.ADD_NEW,
                            canonicalKey(KeyGroup.representativeOf(members(cluster))),
                            "Genuinely new term, appears in " + docCount + " documents");
                    accepted.add(added);
                    rows.add(added);
                }
            }
        }

        // ── Step 5: order ────────────────────────────────────────────────
        accepted.sort(AGGREGATE_ORDER);
        rows.sort(AGGREGATE_ORDER);

        ProposalReport report = new ProposalReport(accepted, rows, observations, ordered.size(), minDocCount);
        log.info("Proposals: {} observations in {} documents → {} key groups, {} ADD_NEW, decisions {}",
                observations, ordered.size(), groups.size(), accepted.size(), report.countByDecision());
        return report;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static CandidateAggregate aggregate(List<KeyGroup> cluster, CandidateDecision decision,
                                                String target, String reason) {
        List<KeyGroup.Observation> members = members(cluster);
        Candidate representative = KeyGroup.representativeOf(members);

        double sum = 0;
        String exampleQuote = "";
        for (KeyGroup.Observation member : members) {
            sum += member.candidate().confidence();
            String quote = member.candidate().quote();
            if (quote != null && !quote.isBlank()
                    && (exampleQuote.isEmpty() || quote.length() < exampleQuote.length())) {
                exampleQuote = quote;
            }
        }

        return new CandidateAggregate(
                cluster.get(0).category(),
                representative.originalText(),
                decision,
                target,
                reason,
                distinctDocuments(cluster).size(),
                exampleQuote,
                sum / members.size(),
                cluster.stream().map(KeyGroup::key).toList(),
                new ArrayList<>(distinctDocuments(cluster)));
    }

    private static List<KeyGroup.Observation> members(List<KeyGroup> cluster) {
        List<KeyGroup.Observation> members = new ArrayList<>();
        cluster.forEach(group -> members.addAll(group.observations()));
        return members;
    }

    private static TreeSet<String> distinctDocuments(List<KeyGroup> cluster) {
        TreeSet<String> documents = new TreeSet<>();
        for (KeyGroup group : cluster) {
            group.observations().forEach(o -> documents.add(o.documentId()));
        }
        return documents;
    }

    /** Undecided candidates count as new. */
    private static boolean isNewTermCandidate(Candidate candidate) {
        return candidate.decision() == null || candidate.decision() == CandidateDecision.ADD_NEW;
    }

    private static String canonicalKey(Candidate candidate) {
        String key = CandidateNormalizer.toSnakeCase(candidate.normalizedKey());
        return key.isEmpty() ? CandidateNormalizer.toSnakeCase(candidate.originalText()) : key;
    }
}
