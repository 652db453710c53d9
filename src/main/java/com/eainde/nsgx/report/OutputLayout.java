package com.eainde.nsgx.report;

import java.nio.file.Path;

/**
 * File layout of a run's output directory.
 *
 * <pre>
 * out/
 *   unit_results/{doc}/{unit}.json
 *   docs/{doc}.json
 *   proposals.jsonl
 *   review/candidates_review.csv
 *   dbml_patches/enum_additions.dbml
 *   CHANGELOG.md
 *   MODEL_UPDATE_PROPOSAL.md
 *   run_summary.json, merge_summary.json, propose_summary.json
 * </pre>
 */
public record OutputLayout(Path root) {

    public Path unitResult(String documentId, String unitId) {
        return root.resolve("unit_results").resolve(safe(documentId)).resolve(safe(unitId) + ".json");
    }

    public Path documentsDir() {
        return root.resolve("docs");
    }

    public Path documentResult(String documentId) {
        return documentsDir().resolve(safe(documentId) + ".json");
    }

    public Path proposals() {
        return root.resolve("proposals.jsonl");
    }

    public Path reviewCsv() {
        return root.resolve("review").resolve("candidates_review.csv");
    }

    public Path dbmlPatch() {
        return root.resolve("dbml_patches").resolve("enum_additions.dbml");
    }

    public Path changelog() {
        return root.resolve("CHANGELOG.md");
    }

    public Path modelUpdateProposal() {
        return root.resolve("MODEL_UPDATE_PROPOSAL.md");
    }

    public Path summary(String name) {
        return root.resolve(name + "_summary.json");
    }

    private static String safe(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
