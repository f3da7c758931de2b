package com.osman.picking.core.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Outcome counters of one pipeline run, written next to the document as {@code report.json}.
 *
 * @param rowsProcessed    rows that reached the document
 * @param rowsExcluded     rows left out because their item code did not resolve
 * @param codeFailures     rows printed without a code image
 * @param backendUsed      name of the backend that produced the document
 * @param pages            pages in the document
 * @param codeArtifacts    distinct code images written
 * @param unresolved       excluded rows in shipment order
 * @param encodingFailures item codes that could not be encoded
 * @param renderAttempts   one line per backend tried, in priority order
 */
public record RunReport(int rowsProcessed,
                        int rowsExcluded,
                        int codeFailures,
                        String backendUsed,
                        int pages,
                        int codeArtifacts,
                        List<UnresolvedReference> unresolved,
                        List<EncodingFailure> encodingFailures,
                        List<String> renderAttempts) {

    public static final String DEFAULT_FILENAME = "report.json";

    public RunReport {
        unresolved = List.copyOf(unresolved);
        encodingFailures = List.copyOf(encodingFailures);
        renderAttempts = List.copyOf(renderAttempts);
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("rowsProcessed", rowsProcessed);
        root.put("rowsExcluded", rowsExcluded);
        root.put("codeFailures", codeFailures);
        root.put("backendUsed", backendUsed == null ? JSONObject.NULL : backendUsed);
        root.put("pages", pages);
        root.put("codeArtifacts", codeArtifacts);

        JSONArray unresolvedArray = new JSONArray();
        for (UnresolvedReference reference : unresolved) {
            unresolvedArray.put(new JSONObject()
                .put("row", reference.sourceRow())
                .put("no", reference.displayNumber())
                .put("itemCode", reference.itemCode())
                .put("reason", reference.reason().name()));
        }
        root.put("unresolved", unresolvedArray);

        JSONArray encodingArray = new JSONArray();
        for (EncodingFailure failure : encodingFailures) {
            encodingArray.put(new JSONObject()
                .put("itemCode", failure.itemCode())
                .put("message", failure.message()));
        }
        root.put("encodingFailures", encodingArray);
        root.put("renderAttempts", new JSONArray(renderAttempts));
        return root;
    }

    public String summary() {
        return "%d processed / %d excluded, %d code failures, %d pages, backend %s"
            .formatted(rowsProcessed, rowsExcluded, codeFailures, pages, backendUsed);
    }
}
