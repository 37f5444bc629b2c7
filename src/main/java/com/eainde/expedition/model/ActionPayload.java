package com.eainde.expedition.model;

import com.eainde.expedition.catalog.ActionType;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Canonical execution payload handed to the action execution layer.
 *
 * @param actionId         stable id, {@code <recordId>-<rank>}
 * @param recordId         diagnosis record the action came from
 * @param parameters       catalog-normalized numeric parameters
 * @param attributes       fixed catalog attributes, e.g. the team to notify
 * @param evidence         evidence ids the action cites
 */
public record ActionPayload(
        String actionId,
        String recordId,
        int rank,
        ActionType actionType,
        String operation,
        String platform,
        String targetChannel,
        Map<String, Double> parameters,
        Map<String, String> attributes,
        RiskTier riskTier,
        boolean requiresApproval,
        ImpactRange impact,
        List<String> evidence
) implements Serializable {

    public ActionPayload {
        parameters = Map.copyOf(parameters);
        attributes = Map.copyOf(attributes);
        evidence = List.copyOf(evidence);
    }
}
