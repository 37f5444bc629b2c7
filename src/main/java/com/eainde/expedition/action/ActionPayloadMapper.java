package com.eainde.expedition.action;

import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ActionCatalogEntry;
import com.eainde.expedition.catalog.ChannelRoutingTable;
import com.eainde.expedition.catalog.ParameterSpec;
import com.eainde.expedition.model.ActionPayload;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.ImpactRange;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure mapping of validated candidate actions to execution payloads. The same candidates always give the same
 * payloads, including ids.
 */
@Log4j2
@Component
public class ActionPayloadMapper {

    public List<ActionPayload> toPayloads(String recordId, List<CandidateAction> candidates,
                                          ActionCatalog catalog, ChannelRoutingTable routingTable) {
        return candidates.stream()
                .map(candidate -> toPayload(recordId, candidate, catalog, routingTable))
                .toList();
    }

    ActionPayload toPayload(String recordId, CandidateAction candidate, ActionCatalog catalog,
                            ChannelRoutingTable routingTable) {
        ActionCatalogEntry entry = catalog.require(candidate.actionType());
        return new ActionPayload(
                recordId + "-" + candidate.rank(),
                recordId,
                candidate.rank(),
                candidate.actionType(),
                entry.operation(),
                routingTable.platformOf(candidate.targetChannel()),
                candidate.targetChannel(),
                normalize(candidate, entry),
                entry.attributes(),
                entry.riskTier(),
                entry.riskTier().requiresApproval(),
                ImpactRange.of(candidate.impact().low(), candidate.impact().high()),
                candidate.citations());
    }

    /** Catalog parameters only: proposed values clamped to their bounds, missing ones defaulted. */
    private Map<String, Double> normalize(CandidateAction candidate, ActionCatalogEntry entry) {
        Map<String, Double> parameters = new LinkedHashMap<>();
        new TreeMap<>(entry.parameters()).forEach((name, spec) ->
                parameters.put(name, value(candidate.parameterChange().get(name), spec)));

        candidate.parameterChange().keySet().stream()
                .filter(name -> !entry.parameters().containsKey(name))
                .forEach(name -> log.debug("Dropping parameter '{}' not defined for {}", name, entry.type().id()));
        return parameters;
    }

    private static double value(Double proposed, ParameterSpec spec) {
        return proposed == null ? spec.defaultValue() : spec.clamp(proposed);
    }
}
