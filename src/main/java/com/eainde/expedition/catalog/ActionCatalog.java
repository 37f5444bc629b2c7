package com.eainde.expedition.catalog;

import com.eainde.expedition.model.ChannelFamily;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Versioned, read-only catalog of permissible actions. Loaded once at startup and shared by every run.
 */
public final class ActionCatalog {

    private final String version;
    private final Map<ActionType, ActionCatalogEntry> entries;

    public ActionCatalog(String version, List<ActionCatalogEntry> entries) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Action catalog needs a version");
        }
        Map<ActionType, ActionCatalogEntry> byType = new EnumMap<>(ActionType.class);
        for (ActionCatalogEntry entry : entries) {
            if (byType.put(entry.type(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + entry.type().id());
            }
            if (entry.families().isEmpty()) {
                throw new IllegalArgumentException("Catalog entry " + entry.type().id() + " has no channel family");
            }
        }
        this.version = version;
        this.entries = Collections.unmodifiableMap(byType);
    }

    public static ActionCatalog read(ObjectMapper mapper, InputStream json) throws IOException {
        CatalogDocument document = mapper.readValue(json, CatalogDocument.class);
        return new ActionCatalog(document.version(), document.actions());
    }

    public String version() {
        return version;
    }

    public Optional<ActionCatalogEntry> entry(ActionType type) {
        return Optional.ofNullable(entries.get(type));
    }

    public ActionCatalogEntry require(ActionType type) {
        return entry(type).orElseThrow(() ->
                new IllegalArgumentException("Action " + type.id() + " is not in catalog " + version));
    }

    public boolean isPermitted(ActionType type, ChannelFamily family) {
        ActionCatalogEntry entry = entries.get(type);
        return entry != null && entry.allows(family);
    }

    /** Permitted types for a family, in declaration order of {@link ActionType}. */
    public List<ActionType> permittedFor(ChannelFamily family) {
        return entries.values().stream()
                .filter(entry -> entry.allows(family))
                .map(ActionCatalogEntry::type)
                .collect(Collectors.toUnmodifiableList());
    }

    record CatalogDocument(
            @JsonProperty("version") String version,
            @JsonProperty("actions") List<ActionCatalogEntry> actions) {
    }
}
