package com.eainde.expedition.catalog;

import com.eainde.expedition.model.ChannelFamily;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only channel lookups: channel to investigation family, and channel prefix to execution platform.
 */
public final class ChannelRoutingTable {

    private final Map<String, ChannelFamily> families;
    private final List<Map.Entry<String, String>> platformPrefixes;

    public ChannelRoutingTable(Map<String, ChannelFamily> families, Map<String, String> platformPrefixes) {
        this.families = families.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue));
        // longest prefix wins
        this.platformPrefixes = platformPrefixes.entrySet().stream()
                .map(e -> Map.entry(normalize(e.getKey()), e.getValue()))
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
                .collect(Collectors.toUnmodifiableList());
    }

    public static ChannelRoutingTable read(ObjectMapper mapper, InputStream json) throws IOException {
        RoutingDocument document = mapper.readValue(json, RoutingDocument.class);
        Map<String, ChannelFamily> families = new LinkedHashMap<>();
        document.families().forEach((family, channels) -> channels.forEach(channel -> families.put(channel, family)));
        return new ChannelRoutingTable(families, document.platforms() == null ? Map.of() : document.platforms());
    }

    public Optional<ChannelFamily> familyOf(String channel) {
        return Optional.ofNullable(families.get(normalize(channel)));
    }

    /** Execution platform for a channel; channels with no matching prefix are their own platform. */
    public String platformOf(String channel) {
        String normalized = normalize(channel);
        return platformPrefixes.stream()
                .filter(e -> normalized.startsWith(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(normalized);
    }

    public int size() {
        return families.size();
    }

    private static String normalize(String channel) {
        return channel == null ? "" : channel.trim().toLowerCase(Locale.ROOT);
    }

    record RoutingDocument(
            @JsonProperty("families") Map<ChannelFamily, List<String>> families,
            @JsonProperty("platforms") Map<String, String> platforms) {
    }
}
