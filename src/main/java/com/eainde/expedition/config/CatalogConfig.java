package com.eainde.expedition.config;

import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ChannelRoutingTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the process-wide read-only tables once at startup.
 */
@Log4j2
@Configuration
public class CatalogConfig {

    @Bean
    public ActionCatalog actionCatalog(ExpeditionProperties properties, ObjectMapper objectMapper) throws IOException {
        String path = properties.getCatalog().getActionCatalogResource();
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            ActionCatalog catalog = ActionCatalog.read(objectMapper, in);
            log.info("Loaded action catalog {} from {}", catalog.version(), path);
            return catalog;
        }
    }

    @Bean
    public ChannelRoutingTable channelRoutingTable(ExpeditionProperties properties, ObjectMapper objectMapper)
            throws IOException {
        String path = properties.getCatalog().getChannelRoutingResource();
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            ChannelRoutingTable table = ChannelRoutingTable.read(objectMapper, in);
            log.info("Loaded {} channel routes from {}", table.size(), path);
            return table;
        }
    }
}
