package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.SearchVariant;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class PlatformSearchRegistry {
    private final Map<SearchVariant, PlatformSearchClient> clients;

    public PlatformSearchRegistry(List<PlatformSearchClient> clients) {
        Map<SearchVariant, PlatformSearchClient> byVariant = new LinkedHashMap<>();
        for (PlatformSearchClient client : clients) {
            PlatformSearchClient previous = byVariant.putIfAbsent(client.variant(), client);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate search clients for " + client.variant() + ": "
                        + previous.getClass().getSimpleName() + ", " + client.getClass().getSimpleName()
                );
            }
        }
        this.clients = Collections.unmodifiableMap(byVariant);
    }

    public PlatformSearchClient resolve(SearchVariant variant) {
        PlatformSearchClient client = clients.get(variant);
        if (client == null) {
            throw new PlatformFetchException(FailureKind.FATAL, "no search client registered for " + variant);
        }
        return client;
    }

    public Set<SearchVariant> supportedVariants() {
        return clients.keySet();
    }
}
