package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the configured provider chain ({@code gateway.provider.chain}) to provider beans.
 * The first provider is the primary, the others are tried in order as fallbacks.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final List<TranslationProvider> chain;

    public ProviderRegistry(List<TranslationProvider> providers, GatewayProperties properties) {
        Map<String, TranslationProvider> byId = new LinkedHashMap<>();
        for (TranslationProvider provider : providers) {
            if (byId.putIfAbsent(provider.id(), provider) != null) {
                throw new IllegalStateException("Duplicate translation provider id: " + provider.id());
            }
        }

        List<TranslationProvider> resolved = new ArrayList<>();
        for (String id : properties.getProvider().getChain()) {
            TranslationProvider provider = byId.get(id);
            if (provider == null) {
                throw new IllegalStateException("Unknown translation provider '" + id + "', available: " + byId.keySet());
            }
            if (resolved.contains(provider)) {
                throw new IllegalStateException("Translation provider listed twice in chain: " + id);
            }
            resolved.add(provider);
        }
        if (resolved.isEmpty()) {
            throw new IllegalStateException("gateway.provider.chain must name at least one provider");
        }
        this.chain = List.copyOf(resolved);
        log.info("Translation provider chain - primary: {}, fallbacks: {}",
                chain.get(0).id(),
                chain.subList(1, chain.size()).stream().map(TranslationProvider::id).toList());
    }

    /**
     * Providers in the order they are tried.
     */
    public List<TranslationProvider> chain() {
        return chain;
    }
}
