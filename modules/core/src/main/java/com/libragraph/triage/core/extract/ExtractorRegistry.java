package com.libragraph.triage.core.extract;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extractors keyed by kind. All {@link ArtifactExtractor} beans are discovered
 * via CDI; two beans claiming the same kind is a deployment error.
 */
@ApplicationScoped
public class ExtractorRegistry {

    private static final Logger log = Logger.getLogger(ExtractorRegistry.class);

    @Inject
    Instance<ArtifactExtractor> extractors;

    private final Map<ExtractorKind, ArtifactExtractor> byKind = new EnumMap<>(ExtractorKind.class);

    public static ExtractorRegistry of(Collection<? extends ArtifactExtractor> extractors) {
        ExtractorRegistry registry = new ExtractorRegistry();
        extractors.forEach(registry::register);
        return registry;
    }

    /** Registry holding the six built-in extractors. */
    public static ExtractorRegistry withDefaults() {
        return of(List.of(new BrowserExtractor(), new RegistryExtractor(), new RecycleBinExtractor(),
                new EventLogExtractor(), new UserActivityExtractor(), new FileSystemExtractor()));
    }

    @PostConstruct
    void init() {
        for (ArtifactExtractor extractor : extractors) {
            register(extractor);
        }
        log.infof("Registered %d extractor(s): %s", byKind.size(), byKind.keySet());
    }

    private void register(ArtifactExtractor extractor) {
        ArtifactExtractor previous = byKind.putIfAbsent(extractor.kind(), extractor);
        if (previous != null) {
            throw new IllegalStateException("Duplicate extractor for " + extractor.kind() + ": "
                    + previous.getClass().getName() + " and " + extractor.getClass().getName());
        }
    }

    public Optional<ArtifactExtractor> lookup(ExtractorKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    /** Registered extractors in {@link ExtractorKind} order. */
    public List<ArtifactExtractor> all() {
        return new ArrayList<>(byKind.values());
    }
}
