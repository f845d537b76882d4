package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.config.Identifiers;
import io.penguin.metrics.config.SourceConfigFactory;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;
import io.penguin.metrics.config.model.Config;
import io.penguin.metrics.config.model.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the auto-discovered sources of every enabled type in line with what currently exists.
 * <p>
 * Per pass and type the desired set is every enumerated entry accepted by the filters and not
 * claimed by a manual declaration of the same type. New identities are added, vanished ones
 * removed, and unchanged ones left alone. Manual sources are never touched.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final Config config;
    private final Map<SourceType, NamespaceEnumerator> enumerators = new EnumMap<>(SourceType.class);
    private final CollectorLifecycle lifecycle;
    private final Map<SourceType, Set<String>> active = new EnumMap<>(SourceType.class);

    public Reconciler(Config config, List<NamespaceEnumerator> enumerators, CollectorLifecycle lifecycle) {
        this.config = config;
        this.lifecycle = lifecycle;
        for (NamespaceEnumerator enumerator : enumerators) {
            this.enumerators.put(enumerator.type(), enumerator);
        }
    }

    /**
     * Outcome of one pass.
     *
     * @param added   keys ({@code segment/id}) of sources created in this pass
     * @param removed keys of sources removed in this pass
     * @param failed  types whose enumeration failed and were skipped
     */
    public record Summary(List<String> added, List<String> removed, List<SourceType> failed) {

        public boolean changed() {
            return !added.isEmpty() || !removed.isEmpty();
        }
    }

    public synchronized Summary reconcile() {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<SourceType> failed = new ArrayList<>();
        for (SourceType type : SourceType.values()) {
            AutoDiscoverySettings settings = config.autoDiscovery(type);
            NamespaceEnumerator enumerator = enumerators.get(type);
            if (!type.discoverable() || !settings.enabled() || enumerator == null) {
                continue;
            }
            List<NamespaceEntry> entries;
            try {
                entries = enumerator.enumerate(settings);
            } catch (IOException | RuntimeException e) {
                log.warn("Auto-discovery of {} failed, keeping current sources: {}", type.autoBlockName(), e.getMessage());
                failed.add(type);
                continue;
            }
            reconcileType(type, settings, entries, added, removed);
        }
        Summary summary = new Summary(added, removed, failed);
        if (summary.changed()) {
            log.info("Auto-discovery: {} added {}, {} removed {}", added.size(), added, removed.size(), removed);
        }
        return summary;
    }

    private void reconcileType(SourceType type, AutoDiscoverySettings settings, List<NamespaceEntry> entries,
                               List<String> added, List<String> removed) {
        Map<String, NamespaceEntry> desired = desired(type, settings, entries);
        Set<String> current = active.computeIfAbsent(type, t -> new TreeSet<>());

        for (String id : new ArrayList<>(current)) {
            if (!desired.containsKey(id)) {
                lifecycle.remove(type, id);
                current.remove(id);
                removed.add(type.topicSegment() + "/" + id);
            }
        }
        desired.forEach((id, entry) -> {
            if (current.contains(id)) {
                return;
            }
            SourceConfig source = SourceConfigFactory.discovered(type, entry.name(), entry.target(), settings,
                    config.defaults());
            if (lifecycle.add(source)) {
                current.add(id);
                added.add(type.topicSegment() + "/" + id);
            }
        });
    }

    /**
     * @return accepted and unclaimed entries by identity, first entry wins on a duplicate identity
     */
    Map<String, NamespaceEntry> desired(SourceType type, AutoDiscoverySettings settings,
                                        List<NamespaceEntry> entries) {
        List<SourceConfig> manual = config.sources(type);
        Set<String> claimedIds = new HashSet<>();
        Set<String> claimedTargets = new HashSet<>();
        boolean claimsFirst = false;
        for (SourceConfig source : manual) {
            claimedIds.add(source.id());
            if (source.target() != null) {
                claimedTargets.add(source.target());
            } else if (type == SourceType.BATTERY || type == SourceType.AC_POWER) {
                // a power supply without selector binds to the first supply of its kind
                claimsFirst = true;
            }
        }

        Map<String, NamespaceEntry> desired = new LinkedHashMap<>();
        boolean first = true;
        for (NamespaceEntry entry : entries) {
            boolean claimed = claimedIds.contains(entry.id())
                    || claimedTargets.contains(entry.target())
                    || entry.labels().stream().anyMatch(claimedTargets::contains)
                    || (claimsFirst && first);
            first = false;
            if (claimed || !settings.accepts(entry.labels())) {
                continue;
            }
            desired.putIfAbsent(Identifiers.sanitize(entry.name()), entry);
        }
        return desired;
    }

    /**
     * @return identities of the currently active auto-discovered sources of {@code type}
     */
    public synchronized Set<String> active(SourceType type) {
        return Set.copyOf(active.getOrDefault(type, Set.of()));
    }
}
