package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.config.ConfigLoader;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;
import io.penguin.metrics.config.model.Config;
import io.penguin.metrics.config.model.SourceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {

    /** Returns whatever the test sets, or throws when {@code failure} is set. */
    static class StubEnumerator implements NamespaceEnumerator {
        private final SourceType type;
        List<NamespaceEntry> entries = List.of();
        IOException failure;

        StubEnumerator(SourceType type) {
            this.type = type;
        }

        @Override
        public SourceType type() {
            return type;
        }

        @Override
        public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
            if (failure != null) {
                throw failure;
            }
            return entries;
        }
    }

    static class RecordingLifecycle implements CollectorLifecycle {
        final List<SourceConfig> added = new ArrayList<>();
        final List<String> removed = new ArrayList<>();
        final Set<String> rejected = new HashSet<>();

        @Override
        public boolean add(SourceConfig source) {
            if (rejected.contains(source.id())) {
                return false;
            }
            added.add(source);
            return true;
        }

        @Override
        public void remove(SourceType type, String id) {
            removed.add(type.topicSegment() + "/" + id);
        }
    }

    private static NamespaceEntry supply(String name) {
        return new NamespaceEntry(name, name, List.of(name));
    }

    private static Config config(String text) throws Exception {
        return ConfigLoader.loadString(text).config();
    }

    @Test
    @DisplayName("Should add new entries, remove vanished ones and leave the rest alone")
    void converges() throws Exception {
        StubEnumerator batteries = new StubEnumerator(SourceType.BATTERY);
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        Reconciler reconciler = new Reconciler(config("batteries { auto on; }"), List.of(batteries), lifecycle);

        batteries.entries = List.of(supply("BAT0"), supply("BAT1"));
        Reconciler.Summary first = reconciler.reconcile();
        assertEquals(List.of("battery/bat0", "battery/bat1"), first.added());
        assertEquals("BAT1", lifecycle.added.get(1).target());

        batteries.entries = List.of(supply("BAT0"), supply("BAT2"));
        Reconciler.Summary second = reconciler.reconcile();
        assertEquals(List.of("battery/bat2"), second.added());
        assertEquals(List.of("battery/bat1"), second.removed());
        assertEquals(Set.of("bat0", "bat2"), reconciler.active(SourceType.BATTERY));

        Reconciler.Summary third = reconciler.reconcile();
        assertFalse(third.changed());
        assertEquals(3, lifecycle.added.size());
    }

    @Test
    @DisplayName("Should let a manual battery without selector claim the first battery")
    void manualClaimsFirstBattery() throws Exception {
        StubEnumerator batteries = new StubEnumerator(SourceType.BATTERY);
        batteries.entries = List.of(supply("BAT0"), supply("BAT1"));
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        Reconciler reconciler = new Reconciler(config("""
                battery "main" { }
                batteries { auto on; }
                """), List.of(batteries), lifecycle);

        reconciler.reconcile();

        assertEquals(List.of("bat1"), lifecycle.added.stream().map(SourceConfig::id).toList());
    }

    @Test
    @DisplayName("Should skip entries claimed by a manual target or excluded by filters")
    void claimsAndFilters() throws Exception {
        StubEnumerator services = new StubEnumerator(SourceType.SERVICE);
        services.entries = List.of(
                new NamespaceEntry("docker", "docker.service", List.of("docker.service", "docker")),
                new NamespaceEntry("docker-gc", "docker-gc.service", List.of("docker-gc.service", "docker-gc")),
                new NamespaceEntry("sshd", "sshd.service", List.of("sshd.service", "sshd")),
                new NamespaceEntry("cron", "cron.service", List.of("cron.service", "cron")));
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        Reconciler reconciler = new Reconciler(config("""
                service "Docker Engine" { match unit "docker.service"; }
                services { auto on; filter "docker*" "ssh*"; exclude "docker-gc*"; }
                """), List.of(services), lifecycle);

        reconciler.reconcile();

        assertEquals(List.of("sshd"), lifecycle.added.stream().map(SourceConfig::id).toList());
    }

    @Test
    @DisplayName("Should keep current sources when enumeration fails")
    void enumerationFailure() throws Exception {
        StubEnumerator batteries = new StubEnumerator(SourceType.BATTERY);
        StubEnumerator acPowers = new StubEnumerator(SourceType.AC_POWER);
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        Reconciler reconciler = new Reconciler(config("""
                batteries { auto on; }
                ac_powers { auto on; }
                """), List.of(batteries, acPowers), lifecycle);
        batteries.entries = List.of(supply("BAT0"));
        reconciler.reconcile();

        batteries.failure = new IOException("sysfs unavailable");
        acPowers.entries = List.of(supply("AC"));
        Reconciler.Summary summary = reconciler.reconcile();

        assertEquals(List.of(SourceType.BATTERY), summary.failed());
        assertTrue(lifecycle.removed.isEmpty());
        assertEquals(Set.of("bat0"), reconciler.active(SourceType.BATTERY));
        assertEquals(List.of("ac_power/ac"), summary.added());
    }

    @Test
    @DisplayName("Should retry an entry whose collector could not be started")
    void rejectedAddIsRetried() throws Exception {
        StubEnumerator batteries = new StubEnumerator(SourceType.BATTERY);
        batteries.entries = List.of(supply("BAT0"));
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        lifecycle.rejected.add("bat0");
        Reconciler reconciler = new Reconciler(config("batteries { auto on; }"), List.of(batteries), lifecycle);

        assertFalse(reconciler.reconcile().changed());
        assertTrue(reconciler.active(SourceType.BATTERY).isEmpty());

        lifecycle.rejected.clear();
        assertEquals(List.of("battery/bat0"), reconciler.reconcile().added());
    }

    @Test
    @DisplayName("Should ignore types whose auto-discovery is disabled")
    void disabledType() throws Exception {
        StubEnumerator batteries = new StubEnumerator(SourceType.BATTERY);
        batteries.entries = List.of(supply("BAT0"));
        RecordingLifecycle lifecycle = new RecordingLifecycle();
        Reconciler reconciler = new Reconciler(config(""), List.of(batteries), lifecycle);

        reconciler.reconcile();

        assertTrue(lifecycle.added.isEmpty());
    }
}
