package io.penguin.metrics.agent.probe;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcfsProcessTableTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path proc;

    private ProcfsProcessTable table;

    @BeforeEach
    void setUp() throws IOException {
        table = new ProcfsProcessTable(proc, Clock.fixed(NOW, ZoneOffset.UTC));
        Files.createDirectories(proc.resolve("sys"));
        Files.writeString(proc.resolve("loadavg"), "0.1 0.2 0.3 1/100 4321\n");
    }

    private Path process(long pid, String comm, String cmdline) throws IOException {
        Path dir = Files.createDirectories(proc.resolve(Long.toString(pid)));
        Files.writeString(dir.resolve("comm"), comm + "\n");
        Files.write(dir.resolve("cmdline"), cmdline.replace(' ', '\0').getBytes(StandardCharsets.UTF_8));
        return dir;
    }

    @Test
    @DisplayName("Should list numeric entries sorted by pid")
    void list() throws IOException {
        process(42, "nginx", "nginx: worker process");
        process(7, "sshd", "/usr/sbin/sshd -D");

        List<ProcessInfo> processes = table.list();

        assertEquals(2, processes.size());
        assertEquals(new ProcessInfo(7, "sshd", "/usr/sbin/sshd -D"), processes.get(0));
        assertEquals("nginx", processes.get(1).comm());
    }

    @Test
    @DisplayName("Should parse stat, status, io, smaps_rollup and fd")
    void sample() throws IOException {
        Path dir = process(1234, "my proc", "my proc");
        Files.writeString(dir.resolve("stat"),
                "1234 (my proc) S 1 1234 1234 0 -1 4194560 100 0 0 0 250 50 0 0 20 0 3 0 12345\n");
        Files.writeString(dir.resolve("status"), "Name:\tmy proc\nVmRSS:\t    2048 kB\nThreads:\t3\n");
        Files.writeString(dir.resolve("io"), "rchar: 10\nread_bytes: 4096\nwrite_bytes: 8192\n");
        Files.writeString(dir.resolve("smaps_rollup"),
                "Rss:  2048 kB\nPss:  1024 kB\nPrivate_Clean:  100 kB\nPrivate_Dirty:  400 kB\n");
        Path fd = Files.createDirectories(dir.resolve("fd"));
        Files.createFile(fd.resolve("0"));
        Files.createFile(fd.resolve("1"));

        ProcessSample sample = table.sample(1234, true).orElseThrow();

        assertEquals(3.0, sample.cpuSeconds(), 0.001);
        assertEquals(3, sample.threads());
        assertEquals(2048L * 1024, sample.rssBytes());
        assertEquals(4096L, sample.readBytes());
        assertEquals(8192L, sample.writeBytes());
        assertEquals(1024L * 1024, sample.pssBytes());
        assertEquals(500L * 1024, sample.ussBytes());
        assertEquals(2, sample.openFds());
        assertEquals(NOW, sample.sampledAt());
    }

    @Test
    @DisplayName("Should tolerate unreadable optional files")
    void optionalFiles() throws IOException {
        Path dir = process(99, "init", "/sbin/init");
        Files.writeString(dir.resolve("stat"),
                "99 (init) S 0 99 99 0 -1 0 0 0 0 0 10 10 0 0 20 0 1 0 1\n");

        ProcessSample sample = table.sample(99, false).orElseThrow();

        assertEquals(0, sample.rssBytes());
        assertNull(sample.readBytes());
        assertNull(sample.pssBytes());
        assertNull(sample.openFds());
    }

    @Test
    @DisplayName("Should return empty for a process that exited")
    void exited() throws IOException {
        assertTrue(table.sample(5555, false).isEmpty());
    }
}
