package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link ProcessTable} backed by {@code /proc}.
 */
public class ProcfsProcessTable implements ProcessTable {

    static final double CLOCK_TICKS = 100.0;
    private static final long KIB = 1024;

    private final Path procRoot;
    private final Clock clock;

    public ProcfsProcessTable(Path procRoot) {
        this(procRoot, Clock.systemUTC());
    }

    public ProcfsProcessTable(Path procRoot, Clock clock) {
        this.procRoot = procRoot;
        this.clock = clock;
    }

    @Override
    public List<ProcessInfo> list() throws IOException {
        List<ProcessInfo> processes = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(procRoot, p -> isNumeric(p.getFileName().toString()))) {
            for (Path dir : dirs) {
                long pid = Long.parseLong(dir.getFileName().toString());
                Optional<String> comm = Sysfs.read(dir.resolve("comm"));
                if (comm.isEmpty()) {
                    continue;
                }
                processes.add(new ProcessInfo(pid, comm.get(), cmdline(dir)));
            }
        }
        processes.sort(Comparator.comparingLong(ProcessInfo::pid));
        return processes;
    }

    @Override
    public Optional<ProcessSample> sample(long pid, boolean smaps) throws IOException {
        Path dir = procRoot.resolve(Long.toString(pid));
        String stat;
        try {
            stat = Files.readString(dir.resolve("stat"), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        // fields after the parenthesised comm, which may itself contain spaces
        String[] fields = stat.substring(stat.lastIndexOf(')') + 2).trim().split("\\s+");
        double cpuSeconds = (Long.parseLong(fields[11]) + Long.parseLong(fields[12])) / CLOCK_TICKS;
        int threads = Integer.parseInt(fields[17]);

        long rss = 0;
        for (String line : lines(dir.resolve("status"))) {
            if (line.startsWith("VmRSS:")) {
                rss = kib(line) * KIB;
            }
        }

        Long read = null;
        Long write = null;
        for (String line : lines(dir.resolve("io"))) {
            if (line.startsWith("read_bytes:")) {
                read = Long.parseLong(line.substring(line.indexOf(':') + 1).trim());
            } else if (line.startsWith("write_bytes:")) {
                write = Long.parseLong(line.substring(line.indexOf(':') + 1).trim());
            }
        }

        Long pss = null;
        Long uss = null;
        if (smaps) {
            long privateBytes = 0;
            for (String line : lines(dir.resolve("smaps_rollup"))) {
                if (line.startsWith("Pss:")) {
                    pss = kib(line) * KIB;
                } else if (line.startsWith("Private_Clean:") || line.startsWith("Private_Dirty:")) {
                    privateBytes += kib(line) * KIB;
                    uss = privateBytes;
                }
            }
        }

        return Optional.of(new ProcessSample(pid, cpuSeconds, rss, threads, countFds(dir), read, write, pss, uss,
                clock.instant()));
    }

    private static Integer countFds(Path dir) {
        try (Stream<Path> fds = Files.list(dir.resolve("fd"))) {
            return (int) fds.count();
        } catch (IOException e) {
            return null;
        }
    }

    private static String cmdline(Path dir) {
        try {
            byte[] raw = Files.readAllBytes(dir.resolve("cmdline"));
            return new String(raw, StandardCharsets.UTF_8).replace('\0', ' ').trim();
        } catch (IOException e) {
            return "";
        }
    }

    private static List<String> lines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return List.of();
        }
    }

    private static long kib(String line) {
        String[] parts = line.substring(line.indexOf(':') + 1).trim().split("\\s+");
        return Long.parseLong(parts[0]);
    }

    private static boolean isNumeric(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
