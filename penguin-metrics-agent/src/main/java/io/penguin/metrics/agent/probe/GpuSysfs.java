package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the primary GPU from the DRM subsystem ({@code class/drm/cardN}) or, on boards without
 * a DRM GPU node, from devfreq ({@code class/devfreq/*gpu*}, {@code *mali*}).
 * <p>
 * DRM sources, first match wins:
 * <ul>
 *   <li>utilization: {@code device/gpu_busy_percent}</li>
 *   <li>frequency: {@code device/hwmon/*}{@code /freq1_input} (Hz), {@code device/gt/gt0/rps_cur_freq_mhz},
 *       {@code gt_cur_freq_mhz}, the starred line of {@code device/pp_dpm_sclk}</li>
 *   <li>temperature: {@code device/hwmon/*}{@code /temp1_input} (millidegrees)</li>
 * </ul>
 */
public class GpuSysfs {

    private static final Pattern CARD = Pattern.compile("card\\d+");
    private static final Pattern DPM_LINE = Pattern.compile("(\\d+)\\s*[Mm][Hh]z\\s*\\*");

    private final Path sysRoot;

    public GpuSysfs(Path sysRoot) {
        this.sysRoot = sysRoot;
    }

    /**
     * @return the first GPU found, empty when the host has none
     */
    public Optional<GpuReading> read() throws IOException {
        List<Path> cards = entries(sysRoot.resolve("class/drm"), name -> CARD.matcher(name).matches());
        if (!cards.isEmpty()) {
            return Optional.of(drm(cards.get(0)));
        }
        List<Path> devfreq = entries(sysRoot.resolve("class/devfreq"), name -> {
            String lower = name.toLowerCase(Locale.ROOT);
            return lower.contains("gpu") || lower.contains("mali");
        });
        if (!devfreq.isEmpty()) {
            return Optional.of(devfreq(devfreq.get(0)));
        }
        return Optional.empty();
    }

    private GpuReading drm(Path card) throws IOException {
        Path device = card.resolve("device");
        Double utilization = toDouble(Sysfs.readLong(device.resolve("gpu_busy_percent")));
        Long frequency = null;
        Double temperature = null;
        for (Path hwmon : entries(device.resolve("hwmon"), name -> name.startsWith("hwmon"))) {
            OptionalLong freq = Sysfs.readLong(hwmon.resolve("freq1_input"));
            if (frequency == null && freq.isPresent()) {
                frequency = freq.getAsLong() / 1_000_000;
            }
            OptionalLong temp = Sysfs.readLong(hwmon.resolve("temp1_input"));
            if (temperature == null && temp.isPresent()) {
                temperature = temp.getAsLong() / 1000.0;
            }
        }
        if (frequency == null) {
            frequency = toLong(Sysfs.readLong(device.resolve("gt/gt0/rps_cur_freq_mhz")));
        }
        if (frequency == null) {
            frequency = toLong(Sysfs.readLong(card.resolve("gt_cur_freq_mhz")));
        }
        if (frequency == null) {
            frequency = Sysfs.read(device.resolve("pp_dpm_sclk")).map(GpuSysfs::currentDpmLevel).orElse(null);
        }
        return new GpuReading(card.getFileName().toString(), utilization, frequency, temperature);
    }

    private static GpuReading devfreq(Path entry) {
        OptionalLong hz = Sysfs.readLong(entry.resolve("cur_freq"));
        Long frequency = hz.isPresent() ? hz.getAsLong() / 1_000_000 : null;
        // "45@800000000Hz": busy percent at the current frequency
        Double utilization = Sysfs.read(entry.resolve("load")).map(text -> {
            int at = text.indexOf('@');
            try {
                return Double.valueOf(at < 0 ? text : text.substring(0, at));
            } catch (NumberFormatException e) {
                return null;
            }
        }).orElse(null);
        return new GpuReading(entry.getFileName().toString(), utilization, frequency, null);
    }

    static Long currentDpmLevel(String table) {
        for (String line : table.split("\n")) {
            Matcher m = DPM_LINE.matcher(line);
            if (m.find()) {
                return Long.parseLong(m.group(1));
            }
        }
        return null;
    }

    private static List<Path> entries(Path dir, Predicate<String> accept) throws IOException {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (accept.test(entry.getFileName().toString())) {
                    result.add(entry);
                }
            }
        }
        result.sort(null);
        return result;
    }

    private static Double toDouble(OptionalLong value) {
        return value.isPresent() ? (double) value.getAsLong() : null;
    }

    private static Long toLong(OptionalLong value) {
        return value.isPresent() ? value.getAsLong() : null;
    }
}
