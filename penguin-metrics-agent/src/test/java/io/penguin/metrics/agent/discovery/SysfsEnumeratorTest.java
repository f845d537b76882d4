package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.config.ConfigLoader;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SysfsEnumeratorTest {

    @TempDir
    Path root;

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content + "\n");
    }

    private static AutoDiscoverySettings auto(String text, SourceType type) throws Exception {
        return ConfigLoader.loadString(text).config().autoDiscovery(type);
    }

    @Test
    @DisplayName("Should list power supplies of the requested kind in name order")
    void powerSupplies() throws Exception {
        Path supplies = root.resolve("class/power_supply");
        write(supplies.resolve("BAT1/type"), "Battery");
        write(supplies.resolve("BAT0/type"), "Battery");
        write(supplies.resolve("AC/type"), "Mains");
        write(supplies.resolve("hidpp_battery_0/type"), "Battery");
        AutoDiscoverySettings settings = auto("batteries { auto on; }", SourceType.BATTERY);

        List<NamespaceEntry> batteries = PowerSupplyEnumerator.batteries(supplies).enumerate(settings);
        List<NamespaceEntry> mains = PowerSupplyEnumerator.acPowers(supplies).enumerate(settings);

        assertEquals(List.of("BAT0", "BAT1", "hidpp_battery_0"), batteries.stream().map(NamespaceEntry::name).toList());
        assertEquals(List.of("AC"), mains.stream().map(NamespaceEntry::target).toList());
        assertTrue(PowerSupplyEnumerator.batteries(root.resolve("absent")).enumerate(settings).isEmpty());
    }

    @Test
    @DisplayName("Should name thermal zones by type and disambiguate duplicates")
    void thermalZones() throws Exception {
        Path thermal = root.resolve("class/thermal");
        write(thermal.resolve("thermal_zone0/type"), "acpitz");
        write(thermal.resolve("thermal_zone1/type"), "x86_pkg_temp");
        write(thermal.resolve("thermal_zone2/type"), "acpitz");
        write(thermal.resolve("cooling_device0/type"), "Processor");

        List<NamespaceEntry> entries = new TemperatureEnumerator(thermal, root.resolve("class/hwmon"))
                .enumerate(auto("temperatures { auto on; }", SourceType.TEMPERATURE));

        assertEquals(List.of("acpitz", "x86_pkg_temp", "acpitz_2"), entries.stream().map(NamespaceEntry::name).toList());
        assertEquals("thermal_zone2", entries.get(2).target());
    }

    @Test
    @DisplayName("Should name hwmon inputs by chip and label")
    void hwmon() throws Exception {
        Path hwmon = root.resolve("class/hwmon");
        write(hwmon.resolve("hwmon1/name"), "coretemp");
        write(hwmon.resolve("hwmon1/temp1_input"), "45000");
        write(hwmon.resolve("hwmon1/temp1_label"), "Package id 0");
        write(hwmon.resolve("hwmon1/temp2_input"), "43000");

        List<NamespaceEntry> entries = new TemperatureEnumerator(root.resolve("class/thermal"), hwmon)
                .enumerate(auto("temperatures { auto on; source hwmon; }", SourceType.TEMPERATURE));

        assertEquals(List.of("coretemp_package_id_0", "coretemp_temp2"),
                entries.stream().map(NamespaceEntry::name).toList());
        assertEquals(hwmon.resolve("hwmon1/temp2_input").toString(), entries.get(1).target());
    }

    @Test
    @DisplayName("Should list block device mounts without loop devices")
    void disks() throws Exception {
        write(root.resolve("proc/mounts"), String.join("\n",
                "/dev/nvme0n1p2 / ext4 rw,relatime 0 0",
                "proc /proc proc rw 0 0",
                "/dev/loop3 /snap/core/1 squashfs ro 0 0",
                "/dev/sda1 /mnt/data xfs rw 0 0"));

        List<NamespaceEntry> entries = new DiskEnumerator(new Procfs(root.resolve("proc")))
                .enumerate(auto("disks { auto on; }", SourceType.DISK));

        assertEquals(List.of("nvme0n1p2", "sda1"), entries.stream().map(NamespaceEntry::name).toList());
    }
}
