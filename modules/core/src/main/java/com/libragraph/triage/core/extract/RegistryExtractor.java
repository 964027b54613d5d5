package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.InstalledProgram;
import com.libragraph.triage.core.artifact.RunKey;
import com.libragraph.triage.core.artifact.SystemSetting;
import com.libragraph.triage.core.artifact.UsbDevice;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.formats.filesystem.UserProfile;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.registry.RegistryHive;
import com.libragraph.triage.formats.registry.RegistryKey;
import com.libragraph.triage.formats.registry.RegistryValue;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * USB devices, installed programs, autostart entries and a few machine
 * settings from the SYSTEM, SOFTWARE and per-user NTUSER.DAT hives.
 */
@ApplicationScoped
public class RegistryExtractor implements ArtifactExtractor {

    private static final Logger log = Logger.getLogger(RegistryExtractor.class);

    static final String DEVICE_PROPERTIES = "{83da6326-97a6-4088-9453-a1923f573b29}";
    static final String FIRST_INSTALL = "0064";
    static final String LAST_ARRIVAL = "0066";

    private static final List<String> UNINSTALL_KEYS = List.of(
            "Microsoft\\Windows\\CurrentVersion\\Uninstall",
            "WOW6432Node\\Microsoft\\Windows\\CurrentVersion\\Uninstall");
    private static final List<String> RUN_KEYS = List.of(
            "Microsoft\\Windows\\CurrentVersion\\Run",
            "Microsoft\\Windows\\CurrentVersion\\RunOnce",
            "WOW6432Node\\Microsoft\\Windows\\CurrentVersion\\Run",
            "WOW6432Node\\Microsoft\\Windows\\CurrentVersion\\RunOnce");
    private static final List<String> USER_RUN_KEYS = List.of(
            "Software\\Microsoft\\Windows\\CurrentVersion\\Run",
            "Software\\Microsoft\\Windows\\CurrentVersion\\RunOnce");

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.REGISTRY;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index).flatMap(v -> Stream.of(
                hive(volumes, v, SystemLocations.SYSTEM_HIVE, ctx, hive -> system(hive, caseId, v)),
                hive(volumes, v, SystemLocations.SOFTWARE_HIVE, ctx, hive -> software(hive, caseId, v)),
                volumes.listUserProfiles(v).stream().flatMap(p -> hive(volumes, v,
                        p.resolve(SystemLocations.NTUSER), ctx, hive -> user(hive, caseId, p))))
                .flatMap(s -> s));
    }

    interface HiveDecoder {
        List<Artifact> decode(RegistryHive hive);
    }

    private Stream<Artifact> hive(VolumeSet volumes, int volume, String path, ExtractionContext ctx,
                                  HiveDecoder decoder) {
        return Stream.of(path).flatMap(p -> ImageFiles.guarded(ctx, "Registry hive " + p, () -> {
            if (!volumes.exists(volume, p)) {
                log.debugf("No hive at %s on volume %d", p, volume);
                return Stream.empty();
            }
            RegistryHive hive = RegistryHive.parse(ImageFiles.read(volumes, volume, p));
            return decoder.decode(hive).stream();
        }));
    }

    // SYSTEM

    List<Artifact> system(RegistryHive hive, String caseId, int volume) {
        String source = ImageFiles.source(volume, SystemLocations.SYSTEM_HIVE);
        String controlSet = currentControlSet(hive);
        List<Artifact> out = new ArrayList<>();
        hive.key(controlSet + "\\Enum\\USBSTOR").ifPresent(k -> usbDevices(k, "USBSTOR", caseId, source, out));
        hive.key(controlSet + "\\Enum\\USB").ifPresent(k -> usbDevices(k, "USB", caseId, source, out));

        hive.key(controlSet + "\\Control\\ComputerName\\ComputerName").ifPresent(k ->
                setting(k, "ComputerName", "Computer name", "SYSTEM", caseId, source, out));
        hive.key(controlSet + "\\Control\\TimeZoneInformation").ifPresent(k -> {
            String valueName = k.string("TimeZoneKeyName").isPresent() ? "TimeZoneKeyName" : "StandardName";
            setting(k, valueName, "Time zone", "SYSTEM", caseId, source, out);
        });
        return out;
    }

    static String currentControlSet(RegistryHive hive) {
        long current = hive.key("Select")
                .flatMap(k -> k.value("Current"))
                .flatMap(RegistryValue::asDword)
                .orElse(1L);
        return String.format("ControlSet%03d", current);
    }

    private void usbDevices(RegistryKey enumKey, String deviceClass, String caseId, String source,
                            List<Artifact> out) {
        for (RegistryKey device : enumKey.subkeys()) {
            DeviceId id = DeviceId.parse(device.name());
            for (RegistryKey instance : device.subkeys()) {
                String serial = serialOf(instance.name());
                Instant firstSeen = propertyTime(instance, FIRST_INSTALL).orElse(instance.lastWritten());
                Instant lastSeen = propertyTime(instance, LAST_ARRIVAL).orElse(instance.lastWritten());
                String friendly = instance.string("FriendlyName").orElse(null);
                UsbDevice usb = new UsbDevice(serial, deviceClass, id.vendor, id.product, id.revision, friendly,
                        firstSeen, lastSeen);
                String label = friendly != null ? friendly : join(id.vendor, id.product);
                out.add(Artifact.of(caseId, ArtifactType.USB_DEVICE, serial, firstSeen, source,
                        "USB device " + label + " (serial " + serial + ")", usb));
            }
        }
    }

    /** Instance ids end in {@code &n} when Windows numbered them; the serial is the part before. */
    static String serialOf(String instanceId) {
        int amp = instanceId.lastIndexOf('&');
        if (amp > 0 && amp < instanceId.length() - 1 && instanceId.substring(amp + 1).chars().allMatch(Character::isDigit)) {
            return instanceId.substring(0, amp);
        }
        return instanceId;
    }

    private static Optional<Instant> propertyTime(RegistryKey instance, String property) {
        return instance.subkey("Properties")
                .flatMap(p -> p.subkey(DEVICE_PROPERTIES))
                .flatMap(p -> p.subkey(property))
                .flatMap(k -> k.values().stream().filter(v -> v.data().length >= 8).findFirst())
                .flatMap(v -> WindowsTime.fromFiletime(LittleEndian.i64(v.data(), 0)));
    }

    /** Vendor, product and revision parsed from {@code Disk&Ven_X&Prod_Y&Rev_Z} or {@code VID_X&PID_Y}. */
    record DeviceId(String vendor, String product, String revision) {
        static DeviceId parse(String name) {
            String vendor = null;
            String product = null;
            String revision = null;
            for (String part : name.split("&")) {
                int sep = part.indexOf('_');
                if (sep < 0) continue;
                String tag = part.substring(0, sep).toLowerCase(Locale.ROOT);
                String value = part.substring(sep + 1).replace('_', ' ').trim();
                if (value.isEmpty()) continue;
                switch (tag) {
                    case "ven", "vid" -> vendor = value;
                    case "prod", "pid" -> product = value;
                    case "rev" -> revision = value;
                    default -> { }
                }
            }
            return new DeviceId(vendor, product, revision);
        }
    }

    // SOFTWARE

    List<Artifact> software(RegistryHive hive, String caseId, int volume) {
        String source = ImageFiles.source(volume, SystemLocations.SOFTWARE_HIVE);
        List<Artifact> out = new ArrayList<>();
        for (String uninstall : UNINSTALL_KEYS) {
            hive.key(uninstall).ifPresent(k -> programs(k, caseId, source, out));
        }
        for (String run : RUN_KEYS) {
            hive.key(run).ifPresent(k -> runKeys(k, "SOFTWARE", null, caseId, source, out));
        }
        hive.key("Microsoft\\Windows NT\\CurrentVersion\\Winlogon").ifPresent(k ->
                setting(k, "DefaultUserName", "Default logon user", "SOFTWARE", caseId, source, out));
        hive.key("Microsoft\\Windows NT\\CurrentVersion").ifPresent(k ->
                setting(k, "ProductName", "Operating system", "SOFTWARE", caseId, source, out));
        return out;
    }

    private void programs(RegistryKey uninstall, String caseId, String source, List<Artifact> out) {
        for (RegistryKey app : uninstall.subkeys()) {
            Optional<String> name = app.string("DisplayName");
            if (name.isEmpty()) continue;
            Instant installed = app.string("InstallDate").flatMap(WindowsTime::fromInstallDate).orElse(null);
            String registryPath = "SOFTWARE\\" + app.path();
            InstalledProgram program = new InstalledProgram(name.get(), app.string("DisplayVersion").orElse(null),
                    app.string("Publisher").orElse(null), app.string("InstallLocation").orElse(null),
                    installed, registryPath);
            Instant when = installed != null ? installed : app.lastWritten();
            String version = program.version() != null ? " " + program.version() : "";
            out.add(Artifact.of(caseId, ArtifactType.INSTALLED_PROGRAM, registryPath, when, source,
                    "Installed program " + name.get() + version, program));
        }
    }

    // NTUSER.DAT

    List<Artifact> user(RegistryHive hive, String caseId, UserProfile profile) {
        String hivePath = profile.resolve(SystemLocations.NTUSER);
        String source = ImageFiles.source(profile.volume(), hivePath);
        List<Artifact> out = new ArrayList<>();
        for (String run : USER_RUN_KEYS) {
            hive.key(run).ifPresent(k -> runKeys(k, hivePath, profile.name(), caseId, source, out));
        }
        return out;
    }

    private void runKeys(RegistryKey key, String hiveName, String profile, String caseId, String source,
                         List<Artifact> out) {
        String registryPath = hiveName + "\\" + key.path();
        for (RegistryValue value : key.values()) {
            if (value.name().isEmpty() || !value.isString()) continue;
            String command = value.asString();
            RunKey run = new RunKey(hiveName, registryPath, value.name(), command, profile);
            String who = profile != null ? " for " + profile : "";
            out.add(Artifact.of(caseId, ArtifactType.RUN_KEY, Artifact.key(registryPath, value.name()),
                    key.lastWritten(), source, "Autostart " + value.name() + who + ": " + command, run));
        }
    }

    private void setting(RegistryKey key, String valueName, String label, String hiveName, String caseId,
                         String source, List<Artifact> out) {
        key.string(valueName).ifPresent(value -> {
            String registryPath = hiveName + "\\" + key.path();
            out.add(Artifact.of(caseId, ArtifactType.SYSTEM_SETTING, Artifact.key(registryPath, valueName),
                    null, source, label + ": " + value, new SystemSetting(label, value, registryPath)));
        });
    }

    private static String join(String a, String b) {
        if (a == null) return b == null ? "(unknown)" : b;
        return b == null ? a : a + " " + b;
    }
}
