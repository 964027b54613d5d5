package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.InstalledProgram;
import com.libragraph.triage.core.artifact.RunKey;
import com.libragraph.triage.core.artifact.UsbDevice;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.testing.NtfsImageBuilder;
import com.libragraph.triage.testing.RegistryHiveBuilder;
import com.libragraph.triage.types.ArtifactType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RegistryExtractorTest {

    private static final Instant FIRST = Instant.parse("2021-03-02T08:00:00Z");
    private static final Instant LAST = Instant.parse("2021-04-20T17:45:00Z");
    private static final String SERIAL = "0019E06B9C85F9A0F7550C20";

    @TempDir
    Path tempDir;

    private final RegistryExtractor extractor = new RegistryExtractor();

    private static byte[] systemHive() {
        RegistryHiveBuilder b = new RegistryHiveBuilder();
        b.key("Select").dword("Current", 1);
        String instance = "ControlSet001\\Enum\\USBSTOR\\Disk&Ven_Kingston&Prod_DataTraveler&Rev_1.00\\" + SERIAL + "&0";
        b.key(instance).string("FriendlyName", "Kingston DataTraveler USB Device");
        b.key(instance + "\\Properties\\" + RegistryExtractor.DEVICE_PROPERTIES + "\\" + RegistryExtractor.FIRST_INSTALL)
                .filetime("", FIRST);
        b.key(instance + "\\Properties\\" + RegistryExtractor.DEVICE_PROPERTIES + "\\" + RegistryExtractor.LAST_ARRIVAL)
                .filetime("", LAST);
        b.key("ControlSet001\\Control\\ComputerName\\ComputerName").string("ComputerName", "WS-FINANCE-01");
        // a stale control set that must not be read
        b.key("ControlSet002\\Enum\\USBSTOR\\Disk&Ven_Old&Prod_Stick\\OLDSERIAL&0");
        return b.build();
    }

    private static byte[] softwareHive() {
        RegistryHiveBuilder b = new RegistryHiveBuilder();
        b.key("Microsoft\\Windows\\CurrentVersion\\Uninstall\\7-Zip")
                .string("DisplayName", "7-Zip 19.00")
                .string("DisplayVersion", "19.00")
                .string("Publisher", "Igor Pavlov")
                .string("InstallDate", "20210301");
        b.key("Microsoft\\Windows\\CurrentVersion\\Uninstall\\KB123456");
        b.key("Microsoft\\Windows\\CurrentVersion\\Run")
                .lastWritten(LAST)
                .string("Updater", "C:\\ProgramData\\upd\\updater.exe -silent");
        b.key("Microsoft\\Windows NT\\CurrentVersion").string("ProductName", "Windows 10 Pro");
        return b.build();
    }

    private static byte[] userHive() {
        RegistryHiveBuilder b = new RegistryHiveBuilder();
        b.key("Software\\Microsoft\\Windows\\CurrentVersion\\Run")
                .string("OneDrive", "C:\\Users\\alice\\AppData\\Local\\OneDrive.exe /background");
        return b.build();
    }

    private NtfsImageBuilder image() {
        return new NtfsImageBuilder()
                .file(SystemLocations.SYSTEM_HIVE, systemHive())
                .file(SystemLocations.SOFTWARE_HIVE, softwareHive())
                .file("/Users/alice/NTUSER.DAT", userHive());
    }

    private static List<Artifact> ofType(List<Artifact> artifacts, ArtifactType type) {
        return artifacts.stream().filter(a -> a.type() == type).toList();
    }

    @Test
    void usbDeviceShouldCarrySerialAndConnectionTimes() throws Exception {
        try (MountedImage mounted = MountedImage.of(tempDir, image())) {
            List<Artifact> usb = ofType(mounted.run(extractor), ArtifactType.USB_DEVICE);

            assertThat(usb).singleElement().satisfies(a -> {
                assertThat(a.naturalKey()).isEqualTo(SERIAL);
                assertThat(a.timestamp()).isEqualTo(FIRST);
                assertThat(a.sourcePath()).isEqualTo("vol0:" + SystemLocations.SYSTEM_HIVE);
                UsbDevice device = (UsbDevice) a.payload();
                assertThat(device.vendor()).isEqualTo("Kingston");
                assertThat(device.product()).isEqualTo("DataTraveler");
                assertThat(device.revision()).isEqualTo("1.00");
                assertThat(device.firstSeen()).isEqualTo(FIRST);
                assertThat(device.lastSeen()).isEqualTo(LAST);
                assertThat(a.description()).contains("Kingston DataTraveler USB Device");
            });
        }
    }

    @Test
    void programsAndAutostartsShouldBeReported() throws Exception {
        try (MountedImage mounted = MountedImage.of(tempDir, image())) {
            List<Artifact> all = mounted.run(extractor);

            assertThat(ofType(all, ArtifactType.INSTALLED_PROGRAM)).singleElement().satisfies(a -> {
                InstalledProgram p = (InstalledProgram) a.payload();
                assertThat(p.name()).isEqualTo("7-Zip 19.00");
                assertThat(p.publisher()).isEqualTo("Igor Pavlov");
                assertThat(a.timestamp()).isEqualTo(Instant.parse("2021-03-01T00:00:00Z"));
            });
            assertThat(ofType(all, ArtifactType.RUN_KEY))
                    .extracting(a -> ((RunKey) a.payload()).valueName())
                    .containsExactlyInAnyOrder("Updater", "OneDrive");
            assertThat(ofType(all, ArtifactType.RUN_KEY))
                    .filteredOn(a -> ((RunKey) a.payload()).valueName().equals("OneDrive"))
                    .singleElement()
                    .satisfies(a -> assertThat(((RunKey) a.payload()).profile()).isEqualTo("alice"));
            assertThat(ofType(all, ArtifactType.SYSTEM_SETTING))
                    .extracting(Artifact::description)
                    .contains("Computer name: WS-FINANCE-01", "Operating system: Windows 10 Pro");
        }
    }

    @Test
    void corruptHiveShouldWarnAndLeaveTheOthersReadable() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file(SystemLocations.SYSTEM_HIVE, systemHive())
                .file(SystemLocations.SOFTWARE_HIVE, "definitely not a hive".getBytes(StandardCharsets.US_ASCII));
        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            ExtractionContext ctx = ExtractionContext.standalone(MountedImage.CASE, extractor.kind());

            List<Artifact> all = mounted.run(extractor, ctx);

            assertThat(ofType(all, ArtifactType.USB_DEVICE)).hasSize(1);
            assertThat(ctx.warnings()).singleElement().asString()
                    .startsWith("Registry hive " + SystemLocations.SOFTWARE_HIVE);
        }
    }

    @Test
    void missingHivesShouldYieldNothing() throws Exception {
        try (MountedImage mounted = MountedImage.of(tempDir, new NtfsImageBuilder().directory("/Users/bob"))) {
            ExtractionContext ctx = ExtractionContext.standalone(MountedImage.CASE, extractor.kind());

            assertThat(mounted.run(extractor, ctx)).isEmpty();
            assertThat(ctx.warnings()).isEmpty();
        }
    }

    @Test
    void serialShouldDropTheInstanceCounter() {
        assertThat(RegistryExtractor.serialOf("ABC123&0")).isEqualTo("ABC123");
        assertThat(RegistryExtractor.serialOf("6&2a3b&0&1")).isEqualTo("6&2a3b&0");
        assertThat(RegistryExtractor.serialOf("NOCOUNTER")).isEqualTo("NOCOUNTER");
    }
}
