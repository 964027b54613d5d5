package com.libragraph.triage.formats.filesystem;

import java.util.List;
import java.util.Set;

/**
 * Well-known Windows locations the extractors look at. Paths are matched
 * case-insensitively by {@link VolumeSet}.
 */
public final class SystemLocations {

    public static final String CONFIG_DIR = "/Windows/System32/config";
    public static final String SYSTEM_HIVE = CONFIG_DIR + "/SYSTEM";
    public static final String SOFTWARE_HIVE = CONFIG_DIR + "/SOFTWARE";
    public static final String SAM_HIVE = CONFIG_DIR + "/SAM";
    public static final String SECURITY_HIVE = CONFIG_DIR + "/SECURITY";

    public static final List<String> REGISTRY_HIVES = List.of(SYSTEM_HIVE, SOFTWARE_HIVE, SAM_HIVE, SECURITY_HIVE);

    public static final List<String> RECYCLE_BINS = List.of("/$Recycle.Bin", "/RECYCLER", "/Recycler", "/RECYCLED");

    public static final List<String> LOG_DIRECTORIES = List.of(
            "/Windows/System32/winevt/Logs", CONFIG_DIR, "/WINNT/System32/config");

    public static final String PREFETCH = "/Windows/Prefetch";

    public static final List<String> PROFILE_ROOTS = List.of("/Users", "/Documents and Settings");

    /** Profile directory names that are not interactive users. Compared lower-case. */
    public static final Set<String> NON_USER_PROFILES = Set.of(
            "all users", "default", "default user", "public", ".", "..");

    public static final String NTUSER = "NTUSER.DAT";

    private SystemLocations() {
    }
}
