package com.libragraph.triage.types;

/**
 * Kinds of evidence records the extractors produce. Stored by {@link #name()},
 * which is also the secondary sort key of the case timeline.
 */
public enum ArtifactType {
    BROWSER_HISTORY(0, "browser_history", "Browser"),
    BROWSER_DOWNLOAD(1, "browser_download", "Browser"),
    BROWSER_COOKIE(2, "browser_cookie", "Browser"),
    USB_DEVICE(3, "usb_device", "Registry"),
    INSTALLED_PROGRAM(4, "installed_program", "Registry"),
    RUN_KEY(5, "run_key", "Registry"),
    SYSTEM_SETTING(6, "system_setting", "Registry"),
    DELETED_FILE(7, "deleted_file", "Recycle bin"),
    EVENT_LOG(8, "event_log", "Event log"),
    EXECUTION_COUNT(9, "execution_count", "User activity"),
    PREFETCH(10, "prefetch", "File system"),
    SHORTCUT(11, "shortcut", "File system"),
    JUMP_LIST(12, "jump_list", "File system");

    private final int id;
    private final String label;
    private final String category;

    ArtifactType(int id, String label, String category) {
        this.id = id;
        this.label = label;
        this.category = category;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String category() {
        return category;
    }

    public static ArtifactType fromId(int id) {
        for (ArtifactType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown ArtifactType id: " + id);
    }

    /** Accepts either the label ({@code usb_device}) or the constant name ({@code USB_DEVICE}). */
    public static ArtifactType parse(String value) {
        for (ArtifactType t : values()) {
            if (t.label.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown artifact type: " + value);
    }
}
