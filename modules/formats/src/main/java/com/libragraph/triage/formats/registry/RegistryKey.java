package com.libragraph.triage.formats.registry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A key node. Subkeys and values are decoded from the hive on each call.
 */
public final class RegistryKey {

    private final RegistryHive hive;
    private final int cell;
    private final String name;
    private final String path;
    private final Instant lastWritten;

    RegistryKey(RegistryHive hive, int cell, String name, String path, Instant lastWritten) {
        this.hive = hive;
        this.cell = cell;
        this.name = name;
        this.path = path;
        this.lastWritten = lastWritten;
    }

    public String name() {
        return name;
    }

    /** Backslash-separated path below the hive root, empty for the root itself. */
    public String path() {
        return path;
    }

    /** May be null when the hive holds an implausible timestamp. */
    public Instant lastWritten() {
        return lastWritten;
    }

    public List<RegistryKey> subkeys() {
        return hive.subkeys(this);
    }

    public Optional<RegistryKey> subkey(String name) {
        return subkeys().stream().filter(k -> k.name.equalsIgnoreCase(name)).findFirst();
    }

    public List<RegistryValue> values() {
        return hive.values(this);
    }

    public Optional<RegistryValue> value(String name) {
        return values().stream().filter(v -> v.name().equalsIgnoreCase(name)).findFirst();
    }

    /** String form of a value, empty when absent or blank. */
    public Optional<String> string(String name) {
        return value(name).map(RegistryValue::display).filter(s -> !s.isBlank());
    }

    int cell() {
        return cell;
    }

    @Override
    public String toString() {
        return "RegistryKey[" + path + "]";
    }
}
