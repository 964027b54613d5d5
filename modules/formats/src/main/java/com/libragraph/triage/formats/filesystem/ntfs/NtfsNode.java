package com.libragraph.triage.formats.filesystem.ntfs;

import com.libragraph.triage.formats.filesystem.MacbTimes;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * A file or directory in the tree rebuilt from MFT parent references.
 */
public final class NtfsNode {

    private final MftRecord record;
    private final boolean damaged;
    private final Map<String, NtfsNode> children = new TreeMap<>();
    private NtfsNode parent;

    NtfsNode(MftRecord record, boolean damaged) {
        this.record = record;
        this.damaged = damaged;
    }

    void attach(NtfsNode child) {
        child.parent = this;
        children.putIfAbsent(key(child.name()), child);
    }

    NtfsNode child(String name) {
        return children.get(key(name));
    }

    static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public long recordNumber() {
        return record.number();
    }

    public String name() {
        return record.number() == NtfsVolume.ROOT_RECORD ? "" : record.name();
    }

    public boolean directory() {
        return record.directory();
    }

    /** The record failed its update-sequence check; its subtree is not trusted. */
    public boolean damaged() {
        return damaged;
    }

    public long size() {
        return directory() ? 0 : record.size();
    }

    public MacbTimes times() {
        return record.times();
    }

    public NtfsNode parent() {
        return parent;
    }

    public Collection<NtfsNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    MftRecord record() {
        return record;
    }

    public String path() {
        if (parent == null) return "/";
        StringBuilder sb = new StringBuilder();
        NtfsNode n = this;
        int depth = 0;
        while (n != null && n.parent != null && depth++ < 1024) {
            sb.insert(0, "/" + n.name());
            n = n.parent;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NtfsNode[" + record.number() + " " + path() + "]";
    }

    static List<String> segments(String path) {
        String p = path.replace('\\', '/');
        return Arrays.stream(p.split("/")).filter(s -> !s.isEmpty()).toList();
    }
}
