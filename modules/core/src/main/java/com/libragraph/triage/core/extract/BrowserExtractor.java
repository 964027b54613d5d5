package com.libragraph.triage.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.ArtifactCodec;
import com.libragraph.triage.core.artifact.BrowserCookie;
import com.libragraph.triage.core.artifact.BrowserDownload;
import com.libragraph.triage.core.artifact.BrowserVisit;
import com.libragraph.triage.formats.filesystem.FileEntry;
import com.libragraph.triage.formats.filesystem.UserProfile;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.util.WindowsTime;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * History, downloads and cookies of Chromium browsers (Chrome, Edge) and
 * Firefox. Each database is copied out of the image and opened read-only.
 */
@ApplicationScoped
public class BrowserExtractor implements ArtifactExtractor {

    private static final Logger log = Logger.getLogger(BrowserExtractor.class);

    static final String CHROME = "Chrome";
    static final String EDGE = "Edge";
    static final String FIREFOX = "Firefox";

    static final String CHROME_DATA = "AppData/Local/Google/Chrome/User Data";
    static final String EDGE_DATA = "AppData/Local/Microsoft/Edge/User Data";
    static final String FIREFOX_PROFILES = "AppData/Roaming/Mozilla/Firefox/Profiles";

    static final String CHROMIUM_VISITS = """
            SELECT u.url, u.title, u.visit_count, v.visit_time
            FROM visits v JOIN urls u ON u.id = v.url
            ORDER BY v.visit_time""";

    static final String CHROMIUM_DOWNLOADS = """
            SELECT d.target_path, d.total_bytes, d.start_time, d.end_time,
                   (SELECT c.url FROM downloads_url_chains c WHERE c.id = d.id
                    ORDER BY c.chain_index DESC LIMIT 1) AS url
            FROM downloads d
            ORDER BY d.start_time""";

    static final String CHROMIUM_COOKIES = """
            SELECT host_key, name, path, creation_utc, expires_utc, last_access_utc
            FROM cookies""";

    static final String FIREFOX_VISITS = """
            SELECT p.url, p.title, p.visit_count, v.visit_date
            FROM moz_historyvisits v JOIN moz_places p ON p.id = v.place_id
            ORDER BY v.visit_date""";

    static final String FIREFOX_DOWNLOADS = """
            SELECT p.url, dest.content AS destination, dest.dateAdded AS added, meta.content AS meta
            FROM moz_annos dest
            JOIN moz_anno_attributes da ON da.id = dest.anno_attribute_id
                AND da.name = 'downloads/destinationFileURI'
            JOIN moz_places p ON p.id = dest.place_id
            LEFT JOIN moz_anno_attributes ma ON ma.name = 'downloads/metaData'
            LEFT JOIN moz_annos meta ON meta.place_id = dest.place_id AND meta.anno_attribute_id = ma.id
            ORDER BY dest.dateAdded""";

    static final String FIREFOX_COOKIES = """
            SELECT host, name, path, creationTime, expiry, lastAccessed
            FROM moz_cookies""";

    private static final ObjectMapper JSON = ArtifactCodec.standaloneMapper();

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.BROWSER;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index)
                .flatMap(v -> volumes.listUserProfiles(v).stream())
                .flatMap(p -> Stream.of(
                        chromium(volumes, p, CHROME, CHROME_DATA, caseId, ctx),
                        chromium(volumes, p, EDGE, EDGE_DATA, caseId, ctx),
                        firefox(volumes, p, caseId, ctx)).flatMap(s -> s));
    }

    // Chromium

    private Stream<Artifact> chromium(VolumeSet volumes, UserProfile profile, String browser, String dataDir,
                                      String caseId, ExtractionContext ctx) {
        int vol = profile.volume();
        return ImageFiles.list(volumes, vol, profile.resolve(dataDir)).stream()
                .filter(FileEntry::directory)
                .filter(d -> d.name().equals("Default") || d.name().startsWith("Profile "))
                .flatMap(dir -> Stream.of(
                        database(volumes, vol, dir.path() + "/History", ctx, (db, source) -> {
                            List<Artifact> out = new ArrayList<>();
                            out.addAll(query(db, "visits", source, ctx, h -> h.createQuery(CHROMIUM_VISITS)
                                    .map((rs, c) -> visit(caseId, browser, profile, source, rs.getString("url"),
                                            rs.getString("title"), rs.getLong("visit_count"),
                                            WindowsTime.fromWebkit(rs.getLong("visit_time")).orElse(null)))
                                    .list()));
                            out.addAll(query(db, "downloads", source, ctx, h -> h.createQuery(CHROMIUM_DOWNLOADS)
                                    .map((rs, c) -> download(caseId, browser, profile, source, rs.getString("url"),
                                            rs.getString("target_path"), rs.getLong("total_bytes"),
                                            WindowsTime.fromWebkit(rs.getLong("start_time")).orElse(null),
                                            WindowsTime.fromWebkit(rs.getLong("end_time")).orElse(null)))
                                    .list()));
                            return out;
                        }),
                        chromiumCookies(volumes, vol, dir.path() + "/Cookies", browser, profile, caseId, ctx),
                        chromiumCookies(volumes, vol, dir.path() + "/Network/Cookies", browser, profile, caseId, ctx))
                        .flatMap(s -> s));
    }

    private Stream<Artifact> chromiumCookies(VolumeSet volumes, int vol, String path, String browser,
                                             UserProfile profile, String caseId, ExtractionContext ctx) {
        return database(volumes, vol, path, ctx, (db, source) ->
                query(db, "cookies", source, ctx, h -> h.createQuery(CHROMIUM_COOKIES)
                        .map((rs, c) -> cookie(caseId, browser, profile, source, rs.getString("host_key"),
                                rs.getString("name"), rs.getString("path"),
                                WindowsTime.fromWebkit(rs.getLong("creation_utc")).orElse(null),
                                WindowsTime.fromWebkit(rs.getLong("expires_utc")).orElse(null),
                                WindowsTime.fromWebkit(rs.getLong("last_access_utc")).orElse(null)))
                        .list()));
    }

    // Firefox

    private Stream<Artifact> firefox(VolumeSet volumes, UserProfile profile, String caseId, ExtractionContext ctx) {
        int vol = profile.volume();
        return ImageFiles.list(volumes, vol, profile.resolve(FIREFOX_PROFILES)).stream()
                .filter(FileEntry::directory)
                .flatMap(dir -> Stream.of(
                        database(volumes, vol, dir.path() + "/places.sqlite", ctx, (db, source) -> {
                            List<Artifact> out = new ArrayList<>();
                            out.addAll(query(db, "moz_historyvisits", source, ctx, h -> h.createQuery(FIREFOX_VISITS)
                                    .map((rs, c) -> visit(caseId, FIREFOX, profile, source, rs.getString("url"),
                                            rs.getString("title"), rs.getLong("visit_count"),
                                            WindowsTime.fromUnixMicros(rs.getLong("visit_date")).orElse(null)))
                                    .list()));
                            out.addAll(query(db, "moz_annos", source, ctx, h -> h.createQuery(FIREFOX_DOWNLOADS)
                                    .map((rs, c) -> firefoxDownload(caseId, profile, source, rs.getString("url"),
                                            rs.getString("destination"), rs.getLong("added"), rs.getString("meta")))
                                    .list()));
                            return out;
                        }),
                        database(volumes, vol, dir.path() + "/cookies.sqlite", ctx, (db, source) ->
                                query(db, "moz_cookies", source, ctx, h -> h.createQuery(FIREFOX_COOKIES)
                                        .map((rs, c) -> cookie(caseId, FIREFOX, profile, source, rs.getString("host"),
                                                rs.getString("name"), rs.getString("path"),
                                                WindowsTime.fromUnixMicros(rs.getLong("creationTime")).orElse(null),
                                                WindowsTime.fromUnixSeconds(rs.getLong("expiry")).orElse(null),
                                                WindowsTime.fromUnixMicros(rs.getLong("lastAccessed")).orElse(null)))
                                        .list())))
                        .flatMap(s -> s));
    }

    private Artifact firefoxDownload(String caseId, UserProfile profile, String source, String url,
                                     String destination, long addedMicros, String meta) {
        long size = 0;
        Instant end = null;
        if (meta != null) {
            try {
                JsonNode node = JSON.readTree(meta);
                size = node.path("fileSize").asLong(0);
                long endMillis = node.path("endTime").asLong(0);
                if (endMillis > 0) end = WindowsTime.fromUnixMicros(endMillis * 1000).orElse(null);
            } catch (JsonProcessingException e) {
                log.debugf("Unreadable download metadata for %s: %s", url, e.getMessage());
            }
        }
        return download(caseId, FIREFOX, profile, source, url, localPath(destination), size,
                WindowsTime.fromUnixMicros(addedMicros).orElse(null), end);
    }

    /** {@code file:///C:/Users/a/x.exe} to {@code C:\Users\a\x.exe}; other values unchanged. */
    static String localPath(String fileUri) {
        if (fileUri == null || !fileUri.startsWith("file:")) return fileUri;
        try {
            String path = new URI(fileUri).getPath();
            if (path == null) return fileUri;
            if (path.length() > 2 && path.charAt(0) == '/' && path.charAt(2) == ':') path = path.substring(1);
            return path.replace('/', '\\');
        } catch (URISyntaxException e) {
            return fileUri;
        }
    }

    // Records

    private Artifact visit(String caseId, String browser, UserProfile profile, String source, String url,
                           String title, long count, Instant time) {
        BrowserVisit payload = new BrowserVisit(browser, profile.name(), url, title, count, time);
        return Artifact.of(caseId, ArtifactType.BROWSER_HISTORY,
                Artifact.key(browser, profile.name(), url, time), time, source,
                browser + " visit: " + (title == null || title.isBlank() ? url : title), payload);
    }

    private Artifact download(String caseId, String browser, UserProfile profile, String source, String url,
                              String target, long size, Instant start, Instant end) {
        BrowserDownload payload = new BrowserDownload(browser, profile.name(), url, target, size, start, end);
        return Artifact.of(caseId, ArtifactType.BROWSER_DOWNLOAD,
                Artifact.key(browser, profile.name(), url, start), start, source,
                browser + " download: " + target + " from " + url, payload);
    }

    private Artifact cookie(String caseId, String browser, UserProfile profile, String source, String host,
                            String name, String path, Instant created, Instant expires, Instant accessed) {
        BrowserCookie payload = new BrowserCookie(browser, profile.name(), host, name, path, created, expires,
                accessed);
        return Artifact.of(caseId, ArtifactType.BROWSER_COOKIE,
                Artifact.key(browser, profile.name(), host, name, path), created, source,
                browser + " cookie " + name + " for " + host, payload);
    }

    // Database access

    private interface DatabaseReader {
        List<Artifact> read(Jdbi db, String source);
    }

    private Stream<Artifact> database(VolumeSet volumes, int vol, String path, ExtractionContext ctx,
                                      DatabaseReader reader) {
        return ImageFiles.guarded(ctx, "Browser database " + path, () -> {
            if (!volumes.exists(vol, path)) return Stream.empty();
            byte[] content = ImageFiles.read(volumes, vol, path);
            Path copy = null;
            try {
                copy = Files.createTempFile("triage-browser-", ".sqlite");
                Files.write(copy, content);
                return reader.read(open(copy), ImageFiles.source(vol, path)).stream();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot stage " + path, e);
            } finally {
                deleteQuietly(copy);
            }
        });
    }

    /** Runs one query; a missing table or a damaged page costs that query only. */
    private List<Artifact> query(Jdbi db, String table, String source, ExtractionContext ctx,
                                 Function<Handle, List<Artifact>> query) {
        try {
            return db.withHandle(query::apply);
        } catch (JdbiException e) {
            ctx.warn(source + ": cannot read " + table + ": " + rootMessage(e));
            return List.of();
        }
    }

    static Jdbi open(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
        return Jdbi.create(ds);
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) root = root.getCause();
        return root.getMessage();
    }

    private static void deleteQuietly(Path copy) {
        if (copy == null) return;
        try {
            Files.deleteIfExists(copy);
        } catch (IOException e) {
            log.warnf("Cannot delete staged browser database %s: %s", copy, e.getMessage());
        }
    }
}
