package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.api.ImageFormatFactory;
import com.libragraph.triage.formats.error.ImageFormatException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Opens evidence containers. The format is chosen from the file's leading
 * bytes first and its name second; all {@link ImageFormatFactory} beans are
 * discovered via CDI.
 */
@ApplicationScoped
public class ImageIngestor {

    private static final Logger log = Logger.getLogger(ImageIngestor.class);

    /** Header size to read for detection. */
    private static final int HEADER_SIZE = 512;

    @Inject
    Instance<ImageFormatFactory> factories;

    private List<ImageFormatFactory> fixedFactories;

    /**
     * Ingestor with an explicit factory set, for use outside a CDI container.
     */
    public static ImageIngestor withFactories(List<ImageFormatFactory> factories) {
        ImageIngestor ingestor = new ImageIngestor();
        ingestor.fixedFactories = List.copyOf(factories);
        return ingestor;
    }

    /**
     * Ingestor that knows the built-in raw, split-raw and EWF formats.
     */
    public static ImageIngestor withDefaults() {
        return withFactories(List.of(new RawImageFactory(), new SplitRawImageFactory(), new EwfImageFactory()));
    }

    /**
     * Opens the container at {@code path}.
     *
     * @throws ImageFormatException if the file is missing, empty, unreadable or malformed
     */
    public ImageHandle open(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ImageFormatException(path, "Image file not found");
        }
        byte[] header;
        try (InputStream in = Files.newInputStream(path)) {
            header = in.readNBytes(HEADER_SIZE);
        } catch (IOException e) {
            throw new ImageFormatException(path, "Image file is not readable", e);
        }
        if (header.length == 0) {
            throw new ImageFormatException(path, "Image file is empty");
        }

        String filename = path.getFileName().toString();
        ImageFormatFactory factory = candidates()
                .filter(f -> f.getDetectionCriteria().matches(filename, header))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()))
                .orElseThrow(() -> new ImageFormatException(path, "Unrecognized image format"));

        try {
            ImageHandle handle = factory.open(path, header);
            log.infof("Opened %s image %s (%d bytes, %d segment(s))",
                    handle.format().label(), path, handle.size(), handle.segmentCount());
            return handle;
        } catch (IOException e) {
            throw new ImageFormatException(path, "Failed to open " + factory.format().label() + " image", e);
        }
    }

    /** Known factories, highest detection priority first. */
    public List<ImageFormatFactory> formats() {
        return candidates()
                .sorted(Comparator.comparingInt((ImageFormatFactory f) -> f.getDetectionCriteria().priority())
                        .reversed())
                .toList();
    }

    private Stream<ImageFormatFactory> candidates() {
        if (fixedFactories != null) {
            return fixedFactories.stream();
        }
        return StreamSupport.stream(factories.spliterator(), false);
    }
}
