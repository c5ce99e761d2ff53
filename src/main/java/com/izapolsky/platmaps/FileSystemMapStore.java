package com.izapolsky.platmaps;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Date;
import java.util.Properties;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Store keeping every map as {@code <id>.pdf} in a single directory, with a
 * {@code <id>.pdf.properties} sidecar describing where it came from.
 */
public class FileSystemMapStore implements MapStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemMapStore.class);

    public static final String ARTIFACT_SUFFIX = ".pdf";
    public static final String METADATA_SUFFIX = ".properties";
    static final String PARTIAL_SUFFIX = ".part";

    private final File directory;

    /**
     * Opens the store, creating the directory if needed
     *
     * @param directory
     * @throws StoreInitializationException if directory can't be created or is not writeable
     */
    public FileSystemMapStore(File directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory.toPath());
        } catch (IOException e) {
            throw new StoreInitializationException(String.format("Failed to create output directory %1$s", directory.getAbsolutePath()), e);
        }
        if (!directory.isDirectory() || !directory.canWrite()) {
            throw new StoreInitializationException(String.format("Output directory %1$s has to be writeable directory", directory.getAbsolutePath()));
        }
        log.info("Output directory: {}", directory.getAbsolutePath());
    }

    public File getDirectory() {
        return directory;
    }

    @Override
    public boolean contains(MapId id) {
        return locate(id).isFile();
    }

    @Override
    public File locate(MapId id) {
        return new File(directory, id.format() + ARTIFACT_SUFFIX);
    }

    @Override
    public File write(MapId id, InputStream content) throws IOException {
        File destination = locate(id);
        File partial = new File(directory, destination.getName() + PARTIAL_SUFFIX);
        try {
            FileUtils.copyInputStreamToFile(content, partial);
            Files.move(partial.toPath(), destination.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } finally {
            FileUtils.deleteQuietly(partial);
        }
        return destination;
    }

    @Override
    public void writeMetadata(MapId id, Properties metadata) {
        File propertiesFile = metadataFile(id);
        FileOutputStream fos = null;
        try {
            fos = new FileOutputStream(propertiesFile);
            metadata.store(fos, String.format("Change on %1$s", new Date()));
        } catch (IOException e) {
            throw new RuntimeException(String.format("Failed writing to %1$s", propertiesFile.getAbsolutePath()), e);
        } finally {
            IOUtils.closeQuietly(fos);
        }
    }

    @Override
    public Properties readMetadata(MapId id) {
        Properties result = new Properties();
        File propertiesFile = metadataFile(id);
        if (!propertiesFile.isFile()) {
            return result;
        }
        try (FileInputStream fis = new FileInputStream(propertiesFile)) {
            result.load(fis);
        } catch (IOException e) {
            throw new RuntimeException(String.format("Failed to read %1$s", propertiesFile), e);
        }
        return result;
    }

    @Override
    public SortedSet<MapId> list() {
        SortedSet<MapId> result = new TreeSet<>();
        File[] artifacts = directory.listFiles((dir, name) -> name.endsWith(ARTIFACT_SUFFIX));
        if (artifacts == null) {
            throw new RuntimeException(String.format("Failed to list %1$s", directory.getAbsolutePath()));
        }
        for (File artifact : artifacts) {
            if (!artifact.isFile()) {
                continue;
            }
            String stem = FilenameUtils.removeExtension(artifact.getName());
            try {
                result.add(MapId.parse(stem));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring {}: {}", artifact.getName(), e.getMessage());
            }
        }
        return result;
    }

    private File metadataFile(MapId id) {
        return new File(directory, id.format() + ARTIFACT_SUFFIX + METADATA_SUFFIX);
    }
}
