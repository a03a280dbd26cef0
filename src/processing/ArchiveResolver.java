package processing;

import org.slf4j.Logger;
import processing.LocationExceptions.ExtractionException;
import processing.LocationExceptions.LocationCheckException;
import processing.LocationExceptions.ReadException;
import util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Turns a downloaded resource file into the candidate files (or layers) to read.
 * Zip archives are unpacked into a fresh directory under the scratch root and searched
 * for entries carrying the declared type's extension.
 * This class is final as it's not designed for extension.
 */
public final class ArchiveResolver {

    private static final Logger logger = LoggingUtil.getLogger(ArchiveResolver.class);

    private static final String MAC_RESOURCE_DIR = "__MACOSX";

    private final IFormatSniffer sniffer;
    private final Map<FileType, IGeoContainer> containers;

    public ArchiveResolver() {
        this(new TikaFormatSniffer());
    }

    public ArchiveResolver(IFormatSniffer sniffer) {
        this(sniffer, defaultContainers());
    }

    ArchiveResolver(IFormatSniffer sniffer, Map<FileType, IGeoContainer> containers) {
        this.sniffer = Objects.requireNonNull(sniffer, "sniffer must not be null");
        this.containers = Objects.requireNonNull(containers, "containers must not be null");
    }

    static Map<FileType, IGeoContainer> defaultContainers() {
        Map<FileType, IGeoContainer> map = new EnumMap<>(FileType.class);
        map.put(FileType.GEOPACKAGE, new GeoPackageContainer());
        map.put(FileType.GEODATABASE, new FileGeodatabaseContainer());
        return map;
    }

    /**
     * @param resourceFile the downloaded file
     * @param type         the resource's declared type
     * @param resourceName catalog name of the resource, used in error messages
     * @param scratchRoot  directory that receives extracted archives
     * @return candidates in discovery order, never empty
     * @throws ExtractionException if the archive cannot be unpacked or holds nothing of the type
     * @throws ReadException       if a container's layers cannot be listed
     */
    public List<Candidate> resolve(Path resourceFile, FileType type, String resourceName, Path scratchRoot)
            throws LocationCheckException {
        Objects.requireNonNull(resourceFile, "resourceFile must not be null");
        Objects.requireNonNull(type, "type must not be null");

        if (!isArchive(resourceFile)) {
            logger.debug("[{}] Not an archive, reading {} directly", resourceName, resourceFile.getFileName());
            return requireCandidates(expandLayers(List.of(resourceFile), type), type, resourceName);
        }

        Path extractDir = scratchRoot.resolve(UUID.randomUUID().toString()).toAbsolutePath().normalize();
        try {
            extract(resourceFile, extractDir, resourceName);
        } catch (IOException e) {
            logger.warn("[{}] Could not unzip {}: {}", resourceName, resourceFile.getFileName(), e.getMessage());
            throw ExtractionException.forResource(resourceName, e);
        }

        List<Path> matches;
        try {
            matches = findByExtension(extractDir, type.getExtension());
        } catch (IOException e) {
            throw ExtractionException.forResource(resourceName, e);
        }
        matches = dropContainedMatches(matches);

        if (matches.isEmpty() && type.getFamily() == FormatFamily.SPREADSHEET) {
            // an xlsx is itself a zip, so the download may be the workbook
            logger.debug("[{}] No .{} entries, treating the download as the workbook", resourceName, type.getExtension());
            matches = List.of(resourceFile);
        }
        List<Candidate> candidates = requireCandidates(expandLayers(matches, type), type, resourceName);
        logger.info("[{}] {} candidate(s) of type {} found", resourceName, candidates.size(), type.getDeclaredName());
        return candidates;
    }

    private static List<Candidate> requireCandidates(List<Candidate> candidates, FileType type, String resourceName)
            throws ExtractionException {
        if (candidates.isEmpty()) {
            throw new ExtractionException(String.format("No %s files found in resource %s", type.getExtension(), resourceName));
        }
        return candidates;
    }

    private boolean isArchive(Path file) throws ExtractionException {
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).contains(".zip")) {
            return true;
        }
        try {
            return sniffer.isZipArchive(file);
        } catch (IOException e) {
            throw new ExtractionException("Could not inspect resource " + file.getFileName(), e);
        }
    }

    /**
     * Unpacks every entry of {@code archive} below {@code target}. Entries that would land
     * outside {@code target} are skipped.
     */
    static void extract(Path archive, Path target, String resourceName) throws IOException {
        Files.createDirectories(target);
        int extracted = 0;
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            var entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path entryDestination = target.resolve(entry.getName()).normalize();

                if (!entryDestination.startsWith(target)) {
                    logger.warn("[{}] Zip entry escapes the extraction directory, skipping: '{}'", resourceName, entry.getName());
                    continue;
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(entryDestination);
                } else {
                    Path parentDir = entryDestination.getParent();
                    if (parentDir != null) {
                        Files.createDirectories(parentDir);
                    }
                    try (InputStream in = zipFile.getInputStream(entry);
                         OutputStream out = Files.newOutputStream(entryDestination)) {
                        in.transferTo(out);
                    }
                    extracted++;
                }
            }
        }
        logger.debug("[{}] Extracted {} file(s) into {}", resourceName, extracted, target);
    }

    /** Files and directories below {@code root} whose name ends in {@code .ext}, in walk order. */
    static List<Path> findByExtension(Path root, String ext) throws IOException {
        String suffix = "." + ext.toLowerCase(Locale.ROOT);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(p -> !p.equals(root))
                    .filter(p -> !isHidden(root.relativize(p)))
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals(MAC_RESOURCE_DIR)) {
                return true;
            }
        }
        return false;
    }

    /** When several paths matched, drops any that contains another match. */
    static List<Path> dropContainedMatches(List<Path> matches) {
        if (matches.size() <= 1) {
            return matches;
        }
        List<Path> kept = new ArrayList<>();
        for (Path candidate : matches) {
            boolean prefixOfOther = matches.stream()
                    .anyMatch(other -> !other.equals(candidate) && other.startsWith(candidate));
            if (!prefixOfOther) {
                kept.add(candidate);
            }
        }
        return Collections.unmodifiableList(kept);
    }

    private List<Candidate> expandLayers(List<Path> files, FileType type) throws ReadException {
        List<Candidate> candidates = new ArrayList<>();
        if (type.getFamily() != FormatFamily.MULTI_LAYER_GEO) {
            files.forEach(f -> candidates.add(Candidate.of(f)));
            return candidates;
        }
        IGeoContainer container = containers.get(type);
        if (container == null) {
            throw new ReadException("No layer reader registered for " + type.getDeclaredName());
        }
        for (Path file : files) {
            for (String layer : container.listLayers(file)) {
                candidates.add(Candidate.layer(file, layer));
            }
        }
        return candidates;
    }
}
