package org.sqlver.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaPackage;
import org.sqlver.version.SchemaProblem;
import org.sqlver.version.SchemaVersion;
import org.sqlver.version.SchemaVersionNumber;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads a package from a directory holding one sub-directory per version.
 *
 * <p>A version directory is named {@code X}, {@code vX}, {@code X_text} or {@code vX_text}, where
 * {@code X} is one or more decimal numbers joined by {@code '.'} or {@code '_'}. Unless its
 * {@code _manifest.yaml} says otherwise, the parent of a version is the version sorted right before
 * it. Versions are registered lazily: their files are only parsed when the branch payload is first
 * requested.
 */
public class PackageLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(PackageLoader.class);

    public static final String MANIFEST_FILE_NAME = "_manifest.yaml";

    private static final Pattern VERSION_NAME = Pattern.compile("^[vV]?(\\d+(?:[._]\\d+)*)(?:_.*)?$");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads the package named after the directory.
     */
    public LoadedPackage load(Path rootDir) throws IOException {
        Path name = rootDir.toAbsolutePath().normalize().getFileName();
        return load(rootDir, name == null ? "default" : name.toString());
    }

    /**
     * @throws IOException              when the package directory cannot be listed
     * @throws IllegalArgumentException when two directories hold the same version
     */
    public LoadedPackage load(Path rootDir, String packageName) throws IOException {
        Objects.requireNonNull(rootDir, "rootDir must not be null");
        if (!Files.isDirectory(rootDir)) {
            throw new IOException("not a package directory: " + rootDir);
        }

        Map<SchemaVersionNumber, VersionDirectory> byVersion = new HashMap<>();
        List<SchemaProblem> problems = new ArrayList<>();
        try (Stream<Path> children = Files.list(rootDir)) {
            for (Path dir : children.filter(Files::isDirectory).sorted().toList()) {
                Optional<VersionDirectory> vd;
                try {
                    vd = describe(dir);
                } catch (IllegalArgumentException e) {
                    LOGGER.warn("Skipping {}: {}", dir, e.getMessage());
                    problems.add(SchemaProblem.of(ProblemLevel.ERROR, dir.toString(),
                            "cannot use version directory: " + e.getMessage()));
                    continue;
                }
                if (vd.isEmpty()) {
                    LOGGER.debug("Ignoring {}: not a version directory", dir);
                    continue;
                }
                VersionDirectory prev = byVersion.putIfAbsent(vd.get().getVersion(), vd.get());
                if (prev != null) {
                    throw new IllegalArgumentException("multiple directories for version " + vd.get().getVersion()
                            + ": " + prev.getDirectory().getFileName() + ", " + dir.getFileName());
                }
            }
        }

        List<SchemaVersionNumber> sorted = byVersion.keySet().stream().sorted().toList();
        SchemaPackage pkg = new SchemaPackage(packageName);
        for (int i = 0; i < sorted.size(); i++) {
            VersionDirectory vd = byVersion.get(sorted.get(i));
            SchemaVersionNumber parent = vd.isParentGiven()
                    ? vd.getParent()
                    : (i == 0 ? null : sorted.get(i - 1));
            LOGGER.debug("Registering {} {} (parent {}) from {}", packageName, vd.getVersion(), parent, vd.getDirectory());
            pkg.addLazy(v -> loadVersion(packageName, vd), vd.getVersion(), parent);
        }

        for (SchemaVersionNumber missing : pkg.unresolvedBranchVersions()) {
            problems.add(SchemaProblem.of(ProblemLevel.ERROR, rootDir.toString(),
                    "package references unknown version number " + missing));
        }
        for (SchemaVersionNumber cyclic : pkg.cyclicBranchVersions()) {
            problems.add(SchemaProblem.of(ProblemLevel.ERROR, rootDir.toString(),
                    "cyclic parent reference for version " + cyclic));
        }
        return new LoadedPackage(pkg, problems);
    }

    /**
     * Reads the version number and parent of one directory; empty when the directory is not a
     * version directory.
     *
     * @throws IllegalArgumentException when the directory name holds a number too large for a version
     */
    Optional<VersionDirectory> describe(Path dir) {
        String dirName = dir.getFileName().toString();
        Path manifest = dir.resolve(MANIFEST_FILE_NAME);
        VersionDirectory.VersionDirectoryBuilder builder = VersionDirectory.builder().directory(dir);
        SchemaVersionNumber version = null;

        if (Files.isRegularFile(manifest)) {
            String source = manifest.toString();
            JsonNode root;
            try {
                root = yamlMapper.readTree(manifest.toFile());
            } catch (IOException e) {
                builder.problem(SchemaProblem.of(ProblemLevel.FATAL, source, "invalid manifest: " + e.getMessage()));
                root = null;
            }
            if (root != null && root.isObject()) {
                if (root.has("parent")) {
                    builder.parentGiven(true);
                    JsonNode val = root.get("parent");
                    if (!val.isNull()) {
                        SchemaVersionNumber parent = toVersion(val);
                        if (parent == null) {
                            builder.problem(SchemaProblem.of(ProblemLevel.ERROR, source,
                                    "parent version cannot be parsed; found " + val));
                        }
                        builder.parent(parent);
                    }
                }
                if (root.has("version")) {
                    version = toVersion(root.get("version"));
                    if (version == null) {
                        builder.problem(SchemaProblem.of(ProblemLevel.ERROR, source,
                                "cannot understand version: " + root.get("version")));
                    }
                }
            } else if (root != null && !root.isMissingNode() && !root.isNull()) {
                builder.problem(SchemaProblem.of(ProblemLevel.FATAL, source, "manifest must be an object"));
            }
        }

        if (version == null) {
            version = versionFromName(dirName);
        }
        if (version == null) {
            return Optional.empty();
        }
        return Optional.of(builder.version(version).build());
    }

    /**
     * Version number held by a name such as {@code v1_2_release}; {@code null} when there is none.
     *
     * @throws IllegalArgumentException when a component does not fit an {@code int}
     */
    public static SchemaVersionNumber versionFromName(String name) {
        Matcher m = VERSION_NAME.matcher(name);
        if (!m.matches()) {
            return null;
        }
        return SchemaVersionNumber.parse(m.group(1));
    }

    private static SchemaVersionNumber toVersion(JsonNode val) {
        if (val.isIntegralNumber()) {
            // int 범위를 넘는 값은 잘라내지 않고 거부한다
            return val.canConvertToInt() && val.intValue() >= 0 ? SchemaVersionNumber.of(val.intValue()) : null;
        }
        if (val.isTextual()) {
            try {
                return versionFromName(val.asText().trim());
            } catch (IllegalArgumentException e) {
                LOGGER.debug("Manifest version {} is out of range: {}", val, e.getMessage());
                return null;
            }
        }
        return null;
    }

    /**
     * Parses every schema file under the version directory, sorted by relative path.
     */
    SchemaVersion loadVersion(String packageName, VersionDirectory vd) {
        LOGGER.debug("Loading {} {} from {}", packageName, vd.getVersion(), vd.getDirectory());
        SchemaVersion.SchemaVersionBuilder version = SchemaVersion.builder()
                .packageName(packageName)
                .version(vd.getVersion())
                .problems(vd.getProblems());

        List<Path> files;
        try (Stream<Path> walk = Files.walk(vd.getDirectory())) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !MANIFEST_FILE_NAME.equals(p.getFileName().toString().trim().toLowerCase(Locale.ROOT)))
                    .filter(p -> SchemaFileParser.isSchemaFile(p.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            return version
                    .problem(SchemaProblem.of(ProblemLevel.FATAL, vd.getDirectory().toString(),
                            "cannot list version directory: " + e.getMessage()))
                    .build();
        }

        SchemaFileParser parser = new SchemaFileParser(new OrderSequencer());
        for (Path file : files) {
            String sourceName = vd.getDirectory().relativize(file).toString().replace('\\', '/');
            ParsedSchema parsed = parser.parse(file, sourceName);
            version.topChanges(parsed.getTopChanges())
                    .schema(parsed.getSchema())
                    .problems(parsed.getProblems());
        }
        return version.build();
    }
}
