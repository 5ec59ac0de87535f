package org.sqlver.cli.service;

import org.sqlver.loader.LoadedPackage;
import org.sqlver.loader.PackageLoader;
import org.sqlver.version.SchemaBranch;
import org.sqlver.version.SchemaPackage;
import org.sqlver.version.SchemaVersionNumber;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves package sources given on the command line.
 * A source is a package directory, optionally followed by {@code @version}.
 */
public class PackageService {

    private final PackageLoader loader;

    public PackageService() {
        this(new PackageLoader());
    }

    public PackageService(PackageLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    /**
     * A package directory and the requested version, {@code null} for the newest one.
     */
    public record SourceRef(String text, Path directory, SchemaVersionNumber version) {

        /**
         * Splits {@code dir@1.2}. The part after the last {@code '@'} is only taken as a version
         * when it is one, so directories containing {@code '@'} still work.
         */
        public static SourceRef parse(String text) {
            int at = text.lastIndexOf('@');
            if (at > 0) {
                SchemaVersionNumber v = PackageLoader.versionFromName(text.substring(at + 1).trim());
                if (v != null) {
                    return new SourceRef(text, Path.of(text.substring(0, at)), v);
                }
            }
            return new SourceRef(text, Path.of(text), null);
        }
    }

    /**
     * Loads the package directory of the source.
     *
     * @throws IOException if the directory does not exist or cannot be read
     */
    public LoadedPackage load(SourceRef source) throws IOException {
        if (!Files.isDirectory(source.directory())) {
            throw new IOException("Package directory not found: " + source.directory());
        }
        return loader.load(source.directory());
    }

    /**
     * Picks the requested version, or the newest one.
     *
     * @throws IllegalArgumentException when the package has no such version or no versions at all
     */
    public SchemaBranch selectBranch(SchemaPackage pkg, SchemaVersionNumber version) {
        if (version == null) {
            return pkg.newestVersion()
                    .orElseThrow(() -> new IllegalArgumentException("package " + pkg.getPackageName() + " has no versions"));
        }
        return pkg.get(version)
                .orElseThrow(() -> new IllegalArgumentException("package " + pkg.getPackageName()
                        + " has no version " + version));
    }
}
