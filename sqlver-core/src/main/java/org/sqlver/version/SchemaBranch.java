package org.sqlver.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a package's version tree.
 *
 * <p>The payload is either given up front or loaded through a {@link BranchLoader} the first time
 * {@link #getPayload()} is called; the loaded version is kept afterwards. First resolution is not
 * synchronized.
 */
public final class SchemaBranch {
    private final SchemaBranch parent;
    private final String packageName;
    private final SchemaVersionNumber version;
    private final BranchLoader loader;
    private final List<SchemaBranch> children = new ArrayList<>();

    private Optional<SchemaVersion> payload;

    private SchemaBranch(SchemaBranch parent, String packageName, SchemaVersionNumber version,
                         SchemaVersion payload, BranchLoader loader) {
        this.parent = parent;
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.payload = Optional.ofNullable(payload);
        this.loader = loader;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    static SchemaBranch loaded(SchemaBranch parent, SchemaVersion payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        return new SchemaBranch(parent, payload.getPackageName(), payload.getVersion(), payload, null);
    }

    static SchemaBranch lazy(SchemaBranch parent, String packageName, SchemaVersionNumber version, BranchLoader loader) {
        Objects.requireNonNull(loader, "loader must not be null");
        return new SchemaBranch(parent, packageName, version, null, loader);
    }

    public boolean isLoaded() {
        return payload.isPresent();
    }

    /**
     * Returns the parsed version, loading it on first access.
     *
     * @throws IllegalStateException when the loader returns nothing or a different version
     */
    public SchemaVersion getPayload() {
        if (payload.isEmpty()) {
            SchemaVersion loadedVersion = loader.load(version);
            if (loadedVersion == null) {
                throw new IllegalStateException("loader returned no version for " + this);
            }
            if (!version.equals(loadedVersion.getVersion())) {
                throw new IllegalStateException("loader for " + this + " returned version " + loadedVersion.getVersion());
            }
            payload = Optional.of(loadedVersion);
        }
        return payload.get();
    }

    public Optional<SchemaBranch> getParent() {
        return Optional.ofNullable(parent);
    }

    public List<SchemaBranch> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public String getPackageName() {
        return packageName;
    }

    public SchemaVersionNumber getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "Branch(" + packageName + " : " + version + ")";
    }
}
