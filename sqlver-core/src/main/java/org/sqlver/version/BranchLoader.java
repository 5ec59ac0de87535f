package org.sqlver.version;

/**
 * Loads the content of a lazily registered branch.
 */
@FunctionalInterface
public interface BranchLoader {
    SchemaVersion load(SchemaVersionNumber version);
}
