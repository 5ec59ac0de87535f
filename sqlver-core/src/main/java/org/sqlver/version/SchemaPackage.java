package org.sqlver.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All the branches of one package.
 *
 * <p>Versions may be registered before their parent. Such a registration is deferred until the
 * parent shows up; pending registrations are kept per blocking parent, so adding a version only
 * re-examines the registrations waiting on exactly that version.
 */
public class SchemaPackage {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaPackage.class);

    private final String packageName;
    private final Map<SchemaVersionNumber, SchemaBranch> branches = new LinkedHashMap<>();
    private final List<SchemaBranch> rootBranches = new ArrayList<>();

    // 부모 버전 -> 그 부모를 기다리는 등록들
    private final Map<SchemaVersionNumber, List<PendingBranch>> pending = new LinkedHashMap<>();

    public SchemaPackage(String packageName) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("packageName must not be blank");
        }
        this.packageName = packageName;
    }

    /**
     * Registers an already parsed version.
     *
     * @param parentVersion the version this one upgrades from, or {@code null} for a root version
     * @return {@code true} when the branch was inserted, {@code false} when it waits for its parent
     */
    public boolean add(SchemaVersion version, SchemaVersionNumber parentVersion) {
        Objects.requireNonNull(version, "version must not be null");
        if (!packageName.equals(version.getPackageName())) {
            throw new IllegalArgumentException("tried to add " + version + " to package " + packageName);
        }
        return register(new PendingBranch(version.getVersion(), parentVersion, version, null));
    }

    /**
     * Registers a version whose content is loaded on first use.
     *
     * @return {@code true} when the branch was inserted, {@code false} when it waits for its parent
     */
    public boolean addLazy(BranchLoader loader, SchemaVersionNumber version, SchemaVersionNumber parentVersion) {
        Objects.requireNonNull(loader, "loader must not be null");
        Objects.requireNonNull(version, "version must not be null");
        return register(new PendingBranch(version, parentVersion, null, loader));
    }

    private boolean register(PendingBranch entry) {
        if (isKnown(entry.version())) {
            throw new IllegalArgumentException("already added branch " + packageName + " : " + entry.version());
        }
        if (entry.parent() != null && !branches.containsKey(entry.parent())) {
            LOGGER.debug("Deferring {} : {} until parent {} is registered", packageName, entry.version(), entry.parent());
            pending.computeIfAbsent(entry.parent(), k -> new ArrayList<>()).add(entry);
            return false;
        }

        Deque<PendingBranch> work = new ArrayDeque<>();
        work.add(entry);
        while (!work.isEmpty()) {
            PendingBranch next = work.poll();
            insert(next);
            List<PendingBranch> waiting = pending.remove(next.version());
            if (waiting != null) {
                LOGGER.debug("Parent {} : {} registered; promoting {} deferred branch(es)",
                        packageName, next.version(), waiting.size());
                work.addAll(waiting);
            }
        }
        return true;
    }

    private void insert(PendingBranch entry) {
        SchemaBranch parent = entry.parent() == null ? null : branches.get(entry.parent());
        SchemaBranch branch = entry.payload() != null
                ? SchemaBranch.loaded(parent, entry.payload())
                : SchemaBranch.lazy(parent, packageName, entry.version(), entry.loader());
        branches.put(entry.version(), branch);
        if (parent == null) {
            rootBranches.add(branch);
        }
        LOGGER.trace("Registered {}", branch);
    }

    private boolean isKnown(SchemaVersionNumber version) {
        if (branches.containsKey(version)) {
            return true;
        }
        return pending.values().stream()
                .flatMap(Collection::stream)
                .anyMatch(p -> p.version().equals(version));
    }

    public String getPackageName() {
        return packageName;
    }

    /** All resolved branches, in registration order. */
    public Collection<SchemaBranch> branches() {
        return Collections.unmodifiableCollection(branches.values());
    }

    public List<SchemaBranch> rootBranches() {
        return Collections.unmodifiableList(rootBranches);
    }

    /** Resolved version numbers, sorted. */
    public List<SchemaVersionNumber> versions() {
        return branches.keySet().stream().sorted().toList();
    }

    public Optional<SchemaBranch> get(SchemaVersionNumber version) {
        return Optional.ofNullable(branches.get(version));
    }

    public boolean contains(SchemaVersionNumber version) {
        return branches.containsKey(version);
    }

    public int size() {
        return branches.size();
    }

    /**
     * The branch with the highest version number, if any branch is resolved.
     */
    public Optional<SchemaBranch> newestVersion() {
        return branches.values().stream()
                .max((a, b) -> a.getVersion().compareTo(b.getVersion()));
    }

    /**
     * Parent versions that deferred registrations declare but that were never registered. Once all
     * input is read, each one is an authoring error.
     */
    public List<SchemaVersionNumber> unresolvedBranchVersions() {
        List<SchemaVersionNumber> deferred = deferredBranchVersions();
        return pending.keySet().stream()
                .filter(v -> !deferred.contains(v))
                .toList();
    }

    /**
     * Deferred versions whose parent chain never reaches an unregistered version: the chain runs
     * back into itself, so none of them can ever be resolved. Includes versions that only hang
     * off such a loop.
     */
    public List<SchemaVersionNumber> cyclicBranchVersions() {
        Map<SchemaVersionNumber, SchemaVersionNumber> parentOf = new LinkedHashMap<>();
        pending.values().stream()
                .flatMap(Collection::stream)
                .forEach(p -> parentOf.put(p.version(), p.parent()));

        List<SchemaVersionNumber> cyclic = new ArrayList<>();
        for (SchemaVersionNumber start : parentOf.keySet()) {
            Set<SchemaVersionNumber> seen = new HashSet<>();
            SchemaVersionNumber current = start;
            while (parentOf.containsKey(current) && seen.add(current)) {
                current = parentOf.get(current);
            }
            // 미등록 부모에서 멈추지 않고 다시 돌아왔으면 순환
            if (parentOf.containsKey(current)) {
                cyclic.add(start);
            }
        }
        return cyclic.stream().sorted().toList();
    }

    /**
     * Versions that are registered but still wait for their parent.
     */
    public List<SchemaVersionNumber> deferredBranchVersions() {
        return pending.values().stream()
                .flatMap(Collection::stream)
                .map(PendingBranch::version)
                .toList();
    }

    @Override
    public String toString() {
        return "SchemaPackage(" + packageName + ", " + branches.size() + " branches)";
    }

    private record PendingBranch(SchemaVersionNumber version, SchemaVersionNumber parent,
                                 SchemaVersion payload, BranchLoader loader) {
    }
}
