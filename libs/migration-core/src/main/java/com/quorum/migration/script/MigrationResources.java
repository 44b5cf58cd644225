package com.quorum.migration.script;

import com.quorum.migration.error.DuplicateVersionException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable registry of migration scripts, ordered by ascending version.
 *
 * <p>Construction validates the input before anything touches the cluster: versions must be
 * positive and unique, otherwise a {@link DuplicateVersionException} or
 * {@link IllegalArgumentException} is thrown. The input order does not matter.
 */
public final class MigrationResources implements Iterable<MigrationScript> {

    private static final MigrationResources EMPTY = new MigrationResources(new TreeMap<>());

    private final Map<Integer, MigrationScript> byVersion;
    private final List<MigrationScript> scripts;

    private MigrationResources(TreeMap<Integer, MigrationScript> byVersion) {
        this.byVersion = Collections.unmodifiableMap(byVersion);
        this.scripts = List.copyOf(byVersion.values());
    }

    /** A registry without scripts; a run against it does nothing. */
    public static MigrationResources empty() {
        return EMPTY;
    }

    /**
     * Registry of the given scripts, in any order.
     *
     * @throws DuplicateVersionException if two scripts share a version
     */
    public static MigrationResources of(MigrationScript... scripts) {
        return of(Arrays.asList(scripts));
    }

    public static MigrationResources of(Collection<? extends MigrationScript> scripts) {
        return builder().addAll(scripts).build();
    }

    /** Builder for registries assembled from several sources. */
    public static Builder builder() {
        return new Builder();
    }

    /** Scripts in ascending version order. */
    public List<MigrationScript> scripts() {
        return scripts;
    }

    /** Versions in ascending order. */
    public List<Integer> versions() {
        return List.copyOf(byVersion.keySet());
    }

    /** Script registered under the version, empty if none. */
    public Optional<MigrationScript> find(int version) {
        return Optional.ofNullable(byVersion.get(version));
    }

    /**
     * Returns the script with the lowest version.
     *
     * @throws NoSuchElementException if the registry is empty
     */
    public MigrationScript first() {
        if (scripts.isEmpty()) {
            throw new NoSuchElementException("registry is empty");
        }
        return scripts.get(0);
    }

    public boolean isEmpty() {
        return scripts.isEmpty();
    }

    public int size() {
        return scripts.size();
    }

    @Override
    public Iterator<MigrationScript> iterator() {
        return scripts.iterator();
    }

    @Override
    public String toString() {
        return "MigrationResources" + versions();
    }

    static void requirePositive(int version) {
        if (version <= 0) {
            throw new IllegalArgumentException("Migration version must be positive, got " + version);
        }
    }

    /** Collects scripts and validates them on {@link #build()}. */
    public static final class Builder {

        private final List<MigrationScript> scripts = new ArrayList<>();

        private Builder() {}

        public Builder add(MigrationScript script) {
            scripts.add(Objects.requireNonNull(script, "script must not be null"));
            return this;
        }

        public Builder addAll(Collection<? extends MigrationScript> scripts) {
            scripts.forEach(this::add);
            return this;
        }

        /**
         * Builds the registry.
         *
         * @throws DuplicateVersionException if two scripts share a version
         * @throws IllegalArgumentException if a version is not positive
         */
        public MigrationResources build() {
            TreeMap<Integer, MigrationScript> byVersion = new TreeMap<>();
            for (MigrationScript script : scripts) {
                requirePositive(script.version());
                MigrationScript existing = byVersion.putIfAbsent(script.version(), script);
                if (existing != null) {
                    throw new DuplicateVersionException(
                            script.version(), existing.description(), script.description());
                }
            }
            return byVersion.isEmpty() ? EMPTY : new MigrationResources(byVersion);
        }
    }
}
