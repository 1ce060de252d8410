package com.lattice.hierarchy;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A named, ordered classification scheme.
 *
 * <p>Levels are kept sorted by level number. Level numbers are unique within a hierarchy but need
 * not be contiguous.
 */
public record Hierarchy(String id, String name, List<HierarchyLevel> levels) {

    public Hierarchy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        levels = levels == null ? List.of() : levels.stream()
                .sorted(Comparator.comparingInt(HierarchyLevel::levelNumber))
                .toList();
        Set<Integer> numbers = new HashSet<>();
        for (HierarchyLevel level : levels) {
            if (!level.hierarchyId().equals(id)) {
                throw new IllegalArgumentException(
                        "level " + level.id() + " belongs to hierarchy " + level.hierarchyId() + ", not " + id);
            }
            if (!numbers.add(level.levelNumber())) {
                throw new IllegalArgumentException(
                        "duplicate level number " + level.levelNumber() + " in hierarchy " + id);
            }
        }
    }

    public Optional<HierarchyLevel> level(String levelId) {
        return levels.stream().filter(level -> level.id().equals(levelId)).findFirst();
    }

    public Optional<HierarchyLevel> levelByNumber(int levelNumber) {
        return levels.stream().filter(level -> level.levelNumber() == levelNumber).findFirst();
    }
}
