package com.streamwarden.common.level;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of {@link UserLevel} bits.
 * <p>
 * The ranked-vs-flag distinction lives here ({@link #satisfiesRank} and
 * {@link #hasFlag}) so callers never re-derive it.
 */
public final class UserLevels {

    private static final UserLevels NONE = new UserLevels(EnumSet.noneOf(UserLevel.class));
    public static final UserLevels VIEWER = of(UserLevel.VIEWER);

    private final Set<UserLevel> bits;

    private UserLevels(EnumSet<UserLevel> bits) {
        this.bits = Collections.unmodifiableSet(bits);
    }

    public static UserLevels none() {
        return NONE;
    }

    public static UserLevels of(UserLevel first, UserLevel... rest) {
        return new UserLevels(EnumSet.of(first, rest));
    }

    public static UserLevels copyOf(Collection<UserLevel> levels) {
        if (levels == null || levels.isEmpty()) {
            return NONE;
        }
        return new UserLevels(EnumSet.copyOf(levels));
    }

    /**
     * JSON form: an array of level names, parsed leniently.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UserLevels fromNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            return NONE;
        }
        EnumSet<UserLevel> set = EnumSet.noneOf(UserLevel.class);
        for (String name : names) {
            set.add(UserLevel.parse(name));
        }
        return new UserLevels(set);
    }

    @JsonValue
    public List<String> toNames() {
        List<String> names = new ArrayList<>(bits.size());
        for (UserLevel level : bits) {
            names.add(level.name());
        }
        return names;
    }

    public boolean has(UserLevel level) {
        return bits.contains(level);
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public Set<UserLevel> asSet() {
        return bits;
    }

    public UserLevels union(UserLevels other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        EnumSet<UserLevel> merged = bits.isEmpty() ? EnumSet.noneOf(UserLevel.class) : EnumSet.copyOf(bits);
        merged.addAll(other.bits);
        return new UserLevels(merged);
    }

    public UserLevels with(UserLevel level) {
        return union(of(level));
    }

    /**
     * Lowest rank among the ranked bits of this set, or 0 when it holds none.
     */
    public int rankThreshold() {
        int threshold = 0;
        for (UserLevel level : bits) {
            if (level.isRanked() && (threshold == 0 || level.rank() < threshold)) {
                threshold = level.rank();
            }
        }
        return threshold;
    }

    /**
     * Whether a held ranked level satisfies the ranked part of a requirement.
     * Holding a higher rank satisfies any threshold at or below it.
     */
    public static boolean satisfiesRank(UserLevel held, UserLevels required) {
        if (held == null || !held.isRanked() || required == null) {
            return false;
        }
        int threshold = required.rankThreshold();
        return threshold > 0 && held.rank() >= threshold;
    }

    /**
     * Whether a held flag level is explicitly named by a requirement.
     */
    public static boolean hasFlag(UserLevel held, UserLevels required) {
        if (held == null || !held.isFlag() || required == null) {
            return false;
        }
        return required.has(held);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserLevels other)) return false;
        return bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        if (bits.isEmpty()) {
            return "NONE";
        }
        return bits.stream().map(Enum::name).collect(Collectors.joining("|"));
    }
}
