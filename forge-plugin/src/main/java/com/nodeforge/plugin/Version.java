package com.nodeforge.plugin;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version triple compared numerically ({@code 1.9.0 < 1.10.0}).
 */
public final class Version implements Comparable<Version> {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private final int major;
    private final int minor;
    private final int patch;

    private Version(int major, int minor, int patch) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /** Whether the string is a plain {@code major.minor.patch} triple. */
    public static boolean isValid(String version) {
        return version != null && FORMAT.matcher(version).matches();
    }

    /**
     * Parses {@code major.minor.patch}.
     *
     * @throws IllegalArgumentException if the format is invalid or a part overflows an int
     */
    public static Version parse(String version) {
        Objects.requireNonNull(version, "version");
        Matcher m = FORMAT.matcher(version);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version format: " + version + " (expected major.minor.patch)");
        }
        try {
            return new Version(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version numbers in: " + version, e);
        }
    }

    /** Compares two version strings; returns -1, 0 or 1. */
    public static int compare(String a, String b) {
        return Integer.signum(parse(a).compareTo(parse(b)));
    }

    /** True when {@code have} is at least {@code want}. */
    public static boolean satisfies(String have, String want) {
        return compare(have, want) >= 0;
    }

    @Override
    public int compareTo(Version other) {
        Objects.requireNonNull(other, "other");
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        return Integer.compare(patch, other.patch);
    }

    public boolean isAtLeast(Version minimum) {
        return compareTo(minimum) >= 0;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Version other = (Version) obj;
        return major == other.major && minor == other.minor && patch == other.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }
}
