package com.nodeforge.plugin;

import java.util.Objects;

/**
 * Version requirement of a dependency: {@code >=x.y.z}, a bare {@code x.y.z} (also "at least"),
 * or {@code *} for any version.
 */
public final class VersionRequirement {

    private static final String ANY = "*";
    private static final String AT_LEAST = ">=";

    private static final VersionRequirement ANY_VERSION = new VersionRequirement(ANY, null);

    private final String text;
    private final Version minimum;

    private VersionRequirement(String text, Version minimum) {
        this.text = text;
        this.minimum = minimum;
    }

    public static VersionRequirement any() {
        return ANY_VERSION;
    }

    public static boolean isValid(String requirement) {
        try {
            parse(requirement);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException if the requirement is blank or malformed
     */
    public static VersionRequirement parse(String requirement) {
        Objects.requireNonNull(requirement, "requirement");
        String r = requirement.trim();
        if (r.isEmpty()) {
            throw new IllegalArgumentException("Version requirement must be non-blank");
        }
        if (ANY.equals(r)) {
            return ANY_VERSION;
        }
        String version = r.startsWith(AT_LEAST) ? r.substring(AT_LEAST.length()).trim() : r;
        return new VersionRequirement(AT_LEAST + version, Version.parse(version));
    }

    public boolean isSatisfiedBy(String version) {
        return isSatisfiedBy(Version.parse(version));
    }

    public boolean isSatisfiedBy(Version version) {
        return minimum == null || version.isAtLeast(minimum);
    }

    /** Minimum version, or null for {@code *}. */
    public Version getMinimum() {
        return minimum;
    }

    @Override
    public String toString() {
        return text;
    }
}
