package com.nodeforge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Dependency on another plugin of the same category: a name and a version requirement string. */
public final class DependencySpec {

    private final String name;
    private final String versionRequirement;

    @JsonCreator
    public DependencySpec(
            @JsonProperty("name") String name,
            @JsonProperty("version") String versionRequirement) {
        this.name = name;
        this.versionRequirement = versionRequirement;
    }

    public static DependencySpec of(String name, String versionRequirement) {
        return new DependencySpec(name, versionRequirement);
    }

    /** Dependency on any version of the named plugin. */
    public static DependencySpec any(String name) {
        return new DependencySpec(name, "*");
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("version")
    public String getVersionRequirement() {
        return versionRequirement;
    }

    /** Parsed requirement; only call after validation. */
    public VersionRequirement requirement() {
        return VersionRequirement.parse(versionRequirement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencySpec)) return false;
        DependencySpec that = (DependencySpec) o;
        return Objects.equals(name, that.name) && Objects.equals(versionRequirement, that.versionRequirement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, versionRequirement);
    }

    @Override
    public String toString() {
        return name + "@" + versionRequirement;
    }
}
