package com.nodeforge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON metadata of a plugin: everything in a {@link PluginDescriptor} except the callables.
 * Providers typically ship a manifest as a resource and complete it with
 * {@link #toDescriptorBuilder()}.
 * <pre>
 * {"name":"openapi-generator","version":"1.2.0","category":"api",
 *  "capabilities":{"design":true,"document":true},
 *  "dependencies":[{"name":"api-core","version":"&gt;=1.0.0"}],"priority":40}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PluginManifest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String name;
    private final String version;
    private final String category;
    private final String description;
    private final String author;
    private final Map<String, Boolean> capabilities;
    private final List<DependencySpec> dependencies;
    private final Integer priority;

    @JsonCreator
    public PluginManifest(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("category") String category,
            @JsonProperty("description") String description,
            @JsonProperty("author") String author,
            @JsonProperty("capabilities") Map<String, Boolean> capabilities,
            @JsonProperty("dependencies") List<DependencySpec> dependencies,
            @JsonProperty("priority") Integer priority) {
        this.name = name;
        this.version = version;
        this.category = category;
        this.description = description;
        this.author = author;
        this.capabilities = capabilities != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(capabilities)) : Map.of();
        this.dependencies = dependencies != null
                ? Collections.unmodifiableList(new ArrayList<>(dependencies)) : List.of();
        this.priority = priority;
    }

    /** Metadata of an existing descriptor. */
    public static PluginManifest from(PluginDescriptor d) {
        return new PluginManifest(d.getName(), d.getVersion(), d.getCategoryName(), d.getDescription(),
                d.getAuthor(), d.getCapabilities(), d.getDependencies(), d.getPriority());
    }

    public static PluginManifest fromJson(String json) {
        try {
            return MAPPER.readValue(json, PluginManifest.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid plugin manifest JSON", e);
        }
    }

    public static PluginManifest fromStream(InputStream in) {
        try {
            return MAPPER.readValue(in, PluginManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read plugin manifest", e);
        }
    }

    /**
     * Reads a manifest from the classpath of the given class.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static PluginManifest fromResource(Class<?> owner, String resource) {
        try (InputStream in = owner.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Plugin manifest not found: " + resource);
            }
            return fromStream(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read plugin manifest " + resource, e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize plugin manifest", e);
        }
    }

    /** Builder pre-filled with this manifest's metadata; callers add body, hooks and callbacks. */
    public PluginDescriptor.Builder toDescriptorBuilder() {
        return PluginDescriptor.builder()
                .name(name)
                .version(version)
                .category(category)
                .description(description)
                .author(author)
                .capabilities(capabilities)
                .dependencies(dependencies)
                .priority(priority != null ? priority : PluginDescriptor.DEFAULT_PRIORITY);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("category")
    public String getCategory() {
        return category;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("author")
    public String getAuthor() {
        return author;
    }

    @JsonProperty("capabilities")
    public Map<String, Boolean> getCapabilities() {
        return capabilities;
    }

    @JsonProperty("dependencies")
    public List<DependencySpec> getDependencies() {
        return dependencies;
    }

    @JsonProperty("priority")
    public Integer getPriority() {
        return priority;
    }
}
