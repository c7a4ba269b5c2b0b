package com.nodeforge.plugin;

import com.nodeforge.hooks.HookDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable declaration of a plugin: identity (name, version, category), capabilities,
 * dependencies on other plugins of the category, hooks and the callables that implement it.
 * <p>
 * The builder accepts incomplete input; {@link PluginDescriptorValidator} reports every
 * structural problem before a descriptor is admitted. Hooks built without a name are named
 * {@code <event>#<index>} by their position in the hook list.
 */
public final class PluginDescriptor {

    /** Priority of plugins that declare none. */
    public static final int DEFAULT_PRIORITY = 50;

    private final String name;
    private final String version;
    private final String categoryName;
    private final String description;
    private final String author;
    private final Map<String, Boolean> capabilities;
    private final List<DependencySpec> dependencies;
    private final List<HookDescriptor> hooks;
    private final PluginBody body;
    private final PluginInitializer initializer;
    private final PluginTeardown teardown;
    private final int priority;

    private PluginDescriptor(Builder b) {
        this.name = b.name;
        this.version = b.version;
        this.categoryName = b.categoryName;
        this.description = b.description;
        this.author = b.author;
        this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(b.capabilities));
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(b.dependencies));
        List<HookDescriptor> named = new ArrayList<>(b.hooks.size());
        for (int i = 0; i < b.hooks.size(); i++) {
            HookDescriptor h = b.hooks.get(i);
            if (h != null && h.getName() == null) {
                String event = h.getEvent() != null ? h.getEvent().toValue() : "hook";
                h = h.named(event + "#" + i);
            }
            named.add(h);
        }
        this.hooks = Collections.unmodifiableList(named);
        this.body = b.body;
        this.initializer = b.initializer;
        this.teardown = b.teardown;
        this.priority = b.priority;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /** Category as declared, possibly unknown. */
    public String getCategoryName() {
        return categoryName;
    }

    /** Declared category, or null when missing or unknown. */
    public PluginCategory getCategory() {
        return PluginCategory.find(categoryName);
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    public Map<String, Boolean> getCapabilities() {
        return capabilities;
    }

    /** True when the capability is declared and enabled. */
    public boolean hasCapability(String capability) {
        return Boolean.TRUE.equals(capabilities.get(capability));
    }

    public List<DependencySpec> getDependencies() {
        return dependencies;
    }

    /** Names of the plugins this one depends on, in declaration order. */
    public List<String> getDependencyNames() {
        List<String> out = new ArrayList<>(dependencies.size());
        for (DependencySpec d : dependencies) {
            if (d != null) out.add(d.getName());
        }
        return out;
    }

    /** Hooks declared by the plugin, excluding category built-ins. */
    public List<HookDescriptor> getHooks() {
        return hooks;
    }

    public PluginBody getBody() {
        return body;
    }

    /** Initializer, or null when the plugin needs none. */
    public PluginInitializer getInitializer() {
        return initializer;
    }

    /** Teardown, or null when the plugin needs none. */
    public PluginTeardown getTeardown() {
        return teardown;
    }

    public int getPriority() {
        return priority;
    }

    /** Copy of this descriptor without the named hook. */
    public PluginDescriptor withoutHook(String hookName) {
        List<HookDescriptor> remaining = new ArrayList<>(hooks);
        remaining.removeIf(h -> h != null && hookName.equals(h.getName()));
        return toBuilder().hooks(remaining).build();
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .version(version)
                .category(categoryName)
                .description(description)
                .author(author)
                .capabilities(capabilities)
                .dependencies(dependencies)
                .hooks(hooks)
                .body(body)
                .initializer(initializer)
                .teardown(teardown)
                .priority(priority);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PluginDescriptor{" + categoryName + "/" + name + "@" + version + "}";
    }

    public static final class Builder {
        private String name;
        private String version;
        private String categoryName;
        private String description;
        private String author;
        private Map<String, Boolean> capabilities = new LinkedHashMap<>();
        private List<DependencySpec> dependencies = new ArrayList<>();
        private List<HookDescriptor> hooks = new ArrayList<>();
        private PluginBody body;
        private PluginInitializer initializer;
        private PluginTeardown teardown;
        private int priority = DEFAULT_PRIORITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder category(String category) {
            this.categoryName = category;
            return this;
        }

        public Builder category(PluginCategory category) {
            this.categoryName = category != null ? category.toValue() : null;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder capabilities(Map<String, Boolean> capabilities) {
            this.capabilities = capabilities != null ? new LinkedHashMap<>(capabilities) : new LinkedHashMap<>();
            return this;
        }

        public Builder capability(String capability, boolean enabled) {
            this.capabilities.put(capability, enabled);
            return this;
        }

        public Builder dependencies(List<DependencySpec> dependencies) {
            this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
            return this;
        }

        public Builder dependsOn(String pluginName, String versionRequirement) {
            this.dependencies.add(DependencySpec.of(pluginName, versionRequirement));
            return this;
        }

        public Builder hooks(List<HookDescriptor> hooks) {
            this.hooks = hooks != null ? new ArrayList<>(hooks) : new ArrayList<>();
            return this;
        }

        public Builder hook(HookDescriptor... hooks) {
            this.hooks.addAll(Arrays.asList(hooks));
            return this;
        }

        public Builder body(PluginBody body) {
            this.body = body;
            return this;
        }

        public Builder initializer(PluginInitializer initializer) {
            this.initializer = initializer;
            return this;
        }

        public Builder teardown(PluginTeardown teardown) {
            this.teardown = teardown;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public PluginDescriptor build() {
            return new PluginDescriptor(this);
        }
    }
}
