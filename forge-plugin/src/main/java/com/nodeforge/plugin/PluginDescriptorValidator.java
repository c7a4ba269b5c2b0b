package com.nodeforge.plugin;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.hooks.HookDescriptor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validation of a {@link PluginDescriptor} before admission. Pure: no registry or
 * runtime state is consulted, and every problem is collected rather than stopping at the first.
 * <p>
 * Checks identity (name format, {@code x.y.z} version, known category), capabilities (non-empty,
 * allowed for the category), dependencies (name, parseable requirement, no self or duplicate
 * entries), hooks (event, handler, positive timeout, unique names per event, dependencies on hooks
 * of the same event including the category's built-ins) and presence of the body.
 */
public final class PluginDescriptorValidator {

    private static final Pattern NAME = Pattern.compile("^[a-z0-9-]+$");

    public ValidationResult validate(PluginDescriptor descriptor) {
        if (descriptor == null) {
            return ValidationResult.failure("descriptor is required");
        }
        List<String> errors = new ArrayList<>();
        validateIdentity(descriptor, errors);
        PluginCategory category = descriptor.getCategory();
        validateCapabilities(descriptor, category, errors);
        validateDependencies(descriptor, errors);
        validateHooks(descriptor, category, errors);
        if (descriptor.getBody() == null) {
            errors.add("execute is required");
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    private static void validateIdentity(PluginDescriptor d, List<String> errors) {
        String name = d.getName();
        if (name == null || name.isBlank()) {
            errors.add("name is required");
        } else if (!NAME.matcher(name).matches()) {
            errors.add("name '" + name + "' must contain only lowercase letters, numbers, and hyphens");
        }
        String version = d.getVersion();
        if (version == null || version.isBlank()) {
            errors.add("version is required");
        } else if (!Version.isValid(version)) {
            errors.add("version '" + version + "' must follow semantic versioning (x.y.z)");
        } else {
            try {
                Version.parse(version);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (d.getCategoryName() == null || d.getCategoryName().isBlank()) {
            errors.add("category is required");
        } else if (d.getCategory() == null) {
            errors.add("category '" + d.getCategoryName() + "' is not one of " + List.of(PluginCategory.values()));
        }
    }

    private static void validateCapabilities(PluginDescriptor d, PluginCategory category, List<String> errors) {
        Map<String, Boolean> capabilities = d.getCapabilities();
        if (capabilities.isEmpty()) {
            errors.add("at least one capability must be defined");
            return;
        }
        CategoryProfile profile = category != null ? CategoryProfile.of(category) : null;
        for (Map.Entry<String, Boolean> e : capabilities.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                errors.add("capability names must be non-blank");
            } else if (e.getValue() == null) {
                errors.add("capability '" + e.getKey() + "' must be true or false");
            } else if (profile != null && !profile.isCapabilityAllowed(e.getKey())) {
                errors.add("capability '" + e.getKey() + "' is not supported by " + category
                        + " plugins (allowed: " + profile.getAllowedCapabilities() + ")");
            }
        }
    }

    private static void validateDependencies(PluginDescriptor d, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < d.getDependencies().size(); i++) {
            DependencySpec dep = d.getDependencies().get(i);
            if (dep == null || dep.getName() == null || dep.getName().isBlank()) {
                errors.add("dependency #" + i + " has no name");
                continue;
            }
            if (dep.getVersionRequirement() == null || dep.getVersionRequirement().isBlank()) {
                errors.add("dependency '" + dep.getName() + "' has no version requirement");
            } else if (!VersionRequirement.isValid(dep.getVersionRequirement())) {
                errors.add("dependency '" + dep.getName() + "' has malformed version requirement '"
                        + dep.getVersionRequirement() + "'");
            }
            if (dep.getName().equals(d.getName())) {
                errors.add("plugin cannot depend on itself");
            }
            if (!seen.add(dep.getName())) {
                errors.add("dependency '" + dep.getName() + "' is declared more than once");
            }
        }
    }

    private static void validateHooks(PluginDescriptor d, PluginCategory category, List<String> errors) {
        Map<LifecycleEvent, Set<String>> namesByEvent = new EnumMap<>(LifecycleEvent.class);
        if (category != null) {
            for (HookDescriptor builtIn : CategoryProfile.of(category).getBuiltInHooks()) {
                namesByEvent.computeIfAbsent(builtIn.getEvent(), e -> new HashSet<>()).add(builtIn.getName());
            }
        }
        List<HookDescriptor> hooks = d.getHooks();
        for (int i = 0; i < hooks.size(); i++) {
            HookDescriptor h = hooks.get(i);
            if (h == null) {
                errors.add("hook #" + i + " is null");
                continue;
            }
            if (h.getEvent() == null) {
                errors.add("hook '" + h.getName() + "' has no event");
            }
            if (h.getHandler() == null) {
                errors.add("hook '" + h.getName() + "' has no handler");
            }
            if (h.getTimeout() != null && (h.getTimeout().isZero() || h.getTimeout().isNegative())) {
                errors.add("hook '" + h.getName() + "' timeout must be positive");
            }
            if (h.getEvent() != null
                    && !namesByEvent.computeIfAbsent(h.getEvent(), e -> new HashSet<>()).add(h.getName())) {
                errors.add("hook name '" + h.getName() + "' is used more than once on " + h.getEvent());
            }
        }
        for (HookDescriptor h : hooks) {
            if (h == null || h.getEvent() == null) continue;
            Set<String> sameEvent = namesByEvent.getOrDefault(h.getEvent(), Set.of());
            for (String dep : h.getDependencies()) {
                if (!sameEvent.contains(dep)) {
                    errors.add("hook '" + h.getName() + "' depends on '" + dep + "', which is not a hook on " + h.getEvent());
                }
            }
        }
    }
}
