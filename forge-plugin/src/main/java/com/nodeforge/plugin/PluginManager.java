package com.nodeforge.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Collects plugin providers from two sources: internal providers (explicitly registered or found
 * on the engine's classpath) and community providers loaded from JARs in a plugins directory with
 * a {@link RestrictedPluginClassLoader}.
 * <p>
 * Community load failures (unreadable JAR, broken service file, provider constructor failure) are
 * logged and skipped. Registration of internal providers is expected to be fatal on failure;
 * the caller decides that.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> internalProviders = new ArrayList<>();
    private final List<PluginProvider> communityProviders = new ArrayList<>();
    private final List<URLClassLoader> communityLoaders = new ArrayList<>();

    /** Registers an internal provider. Null is ignored. */
    public void registerInternal(PluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Discovers internal providers on the engine's class path, then community providers in the
     * {@code *.jar} files of {@code pluginsDir} (JARs in name order; may be null).
     *
     * @return number of providers found, internal and community
     * @throws ServiceConfigurationError if an internal provider cannot be loaded
     */
    public int discover(ClassLoader engineLoader, Path pluginsDir) {
        int found = discoverInternal(engineLoader);
        for (Path jar : communityJars(pluginsDir)) {
            found += loadCommunityJar(jar);
        }
        return found;
    }

    /**
     * Registers every provider found by {@link ServiceLoader} through the given class loader as
     * internal. A provider that fails to instantiate fails the whole discovery.
     *
     * @return number of providers found
     */
    public int discoverInternal(ClassLoader loader) {
        int n = collect(ServiceLoader.load(PluginProvider.class, loader), internalProviders, "the classpath", false);
        if (n > 0) {
            log.info("Discovered {} internal plugin provider(s) on the classpath", n);
        }
        return n;
    }

    /**
     * Walks a provider stream into {@code sink}. A community source stops at its first broken
     * provider (logged) and keeps what it loaded so far; an internal source rethrows.
     */
    private static int collect(ServiceLoader<PluginProvider> providers, List<PluginProvider> sink, String source,
                               boolean community) {
        Iterator<PluginProvider> it = providers.iterator();
        int n = 0;
        while (true) {
            PluginProvider provider;
            try {
                if (!it.hasNext()) {
                    return n;
                }
                provider = it.next();
            } catch (ServiceConfigurationError | LinkageError e) {
                if (!community) {
                    throw e;
                }
                log.error("Community plugin provider from {} failed to load (skipping the rest of it): {}",
                        source, e.getMessage(), e);
                return n;
            }
            sink.add(provider);
            n++;
        }
    }

    /** {@code *.jar} files directly in the directory, sorted by name; empty when it is absent. */
    private static List<Path> communityJars(Path pluginsDir) {
        List<Path> jars = new ArrayList<>();
        if (pluginsDir == null) {
            return jars;
        }
        if (!Files.isDirectory(pluginsDir)) {
            if (Files.exists(pluginsDir)) {
                log.warn("Community plugins path is not a directory: {}", pluginsDir);
            } else {
                log.debug("Community plugins directory does not exist: {}", pluginsDir);
            }
            return jars;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list community plugins directory {}: {}", pluginsDir, e.getMessage());
        }
        jars.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return jars;
    }

    private int loadCommunityJar(Path jar) {
        URLClassLoader loader;
        try {
            loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, new RestrictedPluginClassLoader());
        } catch (IOException e) {
            log.error("Failed to open community plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            return 0;
        }
        communityLoaders.add(loader);
        int n = collect(ServiceLoader.load(PluginProvider.class, loader), communityProviders,
                "JAR " + jar.getFileName(), true);
        if (n > 0) {
            log.info("Loaded {} provider(s) from community JAR: {}", n, jar.getFileName());
        }
        return n;
    }

    public List<PluginProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    public List<PluginProvider> getCommunityProviders() {
        return new ArrayList<>(communityProviders);
    }

    /** Internal providers first, then community providers. */
    public List<PluginProvider> getProviders() {
        List<PluginProvider> out = new ArrayList<>(internalProviders.size() + communityProviders.size());
        out.addAll(internalProviders);
        out.addAll(communityProviders);
        return out;
    }

    /** Closes the class loaders of community JARs. */
    public void close() {
        for (URLClassLoader loader : communityLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close community plugin class loader: {}", e.getMessage());
            }
        }
        communityLoaders.clear();
    }
}
