package com.nodeforge.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void discoverInternal_findsServiceLoaderProviders() {
        PluginManager manager = new PluginManager();

        int found = manager.discoverInternal(PluginManagerTest.class.getClassLoader());

        assertEquals(1, found);
        PluginDescriptor d = manager.getInternalProviders().get(0).getDescriptor();
        assertEquals("api-core", d.getName());
        assertEquals("1.4.0", d.getVersion());
    }

    @Test
    void registerInternal_ignoresNull() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(null);
        manager.registerInternal(new ManifestPluginProvider());

        assertEquals(1, manager.getProviders().size());
    }

    private Path jarWithServiceFile(String fileName, String providerClass) throws Exception {
        Path jar = tempDir.resolve(fileName);
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            out.putNextEntry(new JarEntry("META-INF/services/" + PluginProvider.class.getName()));
            out.write((providerClass + "\n").getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        return jar;
    }

    @Test
    void discover_toleratesMissingDirectory() {
        PluginManager manager = new PluginManager();

        int found = manager.discover(PluginManagerTest.class.getClassLoader(), tempDir.resolve("absent"));

        assertEquals(1, found);
        assertTrue(manager.getCommunityProviders().isEmpty());
    }

    @Test
    void discover_loadsCommunityJarsAndSkipsBrokenOnes() throws Exception {
        jarWithServiceFile("a-good.jar", ManifestPluginProvider.class.getName());
        jarWithServiceFile("b-denied.jar", "com.nodeforge.orchestrator.CategoryOrchestrator");
        Files.writeString(tempDir.resolve("c-broken.jar"), "not a jar");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");
        PluginManager manager = new PluginManager();

        int found = manager.discover(PluginManagerTest.class.getClassLoader(), tempDir);

        assertEquals(2, found);
        assertEquals(1, manager.getCommunityProviders().size());
        assertEquals("api-core", manager.getCommunityProviders().get(0).getDescriptor().getName());
        assertEquals(2, manager.getProviders().size());
        manager.close();
    }

    @Test
    void restrictedLoader_allowsOnlyPluginFacingPackages() {
        assertTrue(RestrictedPluginClassLoader.isAllowed("com.nodeforge.plugin.PluginDescriptor"));
        assertTrue(RestrictedPluginClassLoader.isAllowed("org.slf4j.Logger"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.nodeforge.orchestrator.CategoryOrchestrator"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.nodeforge.lifecycle.PluginLifecycle"));
    }
}
