package com.nodeforge.plugin;

/**
 * Parent classloader for community plugin JARs. Only the packages a plugin needs to declare itself
 * are visible; any other class request throws {@link ClassNotFoundException}, so community code
 * cannot reach the orchestrator, lifecycle or bootstrap internals.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.nodeforge.plugin.*},
 * {@code com.nodeforge.hooks.*}, {@code com.nodeforge.annotations.*},
 * {@code com.nodeforge.executioncontext.*}, {@code org.slf4j.*}, {@code com.fasterxml.jackson.*}
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.nodeforge.plugin.",
            "com.nodeforge.hooks.",
            "com.nodeforge.annotations.",
            "com.nodeforge.executioncontext.",
            "org.slf4j.",
            "com.fasterxml.jackson."
    };

    private final ClassLoader engineLoader;

    public RestrictedPluginClassLoader() {
        super(null);
        this.engineLoader = PluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isAllowed(name)) {
                    throw new ClassNotFoundException("Access denied for community plugin: " + name);
                }
                c = engineLoader.loadClass(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
