package com.testbed.plugin;

import java.util.List;

/**
 * Parent of every community plugin jar's class loader. Platform classes and the testbed API
 * packages (plugin SPI, configuration, guest and discover contracts, errors, steps and results)
 * come from the loader that loaded {@link PluginProvider}; any other class, including the
 * bootstrap and the built-in methods, is not visible and must be shipped in the jar itself.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final List<String> PLATFORM_PACKAGES = List.of("java", "javax");

    private static final List<String> LIBRARY_PACKAGES = List.of("org.slf4j", "com.fasterxml.jackson");

    private static final List<String> API_PACKAGES = List.of(
            "com.testbed.plugin",
            "com.testbed.config",
            "com.testbed.guest",
            "com.testbed.discover",
            "com.testbed.errors",
            "com.testbed.steps",
            "com.testbed.result");

    private final ClassLoader apiLoader;

    public RestrictedPluginClassLoader() {
        super(null);
        this.apiLoader = PluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (!isAllowed(name)) {
            throw new ClassNotFoundException(name + " is not part of the plugin API");
        }
        Class<?> c = apiLoader.loadClass(name);
        if (resolve) {
            resolveClass(c);
        }
        return c;
    }

    static boolean isAllowed(String className) {
        return inAny(PLATFORM_PACKAGES, className)
                || inAny(LIBRARY_PACKAGES, className)
                || inAny(API_PACKAGES, className);
    }

    private static boolean inAny(List<String> packages, String className) {
        for (String pkg : packages) {
            if (className.startsWith(pkg) && className.length() > pkg.length()
                    && className.charAt(pkg.length()) == '.') {
                return true;
            }
        }
        return false;
    }
}
