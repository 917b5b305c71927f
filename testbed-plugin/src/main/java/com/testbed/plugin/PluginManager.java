package com.testbed.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Collects step method providers: built-in methods registered explicitly and community methods
 * found in {@code *.jar} files of the plugins directory. Community jars are loaded in name order,
 * each through its own class loader on top of {@link RestrictedPluginClassLoader}. A community
 * provider that claims a step/method pair already taken is skipped.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> internalProviders = new ArrayList<>();
    private final List<PluginProvider> communityProviders = new ArrayList<>();
    private final Map<PluginProvider, Path> communitySources = new IdentityHashMap<>();
    private final Set<String> claimedMethods = new HashSet<>();
    // Loaders stay referenced for as long as their providers are in use.
    private final List<URLClassLoader> communityLoaders = new ArrayList<>();

    /** Registers a built-in provider (on the classpath). */
    public void registerInternal(PluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
            claimedMethods.add(key(provider));
        }
    }

    /**
     * Loads community providers from the {@code *.jar} files in the given directory. A jar
     * that cannot be read or whose service file names a missing or denied class is logged and
     * skipped; the remaining jars still load.
     *
     * @param pluginsDir plugins directory; null or missing = nothing to load
     */
    public void loadCommunityPlugins(Path pluginsDir) {
        if (pluginsDir == null) {
            return;
        }
        if (!Files.isDirectory(pluginsDir)) {
            if (Files.exists(pluginsDir)) {
                log.warn("Plugins path is not a directory | path={}", pluginsDir);
            } else {
                log.debug("Plugins directory not found | path={}", pluginsDir);
            }
            return;
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            stream.forEach(jars::add);
        } catch (IOException e) {
            log.warn("Cannot list plugins directory | path={} | error={}", pluginsDir, e.getMessage());
            return;
        }
        jars.sort(null);
        for (Path jar : jars) {
            loadCommunityJar(jar);
        }
    }

    private void loadCommunityJar(Path jar) {
        List<PluginProvider> found = new ArrayList<>();
        try {
            URLClassLoader loader = new URLClassLoader(
                    new URL[]{jar.toUri().toURL()}, new RestrictedPluginClassLoader());
            communityLoaders.add(loader);
            ServiceLoader.load(PluginProvider.class, loader).forEach(found::add);
        } catch (Exception | ServiceConfigurationError e) {
            log.error("Skipping plugin jar | jar={} | error={}", jar.getFileName(), e.getMessage(), e);
            return;
        }
        int accepted = 0;
        for (PluginProvider provider : found) {
            try {
                if (accept(provider, jar)) {
                    accepted++;
                }
            } catch (RuntimeException e) {
                log.error("Skipping faulty provider | jar={} | provider={} | error={}",
                        jar.getFileName(), provider.getClass().getName(), e.getMessage(), e);
            }
        }
        log.info("Loaded plugin jar | jar={} | methods={}", jar.getFileName(), accepted);
    }

    private boolean accept(PluginProvider provider, Path jar) {
        String stepName = provider.getStepName();
        String methodName = provider.getMethodName();
        if (stepName == null || stepName.isBlank() || methodName == null || methodName.isBlank()) {
            log.warn("Skipping provider without step or method name | jar={} | provider={}",
                    jar.getFileName(), provider.getClass().getName());
            return false;
        }
        if (!claimedMethods.add(key(provider))) {
            log.warn("Skipping provider for a method that is already provided | jar={} | method={}/{}",
                    jar.getFileName(), stepName, methodName);
            return false;
        }
        communityProviders.add(provider);
        communitySources.put(provider, jar);
        return true;
    }

    private static String key(PluginProvider provider) {
        return provider.getStepName() + "/" + provider.getMethodName();
    }

    /** Built-in providers; a registration failure among these is fatal. */
    public List<PluginProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    /** Community providers in jar name order; registration failures are logged and skipped. */
    public List<PluginProvider> getCommunityProviders() {
        return new ArrayList<>(communityProviders);
    }

    /** Jar a community provider was loaded from; null for built-in providers. */
    public Path getSource(PluginProvider provider) {
        return communitySources.get(provider);
    }

    /** All providers: internal first, then community. */
    public List<PluginProvider> getProviders() {
        List<PluginProvider> out = new ArrayList<>(internalProviders.size() + communityProviders.size());
        out.addAll(internalProviders);
        out.addAll(communityProviders);
        return out;
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getCommunityCount() {
        return communityProviders.size();
    }
}
