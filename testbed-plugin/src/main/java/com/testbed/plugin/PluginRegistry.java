package com.testbed.plugin;

import com.testbed.config.StepData;
import com.testbed.errors.SpecificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of step methods by step name and method name. Populated once at process start
 * (see {@code TestbedBootstrap}) and read when steps wake up: {@link #delegate} turns one
 * configuration record into one plugin instance bound to its step.
 */
public final class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private static final PluginRegistry INSTANCE = new PluginRegistry();

    /** stepName → (methodName → provider) */
    private final Map<String, Map<String, PluginProvider>> providersByStep = new ConcurrentHashMap<>();

    /** Process-wide registry. */
    public static PluginRegistry getInstance() {
        return INSTANCE;
    }

    /** Creates an empty registry; production code uses {@link #getInstance()}. */
    public PluginRegistry() {
    }

    /**
     * Registers a provider under its step and method name.
     *
     * @throws IllegalArgumentException if the method name is blank or already registered for the step
     */
    public void register(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String stepName = Objects.requireNonNull(provider.getStepName(), "stepName").trim();
        String methodName = Objects.requireNonNull(provider.getMethodName(), "methodName").trim();
        if (stepName.isEmpty() || methodName.isEmpty()) {
            throw new IllegalArgumentException("Step and method name must be non-blank: " + provider);
        }
        Map<String, PluginProvider> byMethod = providersByStep.computeIfAbsent(stepName, k -> new ConcurrentHashMap<>());
        if (byMethod.putIfAbsent(methodName, provider) != null) {
            throw new IllegalArgumentException("Method already registered for step " + stepName + ": " + methodName);
        }
        log.debug("Registered method {} for step {} (order={}, version={})",
                methodName, stepName, provider.getOrder(), provider.getVersion());
    }

    /**
     * Methods registered for the step, lowest order first.
     */
    public List<Method> getMethods(String stepName) {
        Map<String, PluginProvider> byMethod = providersByStep.get(stepName);
        if (byMethod == null) return List.of();
        List<Method> methods = new ArrayList<>();
        for (PluginProvider p : byMethod.values()) {
            methods.add(p.getMethod());
        }
        methods.sort(Method.BY_ORDER);
        return methods;
    }

    /**
     * Finds the provider for {@code how}: an exact method name first, otherwise the
     * lowest-order method whose name starts with {@code how}.
     *
     * @throws SpecificationException if no method matches
     */
    public PluginProvider resolve(String stepName, String how) {
        if (how == null || how.isBlank()) {
            throw new SpecificationException("Missing 'how' in the " + stepName + " step configuration.");
        }
        String wanted = how.trim();
        Map<String, PluginProvider> byMethod = providersByStep.getOrDefault(stepName, Map.of());
        PluginProvider exact = byMethod.get(wanted);
        if (exact != null) return exact;
        for (Method method : getMethods(stepName)) {
            if (method.name().startsWith(wanted)) {
                log.debug("Method '{}' resolved by prefix '{}' for step {}", method.name(), wanted, stepName);
                return byMethod.get(method.name());
            }
        }
        String supported = getMethods(stepName).stream().map(Method::name).collect(Collectors.joining(", "));
        throw new SpecificationException(String.format(
                "Unsupported %s method '%s' (supported: %s).", stepName, wanted,
                supported.isEmpty() ? "none" : supported));
    }

    /**
     * Creates the plugin for one configuration record of the given step.
     *
     * @param step step the plugin is bound to
     * @param data configuration record; its {@code how} selects the method
     * @param type plugin type the step expects
     * @return new plugin instance
     * @throws SpecificationException if {@code how} does not resolve or the method produces another plugin type
     */
    public <P extends Plugin<?>> P delegate(StepContext step, StepData data, Class<P> type) {
        PluginProvider provider = resolve(step.getName(), data.getHow());
        log.debug("Using method '{}' for '{}' in step {}", provider.getMethodName(), data.getHow(), step.getName());
        Plugin<?> plugin = provider.createPlugin(step, data.withHow(provider.getMethodName()));
        if (!type.isInstance(plugin)) {
            throw new SpecificationException(String.format(
                    "Method '%s' of step %s does not provide a %s.",
                    provider.getMethodName(), step.getName(), type.getSimpleName()));
        }
        return type.cast(plugin);
    }

    /** Step name → (method name → provider). */
    public Map<String, Map<String, PluginProvider>> getAllByStep() {
        return Collections.unmodifiableMap(providersByStep);
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        providersByStep.clear();
    }
}
