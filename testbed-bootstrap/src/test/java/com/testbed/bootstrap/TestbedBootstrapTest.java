package com.testbed.bootstrap;

import com.testbed.config.TestbedConfig;
import com.testbed.execute.internal.InternalExecutorProvider;
import com.testbed.plugin.Method;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.PluginRegistry;
import org.example.community.HtmlReport;
import org.example.community.HtmlReportProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TestbedBootstrapTest {

    @TempDir
    Path pluginsDir;

    @Test
    void initialize_registersBuiltInMethods() {
        PluginRegistry registry = new PluginRegistry();
        TestbedConfig config = TestbedConfig.builder().pluginsDir(pluginsDir).build();

        BootstrapContext ctx = TestbedBootstrap.initialize(config, registry);

        assertEquals(List.of("tmt", "display", "junit"),
                ctx.getRegisteredMethods().stream().map(Method::name).collect(Collectors.toList()));
        assertInstanceOf(InternalExecutorProvider.class, registry.resolve("execute", "tmt"));
        assertEquals("junit", registry.resolve("report", "ju").getMethodName());
        assertEquals(config, ctx.getConfig());
    }

    @Test
    void initialize_twiceIntoSameRegistryFails() {
        PluginRegistry registry = new PluginRegistry();
        TestbedConfig config = TestbedConfig.builder().pluginsDir(pluginsDir).build();
        TestbedBootstrap.initialize(config, registry);

        assertThrows(IllegalArgumentException.class, () -> TestbedBootstrap.initialize(config, registry));
    }

    @Test
    void initialize_registersCommunityMethodFromPluginsDir() throws Exception {
        writePluginJar(pluginsDir.resolve("html-report.jar"), HtmlReportProvider.class, HtmlReport.class);
        PluginRegistry registry = new PluginRegistry();
        TestbedConfig config = TestbedConfig.builder().pluginsDir(pluginsDir).build();

        BootstrapContext ctx = TestbedBootstrap.initialize(config, registry);

        assertEquals(List.of("tmt", "display", "junit", "html"),
                ctx.getRegisteredMethods().stream().map(Method::name).collect(Collectors.toList()));
        PluginProvider html = registry.resolve("report", "html");
        assertEquals(HtmlReportProvider.class.getName(), html.getClass().getName());
        assertNotSame(HtmlReportProvider.class, html.getClass());
        assertInstanceOf(URLClassLoader.class, html.getClass().getClassLoader());
    }

    private static void writePluginJar(Path jar, Class<?> provider, Class<?>... classes) throws IOException {
        try (OutputStream file = Files.newOutputStream(jar);
             JarOutputStream out = new JarOutputStream(file)) {
            out.putNextEntry(new JarEntry("META-INF/services/" + PluginProvider.class.getName()));
            out.write((provider.getName() + "\n").getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
            copyClass(out, provider);
            for (Class<?> c : classes) {
                copyClass(out, c);
            }
        }
    }

    private static void copyClass(JarOutputStream out, Class<?> c) throws IOException {
        String entry = c.getName().replace('.', '/') + ".class";
        out.putNextEntry(new JarEntry(entry));
        try (InputStream in = c.getClassLoader().getResourceAsStream(entry)) {
            if (in == null) {
                throw new IOException("Class file not found: " + entry);
            }
            in.transferTo(out);
        }
        out.closeEntry();
    }
}
