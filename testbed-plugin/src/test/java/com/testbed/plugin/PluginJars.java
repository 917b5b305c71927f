package com.testbed.plugin;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

/** Writes community plugin jars from compiled test classes. */
final class PluginJars {

    private PluginJars() {
    }

    /**
     * Writes a jar registering {@code provider} as a {@link PluginProvider} service and carrying
     * the class files of {@code classes}.
     */
    static Path write(Path jar, String provider, Class<?>... classes) throws IOException {
        try (OutputStream file = Files.newOutputStream(jar);
             JarOutputStream out = new JarOutputStream(file)) {
            out.putNextEntry(new JarEntry("META-INF/services/" + PluginProvider.class.getName()));
            out.write((provider + "\n").getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
            for (Class<?> c : classes) {
                copyClass(out, c);
            }
        }
        return jar;
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
