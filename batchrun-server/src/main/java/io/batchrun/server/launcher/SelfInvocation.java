package io.batchrun.server.launcher;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/// Works out the argv prefix that starts this application again.
///
/// Workers and managed commands are both started as `<prefix> <subcommand> <args...>`.
/// When `batchrun.self-command` is set it is used verbatim. Otherwise the prefix is
/// derived from the running JVM:
///
/// | Launched as | Prefix |
/// |-------------|--------|
/// | `java -jar app.jar` | `<java.home>/bin/java -jar app.jar` |
/// | `java -cp ... Main` | `<java.home>/bin/java -cp <java.class.path> Main` |
public final class SelfInvocation {

    private SelfInvocation() {}

    /// @param configured value of `batchrun.self-command`, may be empty
    /// @return the argv prefix, never empty
    /// @throws IllegalStateException if the JVM launch command cannot be determined
    public static List<String> resolve(Optional<List<String>> configured) {
        return configured
                .filter(argv -> !argv.isEmpty())
                .map(List::copyOf)
                .orElseGet(
                        () ->
                                fromJvm(
                                        System.getProperty("java.home"),
                                        System.getProperty("sun.java.command"),
                                        System.getProperty("java.class.path")));
    }

    /// Defers {@link #resolve(Optional)} to the first call of the returned supplier.
    ///
    /// @param configured value of `batchrun.self-command`, may be empty
    /// @return a caching supplier of the argv prefix, never null
    public static Supplier<List<String>> lazy(Optional<List<String>> configured) {
        return memoize(() -> resolve(configured));
    }

    static <T> Supplier<T> memoize(Supplier<T> delegate) {
        return new Supplier<>() {
            private T value;

            @Override
            public synchronized T get() {
                if (value == null) {
                    value = delegate.get();
                }
                return value;
            }
        };
    }

    static List<String> fromJvm(String javaHome, String javaCommand, String classPath) {
        if (javaHome == null || javaCommand == null || javaCommand.isBlank()) {
            throw new IllegalStateException(
                    "Cannot derive the self command; set batchrun.self-command");
        }
        String java = Path.of(javaHome, "bin", "java").toString();
        String entry = javaCommand.strip().split("\\s+", 2)[0];
        if (entry.endsWith(".jar")) {
            return List.of(java, "-jar", entry);
        }
        return List.of(java, "-cp", classPath == null ? "" : classPath, entry);
    }

    static File nullDevice() {
        return new File(
                System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
