package io.batchrun.server.launcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SelfInvocation")
class SelfInvocationTest {

    private static final String JAVA = Path.of("/opt/jdk", "bin", "java").toString();

    @Test
    @DisplayName("uses the configured command verbatim")
    void configuredCommandWins() {
        List<String> configured = List.of("/usr/local/bin/batchrun", "--quiet");

        assertThat(SelfInvocation.resolve(Optional.of(configured))).isEqualTo(configured);
    }

    @Test
    @DisplayName("re-runs an executable jar with -jar")
    void jarLaunch() {
        assertThat(SelfInvocation.fromJvm("/opt/jdk", "/srv/app/quarkus-run.jar scheduler", "x"))
                .containsExactly(JAVA, "-jar", "/srv/app/quarkus-run.jar");
    }

    @Test
    @DisplayName("re-runs a main class with the current class path")
    void mainClassLaunch() {
        assertThat(SelfInvocation.fromJvm("/opt/jdk", "io.example.Main list-runs", "a.jar:b.jar"))
                .containsExactly(JAVA, "-cp", "a.jar:b.jar", "io.example.Main");
    }

    @Test
    @DisplayName("fails when the launch command is unknown")
    void unknownLaunch() {
        assertThatThrownBy(() -> SelfInvocation.fromJvm("/opt/jdk", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("batchrun.self-command");
    }

    @Test
    @DisplayName("defers resolution to the first use and caches the result")
    void lazyResolution() {
        int[] calls = {0};
        Supplier<List<String>> lazy =
                SelfInvocation.memoize(
                        () -> {
                            calls[0]++;
                            return List.of("/usr/bin/batchrun");
                        });
        assertThat(calls[0]).isZero();

        assertThat(lazy.get()).containsExactly("/usr/bin/batchrun");
        assertThat(lazy.get()).containsExactly("/usr/bin/batchrun");
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    @DisplayName("uses a configured command through the lazy supplier")
    void lazyConfigured() {
        List<String> configured = List.of("/opt/batchrun/bin/batchrun");

        assertThat(SelfInvocation.lazy(Optional.of(configured)).get()).isEqualTo(configured);
    }

    @Test
    @DisplayName("derives a command from the running JVM when nothing is configured")
    void derivedFromRunningJvm() {
        List<String> derived = SelfInvocation.resolve(Optional.of(List.of()));

        assertThat(derived.get(0)).endsWith("java");
        assertThat(derived).hasSizeGreaterThanOrEqualTo(3);
    }
}
