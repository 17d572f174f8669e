package com.leanspec.sync.bridge.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.leanspec.sync.core.json.JacksonConfig;

class ProjectResolverTest {

    @TempDir
    Path dir;

    private final ProjectResolver resolver = new ProjectResolver(JacksonConfig.newObjectMapper());

    @Test
    void resolvesConventionalSpecsDirectory() throws Exception {
        Path root = Files.createDirectories(dir.resolve("app"));
        Files.createDirectories(root.resolve("docs/specs"));

        ProjectConfig project = resolver.resolve(root.toString(), "m1");

        assertThat(project.name()).isEqualTo("app");
        assertThat(project.root()).isEqualTo(root.toAbsolutePath().normalize());
        assertThat(project.specsDir()).isEqualTo(root.resolve("docs/specs"));
    }

    @Test
    void plainSpecsDirectoryWinsOverOthers() throws Exception {
        Path root = Files.createDirectories(dir.resolve("app"));
        Files.createDirectories(root.resolve("specs"));
        Files.createDirectories(root.resolve(".lean-spec/specs"));

        assertThat(resolver.resolve(root.toString(), "m1").specsDir()).isEqualTo(root.resolve("specs"));
    }

    @Test
    void fallsBackToConfiguredSpecsDir() throws Exception {
        Path root = Files.createDirectories(dir.resolve("app"));
        Files.createDirectories(root.resolve("planning/items"));
        Files.createDirectories(root.resolve(".lean-spec"));
        Files.writeString(root.resolve(".lean-spec/config.json"), "{\"specsDir\":\"planning/items\"}");

        assertThat(resolver.resolve(root.toString(), "m1").specsDir()).isEqualTo(root.resolve("planning/items"));
    }

    @Test
    void missingPathOrSpecsDirIsAConfigError() throws Exception {
        assertThatThrownBy(() -> resolver.resolve(dir.resolve("nope").toString(), "m1"))
                .isInstanceOf(BridgeConfigException.class)
                .hasMessageContaining("not found");

        Path empty = Files.createDirectories(dir.resolve("empty"));
        assertThatThrownBy(() -> resolver.resolve(empty.toString(), "m1"))
                .isInstanceOf(BridgeConfigException.class)
                .hasMessageContaining("specs directory");
    }

    @Test
    void projectIdIsStablePerMachineAndPath() {
        Path root = dir.resolve("app");

        assertThat(ProjectResolver.projectId("m1", root)).isEqualTo(ProjectResolver.projectId("m1", root));
        assertThat(ProjectResolver.projectId("m1", root)).isNotEqualTo(ProjectResolver.projectId("m2", root));
        assertThat(ProjectResolver.projectId("m1", root)).isNotEqualTo(ProjectResolver.projectId("m1", dir.resolve("other")));
    }
}
