package com.linetrace.instrument.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    @TempDir
    Path projectDir;

    private final SourceRootResolver resolver = new SourceRootResolver();

    private static void writePom(Path dir, String build, String modules) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("pom.xml"),
            "<project xmlns=\"http://maven.apache.org/POM/4.0.0\">\n"
            + "  <modelVersion>4.0.0</modelVersion>\n"
            + "  <groupId>x</groupId><artifactId>" + dir.getFileName() + "</artifactId><version>1</version>\n"
            + build + modules
            + "</project>\n");
    }

    // --- Maven ---

    @Test
    void mavenDefaults() throws IOException {
        writePom(projectDir, "", "");
        SourceRoots roots = resolver.resolve(projectDir);
        Path root = projectDir.toAbsolutePath().normalize();
        assertEquals(root.resolve("src/main/java"), roots.mainRoots().get(0));
        assertEquals(root.resolve("src/test/java"), roots.testRoots().get(0));
    }

    @Test
    void mavenCustomSourceDirectory() throws IOException {
        writePom(projectDir,
            "  <build><sourceDirectory>${basedir}/java</sourceDirectory>"
            + "<testSourceDirectory>tests</testSourceDirectory></build>\n", "");
        SourceRoots roots = resolver.resolve(projectDir);
        Path root = projectDir.toAbsolutePath().normalize();
        assertEquals(root.resolve("java"), roots.mainRoots().get(0));
        assertEquals(root.resolve("tests"), roots.testRoots().get(0));
    }

    @Test
    void mavenModulesAreIncluded() throws IOException {
        writePom(projectDir, "", "  <packaging>pom</packaging><modules><module>core</module></modules>\n");
        writePom(projectDir.resolve("core"), "", "");

        SourceRoots roots = resolver.resolve(projectDir);
        Path core = projectDir.toAbsolutePath().normalize().resolve("core");
        assertTrue(roots.mainRoots().contains(core.resolve("src/main/java")), roots.toString());
        assertTrue(roots.testRoots().contains(core.resolve("src/test/java")), roots.toString());
        assertEquals(4, roots.all().size());
    }

    @Test
    void unreadablePomFallsBackToDefaults() throws IOException {
        Files.writeString(projectDir.resolve("pom.xml"), "<project><not-closed>");
        SourceRoots roots = resolver.resolve(projectDir);
        assertEquals(projectDir.toAbsolutePath().normalize().resolve("src/main/java"), roots.mainRoots().get(0));
    }

    // --- Gradle ---

    @Test
    void gradleConventions() throws IOException {
        Files.writeString(projectDir.resolve("build.gradle.kts"), "plugins { java }\n");
        SourceRoots roots = resolver.resolve(projectDir);
        assertEquals(projectDir.toAbsolutePath().normalize().resolve("src/main/java"), roots.mainRoots().get(0));
    }

    // --- No build file ---

    @Test
    void conventionalDirectoryWithoutBuildFile() throws IOException {
        Files.createDirectories(projectDir.resolve("src/main/java"));
        SourceRoots roots = resolver.resolve(projectDir);
        assertEquals(1, roots.all().size());
        assertTrue(roots.testRoots().isEmpty());
    }

    @Test
    void nothingToResolveThrows() {
        assertThrows(SourceRootResolver.UnsupportedBuildToolException.class, () -> resolver.resolve(projectDir));
    }
}
