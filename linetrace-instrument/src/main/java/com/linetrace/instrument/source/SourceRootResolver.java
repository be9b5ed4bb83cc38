package com.linetrace.instrument.source;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Resolves the Java source roots of a Maven or Gradle project.
 *
 * Maven: {@code build.sourceDirectory} and {@code build.testSourceDirectory} from pom.xml
 * (defaults src/main/java and src/test/java), including the roots of listed modules.
 * Gradle: the src/main/java and src/test/java conventions.
 * No build file: whichever of the conventional directories exist.
 */
public class SourceRootResolver {

    static final String MAIN_DEFAULT = "src/main/java";
    static final String TEST_DEFAULT = "src/test/java";

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    /**
     * Detect build tool and resolve source roots.
     *
     * @param projectRoot path to the project root directory
     * @throws UnsupportedBuildToolException if there is no build file and no conventional source directory
     */
    public SourceRoots resolve(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path pomFile = root.resolve("pom.xml");
        Path gradleFile = root.resolve("build.gradle");
        Path gradleKts = root.resolve("build.gradle.kts");

        if (Files.exists(pomFile)) {
            List<Path> main = new ArrayList<>();
            List<Path> test = new ArrayList<>();
            collectMaven(root, main, test, new HashSet<>());
            return new SourceRoots(main, test);
        } else if (Files.exists(gradleFile) || Files.exists(gradleKts)) {
            return new SourceRoots(List.of(root.resolve(MAIN_DEFAULT)), List.of(root.resolve(TEST_DEFAULT)));
        }

        List<Path> main = existing(root.resolve(MAIN_DEFAULT));
        List<Path> test = existing(root.resolve(TEST_DEFAULT));
        if (main.isEmpty() && test.isEmpty()) {
            throw new UnsupportedBuildToolException(
                "No pom.xml, build.gradle or " + MAIN_DEFAULT + " found in: " + root +
                ". Pass the source roots explicitly with sources=<dir>."
            );
        }
        return new SourceRoots(main, test);
    }

    private void collectMaven(Path projectRoot, List<Path> main, List<Path> test, Set<Path> seen) {
        if (!seen.add(projectRoot)) return;

        String sourceDir = MAIN_DEFAULT;
        String testSourceDir = TEST_DEFAULT;
        List<String> modules = List.of();
        try (Reader reader = Files.newBufferedReader(projectRoot.resolve("pom.xml"))) {
            Model model = new MavenXpp3Reader().read(reader);
            Build build = model.getBuild();
            if (build != null && build.getSourceDirectory() != null) {
                sourceDir = build.getSourceDirectory();
            }
            if (build != null && build.getTestSourceDirectory() != null) {
                testSourceDir = build.getTestSourceDirectory();
            }
            modules = model.getModules();
        } catch (IOException | XmlPullParserException e) {
            // Fall back to defaults
            System.err.println("[linetrace] Warning: could not parse " + projectRoot.resolve("pom.xml")
                + ", using default source roots: " + e.getMessage());
        }

        main.add(projectRoot.resolve(expandBasedir(sourceDir, projectRoot)).normalize());
        test.add(projectRoot.resolve(expandBasedir(testSourceDir, projectRoot)).normalize());

        for (String module : modules) {
            Path moduleRoot = projectRoot.resolve(module).normalize();
            if (Files.exists(moduleRoot.resolve("pom.xml"))) {
                collectMaven(moduleRoot, main, test, seen);
            }
        }
    }

    private static String expandBasedir(String dir, Path projectRoot) {
        return dir.replace("${project.basedir}", projectRoot.toString())
                  .replace("${basedir}", projectRoot.toString());
    }

    private static List<Path> existing(Path dir) {
        return Files.isDirectory(dir) ? List.of(dir) : List.of();
    }
}
