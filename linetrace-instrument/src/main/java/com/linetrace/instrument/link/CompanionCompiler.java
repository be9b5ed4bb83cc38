package com.linetrace.instrument.link;

import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Compiles one companion source with the system Java compiler.
 * Sources and class files go to a temporary directory that is removed afterwards.
 */
public class CompanionCompiler {

    /**
     * @param qualifiedName binary name of the companion class
     * @param source        its source text
     * @param classpath     entries the source compiles against
     * @return class file bytes keyed by binary name, the companion and any nested classes it declares
     * @throws Linker.LinkException if no compiler is available or the source does not compile
     */
    public Map<String, byte[]> compile(String qualifiedName, String source, List<Path> classpath) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new Linker.LinkException("No Java compiler available: recording requires a JDK");
        }

        Path workDir;
        try {
            workDir = Files.createTempDirectory("linetrace-");
        } catch (IOException e) {
            throw new Linker.LinkException("Could not create compilation directory: " + e.getMessage(), e);
        }

        try {
            Path sourceFile = workDir.resolve("src").resolve(qualifiedName.replace('.', File.separatorChar) + ".java");
            Path outputDir = workDir.resolve("classes");
            Files.createDirectories(sourceFile.getParent());
            Files.createDirectories(outputDir);
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);

            StringWriter errorWriter = new StringWriter();
            try (StandardJavaFileManager fileManager =
                     compiler.getStandardFileManager(null, null, StandardCharsets.UTF_8)) {
                Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjects(sourceFile.toFile());

                List<String> options = Arrays.asList(
                    "-d", outputDir.toString(),
                    "-classpath", classpath.stream().map(Path::toString).collect(Collectors.joining(File.pathSeparator)),
                    "-proc:none",
                    "-g",
                    "-parameters"
                );

                JavaCompiler.CompilationTask task = compiler.getTask(
                    errorWriter, fileManager, null, options, null, units);
                if (!task.call()) {
                    throw new Linker.LinkException("Compilation of " + qualifiedName + " failed:\n"
                        + errorWriter + "\nGenerated source:\n" + source);
                }
            }
            return readClasses(outputDir);
        } catch (IOException e) {
            throw new Linker.LinkException("Compilation of " + qualifiedName + " failed: " + e.getMessage(), e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private static Map<String, byte[]> readClasses(Path outputDir) throws IOException {
        Map<String, byte[]> classes = new LinkedHashMap<>();
        try (Stream<Path> walk = Files.walk(outputDir)) {
            for (Path p : walk.filter(f -> f.toString().endsWith(".class")).sorted().collect(Collectors.toList())) {
                String relative = outputDir.relativize(p).toString();
                String binaryName = relative.substring(0, relative.length() - ".class".length())
                    .replace(File.separatorChar, '.');
                classes.put(binaryName, Files.readAllBytes(p));
            }
        }
        return classes;
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            System.err.println("[linetrace] Warning: could not delete " + dir + ": " + e.getMessage());
        }
    }
}
