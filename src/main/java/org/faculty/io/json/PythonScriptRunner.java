package org.faculty.io.json;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a Python script as an external process and exchanges bytes with it.
 *
 * Responsibility:
 * 1) Build the command: python <script> <args...>
 * 2) Run it from the script's folder
 * 3) Feed the request to stdin, collect stdout, let stderr through to our stderr
 * 4) Fail fast on a non-zero exit code or when the timeout expires
 *
 * This class does NOT parse JSON.
 */
public final class PythonScriptRunner {

    private final String pythonExecutable;   // e.g. "python3" or a venv interpreter
    private final Path scriptPath;           // absolute path to the script file
    private final Path workingDirectory;     // the script's parent folder

    /**
     * Convenience constructor: uses "python3" as the executable.
     */
    public PythonScriptRunner(Path scriptPath) {
        this("python3", scriptPath);
    }

    /**
     * @param pythonExecutable "python", "python3", or a full path to an interpreter
     * @param scriptPath Path to the Python script (relative or absolute)
     */
    public PythonScriptRunner(String pythonExecutable, Path scriptPath) {
        if (pythonExecutable == null || pythonExecutable.isBlank()) {
            throw new IllegalArgumentException("pythonExecutable must not be null/blank");
        }
        if (scriptPath == null) {
            throw new IllegalArgumentException("scriptPath must not be null");
        }

        // Absolute so a changed working directory does not break the lookup
        Path absScript = scriptPath.toAbsolutePath().normalize();

        if (!Files.exists(absScript)) {
            throw new IllegalArgumentException("Python script file does not exist: " + absScript);
        }

        this.pythonExecutable = pythonExecutable;
        this.scriptPath = absScript;
        this.workingDirectory = absScript.getParent();

        if (this.workingDirectory == null) {
            throw new IllegalStateException("Cannot determine working directory for script: " + absScript);
        }
    }

    /**
     * Runs the script and blocks until it finishes or the timeout expires.
     *
     * @param args extra command-line arguments after the script path
     * @param stdin bytes written to the process's standard input (may be empty)
     * @param timeout maximum wall-clock time for the process
     * @return everything the process wrote to standard output
     * @throws IOException if the process cannot start, times out, or exits non-zero
     */
    public byte[] run(List<String> args, byte[] stdin, Duration timeout) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(pythonExecutable);
        command.add(scriptPath.toString());
        command.addAll(args);

        // stdout goes to a file so a chatty process can never block on a full pipe
        Path stdout = Files.createTempFile("python-stdout-", ".json");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDirectory.toFile());
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(ProcessBuilder.Redirect.INHERIT);

            Process process = pb.start();
            try (OutputStream in = process.getOutputStream()) {
                in.write(stdin);
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Python script timed out after " + timeout + ": " + scriptPath);
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IOException("Python script failed (exit code=" + exitCode + "): " + scriptPath);
            }
            return Files.readAllBytes(stdout);
        } finally {
            Files.deleteIfExists(stdout);
        }
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    public Path getScriptPath() {
        return scriptPath;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }
}
