package com.phillippitts.avifconverter.testutil;

import com.phillippitts.avifconverter.service.process.ProcessFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ProcessFactory that plays a script per executable instead of launching anything.
 *
 * <p>Executables without a script behave as if missing from PATH (start throws IOException).
 * Every command line is recorded so tests can assert on what would have run.
 */
public final class ScriptedProcessFactory implements ProcessFactory {

    /**
     * What a fake tool does when "launched": optionally touch the filesystem, then report how
     * the process behaves.
     */
    @FunctionalInterface
    public interface Script {
        FakeProcess.Behavior run(List<String> command, Path workingDir) throws IOException;
    }

    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private final List<FakeProcess> started = new CopyOnWriteArrayList<>();

    public ScriptedProcessFactory on(String executable, Script script) {
        scripts.put(executable, script);
        return this;
    }

    /** Tool that writes the given bytes to its last argument (the output path) and exits 0. */
    public static Script writesOutput(byte[] bytes) {
        return (command, wd) -> {
            Files.write(Path.of(command.get(command.size() - 1)), bytes);
            return FakeProcess.Behavior.succeeds();
        };
    }

    /** Tool that exits with the given code and stderr, writing nothing. */
    public static Script exits(int exitCode, String stderr) {
        return (command, wd) -> FakeProcess.Behavior.fails(exitCode, stderr);
    }

    /** Tool that exits 0 without producing its output artifact. */
    public static Script silentlyProducesNothing() {
        return (command, wd) -> FakeProcess.Behavior.succeeds();
    }

    /** Tool that never exits on its own. */
    public static Script hangs() {
        return (command, wd) -> FakeProcess.Behavior.hangs();
    }

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        commands.add(List.copyOf(command));
        Script script = scripts.get(command.get(0));
        if (script == null) {
            throw new IOException("Cannot run program \"" + command.get(0) + "\": error=2, No such file or directory");
        }
        FakeProcess process = new FakeProcess(script.run(command, workingDir));
        started.add(process);
        return process;
    }

    public List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public List<String> executables() {
        return commands.stream().map(c -> c.get(0)).toList();
    }

    public List<FakeProcess> startedProcesses() {
        return List.copyOf(started);
    }
}
