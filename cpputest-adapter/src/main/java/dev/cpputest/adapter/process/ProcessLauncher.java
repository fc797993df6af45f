package dev.cpputest.adapter.process;

import dev.cpputest.adapter.host.DebuggerLauncher;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Starts the process that {@link ProcessRunner} then waits on.
 */
public abstract class ProcessLauncher {
	public abstract LaunchedProcess launch(Path executable, Path workingDirectory, List<String> arguments) throws IOException;

	public static ProcessLauncher direct() {
		return DirectLauncher.INSTANCE;
	}

	public static ProcessLauncher forDebugger(@Nullable DebuggerLauncher debuggerLauncher) {
		if(debuggerLauncher == null) {
			return direct();
		}

		return new DebuggerAttachedLauncher(debuggerLauncher);
	}

	static List<String> command(Path executable, List<String> arguments) {
		var command = new ArrayList<String>(arguments.size() + 1);
		command.add(executable.toString());
		command.addAll(arguments);
		return command;
	}

	private static final class DirectLauncher extends ProcessLauncher {
		static final DirectLauncher INSTANCE = new DirectLauncher();

		@Override
		public LaunchedProcess launch(Path executable, Path workingDirectory, List<String> arguments) throws IOException {
			var pb = new ProcessBuilder(command(executable, arguments));
			pb.directory(workingDirectory.toFile());
			pb.redirectInput(ProcessBuilder.Redirect.PIPE);
			pb.redirectOutput(ProcessBuilder.Redirect.INHERIT);
			pb.redirectError(ProcessBuilder.Redirect.INHERIT);

			var process = pb.start();
			process.getOutputStream().close();
			return new SpawnedProcess(process);
		}
	}

	private static final class DebuggerAttachedLauncher extends ProcessLauncher {
		DebuggerAttachedLauncher(DebuggerLauncher debuggerLauncher) {
			this.debuggerLauncher = debuggerLauncher;
		}

		private final DebuggerLauncher debuggerLauncher;

		@Override
		public LaunchedProcess launch(Path executable, Path workingDirectory, List<String> arguments) throws IOException {
			long pid = debuggerLauncher.launchProcessWithDebuggerAttached(executable, workingDirectory, arguments, Map.of());

			// Take the handle now; a process we cannot see cannot be waited on or killed later.
			var handle = ProcessHandle.of(pid)
				.orElseThrow(() -> new IOException("Process " + pid + " launched for " + executable.getFileName() + " could not be found"));

			return new AttachedProcess(handle);
		}
	}
}
