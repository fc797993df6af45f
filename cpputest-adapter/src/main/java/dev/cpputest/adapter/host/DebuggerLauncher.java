package dev.cpputest.adapter.host;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launches a process with a debugger already attached.
 */
@FunctionalInterface
public interface DebuggerLauncher {
	/**
	 * @param filePath             the executable to launch.
	 * @param workingDirectory     the working directory of the new process.
	 * @param arguments            command line arguments for the process.
	 * @param environmentVariables variables to set in the process, may be empty.
	 * @return the process id of the started process.
	 */
	long launchProcessWithDebuggerAttached(
		Path filePath,
		Path workingDirectory,
		List<String> arguments,
		Map<String, String> environmentVariables
	) throws IOException;
}
