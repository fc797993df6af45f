package dev.cpputest.adapter.process;

import dev.cpputest.adapter.host.DebuggerLauncher;
import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs test executables to completion, or until a {@link CancelSignal} says to stop.
 * <p>
 * Waiting is done by polling rather than blocking so that a cancelled run notices promptly. A process
 * still alive when its run ends is killed.
 */
public final class ProcessRunner {
	private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
	private static final long OUTPUT_POLL_INTERVAL_MILLIS = 1;

	public ProcessRunner() {
		this(DEFAULT_POLL_INTERVAL);
	}

	public ProcessRunner(Duration pollInterval) {
		if(pollInterval.isNegative() || pollInterval.isZero()) {
			throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
		}
		this.pollIntervalMillis = Math.max(1, pollInterval.toMillis());
	}

	private final long pollIntervalMillis;

	/**
	 * Runs an executable and waits for it to exit.
	 *
	 * @param debuggerLauncher if not null, used to launch the process with a debugger attached.
	 */
	public ProcessExit run(
		Path executable,
		Path workingDirectory,
		List<String> arguments,
		@Nullable DebuggerLauncher debuggerLauncher,
		CancelSignal signal
	) throws IOException, InterruptedException {
		return run(ProcessLauncher.forDebugger(debuggerLauncher), executable, workingDirectory, arguments, signal);
	}

	public ProcessExit run(
		ProcessLauncher launcher,
		Path executable,
		Path workingDirectory,
		List<String> arguments,
		CancelSignal signal
	) throws IOException, InterruptedException {
		if(signal.isCancellationRequested()) {
			log.debug("Not launching {}, run was already cancelled", executable);
			return ProcessExit.cancelledRun();
		}

		log.debug("Launching {} {} in {}", executable, arguments, workingDirectory);
		try(var process = launcher.launch(executable, workingDirectory, arguments)) {
			boolean cancelled = false;
			try {
				while(!process.hasExited()) {
					if(signal.isCancellationRequested()) {
						cancelled = true;
						break;
					}
					Thread.sleep(pollIntervalMillis);
				}
			}
			finally {
				killIfAlive(process);
			}

			if(cancelled) {
				log.debug("Run of {} (pid {}) was cancelled", executable.getFileName(), process.pid());
				return ProcessExit.cancelledRun();
			}

			var exitCode = process.exitCode();
			log.debug("Process {} (pid {}) exited with {}", executable.getFileName(), process.pid(), exitCode);
			return ProcessExit.exited(exitCode);
		}
	}

	/**
	 * Runs an executable and returns what it printed to standard output.
	 * <p>
	 * Standard output is drained on a separate thread while this one waits, since a child that fills
	 * the pipe would otherwise block forever. If the signal fires first the process is killed and the
	 * draining thread is left to finish on its own.
	 *
	 * @param workingDirectory the working directory, or null to inherit ours.
	 * @throws CancellationException if the signal fired before the output was complete.
	 */
	public String runAndCollectOutput(
		Path executable,
		@Nullable Path workingDirectory,
		List<String> arguments,
		CancelSignal signal
	) throws IOException, InterruptedException {
		signal.throwIfCancellationRequested();

		var pb = new ProcessBuilder(ProcessLauncher.command(executable, arguments));
		if(workingDirectory != null) {
			pb.directory(workingDirectory.toFile());
		}
		pb.redirectInput(ProcessBuilder.Redirect.PIPE);
		pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
		pb.redirectError(ProcessBuilder.Redirect.INHERIT);

		log.debug("Launching {} {} to collect its output", executable, arguments);
		try(var process = new SpawnedProcess(pb.start())) {
			try {
				process.process().getOutputStream().close();

				var output = drainOutput(process.process());
				while(!output.isDone() && !signal.isCancellationRequested()) {
					Thread.sleep(OUTPUT_POLL_INTERVAL_MILLIS);
				}

				if(!output.isDone()) {
					throw new CancellationException("Cancelled while waiting for output of " + executable.getFileName());
				}

				return getOutput(output);
			}
			finally {
				killIfAlive(process);
			}
		}
	}

	private static CompletableFuture<String> drainOutput(Process process) {
		var output = new CompletableFuture<String>();
		var thread = new Thread(() -> {
			try(var stdout = process.getInputStream()) {
				var text = IOUtils.toString(stdout, StandardCharsets.UTF_8);
				process.waitFor();
				output.complete(text);
			}
			catch(Throwable e) {
				output.completeExceptionally(e);
			}
		}, "process-output-" + process.pid());
		thread.setDaemon(true);
		thread.start();
		return output;
	}

	private static String getOutput(CompletableFuture<String> output) throws IOException, InterruptedException {
		try {
			return output.get();
		}
		catch(ExecutionException e) {
			if(e.getCause() instanceof IOException e2) {
				throw e2;
			}

			if(e.getCause() instanceof InterruptedException e2) {
				throw e2;
			}

			throw new IOException("Failed to read process output", e.getCause());
		}
	}

	private static void killIfAlive(LaunchedProcess process) {
		try {
			if(!process.hasExited()) {
				log.debug("Killing process {}", process.pid());
				process.kill();
			}
		}
		catch(RuntimeException e) {
			log.warn("Could not kill process {}", process.pid(), e);
		}
	}
}
