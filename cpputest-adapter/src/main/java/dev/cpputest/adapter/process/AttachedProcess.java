package dev.cpputest.adapter.process;

import java.util.OptionalInt;

/**
 * A process started by someone else, known only by its handle. Its exit code is not observable.
 */
final class AttachedProcess extends LaunchedProcess {
	AttachedProcess(ProcessHandle handle) {
		this.handle = handle;
	}

	private final ProcessHandle handle;

	@Override
	public long pid() {
		return handle.pid();
	}

	@Override
	public boolean hasExited() {
		return !handle.isAlive();
	}

	@Override
	public OptionalInt exitCode() {
		return OptionalInt.empty();
	}

	@Override
	public void kill() {
		handle.destroyForcibly();
	}

	@Override
	public void close() {
		// A ProcessHandle holds no operating system resources.
	}
}
