package dev.cpputest.adapter.process;

import java.util.OptionalInt;

/**
 * How a process run by {@link ProcessRunner} ended.
 *
 * @param cancelled true if the run was cancelled while the process was still alive.
 * @param exitCode  the exit code, when the process exited on its own and the code is observable.
 */
public record ProcessExit(boolean cancelled, OptionalInt exitCode) {
	public static ProcessExit exited(OptionalInt exitCode) {
		return new ProcessExit(false, exitCode);
	}

	public static ProcessExit cancelledRun() {
		return new ProcessExit(true, OptionalInt.empty());
	}
}
