package dev.cpputest.adapter.process;

import java.io.Closeable;
import java.util.OptionalInt;

/**
 * A running process, however it was started. Closing releases whatever the process holds on our side
 * and does not terminate it.
 */
public abstract class LaunchedProcess implements Closeable {
	public abstract long pid();

	public abstract boolean hasExited();

	public abstract OptionalInt exitCode();

	public abstract void kill();

	@Override
	public abstract void close();
}
