package dev.cpputest.adapter;

import java.nio.file.Path;

public class TestRunException extends Exception {
	public TestRunException(Path source, Throwable cause) {
		super("Error running tests in " + source.getFileName(), cause);
		this.source = source;
	}

	private final Path source;

	public Path getSource() {
		return source;
	}
}
