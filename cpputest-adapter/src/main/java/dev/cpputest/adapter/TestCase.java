package dev.cpputest.adapter;

import java.nio.file.Path;
import java.util.Objects;

public record TestCase(TestIdentifier identifier, Path source) {
	public TestCase {
		Objects.requireNonNull(identifier, "identifier");
		Objects.requireNonNull(source, "source");
	}

	public String fullyQualifiedName() {
		return identifier.fullyQualifiedName();
	}

	@Override
	public String toString() {
		return "TestCase{" +
			"name='" + identifier.fullyQualifiedName() + '\'' +
			", source=" + source +
			'}';
	}
}
