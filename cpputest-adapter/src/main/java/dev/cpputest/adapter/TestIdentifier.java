package dev.cpputest.adapter;

import java.util.Objects;

/**
 * Names one CppUTest test: the group given to {@code TEST_GROUP} and the case given to {@code TEST}.
 */
public record TestIdentifier(String groupName, String caseName) {
	public TestIdentifier {
		Objects.requireNonNull(groupName, "groupName");
		Objects.requireNonNull(caseName, "caseName");
	}

	public String fullyQualifiedName() {
		return groupName + "." + caseName;
	}

	/**
	 * Parses a {@code Group.Case} token as printed by a test executable.
	 *
	 * @throws InvalidTestNameException if the token does not contain exactly one separator
	 *                                  or either side of it is empty.
	 */
	public static TestIdentifier parse(String token) throws InvalidTestNameException {
		var parts = token.split("\\.", -1);
		if(parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
			throw new InvalidTestNameException(token);
		}

		return new TestIdentifier(parts[0], parts[1]);
	}

	@Override
	public String toString() {
		return fullyQualifiedName();
	}
}
