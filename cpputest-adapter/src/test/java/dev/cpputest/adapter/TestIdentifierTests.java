package dev.cpputest.adapter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestIdentifierTests {

	@Test
	void parsesGroupAndCase() throws InvalidTestNameException {
		var identifier = TestIdentifier.parse("MyFunnyValentine_testGroup.test_FailingTest1");
		Assertions.assertEquals("MyFunnyValentine_testGroup", identifier.groupName());
		Assertions.assertEquals("test_FailingTest1", identifier.caseName());
		Assertions.assertEquals("MyFunnyValentine_testGroup.test_FailingTest1", identifier.fullyQualifiedName());
	}

	@Test
	void rejectsNameWithoutSeparator() {
		var e = Assertions.assertThrows(InvalidTestNameException.class, () -> TestIdentifier.parse("NoSeparator"));
		Assertions.assertEquals("NoSeparator", e.getTestName());
	}

	@Test
	void rejectsNameWithTwoSeparators() {
		Assertions.assertThrows(InvalidTestNameException.class, () -> TestIdentifier.parse("Group.Case.Extra"));
	}

	@Test
	void rejectsEmptyParts() {
		Assertions.assertThrows(InvalidTestNameException.class, () -> TestIdentifier.parse("Group."));
		Assertions.assertThrows(InvalidTestNameException.class, () -> TestIdentifier.parse(".Case"));
		Assertions.assertThrows(InvalidTestNameException.class, () -> TestIdentifier.parse("."));
	}

	@Test
	void equalityIsByValue() throws InvalidTestNameException {
		Assertions.assertEquals(new TestIdentifier("A", "b"), TestIdentifier.parse("A.b"));
	}
}
