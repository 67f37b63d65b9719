package slr.util;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

	@Test
	public void testFormatTable(){
		String table = Utils.formatTable(List.of(List.of("State", "a", "B"), List.of("I0", "s12", ""),
				List.of("I12", "", "3")));
		assertEquals("State | a   | B\nI0    | s12 |\nI12   |     | 3", table);
	}

	@Test
	public void testJoin(){
		assertEquals("1, 2, 3", Utils.join(List.of(1, 2, 3), ", "));
		assertEquals("", Utils.join(List.of(), ", "));
	}

	@Test
	public void testTrailingEmptyCellsAreTrimmed(){
		String table = Utils.formatTable(List.of(List.of("Step", "Action", "Details"), List.of("0", "", "")));
		assertEquals("Step | Action | Details\n0", table);
	}
}
