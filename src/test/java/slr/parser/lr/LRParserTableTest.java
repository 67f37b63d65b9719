package slr.parser.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import slr.grammar.*;

import static org.junit.jupiter.api.Assertions.*;
import static slr.parser.lr.GraphTest.EPSILON;
import static slr.parser.lr.GraphTest.EXPRESSION;

public class LRParserTableTest {

	private static LRParserTable table(String grammar){
		return Generator.fromGrammar(grammar).getTable();
	}

	private static String cell(LRParserTable table, int state, String terminal){
		LRParserTable.Action action = table.action(state, new Terminal(terminal));
		return action == null ? "" : action.toShortString();
	}

	@Nested
	public class ExpressionGrammar {

		private final LRParserTable table = table(EXPRESSION);

		@Test
		public void testNoConflicts(){
			assertFalse(table.hasConflicts());
			assertEquals(12, table.stateCount());
		}

		@Test
		public void testActions(){
			assertEquals("s5", cell(table, 0, "id"));
			assertEquals("s4", cell(table, 0, "("));
			assertEquals("", cell(table, 0, "+"));
			assertEquals("s6", cell(table, 1, "+"));
			assertEquals("acc", cell(table, 1, "$"));
			assertEquals("r(E → T)", cell(table, 2, "+"));
			assertEquals("s7", cell(table, 2, "*"));
			assertEquals("r(E → T)", cell(table, 2, ")"));
			assertEquals("r(F → id)", cell(table, 5, "*"));
			assertEquals("r(F → ( E ))", cell(table, 11, "$"));
			assertEquals("", cell(table, 5, "("));
		}

		@Test
		public void testGotos(){
			Grammar grammar = table.grammar;
			assertEquals(Integer.valueOf(1), table.gotoState(0, grammar.getNonTerminal("E")));
			assertEquals(Integer.valueOf(8), table.gotoState(4, grammar.getNonTerminal("E")));
			assertEquals(Integer.valueOf(10), table.gotoState(7, grammar.getNonTerminal("F")));
			assertNull(table.gotoState(7, grammar.getNonTerminal("T")));
			assertTrue(table.gotoRow(5).isEmpty());
		}

		@Test
		public void testReduceAction(){
			LRParserTable.ReduceAction reduce = (LRParserTable.ReduceAction) table.action(10, Terminal.EOF);
			assertEquals("reduce", reduce.name());
			assertEquals("T → T * F", reduce.production.toString());
			assertEquals(0, reduce.ruleIndex());
			assertEquals("reduce(T, 0)", reduce.toString());
		}

		@Test
		public void testGrid(){
			String[] lines = table.toString().split("\n");
			assertEquals(13, lines.length);
			assertEquals(List.of("State", "+", "*", "(", ")", "id", "$", "E", "T", "F"), cells(lines[0]));
			assertEquals(List.of("I0", "", "", "s4", "", "s5", "", "1", "2", "3"), cells(lines[1]));
			assertEquals(List.of("I1", "s6", "", "", "", "", "acc"), cells(lines[2]).subList(0, 7));
		}

		private List<String> cells(String line){
			List<String> cells = new ArrayList<>();
			for (String cell : line.split("\\|")){
				cells.add(cell.trim());
			}
			return cells;
		}
	}

	@Test
	public void testEpsilonGrammar(){
		LRParserTable table = table(EPSILON);
		assertEquals("r(A → ε)", cell(table, 0, "$"));
		assertEquals("s3", cell(table, 0, "a"));
		assertEquals("r(A → ε)", cell(table, 3, "$"));
		assertEquals("r(A → a A)", cell(table, 4, "$"));
		assertEquals("r(S → A)", cell(table, 2, "$"));
		assertFalse(table.hasConflicts());
	}

	@ParameterizedTest
	@ValueSource(strings = {EXPRESSION, EPSILON, "E -> E + E | id", "S -> A | B ; A -> x ; B -> x",
			"S -> if C then S | if C then S else S | x ; C -> c"})
	public void testAcceptOnlyInStateAfterStart(String grammarText){
		Generator generator = Generator.fromGrammar(grammarText);
		LRParserTable table = generator.getTable();
		Grammar grammar = generator.getGrammar();
		int acceptState = generator.getGraph().transitions(0).get(grammar.getOriginalStart());
		assertEquals(List.of(acceptState), table.acceptingStates());
		assertEquals(new LRParserTable.Accept(), table.action(acceptState, Terminal.EOF));
		assertTrue(generator.getGraph().getState(acceptState)
				.contains(new Item(grammar.getStartProduction(), 1)));
	}

	@ParameterizedTest
	@ValueSource(strings = {EXPRESSION, EPSILON, "S -> if C then S | x ; C -> c"})
	public void testReducesOnlyOnFollow(String grammarText){
		Generator generator = Generator.fromGrammar(grammarText);
		LRParserTable table = generator.getTable();
		for (int state = 0; state < table.stateCount(); state++){
			for (Map.Entry<Terminal, LRParserTable.Action> entry : table.actionRow(state).entrySet()){
				if (entry.getValue() instanceof LRParserTable.ReduceAction){
					NonTerminal left = ((LRParserTable.ReduceAction) entry.getValue()).production.left;
					assertTrue(generator.getFirstFollow().follow(left).contains(entry.getKey()));
				}
			}
		}
	}

	@Test
	public void testShiftReduceConflict(){
		LRParserTable table = table("E -> E + E | id");
		assertEquals(5, table.stateCount());
		assertEquals(1, table.getConflicts().size());
		LRParserTable.Conflict conflict = table.getConflicts().get(0);
		assertEquals(4, conflict.state);
		assertEquals(new Terminal("+"), conflict.terminal);
		assertEquals("shift/reduce", conflict.kind());
		assertEquals(new LRParserTable.ShiftAction(3), conflict.kept);
		assertEquals(conflict.kept, table.action(4, new Terminal("+")));
		assertEquals("r(E → E + E)", cell(table, 4, "$"));
	}

	@Test
	public void testReduceReduceConflict(){
		Generator generator = Generator.fromGrammar("S -> A | B ; A -> x ; B -> x");
		LRParserTable table = generator.getTable();
		assertEquals(1, table.getConflicts().size());
		LRParserTable.Conflict conflict = table.getConflicts().get(0);
		assertEquals(4, conflict.state);
		assertEquals(Terminal.EOF, conflict.terminal);
		assertEquals("reduce/reduce", conflict.kind());
		assertEquals("r(A → x)", conflict.kept.toShortString());
		assertEquals("r(B → x)", conflict.dropped.toShortString());
		assertEquals("r(A → x)", cell(table, 4, "$"));
	}

	@Test
	public void testFirstActionWins(){
		Grammar grammar = GrammarParser.parseAugmented("S -> a | b");
		Production production = grammar.getProductionForId(0);
		LRParserTable table = new LRParserTable.Builder(grammar)
				.addShift(0, new Terminal("a"), 1)
				.addReduce(0, new Terminal("a"), production)
				.addShift(0, new Terminal("a"), 1)
				.addShift(0, new Terminal("a"), 2)
				.ensureStates(3)
				.build();
		assertEquals(3, table.stateCount());
		assertEquals(new LRParserTable.ShiftAction(1), table.action(0, new Terminal("a")));
		assertEquals(2, table.getConflicts().size());
		assertEquals("shift/reduce", table.getConflicts().get(0).kind());
		assertEquals("shift/shift", table.getConflicts().get(1).kind());
		assertTrue(table.actionRow(2).isEmpty());
	}

	@Test
	public void testUnknownState(){
		LRParserTable table = table(EPSILON);
		assertThrows(IllegalArgumentException.class, () -> table.actionRow(5));
		assertThrows(IllegalArgumentException.class, () -> table.action(-1, Terminal.EOF));
	}

	@Test
	public void testForeignFollowSets(){
		Generator generator = Generator.fromGrammar(EPSILON);
		Generator other = Generator.fromGrammar(EPSILON);
		assertThrows(slr.SLRException.class, () -> generator.getGraph().toParserTable(other.getFirstFollow()));
	}
}
