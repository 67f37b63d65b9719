package slr.parser.lr;

import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import slr.grammar.Production;
import slr.lexer.LexerKind;
import slr.lexer.Location;
import slr.util.ParserError;

import static org.junit.jupiter.api.Assertions.*;
import static slr.parser.lr.GraphTest.EPSILON;
import static slr.parser.lr.GraphTest.EXPRESSION;

public class LRParserTest {

	private static ParseResult parse(String grammar, String input){
		return Generator.fromGrammar(grammar).parse(input, LexerKind.MAXIMAL_MUNCH);
	}

	private static void assertAccepted(String grammar, String input){
		ParseResult result = parse(grammar, input);
		assertTrue(result.isAccepted(), () -> input + ": " + result.getMessage());
	}

	private static void assertRejected(String grammar, String input){
		assertFalse(parse(grammar, input).isAccepted(), input);
	}

	@Nested
	public class ExpressionGrammar {

		@ParameterizedTest
		@ValueSource(strings = {"id", "id + id * id", "( id + id ) * id", "((id))", "id*id*id+id", "id + ( id * ( id ) )"})
		public void testAccepted(String input){
			assertAccepted(EXPRESSION, input);
		}

		@ParameterizedTest
		@ValueSource(strings = {"", "id +", "+ id", "id id", "( id", "id )", "id + x", "$ id", "id ) ("})
		public void testRejected(String input){
			assertRejected(EXPRESSION, input);
		}

		@Test
		public void testTrace(){
			ParseResult result = parse(EXPRESSION, "id + id * id");
			List<TraceRecord> trace = result.getTrace();
			assertEquals(15, trace.size());

			TraceRecord first = trace.get(0);
			assertEquals(0, first.step);
			assertEquals(TraceRecord.Kind.INITIALIZE, first.kind);
			assertEquals("Initialize", first.action);
			assertEquals("0", first.formatStack());
			assertEquals("id + id * id $", first.formatInput());
			assertEquals("Start parsing", first.details);

			TraceRecord shift = trace.get(1);
			assertEquals(TraceRecord.Kind.SHIFT, shift.kind);
			assertEquals("Shift id", shift.action);
			assertEquals("Move to state 5", shift.details);
			assertEquals("0 id 5", shift.formatStack());
			assertEquals("+ id * id $", shift.formatInput());

			TraceRecord reduce = trace.get(4);
			assertEquals(TraceRecord.Kind.REDUCE, reduce.kind);
			assertEquals("Reduce by E → T", reduce.action);
			assertEquals("Pop 1 symbols, push E, goto state 1", reduce.details);
			assertEquals("0 E 1", reduce.formatStack());

			TraceRecord reduceProduct = trace.get(12);
			assertEquals("Reduce by T → T * F", reduceProduct.action);
			assertEquals("Pop 3 symbols, push T, goto state 9", reduceProduct.details);
			assertEquals("0 E 1 + 6 T 9", reduceProduct.formatStack());
			assertEquals("$", reduceProduct.formatInput());

			TraceRecord accept = result.lastRecord();
			assertEquals(14, accept.step);
			assertEquals(TraceRecord.Kind.ACCEPT, accept.kind);
			assertEquals("Accept", accept.action);
			assertEquals("Input string is valid according to the grammar", accept.details);
			assertEquals("0 E 1", accept.formatStack());
			assertEquals("Input accepted", result.getMessage());
			assertNull(result.getErrorToken());
		}

		@Test
		public void testMissingOperand(){
			ParseResult result = parse(EXPRESSION, "id +");
			assertEquals("No action defined for token '$' in state 6", result.getMessage());
			TraceRecord error = result.lastRecord();
			assertEquals(TraceRecord.Kind.ERROR, error.kind);
			assertEquals("ERROR", error.action);
			assertEquals(result.getMessage(), error.details);
			assertEquals("0 E 1 + 6", error.formatStack());
			assertEquals("$", error.formatInput());
			assertTrue(result.getErrorToken().isEOF());
			assertEquals(new Location(1, 5), result.getErrorToken().location);
		}

		@Test
		public void testOrThrow(){
			ParserError error = assertThrows(ParserError.class, () -> parse(EXPRESSION, "id id").orThrow());
			assertEquals("Error at [1:4]: No action defined for token 'id' in state 5", error.getMessage());
			assertEquals(new Location(1, 4), error.errorLocation);
			ParseResult accepted = parse(EXPRESSION, "id");
			assertSame(accepted, accepted.orThrow());
		}

		@ParameterizedTest
		@EnumSource(LexerKind.class)
		public void testTypedEndMarker(LexerKind kind){
			ParseResult result = Generator.fromGrammar(EXPRESSION).parse("id $", kind);
			assertTrue(result.isAccepted(), result.getMessage());
			assertEquals("$ $", result.lastRecord().formatInput());
		}

		@Test
		public void testFormatTrace(){
			String[] lines = parse(EXPRESSION, "id").formatTrace().split("\n");
			assertEquals(7, lines.length);
			assertTrue(lines[0].startsWith("Step | Action"), lines[0]);
			assertTrue(lines[1].startsWith("0    | Initialize"), lines[1]);
			assertTrue(lines[6].contains("Accept"), lines[6]);
		}
	}

	@Nested
	public class EpsilonGrammar {

		@ParameterizedTest
		@ValueSource(strings = {"", "a", "a a a", "aaaa"})
		public void testAccepted(String input){
			assertAccepted(EPSILON, input);
		}

		@Test
		public void testUnknownToken(){
			ParseResult result = parse(EPSILON, "a a b");
			assertFalse(result.isAccepted());
			assertEquals("No action defined for token 'b' in state 3", result.getMessage());
			assertEquals("b", result.getErrorToken().value);
			assertFalse(result.getErrorToken().known);
			assertEquals("0 a 3 a 3", result.lastRecord().formatStack());
			assertEquals("b $", result.lastRecord().formatInput());
		}

		@Test
		public void testEmptyReduction(){
			List<TraceRecord> trace = parse(EPSILON, "a").getTrace();
			TraceRecord reduce = trace.get(2);
			assertEquals("Reduce by A → ε", reduce.action);
			assertEquals("Pop 0 symbols, push A, goto state 4", reduce.details);
			assertEquals("0 a 3 A 4", reduce.formatStack());
		}
	}

	@Nested
	public class Conflicts {

		@Test
		public void testShiftIsPreferred(){
			ParseResult result = parse("E -> E + E | id", "id + id + id");
			assertTrue(result.isAccepted());
			long shifts = result.getTrace().stream().filter(r -> r.kind == TraceRecord.Kind.SHIFT).count();
			assertEquals(5, shifts);
			// right associative: the first reduction of E + E happens after the last id
			int firstSumReduction = -1;
			for (TraceRecord record : result.getTrace()){
				if (record.action.equals("Reduce by E → E + E")){
					firstSumReduction = record.step;
					break;
				}
			}
			assertEquals("$", result.getTrace().get(firstSumReduction).formatInput());
		}

		@Test
		public void testFirstReductionIsKept(){
			ParseResult result = parse("S -> A | B ; A -> x ; B -> x", "x");
			assertTrue(result.isAccepted());
			assertEquals("Reduce by A → x", result.getTrace().get(2).action);
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {"id + id * id", "( ( id ) ) * id + id", "id + +", "( id"})
	public void testStackHeight(String input){
		Generator generator = Generator.fromGrammar(EXPRESSION);
		List<TraceRecord> trace = generator.parse(input, LexerKind.MAXIMAL_MUNCH).getTrace();
		for (int i = 1; i < trace.size(); i++){
			TraceRecord record = trace.get(i);
			int previous = trace.get(i - 1).stack.size();
			switch (record.kind){
				case SHIFT:
					assertEquals(previous + 2, record.stack.size());
					assertEquals(trace.get(i - 1).input.size() - 1, record.input.size());
					break;
				case REDUCE:
					Production production = reducedProduction(generator, record);
					assertEquals(previous - 2 * production.rightSize() + 2, record.stack.size());
					assertEquals(production.left.name, record.stack.get(record.stack.size() - 2));
					assertEquals(trace.get(i - 1).input, record.input);
					break;
				default:
					assertEquals(trace.size() - 1, i);
			}
		}
	}

	private static Production reducedProduction(Generator generator, TraceRecord record){
		for (Production production : generator.getGrammar().getProductions()){
			if (record.action.equals("Reduce by " + production)){
				return production;
			}
		}
		throw new AssertionError("No production for " + record.action);
	}

	@Test
	public void testTableIsReusable(){
		Generator generator = Generator.fromGrammar(EXPRESSION);
		assertFalse(generator.parse("id +", LexerKind.MAXIMAL_MUNCH).isAccepted());
		ParseResult first = generator.parse("id * ( id )", LexerKind.MAXIMAL_MUNCH);
		ParseResult second = generator.parse("id * ( id )", LexerKind.MAXIMAL_MUNCH);
		assertTrue(first.isAccepted());
		assertEquals(first.formatTrace(), second.formatTrace());
	}

	@Test
	public void testParseOnlyOnce(){
		Generator generator = Generator.fromGrammar(EXPRESSION);
		LRParser parser = new LRParser(generator.getTable(), generator.createLexer("id", LexerKind.MAXIMAL_MUNCH));
		ParseResult result = parser.parse();
		assertSame(result, parser.parse());
		assertEquals(1, parser.currentState());
	}

	@Test
	public void testTokenizers(){
		Generator generator = Generator.fromGrammar("S -> a S | ba");
		assertTrue(generator.parse("a ba", LexerKind.MAXIMAL_MUNCH).isAccepted());
		assertTrue(generator.parse("aba", LexerKind.MAXIMAL_MUNCH).isAccepted());
		assertFalse(generator.parse("bba", LexerKind.MAXIMAL_MUNCH).isAccepted());
		assertFalse(generator.parse("aba", LexerKind.SUBSTITUTION).isAccepted());
	}
}
