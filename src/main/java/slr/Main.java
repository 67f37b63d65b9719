package slr;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import slr.grammar.GrammarError;
import slr.parser.lr.Generator;
import slr.parser.lr.LRParserTable;
import slr.parser.lr.ParseResult;

/**
 * Prints the first and follow sets, the LR(0) states, the SLR(1) table and (if an input is passed) the parser
 * trace for a grammar.
 *
 * Usage: <code>Main "E -> E + T | T ; T -> id" ["id + id"]</code>
 */
public class Main {

	public static void main(String[] args) {
		int status = run(args, utf8(new FileOutputStream(FileDescriptor.out)),
				utf8(new FileOutputStream(FileDescriptor.err)));
		if (status != 0){
			System.exit(status);
		}
	}

	/**
	 * Output uses UTF-8 regardless of the platform encoding, the arrows and dots of productions and items
	 * aren't part of every charset
	 */
	static PrintStream utf8(OutputStream stream){
		return new PrintStream(stream, true, StandardCharsets.UTF_8);
	}

	/**
	 * @return exit status: 0 on success, 1 for usage errors and invalid grammars, 2 for a rejected input
	 */
	static int run(String[] args, PrintStream out, PrintStream err){
		if (args.length < 1 || args.length > 2){
			err.println("Usage: Main \"<grammar>\" [\"<input>\"]");
			return 1;
		}
		Generator generator;
		try {
			generator = Generator.fromGrammar(args[0]);
		} catch (GrammarError error){
			err.println(error.getMessage());
			return 1;
		}
		out.println(generator.getFirstFollow());
		out.println();
		out.println(generator.getGraph());
		out.println();
		out.println(generator.getTable());
		for (LRParserTable.Conflict conflict : generator.getTable().getConflicts()){
			out.println(conflict);
		}
		if (args.length == 2){
			ParseResult result = generator.parse(args[1]);
			out.println();
			out.println(result.formatTrace());
			out.println(result);
			if (!result.isAccepted()){
				return 2;
			}
		}
		return 0;
	}
}
