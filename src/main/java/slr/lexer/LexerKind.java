package slr.lexer;

import java.util.Collection;

import slr.SLRException;
import slr.grammar.Terminal;

/**
 * The available tokenizers.
 */
public enum LexerKind {

	MAXIMAL_MUNCH("munch") {
		@Override
		public Lexer create(Collection<Terminal> terminals, String input) {
			return new MaximalMunchLexer(terminals, input);
		}
	},
	SUBSTITUTION("substitution") {
		@Override
		public Lexer create(Collection<Terminal> terminals, String input) {
			return new SubstitutionLexer(terminals, input);
		}
	};

	/**
	 * Name used in the configuration
	 */
	public final String configName;

	LexerKind(String configName) {
		this.configName = configName;
	}

	public abstract Lexer create(Collection<Terminal> terminals, String input);

	public static LexerKind forName(String configName){
		for (LexerKind kind : values()){
			if (kind.configName.equals(configName)){
				return kind;
			}
		}
		throw new SLRException(String.format("Unknown tokenizer \"%s\"", configName));
	}
}
