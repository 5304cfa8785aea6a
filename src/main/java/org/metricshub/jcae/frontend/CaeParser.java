package org.metricshub.jcae.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jcae
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jcae.intermediate.Instruction;
import org.metricshub.jcae.intermediate.Opcode;
import org.metricshub.jcae.intermediate.Procedure;
import org.metricshub.jcae.intermediate.RegionReference;
import org.metricshub.jcae.util.CaeLogger;
import org.metricshub.jcae.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts Cae scripts into {@link ParsedProgram} declarations.
 * <p>
 * Recursive descent parser over the tokens of a {@link CaeLexer}:
 *
 * <pre>
 * SCRIPT      := { REGION | PROCEDURE } EOF
 * REGION      := region IDENTIFIER [ INTEGER ] ;
 * PROCEDURE   := proc IDENTIFIER : BODY ;
 * BODY        := { INSTRUCTION }
 * INSTRUCTION := + | - | &gt; | &lt; | ~ | . | , | "XX
 *              | [ BODY ] | ^ REF | &amp; REF
 *              | IDENTIFIER [ CLAUSE ] | ( BODY ) [ CLAUSE ]
 * CLAUSE      := @ REF | $
 * REF         := IDENTIFIER | $
 * </pre>
 *
 * Loop brackets must balance within the procedure body they appear in,
 * anonymous bodies included: a <code>[</code> cannot be closed after the
 * <code>)</code> of its anonymous procedure, and a <code>]</code> cannot
 * close a loop of the enclosing body. Both cases raise a
 * {@link BracketScopeException}.
 */
public class CaeParser {

	private static final Logger LOG = CaeLogger.getLogger(CaeParser.class);

	private CaeLexer lexer;
	private Token token;
	private ParsedProgram program;

	/**
	 * Parse a single script.
	 *
	 * @param source the script
	 * @return its declarations
	 * @throws IOException upon an IO error
	 * @throws LexerException if the text cannot be tokenized
	 * @throws ParserException if the tokens do not form a valid script
	 */
	public ParsedProgram parse(ScriptSource source) throws IOException {
		ParsedProgram result = new ParsedProgram();
		parse(source, result);
		return result;
	}

	/**
	 * Parse the script and append its declarations to <code>into</code>.
	 *
	 * @param source the script
	 * @param into declarations of the scripts parsed so far
	 * @throws IOException upon an IO error
	 * @throws LexerException if the text cannot be tokenized
	 * @throws ParserException if the tokens do not form a valid script
	 */
	public void parse(ScriptSource source, ParsedProgram into) throws IOException {
		if (source == null) {
			throw new IOException("No script source supplied");
		}
		this.program = into;
		this.lexer = new CaeLexer(source);
		int regionsBefore = into.getRegions().size();
		int proceduresBefore = into.getProcedures().size();
		lexer();
		SCRIPT();
		LOG
				.debug(
						"Parsed {} region(s) and {} procedure(s) from {}",
						into.getRegions().size() - regionsBefore,
						into.getProcedures().size() - proceduresBefore,
						source.getDescription());
	}

	private Token lexer() throws IOException {
		token = lexer.lexer();
		return token;
	}

	private Token lexer(Token expectedToken) throws IOException {
		if (token != expectedToken) {
			throw parserException("Expecting " + expectedToken.name() + ". Found: " + describeToken());
		}
		return lexer();
	}

	private String describeToken() {
		if (token == Token.EOF) {
			return "EOF";
		}
		return token.name() + " (" + lexer.getText() + ")";
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// SCRIPT : { REGION | PROCEDURE } EOF
	void SCRIPT() throws IOException {
		while (token != Token.EOF) {
			if (token == Token.KW_REGION) {
				REGION();
			} else if (token == Token.KW_PROC) {
				PROCEDURE();
			} else {
				throw parserException("Expecting 'region' or 'proc' declaration. Found: " + describeToken());
			}
		}
	}

	// REGION : region IDENTIFIER [ INTEGER ] ;
	void REGION() throws IOException {
		int line = lexer.getTokenLineNumber();
		int col = lexer.getTokenColumn();
		lexer(Token.KW_REGION);
		String name = IDENTIFIER("region name");
		lexer(Token.OPEN_BRACKET);
		if (token != Token.INTEGER) {
			throw parserException("Expecting size of region '" + name + "'. Found: " + describeToken());
		}
		int capacity;
		try {
			capacity = Integer.parseInt(lexer.getText());
		} catch (NumberFormatException nfe) {
			throw parserException("Size of region '" + name + "' is too large: " + lexer.getText());
		}
		if (capacity < 1) {
			throw parserException("Size of region '" + name + "' must be strictly positive");
		}
		if (capacity > RegionDeclaration.MAX_CAPACITY) {
			throw parserException(
					"Size of region '" + name + "' is too large: " + capacity + " (at most " + RegionDeclaration.MAX_CAPACITY
							+ ")");
		}
		lexer();
		lexer(Token.CLOSE_BRACKET);
		lexer(Token.SEMICOLON);
		program.addRegion(new RegionDeclaration(name, capacity, lexer.getSourceDescription(), line, col));
	}

	// PROCEDURE : proc IDENTIFIER : BODY ;
	void PROCEDURE() throws IOException {
		int line = lexer.getTokenLineNumber();
		int col = lexer.getTokenColumn();
		lexer(Token.KW_PROC);
		String name = IDENTIFIER("procedure name");
		lexer(Token.COLON);
		List<Instruction> body = BODY(new BodyScope(name), -1, -1);
		lexer(Token.SEMICOLON);
		program.addProcedure(Procedure.named(name, body, lexer.getSourceDescription(), line, col));
	}

	// BODY : { INSTRUCTION }
	// loopLine/loopCol locate the '[' this body belongs to, -1 outside of a loop
	List<Instruction> BODY(BodyScope scope, int loopLine, int loopCol) throws IOException {
		boolean inLoop = loopLine > 0;
		List<Instruction> instructions = new ArrayList<Instruction>();
		while (true) {
			int line = lexer.getTokenLineNumber();
			int col = lexer.getTokenColumn();
			switch (token) {
			case PLUS:
				instructions.add(simple(Opcode.INCREMENT, line, col));
				break;
			case MINUS:
				instructions.add(simple(Opcode.DECREMENT, line, col));
				break;
			case GT:
				instructions.add(simple(Opcode.MOVE_RIGHT, line, col));
				break;
			case LT:
				instructions.add(simple(Opcode.MOVE_LEFT, line, col));
				break;
			case TILDE:
				instructions.add(simple(Opcode.RESET_HEAD, line, col));
				break;
			case DOT:
				instructions.add(simple(Opcode.OUTPUT, line, col));
				break;
			case COMMA:
				instructions.add(simple(Opcode.INPUT, line, col));
				break;
			case HEX_LITERAL:
				instructions.add(Instruction.writeLiteral(lexer.getLiteral(), line, col));
				lexer();
				break;
			case OPEN_BRACKET: {
				lexer();
				List<Instruction> loopBody = BODY(scope, line, col);
				lexer(Token.CLOSE_BRACKET);
				instructions.add(Instruction.loop(loopBody, line, col));
				break;
			}
			case CLOSE_BRACKET:
				if (inLoop) {
					return instructions;
				}
				throw new BracketScopeException(
						"Unmatched ']' in " + scope.describe(),
						lexer.getSourceDescription(),
						line,
						col);
			case CLOSE_PAREN:
			case SEMICOLON:
			case EOF:
				if (inLoop) {
					throw new BracketScopeException(
							"Loop opened at line " + loopLine + ", column " + loopCol + " is not closed before "
									+ describeToken() + " in " + scope.describe(),
							lexer.getSourceDescription(),
							line,
							col,
							loopLine,
							loopCol);
				}
				return instructions;
			case CARET:
				lexer();
				instructions.add(Instruction.send(REF(), line, col));
				break;
			case AMPERSAND:
				lexer();
				instructions.add(Instruction.receive(REF(), line, col));
				break;
			case IDENTIFIER: {
				String name = lexer.getText();
				lexer();
				instructions.add(Instruction.call(name, CLAUSE(), line, col));
				break;
			}
			case OPEN_PAREN: {
				lexer();
				BodyScope anonymousScope = new BodyScope(scope.nextAnonymousLabel());
				List<Instruction> anonymousBody = BODY(anonymousScope, -1, -1);
				if (token != Token.CLOSE_PAREN) {
					throw parserException(
							"Expecting ')' to close the anonymous procedure opened at line " + line + ", column "
									+ col + ". Found: " + describeToken());
				}
				lexer();
				Procedure anonymous = Procedure
						.anonymous(anonymousScope.label, anonymousBody, lexer.getSourceDescription(), line, col);
				instructions.add(Instruction.callAnonymous(anonymous, CLAUSE(), line, col));
				break;
			}
			default:
				throw parserException("Unexpected " + describeToken() + " in " + scope.describe());
			}
		}
	}

	private Instruction simple(Opcode opcode, int line, int col) throws IOException {
		lexer();
		return Instruction.simple(opcode, line, col);
	}

	// CLAUSE : @ REF | $
	// returns null when there is no clause
	RegionReference CLAUSE() throws IOException {
		if (token == Token.AT) {
			lexer();
			return REF();
		} else if (token == Token.DOLLAR) {
			lexer();
			return RegionReference.BACK_REFERENCE;
		} else {
			return null;
		}
	}

	// REF : IDENTIFIER | $
	RegionReference REF() throws IOException {
		if (token == Token.DOLLAR) {
			lexer();
			return RegionReference.BACK_REFERENCE;
		}
		return RegionReference.named(IDENTIFIER("region name or '$'"));
	}

	private String IDENTIFIER(String what) throws IOException {
		if (token != Token.IDENTIFIER) {
			throw parserException("Expecting " + what + ". Found: " + describeToken());
		}
		String name = lexer.getText();
		lexer();
		return name;
	}
	// CHECKSTYLE.ON: MethodName

	private ParserException parserException(String msg) {
		return new ParserException(
				msg,
				lexer.getSourceDescription(),
				lexer.getTokenLineNumber(),
				lexer.getTokenColumn());
	}

	/**
	 * The procedure body being parsed, named or anonymous. Loops share the
	 * scope of the body they appear in.
	 */
	private static final class BodyScope {

		private final String label;
		private int anonymousCount;

		private BodyScope(String label) {
			this.label = label;
		}

		private String nextAnonymousLabel() {
			anonymousCount++;
			return label + "-anon-" + anonymousCount;
		}

		private String describe() {
			return "procedure " + label;
		}
	}
}
