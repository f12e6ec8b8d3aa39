package org.metricshub.jst.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jst
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
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;
import org.metricshub.jst.util.JstLogger;
import org.metricshub.jst.util.ScriptSource;
import org.metricshub.jst.util.SourceSpan;
import org.slf4j.Logger;

/**
 * Converts Structured Text source into a {@link SyntaxNode} tree.
 * <p>
 * It contains the internal state of the parser and the lexer, so an instance
 * must not be shared between threads. Syntax errors never escape: they are
 * returned as diagnostics in the {@link ParseResult}. Inside statement lists
 * and VAR blocks the parser resumes after the next <code>;</code> so that one
 * pass reports as many errors as possible.
 */
public class StParser {

	private static final Logger LOGGER = JstLogger.getLogger(StParser.class);

	/** Lexer token values. */
	enum Token {
		EOF("end of input"),
		ID("identifier"),
		INTEGER("integer"),
		REAL("real number"),
		TIME("duration"),

		SEMICOLON(";"),
		COLON(":"),
		COMMA(","),
		DOT("."),
		DOTDOT(".."),
		ASSIGN(":="),
		OUTPUT_ASSIGN("=>"),
		OPEN_PAREN("("),
		CLOSE_PAREN(")"),

		PLUS("+"),
		MINUS("-"),
		MULT("*"),
		DIVIDE("/"),
		POW("**"),
		EQ("="),
		NE("<>"),
		LT("<"),
		LE("<="),
		GT(">"),
		GE(">="),

		KW_PROGRAM("PROGRAM"),
		KW_END_PROGRAM("END_PROGRAM"),
		KW_VAR("VAR"),
		KW_VAR_INPUT("VAR_INPUT"),
		KW_VAR_OUTPUT("VAR_OUTPUT"),
		KW_VAR_IN_OUT("VAR_IN_OUT"),
		KW_VAR_TEMP("VAR_TEMP"),
		KW_CONSTANT("CONSTANT"),
		KW_RETAIN("RETAIN"),
		KW_END_VAR("END_VAR"),
		KW_IF("IF"),
		KW_THEN("THEN"),
		KW_ELSIF("ELSIF"),
		KW_ELSE("ELSE"),
		KW_END_IF("END_IF"),
		KW_CASE("CASE"),
		KW_OF("OF"),
		KW_END_CASE("END_CASE"),
		KW_FOR("FOR"),
		KW_TO("TO"),
		KW_BY("BY"),
		KW_DO("DO"),
		KW_END_FOR("END_FOR"),
		KW_WHILE("WHILE"),
		KW_END_WHILE("END_WHILE"),
		KW_REPEAT("REPEAT"),
		KW_UNTIL("UNTIL"),
		KW_END_REPEAT("END_REPEAT"),
		KW_RETURN("RETURN"),
		KW_EXIT("EXIT"),
		KW_AND("AND"),
		KW_OR("OR"),
		KW_XOR("XOR"),
		KW_NOT("NOT"),
		KW_MOD("MOD"),
		KW_TRUE("TRUE"),
		KW_FALSE("FALSE");

		private final String symbol;

		Token(String symbol) {
			this.symbol = symbol;
		}

		String getSymbol() {
			return symbol;
		}
	}

	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		for (Token t : Token.values()) {
			if (t.name().startsWith("KW_")) {
				KEYWORDS.put(t.getSymbol(), t);
			}
		}
	}

	private static final Set<Token> VAR_KEYWORDS = EnumSet
			.of(Token.KW_VAR, Token.KW_VAR_INPUT, Token.KW_VAR_OUTPUT, Token.KW_VAR_IN_OUT, Token.KW_VAR_TEMP);

	private static final Set<Token> PROGRAM_END = EnumSet.of(Token.KW_END_PROGRAM);
	private static final Set<Token> VAR_BLOCK_END = EnumSet.of(Token.KW_END_VAR);
	private static final Set<Token> IF_BODY_END = EnumSet.of(Token.KW_ELSIF, Token.KW_ELSE, Token.KW_END_IF);
	private static final Set<Token> ELSE_BODY_END = EnumSet.of(Token.KW_END_IF);
	private static final Set<Token> CASE_BODY_END = EnumSet.of(Token.KW_ELSE, Token.KW_END_CASE);
	private static final Set<Token> CASE_ELSE_END = EnumSet.of(Token.KW_END_CASE);
	private static final Set<Token> FOR_BODY_END = EnumSet.of(Token.KW_END_FOR);
	private static final Set<Token> WHILE_BODY_END = EnumSet.of(Token.KW_END_WHILE);
	private static final Set<Token> REPEAT_BODY_END = EnumSet.of(Token.KW_UNTIL);

	private String sourceDescription;
	private String source;
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

	// lexer state
	private int pos;
	private int c;
	private int line;
	private int column;
	private Token token;
	private final StringBuilder text = new StringBuilder();
	private int tokenOffset;
	private int tokenLine;
	private int tokenColumn;
	private int tokenEnd;
	private int previousTokenEnd;

	/**
	 * Parses a whole program.
	 *
	 * @param scriptSource the program source
	 * @return the syntax tree, or the syntax errors
	 * @throws IOException when the source cannot be read
	 */
	public ParseResult parse(ScriptSource scriptSource) throws IOException {
		return parse(scriptSource.getDescription(), scriptSource.readContent());
	}

	/**
	 * Parses a whole program held in a string.
	 *
	 * @param programSource the program text
	 * @return the syntax tree, or the syntax errors
	 */
	public ParseResult parse(String programSource) {
		return parse(ScriptSource.DESCRIPTION_INLINE, programSource);
	}

	private ParseResult parse(String description, String programSource) {
		init(description, programSource);
		SyntaxNode tree = null;
		try {
			lexer();
			tree = PROGRAM_UNIT();
		} catch (LexerException le) {
			diagnostics.add(Diagnostic.syntaxError(le.getReason(), le.getSpan()));
		} catch (ParserException pe) {
			record(pe);
		}
		if (Diagnostic.hasKind(diagnostics, DiagnosticKind.SYNTAX_ERROR)) {
			tree = null;
		}
		LOGGER.debug("Parsed {}: {} diagnostic(s)", description, diagnostics.size());
		return new ParseResult(tree, diagnostics);
	}

	/**
	 * Parses a standalone expression, e.g. <code>A AND NOT B</code>.
	 *
	 * @param expression the expression text
	 * @return the expression tree, or the syntax errors
	 */
	public ParseResult parseExpression(String expression) {
		init(ScriptSource.DESCRIPTION_INLINE, expression);
		SyntaxNode tree = null;
		try {
			lexer();
			tree = EXPRESSION();
			lexer(Token.EOF);
		} catch (LexerException le) {
			diagnostics.add(Diagnostic.syntaxError(le.getReason(), le.getSpan()));
			tree = null;
		} catch (ParserException pe) {
			record(pe);
			tree = null;
		}
		return new ParseResult(tree, diagnostics);
	}

	private void init(String description, String programSource) {
		this.sourceDescription = description;
		this.source = programSource == null ? "" : programSource;
		diagnostics.clear();
		pos = 0;
		line = 1;
		column = 1;
		c = source.isEmpty() ? -1 : source.charAt(0);
		token = null;
		text.setLength(0);
		tokenOffset = 0;
		tokenLine = 1;
		tokenColumn = 1;
		tokenEnd = 0;
		previousTokenEnd = 0;
	}

	// LEXER

	private void read() {
		if (c < 0) {
			return;
		}
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		pos++;
		c = pos < source.length() ? source.charAt(pos) : -1;
	}

	private int peek(int offset) {
		int index = pos + offset;
		return index < source.length() ? source.charAt(index) : -1;
	}

	private void readAndAppend() {
		text.append((char) c);
		read();
	}

	private void skipWhitespaceAndComments() {
		while (c >= 0) {
			if (Character.isWhitespace(c)) {
				read();
			} else if (c == '/' && peek(1) == '/') {
				while (c >= 0 && c != '\n') {
					read();
				}
			} else if (c == '(' && peek(1) == '*') {
				SourceSpan commentStart = new SourceSpan(pos, 2, line, column);
				read();
				read();
				while (!(c == '*' && peek(1) == ')')) {
					if (c < 0) {
						throw new LexerException("Unterminated comment", sourceDescription, commentStart);
					}
					read();
				}
				read();
				read();
			} else {
				return;
			}
		}
	}

	private Token lexer(Token expectedToken) {
		if (token != expectedToken) {
			throw parserException("Expecting '" + expectedToken.getSymbol() + "', got " + describe());
		}
		return lexer();
	}

	private Token lexer() {
		previousTokenEnd = tokenEnd;
		skipWhitespaceAndComments();
		text.setLength(0);
		tokenOffset = pos;
		tokenLine = line;
		tokenColumn = column;
		token = scan();
		tokenEnd = pos;
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} '{}' at {}:{}", token, text, tokenLine, tokenColumn);
		}
		return token;
	}

	private Token scan() {
		if (c < 0) {
			return Token.EOF;
		}
		if (Character.isLetter(c) || c == '_') {
			return scanWord();
		}
		if (Character.isDigit(c)) {
			return scanNumber();
		}
		int first = c;
		readAndAppend();
		switch (first) {
		case ';':
			return Token.SEMICOLON;
		case ',':
			return Token.COMMA;
		case '(':
			return Token.OPEN_PAREN;
		case ')':
			return Token.CLOSE_PAREN;
		case '+':
			return Token.PLUS;
		case '-':
			return Token.MINUS;
		case '/':
			return Token.DIVIDE;
		case '&':
			return Token.KW_AND;
		case ':':
			if (c == '=') {
				readAndAppend();
				return Token.ASSIGN;
			}
			return Token.COLON;
		case '.':
			if (c == '.') {
				readAndAppend();
				return Token.DOTDOT;
			}
			return Token.DOT;
		case '*':
			if (c == '*') {
				readAndAppend();
				return Token.POW;
			}
			return Token.MULT;
		case '=':
			if (c == '>') {
				readAndAppend();
				return Token.OUTPUT_ASSIGN;
			}
			return Token.EQ;
		case '<':
			if (c == '>') {
				readAndAppend();
				return Token.NE;
			}
			if (c == '=') {
				readAndAppend();
				return Token.LE;
			}
			return Token.LT;
		case '>':
			if (c == '=') {
				readAndAppend();
				return Token.GE;
			}
			return Token.GT;
		default:
			throw lexerException("Invalid character '" + (char) first + "'");
		}
	}

	private Token scanWord() {
		while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
			readAndAppend();
		}
		String upper = text.toString().toUpperCase(Locale.ROOT);
		if (c == '#' && ("T".equals(upper) || "TIME".equals(upper))) {
			readAndAppend();
			if (c == '-') {
				readAndAppend();
			}
			while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_' || c == '.')) {
				readAndAppend();
			}
			try {
				TimeLiterals.parse(text.toString());
			} catch (IllegalArgumentException ex) {
				throw lexerException(ex.getMessage());
			}
			return Token.TIME;
		}
		Token keyword = KEYWORDS.get(upper);
		return keyword == null ? Token.ID : keyword;
	}

	private Token scanNumber() {
		readDigits();
		String digits = text.toString();
		if (c == '#' && ("2".equals(digits) || "8".equals(digits) || "16".equals(digits))) {
			int base = Integer.parseInt(digits);
			readAndAppend();
			int start = text.length();
			while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
				if (c != '_' && Character.digit(c, base) < 0) {
					throw lexerException("Invalid digit '" + (char) c + "' in base " + base + " literal");
				}
				readAndAppend();
			}
			if (text.length() == start) {
				throw lexerException("Missing digits in base " + base + " literal");
			}
			return Token.INTEGER;
		}
		boolean real = false;
		if (c == '.' && peek(1) >= 0 && Character.isDigit(peek(1))) {
			real = true;
			readAndAppend();
			readDigits();
		}
		if (c == 'e' || c == 'E') {
			int sign = peek(1);
			int afterSign = sign == '+' || sign == '-' ? peek(2) : sign;
			if (afterSign >= 0 && Character.isDigit(afterSign)) {
				real = true;
				readAndAppend();
				if (c == '+' || c == '-') {
					readAndAppend();
				}
				readDigits();
			}
		}
		return real ? Token.REAL : Token.INTEGER;
	}

	private void readDigits() {
		while (c >= 0 && (Character.isDigit(c) || c == '_')) {
			readAndAppend();
		}
	}

	// LOOKAHEAD

	/** Snapshot of the lexer, to look past the current token and come back. */
	private static final class LexerState {
		private final int pos;
		private final int c;
		private final int line;
		private final int column;
		private final Token token;
		private final String text;
		private final int tokenOffset;
		private final int tokenLine;
		private final int tokenColumn;
		private final int tokenEnd;
		private final int previousTokenEnd;

		private LexerState(StParser p) {
			pos = p.pos;
			c = p.c;
			line = p.line;
			column = p.column;
			token = p.token;
			text = p.text.toString();
			tokenOffset = p.tokenOffset;
			tokenLine = p.tokenLine;
			tokenColumn = p.tokenColumn;
			tokenEnd = p.tokenEnd;
			previousTokenEnd = p.previousTokenEnd;
		}
	}

	private LexerState mark() {
		return new LexerState(this);
	}

	private void reset(LexerState state) {
		pos = state.pos;
		c = state.c;
		line = state.line;
		column = state.column;
		token = state.token;
		text.setLength(0);
		text.append(state.text);
		tokenOffset = state.tokenOffset;
		tokenLine = state.tokenLine;
		tokenColumn = state.tokenColumn;
		tokenEnd = state.tokenEnd;
		previousTokenEnd = state.previousTokenEnd;
	}

	/**
	 * @param follow tokens that may follow the current one
	 * @return whether the token after the current one is in follow
	 */
	private boolean nextTokenIn(Set<Token> follow) {
		LexerState state = mark();
		try {
			lexer();
			return follow.contains(token);
		} catch (LexerException e) {
			// reported when the parser actually gets there
			return false;
		} finally {
			reset(state);
		}
	}

	// SUPPORTING FUNCTIONS/METHODS

	private SourceSpan currentSpan() {
		return new SourceSpan(tokenOffset, tokenEnd - tokenOffset, tokenLine, tokenColumn);
	}

	private SourceSpan spanFrom(SourceSpan start) {
		int end = Math.max(previousTokenEnd, start.getOffset());
		return new SourceSpan(start.getOffset(), end - start.getOffset(), start.getLine(), start.getColumn());
	}

	private String describe() {
		if (token == Token.EOF) {
			return "end of input";
		}
		return "'" + text + "'";
	}

	private String identifier(String what) {
		if (token != Token.ID) {
			throw parserException("Expecting " + what + ", got " + describe());
		}
		String name = text.toString();
		lexer();
		return name;
	}

	private SyntaxNode identifierNode(String what) {
		SourceSpan start = currentSpan();
		return new SyntaxNode(SyntaxKind.IDENTIFIER, identifier(what), start);
	}

	private void optional(Token t) {
		if (token == t) {
			lexer();
		}
	}

	private void record(ParserException pe) {
		LOGGER.debug("Syntax error: {}", pe.getMessage());
		diagnostics.add(Diagnostic.syntaxError(pe.getReason(), pe.getSpan()));
	}

	/**
	 * Skips tokens up to and including the next <code>;</code>, or up to (but
	 * excluding) a token that closes the enclosing construct.
	 */
	private void synchronize(Set<Token> stops) {
		while (token != Token.EOF && !stops.contains(token)) {
			Token skipped = token;
			lexer();
			if (skipped == Token.SEMICOLON) {
				return;
			}
		}
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, new SourceSpan(tokenOffset, pos - tokenOffset, tokenLine, tokenColumn));
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, sourceDescription, currentSpan());
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM_UNIT : [PROGRAM ID] {VAR_BLOCK} STATEMENT_LIST [END_PROGRAM [;]] EOF
	SyntaxNode PROGRAM_UNIT() {
		SourceSpan start = currentSpan();
		boolean wrapped = token == Token.KW_PROGRAM;
		String name = "";
		if (wrapped) {
			lexer();
			name = identifier("a program name");
		}
		SyntaxNode program = new SyntaxNode(SyntaxKind.PROGRAM, name, start);
		while (VAR_KEYWORDS.contains(token)) {
			try {
				program.add(VAR_BLOCK());
			} catch (ParserException pe) {
				record(pe);
				optional(Token.KW_END_VAR);
			}
		}
		program.add(STATEMENT_LIST(PROGRAM_END));
		if (wrapped) {
			try {
				lexer(Token.KW_END_PROGRAM);
				optional(Token.SEMICOLON);
			} catch (ParserException pe) {
				record(pe);
			}
		}
		if (token != Token.EOF) {
			record(parserException("Unexpected " + describe() + " after the end of the program"));
		}
		program.setSpan(spanFrom(start));
		return program;
	}

	// VAR_BLOCK : (VAR | VAR_INPUT | VAR_OUTPUT | VAR_IN_OUT | VAR_TEMP) [CONSTANT | RETAIN] {VAR_DECL} END_VAR
	SyntaxNode VAR_BLOCK() {
		SourceSpan start = currentSpan();
		SyntaxNode block = new SyntaxNode(SyntaxKind.VAR_BLOCK, token.getSymbol(), start);
		lexer();
		while (token == Token.KW_CONSTANT || token == Token.KW_RETAIN) {
			block.add(new SyntaxNode(SyntaxKind.MODIFIER, token.getSymbol(), currentSpan()));
			lexer();
		}
		while (token != Token.KW_END_VAR) {
			if (token != Token.ID) {
				throw parserException("Expecting a variable declaration or 'END_VAR', got " + describe());
			}
			try {
				block.add(VAR_DECL());
			} catch (ParserException pe) {
				record(pe);
				synchronize(VAR_BLOCK_END);
			}
		}
		lexer(Token.KW_END_VAR);
		block.setSpan(spanFrom(start));
		return block;
	}

	// VAR_DECL : ID {, ID} : TYPE_NAME [:= (INIT_LIST | EXPRESSION)] ;
	SyntaxNode VAR_DECL() {
		SourceSpan start = currentSpan();
		SyntaxNode decl = new SyntaxNode(SyntaxKind.VAR_DECL, null, start);
		decl.add(identifierNode("a variable name"));
		while (token == Token.COMMA) {
			lexer();
			decl.add(identifierNode("a variable name"));
		}
		lexer(Token.COLON);
		SourceSpan typeStart = currentSpan();
		decl.add(new SyntaxNode(SyntaxKind.TYPE_REF, identifier("a type name"), typeStart));
		if (token == Token.ASSIGN) {
			lexer();
			if (token == Token.OPEN_PAREN && isInitList()) {
				decl.add(INIT_LIST());
			} else {
				decl.add(EXPRESSION());
			}
		}
		lexer(Token.SEMICOLON);
		decl.setSpan(spanFrom(start));
		return decl;
	}

	private boolean isInitList() {
		LexerState state = mark();
		try {
			lexer();
			return token == Token.ID && nextTokenIn(EnumSet.of(Token.ASSIGN));
		} finally {
			reset(state);
		}
	}

	// INIT_LIST : ( ID := EXPRESSION {, ID := EXPRESSION} )
	SyntaxNode INIT_LIST() {
		SourceSpan start = currentSpan();
		SyntaxNode list = new SyntaxNode(SyntaxKind.INIT_LIST, null, start);
		lexer(Token.OPEN_PAREN);
		list.add(PARAMETER(false));
		while (token == Token.COMMA) {
			lexer();
			list.add(PARAMETER(false));
		}
		lexer(Token.CLOSE_PAREN);
		list.setSpan(spanFrom(start));
		return list;
	}

	// STATEMENT_LIST : {STATEMENT}
	SyntaxNode STATEMENT_LIST(Set<Token> terminators) {
		return STATEMENT_LIST(terminators, false);
	}

	SyntaxNode STATEMENT_LIST(Set<Token> terminators, boolean caseClause) {
		SourceSpan start = currentSpan();
		SyntaxNode list = new SyntaxNode(SyntaxKind.STATEMENT_LIST, null, start);
		while (token != Token.EOF && !terminators.contains(token) && !(caseClause && isCaseLabelStart())) {
			try {
				list.add(STATEMENT());
			} catch (ParserException pe) {
				record(pe);
				synchronize(terminators);
			}
		}
		list.setSpan(spanFrom(start));
		return list;
	}

	// STATEMENT : ASSIGNMENT_OR_CALL | IF_STATEMENT | CASE_STATEMENT | FOR_STATEMENT
	// | WHILE_STATEMENT | REPEAT_STATEMENT | RETURN ; | EXIT ; | ;
	SyntaxNode STATEMENT() {
		SourceSpan start = currentSpan();
		switch (token) {
		case ID:
			return ASSIGNMENT_OR_CALL();
		case KW_IF:
			return IF_STATEMENT();
		case KW_CASE:
			return CASE_STATEMENT();
		case KW_FOR:
			return FOR_STATEMENT();
		case KW_WHILE:
			return WHILE_STATEMENT();
		case KW_REPEAT:
			return REPEAT_STATEMENT();
		case KW_RETURN:
			lexer();
			lexer(Token.SEMICOLON);
			return new SyntaxNode(SyntaxKind.RETURN, null, spanFrom(start));
		case KW_EXIT:
			lexer();
			lexer(Token.SEMICOLON);
			return new SyntaxNode(SyntaxKind.EXIT, null, spanFrom(start));
		case SEMICOLON:
			// empty statement
			lexer();
			return null;
		default:
			throw parserException("Expecting a statement, got " + describe());
		}
	}

	// ASSIGNMENT_OR_CALL : ID [. ID] := EXPRESSION ; | ID ( [PARAMETER {, PARAMETER}] ) ;
	SyntaxNode ASSIGNMENT_OR_CALL() {
		SourceSpan start = currentSpan();
		String name = identifier("a variable name");
		if (token == Token.OPEN_PAREN) {
			SyntaxNode call = new SyntaxNode(SyntaxKind.FB_CALL, name, start);
			lexer();
			if (token != Token.CLOSE_PAREN) {
				call.add(PARAMETER(true));
				while (token == Token.COMMA) {
					lexer();
					call.add(PARAMETER(true));
				}
			}
			lexer(Token.CLOSE_PAREN);
			lexer(Token.SEMICOLON);
			call.setSpan(spanFrom(start));
			return call;
		}
		SyntaxNode target = VARIABLE_REF(name, start);
		if (token == Token.EQ) {
			throw parserException("Expecting ':=' for an assignment, got '='");
		}
		lexer(Token.ASSIGN);
		SyntaxNode value = EXPRESSION();
		lexer(Token.SEMICOLON);
		SyntaxNode assignment = new SyntaxNode(SyntaxKind.ASSIGNMENT, null, spanFrom(start));
		return assignment.add(target).add(value);
	}

	// VARIABLE_REF : ID [. ID]   (the first ID is already consumed)
	SyntaxNode VARIABLE_REF(String name, SourceSpan start) {
		if (token == Token.DOT) {
			lexer();
			SyntaxNode member = identifierNode("a member name");
			SyntaxNode access = new SyntaxNode(SyntaxKind.MEMBER_ACCESS, name, spanFrom(start));
			return access.add(member);
		}
		return new SyntaxNode(SyntaxKind.VARIABLE, name, spanFrom(start));
	}

	// PARAMETER : ID := EXPRESSION | ID => ID [. ID]
	SyntaxNode PARAMETER(boolean allowOutput) {
		SourceSpan start = currentSpan();
		if (token != Token.ID || !nextTokenIn(EnumSet.of(Token.ASSIGN, Token.OUTPUT_ASSIGN))) {
			throw parserException("Expecting a named parameter such as 'IN := value', got " + describe());
		}
		String name = identifier("a parameter name");
		if (token == Token.OUTPUT_ASSIGN) {
			if (!allowOutput) {
				throw parserException("Output binding '=>' is not allowed here");
			}
			lexer();
			SourceSpan targetStart = currentSpan();
			SyntaxNode target = VARIABLE_REF(identifier("a variable name"), targetStart);
			return new SyntaxNode(SyntaxKind.OUTPUT_ARGUMENT, name, spanFrom(start)).add(target);
		}
		lexer(Token.ASSIGN);
		SyntaxNode value = EXPRESSION();
		return new SyntaxNode(SyntaxKind.ARGUMENT, name, spanFrom(start)).add(value);
	}

	// IF_STATEMENT : IF EXPRESSION THEN STATEMENT_LIST {ELSIF EXPRESSION THEN STATEMENT_LIST}
	// [ELSE STATEMENT_LIST] END_IF [;]
	SyntaxNode IF_STATEMENT() {
		SourceSpan start = currentSpan();
		SyntaxNode ifNode = new SyntaxNode(SyntaxKind.IF, null, start);
		do {
			SourceSpan branchStart = currentSpan();
			lexer();
			SyntaxNode condition = EXPRESSION();
			lexer(Token.KW_THEN);
			SyntaxNode body = STATEMENT_LIST(IF_BODY_END);
			ifNode.add(new SyntaxNode(SyntaxKind.IF_BRANCH, null, spanFrom(branchStart)).add(condition).add(body));
		} while (token == Token.KW_ELSIF);
		if (token == Token.KW_ELSE) {
			SourceSpan elseStart = currentSpan();
			lexer();
			SyntaxNode body = STATEMENT_LIST(ELSE_BODY_END);
			ifNode.add(new SyntaxNode(SyntaxKind.ELSE_CLAUSE, null, spanFrom(elseStart)).add(body));
		}
		lexer(Token.KW_END_IF);
		optional(Token.SEMICOLON);
		ifNode.setSpan(spanFrom(start));
		return ifNode;
	}

	// CASE_STATEMENT : CASE EXPRESSION OF {CASE_CLAUSE} [ELSE STATEMENT_LIST] END_CASE [;]
	SyntaxNode CASE_STATEMENT() {
		SourceSpan start = currentSpan();
		SyntaxNode caseNode = new SyntaxNode(SyntaxKind.CASE, null, start);
		lexer(Token.KW_CASE);
		caseNode.add(EXPRESSION());
		lexer(Token.KW_OF);
		while (token != Token.KW_ELSE && token != Token.KW_END_CASE && token != Token.EOF) {
			caseNode.add(CASE_CLAUSE());
		}
		if (token == Token.KW_ELSE) {
			SourceSpan elseStart = currentSpan();
			lexer();
			SyntaxNode body = STATEMENT_LIST(CASE_ELSE_END);
			caseNode.add(new SyntaxNode(SyntaxKind.ELSE_CLAUSE, null, spanFrom(elseStart)).add(body));
		}
		lexer(Token.KW_END_CASE);
		optional(Token.SEMICOLON);
		caseNode.setSpan(spanFrom(start));
		return caseNode;
	}

	// CASE_CLAUSE : CASE_LABEL {, CASE_LABEL} : STATEMENT_LIST
	// CASE_LABEL : ADDITIVE_EXPRESSION [.. ADDITIVE_EXPRESSION]
	SyntaxNode CASE_CLAUSE() {
		SourceSpan start = currentSpan();
		SyntaxNode labels = new SyntaxNode(SyntaxKind.CASE_LABELS, null, start);
		do {
			if (token == Token.COMMA) {
				lexer();
			}
			SourceSpan labelStart = currentSpan();
			SyntaxNode low = ADDITIVE_EXPRESSION();
			if (token == Token.DOTDOT) {
				lexer();
				SyntaxNode high = ADDITIVE_EXPRESSION();
				labels.add(new SyntaxNode(SyntaxKind.CASE_RANGE, null, spanFrom(labelStart)).add(low).add(high));
			} else {
				labels.add(low);
			}
		} while (token == Token.COMMA);
		labels.setSpan(spanFrom(start));
		lexer(Token.COLON);
		SyntaxNode body = STATEMENT_LIST(CASE_BODY_END, true);
		return new SyntaxNode(SyntaxKind.CASE_CLAUSE, null, spanFrom(start)).add(labels).add(body);
	}

	/**
	 * A case label starts with a number, a sign, or an identifier directly
	 * followed by <code>:</code>, <code>,</code> or <code>..</code>, none of
	 * which can start a statement.
	 */
	private boolean isCaseLabelStart() {
		if (token == Token.INTEGER || token == Token.MINUS || token == Token.PLUS) {
			return true;
		}
		return token == Token.ID && nextTokenIn(EnumSet.of(Token.COLON, Token.COMMA, Token.DOTDOT));
	}

	// FOR_STATEMENT : FOR ID := EXPRESSION TO EXPRESSION [BY EXPRESSION] DO STATEMENT_LIST END_FOR [;]
	SyntaxNode FOR_STATEMENT() {
		SourceSpan start = currentSpan();
		SyntaxNode forNode = new SyntaxNode(SyntaxKind.FOR, null, start);
		lexer(Token.KW_FOR);
		forNode.add(identifierNode("a loop variable"));
		lexer(Token.ASSIGN);
		forNode.add(EXPRESSION());
		lexer(Token.KW_TO);
		forNode.add(EXPRESSION());
		if (token == Token.KW_BY) {
			SourceSpan stepStart = currentSpan();
			lexer();
			SyntaxNode step = EXPRESSION();
			forNode.add(new SyntaxNode(SyntaxKind.STEP, null, spanFrom(stepStart)).add(step));
		}
		lexer(Token.KW_DO);
		forNode.add(STATEMENT_LIST(FOR_BODY_END));
		lexer(Token.KW_END_FOR);
		optional(Token.SEMICOLON);
		forNode.setSpan(spanFrom(start));
		return forNode;
	}

	// WHILE_STATEMENT : WHILE EXPRESSION DO STATEMENT_LIST END_WHILE [;]
	SyntaxNode WHILE_STATEMENT() {
		SourceSpan start = currentSpan();
		lexer(Token.KW_WHILE);
		SyntaxNode condition = EXPRESSION();
		lexer(Token.KW_DO);
		SyntaxNode body = STATEMENT_LIST(WHILE_BODY_END);
		lexer(Token.KW_END_WHILE);
		optional(Token.SEMICOLON);
		return new SyntaxNode(SyntaxKind.WHILE, null, spanFrom(start)).add(condition).add(body);
	}

	// REPEAT_STATEMENT : REPEAT STATEMENT_LIST UNTIL EXPRESSION [;] END_REPEAT [;]
	SyntaxNode REPEAT_STATEMENT() {
		SourceSpan start = currentSpan();
		lexer(Token.KW_REPEAT);
		SyntaxNode body = STATEMENT_LIST(REPEAT_BODY_END);
		lexer(Token.KW_UNTIL);
		SyntaxNode condition = EXPRESSION();
		optional(Token.SEMICOLON);
		lexer(Token.KW_END_REPEAT);
		optional(Token.SEMICOLON);
		return new SyntaxNode(SyntaxKind.REPEAT, null, spanFrom(start)).add(body).add(condition);
	}

	// EXPRESSION : XOR_EXPRESSION {OR XOR_EXPRESSION}
	SyntaxNode EXPRESSION() {
		SyntaxNode left = XOR_EXPRESSION();
		while (token == Token.KW_OR) {
			lexer();
			left = binary("OR", left, XOR_EXPRESSION());
		}
		return left;
	}

	// XOR_EXPRESSION : AND_EXPRESSION {XOR AND_EXPRESSION}
	SyntaxNode XOR_EXPRESSION() {
		SyntaxNode left = AND_EXPRESSION();
		while (token == Token.KW_XOR) {
			lexer();
			left = binary("XOR", left, AND_EXPRESSION());
		}
		return left;
	}

	// AND_EXPRESSION : EQUALITY_EXPRESSION {(AND | &) EQUALITY_EXPRESSION}
	SyntaxNode AND_EXPRESSION() {
		SyntaxNode left = EQUALITY_EXPRESSION();
		while (token == Token.KW_AND) {
			lexer();
			left = binary("AND", left, EQUALITY_EXPRESSION());
		}
		return left;
	}

	// EQUALITY_EXPRESSION : RELATIONAL_EXPRESSION {(= | <>) RELATIONAL_EXPRESSION}
	SyntaxNode EQUALITY_EXPRESSION() {
		SyntaxNode left = RELATIONAL_EXPRESSION();
		while (token == Token.EQ || token == Token.NE) {
			String op = token.getSymbol();
			lexer();
			left = binary(op, left, RELATIONAL_EXPRESSION());
		}
		return left;
	}

	// RELATIONAL_EXPRESSION : ADDITIVE_EXPRESSION {(< | <= | > | >=) ADDITIVE_EXPRESSION}
	SyntaxNode RELATIONAL_EXPRESSION() {
		SyntaxNode left = ADDITIVE_EXPRESSION();
		while (token == Token.LT || token == Token.LE || token == Token.GT || token == Token.GE) {
			String op = token.getSymbol();
			lexer();
			left = binary(op, left, ADDITIVE_EXPRESSION());
		}
		return left;
	}

	// ADDITIVE_EXPRESSION : MULTIPLICATIVE_EXPRESSION {(+ | -) MULTIPLICATIVE_EXPRESSION}
	SyntaxNode ADDITIVE_EXPRESSION() {
		SyntaxNode left = MULTIPLICATIVE_EXPRESSION();
		while (token == Token.PLUS || token == Token.MINUS) {
			String op = token.getSymbol();
			lexer();
			left = binary(op, left, MULTIPLICATIVE_EXPRESSION());
		}
		return left;
	}

	// MULTIPLICATIVE_EXPRESSION : POWER_EXPRESSION {(* | / | MOD) POWER_EXPRESSION}
	SyntaxNode MULTIPLICATIVE_EXPRESSION() {
		SyntaxNode left = POWER_EXPRESSION();
		while (token == Token.MULT || token == Token.DIVIDE || token == Token.KW_MOD) {
			String op = token.getSymbol();
			lexer();
			left = binary(op, left, POWER_EXPRESSION());
		}
		return left;
	}

	// POWER_EXPRESSION : UNARY_EXPRESSION {** UNARY_EXPRESSION}
	SyntaxNode POWER_EXPRESSION() {
		SyntaxNode left = UNARY_EXPRESSION();
		while (token == Token.POW) {
			lexer();
			left = binary("**", left, UNARY_EXPRESSION());
		}
		return left;
	}

	// UNARY_EXPRESSION : (NOT | - | +) UNARY_EXPRESSION | PRIMARY
	SyntaxNode UNARY_EXPRESSION() {
		SourceSpan start = currentSpan();
		if (token == Token.KW_NOT || token == Token.MINUS) {
			String op = token.getSymbol();
			lexer();
			SyntaxNode operand = UNARY_EXPRESSION();
			return new SyntaxNode(SyntaxKind.UNARY, op, spanFrom(start)).add(operand);
		}
		if (token == Token.PLUS) {
			lexer();
			return UNARY_EXPRESSION();
		}
		return PRIMARY();
	}

	// PRIMARY : INTEGER | REAL | TIME | TRUE | FALSE | ( EXPRESSION ) | ID [. ID]
	// | ID ( [ARGUMENT {, ARGUMENT}] )
	SyntaxNode PRIMARY() {
		SourceSpan start = currentSpan();
		String image = text.toString();
		switch (token) {
		case INTEGER:
			lexer();
			return new SyntaxNode(SyntaxKind.INT_LITERAL, image, start);
		case REAL:
			lexer();
			return new SyntaxNode(SyntaxKind.REAL_LITERAL, image, start);
		case TIME:
			lexer();
			return new SyntaxNode(SyntaxKind.TIME_LITERAL, image, start);
		case KW_TRUE:
		case KW_FALSE:
			lexer();
			return new SyntaxNode(SyntaxKind.BOOL_LITERAL, image.toUpperCase(Locale.ROOT), start);
		case OPEN_PAREN:
			lexer();
			SyntaxNode inner = EXPRESSION();
			lexer(Token.CLOSE_PAREN);
			return inner;
		case ID:
			lexer();
			if (token == Token.OPEN_PAREN) {
				return FUNCTION_CALL(image, start);
			}
			return VARIABLE_REF(image, start);
		default:
			throw parserException("Expecting an expression, got " + describe());
		}
	}

	// FUNCTION_CALL : ( [ARGUMENT {, ARGUMENT}] )   (the name is already consumed)
	// ARGUMENT : [ID :=] EXPRESSION
	SyntaxNode FUNCTION_CALL(String name, SourceSpan start) {
		SyntaxNode call = new SyntaxNode(SyntaxKind.FUNCTION_CALL, name, start);
		lexer(Token.OPEN_PAREN);
		if (token != Token.CLOSE_PAREN) {
			do {
				if (token == Token.COMMA) {
					lexer();
				}
				SourceSpan argStart = currentSpan();
				String argName = null;
				if (token == Token.ID && nextTokenIn(EnumSet.of(Token.ASSIGN))) {
					argName = identifier("a parameter name");
					lexer(Token.ASSIGN);
				}
				SyntaxNode value = EXPRESSION();
				call.add(new SyntaxNode(SyntaxKind.ARGUMENT, argName, spanFrom(argStart)).add(value));
			} while (token == Token.COMMA);
		}
		lexer(Token.CLOSE_PAREN);
		call.setSpan(spanFrom(start));
		return call;
	}

	// CHECKSTYLE.ON: MethodName

	private static SyntaxNode binary(String op, SyntaxNode left, SyntaxNode right) {
		SyntaxNode node = new SyntaxNode(SyntaxKind.BINARY, op, left.getSpan().to(right.getSpan()));
		return node.add(left).add(right);
	}
}
