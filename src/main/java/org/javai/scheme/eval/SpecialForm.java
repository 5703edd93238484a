package org.javai.scheme.eval;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keywords the evaluator handles itself instead of applying a procedure.
 * A head symbol is resolved to its tag once through {@link #forKeyword(String)}
 * and the evaluator then switches over the tag.
 */
public enum SpecialForm {

	QUOTE("quote", "(quote X)"),
	EVAL("eval", "(eval X)"),
	IF("if", "(if CONDITION THEN ELSE)"),
	DEFINE("define", "(define NAME EXPR)"),
	SET("set!", "(set! NAME EXPR)"),
	LAMBDA("lambda", "(lambda (PARAM...) BODY)"),
	LET("let", "(let ((NAME VALUE)...) BODY...)"),
	BEGIN("begin", "(begin EXPR...)"),
	WHILE("while", "(while CONDITION BODY)");

	private static final Map<String, SpecialForm> BY_KEYWORD = Collections.unmodifiableMap(
			Arrays.stream(values()).collect(Collectors.toMap(SpecialForm::keyword, Function.identity())));

	private final String keyword;
	private final String shape;

	SpecialForm(String keyword, String shape) {
		this.keyword = keyword;
		this.shape = shape;
	}

	public String keyword() {
		return keyword;
	}

	/**
	 * The expected shape, used in malformed-form diagnostics.
	 */
	public String shape() {
		return shape;
	}

	public static Optional<SpecialForm> forKeyword(String name) {
		return Optional.ofNullable(BY_KEYWORD.get(name));
	}
}
