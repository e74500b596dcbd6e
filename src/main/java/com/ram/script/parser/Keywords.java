package com.ram.script.parser;

import java.util.Set;

/** Reserved words and operator sets of the Ram language. */
public final class Keywords {

    public static final String SET = "set";
    public static final String RESET = "reset";
    public static final String DISPLAY = "display";
    public static final String CALL = "call";
    public static final String SEND = "send";
    public static final String BACK = "back";
    public static final String TO = "to";

    public static final String LOOP = "loop";
    public static final String WITH = "with";
    public static final String FROM = "from";

    public static final String IF = "if";
    public static final String ELSE = "else";
    public static final String IS = "is";

    public static final String NEW = "new";
    public static final String FUNCTION = "function";
    public static final String TAKES = "takes";

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    /** Reads one line of user input and evaluates it as an expression. */
    public static final String INPUT = "GET_INPUT";

    // builtin function records seeded into every top-level environment
    public static final String CONVERT_NUMBER = "CONVERT_NUMBER";
    public static final String GET_TEXT = "GET_TEXT";

    public static final Set<String> VAR_TYPES = Set.of("integer", "text", "boolean");

    public static final Set<String> OPERATORS = Set.of("+", "-", "/", "*", NOT, OR, AND, IS);
    public static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");
    public static final Set<String> MULTIPLICATIVE = Set.of("*", "/");
    public static final Set<String> ADDITIVE = Set.of("+", "-");
    public static final Set<String> BOOLEAN = Set.of(AND, OR);

    /** Characters the lexer isolates with surrounding whitespace. */
    public static final String OPERATOR_CHARS = "+-*/";

    private Keywords() {}
}
