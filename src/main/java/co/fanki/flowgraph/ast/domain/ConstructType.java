package co.fanki.flowgraph.ast.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The AST node types the builder knows how to translate.
 *
 * <p>Each constant carries the {@code type} tag used by the frontends.
 * Tags that are not listed here resolve to {@link #UNKNOWN}, which the
 * builder turns into a single atom.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ConstructType {

    /** Program root holding a {@code body} list. */
    PROGRAM_ENTRY_POINT("program_entry_point"),

    /** Function holding a {@code body} block or list. */
    FUNCTION_DEFINITION("function_definition"),

    /** Block holding a {@code statements} list. */
    COMPOUND_STATEMENT("compound_statement"),

    /** Assignment. */
    ASSIGNMENT_STATEMENT("assignment_statement"),

    /** Expression evaluated for its side effects. */
    EXPRESSION_STATEMENT("expression_statement"),

    /** Local variable declaration, optionally initialized. */
    VARIABLE_DECLARATION("variable_declaration"),

    /** Call used as a statement. */
    FUNCTION_CALL("function_call"),

    /** Bare condition, treated as a leaf when it is a statement. */
    CONDITION("condition"),

    /** If / else-if / else chain. */
    IF_STATEMENT("if_statement"),

    /** Pre-tested loop. */
    WHILE_LOOP("while_loop"),

    /** Post-tested loop. */
    DO_WHILE_LOOP("do_while_loop"),

    /** Loop over a range or iterable. */
    RANGE_FOR_LOOP("range_for_loop"),

    /** Classic three-clause for loop. */
    GENERAL_FOR_LOOP("general_for_loop"),

    /** Leaves the innermost loop. */
    BREAK_STATEMENT("break_statement"),

    /** Restarts the innermost loop. */
    CONTINUE_STATEMENT("continue_statement"),

    /** Leaves the function. */
    RETURN_STATEMENT("return_statement"),

    /** Raises an exception. */
    THROW_STATEMENT("throw_statement"),

    /** Protected region with handlers and an optional finally block. */
    TRY_STATEMENT("try_statement"),

    /** Anything the frontends produce that has no translation rule. */
    UNKNOWN("");

    private static final Map<String, ConstructType> BY_TAG =
            Arrays.stream(values())
                    .filter(t -> t != UNKNOWN)
                    .collect(Collectors.toUnmodifiableMap(
                            ConstructType::tag, Function.identity()));

    private final String tag;

    ConstructType(final String theTag) {
        this.tag = theTag;
    }

    /**
     * Returns the AST {@code type} tag for this construct.
     *
     * @return the tag, empty for {@link #UNKNOWN}
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a type tag, returning UNKNOWN if not recognized.
     *
     * @param value the AST type tag
     * @return the corresponding construct type or UNKNOWN
     */
    public static ConstructType fromTag(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return BY_TAG.getOrDefault(value.trim(), UNKNOWN);
    }

    /**
     * Checks whether the tag belongs to a built-in construct.
     *
     * @param value the tag to check
     * @return true if the tag has a built-in translation rule
     */
    public static boolean isBuiltIn(final String value) {
        return fromTag(value) != UNKNOWN;
    }

}
