package com.hdlformatter.plugins.verilog.line;

import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Classifies raw lines. Classification is cheap and recomputed by every pass.
 */
public final class LineClassifier {
    private static final Pattern COMMENT = Pattern.compile("^\\s*//");
    private static final Pattern DIRECTIVE = Pattern.compile("^\\s*`(ifn?def|elsif|else|endif)\\b");
    private static final Pattern NET = Pattern.compile("^\\s*(wire|reg|logic|integer)\\b");
    private static final Pattern PORT = Pattern.compile("^\\s*(input|output|inout)\\b");
    private static final Pattern PARAMETER = Pattern.compile("^\\s*(parameter|localparam)\\b");
    private static final Pattern ASSIGN = Pattern.compile("^\\s*assign\\b");
    private static final Pattern GENERIC_ASSIGNMENT = Pattern.compile("^(.*?)\\s*(<=|=)(?!=).*;\\s*(//.*)?$");
    private static final Pattern CONTROL_KEYWORD = Pattern.compile(
            "^\\s*(if|else|for|while|case[xz]?|always\\w*|initial|begin|end\\w*|module|function|task|return)\\b");

    private LineClassifier() {
    }

    /**
     * Classifies a line. {@code continuing} marks a line that follows an unterminated declaration.
     */
    public static LineKind classify(String line, boolean continuing) {
        if (continuing) {
            return LineKind.CONTINUATION;
        }
        if (Texts.isBlank(line)) {
            return LineKind.BLANK;
        }
        if (COMMENT.matcher(line).find()) {
            return LineKind.COMMENT;
        }
        if (DIRECTIVE.matcher(line).find()) {
            return LineKind.DIRECTIVE;
        }
        if (declarationKind(line) != DeclarationKind.NONE) {
            return LineKind.DECLARATION_START;
        }
        return LineKind.OTHER;
    }

    /**
     * Returns the declaration kind a line starts, ignoring the module-level assignment heuristic.
     */
    public static DeclarationKind declarationKind(String line) {
        if (PORT.matcher(line).find()) {
            return DeclarationKind.PORT;
        }
        if (NET.matcher(line).find()) {
            return DeclarationKind.NET;
        }
        if (PARAMETER.matcher(line).find()) {
            return DeclarationKind.PARAMETER;
        }
        if (ASSIGN.matcher(line).find()) {
            return DeclarationKind.ASSIGNMENT;
        }
        return DeclarationKind.NONE;
    }

    public static boolean isComment(String line) {
        return COMMENT.matcher(line).find();
    }

    public static boolean isDirective(String line) {
        return DIRECTIVE.matcher(line).find();
    }

    /**
     * Comment or conditional-compilation directive: lines that never break a group.
     */
    public static boolean isCommentOrDirective(String line) {
        return isComment(line) || isDirective(line);
    }

    public static boolean isPortDeclaration(String line) {
        return PORT.matcher(line).find();
    }

    /**
     * A single-line {@code lhs = rhs;} or {@code lhs <= rhs;} statement that is not a declaration.
     */
    public static boolean isGenericAssignment(String line) {
        return GENERIC_ASSIGNMENT.matcher(line).find()
                && !CONTROL_KEYWORD.matcher(line).find()
                && !PARAMETER.matcher(line).find()
                && !NET.matcher(line).find()
                && !PORT.matcher(line).find();
    }

    /**
     * True when the code part of a declaration carries an initializer.
     */
    public static boolean hasInitializer(String line) {
        return Texts.stripComment(line).contains("=");
    }
}
