package com.hdlformatter.plugins.verilog;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.align.AssignmentAligner;
import com.hdlformatter.plugins.verilog.align.ParameterAligner;
import com.hdlformatter.plugins.verilog.align.WireDeclarationAligner;
import com.hdlformatter.plugins.verilog.comment.CommentFormatter;
import com.hdlformatter.plugins.verilog.directive.MacroAnnotator;
import com.hdlformatter.plugins.verilog.line.DeclarationKind;
import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.plugins.verilog.line.LineKind;
import com.hdlformatter.plugins.verilog.structure.ModuleHeaderFormatter;
import com.hdlformatter.util.Texts;

/**
 * First stage of the pipeline. Scans the document once, top to bottom:
 * <ul>
 *   <li>trims trailing whitespace and tags {@code `else}/{@code `endif} with their macro symbol,</li>
 *   <li>collects module headers and hands them to {@link ModuleHeaderFormatter},</li>
 *   <li>compresses runs of blank lines,</li>
 *   <li>collects runs of related declarations into groups and renders each group through its aligner,</li>
 *   <li>moves trailing comments to the comment column and wraps over-long comment lines.</li>
 * </ul>
 * Comments, directives and blank lines never break a group by themselves. A net/variable group that is not a
 * port group closes after {@value #GAP_LIMIT} consecutive such lines; port groups stay open across any number.
 */
public class DeclarationGrouper implements LinePass {
    static final int GAP_LIMIT = 3;

    private static final Pattern MODULE_START = Pattern.compile("^\\s*(module|macromodule)\\b");
    private static final Pattern FUNCTION_START = Pattern.compile("^\\s*(function|task)\\b");
    private static final Pattern FUNCTION_END = Pattern.compile("^\\s*(endfunction|endtask)\\b");
    private static final Pattern PROCEDURAL = Pattern.compile("^\\s*(always\\w*|initial|final)\\b");
    private static final Pattern BEGIN = Pattern.compile("\\bbegin\\b");
    private static final Pattern END = Pattern.compile("\\bend\\b");

    private enum Family {
        WIRE, PARAMETER, ASSIGNMENT
    }

    private final FormatConfig config;
    private final ModuleHeaderFormatter headerFormatter;
    private final CommentFormatter commentFormatter;
    private final WireDeclarationAligner wireAligner;
    private final ParameterAligner parameterAligner = new ParameterAligner();
    private final AssignmentAligner assignmentAligner = new AssignmentAligner();

    public DeclarationGrouper(FormatConfig config) {
        this.config = config;
        this.headerFormatter = new ModuleHeaderFormatter(config);
        this.commentFormatter = new CommentFormatter(config);
        this.wireAligner = new WireDeclarationAligner(config);
    }

    @Override
    public String getName() {
        return "declaration-groups";
    }

    @Override
    public List<String> apply(List<String> lines) {
        return new Scan(lines).run();
    }

    /**
     * One run of related declarations. Lines after the last member are gap lines (comments, directives,
     * blanks) that are emitted as-is when the group closes.
     */
    private static final class Group {
        private final Family family;
        private final boolean io;
        private final boolean initialized;
        private final List<String> lines = new ArrayList<>();
        private int memberEnd;
        private int gap;
        private boolean continuing;

        private Group(Family family, String first) {
            this.family = family;
            this.io = LineClassifier.isPortDeclaration(first);
            this.initialized = LineClassifier.hasInitializer(first);
        }

        void addMember(String line) {
            lines.add(line);
            memberEnd = lines.size();
            gap = 0;
            continuing = !Texts.endsStatement(line);
        }

        void addContinuation(String line) {
            lines.add(line);
            memberEnd = lines.size();
            continuing = !Texts.endsStatement(line);
        }

        boolean absorbsGap() {
            if (family == Family.WIRE && io) {
                return true;
            }
            return ++gap <= GAP_LIMIT;
        }
    }

    /**
     * State of one scan. Never shared between documents.
     */
    private final class Scan {
        private final List<String> input;
        private final List<String> processed = new ArrayList<>();
        private final MacroAnnotator annotator = new MacroAnnotator();
        private List<String> header;
        private Group pending;
        private int blankCount;
        private int functionDepth;
        private int blockDepth;
        private boolean awaitingBody;

        Scan(List<String> input) {
            this.input = input;
        }

        List<String> run() {
            for (int i = 0; i < input.size(); i++) {
                String line = input.get(i);
                if (config.isRemoveTrailingWhitespace()) {
                    line = Texts.trimEnd(line);
                }
                if (config.isAnnotateIfdefComments()) {
                    line = annotator.annotate(line);
                }

                if (header == null && MODULE_START.matcher(line).find()) {
                    _flush();
                    header = new ArrayList<>();
                }
                if (header != null) {
                    header.add(line);
                    if (Texts.endsStatement(line)) {
                        _emitHeader(i + 1 < input.size() && !Texts.isBlank(input.get(i + 1)));
                    }
                    continue;
                }

                LineKind kind = LineClassifier.classify(line, pending != null && pending.continuing);
                switch (kind) {
                    case CONTINUATION -> pending.addContinuation(line);
                    case BLANK -> _blank();
                    case COMMENT, DIRECTIVE -> _gapLine(line);
                    case DECLARATION_START, OTHER -> _code(line);
                }
            }
            if (header != null) {
                // unterminated header at end of input
                header.forEach(this::_emitPlain);
                header = null;
            }
            _flush();
            return processed;
        }

        private void _emitHeader(boolean separate) {
            if (config.isFormatModuleHeaders()) {
                processed.addAll(headerFormatter.format(header));
                if (separate) {
                    processed.add("");
                }
            } else {
                header.forEach(this::_emitPlain);
            }
            header = null;
            blankCount = 0;
        }

        private void _blank() {
            blankCount++;
            if (config.compressesBlankLines() && blankCount > config.getMaxBlankLines()) {
                return;
            }
            if (pending != null) {
                if (pending.absorbsGap()) {
                    pending.lines.add("");
                    return;
                }
                _flush();
            }
            processed.add("");
        }

        private void _gapLine(String line) {
            blankCount = 0;
            if (pending != null) {
                if (pending.absorbsGap()) {
                    pending.lines.add(line);
                    return;
                }
                _flush();
            }
            _emitPlain(line);
        }

        private void _code(String line) {
            blankCount = 0;
            boolean procedural = _track(line);
            Family family = _family(line, procedural);
            if (family == null) {
                _flush();
                _emitPlain(line);
                return;
            }
            if (pending != null && !_accepts(pending, family, line)) {
                _flush();
            }
            if (pending == null) {
                pending = new Group(family, line);
            }
            pending.addMember(line);
        }

        /**
         * Updates function and procedural-block depth. Returns true when the line sits inside procedural code.
         */
        private boolean _track(String line) {
            if (FUNCTION_START.matcher(line).find()) {
                functionDepth++;
            }
            if (FUNCTION_END.matcher(line).find()) {
                functionDepth = Math.max(0, functionDepth - 1);
            }

            boolean inside = blockDepth > 0 || awaitingBody;
            String code = Texts.stripComment(line);
            if (PROCEDURAL.matcher(code).find()) {
                awaitingBody = true;
            }
            if (blockDepth > 0 || awaitingBody) {
                int delta = Texts.countMatches(BEGIN, code) - Texts.countMatches(END, code);
                blockDepth = Math.max(0, blockDepth + delta);
            }
            if (awaitingBody && (blockDepth > 0 || Texts.endsStatement(line))) {
                awaitingBody = false;
            }
            return inside || blockDepth > 0;
        }

        private Family _family(String line, boolean procedural) {
            DeclarationKind kind = LineClassifier.declarationKind(line);
            return switch (kind) {
                case NET, PORT -> config.isAlignWireDeclSemicolons() ? Family.WIRE : null;
                case PARAMETER -> config.isAlignParameters() ? Family.PARAMETER : null;
                case ASSIGNMENT -> config.isAlignAssignments() ? Family.ASSIGNMENT : null;
                case NONE -> config.isAlignAssignments() && !procedural && LineClassifier.isGenericAssignment(line)
                        ? Family.ASSIGNMENT : null;
            };
        }

        /**
         * Wire groups split on port vs. net and on initialized vs. plain, except inside functions and tasks.
         */
        private boolean _accepts(Group group, Family family, String line) {
            if (group.family != family) {
                return false;
            }
            if (family != Family.WIRE || functionDepth > 0) {
                return true;
            }
            return group.io == LineClassifier.isPortDeclaration(line)
                    && group.initialized == LineClassifier.hasInitializer(line);
        }

        private void _flush() {
            if (pending == null) {
                return;
            }
            Group group = pending;
            pending = null;

            List<String> members = new ArrayList<>(group.lines.subList(0, group.memberEnd));
            List<String> aligned = switch (group.family) {
                case WIRE -> wireAligner.align(members);
                case PARAMETER -> parameterAligner.align(members);
                case ASSIGNMENT -> assignmentAligner.align(members);
            };
            for (String line : aligned) {
                processed.add(commentFormatter.applyCommentColumn(line));
            }
            for (String line : group.lines.subList(group.memberEnd, group.lines.size())) {
                _emitPlain(line);
            }
        }

        private void _emitPlain(String line) {
            String placed = commentFormatter.applyCommentColumn(line);
            if (LineClassifier.isComment(placed) && placed.length() > config.getLineLength()) {
                processed.addAll(commentFormatter.wrapComment(placed));
            } else {
                processed.add(placed);
            }
        }
    }
}
