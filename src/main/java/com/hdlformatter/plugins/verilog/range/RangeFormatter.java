package com.hdlformatter.plugins.verilog.range;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.DocumentFormatter;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.plugins.verilog.PassRunner;
import com.hdlformatter.plugins.verilog.align.PortDeclarationAligner;
import com.hdlformatter.plugins.verilog.align.WireDeclarationAligner;
import com.hdlformatter.plugins.verilog.directive.MacroAnnotator;
import com.hdlformatter.plugins.verilog.indent.ConditionAligner;
import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.plugins.verilog.structure.InstantiationFormatter;
import com.hdlformatter.plugins.verilog.structure.ModuleHeaderFormatter;
import com.hdlformatter.util.LoggerUtil;
import com.hdlformatter.util.Texts;

/**
 * Formats a selection of lines using only what the selection shows.
 * <p>
 * A selection holding a complete construct ({@code always}/{@code initial}/{@code for} with balanced
 * {@code begin}/{@code end}, {@code generate ... endgenerate}, {@code case ... endcase}, an {@code if}/{@code else}
 * chain, or a whole instantiation) goes through the full pipeline. Anything else only gets the passes that
 * never re-indent a line: annotation, trimming, blank-line compression and column alignment.
 */
public class RangeFormatter {
    private static final Logger logger = LoggerUtil.getLogger(RangeFormatter.class);

    private static final Pattern MODULE_START = Pattern.compile("^\\s*(module|macromodule)\\s+\\w+");

    private final FormatConfig config;

    public RangeFormatter(FormatConfig config) {
        this.config = config;
    }

    /**
     * Formats the selected lines. Failures of single passes are collected on {@code runner}.
     */
    public List<String> format(List<String> selected, PassRunner runner) {
        if (!config.hasAnyFeatureEnabled()) {
            return selected;
        }
        SelectionShape shape = new SelectionShape(selected);
        if (shape.hasCompleteStructure()) {
            logger.fine("Selection holds a complete construct; running the full pipeline");
            List<String> formatted = new ArrayList<>(new DocumentFormatter(config).formatLines(selected, runner));
            while (formatted.size() > 1 && formatted.get(formatted.size() - 1).trim().isEmpty()) {
                formatted.remove(formatted.size() - 1);
            }
            return formatted;
        }
        return _alignOnly(selected, runner);
    }

    private List<String> _alignOnly(List<String> selected, PassRunner runner) {
        List<String> result = new ArrayList<>(selected);
        if (config.isAnnotateIfdefComments()) {
            MacroAnnotator annotator = new MacroAnnotator();
            result.replaceAll(annotator::annotate);
        }
        if (config.isRemoveTrailingWhitespace()) {
            result.replaceAll(Texts::trimEnd);
        }
        if (config.compressesBlankLines()) {
            result = _compressBlankLines(result);
        }

        SelectionShape shape = new SelectionShape(result);
        boolean completeHeader = shape.hasCompleteModuleHeader();

        result = runner.run(new ConditionAligner(), result);
        result = runner.runIf(config.isFormatModuleHeaders() && completeHeader,
                _pass("range-module-header", this::_formatHeader), result);
        result = runner.runIf(config.isAlignAssignments(),
                _pass("range-assignments", new RangeAssignmentAligner()::align), result);
        result = runner.runIf(config.isAlignWireDeclSemicolons(),
                _pass("range-declarations", this::_alignDeclarations), result);
        result = runner.runIf(config.isAlignParameters() && !completeHeader,
                _pass("range-parameters", new RangeParameterAligner()::align), result);
        result = runner.runIf(config.isAlignPortList() && shape.hasPortDeclarations() && !completeHeader,
                _pass("range-ports", new PortDeclarationAligner()::align), result);

        boolean instances = config.isFormatModuleInstantiations()
                && shape.hasModuleInstantiation()
                && !shape.hasModuleHeader()
                && !shape.hasOnlyConnections()
                && !(config.isIndentAlwaysBlocks() && shape.hasProceduralBlock());
        result = runner.runIf(instances, new InstantiationFormatter(config), result);
        return result;
    }

    private List<String> _compressBlankLines(List<String> lines) {
        List<String> compressed = new ArrayList<>(lines.size());
        int blankCount = 0;
        for (String line : lines) {
            if (line.trim().isEmpty()) {
                blankCount++;
                if (blankCount <= config.getMaxBlankLines()) {
                    compressed.add(line);
                }
            } else {
                blankCount = 0;
                compressed.add(line);
            }
        }
        return compressed;
    }

    /**
     * Formats the header from its {@code module} line to the first terminated line; other lines are kept.
     */
    private List<String> _formatHeader(List<String> lines) {
        int start = -1;
        for (int i = 0; i < lines.size() && start < 0; i++) {
            if (MODULE_START.matcher(lines.get(i)).find()) {
                start = i;
            }
        }
        int end = start;
        while (end >= 0 && end < lines.size() && !Texts.endsStatement(lines.get(end))) {
            end++;
        }
        if (start < 0 || end >= lines.size()) {
            return lines;
        }
        List<String> result = new ArrayList<>(lines.subList(0, start));
        result.addAll(new ModuleHeaderFormatter(config).format(new ArrayList<>(lines.subList(start, end + 1))));
        result.addAll(lines.subList(end + 1, lines.size()));
        return result;
    }

    /**
     * Groups consecutive declarations. Comments, directives and blank lines stay inside a group; a change
     * between port and net, or between initialized and plain, starts a new one.
     */
    private List<String> _alignDeclarations(List<String> lines) {
        WireDeclarationAligner aligner = new WireDeclarationAligner(config);
        List<String> result = new ArrayList<>(lines.size());
        List<String> group = new ArrayList<>();
        boolean groupIo = false;
        boolean groupInit = false;

        for (String line : lines) {
            if (LineClassifier.declarationKind(line).isWireFamily()) {
                boolean io = LineClassifier.isPortDeclaration(line);
                boolean init = LineClassifier.hasInitializer(line);
                if (!group.isEmpty() && (io != groupIo || init != groupInit)) {
                    result.addAll(aligner.align(group));
                    group = new ArrayList<>();
                }
                if (group.isEmpty()) {
                    groupIo = io;
                    groupInit = init;
                }
                group.add(line);
            } else if (!group.isEmpty() && (LineClassifier.isCommentOrDirective(line) || line.trim().isEmpty())) {
                group.add(line);
            } else {
                if (!group.isEmpty()) {
                    result.addAll(aligner.align(group));
                    group = new ArrayList<>();
                }
                result.add(line);
            }
        }
        if (!group.isEmpty()) {
            result.addAll(aligner.align(group));
        }
        return result;
    }

    private static LinePass _pass(String name, UnaryOperator<List<String>> body) {
        return new LinePass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<String> apply(List<String> lines) {
                return body.apply(lines);
            }
        };
    }
}
