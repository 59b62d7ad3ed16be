package com.hdlformatter.plugins.verilog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.align.BlockAssignmentAligner;
import com.hdlformatter.plugins.verilog.directive.DirectiveIndentNormalizer;
import com.hdlformatter.plugins.verilog.indent.AlwaysBlockIndenter;
import com.hdlformatter.plugins.verilog.indent.BeginPlacement;
import com.hdlformatter.plugins.verilog.indent.CaseIndenter;
import com.hdlformatter.plugins.verilog.indent.ConditionAligner;
import com.hdlformatter.plugins.verilog.indent.EndIfSplitter;
import com.hdlformatter.plugins.verilog.indent.ForLoopEnforcer;
import com.hdlformatter.plugins.verilog.indent.IfBlockEnforcer;
import com.hdlformatter.plugins.verilog.indent.ModuleLevelIndenter;
import com.hdlformatter.plugins.verilog.structure.InstantiationFormatter;
import com.hdlformatter.util.LoggerUtil;

/**
 * The full formatting pipeline over one document.
 * <p>
 * Stage order:
 * <ol>
 *   <li>declaration grouping (trim, macro annotation, module headers, blank lines, alignment groups, comments)</li>
 *   <li>begin placement and {@code end if} splitting</li>
 *   <li>begin/end enforcement for {@code if}/{@code else}/{@code for}, repeated until stable</li>
 *   <li>always-block indentation, multi-line condition alignment, module-level indentation</li>
 *   <li>module instantiations, case indentation, block assignment alignment</li>
 *   <li>directive indentation</li>
 * </ol>
 * Every stage runs guarded by a {@link PassRunner}.
 */
public class DocumentFormatter {
    private static final Logger logger = LoggerUtil.getLogger(DocumentFormatter.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private final FormatConfig config;
    private final int maxEnforceIterations;

    public DocumentFormatter(FormatConfig config) {
        this(config, FixedPointLoop.DEFAULT_MAX_ITERATIONS);
    }

    public DocumentFormatter(FormatConfig config, int maxEnforceIterations) {
        this.config = config;
        this.maxEnforceIterations = maxEnforceIterations;
    }

    /**
     * Formats a whole document. With every rule disabled the text is returned without being scanned.
     */
    public FormatterResult format(String source) {
        if (!config.hasAnyFeatureEnabled()) {
            logger.fine("No formatting rule enabled; document left as is");
            return FormatterResult.builder()
                    .successful(true)
                    .changed(false)
                    .formattedCode(source)
                    .build();
        }

        PassRunner runner = new PassRunner();
        List<String> lines = formatLines(Arrays.asList(LINE_BREAK.split(source, -1)), runner);

        // Drop trailing blank lines, keep the final newline if the input had one
        List<String> output = new ArrayList<>(lines);
        while (!output.isEmpty() && output.get(output.size() - 1).trim().isEmpty()) {
            output.remove(output.size() - 1);
        }
        String formatted = String.join("\n", output) + (source.endsWith("\n") ? "\n" : "");
        boolean changed = !formatted.equals(source);

        logger.fine(() -> "Document formatted: " + runner.getApplied().size() + " passes changed the text, "
                + runner.getErrors().size() + " failed");
        return FormatterResult.builder()
                .successful(true)
                .changed(changed)
                .formattedCode(changed ? formatted : source)
                .errors(runner.getErrors())
                .appliedRefactorings(runner.getApplied())
                .build();
    }

    /**
     * Runs every stage over {@code lines}. Failures are collected on {@code runner}.
     */
    public List<String> formatLines(List<String> lines, PassRunner runner) {
        boolean enforce = config.isEnforceBeginEnd();
        boolean indentAlways = config.isIndentAlwaysBlocks();

        // Grouping and alignment first, then block structure, then indentation
        List<String> current = runner.run(new DeclarationGrouper(config), lines);
        current = runner.runIf(enforce, new BeginPlacement(), current);
        current = runner.runIf(enforce, new EndIfSplitter(), current);
        current = runner.runIf(enforce, enforcementLoop(), current);

        boolean hasAlways = AlwaysBlockIndenter.hasProceduralBlock(current);
        current = runner.runIf(indentAlways, new AlwaysBlockIndenter(config), current);
        current = runner.run(new ConditionAligner(), current);
        current = runner.runIf(indentAlways, new ModuleLevelIndenter(config), current);

        // instance layout would fight the always-block indentation
        current = runner.runIf(config.isFormatModuleInstantiations() && !(indentAlways && hasAlways),
                new InstantiationFormatter(config), current);
        current = runner.runIf(config.isIndentCaseStatements(), new CaseIndenter(config), current);
        current = runner.runIf(config.isIndentCaseStatements() || indentAlways, new BlockAssignmentAligner(), current);
        // with block indentation on, directives inside blocks are already placed
        current = runner.run(new DirectiveIndentNormalizer(indentAlways), current);
        return current;
    }

    /**
     * The begin/end enforcement rounds: {@code if}/{@code else} first, then {@code for}.
     */
    public FixedPointLoop enforcementLoop() {
        return new FixedPointLoop("begin-end-enforcement",
                List.of(new IfBlockEnforcer(config), new ForLoopEnforcer(config)),
                maxEnforceIterations);
    }

    public FormatConfig getConfig() {
        return config;
    }
}
