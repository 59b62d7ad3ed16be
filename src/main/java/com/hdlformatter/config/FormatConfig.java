package com.hdlformatter.config;

/**
 * Flat set of rule toggles consumed by the Verilog pipeline. Immutable; build with {@link #builder()}.
 */
public class FormatConfig {
    public static final String PLUGIN_NAME = "verilog";

    /** {@code maxBlankLines} at or above this value disables blank-line compression. */
    public static final int NO_BLANK_LINE_LIMIT = 100;

    private final int indentSize;
    private final int maxBlankLines;
    private final int lineLength;
    private final int commentColumn;
    private final boolean indentSizeExplicit;
    private final boolean alignPortList;
    private final boolean alignParameters;
    private final boolean wrapPortList;
    private final boolean removeTrailingWhitespace;
    private final boolean alignAssignments;
    private final boolean alignWireDeclSemicolons;
    private final boolean formatModuleInstantiations;
    private final boolean formatModuleHeaders;
    private final boolean indentAlwaysBlocks;
    private final boolean enforceBeginEnd;
    private final boolean indentCaseStatements;
    private final boolean annotateIfdefComments;

    private FormatConfig(Builder builder) {
        this.indentSize = builder.indentSize;
        this.maxBlankLines = builder.maxBlankLines;
        this.lineLength = builder.lineLength;
        this.commentColumn = builder.commentColumn;
        this.indentSizeExplicit = builder.indentSizeExplicit;
        this.alignPortList = builder.alignPortList;
        this.alignParameters = builder.alignParameters;
        this.wrapPortList = builder.wrapPortList;
        this.removeTrailingWhitespace = builder.removeTrailingWhitespace;
        this.alignAssignments = builder.alignAssignments;
        this.alignWireDeclSemicolons = builder.alignWireDeclSemicolons;
        this.formatModuleInstantiations = builder.formatModuleInstantiations;
        this.formatModuleHeaders = builder.formatModuleHeaders;
        this.indentAlwaysBlocks = builder.indentAlwaysBlocks;
        this.enforceBeginEnd = builder.enforceBeginEnd;
        this.indentCaseStatements = builder.indentCaseStatements;
        this.annotateIfdefComments = builder.annotateIfdefComments;
    }

    /**
     * Reads the {@code verilog} plugin section, falling back to the built-in defaults per key.
     */
    public static FormatConfig from(FormatterConfig config) {
        Builder defaults = builder();
        return defaults
                .indentSize(config.getPluginConfig(PLUGIN_NAME, "indentSize", defaults.indentSize))
                .indentSizeExplicit(config.hasPluginConfig(PLUGIN_NAME, "indentSize"))
                .maxBlankLines(config.getPluginConfig(PLUGIN_NAME, "maxBlankLines", defaults.maxBlankLines))
                .lineLength(config.getPluginConfig(PLUGIN_NAME, "lineLength", defaults.lineLength))
                .commentColumn(config.getPluginConfig(PLUGIN_NAME, "commentColumn", defaults.commentColumn))
                .alignPortList(config.getPluginConfig(PLUGIN_NAME, "alignPortList", true))
                .alignParameters(config.getPluginConfig(PLUGIN_NAME, "alignParameters", true))
                .wrapPortList(config.getPluginConfig(PLUGIN_NAME, "wrapPortList", true))
                .removeTrailingWhitespace(config.getPluginConfig(PLUGIN_NAME, "removeTrailingWhitespace", true))
                .alignAssignments(config.getPluginConfig(PLUGIN_NAME, "alignAssignments", true))
                .alignWireDeclSemicolons(config.getPluginConfig(PLUGIN_NAME, "alignWireDeclSemicolons", true))
                .formatModuleInstantiations(config.getPluginConfig(PLUGIN_NAME, "formatModuleInstantiations", true))
                .formatModuleHeaders(config.getPluginConfig(PLUGIN_NAME, "formatModuleHeaders", true))
                .indentAlwaysBlocks(config.getPluginConfig(PLUGIN_NAME, "indentAlwaysBlocks", true))
                .enforceBeginEnd(config.getPluginConfig(PLUGIN_NAME, "enforceBeginEnd", true))
                .indentCaseStatements(config.getPluginConfig(PLUGIN_NAME, "indentCaseStatements", true))
                .annotateIfdefComments(config.getPluginConfig(PLUGIN_NAME, "annotateIfdefComments", true))
                .build();
    }

    /**
     * Every rule off, blank-line compression and comment column at their no-op values.
     */
    public static FormatConfig allDisabled() {
        return builder()
                .maxBlankLines(NO_BLANK_LINE_LIMIT)
                .commentColumn(0)
                .alignPortList(false)
                .alignParameters(false)
                .wrapPortList(false)
                .removeTrailingWhitespace(false)
                .alignAssignments(false)
                .alignWireDeclSemicolons(false)
                .formatModuleInstantiations(false)
                .formatModuleHeaders(false)
                .indentAlwaysBlocks(false)
                .enforceBeginEnd(false)
                .indentCaseStatements(false)
                .annotateIfdefComments(false)
                .build();
    }

    /**
     * True when at least one rule could change the text.
     */
    public boolean hasAnyFeatureEnabled() {
        return removeTrailingWhitespace || maxBlankLines < NO_BLANK_LINE_LIMIT
                || alignAssignments || alignWireDeclSemicolons || alignParameters
                || alignPortList || formatModuleHeaders || formatModuleInstantiations
                || indentAlwaysBlocks || enforceBeginEnd || indentCaseStatements
                || annotateIfdefComments || commentColumn > 0;
    }

    public boolean compressesBlankLines() {
        return maxBlankLines < NO_BLANK_LINE_LIMIT;
    }

    /**
     * Indentation unit as a string of spaces.
     */
    public String indentUnit() {
        return " ".repeat(indentSize);
    }

    /**
     * Applies an editor tab size unless the configuration set {@code indentSize} itself.
     */
    public FormatConfig withEditorTabSize(Integer tabSize) {
        if (tabSize == null || indentSizeExplicit || tabSize < 1) {
            return this;
        }
        return toBuilder().indentSize(tabSize).build();
    }

    public Builder toBuilder() {
        return builder()
                .indentSize(indentSize)
                .indentSizeExplicit(indentSizeExplicit)
                .maxBlankLines(maxBlankLines)
                .lineLength(lineLength)
                .commentColumn(commentColumn)
                .alignPortList(alignPortList)
                .alignParameters(alignParameters)
                .wrapPortList(wrapPortList)
                .removeTrailingWhitespace(removeTrailingWhitespace)
                .alignAssignments(alignAssignments)
                .alignWireDeclSemicolons(alignWireDeclSemicolons)
                .formatModuleInstantiations(formatModuleInstantiations)
                .formatModuleHeaders(formatModuleHeaders)
                .indentAlwaysBlocks(indentAlwaysBlocks)
                .enforceBeginEnd(enforceBeginEnd)
                .indentCaseStatements(indentCaseStatements)
                .annotateIfdefComments(annotateIfdefComments);
    }

    // Getters
    public int getIndentSize() { return indentSize; }
    public int getMaxBlankLines() { return maxBlankLines; }
    public int getLineLength() { return lineLength; }
    public int getCommentColumn() { return commentColumn; }
    public boolean isIndentSizeExplicit() { return indentSizeExplicit; }
    public boolean isAlignPortList() { return alignPortList; }
    public boolean isAlignParameters() { return alignParameters; }
    public boolean isWrapPortList() { return wrapPortList; }
    public boolean isRemoveTrailingWhitespace() { return removeTrailingWhitespace; }
    public boolean isAlignAssignments() { return alignAssignments; }
    public boolean isAlignWireDeclSemicolons() { return alignWireDeclSemicolons; }
    public boolean isFormatModuleInstantiations() { return formatModuleInstantiations; }
    public boolean isFormatModuleHeaders() { return formatModuleHeaders; }
    public boolean isIndentAlwaysBlocks() { return indentAlwaysBlocks; }
    public boolean isEnforceBeginEnd() { return enforceBeginEnd; }
    public boolean isIndentCaseStatements() { return indentCaseStatements; }
    public boolean isAnnotateIfdefComments() { return annotateIfdefComments; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int indentSize = 2;
        private int maxBlankLines = 1;
        private int lineLength = 160;
        private int commentColumn = 0;
        private boolean indentSizeExplicit = false;
        private boolean alignPortList = true;
        private boolean alignParameters = true;
        private boolean wrapPortList = true;
        private boolean removeTrailingWhitespace = true;
        private boolean alignAssignments = true;
        private boolean alignWireDeclSemicolons = true;
        private boolean formatModuleInstantiations = true;
        private boolean formatModuleHeaders = true;
        private boolean indentAlwaysBlocks = true;
        private boolean enforceBeginEnd = true;
        private boolean indentCaseStatements = true;
        private boolean annotateIfdefComments = true;

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder indentSizeExplicit(boolean indentSizeExplicit) {
            this.indentSizeExplicit = indentSizeExplicit;
            return this;
        }

        public Builder maxBlankLines(int maxBlankLines) {
            this.maxBlankLines = maxBlankLines;
            return this;
        }

        public Builder lineLength(int lineLength) {
            this.lineLength = lineLength;
            return this;
        }

        public Builder commentColumn(int commentColumn) {
            this.commentColumn = commentColumn;
            return this;
        }

        public Builder alignPortList(boolean alignPortList) {
            this.alignPortList = alignPortList;
            return this;
        }

        public Builder alignParameters(boolean alignParameters) {
            this.alignParameters = alignParameters;
            return this;
        }

        public Builder wrapPortList(boolean wrapPortList) {
            this.wrapPortList = wrapPortList;
            return this;
        }

        public Builder removeTrailingWhitespace(boolean removeTrailingWhitespace) {
            this.removeTrailingWhitespace = removeTrailingWhitespace;
            return this;
        }

        public Builder alignAssignments(boolean alignAssignments) {
            this.alignAssignments = alignAssignments;
            return this;
        }

        public Builder alignWireDeclSemicolons(boolean alignWireDeclSemicolons) {
            this.alignWireDeclSemicolons = alignWireDeclSemicolons;
            return this;
        }

        public Builder formatModuleInstantiations(boolean formatModuleInstantiations) {
            this.formatModuleInstantiations = formatModuleInstantiations;
            return this;
        }

        public Builder formatModuleHeaders(boolean formatModuleHeaders) {
            this.formatModuleHeaders = formatModuleHeaders;
            return this;
        }

        public Builder indentAlwaysBlocks(boolean indentAlwaysBlocks) {
            this.indentAlwaysBlocks = indentAlwaysBlocks;
            return this;
        }

        public Builder enforceBeginEnd(boolean enforceBeginEnd) {
            this.enforceBeginEnd = enforceBeginEnd;
            return this;
        }

        public Builder indentCaseStatements(boolean indentCaseStatements) {
            this.indentCaseStatements = indentCaseStatements;
            return this;
        }

        public Builder annotateIfdefComments(boolean annotateIfdefComments) {
            this.annotateIfdefComments = annotateIfdefComments;
            return this;
        }

        public FormatConfig build() {
            return new FormatConfig(this);
        }
    }
}
