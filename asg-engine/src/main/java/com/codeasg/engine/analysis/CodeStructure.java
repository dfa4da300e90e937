package com.codeasg.engine.analysis;

import java.util.List;

/**
 * Outline of one unit: declared functions and classes, imports, and size metrics.
 * Lines are 1-based.
 */
public record CodeStructure(
        String language,
        int codeLength,
        List<FunctionInfo> functions,
        List<ClassInfo> classes,
        List<ImportInfo> imports,
        int totalNodes,
        int maxNestingLevel
) {

    public CodeStructure {
        functions = List.copyOf(functions);
        classes = List.copyOf(classes);
        imports = List.copyOf(imports);
    }

    /**
     * @param blockCount         basic blocks of the function's CFG, entry and exit included
     * @param unreachableBlocks  blocks with no path from the entry
     */
    public record FunctionInfo(String name, int startLine, int endLine, List<String> parameters,
                               int blockCount, int unreachableBlocks) {
        public FunctionInfo {
            parameters = List.copyOf(parameters);
        }
    }

    public record ClassInfo(String name, int startLine, int endLine) {}

    public record ImportInfo(String module, int line) {}
}
