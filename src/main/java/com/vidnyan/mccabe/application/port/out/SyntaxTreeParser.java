package com.vidnyan.mccabe.application.port.out;

import com.vidnyan.mccabe.domain.tree.ModuleNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for turning source text into a syntax tree.
 * Implemented by language front ends (e.g., the JavaParser adapter).
 */
public interface SyntaxTreeParser {

    /**
     * Parse one source unit. Malformed source yields an unsuccessful result, never an exception.
     * @param fileName Name reported in problems and used as module name
     * @param source Source text
     */
    ParsingResult parse(String fileName, String source);

    /**
     * Whether this front end understands the given file.
     */
    boolean supports(Path file);

    /**
     * Parsing result: a tree, or the problems that prevented one.
     */
    record ParsingResult(
        ModuleNode tree,
        List<String> problems
    ) {
        public static ParsingResult success(ModuleNode tree) {
            return new ParsingResult(tree, List.of());
        }

        public static ParsingResult failure(List<String> problems) {
            return new ParsingResult(null, List.copyOf(problems));
        }

        public boolean isSuccessful() {
            return tree != null;
        }
    }
}
