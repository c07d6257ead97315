package com.raditha.repairgraph.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.repairgraph.model.GraphBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns source text into an {@link AnalysisUnit}.
 * <p>
 * Accepts three shapes of input, tried in this order:
 * <ol>
 * <li>a complete compilation unit,</li>
 * <li>a class body fragment (fields, methods, constructors),</li>
 * <li>a bare statement list.</li>
 * </ol>
 * Fragments are wrapped in a holder class on the first line so that line numbers of the
 * original text are preserved.
 */
public class SourceUnitParser {
    private static final Logger logger = LoggerFactory.getLogger(SourceUnitParser.class);

    public static final String HOLDER_CLASS = "Fragment";
    public static final String HOLDER_METHOD = "fragment";

    private final ParserConfiguration configuration;

    public SourceUnitParser() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * Parse one piece of source text as a single-file unit.
     *
     * @param path name of the file, used in statement keys
     * @param text the source text
     * @throws GraphBuildException if none of the accepted shapes parses
     */
    public AnalysisUnit parse(String path, String text) throws GraphBuildException {
        return AnalysisUnit.of(parseFile(path, text));
    }

    /**
     * Parse several files as one unit, keeping the order of the map.
     */
    public AnalysisUnit parseAll(String name, Map<String, String> textsByPath) throws GraphBuildException {
        List<SourceFile> files = new ArrayList<>();
        for (Map.Entry<String, String> entry : textsByPath.entrySet()) {
            files.add(parseFile(entry.getKey(), entry.getValue()));
        }
        return new AnalysisUnit(name, files);
    }

    SourceFile parseFile(String path, String text) throws GraphBuildException {
        String source = text == null ? "" : text;

        ParseResult<CompilationUnit> whole = newParser().parse(source);
        if (whole.isSuccessful() && whole.getResult().isPresent()) {
            return new SourceFile(path, whole.getResult().get(), false);
        }

        String asMembers = "class " + HOLDER_CLASS + " { " + source + "\n}";
        ParseResult<CompilationUnit> members = newParser().parse(asMembers);
        if (members.isSuccessful() && members.getResult().isPresent()) {
            logger.debug("Parsed {} as a class body fragment", path);
            return new SourceFile(path, members.getResult().get(), true);
        }

        String asStatements = "class " + HOLDER_CLASS + " { void " + HOLDER_METHOD + "() { " + source + "\n} }";
        ParseResult<CompilationUnit> statements = newParser().parse(asStatements);
        if (statements.isSuccessful() && statements.getResult().isPresent()) {
            logger.debug("Parsed {} as a statement fragment", path);
            return new SourceFile(path, statements.getResult().get(), true);
        }

        throw new GraphBuildException("Cannot parse " + path + ": " + describe(whole.getProblems()), null);
    }

    private JavaParser newParser() {
        return new JavaParser(configuration);
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "no result";
        }
        return problems.stream()
                .limit(3)
                .map(Problem::getVerboseMessage)
                .map(m -> m.replaceAll("\\s+", " "))
                .collect(Collectors.joining("; "));
    }
}
