package me.christianrobert.ast2c.analysis.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.ast2c.analysis.model.AnalysisReport;
import me.christianrobert.ast2c.analysis.model.AnalysisResult;
import me.christianrobert.ast2c.generator.context.GenerationException;
import me.christianrobert.ast2c.tree.parser.AstJsonReader;
import me.christianrobert.ast2c.tree.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Reads a JSON tree and reports the functions it declares and defines.
 * Shares the reader, and its malformed-input handling, with code generation.
 */
@ApplicationScoped
public class FunctionAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FunctionAnalysisService.class);

    @Inject
    AstJsonReader reader;

    public AnalysisResult analyze(String json) {
        return analyze(reader.read(json));
    }

    public AnalysisResult analyze(Path file) {
        log.debug("Reading tree from file: {}", file);
        return analyze(reader.read(file));
    }

    private AnalysisResult analyze(ParseResult parseResult) {
        if (parseResult.hasErrors()) {
            log.warn("Analysis refused, malformed input: {}", parseResult.getErrorMessage());
            return AnalysisResult.failure("Malformed input: " + parseResult.getErrorMessage());
        }

        try {
            AnalysisReport report = FunctionAnalyzer.analyze(parseResult.getTree());
            log.info("Analyzed {} functions", report.getTotalFunctions());
            return AnalysisResult.success(report);
        } catch (GenerationException e) {
            log.warn("Analysis failed: {}", e.getMessage());
            return AnalysisResult.failure(e.getDetailedMessage());
        }
    }
}
