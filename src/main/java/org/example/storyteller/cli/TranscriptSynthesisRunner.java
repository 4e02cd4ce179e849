package org.example.storyteller.cli;

import org.example.storyteller.model.SynthesisResult;
import org.example.storyteller.service.StorySynthesisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line runner that turns one transcript file into a story file.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=synthesize-file
 *     -Dspring-boot.run.arguments="--storyteller.cli.input=session.txt --storyteller.cli.output=story.md"
 */
@Component
@Profile("synthesize-file")
public class TranscriptSynthesisRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(TranscriptSynthesisRunner.class);

    private final StorySynthesisService storySynthesisService;

    @Value("${storyteller.cli.input:}")
    private String inputPath;

    @Value("${storyteller.cli.output:}")
    private String outputPath;

    @Value("${storyteller.cli.backends:}")
    private String backends;

    public TranscriptSynthesisRunner(StorySynthesisService storySynthesisService) {
        this.storySynthesisService = storySynthesisService;
    }

    @Override
    public void run(String... args) throws Exception {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("storyteller.cli.input is required");
        }
        Path input = Path.of(inputPath);
        Path output = outputPath == null || outputPath.isBlank()
                ? input.resolveSibling(input.getFileName() + ".story.md")
                : Path.of(outputPath);

        String transcript = Files.readString(input, StandardCharsets.UTF_8);
        log.info("Synthesizing {} ({} chars)", input, transcript.length());

        SynthesisResult result = storySynthesisService.synthesize(transcript, parseBackends(backends), null);
        if (!result.storyText().isEmpty()) {
            Files.writeString(output, result.storyText(), StandardCharsets.UTF_8);
            log.info("Wrote story to {}", output);
        }

        log.info("========================================");
        log.info("Segments: {}, characters: {}, locations: {}, plot points: {}",
                result.segmentsProcessed(), result.characters().size(), result.locations().size(),
                result.plotPoints().size());
        log.info("Failovers: {}, completeness: {}, time: {}s",
                result.failoverEvents().size(), result.completenessScore(), result.processingTimeSeconds());
        if (!result.success()) {
            log.warn("Run did not complete: {} ({})", result.failureReason(), result.failureMessage());
        }
        log.info("========================================");
    }

    static List<String> parseBackends(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }
}
