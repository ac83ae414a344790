package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.papersearch.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Offline build of the paper index from a corpus JSON file.
 * <pre>
 * java -cp mcp-paper-search.jar de.mirkosertic.mcp.papersearch.index.IndexBuilderCommand \
 *      [--input corpus.json] [--output index-dir]
 * </pre>
 * Missing arguments fall back to {@code papers.corpus.path} and {@code papers.index.path}.
 */
public class IndexBuilderCommand {

    private static final Logger logger = LoggerFactory.getLogger(IndexBuilderCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final CorpusReader corpusReader;
    private final PaperIndexBuilder indexBuilder;

    public IndexBuilderCommand(final CorpusReader corpusReader, final PaperIndexBuilder indexBuilder) {
        this.corpusReader = corpusReader;
        this.indexBuilder = indexBuilder;
    }

    int run(final String[] args, final ApplicationConfig config) {
        String input = config.getCorpusPath();
        String output = config.getIndexPath();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (("--input".equals(arg) || "--output".equals(arg)) && i + 1 < args.length) {
                if ("--input".equals(arg)) {
                    input = args[++i];
                } else {
                    output = args[++i];
                }
            } else {
                logger.error("Unknown or incomplete argument: {}", arg);
                printUsage();
                return EXIT_USAGE;
            }
        }
        if (input == null || input.isBlank()) {
            logger.error("No corpus file given: use --input or configure papers.corpus.path");
            printUsage();
            return EXIT_USAGE;
        }

        try {
            final List<ObjectNode> records = corpusReader.read(Path.of(input));
            final PaperIndexBuilder.BuildSummary summary = indexBuilder.build(records, Path.of(output));
            logger.info("Build {} finished: {} papers, {} columns, {}ms -> {}",
                    summary.buildId(), summary.documentCount(), summary.columns().size(),
                    summary.durationMs(), summary.indexPath());
            return EXIT_OK;
        } catch (final CorpusFormatException e) {
            logger.error("Invalid corpus {}: {}", input, e.getMessage());
            return EXIT_FAILED;
        } catch (final IOException e) {
            logger.error("Failed to build index at {}", output, e);
            return EXIT_FAILED;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: IndexBuilderCommand [--input <corpus.json>] [--output <index directory>]");
    }

    public static void main(final String[] args) {
        final ApplicationConfig config = ApplicationConfig.load();
        final IndexBuilderCommand command = new IndexBuilderCommand(
                new CorpusReader(), new PaperIndexBuilder(new RecordNormalizer()));
        System.exit(command.run(args, config));
    }
}
