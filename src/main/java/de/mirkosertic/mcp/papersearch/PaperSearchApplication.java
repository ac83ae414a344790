package de.mirkosertic.mcp.papersearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.papersearch.catalog.PaperCatalog;
import de.mirkosertic.mcp.papersearch.config.ApplicationConfig;
import de.mirkosertic.mcp.papersearch.config.BuildInfo;
import de.mirkosertic.mcp.papersearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.papersearch.schema.SchemaReporter;
import de.mirkosertic.mcp.papersearch.search.QueryEngine;
import de.mirkosertic.mcp.papersearch.service.PaperSearchService;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main entry point for the MCP paper search server.
 * Loads the paper index into memory and serves it over the STDIO transport.
 */
public class PaperSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(PaperSearchApplication.class);

    private final ApplicationConfig config;
    private PaperSearchService searchService;
    private McpSyncServer mcpServer;

    public PaperSearchApplication(final ApplicationConfig config) {
        this.config = config;
    }

    /**
     * Loads the corpus. Fails if the index is missing or unreadable.
     */
    public void init() throws IOException {
        logger.info("Initializing MCP Paper Search Server...");

        final PaperCatalog catalog = new PaperCatalog(Path.of(config.getIndexPath()), new SchemaReporter());
        this.searchService = new PaperSearchService(catalog, new QueryEngine());

        logger.info("Corpus loaded, {} papers available", searchService.stats().documentCount());
    }

    /**
     * Start the MCP server and block until the process is stopped.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Paper Search Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        final PaperSearchTools tools = new PaperSearchTools(searchService, config);
        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down MCP Paper Search Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            if (searchService != null) {
                searchService.close();
            }
        } catch (final IOException e) {
            logger.error("Error closing paper catalog", e);
        }

        logger.info("MCP Paper Search Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first, so nothing is written to stdout before the protocol starts
            final boolean deployedMode = ApplicationConfig.DEPLOYED_PROFILE.equals(ApplicationConfig.activeProfile());
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
            }

            final PaperSearchApplication app = new PaperSearchApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode the console is not a log target, so report on stderr
            System.err.println("Failed to start MCP Paper Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
