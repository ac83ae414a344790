package de.mirkosertic.mcp.papersearch;

import de.mirkosertic.mcp.papersearch.config.ApplicationConfig;
import de.mirkosertic.mcp.papersearch.config.BuildInfo;
import de.mirkosertic.mcp.papersearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.papersearch.mcp.ToolResultHelper;
import de.mirkosertic.mcp.papersearch.mcp.dto.GetPaperRequest;
import de.mirkosertic.mcp.papersearch.mcp.dto.GetPaperResponse;
import de.mirkosertic.mcp.papersearch.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.papersearch.mcp.dto.ReloadCorpusResponse;
import de.mirkosertic.mcp.papersearch.mcp.dto.SchemaResponse;
import de.mirkosertic.mcp.papersearch.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.papersearch.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;
import de.mirkosertic.mcp.papersearch.search.SearchPage;
import de.mirkosertic.mcp.papersearch.search.SearchQuery;
import de.mirkosertic.mcp.papersearch.service.IndexStats;
import de.mirkosertic.mcp.papersearch.service.PaperSearchService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools for searching the paper corpus.
 * Every handler returns a result; failures are reported with {@code success=false}.
 */
public class PaperSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(PaperSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search conference papers. The query is split into words and every word must match \
            the beginning of a word somewhere in the paper (title, authors, abstract, keywords and other fields), \
            e.g. 'transform lang' finds 'Transformers for Language Modeling'. Matching ignores case and accents. \
            Narrow results with filters (field -> value or list of values, case-insensitive substring match; \
            call getSchema for the available fields and facet values). \
            Results are sorted by name unless sortBy is given; sortBy='random' with a seed gives a reproducible shuffle \
            that is stable across pages. Returns total, the requested page of papers, and searchTimeMs.""";

    private final PaperSearchService searchService;
    private final ApplicationConfig config;

    public PaperSearchTools(final PaperSearchService searchService, final ApplicationConfig config) {
        this.searchService = searchService;
        this.config = config;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchRequest.class))
                        .build())
                .callHandler((exchange, request) -> search(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getPaper")
                        .description("Get all fields of a single paper by its id.")
                        .inputSchema(SchemaGenerator.generateSchema(GetPaperRequest.class))
                        .build())
                .callHandler((exchange, request) -> getPaper(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getSchema")
                        .description("List every field of the corpus with its type, and the distinct values of the facet fields "
                                + "(decision, event_type, session, topic, keywords, authors). Use these values as search filters.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getSchema())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStats")
                        .description("Get statistics about the loaded paper index: number of papers, columns, build id and time.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndexStats())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("reloadCorpus")
                        .description("Load a newer index build from disk, if one exists. Running searches are not affected.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> reloadCorpus())
                .build());

        return tools;
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchQuery query;
        try {
            query = SearchRequest.fromMap(args).toQuery(config.getDefaultPageSize(), config.getMaxPageSize());
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error("Invalid request: " + e.getMessage()));
        }

        try {
            final long startTime = System.nanoTime();
            final SearchPage page = searchService.search(query);
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            final List<Map<String, Object>> results = new ArrayList<>(page.results().size());
            for (final PaperDocument document : page.results()) {
                results.add(document.toPlainMap());
            }
            return ToolResultHelper.createResult(
                    SearchResponse.success(page.total(), query.page(), query.pageSize(), results, durationMs));

        } catch (final IOException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getPaper(final Map<String, Object> args) {
        final GetPaperRequest request;
        try {
            request = GetPaperRequest.fromMap(args);
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(GetPaperResponse.error("Invalid request: " + e.getMessage()));
        }

        logger.info("Get paper request: id={}", request.id());
        try {
            final Optional<PaperDocument> paper = searchService.get(request.id());
            if (paper.isEmpty()) {
                return ToolResultHelper.createResult(GetPaperResponse.error("Paper not found: " + request.id()));
            }
            return ToolResultHelper.createResult(GetPaperResponse.success(paper.get().toPlainMap()));
        } catch (final IOException e) {
            logger.error("Error loading paper {}", request.id(), e);
            return ToolResultHelper.createResult(GetPaperResponse.error("Error loading paper: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSchema() {
        logger.info("Schema request");
        try {
            return ToolResultHelper.createResult(SchemaResponse.success(searchService.schema()));
        } catch (final IOException e) {
            logger.error("Error reading schema", e);
            return ToolResultHelper.createResult(SchemaResponse.error("Error reading schema: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getIndexStats() {
        logger.info("Index stats request");
        try {
            final IndexStats stats = searchService.stats();
            logger.info("Index stats: {} papers, build {}", stats.documentCount(), stats.buildId());
            return ToolResultHelper.createResult(
                    IndexStatsResponse.success(stats, BuildInfo.getVersion(), BuildInfo.getBuildTimestamp()));
        } catch (final IOException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Error getting index stats: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult reloadCorpus() {
        logger.info("Reload corpus request");
        try {
            final boolean reloaded = searchService.reload();
            final IndexStats stats = searchService.stats();
            return ToolResultHelper.createResult(
                    ReloadCorpusResponse.success(reloaded, stats.buildId(), stats.documentCount()));
        } catch (final IOException e) {
            logger.error("Error reloading corpus", e);
            return ToolResultHelper.createResult(ReloadCorpusResponse.error("Error reloading corpus: " + e.getMessage()));
        }
    }
}
