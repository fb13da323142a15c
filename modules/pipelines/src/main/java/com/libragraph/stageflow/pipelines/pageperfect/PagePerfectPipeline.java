package com.libragraph.stageflow.pipelines.pageperfect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.stageflow.core.intake.Page;
import com.libragraph.stageflow.core.intake.PageDirectory;
import com.libragraph.stageflow.core.intake.PreparedIntake;
import com.libragraph.stageflow.core.intake.ValidationException;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageHandler;
import com.libragraph.stageflow.pipelines.engine.EngineStageHandler;
import com.libragraph.stageflow.pipelines.engine.StageEngineClient;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Page optimisation: crawl a page, wait for the crawl, embed its segments, cluster keywords,
 * find content gaps and draft a rewrite.
 */
@ApplicationScoped
public class PagePerfectPipeline implements PipelineDefinition {

    public static final String NAME = "pageperfect";

    public static final String SUBMIT_CRAWL = "submit_crawl";
    public static final String WAIT_CRAWL = "wait_crawl";
    public static final String SEGMENT_EMBED = "segment_embed";
    public static final String KEYWORD_CLUSTERING = "keyword_clustering";
    public static final String GAP_ANALYSIS = "gap_analysis";
    public static final String REWRITE_DRAFT = "rewrite_draft";

    private static final List<String> STAGES = List.of(
            SUBMIT_CRAWL, WAIT_CRAWL, SEGMENT_EMBED, KEYWORD_CLUSTERING, GAP_ANALYSIS, REWRITE_DRAFT);

    /** Stale crawl waits restart from a fresh crawl. */
    private static final Map<String, String> RESCUE_STAGES = Map.of(WAIT_CRAWL, SUBMIT_CRAWL);

    @Inject
    @RestClient
    StageEngineClient engine;

    @Inject
    PageDirectory pages;

    private List<StageHandler<?>> handlers;

    public PagePerfectPipeline() {
    }

    public PagePerfectPipeline(StageEngineClient engine, PageDirectory pages) {
        this.engine = engine;
        this.pages = pages;
        init();
    }

    @PostConstruct
    void init() {
        List<StageHandler<?>> list = new ArrayList<>(STAGES.size());
        for (int i = 0; i < STAGES.size(); i++) {
            list.add(new EngineStageHandler(NAME, STAGES.get(i), engine, i == STAGES.size() - 1));
        }
        handlers = List.copyOf(list);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> stages() {
        return STAGES;
    }

    @Override
    public List<StageHandler<?>> handlers() {
        return handlers;
    }

    @Override
    public String rescueStage(String stage) {
        return RESCUE_STAGES.getOrDefault(stage, stage);
    }

    /**
     * Requires {@code url} or {@code page_id}. The page is resolved (or created from the URL)
     * and its id becomes the dedup key, so one page has at most one active job.
     */
    @Override
    public PreparedIntake prepareIntake(JsonNode payload) {
        Page page = resolvePage(payload);
        ObjectNode prepared = ((ObjectNode) payload.deepCopy())
                .put("page_id", page.id().toString())
                .put("url", page.url());
        return new PreparedIntake(prepared, page.id().toString());
    }

    private Page resolvePage(JsonNode payload) {
        String pageId = text(payload, "page_id");
        if (pageId != null) {
            UUID id;
            try {
                id = UUID.fromString(pageId);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("page_id is not a valid UUID: " + pageId);
            }
            return pages.find(id).orElseThrow(() -> new ValidationException("Unknown page_id: " + pageId));
        }

        String url = text(payload, "url");
        if (url == null) {
            throw new ValidationException("url or page_id is required");
        }
        if (!isHttpUrl(url)) {
            throw new ValidationException("url must be an absolute http(s) URL: " + url);
        }
        return pages.resolveOrCreate(url);
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }

    static boolean isHttpUrl(String url) {
        try {
            URI uri = URI.create(url);
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
