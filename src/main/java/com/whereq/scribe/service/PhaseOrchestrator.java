package com.whereq.scribe.service;

import com.whereq.scribe.client.ContentScorer;
import com.whereq.scribe.client.ContentStore;
import com.whereq.scribe.client.ContentSynthesizer;
import com.whereq.scribe.client.EntityGapAnalyzer;
import com.whereq.scribe.client.NlpTermAnalyzer;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.dto.OptimizationRequest;
import com.whereq.scribe.exception.ConfigurationException;
import com.whereq.scribe.exception.GenerationException;
import com.whereq.scribe.exception.JobCancelledException;
import com.whereq.scribe.exception.OptimizerException;
import com.whereq.scribe.exception.PublishException;
import com.whereq.scribe.exception.TargetResolutionException;
import com.whereq.scribe.model.CancellationToken;
import com.whereq.scribe.model.EntityGapData;
import com.whereq.scribe.model.ExistingContentAnalysis;
import com.whereq.scribe.model.ImprovementRecord;
import com.whereq.scribe.model.InternalLinkTarget;
import com.whereq.scribe.model.Job;
import com.whereq.scribe.model.NeuronAnalysis;
import com.whereq.scribe.model.OptimizationResult;
import com.whereq.scribe.model.Page;
import com.whereq.scribe.model.PageStatus;
import com.whereq.scribe.model.Phase;
import com.whereq.scribe.model.PostPayload;
import com.whereq.scribe.model.PreservationFlags;
import com.whereq.scribe.model.PreservationRecord;
import com.whereq.scribe.model.PublishedPost;
import com.whereq.scribe.model.QaResult;
import com.whereq.scribe.model.QualitySignals;
import com.whereq.scribe.model.RunOptions;
import com.whereq.scribe.model.SeoMeta;
import com.whereq.scribe.model.SeoMetrics;
import com.whereq.scribe.model.SiteCredentials;
import com.whereq.scribe.model.SoftWarning;
import com.whereq.scribe.model.StageProgress;
import com.whereq.scribe.model.SynthesisRequest;
import com.whereq.scribe.model.SynthesizedContent;
import com.whereq.scribe.progress.ProgressReporter;
import com.whereq.scribe.progress.ProgressUpdate;
import com.whereq.scribe.state.ActivityLog;
import com.whereq.scribe.state.JobStateStore;
import com.whereq.scribe.state.OptimizationStats;
import com.whereq.scribe.state.PageCatalog;
import com.whereq.scribe.util.HtmlText;
import com.whereq.scribe.util.Slugs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Drive one page through the optimization phases.
 *
 * A run resolves the WordPress post behind the target URL, gathers optional search and NLP
 * enrichment, has the synthesis engine write a new article, scores it and publishes it. Optional
 * phases degrade to soft warnings; any other failure aborts the run. Every run ends with the job in
 * exactly one of {@link Phase#COMPLETED} or {@link Phase#FAILED}.
 */
@Slf4j
@Service
public class PhaseOrchestrator {

    static final String INTERRUPTED = "Optimization interrupted before completion";
    static final String NO_VALID_CONTENT = "Content generation failed: No valid content produced";

    private static final double AEO_WEIGHT = 0.25;
    private static final double QA_WEIGHT = 0.45;
    private static final double DEPTH_WEIGHT = 0.15;
    private static final double HEADING_WEIGHT = 0.15;

    @Autowired
    private OptimizerProperties properties;

    @Autowired
    private JobStateStore jobStateStore;

    @Autowired
    private PageCatalog pageCatalog;

    @Autowired
    private ProgressReporter progressReporter;

    @Autowired
    private ActivityLog activityLog;

    @Autowired
    private OptimizationStats optimizationStats;

    @Autowired
    private ContentStore contentStore;

    @Autowired
    private ContentSynthesizer contentSynthesizer;

    @Autowired
    private ContentScorer contentScorer;

    @Autowired
    private EntityGapAnalyzer entityGapAnalyzer;

    @Autowired
    private NlpTermAnalyzer nlpTermAnalyzer;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter successCounter;
    private Counter failureCounter;
    private Timer executionTimer;

    @PostConstruct
    public void initialize() {
        successCounter = Counter.builder("scribe.jobs.succeeded")
            .description("Number of successfully completed optimizations")
            .register(meterRegistry);

        failureCounter = Counter.builder("scribe.jobs.failed")
            .description("Number of failed optimizations")
            .register(meterRegistry);

        executionTimer = Timer.builder("scribe.jobs.execution.time")
            .description("Optimization execution time")
            .register(meterRegistry);
    }

    /**
     * Optimize one page.
     *
     * The returned Mono never errors: failures are reported as an unsuccessful result carrying the
     * failure message. Cancelling the subscription marks the job failed.
     *
     * @param request target URL and keyword override, both optional
     * @param options silent mode and cancellation token
     * @return terminal result of the run
     */
    public Mono<OptimizationResult> optimize(OptimizationRequest request, RunOptions options) {
        return Mono.defer(() -> {
            Instant startTime = Instant.now();
            if (!options.isSilent()) {
                progressReporter.start(request.getUrl(), startTime);
            }

            String targetId;
            try {
                checkConfiguration();
                targetId = resolveTarget(request);
                jobStateStore.begin(targetId, startTime);
            } catch (OptimizerException | IllegalStateException e) {
                return Mono.just(reject(options, e));
            }

            RunContext ctx = new RunContext(targetId, request, options, startTime,
                properties.getWordpress().credentials());
            return run(ctx);
        });
    }

    private Mono<OptimizationResult> run(RunContext ctx) {
        Mono<OptimizationResult> pipeline = Mono.fromRunnable(() -> prepare(ctx))
            .then(Mono.defer(() -> resolvePost(ctx)))
            .then(Mono.defer(() -> analyzeExisting(ctx)))
            .then(Mono.defer(() -> analyzeEntityGap(ctx)))
            .then(Mono.defer(() -> analyzeNlpTerms(ctx)))
            .then(Mono.defer(() -> buildInternalLinks(ctx)))
            .then(Mono.defer(() -> synthesize(ctx)))
            .then(Mono.defer(() -> validateQuality(ctx)))
            .then(Mono.defer(() -> publish(ctx)))
            .then(Mono.fromCallable(() -> complete(ctx)));

        CancellationToken token = ctx.options.getCancellationToken();
        if (token != null) {
            pipeline = pipeline
                .takeUntilOther(token.whenCancelled())
                .switchIfEmpty(Mono.error(() -> new JobCancelledException(token.getReason())));
        }

        return pipeline
            .onErrorResume(e -> Mono.just(fail(ctx, e)))
            .doOnCancel(() -> interrupt(ctx));
    }

    private void prepare(RunContext ctx) {
        pageCatalog.update(ctx.targetId, page -> page.toBuilder().status(PageStatus.ANALYZING).build());
        ctx.topic = pageCatalog.get(ctx.targetId)
            .map(Page::getTitle)
            .orElseGet(() -> Slugs.titleFromUrl(ctx.targetId));
        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.builder().currentUrl(ctx.targetId).build());
        }
        jobLog(ctx, "Starting optimization of " + ctx.targetId);
    }

    private void checkConfiguration() {
        if (!properties.getAi().hasAnyKey()) {
            throw new ConfigurationException("No AI API key configured");
        }
        OptimizerProperties.WordPressConfig wordpress = properties.getWordpress();
        if (isBlank(wordpress.getUrl())) {
            throw new ConfigurationException("WordPress URL not configured");
        }
        if (isBlank(wordpress.getUsername()) || isBlank(wordpress.getPassword())) {
            throw new ConfigurationException("WordPress credentials not configured");
        }
    }

    /**
     * Explicit URL, otherwise the idle catalogue page with the lowest health score
     */
    private String resolveTarget(OptimizationRequest request) {
        if (!isBlank(request.getUrl())) {
            String url = request.getUrl().trim();
            pageCatalog.ensurePage(url);
            return url;
        }
        return pageCatalog.lowestHealthCandidate(jobStateStore::isRunning)
            .map(Page::getId)
            .orElseThrow(() -> new TargetResolutionException("No pages to optimize"));
    }

    private Mono<Void> resolvePost(RunContext ctx) {
        enter(ctx, Phase.RESOLVING_POST);
        jobLog(ctx, "Resolving WordPress post");

        return contentStore.resolvePostId(ctx.site, ctx.targetId)
            .flatMap(postId -> {
                ctx.postId = postId;
                jobStateStore.recordPostId(ctx.targetId, postId);
                jobLog(ctx, "Found post id " + postId);
                return fetchExisting(ctx, postId).thenReturn(postId);
            })
            .switchIfEmpty(Mono.fromRunnable(() ->
                warn(ctx, SoftWarning.RESOLUTION, "No existing post found, a new post will be created")))
            .then(Mono.fromRunnable(() -> applyKeywordOverride(ctx)));
    }

    private Mono<Void> fetchExisting(RunContext ctx, long postId) {
        return contentStore.fetchPost(ctx.site, postId)
            .doOnNext(post -> {
                ctx.preservation = PreservationRecord.from(post);
                ctx.existingContent = post.getContent();
                String title = post.getTitle() != null ? post.getTitle().trim() : "";
                if (title.length() > 3) {
                    ctx.topic = title;
                    pageCatalog.update(ctx.targetId, page -> page.toBuilder().title(title).build());
                }
                jobLog(ctx, "Preserved slug \"" + ctx.preservation.getOriginalSlug() + "\", "
                    + ctx.preservation.getCategories().size() + " categories, "
                    + ctx.preservation.getTags().size() + " tags");
            })
            .onErrorResume(e -> softFailure(ctx, SoftWarning.RESOLUTION, "Could not fetch post " + postId, e))
            .then();
    }

    private void applyKeywordOverride(RunContext ctx) {
        String keyword = ctx.request.getTargetKeyword();
        if (keyword != null && keyword.trim().length() > 3) {
            String trimmed = keyword.trim();
            ctx.topic = trimmed;
            pageCatalog.update(ctx.targetId, page -> page.toBuilder().targetKeyword(trimmed).build());
            jobLog(ctx, "Using keyword override \"" + trimmed + "\"");
        }
        jobLog(ctx, "Topic: " + ctx.topic);
    }

    private Mono<Void> analyzeExisting(RunContext ctx) {
        enter(ctx, Phase.ANALYZING_EXISTING);
        ctx.existingAnalysis = HtmlText.analyze(ctx.existingContent);
        jobLog(ctx, "Existing content: " + ctx.existingAnalysis.getWordCount() + " words, "
            + ctx.existingAnalysis.getHeadings().size() + " headings, "
            + ctx.existingAnalysis.getLinkCount() + " links");
        return Mono.empty();
    }

    private Mono<Void> analyzeEntityGap(RunContext ctx) {
        if (isBlank(properties.getSearch().getSerperApiKey())) {
            jobLog(ctx, "Skipping entity gap analysis, no search key configured");
            return Mono.empty();
        }
        enter(ctx, Phase.ENTITY_GAP_ANALYSIS);

        return entityGapAnalyzer.analyze(ctx.topic, ctx.existingContent, searchCountry())
            .doOnNext(gap -> {
                ctx.entityGap = gap;
                jobLog(ctx, gap.getMissingEntities().size() + " missing entities, "
                    + gap.getPaaQuestions().size() + " questions");
            })
            .onErrorResume(e -> softFailure(ctx, SoftWarning.ANALYSIS, "Entity gap analysis failed", e))
            .then();
    }

    private Mono<Void> analyzeNlpTerms(RunContext ctx) {
        if (!properties.getNeuron().isConfigured()) {
            return Mono.empty();
        }
        enter(ctx, Phase.NEURON_ANALYSIS);

        return nlpTermAnalyzer.analyze(ctx.topic)
            .doOnNext(neuron -> {
                ctx.neuron = neuron;
                jobLog(ctx, neuron.getTerms().size() + " NLP terms");
            })
            .onErrorResume(e -> softFailure(ctx, SoftWarning.ANALYSIS, "NLP analysis failed", e))
            .then();
    }

    private Mono<Void> buildInternalLinks(RunContext ctx) {
        enter(ctx, Phase.INTERNAL_LINKING);
        ctx.internalLinks = pageCatalog.internalLinkTargets(ctx.targetId,
            properties.getGeneration().getMaxInternalLinks());
        jobLog(ctx, ctx.internalLinks.size() + " internal link candidates");
        return Mono.empty();
    }

    private Mono<Void> synthesize(RunContext ctx) {
        enter(ctx, Phase.OUTLINE_GENERATION);
        OptimizerProperties.AiConfig ai = properties.getAi();
        jobLog(ctx, "Generating content with " + ai.getProvider() + " / " + ai.actualModel());

        return contentSynthesizer.synthesize(synthesisRequest(ctx), stage -> onStage(ctx, stage))
            .onErrorMap(e -> !(e instanceof JobCancelledException),
                e -> new GenerationException("Content generation failed: " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new GenerationException(NO_VALID_CONTENT)))
            .doOnNext(content -> accept(ctx, content))
            .then();
    }

    private SynthesisRequest synthesisRequest(RunContext ctx) {
        OptimizerProperties.AiConfig ai = properties.getAi();
        OptimizerProperties.WordPressConfig wordpress = properties.getWordpress();
        OptimizerProperties.GeoConfig geo = properties.getGeo();
        return SynthesisRequest.builder()
            .topic(ctx.topic)
            .targetKeyword(ctx.topic)
            .mode(properties.getGeneration().getMode().name().toLowerCase(Locale.ROOT))
            .provider(ai.getProvider())
            .model(ai.actualModel())
            .apiKey(ai.activeKey())
            .targetWords(properties.getGeneration().getTargetWords())
            .siteName(wordpress.getOrgName())
            .siteUrl(ctx.site.baseUrl())
            .authorName(wordpress.getAuthorName())
            .country(geo.isEnabled() ? geo.getCountry() : null)
            .language(geo.getLanguage())
            .existingAnalysis(ctx.existingAnalysis)
            .entityGap(ctx.entityGap)
            .neuron(ctx.neuron)
            .internalLinks(ctx.internalLinks)
            .build();
    }

    private void onStage(RunContext ctx, StageProgress progress) {
        if (progress == null || progress.getStage() == null) {
            return;
        }
        Phase phase = progress.getStage().getPhase();
        jobStateStore.advance(ctx.targetId, phase);
        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.builder()
                .phase(phase)
                .sectionsCompleted(progress.getSectionsCompleted())
                .totalSections(progress.getTotalSections())
                .build());
        }
        log.debug("[{}] synthesis stage {}", ctx.targetId, progress.getStage());
    }

    /**
     * Post-process generated content and enforce the minimum content size
     */
    private void accept(RunContext ctx, SynthesizedContent content) {
        String html = HtmlText.removeH1Tags(content.getHtmlContent());
        if (html.length() < properties.getGeneration().getMinContentLength()) {
            jobLog(ctx, "Generated content too short: " + html.length() + " characters");
            throw new GenerationException(NO_VALID_CONTENT);
        }
        ctx.content = content.toBuilder().htmlContent(html).build();
        ctx.wordCount = HtmlText.countWords(html);
        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.builder().wordCount(ctx.wordCount).build());
        }
        jobLog(ctx, "Content generated: " + ctx.wordCount + " words");
    }

    private Mono<Void> validateQuality(RunContext ctx) {
        enter(ctx, Phase.QA_VALIDATION);
        QaResult qa = contentScorer.score(ctx.content.getHtmlContent(), qualitySignals(ctx));
        ctx.qaScore = qa.getScore();
        jobLog(ctx, "QA score " + qa.getScore() + "/100, " + ctx.wordCount + " words");
        return Mono.empty();
    }

    private Mono<Void> publish(RunContext ctx) {
        enter(ctx, Phase.PUBLISHING);
        SynthesizedContent content = ctx.content;
        String title = !isBlank(content.getTitle()) ? content.getTitle() : ctx.topic;

        PostPayload.PostPayloadBuilder payload = PostPayload.builder()
            .title(title)
            .content(content.getHtmlContent())
            .excerpt(content.getExcerpt() != null ? content.getExcerpt() : "")
            .status(properties.getWordpress().getPublishMode() == OptimizerProperties.PublishMode.PUBLISH
                ? "publish" : "draft");

        Mono<PublishedPost> published;
        if (ctx.postId != null) {
            PreservationFlags flags = properties.getPreservation().toFlags();
            applyPreservation(payload, flags, ctx.preservation);
            jobLog(ctx, "Updating existing post " + ctx.postId);
            published = contentStore.updatePost(ctx.site, ctx.postId, payload.build(), flags);
        } else {
            String slug = !isBlank(content.getSlug()) ? content.getSlug() : Slugs.sanitizeSlug(title);
            payload.slug(slug);
            jobLog(ctx, "Creating new post with slug \"" + slug + "\"");
            published = contentStore.createPost(ctx.site, payload.build());
        }

        return published
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("No response from WordPress")))
            .onErrorMap(e -> !(e instanceof JobCancelledException),
                e -> new PublishException("Publish failed: " + e.getMessage(), e))
            .flatMap(post -> {
                ctx.postId = post.getId();
                jobStateStore.recordPostId(ctx.targetId, post.getId());
                jobLog(ctx, "Published post " + post.getId() + (post.getLink() != null ? " at " + post.getLink() : ""));
                return updateSeoMeta(ctx, post.getId(), title);
            });
    }

    private static void applyPreservation(PostPayload.PostPayloadBuilder payload, PreservationFlags flags,
                                          PreservationRecord preserved) {
        if (preserved == null) {
            return;
        }
        if (flags.isPreserveCategories() && !preserved.getCategories().isEmpty()) {
            payload.categories(preserved.getCategories());
        }
        if (flags.isPreserveTags() && !preserved.getTags().isEmpty()) {
            payload.tags(preserved.getTags());
        }
        if (flags.isPreserveFeaturedImage() && preserved.getFeaturedMediaId() != null) {
            payload.featuredMedia(preserved.getFeaturedMediaId());
        }
    }

    private Mono<Void> updateSeoMeta(RunContext ctx, long postId, String title) {
        SeoMeta meta = SeoMeta.builder()
            .title(title)
            .description(ctx.content.getMetaDescription())
            .focusKeyword(ctx.topic)
            .build();

        return contentStore.updatePostMeta(ctx.site, postId, meta)
            .doOnSuccess(v -> jobLog(ctx, "SEO meta updated"))
            .onErrorResume(e -> softFailure(ctx, SoftWarning.METADATA, "SEO meta update failed", e));
    }

    private OptimizationResult complete(RunContext ctx) {
        checkCancelled(ctx);
        SynthesizedContent content = ctx.content;
        String title = !isBlank(content.getTitle()) ? content.getTitle() : ctx.topic;
        SeoMetrics metrics = contentScorer.measure(content.getHtmlContent(), title,
            content.getSlug() != null ? content.getSlug() : "");
        QaResult finalQa = contentScorer.score(content.getHtmlContent(), qualitySignals(ctx));
        int finalScore = (int) Math.round(metrics.getAeoScore() * AEO_WEIGHT
            + finalQa.getScore() * QA_WEIGHT
            + metrics.getContentDepth() * DEPTH_WEIGHT
            + metrics.getHeadingStructure() * HEADING_WEIGHT);

        Instant now = Instant.now();
        long processingTime = Duration.between(ctx.startTime, now).toMillis();
        if (!jobStateStore.complete(ctx.targetId, finalScore, metrics.getWordCount(), processingTime, ctx.postId)) {
            // failed or interrupted while scoring; that path already recorded the outcome
            log.warn("[{}] Run ended before completion could be recorded", ctx.targetId);
            String error = jobStateStore.get(ctx.targetId).map(Job::getError).orElse(INTERRUPTED);
            return OptimizationResult.failure(error != null ? error : INTERRUPTED);
        }

        ImprovementRecord improvement = ImprovementRecord.builder()
            .timestamp(now)
            .score(finalScore)
            .action("v" + properties.getVersion())
            .wordCount(metrics.getWordCount())
            .qaScore(finalQa.getScore())
            .version(properties.getVersion())
            .build();
        pageCatalog.update(ctx.targetId, page -> page.toBuilder()
            .status(PageStatus.ANALYZED)
            .healthScore(finalScore)
            .wordCount(metrics.getWordCount())
            .seoMetrics(metrics)
            .postId(ctx.postId)
            .lastPublishedAt(now)
            .build()
            .withImprovement(improvement));

        boolean improved = finalScore >= properties.getGeneration().getImprovedThreshold();
        optimizationStats.recordCompletion(metrics.getWordCount(), processingTime, improved);

        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.builder()
                .phase(Phase.COMPLETED)
                .running(false)
                .wordCount(metrics.getWordCount())
                .build());
        }
        successCounter.increment();
        executionTimer.record(Duration.ofMillis(processingTime));
        jobLog(ctx, "Completed: score " + finalScore + ", " + metrics.getWordCount() + " words in "
            + processingTime + " ms");

        return OptimizationResult.success(finalScore, metrics.getWordCount());
    }

    private QualitySignals qualitySignals(RunContext ctx) {
        return QualitySignals.builder()
            .title(ctx.content.getTitle())
            .metaDescription(ctx.content.getMetaDescription())
            .targetKeyword(ctx.topic)
            .entityGap(ctx.entityGap)
            .nlpTerms(ctx.neuron != null ? ctx.neuron.getTerms() : List.of())
            .build();
    }

    /**
     * Phase boundary: honour cancellation, then record the phase
     */
    private void enter(RunContext ctx, Phase phase) {
        checkCancelled(ctx);
        jobStateStore.advance(ctx.targetId, phase);
        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.phase(phase));
        }
        jobLog(ctx, phase.getLabel());
    }

    private static void checkCancelled(RunContext ctx) {
        CancellationToken token = ctx.options.getCancellationToken();
        if (token != null) {
            token.throwIfCancelled();
        }
    }

    private OptimizationResult fail(RunContext ctx, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : "Unknown error";
        long processingTime = Duration.between(ctx.startTime, Instant.now()).toMillis();

        if (jobStateStore.fail(ctx.targetId, message, processingTime)) {
            pageCatalog.update(ctx.targetId, page -> page.toBuilder().status(PageStatus.ERROR).build());
            failureCounter.increment();
            executionTimer.record(Duration.ofMillis(processingTime));
        }
        if (!ctx.options.isSilent()) {
            progressReporter.update(ProgressUpdate.stopped(Phase.FAILED));
        }

        if (error instanceof OptimizerException) {
            jobLog(ctx, "Failed: " + message);
        } else {
            log.error("[{}] Unexpected optimization failure", ctx.targetId, error);
            jobLog(ctx, "Failed: " + message);
        }
        return OptimizationResult.failure(message);
    }

    private void interrupt(RunContext ctx) {
        long processingTime = Duration.between(ctx.startTime, Instant.now()).toMillis();
        if (jobStateStore.fail(ctx.targetId, INTERRUPTED, processingTime)) {
            pageCatalog.update(ctx.targetId, page -> page.toBuilder().status(PageStatus.ERROR).build());
            failureCounter.increment();
            jobLog(ctx, INTERRUPTED);
        }
        if (!ctx.options.isSilent()) {
            progressReporter.forceFailed();
        }
    }

    /**
     * Failure before the job was claimed: only the progress snapshot and the caller see it
     */
    private OptimizationResult reject(RunOptions options, RuntimeException error) {
        log.warn("Optimization rejected: {}", error.getMessage());
        if (!options.isSilent()) {
            progressReporter.forceFailed();
            activityLog.add("Optimization rejected: " + error.getMessage());
        }
        failureCounter.increment();
        return OptimizationResult.failure(error.getMessage());
    }

    private <T> Mono<T> softFailure(RunContext ctx, SoftWarning kind, String what, Throwable error) {
        if (error instanceof JobCancelledException) {
            return Mono.error(error);
        }
        warn(ctx, kind, what + ": " + error.getMessage());
        return Mono.empty();
    }

    private String searchCountry() {
        OptimizerProperties.GeoConfig geo = properties.getGeo();
        return geo.isEnabled() ? geo.getCountry() : "US";
    }

    private void jobLog(RunContext ctx, String message) {
        log.info("[{}] {}", ctx.targetId, message);
        jobStateStore.appendLog(ctx.targetId, message);
        if (!ctx.options.isSilent()) {
            activityLog.add(message);
        }
    }

    private void warn(RunContext ctx, SoftWarning kind, String message) {
        log.warn("[{}] {}", ctx.targetId, message);
        jobStateStore.addWarning(ctx.targetId, kind, message);
        jobStateStore.appendLog(ctx.targetId, "WARN " + message);
        if (!ctx.options.isSilent()) {
            activityLog.add(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Mutable state of one run, confined to its sequential pipeline
     */
    private static final class RunContext {
        final String targetId;
        final OptimizationRequest request;
        final RunOptions options;
        final Instant startTime;
        final SiteCredentials site;

        String topic;
        Long postId;
        PreservationRecord preservation;
        String existingContent;
        ExistingContentAnalysis existingAnalysis;
        EntityGapData entityGap;
        NeuronAnalysis neuron;
        List<InternalLinkTarget> internalLinks = List.of();
        SynthesizedContent content;
        int wordCount;
        int qaScore;

        RunContext(String targetId, OptimizationRequest request, RunOptions options, Instant startTime,
                   SiteCredentials site) {
            this.targetId = targetId;
            this.request = request;
            this.options = options;
            this.startTime = startTime;
            this.site = site;
        }
    }
}
