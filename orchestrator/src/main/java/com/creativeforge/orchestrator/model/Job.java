package com.creativeforge.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One image-to-creative request submitted by an owner.
 *
 * The id is assigned by the caller at submission (random, or derived from the
 * idempotency key), never generated by the database. Records read from a
 * JobStore are detached snapshots: the Orchestrator mutates a copy and hands
 * it back through compareAndSwap, which is the only update path.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "source_asset_ref", nullable = false, updatable = false)
    private String sourceAssetRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private OutputLanguage language;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state = JobState.PENDING;

    // Failed attempts in the current stage. Reset whenever a stage is entered.
    @Column(name = "stage_attempt", nullable = false)
    private int stageAttempt = 0;

    // Adjustment for the next attempt of the current stage (e.g. SHORTER caption).
    @Column(name = "retry_hint")
    private String retryHint;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    // Bumped by the JobStore on every applied write. A state can be entered twice
    // (safety regeneration), so compareAndSwap checks this as well as the state.
    @Column(nullable = false)
    private long revision = 0;

    // ── Analysis output ─────────────────────────────────────────────────────
    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_category")
    private ProductCategory analysisCategory;

    @Column(name = "analysis_confidence")
    private Double analysisConfidence;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "analysis_attributes")
    private Map<String, String> analysisAttributes = new LinkedHashMap<>();

    @Column(name = "needs_manual_category", nullable = false)
    private boolean needsManualCategory = false;

    // ── Generation output ───────────────────────────────────────────────────
    @Convert(converter = StringListConverter.class)
    @Column(name = "variation_refs")
    private List<String> variationRefs = new ArrayList<>();

    @Column(name = "caption_text")
    private String captionText;

    // ── Safety regeneration bookkeeping ─────────────────────────────────────
    @Column(name = "background_regenerations", nullable = false)
    private int backgroundRegenerations = 0;

    @Column(name = "caption_regenerations", nullable = false)
    private int captionRegenerations = 0;

    @Column(name = "regenerate_backgrounds", nullable = false)
    private boolean regenerateBackgrounds = false;

    @Column(name = "regenerate_caption", nullable = false)
    private boolean regenerateCaption = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason")
    private FailureReason failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Lets Spring Data call persist() for a caller-assigned id instead of merge().
    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(UUID id, String ownerId, String sourceAssetRef,
               OutputLanguage language, String idempotencyKey, Instant now) {
        this.id             = id;
        this.ownerId        = ownerId;
        this.sourceAssetRef = sourceAssetRef;
        this.language       = language;
        this.idempotencyKey = idempotencyKey;
        this.createdAt      = now;
        this.updatedAt      = now;
    }

    /** Detached deep copy; the only way a stored job leaves a JobStore. */
    public Job snapshot() {
        Job copy = new Job();
        copy.id             = id;
        copy.ownerId        = ownerId;
        copy.sourceAssetRef = sourceAssetRef;
        copy.language       = language;
        copy.idempotencyKey = idempotencyKey;
        copy.createdAt      = createdAt;
        copy.copyMutableFieldsFrom(this);
        copy.revision       = revision;
        copy.isNew          = isNew;
        return copy;
    }

    /**
     * Overwrite every mutable field with the values of {@code source}.
     * Used by JobStore implementations to apply a successful compare-and-swap.
     * A stored cancellation request survives writes that did not observe it.
     * The revision is left alone; the store advances it with {@link #incrementRevision()}.
     */
    public void copyMutableFieldsFrom(Job source) {
        boolean wasCancelRequested = this.cancelRequested;
        this.state                   = source.state;
        this.stageAttempt            = source.stageAttempt;
        this.retryHint               = source.retryHint;
        this.cancelRequested         = source.cancelRequested || wasCancelRequested;
        this.analysisCategory        = source.analysisCategory;
        this.analysisConfidence      = source.analysisConfidence;
        this.analysisAttributes      = new LinkedHashMap<>(source.analysisAttributes);
        this.needsManualCategory     = source.needsManualCategory;
        this.variationRefs           = new ArrayList<>(source.variationRefs);
        this.captionText             = source.captionText;
        this.backgroundRegenerations = source.backgroundRegenerations;
        this.captionRegenerations    = source.captionRegenerations;
        this.regenerateBackgrounds   = source.regenerateBackgrounds;
        this.regenerateCaption       = source.regenerateCaption;
        this.failureReason           = source.failureReason;
        this.updatedAt               = source.updatedAt;
        this.completedAt             = source.completedAt;
    }

    /** Called by a JobStore once per applied write. */
    public void incrementRevision() {
        this.revision++;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}, resetting the per-stage attempt counter.
     *
     * @throws IllegalStateException if the transition is not in the state table
     */
    public void enterState(JobState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition %s → %s for job %s".formatted(state, next, id));
        }
        this.state        = next;
        this.stageAttempt = 0;
        this.retryHint    = null;
        this.updatedAt    = now;
    }

    /** Count one failed attempt in the current stage and remember how to adjust the next one. */
    public void recordFailedAttempt(String hint, Instant now) {
        this.stageAttempt++;
        this.retryHint = hint;
        this.updatedAt = now;
    }

    public void complete(Instant now) {
        enterState(JobState.COMPLETE, now);
        this.completedAt = now;
    }

    public void fail(FailureReason reason, Instant now) {
        enterState(JobState.FAILED, now);
        this.failureReason = reason;
        this.completedAt   = now;
    }

    public void requestCancel(Instant now) {
        this.cancelRequested = true;
        this.updatedAt       = now;
    }

    // ------------------------------------------------------------------
    // Stage outputs
    // ------------------------------------------------------------------

    public void applyAnalysis(ProductCategory category, double confidence, Map<String, String> attributes) {
        this.analysisCategory   = category;
        this.analysisConfidence = confidence;
        this.analysisAttributes = new LinkedHashMap<>(attributes == null ? Map.of() : attributes);
    }

    public void flagNeedsManualCategory() {
        this.needsManualCategory = true;
    }

    public void applyVariations(List<String> refs) {
        this.variationRefs         = new ArrayList<>(refs);
        this.regenerateBackgrounds = false;
    }

    public void applyCaption(String text) {
        this.captionText       = text;
        this.regenerateCaption = false;
    }

    /**
     * Schedule the single regeneration of {@code stage} after an unsafe verdict.
     *
     * @throws IllegalArgumentException for the analysis stage, which is never regenerated
     */
    public void requestRegeneration(PipelineStage stage) {
        switch (stage) {
            case BACKGROUND_GENERATION -> {
                this.regenerateBackgrounds = true;
                this.backgroundRegenerations++;
            }
            case CAPTION_GENERATION -> {
                this.regenerateCaption = true;
                this.captionRegenerations++;
            }
            default -> throw new IllegalArgumentException("Stage cannot be regenerated: " + stage);
        }
    }

    public int regenerationsOf(PipelineStage stage) {
        return switch (stage) {
            case BACKGROUND_GENERATION -> backgroundRegenerations;
            case CAPTION_GENERATION    -> captionRegenerations;
            default                    -> 0;
        };
    }

    /** True when the caption stage must call its capability (first run or pending regeneration). */
    public boolean needsCaption() {
        return captionText == null || regenerateCaption;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    @Override
    public UUID    getId()    { return id; }

    @Override
    public boolean isNew()    { return isNew; }

    public String              getOwnerId()                 { return ownerId; }
    public String              getSourceAssetRef()          { return sourceAssetRef; }
    public OutputLanguage      getLanguage()                { return language; }
    public String              getIdempotencyKey()          { return idempotencyKey; }
    public JobState            getState()                   { return state; }
    public int                 getStageAttempt()            { return stageAttempt; }
    public String              getRetryHint()               { return retryHint; }
    public boolean             isCancelRequested()          { return cancelRequested; }
    public long                getRevision()                { return revision; }
    public ProductCategory     getAnalysisCategory()        { return analysisCategory; }
    public Double              getAnalysisConfidence()      { return analysisConfidence; }
    public Map<String, String> getAnalysisAttributes()      { return Map.copyOf(analysisAttributes); }
    public boolean             isNeedsManualCategory()      { return needsManualCategory; }
    public List<String>        getVariationRefs()           { return List.copyOf(variationRefs); }
    public String              getCaptionText()             { return captionText; }
    public int                 getBackgroundRegenerations() { return backgroundRegenerations; }
    public int                 getCaptionRegenerations()    { return captionRegenerations; }
    public boolean             isRegenerateBackgrounds()    { return regenerateBackgrounds; }
    public boolean             isRegenerateCaption()        { return regenerateCaption; }
    public FailureReason       getFailureReason()           { return failureReason; }
    public Instant             getCreatedAt()               { return createdAt; }
    public Instant             getUpdatedAt()               { return updatedAt; }
    public Instant             getCompletedAt()             { return completedAt; }
}
