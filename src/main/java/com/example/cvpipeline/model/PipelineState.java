package com.example.cvpipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state of a single run.
 * <p>
 * Owned and mutated only by the orchestrating thread; workers hand values back instead of
 * writing here. Phases only move forward and the iteration count never exceeds the loop cap.
 */
public class PipelineState {

    private PipelinePhase phase = PipelinePhase.CREATED;
    private List<RoleRecord> roles = List.of();
    private final Map<String, RoleBulletSet> bulletSets = new LinkedHashMap<>();
    private StitchedDocument document;
    private HeaderSection header;
    private CvDraft draft;
    private CvDraft gradedDraft;
    private GradeResult lastGrade;
    private int iterations;
    private LoopState loopState;
    private final List<Degradation> degradations = new ArrayList<>();
    private final Set<DegradationKind> reportedOnce = EnumSet.noneOf(DegradationKind.class);
    private final Map<String, GradeResult> gradeCache = new LinkedHashMap<>();

    public void advanceTo(PipelinePhase next) {
        if (next.ordinal() < phase.ordinal()) {
            throw new IllegalStateException("Cannot move from " + phase + " back to " + next);
        }
        phase = next;
    }

    public void addDegradation(DegradationKind kind, String detail) {
        degradations.add(new Degradation(kind, detail));
    }

    /** Records a degradation kind at most once per run. */
    public void addDegradationOnce(DegradationKind kind, String detail) {
        if (reportedOnce.add(kind)) {
            addDegradation(kind, detail);
        }
    }

    public void putBulletSet(RoleBulletSet set) {
        bulletSets.put(set.roleId(), set);
    }

    public void replaceBulletSets(List<RoleBulletSet> sets) {
        bulletSets.clear();
        sets.forEach(this::putBulletSet);
    }

    /** Records the grade of the current draft; the draft and its grade travel together. */
    public void recordGrade(GradeResult grade) {
        this.lastGrade = grade;
        this.gradedDraft = draft;
        this.loopState = LoopState.GRADED;
    }

    public void applyRevision(List<RoleBulletSet> sets, CvDraft revised, int iterationCap) {
        if (iterations >= iterationCap) {
            throw new IllegalStateException("Iteration cap " + iterationCap + " already reached");
        }
        replaceBulletSets(sets);
        iterations++;
        setDraft(revised);
    }

    public void setDraft(CvDraft draft) {
        this.draft = draft;
        this.document = draft.document();
        this.header = draft.header();
        this.loopState = LoopState.DRAFTED;
    }

    public boolean hasDegradations() {
        return !degradations.isEmpty();
    }

    public PipelinePhase phase() { return phase; }

    public List<RoleRecord> roles() { return roles; }

    public void setRoles(List<RoleRecord> roles) { this.roles = List.copyOf(roles); }

    public List<RoleBulletSet> bulletSets() { return List.copyOf(bulletSets.values()); }

    public StitchedDocument document() { return document; }

    public void setDocument(StitchedDocument document) { this.document = document; }

    public HeaderSection header() { return header; }

    public void setHeader(HeaderSection header) { this.header = header; }

    public CvDraft draft() { return draft; }

    public CvDraft gradedDraft() { return gradedDraft; }

    public GradeResult lastGrade() { return lastGrade; }

    public int iterations() { return iterations; }

    public LoopState loopState() { return loopState; }

    public void setLoopState(LoopState loopState) { this.loopState = loopState; }

    public List<Degradation> degradations() { return Collections.unmodifiableList(degradations); }

    /** Model grades of this run's drafts, keyed by draft digest. Dropped with the state. */
    public Map<String, GradeResult> gradeCache() { return gradeCache; }
}
