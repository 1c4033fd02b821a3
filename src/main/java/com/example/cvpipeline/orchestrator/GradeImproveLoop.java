package com.example.cvpipeline.orchestrator;

import com.example.cvpipeline.agent.Grader;
import com.example.cvpipeline.agent.Improver;
import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.DegradationKind;
import com.example.cvpipeline.model.GradeResult;
import com.example.cvpipeline.model.GradingMethod;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.LoopState;
import com.example.cvpipeline.model.PipelineState;
import com.example.cvpipeline.model.Revision;
import com.example.cvpipeline.service.RunDeadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grade/improve state machine.
 * <p>
 * DRAFTED → GRADED → {ACCEPTED | REVISING → DRAFTED → GRADED ...} until the draft is accepted or
 * the revision cap is reached. Every pass ends on a grading step, so the draft left in the state
 * is always the one its grade belongs to. At most {@code cap + 1} grading passes run.
 */
@Component
public class GradeImproveLoop {

    private static final Logger log = LoggerFactory.getLogger(GradeImproveLoop.class);

    private final Grader grader;
    private final Improver improver;
    private final int iterationCap;

    public GradeImproveLoop(Grader grader, Improver improver, CvPipelineProperties properties) {
        this.grader = grader;
        this.improver = improver;
        this.iterationCap = properties.loop().iterationCap();
    }

    public void run(PipelineState state, JobContext context, RunDeadline deadline) {
        while (true) {
            boolean outOfTime = deadline.expired();
            GradeResult grade = outOfTime
                    ? grader.gradeRuleBased(state.draft(), context)
                    : grader.grade(state.draft(), context, state.gradeCache());
            if (grade.method() == GradingMethod.RULE_BASED) {
                state.addDegradationOnce(DegradationKind.GRADING_FALLBACK,
                        outOfTime ? "run deadline passed, graded without the model" : "grading model unavailable");
            }
            state.recordGrade(grade);
            log.info("Pass {}: score {} / {}, {} flags", state.iterations() + 1, grade.overallScore(),
                    grade.passingThreshold(), grade.flaggedSections().size());

            if (grade.accepted()) {
                state.setLoopState(LoopState.ACCEPTED);
                log.info("Draft accepted after {} revisions", state.iterations());
                return;
            }
            if (state.iterations() >= iterationCap) {
                state.setLoopState(LoopState.ITERATION_CAP_REACHED);
                state.addDegradation(DegradationKind.ITERATION_CAP_REACHED,
                        "not accepted after " + iterationCap + " revisions, last score " + grade.overallScore());
                log.warn("Iteration cap {} reached, returning last graded draft (score {})",
                        iterationCap, grade.overallScore());
                return;
            }
            if (deadline.expired()) {
                state.addDegradationOnce(DegradationKind.DEADLINE_EXCEEDED,
                        "run deadline passed during grading, returning last graded draft");
                log.warn("Run deadline passed, stopping after {} revisions", state.iterations());
                return;
            }

            state.setLoopState(LoopState.REVISING);
            Revision revision = improver.improve(state.draft(), grade, state.bulletSets(), state.roles(), context);
            revision.changes().forEach(change -> log.info("Revision {}: {}", state.iterations() + 1, change));
            state.applyRevision(revision.bulletSets(), revision.draft(), iterationCap);
        }
    }

    public int iterationCap() {
        return iterationCap;
    }
}
