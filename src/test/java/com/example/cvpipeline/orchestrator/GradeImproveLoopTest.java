package com.example.cvpipeline.orchestrator;

import com.example.cvpipeline.agent.Grader;
import com.example.cvpipeline.agent.Improver;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.Degradation;
import com.example.cvpipeline.model.DegradationKind;
import com.example.cvpipeline.model.FlaggedSection;
import com.example.cvpipeline.model.GradeResult;
import com.example.cvpipeline.model.GradingMethod;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.LoopState;
import com.example.cvpipeline.model.PipelineState;
import com.example.cvpipeline.model.Revision;
import com.example.cvpipeline.service.RunDeadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.cvpipeline.support.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GradeImproveLoopTest {

    private final JobContext context = JobContext.of("Engineering Manager", List.of());
    private Grader grader;
    private Improver improver;
    private PipelineState state;
    private RunDeadline deadline;

    @BeforeEach
    void setUp() {
        grader = mock(Grader.class);
        improver = mock(Improver.class);
        state = new PipelineState();
        state.setDraft(draft("initial"));
        deadline = RunDeadline.after(Clock.systemUTC(), Duration.ofMinutes(1));
    }

    private static CvDraft draft(String text) {
        return new CvDraft(null, null, text, 1);
    }

    private static GradeResult grade(double score, GradingMethod method, FlaggedSection... flags) {
        return new GradeResult("v1", List.of(), score, 8.0, List.of(flags), method);
    }

    private GradeImproveLoop loop(int cap) {
        return new GradeImproveLoop(grader, improver, properties(properties().stitching(), cap));
    }

    private void reviseTo(String... texts) {
        var stubbing = when(improver.improve(any(), any(), any(), any(), any()));
        for (String text : texts) {
            stubbing = stubbing.thenReturn(new Revision(List.of(), draft(text), List.of("rewrote " + text)));
        }
    }

    @Test
    @DisplayName("Should stop after cap + 1 grading passes when the draft is never accepted")
    void shouldStopAtIterationCap() {
        when(grader.grade(any(), any(), any())).thenReturn(grade(6.0, GradingMethod.MODEL));
        reviseTo("second", "third");

        loop(2).run(state, context, deadline);

        verify(grader, times(3)).grade(any(), any(), any());
        verify(improver, times(2)).improve(any(), any(), any(), any(), any());
        assertThat(state.iterations()).isEqualTo(2);
        assertThat(state.loopState()).isEqualTo(LoopState.ITERATION_CAP_REACHED);
        assertThat(state.degradations()).extracting(Degradation::kind)
                .containsExactly(DegradationKind.ITERATION_CAP_REACHED);
        assertThat(state.gradedDraft().text()).isEqualTo("third");
        assertThat(state.gradedDraft()).isSameAs(state.draft());
    }

    @Test
    @DisplayName("Should accept the first draft without revising it")
    void shouldAcceptImmediately() {
        when(grader.grade(any(), any(), any())).thenReturn(grade(9.0, GradingMethod.MODEL));

        loop(2).run(state, context, deadline);

        verify(improver, never()).improve(any(), any(), any(), any(), any());
        assertThat(state.loopState()).isEqualTo(LoopState.ACCEPTED);
        assertThat(state.iterations()).isZero();
        assertThat(state.degradations()).isEmpty();
    }

    @Test
    @DisplayName("Should revise while flagged sections remain even above the threshold")
    void shouldReviseFlaggedDraft() {
        when(grader.grade(any(), any(), any()))
                .thenReturn(grade(9.0, GradingMethod.MODEL, new FlaggedSection("bullet:acme-1", "vague")))
                .thenReturn(grade(9.0, GradingMethod.MODEL));
        reviseTo("second");

        loop(2).run(state, context, deadline);

        assertThat(state.loopState()).isEqualTo(LoopState.ACCEPTED);
        assertThat(state.iterations()).isEqualTo(1);
        assertThat(state.lastGrade().flaggedSections()).isEmpty();
        assertThat(state.gradedDraft().text()).isEqualTo("second");
    }

    @Test
    @DisplayName("Should grade once and never revise when the cap is zero")
    void shouldGradeOnceWithZeroCap() {
        when(grader.grade(any(), any(), any())).thenReturn(grade(6.0, GradingMethod.MODEL));

        loop(0).run(state, context, deadline);

        verify(grader, times(1)).grade(any(), any(), any());
        verify(improver, never()).improve(any(), any(), any(), any(), any());
        assertThat(state.loopState()).isEqualTo(LoopState.ITERATION_CAP_REACHED);
    }

    @Test
    @DisplayName("Should record a single grading fallback across passes")
    void shouldRecordGradingFallbackOnce() {
        when(grader.grade(any(), any(), any())).thenReturn(grade(6.0, GradingMethod.RULE_BASED));
        reviseTo("second", "third");

        loop(2).run(state, context, deadline);

        assertThat(state.degradations()).extracting(Degradation::kind)
                .containsExactly(DegradationKind.GRADING_FALLBACK, DegradationKind.ITERATION_CAP_REACHED);
    }

    @Test
    @DisplayName("Should grade by rules and stop when the run deadline has passed")
    void shouldStopAtDeadline() {
        Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        when(grader.gradeRuleBased(any(), any())).thenReturn(grade(6.0, GradingMethod.RULE_BASED));

        loop(2).run(state, context, RunDeadline.after(fixed, Duration.ZERO));

        verify(grader, never()).grade(any(), any(), any());
        verify(improver, never()).improve(any(), any(), any(), any(), any());
        assertThat(state.loopState()).isEqualTo(LoopState.GRADED);
        assertThat(state.degradations()).extracting(Degradation::kind)
                .containsExactly(DegradationKind.GRADING_FALLBACK, DegradationKind.DEADLINE_EXCEEDED);
    }
}
