package com.deepansh.wordplay.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoalTest {

    @Test
    void transitionTo_forward_stampsCompletionOnTerminal() {
        Goal goal = new Goal("Draft chapter", 1, List.of("generate_text"), 3);

        goal.transitionTo(GoalStatus.IN_PROGRESS, null);
        assertThat(goal.getCompletionTime()).isNull();

        goal.transitionTo(GoalStatus.COMPLETED, "done");
        assertThat(goal.getStatus()).isEqualTo(GoalStatus.COMPLETED);
        assertThat(goal.getCompletionTime()).isNotNull();
        assertThat(goal.getNotes()).isEqualTo("done");
    }

    @Test
    void transitionTo_fromTerminal_throws() {
        Goal goal = new Goal("g", 1, List.of(), 1);
        goal.transitionTo(GoalStatus.FAILED, null);

        assertThatThrownBy(() -> goal.transitionTo(GoalStatus.COMPLETED, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void goalStatus_wireNames_roundTrip() {
        assertThat(GoalStatus.IN_PROGRESS.wireName()).isEqualTo("in_progress");
        assertThat(GoalStatus.fromWire("COMPLETED")).isEqualTo(GoalStatus.COMPLETED);
    }

    @Test
    void snapshot_laterTransitions_doNotShowThrough() {
        Goal goal = new Goal("Draft chapter", 1, List.of(), 3);
        goal.addSubGoal(new Goal("Scene one", 2, List.of(), 1));

        Goal copy = goal.snapshot();
        goal.transitionTo(GoalStatus.IN_PROGRESS, "started");
        goal.addSubGoal(new Goal("Scene two", 2, List.of(), 1));

        assertThat(copy.getId()).isEqualTo(goal.getId());
        assertThat(copy.getStatus()).isEqualTo(GoalStatus.PENDING);
        assertThat(copy.getSubGoals()).extracting(Goal::getDescription).containsExactly("Scene one");
    }

    @Test
    void getSubGoals_isReadOnly() {
        Goal goal = new Goal("Book", 1, List.of(), 10);

        assertThatThrownBy(() -> goal.getSubGoals().add(new Goal("Chapter", 1, List.of(), 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
