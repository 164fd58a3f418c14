package com.deepansh.wordplay.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A tracked objective for the session. Created by the set_goal tool and owned by the
 * ExecutionContext; status only moves forward.
 */
@Getter
public class Goal {

    private final String id;
    private final String description;
    private final int priority;
    private final List<Goal> subGoals = new ArrayList<>();
    private final List<String> requiredTools;
    private final int estimatedSteps;
    private final Instant startTime;

    private GoalStatus status = GoalStatus.PENDING;
    private int actualSteps;
    private Instant completionTime;
    private String notes;

    public Goal(String description, int priority, List<String> requiredTools, int estimatedSteps) {
        this.id = "goal_" + UUID.randomUUID().toString().substring(0, 8);
        this.description = description;
        this.priority = priority;
        this.requiredTools = requiredTools != null ? List.copyOf(requiredTools) : List.of();
        this.estimatedSteps = estimatedSteps;
        this.startTime = Instant.now();
    }

    private Goal(Goal source) {
        this.id = source.id;
        this.description = source.description;
        this.priority = source.priority;
        this.requiredTools = source.requiredTools;
        this.estimatedSteps = source.estimatedSteps;
        this.startTime = source.startTime;
        this.status = source.status;
        this.actualSteps = source.actualSteps;
        this.completionTime = source.completionTime;
        this.notes = source.notes;
        source.subGoals.forEach(sub -> this.subGoals.add(sub.snapshot()));
    }

    /** Detached copy, sub-goals included; later changes to this goal do not show through. */
    public Goal snapshot() {
        return new Goal(this);
    }

    public List<Goal> getSubGoals() {
        return Collections.unmodifiableList(subGoals);
    }

    public void addSubGoal(Goal subGoal) {
        subGoals.add(subGoal);
    }

    /**
     * Moves the goal forward. Completion time is stamped on reaching a terminal status.
     *
     * @throws IllegalStateException if the transition would move the goal backward
     */
    public void transitionTo(GoalStatus target, String transitionNotes) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Goal " + id + " cannot move from " + status.wireName() + " to "
                            + (target != null ? target.wireName() : "null"));
        }
        status = target;
        if (transitionNotes != null && !transitionNotes.isBlank()) {
            notes = transitionNotes;
        }
        if (target.isTerminal()) {
            completionTime = Instant.now();
        }
    }

    public void recordStep() {
        actualSteps++;
    }
}
