package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** What phase of autonomous work comes next, derived from the tool types already run. */
@Value
@Builder
public class ContinuousOperationPlan {

    String nextPhase;
    String description;
    List<String> suggestedTools;
    boolean readyForAutonomousExecution;
}
