package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

/** Resolved autonomy preset: iteration cap, chain-length cap and reflection toggle. */
@Value
@Builder(toBuilder = true)
public class AutonomySettings {

    AutonomyLevel level;
    int maxIterations;
    int maxToolChainLength;
    boolean reflectionEnabled;
}
