package com.deepansh.wordplay.tool;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Declared shape of one tool parameter. */
@Value
@Builder
public class ParameterSpec {

    String name;
    ParameterType type;
    boolean required;
    String description;

    /** Closed set of accepted values (compared case-insensitively); empty means unrestricted. */
    @Builder.Default
    List<String> allowedValues = List.of();
}
