package com.deepansh.wordplay.writing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TextCommandResult(String result, String message) {}
