package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TextRequest(@JsonProperty("text") String text) {}
