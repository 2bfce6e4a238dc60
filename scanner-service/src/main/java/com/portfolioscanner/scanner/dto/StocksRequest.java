package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StocksRequest(@JsonProperty("stocks") List<String> stocks) {}
