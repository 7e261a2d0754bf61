package io.github.sysfina.ingestion.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SheetValuesResponse(
        String range,
        String majorDimension,
        List<List<String>> values
) { }
