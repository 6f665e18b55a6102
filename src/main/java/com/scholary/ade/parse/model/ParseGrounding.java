package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Location of a chunk in the source document: zero-indexed page plus bounding box. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseGrounding(ParseGroundingBox box, int page) {}
