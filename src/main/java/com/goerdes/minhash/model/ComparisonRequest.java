package com.goerdes.minhash.model;

import java.util.List;

/**
 * Two token collections to compare.
 */
public record ComparisonRequest(
        List<String> first,
        List<String> second
) {}
