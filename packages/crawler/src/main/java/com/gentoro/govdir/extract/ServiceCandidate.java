package com.gentoro.govdir.extract;

/** A service link; the URL is kept as found and may point off-platform. */
public record ServiceCandidate(String name, String url) {}
