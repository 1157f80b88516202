package com.gentoro.govdir.extract;

public record MinistryLinkCandidate(String name, String url) {}
