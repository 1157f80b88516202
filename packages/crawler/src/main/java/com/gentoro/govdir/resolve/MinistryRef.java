package com.gentoro.govdir.resolve;

/** A ministry from the ministry list, ready to have its page fetched. */
public record MinistryRef(String ministryId, String name, String url) {}
