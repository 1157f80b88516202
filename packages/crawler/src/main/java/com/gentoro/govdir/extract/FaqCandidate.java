package com.gentoro.govdir.extract;

/** One question/answer pair; {@code answer} is null when the item had no answer block. */
public record FaqCandidate(String question, String answer) {}
