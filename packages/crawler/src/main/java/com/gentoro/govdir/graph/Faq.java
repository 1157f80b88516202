package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"faq_id", "question", "answer"})
public record Faq(
    @JsonProperty("faq_id") String faqId,
    @JsonProperty("question") String question,
    @JsonProperty("answer") String answer) {}
