package com.gentoro.kbo.schema;

/** Best exemplar for a question with its similarity score in [0, 1]. */
public record IntentMatch(IntentExemplar exemplar, double score) {}
