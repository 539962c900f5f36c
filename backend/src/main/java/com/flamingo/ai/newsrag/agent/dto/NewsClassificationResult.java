package com.flamingo.ai.newsrag.agent.dto;

/**
 * Structured output from NewsClassificationAgent. LangChain4j deserializes the LLM JSON response
 * into this record.
 */
public record NewsClassificationResult(boolean newsRelated, String reasoning) {}
