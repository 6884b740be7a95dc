package com.bank.recovery.generation;

/**
 * A piece of policy or regulation text offered to the generator as reference.
 *
 * @param score relevance to the query, higher is better
 */
public record ReferenceSnippet(String source, String title, String content, double score) {
}
