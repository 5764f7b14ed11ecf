package com.starscape.destinationtags.features.tags.infra;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Node of a per-language synonym trie.
 * Children are keyed by code point and kept sorted so traversal order is deterministic.
 * Tags with identically spelled synonyms share the terminal node's id set.
 */
class TagTrieNode {
    
    private final Map<Integer, TagTrieNode> children = new TreeMap<>();
    private final Set<String> tagIds = new LinkedHashSet<>();
    
    TagTrieNode child(int codePoint) {
        return children.get(codePoint);
    }
    
    TagTrieNode getOrAddChild(int codePoint) {
        return children.computeIfAbsent(codePoint, key -> new TagTrieNode());
    }
    
    void removeChild(int codePoint) {
        children.remove(codePoint);
    }
    
    Map<Integer, TagTrieNode> children() {
        return Collections.unmodifiableMap(children);
    }
    
    void addTagId(String tagId) {
        tagIds.add(tagId);
    }
    
    void removeTagId(String tagId) {
        tagIds.remove(tagId);
    }
    
    Set<String> tagIds() {
        return Collections.unmodifiableSet(tagIds);
    }
    
    boolean isEmpty() {
        return children.isEmpty() && tagIds.isEmpty();
    }
    
    /**
     * Collect ids terminating at this node and every descendant, depth first.
     */
    void collectTagIds(Set<String> into) {
        into.addAll(tagIds);
        for (TagTrieNode child : children.values()) {
            child.collectTagIds(into);
        }
    }
}
