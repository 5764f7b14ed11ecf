package com.starscape.destinationtags.features.tags.infra;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagPrefixIndex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PrimitiveIterator;
import java.util.Set;

/**
 * Trie-backed prefix index, one trie per language, created on first use.
 * Lookups are case-insensitive: synonyms and prefixes are lower-cased with {@link Locale#ROOT}.
 * Not thread-safe on its own; callers hold the engine lock.
 */
@Component
public class TrieTagPrefixIndex implements TagPrefixIndex {
    
    private final Map<LanguageCode, TagTrieNode> roots = new EnumMap<>(LanguageCode.class);
    
    @Override
    public void index(Tag tag) {
        tag.getSynonyms().forEach((language, names) -> {
            TagTrieNode root = roots.computeIfAbsent(language, key -> new TagTrieNode());
            for (String name : names) {
                insert(root, normalize(name), tag.getId());
            }
        });
    }
    
    private void insert(TagTrieNode root, String name, String tagId) {
        TagTrieNode node = root;
        PrimitiveIterator.OfInt codePoints = name.codePoints().iterator();
        while (codePoints.hasNext()) {
            node = node.getOrAddChild(codePoints.nextInt());
        }
        node.addTagId(tagId);
    }
    
    @Override
    public void retract(Tag tag) {
        tag.getSynonyms().forEach((language, names) -> {
            TagTrieNode root = roots.get(language);
            if (root == null) {
                return;
            }
            for (String name : names) {
                remove(root, normalize(name), tag.getId());
            }
            if (root.isEmpty()) {
                roots.remove(language);
            }
        });
    }
    
    private void remove(TagTrieNode root, String name, String tagId) {
        int[] codePoints = name.codePoints().toArray();
        List<TagTrieNode> path = new ArrayList<>(codePoints.length + 1);
        path.add(root);
        
        TagTrieNode node = root;
        for (int codePoint : codePoints) {
            node = node.child(codePoint);
            if (node == null) {
                return;
            }
            path.add(node);
        }
        node.removeTagId(tagId);
        
        // Prune the branch bottom-up while it holds neither ids nor children
        for (int depth = codePoints.length; depth > 0; depth--) {
            TagTrieNode current = path.get(depth);
            if (!current.isEmpty()) {
                break;
            }
            path.get(depth - 1).removeChild(codePoints[depth - 1]);
        }
    }
    
    @Override
    public Set<String> search(String prefix, LanguageCode language) {
        TagTrieNode node = roots.get(language);
        if (node == null) {
            return Collections.emptySet();
        }
        
        PrimitiveIterator.OfInt codePoints = normalize(prefix).codePoints().iterator();
        while (codePoints.hasNext()) {
            node = node.child(codePoints.nextInt());
            if (node == null) {
                return Collections.emptySet();
            }
        }
        
        Set<String> tagIds = new LinkedHashSet<>();
        node.collectTagIds(tagIds);
        return tagIds;
    }
    
    @Override
    public Set<LanguageCode> indexedLanguages() {
        return Collections.unmodifiableSet(roots.keySet());
    }
    
    @Override
    public void clear() {
        roots.clear();
    }
    
    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
