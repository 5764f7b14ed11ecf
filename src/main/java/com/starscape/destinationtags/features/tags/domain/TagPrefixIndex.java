package com.starscape.destinationtags.features.tags.domain;

import com.starscape.destinationtags.common.domain.LanguageCode;

import java.util.Set;

/**
 * Per-language prefix index over lower-cased tag synonyms. Holds tag ids only.
 */
public interface TagPrefixIndex {
    
    /**
     * Index every synonym of the tag under its language.
     */
    void index(Tag tag);
    
    /**
     * Remove the entries contributed by this version of the tag.
     */
    void retract(Tag tag);
    
    /**
     * Ids of all tags with a synonym starting with the prefix, in traversal order.
     * Returns an empty set for a language without an index or an unmatched prefix.
     */
    Set<String> search(String prefix, LanguageCode language);
    
    Set<LanguageCode> indexedLanguages();
    
    void clear();
}
