package com.starscape.destinationtags.common.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.starscape.destinationtags.common.exception.DecodeException;

import java.util.Locale;
import java.util.Optional;

/**
 * ISO 639-1 codes of the languages the engine indexes.
 */
public enum LanguageCode {
    ZH("zh"),
    EN("en"),
    JA("ja"),
    KO("ko"),
    FR("fr"),
    ES("es"),
    DE("de");
    
    private final String code;
    
    LanguageCode(String code) {
        this.code = code;
    }
    
    @JsonValue
    public String getCode() {
        return code;
    }
    
    /**
     * Decode a language code, case-insensitively.
     * @throws DecodeException if the code is not one of the supported languages
     */
    @JsonCreator
    public static LanguageCode fromCode(String value) {
        return find(value)
                .orElseThrow(() -> new DecodeException("language", value));
    }
    
    public static Optional<LanguageCode> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LanguageCode language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
