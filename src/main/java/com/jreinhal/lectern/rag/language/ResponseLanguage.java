package com.jreinhal.lectern.rag.language;

import java.util.EnumMap;
import java.util.Map;

/**
 * Languages an answer can be written in, detected from the writing system of the
 * question. Scripts shared by several languages map to the most common one
 * (Devanagari to Hindi, Bengali script to Bengali, Arabic script to Urdu).
 */
public enum ResponseLanguage {
    ENGLISH("en", "English", Character.UnicodeScript.LATIN),
    HINDI("hi", "Hindi", Character.UnicodeScript.DEVANAGARI),
    BENGALI("bn", "Bengali", Character.UnicodeScript.BENGALI),
    GUJARATI("gu", "Gujarati", Character.UnicodeScript.GUJARATI),
    PUNJABI("pa", "Punjabi", Character.UnicodeScript.GURMUKHI),
    TAMIL("ta", "Tamil", Character.UnicodeScript.TAMIL),
    TELUGU("te", "Telugu", Character.UnicodeScript.TELUGU),
    KANNADA("kn", "Kannada", Character.UnicodeScript.KANNADA),
    MALAYALAM("ml", "Malayalam", Character.UnicodeScript.MALAYALAM),
    ODIA("or", "Odia", Character.UnicodeScript.ORIYA),
    URDU("ur", "Urdu", Character.UnicodeScript.ARABIC);

    private static final Map<Character.UnicodeScript, ResponseLanguage> BY_SCRIPT = new EnumMap<>(Character.UnicodeScript.class);

    static {
        for (ResponseLanguage language : values()) {
            BY_SCRIPT.put(language.script, language);
        }
    }

    private final String code;
    private final String displayName;
    private final Character.UnicodeScript script;

    ResponseLanguage(String code, String displayName, Character.UnicodeScript script) {
        this.code = code;
        this.displayName = displayName;
        this.script = script;
    }

    public String code() {
        return this.code;
    }

    public String displayName() {
        return this.displayName;
    }

    /**
     * The language whose script covers the most letters of {@code text}. Text without
     * letters, or written in an unsupported script, is answered in English.
     */
    public static ResponseLanguage detect(String text) {
        if (text == null || text.isBlank()) {
            return ENGLISH;
        }
        Map<ResponseLanguage, Integer> letters = new EnumMap<>(ResponseLanguage.class);
        text.codePoints()
                .filter(Character::isLetter)
                .mapToObj(Character.UnicodeScript::of)
                .map(BY_SCRIPT::get)
                .filter(language -> language != null)
                .forEach(language -> letters.merge(language, 1, Integer::sum));
        ResponseLanguage best = ENGLISH;
        int bestCount = 0;
        for (Map.Entry<ResponseLanguage, Integer> entry : letters.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
