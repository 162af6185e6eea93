package com.jreinhal.lectern.rag.language;

import com.jreinhal.lectern.constant.RagConstants;

/**
 * User-facing messages the pipeline sends without a generation call. Hindi has its own
 * wording; every other language receives the English text.
 */
public enum FixedMessage {
    UPLOAD_PROMPT(RagConstants.UPLOAD_PROMPT_MESSAGE,
            "कृपया पहले कुछ दस्तावेज़ अपलोड करें, फिर उनके बारे में मुझसे प्रश्न पूछें।"),
    NO_RELEVANT_INFO(RagConstants.NO_RELEVANT_INFO_MESSAGE,
            "मुझे आपके दस्तावेज़ों में प्रासंगिक जानकारी नहीं मिली। कृपया अपना प्रश्न दूसरे शब्दों में पूछें।"),
    APOLOGY(RagConstants.APOLOGY_MESSAGE,
            "आपके अनुरोध को संसाधित करते समय एक त्रुटि हुई। कृपया पुनः प्रयास करें।"),
    SERVICE_UNAVAILABLE(RagConstants.SERVICE_UNAVAILABLE_MESSAGE,
            "दस्तावेज़ सेवा अस्थायी रूप से उपलब्ध नहीं है। कृपया थोड़ी देर बाद पुनः प्रयास करें।"),
    SIMPLE_FALLBACK(RagConstants.SIMPLE_FALLBACK_MESSAGE,
            "मैं इस बातचीत में अपलोड किए गए दस्तावेज़ों के बारे में प्रश्नों के उत्तर देता हूँ। कोई PDF या छवि अपलोड करें और उसके बारे में कुछ भी पूछें।");

    private final String english;
    private final String hindi;

    FixedMessage(String english, String hindi) {
        this.english = english;
        this.hindi = hindi;
    }

    public String text(ResponseLanguage language) {
        return language == ResponseLanguage.HINDI ? this.hindi : this.english;
    }
}
