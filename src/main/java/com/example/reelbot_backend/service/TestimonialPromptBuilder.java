package com.example.reelbot_backend.service;

import com.example.reelbot_backend.util.ClipType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed prompt templates for testimonial footage.
 */
@Component
public class TestimonialPromptBuilder {
    private static final String DEFAULT_STYLE = "professional";
    private static final Map<String, String> STYLES = Map.of(
            "professional", "professional, corporate setting, business attire",
            "casual", "casual, relaxed setting, everyday clothing",
            "friendly", "warm, welcoming, approachable demeanor",
            "energetic", "high energy, enthusiastic, dynamic movements",
            "calm", "serene, peaceful, gentle expressions",
            "bold", "confident, strong presence, direct eye contact",
            "warm", "cozy, inviting, natural warmth",
            "corporate", "business professional, office environment"
    );

    public String singleTake(String businessName, String style) {
        String key = style == null ? DEFAULT_STYLE : style.trim().toLowerCase(Locale.ROOT);
        String styleDesc = STYLES.getOrDefault(key, STYLES.get(DEFAULT_STYLE));
        return """
                A person giving a genuine video testimonial review. They are %s.
                The person is speaking directly to camera, expressing satisfaction about %s.
                They appear authentic and trustworthy, like a real customer sharing their experience.
                UGC style, selfie video, natural lighting, vertical phone recording.""".formatted(styleDesc, businessName);
    }

    public String clip(ClipType type, String line) {
        String delivery = switch (type) {
            case HOOK -> "opens with an attention-grabbing, curious expression";
            case TESTIMONIAL -> "shares their experience sincerely, natural gestures";
            case CTA -> "ends with an encouraging, upbeat recommendation";
        };
        return "The person looks into the camera and " + delivery + ", saying: \"" + line + "\". "
                + "UGC selfie style, natural lighting, consistent appearance.";
    }
}
