package com.railexchange.api.abuse;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pre-filter for inquiry bodies. Runs before any counter is touched, so a rejected message
 * does not consume the sender's allowance.
 */
@Component
public class ContentFilter {

    static final String LINKS_NOT_ALLOWED = "External links are not allowed in inquiries.";
    static final String CONTENT_NOT_ALLOWED = "Your message contains content that is not allowed.";

    private static final Pattern EXTERNAL_LINK = Pattern.compile(
            "https?://\\S+|www\\.\\S+|\\[url]|\\[link]", Pattern.CASE_INSENSITIVE);

    private static final List<String> BLOCKED_PHRASES = List.of(
            // promotional
            "click here",
            "visit my website",
            "check out my site",
            "free offer",
            "limited time offer",
            "act now",
            "don't miss out",
            "exclusive deal",
            "make money fast",
            "work from home",
            "earn extra income",
            // payment scams and phishing
            "send money",
            "wire transfer",
            "western union",
            "moneygram",
            "gift card payment",
            "bitcoin payment",
            "crypto payment",
            "verify your account",
            "confirm your identity",
            // off-platform contact harvesting
            "contact me at",
            "email me at",
            "call me at",
            "text me at",
            "whatsapp",
            "telegram",
            "signal me"
    );

    public ContentCheck check(String content) {
        if (content == null || content.isBlank()) {
            return ContentCheck.ok();
        }
        if (containsExternalLink(content)) {
            return ContentCheck.rejected(LINKS_NOT_ALLOWED, null);
        }
        String blocked = findBlockedPhrase(content);
        if (blocked != null) {
            return ContentCheck.rejected(CONTENT_NOT_ALLOWED, blocked);
        }
        return ContentCheck.ok();
    }

    public boolean containsExternalLink(String content) {
        return content != null && EXTERNAL_LINK.matcher(content).find();
    }

    /**
     * @return the first blocklisted phrase found, or null
     */
    public String findBlockedPhrase(String content) {
        if (content == null) {
            return null;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String phrase : BLOCKED_PHRASES) {
            if (lower.contains(phrase)) {
                return phrase;
            }
        }
        return null;
    }

    /**
     * @param matchedPhrase internal detail for moderation logs, never shown to the sender
     */
    public record ContentCheck(boolean allowed, String reason, String matchedPhrase) {

        static ContentCheck ok() {
            return new ContentCheck(true, null, null);
        }

        static ContentCheck rejected(String reason, String matchedPhrase) {
            return new ContentCheck(false, reason, matchedPhrase);
        }
    }
}
