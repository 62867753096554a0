package com.tale.script.ai;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Screens user prompts before they reach the generator. */
public final class PromptSafety {

    private static final List<Pattern> UNSAFE = Collections.unmodifiableList(Arrays.asList(
            Pattern.compile("\\bhack(ing)?\\b"),
            Pattern.compile("\\bexploit\\b"),
            Pattern.compile("\\bsystem command\\b"),
            Pattern.compile("\\bcommand prompt\\b"),
            Pattern.compile("\\bterminal\\b"),
            Pattern.compile("\\bshell\\b"),
            Pattern.compile("\\bbash\\b"),
            Pattern.compile("\\bpowershell\\b"),
            Pattern.compile("\\bcmd\\.exe\\b"),
            Pattern.compile("\\binfinite loop\\b"),
            Pattern.compile("while\\s+true"),
            Pattern.compile("for\\s+ever")
    ));

    private static final Pattern OPENING_FENCE = Pattern.compile("^```[a-zA-Z0-9_-]*");
    private static final Pattern CLOSING_FENCE = Pattern.compile("```$");

    private PromptSafety() {}

    public static boolean isUnsafe(String prompt) {
        if (prompt == null) return false;
        String lowered = prompt.toLowerCase(Locale.ROOT);
        for (Pattern p : UNSAFE) {
            if (p.matcher(lowered).find()) return true;
        }
        return false;
    }

    /** Removes one surrounding markdown code fence, with or without a language tag. */
    public static String stripCodeFences(String text) {
        if (text == null) return "";
        String cleaned = text.strip();
        cleaned = OPENING_FENCE.matcher(cleaned).replaceFirst("");
        cleaned = CLOSING_FENCE.matcher(cleaned).replaceFirst("");
        return cleaned.strip();
    }
}
