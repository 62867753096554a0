package com.tale.script.ai;

import com.tale.debug.Debug;
import com.tale.script.TaleScript;

/**
 * Gateway between a {@link CodeGenerator} and the engine.
 *
 * Prompts are screened, the model's answer is cleaned up and analyzed, and
 * the caller gets both. Nothing generated is ever run here; running goes
 * through {@link TaleScript#run} like any user program.
 */
public final class GeneratedCodeService {

    private static final String TAG = "tale.ai";

    static final String SYSTEM_PROMPT = String.join("\n",
            "You are an expert TALE code generator.",
            "Always respond with TALE code only.",
            "Never include markdown, backticks, comments, or explanations.",
            "Never output Python or other languages.",
            "Keep programs concise and free of unbounded or infinite loops.",
            "",
            "TALE philosophy: readable, English-like programming for beginners.",
            "Core syntax rules:",
            "- Variables: x is 5",
            "- Output: say x",
            "- Input: ask name",
            "- Condition:",
            "  if x > 5",
            "  say \"big\"",
            "  else",
            "  say \"small\"",
            "  end",
            "- Loops:",
            "  repeat 5",
            "  say \"hello\"",
            "  end",
            "- While loops:",
            "  while x < 3",
            "  add 1 to x",
            "  end",
            "- Functions:",
            "  function add a b",
            "  return a + b",
            "  end",
            "- Lists: list numbers is [1,2,3]",
            "- Dictionary access: set scores player to 10, get scores player",
            "- File IO: open \"path\" as f, write f \"data\", close f",
            "- Flow: try / catch err / finally / end",
            "- Blocks end with the word end on its own line.",
            "",
            "Generation rules:",
            "- Return only executable TALE code.",
            "- No markdown, no backticks, no comments, no prose.",
            "- Avoid dangerous content, system commands, hacking, or unbounded loops.",
            "- Return full programs as needed; keep concise but do not truncate necessary code.");

    private final CodeGenerator generator;
    private final TaleScript engine;

    /** @param generator may be null, in which case every request fails with "AI not configured" */
    public GeneratedCodeService(CodeGenerator generator, TaleScript engine) {
        this.generator = generator;
        this.engine = engine;
    }

    public boolean configured() {
        return generator != null;
    }

    public GeneratedCode generate(String userPrompt) {
        String prompt = userPrompt == null ? "" : userPrompt.strip();
        if (prompt.isEmpty()) throw new IllegalArgumentException("Prompt is required.");
        if (PromptSafety.isUnsafe(prompt)) {
            Debug.get().w(TAG, "Prompt flagged as unsafe");
            throw new UnsafeRequestException("Unsafe request");
        }
        if (generator == null) {
            Debug.get().w(TAG, "No code generator configured");
            throw new AiServiceException("AI not configured");
        }

        String composed = SYSTEM_PROMPT + "\n\nUser request:\n" + prompt
                + "\n\nReturn only TALE code with no comments.";
        Debug.get().d(TAG, "Calling model with prompt_len=" + prompt.length());

        String text;
        try {
            text = generator.generate(composed);
        } catch (UnsafeRequestException | AiServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Model call failed", e);
            throw new AiServiceException("AI request failed: " + e.getMessage(), e);
        }

        String code = PromptSafety.stripCodeFences(text);
        Debug.get().d(TAG, "Received code_len=" + code.length());
        if (code.isEmpty()) throw new AiServiceException("AI returned empty response");

        return new GeneratedCode(code, engine.analyze(code));
    }
}
