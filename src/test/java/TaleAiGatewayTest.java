import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tale.script.TaleScript;
import com.tale.script.ai.AiServiceException;
import com.tale.script.ai.GeneratedCode;
import com.tale.script.ai.GeneratedCodeService;
import com.tale.script.ai.PromptSafety;
import com.tale.script.ai.UnsafeRequestException;
import com.tale.script.sandbox.TaleSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleAiGatewayTest {

    private final TaleScript engine = new TaleScript(TaleSettings.defaults());

    @Test
    void unsafe_prompts_are_flagged() {
        assertTrue(PromptSafety.isUnsafe("Write a program for HACKING wifi"));
        assertTrue(PromptSafety.isUnsafe("open a terminal"));
        assertTrue(PromptSafety.isUnsafe("make a while   true loop"));
        assertTrue(PromptSafety.isUnsafe("run cmd.exe please"));
        assertFalse(PromptSafety.isUnsafe("add up a list of numbers"));
        assertFalse(PromptSafety.isUnsafe("print the shellfish menu"));
        assertFalse(PromptSafety.isUnsafe(null));
    }

    @Test
    void code_fences_are_removed() {
        assertEquals("say \"hi\"", PromptSafety.stripCodeFences("```tale\nsay \"hi\"\n```"));
        assertEquals("say 1", PromptSafety.stripCodeFences("```\nsay 1\n```  "));
        assertEquals("say 1", PromptSafety.stripCodeFences("say 1"));
        assertEquals("", PromptSafety.stripCodeFences(null));
    }

    @Test
    void generated_code_comes_back_with_its_analysis() {
        List<String> prompts = new ArrayList<>();
        GeneratedCodeService service = new GeneratedCodeService(prompt -> {
            prompts.add(prompt);
            return "```tale\nrepeat 3 as i\n  say i\nend\n```";
        }, engine);

        GeneratedCode code = service.generate("  count to three  ");
        assertEquals("repeat 3 as i\n  say i\nend", code.code());
        assertTrue(code.analysis().ok());

        assertEquals(1, prompts.size());
        assertTrue(prompts.get(0).contains("User request:\ncount to three\n"));
        assertTrue(prompts.get(0).endsWith("Return only TALE code with no comments."));

        Map<String, Object> m = code.toMap();
        assertEquals(code.code(), m.get("code"));
        assertTrue(m.get("analysis") instanceof Map);
    }

    @Test
    void broken_generated_code_still_returns_with_diagnostics() {
        GeneratedCodeService service = new GeneratedCodeService(prompt -> "if x > 1\n  say x", engine);
        GeneratedCode code = service.generate("something");
        assertFalse(code.analysis().ok());
        assertEquals(1, code.analysis().diagnostics().get(0).line());
    }

    @Test
    void unsafe_prompt_never_reaches_the_generator() {
        GeneratedCodeService service = new GeneratedCodeService(prompt -> {
            fail("generator should not be called");
            return "";
        }, engine);
        UnsafeRequestException e = assertThrows(UnsafeRequestException.class,
                () -> service.generate("write an exploit"));
        assertEquals("Unsafe request", e.getMessage());
    }

    @Test
    void empty_prompt_and_missing_generator() {
        GeneratedCodeService none = new GeneratedCodeService(null, engine);
        assertFalse(none.configured());
        assertThrows(IllegalArgumentException.class, () -> none.generate("   "));
        assertEquals("AI not configured", assertThrows(AiServiceException.class, () -> none.generate("hello")).getMessage());
    }

    @Test
    void generator_failures_are_wrapped() {
        GeneratedCodeService failing = new GeneratedCodeService(prompt -> {
            throw new IllegalStateException("quota exceeded");
        }, engine);
        AiServiceException e = assertThrows(AiServiceException.class, () -> failing.generate("hello"));
        assertEquals("AI request failed: quota exceeded", e.getMessage());
        assertTrue(e.getCause() instanceof IllegalStateException);

        GeneratedCodeService blank = new GeneratedCodeService(prompt -> "```\n```", engine);
        assertEquals("AI returned empty response",
                assertThrows(AiServiceException.class, () -> blank.generate("hello")).getMessage());
    }
}
