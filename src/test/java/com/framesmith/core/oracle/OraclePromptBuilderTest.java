package com.framesmith.core.oracle;

import com.framesmith.core.model.DesignNode;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.Screen;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OraclePromptBuilderTest {

    private final OraclePromptBuilder builder = new OraclePromptBuilder();

    private static Screen checkout() {
        var root = DesignNode.of("2:3", "FRAME", "Checkout", Map.of("width", 375), List.of(
                DesignNode.of("3:1", "TEXT", "Total", Map.of("characters", "$42"), List.of())));
        return Screen.pending("2:3", "Checkout", root, 2, List.of("0:0", "1:1"), List.of("Document", "Shop"));
    }

    @Test
    @DisplayName("Prompt carries screen location, target stacks and the serialized subtree")
    void promptContents() {
        var options = new GenerationOptions("vue", "python", true, false, "Use Tailwind", Set.of());

        OracleRequest request = builder.build(checkout(), List.of(), options);

        assertEquals("2:3", request.screenId());
        assertEquals(OraclePromptBuilder.SYSTEM_PROMPT, request.systemPrompt());
        String prompt = request.userPrompt();
        assertTrue(prompt.contains("Name: Checkout"));
        assertTrue(prompt.contains("Location: Document / Shop"));
        assertTrue(prompt.contains("Frontend: vue"));
        assertTrue(prompt.contains("Backend: python"));
        assertTrue(prompt.contains("Include tests: yes"));
        assertTrue(prompt.contains("(none yet)"));
        assertTrue(prompt.contains("## Additional requirements\nUse Tailwind"));
        assertTrue(prompt.contains("\"characters\":\"$42\""));
    }

    @Test
    @DisplayName("Registered components are listed so the oracle can reuse them")
    void knownComponentsListed() {
        OracleRequest request = builder.build(checkout(), List.of("Header", "Button"), GenerationOptions.defaults());

        assertTrue(request.userPrompt().contains("- Header\n- Button\n"));
        assertFalse(request.userPrompt().contains("Additional requirements"));
        assertEquals(List.of("Header", "Button"), request.knownComponents());
    }

    @Test
    @DisplayName("Subtree serialization keeps id, type, name, attributes and children in order")
    void serialization() {
        String json = builder.serialize(checkout().root());
        assertEquals("{\"id\":\"2:3\",\"type\":\"FRAME\",\"name\":\"Checkout\",\"width\":375,"
                + "\"children\":[{\"id\":\"3:1\",\"type\":\"TEXT\",\"name\":\"Total\",\"characters\":\"$42\"}]}", json);
    }

    @Test
    @DisplayName("System prompt describes the registryRef shortcut")
    void systemPromptMentionsRegistryRef() {
        assertTrue(OraclePromptBuilder.SYSTEM_PROMPT.contains("registryRef"));
    }
}
