package com.framesmith.core.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framesmith.core.model.DesignNode;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.Screen;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the contextual prompt for one screen: screen position in the document, the components already
 * registered by earlier screens, the target stacks and the serialized subtree.
 */
@Component
public class OraclePromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a code generator that turns one screen of a UI design into source files.
            The design is given as a JSON node tree (id, type, name, geometry and style attributes, children).

            Respond with a single JSON object and nothing else:
            {
              "files": [{"path": "src/pages/Home.tsx", "content": "..."}],
              "backendFiles": [{"path": "src/routes/home.js", "content": "..."}],
              "registryEntry": {
                "componentName": "Header",
                "path": "src/components/Header.tsx",
                "variants": ["default"],
                "tokens": ["color.primary"],
                "dependencies": [],
                "apiEndpoints": []
              }
            }

            RULES:
            1. Put the screen's page component under src/pages/.
            2. Put reusable components under src/components/ and describe each in registryEntry
               (use "registryEntries" for several).
            3. If a component listed under "Existing components" already covers this screen, do not
               generate it again. Import it from its registered path instead.
            4. If the entire screen is exactly one existing component, respond only with
               {"registryRef": "<component name>"}.
            5. Paths are relative. Never use absolute paths or "..".
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public OracleRequest build(Screen screen, List<String> knownComponents, GenerationOptions options) {
        var prompt = new StringBuilder();
        prompt.append("## Screen\n");
        prompt.append("Name: ").append(screen.name()).append('\n');
        prompt.append("Id: ").append(screen.id()).append('\n');
        if (!screen.ancestorPath().isEmpty()) {
            prompt.append("Location: ").append(String.join(" / ", screen.ancestorPath())).append('\n');
        }
        prompt.append("Nodes: ").append(screen.nodeCount()).append('\n');

        prompt.append("\n## Target\n");
        prompt.append("Frontend: ").append(options.frontendFramework()).append('\n');
        prompt.append("Backend: ").append(options.backendFramework()).append('\n');
        prompt.append("Include tests: ").append(options.includeTests() ? "yes" : "no").append('\n');
        prompt.append("Include docs: ").append(options.includeDocs() ? "yes" : "no").append('\n');

        prompt.append("\n## Existing components\n");
        if (knownComponents.isEmpty()) {
            prompt.append("(none yet)\n");
        } else {
            knownComponents.forEach(name -> prompt.append("- ").append(name).append('\n'));
        }

        if (options.userMessage() != null && !options.userMessage().isBlank()) {
            prompt.append("\n## Additional requirements\n").append(options.userMessage().trim()).append('\n');
        }

        prompt.append("\n## Design\n```json\n").append(serialize(screen.root())).append("\n```\n");
        return new OracleRequest(screen.id(), SYSTEM_PROMPT, prompt.toString(), knownComponents, options);
    }

    String serialize(DesignNode root) {
        try {
            return objectMapper.writeValueAsString(toMap(root));
        } catch (JsonProcessingException e) {
            throw new OracleRequestException("Cannot serialize design subtree " + root.id(), e);
        }
    }

    private static Map<String, Object> toMap(DesignNode node) {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", node.id());
        map.put("type", node.type());
        map.put("name", node.name());
        map.putAll(node.attributes());
        if (!node.children().isEmpty()) {
            var children = new ArrayList<Map<String, Object>>(node.children().size());
            for (DesignNode child : node.children()) {
                children.add(toMap(child));
            }
            map.put("children", children);
        }
        return map;
    }
}
