package com.framesmith.core.oracle;

import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser();

    @Nested
    @DisplayName("Structured JSON")
    class Structured {

        @Test
        @DisplayName("Bare JSON with files, backend files and a registry entry")
        void bareJson() {
            ParsedOracleResponse parsed = parser.parse("""
                    {
                      "files": [{"path": "/src/pages/Home.tsx", "content": "export default () => null;"}],
                      "backendFiles": [{"path": "./routes/home.js", "content": "module.exports = {};"}],
                      "registryEntry": {
                        "componentName": "HeroBanner",
                        "path": "src/components/HeroBanner.tsx",
                        "tokens": ["color.brand", "space.4"],
                        "variants": ["wide"],
                        "dependencies": ["Button"],
                        "apiEndpoints": ["/api/banners"],
                        "lastGenerated": "2026-03-01T10:00:00Z"
                      }
                    }
                    """);

            assertEquals(ParsedOracleResponse.Shape.STRUCTURED, parsed.shape());
            assertEquals(List.of(new GeneratedFile("src/pages/Home.tsx", "export default () => null;")), parsed.uiFiles());
            assertEquals("routes/home.js", parsed.apiFiles().get(0).path());

            ComponentDescriptor banner = parsed.components().get(0);
            assertEquals("HeroBanner", banner.name());
            assertEquals("src/components/HeroBanner.tsx", banner.filePath());
            assertEquals(List.of("color.brand", "space.4"), banner.designTokens());
            assertEquals(Set.of("wide"), banner.variants());
            assertEquals(List.of("Button"), banner.dependencies());
            assertEquals(List.of("/api/banners"), banner.apiEndpoints());
            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), banner.generatedAt());
        }

        @Test
        @DisplayName("JSON inside a ```json fence surrounded by prose")
        void fencedJson() {
            ParsedOracleResponse parsed = parser.parse("""
                    Here is the screen:

                    ```json
                    {"files": [{"path": "src/pages/Login.tsx", "content": "login"}]}
                    ```
                    Let me know if you need changes.
                    """);

            assertEquals(ParsedOracleResponse.Shape.STRUCTURED, parsed.shape());
            assertEquals("src/pages/Login.tsx", parsed.uiFiles().get(0).path());
        }

        @Test
        @DisplayName("JSON object embedded in prose, with braces inside strings")
        void embeddedJson() {
            ParsedOracleResponse parsed = parser.parse(
                    "Sure! {\"files\": [{\"path\": \"src/a.css\", \"content\": \".a { color: red; }\"}]} Done.");

            assertEquals(".a { color: red; }", parsed.uiFiles().get(0).content());
        }

        @Test
        @DisplayName("Legacy frontend/backend maps and registryEntries arrays")
        void legacyMaps() {
            ParsedOracleResponse parsed = parser.parse("""
                    {
                      "frontend": {"src/App.tsx": "app"},
                      "backend": {"server/index.js": "server"},
                      "registryEntries": [
                        {"name": "Card", "filePath": "src/components/Card.tsx"},
                        {"name": "  "}
                      ]
                    }
                    """);

            assertEquals("src/App.tsx", parsed.uiFiles().get(0).path());
            assertEquals("server/index.js", parsed.apiFiles().get(0).path());
            assertEquals(1, parsed.components().size());
            assertEquals("src/components/Card.tsx", parsed.components().get(0).filePath());
        }

        @Test
        @DisplayName("registryRef short-circuits to a reference response")
        void registryRef() {
            ParsedOracleResponse parsed = parser.parse("{\"registryRef\": \" Button \"}");

            assertTrue(parsed.isRegistryRef());
            assertEquals("Button", parsed.registryRef());
            assertTrue(parsed.uiFiles().isEmpty());
        }

        @Test
        @DisplayName("Paths escaping the output root are dropped")
        void unsafePathsDropped() {
            ParsedOracleResponse parsed = parser.parse("""
                    {"files": [
                      {"path": "../../etc/passwd", "content": "x"},
                      {"path": "src/ok.tsx", "content": "ok"}
                    ]}
                    """);

            assertEquals(List.of("src/ok.tsx"), parsed.uiFiles().stream().map(GeneratedFile::path).toList());
        }

        @Test
        @DisplayName("Structured JSON with nothing in it is a parse error")
        void emptyStructured() {
            assertThrows(OracleParseException.class, () -> parser.parse("{\"files\": []}"));
        }
    }

    @Nested
    @DisplayName("Text fallback")
    class TextFallback {

        @Test
        @DisplayName("File headers with fenced blocks are split into UI and API files")
        void fileBlocks() {
            ParsedOracleResponse parsed = parser.parse("""
                    I generated two files.

                    File: src/pages/Home.tsx
                    ```tsx
                    export const Home = () => <div/>;
                    ```

                    File: backend/routes/home.js
                    ```javascript
                    router.get('/home');
                    ```
                    """);

            assertEquals(ParsedOracleResponse.Shape.TEXT, parsed.shape());
            assertEquals(List.of(new GeneratedFile("src/pages/Home.tsx", "export const Home = () => <div/>;\n")),
                    parsed.uiFiles());
            assertEquals("backend/routes/home.js", parsed.apiFiles().get(0).path());
        }

        @Test
        @DisplayName("A package.json block with a files key does not hide the file blocks")
        void packageJsonBlock() {
            ParsedOracleResponse parsed = parser.parse("""
                    Here is the project.

                    File: package.json
                    ```json
                    {"name": "shop-app", "version": "1.0.0", "files": ["dist"]}
                    ```

                    File: src/pages/Home.tsx
                    ```tsx
                    export const Home = () => <div/>;
                    ```
                    """);

            assertEquals(ParsedOracleResponse.Shape.TEXT, parsed.shape());
            assertEquals(List.of("package.json", "src/pages/Home.tsx"),
                    parsed.uiFiles().stream().map(GeneratedFile::path).toList());
            assertTrue(parsed.uiFiles().get(0).content().contains("\"files\": [\"dist\"]"));
        }

        @Test
        @DisplayName("Structured JSON with nothing usable and no file blocks is still a parse error")
        void unusableJsonWithoutBlocks() {
            var e = assertThrows(OracleParseException.class,
                    () -> parser.parse("Config: {\"name\": \"app\", \"files\": [\"dist\"]}"));
            assertTrue(e.getMessage().contains("no files"));
        }

        @Test
        @DisplayName("CRLF line endings are accepted")
        void crlfLineEndings() {
            ParsedOracleResponse parsed = parser.parse(
                    "File: src/pages/Home.tsx\r\n```tsx\r\nexport const Home = 1;\r\n```\r\n");

            assertEquals(List.of(new GeneratedFile("src/pages/Home.tsx", "export const Home = 1;\n")),
                    parsed.uiFiles());
        }

        @Test
        @DisplayName("A truncated reply keeps its last block even without a closing fence")
        void unclosedLastBlock() {
            ParsedOracleResponse parsed = parser.parse("""
                    File: src/pages/Home.tsx
                    ```tsx
                    export const Home = 1;
                    ```

                    File: backend/routes/home.js
                    ```javascript
                    router.get('/home');
                    router.post('/ho""");

            assertEquals(1, parsed.uiFiles().size());
            assertEquals(1, parsed.apiFiles().size());
            assertEquals("backend/routes/home.js", parsed.apiFiles().get(0).path());
            assertTrue(parsed.apiFiles().get(0).content().startsWith("router.get('/home');"));
        }

        @Test
        @DisplayName("Prose without JSON or file blocks is a parse error")
        void proseOnly() {
            var e = assertThrows(OracleParseException.class,
                    () -> parser.parse("I'm sorry, I cannot help with that design."));
            assertTrue(e.getMessage().contains("neither JSON nor file blocks"));
        }

        @Test
        @DisplayName("Blank content is a parse error")
        void blank() {
            assertThrows(OracleParseException.class, () -> parser.parse(" \n "));
        }
    }

    @Test
    @DisplayName("API paths are recognised by directory or script extension")
    void apiPathClassification() {
        assertTrue(OracleResponseParser.isApiPath("server/app.ts"));
        assertTrue(OracleResponseParser.isApiPath("handlers/users.py"));
        assertFalse(OracleResponseParser.isApiPath("src/components/Button.tsx"));
        assertFalse(OracleResponseParser.isApiPath("styles/main.scss"));
        assertFalse(OracleResponseParser.isApiPath("README.md"));
    }

    @Test
    @DisplayName("Balanced object scan ignores braces in strings")
    void balancedObject() {
        assertEquals("{\"a\": \"}\"}", OracleResponseParser.firstBalancedObject("x {\"a\": \"}\"} y"));
        assertNull(OracleResponseParser.firstBalancedObject("no braces here"));
    }
}
