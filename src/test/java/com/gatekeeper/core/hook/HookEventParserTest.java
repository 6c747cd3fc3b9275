package com.gatekeeper.core.hook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.HookPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class HookEventParserTest {

    private GatekeeperProperties properties;
    private HookEventParser parser;

    @BeforeEach
    void setUp() {
        properties = new GatekeeperProperties();
        properties.setProjectDir("/work/app");
        parser = new HookEventParser(new ObjectMapper(), properties);
    }

    @Nested
    @DisplayName("Well-formed events")
    class ValidTests {

        @Test
        @DisplayName("host pre-tool event with a shell command")
        void bashEvent() throws MalformedEventException {
            ActionRequest request = parser.parse("""
                    {"session_id":"abc","hook_event_name":"PreToolUse","tool_name":"Bash",
                     "tool_input":{"command":"rm -rf /tmp/foo","description":"cleanup"}}
                    """, null);

            assertEquals(HookPhase.PRE_ACTION, request.phase());
            assertEquals("Bash", request.toolName());
            assertEquals("rm -rf /tmp/foo", request.commandText());
            assertNull(request.resourcePath());
            assertEquals("abc", request.sessionId());
            assertEquals(Path.of("/work/app"), request.projectDir());
        }

        @Test
        @DisplayName("file path and content are extracted from edit tools")
        void editEvent() throws MalformedEventException {
            ActionRequest request = parser.parse("""
                    {"phase":"post-action","tool_name":"Edit",
                     "tool_input":{"file_path":"src/app.ts","old_string":"a","new_string":"b"}}
                    """, null);

            assertEquals(HookPhase.POST_ACTION, request.phase());
            assertEquals("src/app.ts", request.resourcePath());
            assertEquals("b", request.content());
        }

        @Test
        @DisplayName("notebook path is recognised")
        void notebookEvent() throws MalformedEventException {
            ActionRequest request = parser.parse("""
                    {"phase":"PRE_ACTION","tool_name":"NotebookEdit","tool_input":{"notebook_path":"nb/a.ipynb","new_source":"x"}}
                    """, null);
            assertEquals("nb/a.ipynb", request.resourcePath());
        }

        @Test
        @DisplayName("completion check needs no tool name")
        void stopEvent() throws MalformedEventException {
            ActionRequest request = parser.parse("{\"hook_event_name\":\"Stop\",\"session_id\":\"s\"}", null);
            assertEquals(HookPhase.COMPLETION_CHECK, request.phase());
            assertNull(request.toolName());
        }

        @Test
        @DisplayName("phase override wins over the event")
        void override() throws MalformedEventException {
            ActionRequest request = parser.parse(
                    "{\"hook_event_name\":\"PreToolUse\",\"tool_name\":\"Write\",\"tool_input\":{}}",
                    HookPhase.POST_ACTION);
            assertEquals(HookPhase.POST_ACTION, request.phase());
        }

        @Test
        @DisplayName("unknown fields and non-string inputs are tolerated")
        void lenient() throws MalformedEventException {
            ActionRequest request = parser.parse("""
                    {"phase":"pre-action","tool_name":"Write","transcript_path":"/x",
                     "tool_input":{"file_path":42,"path":"docs/a.md","content":["not","text"]}}
                    """, null);
            assertEquals("docs/a.md", request.resourcePath());
            assertNull(request.content());
        }

        @Test
        @DisplayName("event cwd is used when nothing else names the project")
        void cwdFallback() throws MalformedEventException {
            assumeTrue(System.getenv("CLAUDE_PROJECT_DIR") == null);
            properties.setProjectDir("");

            ActionRequest request = parser.parse(
                    "{\"phase\":\"pre-action\",\"tool_name\":\"Read\",\"cwd\":\"/srv/repo\"}", null);

            assertEquals(Path.of("/srv/repo"), request.projectDir());
        }
    }

    @Nested
    @DisplayName("Malformed events")
    class MalformedTests {

        @ParameterizedTest(name = "rejects {0}")
        @ValueSource(strings = {"", "   ", "null", "{not json", "[1,2]"})
        void unparsable(String json) {
            assertThrows(MalformedEventException.class, () -> parser.parse(json, null));
        }

        @Test
        @DisplayName("missing phase is malformed")
        void missingPhase() {
            var e = assertThrows(MalformedEventException.class,
                    () -> parser.parse("{\"tool_name\":\"Bash\"}", null));
            assertTrue(e.getMessage().contains("no recognisable phase"));
        }

        @Test
        @DisplayName("pre-action without a tool name is malformed")
        void missingToolName() {
            assertThrows(MalformedEventException.class,
                    () -> parser.parse("{\"phase\":\"pre-action\",\"tool_input\":{\"command\":\"ls\"}}", null));
        }
    }
}
