package com.gatekeeper.core.standards;

import com.gatekeeper.core.model.Severity;
import com.gatekeeper.core.model.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CodeStandardsCheckerTest {

    private final CodeStandardsChecker checker = new CodeStandardsChecker();

    private static List<String> ruleIds(List<Violation> violations) {
        return violations.stream().map(Violation::ruleId).toList();
    }

    // ── Banned types ────────────────────────────────────────────────

    @Nested
    @DisplayName("Banned types")
    class BannedTypeTests {

        @Test
        @DisplayName("TypeScript any annotation is an error with its line")
        void typescriptAny() {
            var violations = checker.check("src/user-service.ts",
                    "const a = 1;\n\nexport function load(input: any) {\n  return input;\n}\n");

            assertEquals(List.of("banned_type"), ruleIds(violations));
            Violation v = violations.get(0);
            assertEquals(Severity.ERROR, v.severity());
            assertEquals(3, v.line());
            assertEquals("src/user-service.ts", v.resourcePath());
            assertNotNull(v.fix());
        }

        @Test
        @DisplayName("as any and generic any are reported")
        void castsAndGenerics() {
            var violations = checker.check("src/a.ts", "const x = y as any;\nconst l: Array<any> = [];\n");
            assertEquals(2, violations.size());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "const x: unknown = JSON.parse(s);",
                "const anything = 1;",
                "let company: string = 'any';",
                "type T = { many: number };"
        })
        @DisplayName("clean TypeScript passes")
        void cleanTypescript(String line) {
            assertTrue(checker.check("src/clean.ts", line + "\n").isEmpty());
        }

        @Test
        @DisplayName("Python Any hint is reported")
        void pythonAny() {
            var violations = checker.check("pkg/loader.py",
                    "from typing import Any\n\ndef load(x: int) -> Any:\n    return x\n");
            assertEquals(List.of("banned_type"), ruleIds(violations));
            assertEquals(3, violations.get(0).line());
        }
    }

    // ── Banned keywords ─────────────────────────────────────────────

    @Nested
    @DisplayName("Banned keywords")
    class BannedKeywordTests {

        @Test
        @DisplayName("var declarations are reported in JavaScript")
        void varDeclaration() {
            var violations = checker.check("lib/index.js", "'use strict';\n\n\nvar count = 0;\n");
            assertEquals(List.of("banned_keyword"), ruleIds(violations));
            assertEquals(4, violations.get(0).line());
        }

        @Test
        @DisplayName("ts-ignore is reported")
        void tsIgnore() {
            var violations = checker.check("src/a.ts", "// @ts-ignore\nfoo(bar);\n");
            assertEquals(List.of("banned_keyword"), ruleIds(violations));
        }

        @Test
        @DisplayName("python global statement is reported")
        void pythonGlobal() {
            var violations = checker.check("app/state.py", "counter = 0\n\ndef bump():\n    global counter\n");
            assertEquals(List.of("banned_keyword"), ruleIds(violations));
            assertEquals(4, violations.get(0).line());
        }

        @Test
        @DisplayName("identifiers containing var are not reported")
        void variableNames() {
            assertTrue(checker.check("src/a.js", "const variance = 2;\nlet varName = 1;\n").isEmpty());
        }
    }

    // ── Empty error handling ────────────────────────────────────────

    @Nested
    @DisplayName("Empty error handling")
    class EmptyErrorHandlingTests {

        @Test
        @DisplayName("empty catch block in TypeScript")
        void emptyCatchTs() {
            var violations = checker.check("src/a.ts", "try {\n  run();\n} catch (e) {}\n");
            assertEquals(List.of("empty_error_handling"), ruleIds(violations));
            assertEquals(3, violations.get(0).line());
        }

        @Test
        @DisplayName("empty catch block spanning lines in Java")
        void emptyCatchJava() {
            var violations = checker.check("src/main/java/App.java",
                    "class App {\n  void run() {\n    try { go(); } catch (IOException e) {\n    }\n  }\n}\n");
            assertEquals(List.of("empty_error_handling"), ruleIds(violations));
        }

        @Test
        @DisplayName("except pass in Python")
        void exceptPass() {
            var violations = checker.check("app/job.py", "try:\n    run()\nexcept Exception:\n    pass\n");
            assertEquals(List.of("empty_error_handling"), ruleIds(violations));
            assertEquals(3, violations.get(0).line());
        }

        @Test
        @DisplayName("handled errors pass")
        void handled() {
            assertTrue(checker.check("src/a.ts",
                    "try { run(); } catch (e) { logger.error(e); throw e; }\n").isEmpty());
            assertTrue(checker.check("app/job.py",
                    "try:\n    run()\nexcept ValueError as e:\n    log.warning(e)\n").isEmpty());
        }
    }

    // ── Naming conventions ──────────────────────────────────────────

    @Nested
    @DisplayName("Naming conventions")
    class NamingTests {

        @ParameterizedTest
        @ValueSource(strings = {"src/user-profile.ts", "src/user-profile.test.ts", "src/index.tsx", "src/v2-api.js"})
        @DisplayName("kebab-case JavaScript family names pass")
        void kebabCase(String path) {
            assertTrue(checker.check(path, "").isEmpty());
        }

        @Test
        @DisplayName("PascalCase TypeScript file is a warning")
        void pascalTs() {
            var violations = checker.check("src/UserProfile.ts", "");
            assertEquals(List.of("naming_convention"), ruleIds(violations));
            assertEquals(Severity.WARNING, violations.get(0).severity());
            assertTrue(violations.get(0).message().endsWith("UserProfile.ts"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"pkg/user_profile.py", "pkg/__init__.py", "pkg/_private.py"})
        @DisplayName("snake_case Python names pass")
        void snakeCase(String path) {
            assertTrue(checker.check(path, "").isEmpty());
        }

        @Test
        @DisplayName("camelCase Python module is a warning")
        void camelPython() {
            assertEquals(List.of("naming_convention"), ruleIds(checker.check("pkg/userProfile.py", "")));
        }

        @Test
        @DisplayName("Java files must be PascalCase")
        void javaNames() {
            assertTrue(checker.check("src/UserService.java", "").isEmpty());
            assertTrue(checker.check("src/package-info.java", "").isEmpty());
            assertEquals(List.of("naming_convention"), ruleIds(checker.check("src/userService.java", "")));
        }
    }

    // ── Files and rules ─────────────────────────────────────────────

    @Nested
    @DisplayName("Files and rule sets")
    class FileTests {

        @TempDir
        Path project;

        @Test
        @DisplayName("reads files and reports paths relative to the project")
        void readsFile() throws IOException {
            Path file = project.resolve("src/app.ts");
            Files.createDirectories(file.getParent());
            Files.writeString(file, "let x: any;\n");

            var violations = checker.check(file, project);

            assertEquals(1, violations.size());
            assertEquals(Path.of("src", "app.ts").toString(), violations.get(0).resourcePath());
        }

        @Test
        @DisplayName("unreadable file raises UncheckedIOException")
        void missingFile() {
            assertThrows(UncheckedIOException.class, () -> checker.check(project.resolve("gone.ts"), project));
        }

        @Test
        @DisplayName("files without matching rules are clean")
        void otherExtensions() {
            assertTrue(checker.check("README.md", "var x: any\n").isEmpty());
            assertTrue(checker.check("Makefile", "var x: any\n").isEmpty());
        }

        @Test
        @DisplayName("custom rules are evaluated in order")
        void customRules() {
            var custom = new CodeStandardsChecker(List.of(
                    StandardsRule.forbids("no_console", Set.of("js"), "console\\.log\\(", "console.log left in", "Remove it"),
                    StandardsRule.forbids("no_debugger", Set.of("js"), "\\bdebugger\\b", "debugger left in", "Remove it")));

            var violations = custom.check("a.js", "debugger;\nconsole.log(1);\n");

            assertEquals(List.of("no_console", "no_debugger"), ruleIds(violations));
        }
    }

    @Test
    @DisplayName("line numbers skip leading whitespace of a match")
    void lineOf() {
        assertEquals(1, CodeStandardsChecker.lineOf("abc", 0));
        assertEquals(3, CodeStandardsChecker.lineOf("a\n\n  var x", 1));
        assertEquals(2, CodeStandardsChecker.lineOf("a\nb", 2));
    }
}
