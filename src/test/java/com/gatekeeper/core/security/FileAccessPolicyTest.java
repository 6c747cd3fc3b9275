package com.gatekeeper.core.security;

import com.gatekeeper.core.config.GatekeeperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileAccessPolicyTest {

    private FileAccessPolicy policy;

    @BeforeEach
    void setUp() {
        var properties = new GatekeeperProperties();
        properties.getGuard().setProtectedPaths(List.of(".git/**", ".claude/settings.json", ".claude/hooks/**"));
        properties.getGuard().setCommandFileGlobs(List.of(".claude/commands/**"));
        properties.getGuard().setAllowedRootFiles(List.of("README*", "package.json", "*.config.js"));
        policy = new FileAccessPolicy(properties);
    }

    @Nested
    @DisplayName("Environment files")
    class EnvFileTests {

        @ParameterizedTest(name = "\"{0}\" is an env file")
        @ValueSource(strings = {".env", ".env.local", ".env.production", "config/.env", "credentials.env", "C:\\app\\.env"})
        void envFiles(String path) {
            assertTrue(policy.isEnvFile(path));
        }

        @ParameterizedTest(name = "\"{0}\" is not an env file")
        @ValueSource(strings = {".env.sample", ".env.example", ".env.template", "src/.env.example",
                ".env.local.example", "environment.ts", "envoy.yaml", "README.md"})
        void notEnvFiles(String path) {
            assertFalse(policy.isEnvFile(path));
        }

        @Test
        @DisplayName("commands that name an env file are detected")
        void commandsTouchingEnv() {
            assertTrue(policy.commandTouchesEnvFile("cat .env"));
            assertTrue(policy.commandTouchesEnvFile("source ./config/.env.local && npm start"));
            assertTrue(policy.commandTouchesEnvFile("echo KEY=1 >> .env"));
            assertFalse(policy.commandTouchesEnvFile("cp .env.example .env.sample"));
            assertFalse(policy.commandTouchesEnvFile("npm run dev"));
        }
    }

    @Nested
    @DisplayName("Globs")
    class GlobTests {

        @Test
        @DisplayName("protected paths")
        void protectedPaths() {
            assertTrue(policy.isProtected(".git/config"));
            assertTrue(policy.isProtected(".claude/settings.json"));
            assertTrue(policy.isProtected(".claude/hooks/pre.sh"));
            assertFalse(policy.isProtected(".claude/settings.local.json"));
            assertFalse(policy.isProtected("src/git/config.ts"));
        }

        @Test
        @DisplayName("command files")
        void commandFiles() {
            assertTrue(policy.isCommandFile(".claude/commands/review.md"));
            assertFalse(policy.isCommandFile("docs/commands.md"));
        }

        @Test
        @DisplayName("allowed root files")
        void allowedRoot() {
            assertTrue(policy.isAllowedInRoot("README.md"));
            assertTrue(policy.isAllowedInRoot("package.json"));
            assertTrue(policy.isAllowedInRoot("vite.config.js"));
            assertFalse(policy.isAllowedInRoot("notes.txt"));
        }
    }
}
