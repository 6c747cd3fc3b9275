package com.gatekeeper.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a path requested by the agent stays strictly inside a base directory.
 * <p>
 * Checks, in order: known dangerous encoded substrings in the raw value, iterative
 * percent-decoding to a fixed point (bounded), traversal tokens, null bytes and
 * drive/UNC prefixes in the decoded value, then canonicalisation against the base
 * directory with symlinks of existing ancestors resolved. The canonical path must
 * be a strict descendant of the canonical base. Anything that throws is unsafe.
 */
@Service
public class PathSafetyResolver {

    private static final Logger log = LoggerFactory.getLogger(PathSafetyResolver.class);

    static final int MAX_DECODE_ROUNDS = 3;

    /** Lower-case encoded forms of dots, separators and NUL used to smuggle traversal. */
    private static final List<String> DANGEROUS_ENCODINGS = List.of(
            "%2e%2e", "%2e.", ".%2e", "..%2f", "..%5c", "%2f..", "%5c..",
            "%252e", "%252f", "%255c", "%25c0", "%25c1",
            "%c0%ae", "%c0%af", "%c0%2f", "%c0%5c", "%c1%9c", "%c1%1c", "%c1%af", "%e0%80%ae", "%e0%80%af",
            "%00", "%u002e", "%u002f", "%u005c", "%u2215", "%u2216", "%uff0e", "%uff0f");

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[a-zA-Z]:");
    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");

    /**
     * @return {@code true} only if {@code path} resolves to a strict descendant of {@code baseDir}
     */
    public boolean isSafe(String path, Path baseDir) {
        return resolve(path, baseDir).isPresent();
    }

    /**
     * Resolves {@code path} against {@code baseDir}.
     *
     * @return the canonical path, or empty when the path is unsafe
     */
    public Optional<Path> resolve(String path, Path baseDir) {
        return resolution(path, baseDir).map(Resolution::target);
    }

    /**
     * Resolves {@code path} against {@code baseDir} and returns it relative to the
     * canonical base, e.g. {@code src/app.ts}.
     */
    public Optional<Path> resolveRelative(String path, Path baseDir) {
        return resolution(path, baseDir).map(r -> r.base().relativize(r.target()));
    }

    private record Resolution(Path base, Path target) {}

    private Optional<Resolution> resolution(String path, Path baseDir) {
        if (path == null || path.isBlank() || baseDir == null) {
            return Optional.empty();
        }
        try {
            String lowered = path.toLowerCase(Locale.ROOT);
            for (String encoding : DANGEROUS_ENCODINGS) {
                if (lowered.contains(encoding)) {
                    log.debug("Rejected path with encoded sequence '{}': {}", encoding, path);
                    return Optional.empty();
                }
            }

            Optional<String> decoded = decodeToFixedPoint(path);
            if (decoded.isEmpty()) {
                log.debug("Rejected path that did not decode to a fixed point: {}", path);
                return Optional.empty();
            }
            String candidate = decoded.get();

            if (candidate.indexOf('\0') >= 0 || candidate.indexOf('\uFFFD') >= 0) {
                log.debug("Rejected path with NUL or invalid encoding: {}", path);
                return Optional.empty();
            }
            for (String segment : SEPARATORS.split(candidate)) {
                if ("..".equals(segment.trim())) {
                    log.debug("Rejected path with traversal segment: {}", path);
                    return Optional.empty();
                }
            }
            if (DRIVE_PREFIX.matcher(candidate).find()
                    || candidate.startsWith("\\\\") || candidate.startsWith("//")) {
                log.debug("Rejected drive or UNC path: {}", path);
                return Optional.empty();
            }

            Path base = canonical(baseDir.toAbsolutePath().normalize());
            Path target = canonical(base.resolve(candidate.replace('\\', '/')).normalize());
            if (target.startsWith(base) && !target.equals(base)) {
                return Optional.of(new Resolution(base, target));
            }
            log.debug("Rejected path outside {}: {} -> {}", base, path, target);
            return Optional.empty();
        } catch (Exception e) {
            log.debug("Rejected path '{}' after resolution failure: {}", path, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Percent-decodes until the value stops changing. Empty when the value is still
     * changing after {@link #MAX_DECODE_ROUNDS} rounds.
     */
    static Optional<String> decodeToFixedPoint(String value) {
        String current = value;
        for (int round = 0; round < MAX_DECODE_ROUNDS; round++) {
            if (current.indexOf('%') < 0) {
                return Optional.of(current);
            }
            // '+' is a literal in paths; URLDecoder would turn it into a space
            String next = URLDecoder.decode(current.replace("+", "%2B"), StandardCharsets.UTF_8);
            if (next.equals(current)) {
                return Optional.of(current);
            }
            current = next;
        }
        return current.indexOf('%') < 0 ? Optional.of(current) : Optional.empty();
    }

    /**
     * Real path of the deepest existing ancestor with the remaining segments
     * appended, so symlinked directories cannot point outside the base.
     */
    private static Path canonical(Path absolute) throws IOException {
        Path existing = absolute;
        Deque<Path> missing = new ArrayDeque<>();
        while (existing != null && !Files.exists(existing)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        Path result = existing.toRealPath();
        while (!missing.isEmpty()) {
            result = result.resolve(missing.pop());
        }
        return result.normalize();
    }
}
