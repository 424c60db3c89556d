package com.platform.dbwatch.statement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Rewrites SQL text into a canonical shape so statements that differ only in literals,
 * parameters or IN-list length share one signature.
 * 
 * Rules, applied in order:
 * 1. single-quoted string literals become {@code ?}
 * 2. line and block comments are dropped
 * 3. positional parameters ({@code $1}) become {@code ?}
 * 4. numeric literals outside identifiers become {@code ?}
 * 5. {@code IN (?, ?, ...)} becomes {@code IN (?)}
 * 6. whitespace runs become one space, ends trimmed
 * 
 * The pass is repeated until the text stops changing, so normalize(normalize(x)) == normalize(x).
 * Normalization never throws: on failure the input is returned unchanged.
 */
@Slf4j
@Component
public class StatementNormalizer {
    
    static final String PLACEHOLDER = "?";
    
    private static final int MAX_PASSES = 8;
    
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*+(?:''[^']*+)*+'");
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\r\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern POSITIONAL_PARAMETER = Pattern.compile("\\$\\d+");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("(?<![\\w$.])\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?(?![\\w$])");
    private static final Pattern IN_LIST = Pattern.compile(
        "(?i)\\b(IN)\\s*\\(\\s*-?\\?(?:::\\w+)?(?:\\s*,\\s*-?\\?(?:::\\w+)?)*\\s*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    
    public String normalize(String rawText) {
        if (rawText == null) {
            return "";
        }
        try {
            String current = rawText;
            for (int pass = 0; pass < MAX_PASSES; pass++) {
                String next = normalizeOnce(current);
                if (next.equals(current)) {
                    return next;
                }
                current = next;
            }
            // Every rule only shrinks the text, so this is reached only for pathological input.
            log.debug("Normalization did not settle after {} passes", MAX_PASSES);
            return current;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Statement normalization failed, keeping raw text: {}", e.toString());
            return rawText;
        }
    }
    
    /**
     * 128-bit MD5 of the UTF-8 text as 32 lowercase hex characters.
     */
    public String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] bytes = digest.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available in this JVM", e);
        }
    }
    
    public NormalizedStatement normalizeAndHash(String rawText) {
        String canonical = normalize(rawText);
        return new NormalizedStatement(canonical, hash(canonical));
    }
    
    String normalizeOnce(String text) {
        String result = STRING_LITERAL.matcher(text).replaceAll(PLACEHOLDER);
        result = BLOCK_COMMENT.matcher(result).replaceAll(" ");
        result = LINE_COMMENT.matcher(result).replaceAll(" ");
        result = POSITIONAL_PARAMETER.matcher(result).replaceAll(PLACEHOLDER);
        result = NUMERIC_LITERAL.matcher(result).replaceAll(PLACEHOLDER);
        result = IN_LIST.matcher(result).replaceAll("$1 (?)");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }
}
